package com.digitalgroup.crm.domain.contact.repository;

import com.digitalgroup.crm.domain.contact.entity.Contact;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface ContactRepository extends JpaRepository<Contact, Long> {

    boolean existsByEmailIgnoreCase(String email);
}
