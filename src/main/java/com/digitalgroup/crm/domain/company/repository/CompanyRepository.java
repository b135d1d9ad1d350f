package com.digitalgroup.crm.domain.company.repository;

import com.digitalgroup.crm.domain.company.entity.Company;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface CompanyRepository extends JpaRepository<Company, Long> {

    Optional<Company> findFirstByNameIgnoreCase(String name);
}
