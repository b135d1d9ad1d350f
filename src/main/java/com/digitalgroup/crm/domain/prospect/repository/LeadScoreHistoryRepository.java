package com.digitalgroup.crm.domain.prospect.repository;

import com.digitalgroup.crm.domain.prospect.entity.LeadScoreHistory;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface LeadScoreHistoryRepository extends JpaRepository<LeadScoreHistory, Long> {

    List<LeadScoreHistory> findByProspectIdOrderByCreatedAtDescIdDesc(Long prospectId);

    @Modifying
    @Query("DELETE FROM LeadScoreHistory h WHERE h.prospect.id = :prospectId")
    int deleteByProspectId(@Param("prospectId") Long prospectId);
}
