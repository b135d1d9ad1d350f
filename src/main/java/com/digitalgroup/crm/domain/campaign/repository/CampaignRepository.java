package com.digitalgroup.crm.domain.campaign.repository;

import com.digitalgroup.crm.domain.campaign.entity.Campaign;
import com.digitalgroup.crm.domain.campaign.enums.CampaignStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

@Repository
public interface CampaignRepository extends JpaRepository<Campaign, Long>, JpaSpecificationExecutor<Campaign> {

    @Query("SELECT c FROM Campaign c LEFT JOIN FETCH c.emailTemplate WHERE c.id = :id")
    Optional<Campaign> findWithTemplateById(@Param("id") Long id);

    List<Campaign> findByStatus(CampaignStatus status);

    List<Campaign> findByOwnerId(Long ownerId);

    // Scheduled campaigns whose start date has been reached
    @Query("SELECT c.id FROM Campaign c WHERE c.status = :status AND c.startDate <= :now ORDER BY c.startDate ASC")
    List<Long> findDueIds(@Param("status") CampaignStatus status, @Param("now") LocalDateTime now);
}
