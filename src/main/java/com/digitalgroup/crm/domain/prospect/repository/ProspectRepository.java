package com.digitalgroup.crm.domain.prospect.repository;

import com.digitalgroup.crm.domain.prospect.entity.Prospect;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface ProspectRepository extends JpaRepository<Prospect, Long>, JpaSpecificationExecutor<Prospect> {

    Optional<Prospect> findFirstByEmailIgnoreCase(String email);

    Optional<Prospect> findFirstByPhone(String phone);

    @Query("SELECT p FROM Prospect p LEFT JOIN FETCH p.campaign WHERE p.id = :id")
    Optional<Prospect> findWithCampaignById(@Param("id") Long id);

    Page<Prospect> findByCampaignId(Long campaignId, Pageable pageable);

    long countByCampaignId(Long campaignId);

    @Query("SELECT COALESCE(AVG(p.leadScore), 0) FROM Prospect p " +
           "WHERE (:campaignId IS NULL OR p.campaign.id = :campaignId) " +
           "AND (:userId IS NULL OR p.assignedTo = :userId OR p.createdBy = :userId)")
    Double averageLeadScore(@Param("campaignId") Long campaignId, @Param("userId") Long userId);

    // Prospects outlive the campaign that generated them
    @Modifying
    @Query("UPDATE Prospect p SET p.campaign = null WHERE p.campaign.id = :campaignId")
    int detachFromCampaign(@Param("campaignId") Long campaignId);
}
