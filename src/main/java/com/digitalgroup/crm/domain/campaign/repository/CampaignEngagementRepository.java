package com.digitalgroup.crm.domain.campaign.repository;

import com.digitalgroup.crm.domain.campaign.entity.CampaignEngagement;
import com.digitalgroup.crm.domain.campaign.enums.EngagementStatus;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.math.BigDecimal;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

@Repository
public interface CampaignEngagementRepository extends JpaRepository<CampaignEngagement, Long> {

    Optional<CampaignEngagement> findByCampaignIdAndContactId(Long campaignId, Long contactId);

    Optional<CampaignEngagement> findByCampaignIdAndProspectId(Long campaignId, Long prospectId);

    long countByCampaignId(Long campaignId);

    long countByCampaignIdAndStatus(Long campaignId, EngagementStatus status);

    @Query("SELECT e FROM CampaignEngagement e " +
           "LEFT JOIN FETCH e.contact c LEFT JOIN FETCH c.company " +
           "LEFT JOIN FETCH e.prospect " +
           "WHERE e.campaign.id = :campaignId AND e.status = :status ORDER BY e.id ASC")
    List<CampaignEngagement> findWithRecipientsByStatus(@Param("campaignId") Long campaignId,
                                                        @Param("status") EngagementStatus status);

    @Query("SELECT e FROM CampaignEngagement e " +
           "JOIN FETCH e.campaign " +
           "LEFT JOIN FETCH e.contact c LEFT JOIN FETCH c.company " +
           "LEFT JOIN FETCH e.prospect " +
           "WHERE e.id = :id")
    Optional<CampaignEngagement> findWithRecipientById(@Param("id") Long id);

    @Query(value = "SELECT e FROM CampaignEngagement e " +
                   "LEFT JOIN FETCH e.contact c LEFT JOIN FETCH c.company " +
                   "LEFT JOIN FETCH e.prospect " +
                   "WHERE e.campaign.id = :campaignId",
           countQuery = "SELECT COUNT(e) FROM CampaignEngagement e WHERE e.campaign.id = :campaignId")
    Page<CampaignEngagement> findAudience(@Param("campaignId") Long campaignId, Pageable pageable);

    @Query(value = "SELECT e FROM CampaignEngagement e " +
                   "LEFT JOIN FETCH e.contact c LEFT JOIN FETCH c.company " +
                   "LEFT JOIN FETCH e.prospect " +
                   "WHERE e.campaign.id = :campaignId AND e.status IN :statuses",
           countQuery = "SELECT COUNT(e) FROM CampaignEngagement e " +
                        "WHERE e.campaign.id = :campaignId AND e.status IN :statuses")
    Page<CampaignEngagement> findAudienceByStatusIn(@Param("campaignId") Long campaignId,
                                                    @Param("statuses") Collection<EngagementStatus> statuses,
                                                    Pageable pageable);

    @Query("SELECT e FROM CampaignEngagement e " +
           "LEFT JOIN FETCH e.contact c LEFT JOIN FETCH c.company " +
           "LEFT JOIN FETCH e.prospect " +
           "WHERE e.campaign.id = :campaignId ORDER BY e.id ASC")
    List<CampaignEngagement> findAllWithRecipients(@Param("campaignId") Long campaignId);

    // Weighted engagement ranking, clicks count double; id keeps ties stable
    @Query("SELECT e FROM CampaignEngagement e " +
           "LEFT JOIN FETCH e.contact LEFT JOIN FETCH e.prospect " +
           "WHERE e.campaign.id = :campaignId " +
           "ORDER BY (e.openCount + e.clickCount * 2) DESC, e.id ASC")
    List<CampaignEngagement> findTopPerformers(@Param("campaignId") Long campaignId, Pageable pageable);

    @Query("SELECT e FROM CampaignEngagement e " +
           "LEFT JOIN FETCH e.contact LEFT JOIN FETCH e.prospect LEFT JOIN FETCH e.deal " +
           "WHERE e.campaign.id = :campaignId AND e.convertedAt IS NOT NULL " +
           "ORDER BY e.convertedAt DESC")
    List<CampaignEngagement> findConversions(@Param("campaignId") Long campaignId);

    @Query("SELECT COUNT(e.sentAt) AS sent, COUNT(e.deliveredAt) AS delivered, " +
           "COUNT(e.openedAt) AS opened, COUNT(e.clickedAt) AS clicked, " +
           "COUNT(e.respondedAt) AS responded, " +
           "SUM(CASE WHEN e.status = :bounced THEN 1 ELSE 0 END) AS bounced, " +
           "SUM(CASE WHEN e.status = :unsubscribed THEN 1 ELSE 0 END) AS unsubscribed, " +
           "COUNT(e.convertedAt) AS converted " +
           "FROM CampaignEngagement e WHERE e.campaign.id = :campaignId")
    EngagementTotals aggregateByCampaignId(@Param("campaignId") Long campaignId,
                                           @Param("bounced") EngagementStatus bounced,
                                           @Param("unsubscribed") EngagementStatus unsubscribed);

    @Query("SELECT COALESCE(SUM(e.conversionValue), 0) FROM CampaignEngagement e " +
           "WHERE e.campaign.id = :campaignId AND e.convertedAt IS NOT NULL")
    BigDecimal sumConversionValue(@Param("campaignId") Long campaignId);

    @Query("SELECT e FROM CampaignEngagement e JOIN FETCH e.campaign WHERE e.prospect.id = :prospectId")
    List<CampaignEngagement> findByProspectIdWithCampaign(@Param("prospectId") Long prospectId);

    List<CampaignEngagement> findByProspectId(Long prospectId);

    @Modifying
    @Query("DELETE FROM CampaignEngagement e WHERE e.prospect.id = :prospectId")
    int deleteByProspectId(@Param("prospectId") Long prospectId);

    @Modifying
    @Query("DELETE FROM CampaignEngagement e WHERE e.campaign.id = :campaignId")
    int deleteByCampaignId(@Param("campaignId") Long campaignId);
}
