package com.digitalgroup.crm.domain.campaign.repository;

import com.digitalgroup.crm.domain.campaign.entity.CampaignMetric;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

@Repository
public interface CampaignMetricRepository extends JpaRepository<CampaignMetric, Long> {

    List<CampaignMetric> findByCampaignIdAndPeriodTypeAndMetricDateGreaterThanEqualOrderByMetricDateAsc(
            Long campaignId, String periodType, LocalDate from);

    Optional<CampaignMetric> findByCampaignIdAndMetricDateAndPeriodType(
            Long campaignId, LocalDate metricDate, String periodType);

    void deleteByCampaignId(Long campaignId);
}
