package com.digitalgroup.crm.domain.campaign.service;

import com.digitalgroup.crm.domain.campaign.dto.CampaignAnalytics;
import com.digitalgroup.crm.domain.campaign.dto.CampaignMetrics;
import com.digitalgroup.crm.domain.campaign.dto.CampaignStatistics;
import com.digitalgroup.crm.domain.campaign.dto.FunnelStage;
import com.digitalgroup.crm.domain.campaign.entity.Campaign;
import com.digitalgroup.crm.domain.campaign.entity.CampaignCounters;
import com.digitalgroup.crm.domain.campaign.entity.CampaignEngagement;
import com.digitalgroup.crm.domain.campaign.entity.CampaignMetric;
import com.digitalgroup.crm.domain.campaign.enums.CampaignStatus;
import com.digitalgroup.crm.domain.campaign.enums.EngagementStatus;
import com.digitalgroup.crm.domain.campaign.repository.CampaignEngagementRepository;
import com.digitalgroup.crm.domain.campaign.repository.CampaignMetricRepository;
import com.digitalgroup.crm.domain.campaign.repository.CampaignRepository;
import com.digitalgroup.crm.domain.campaign.repository.EngagementTotals;
import com.digitalgroup.crm.domain.prospect.repository.ProspectRepository;
import com.digitalgroup.crm.exception.ResourceNotFoundException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Campaign Metrics Service
 * Rebuilds the cached campaign counters from engagement records and serves
 * the reporting views (timeline, top performers, funnel, statistics).
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CampaignMetricsService {

    private final CampaignRepository campaignRepository;
    private final CampaignEngagementRepository engagementRepository;
    private final CampaignMetricRepository metricRepository;
    private final ProspectRepository prospectRepository;

    @Value("${app.campaigns.top-performers-limit:10}")
    private int topPerformersLimit;

    /**
     * Re-derive every counter and the actual revenue of a campaign.
     */
    @Transactional
    public Campaign recompute(Long campaignId) {
        Campaign campaign = findCampaign(campaignId);

        EngagementTotals totals = engagementRepository.aggregateByCampaignId(
                campaignId, EngagementStatus.BOUNCED, EngagementStatus.UNSUBSCRIBED);
        long prospectsGenerated = prospectRepository.countByCampaignId(campaignId);
        BigDecimal revenue = engagementRepository.sumConversionValue(campaignId);

        CampaignCounters counters = totals == null
                ? new CampaignCounters(0, 0, 0, 0, 0, 0, 0, 0, (int) prospectsGenerated)
                : new CampaignCounters(
                        count(totals.getSent()),
                        count(totals.getDelivered()),
                        count(totals.getOpened()),
                        count(totals.getClicked()),
                        count(totals.getResponded()),
                        count(totals.getBounced()),
                        count(totals.getUnsubscribed()),
                        count(totals.getConverted()),
                        (int) prospectsGenerated);

        campaign.applyCounters(counters, revenue);
        campaign = campaignRepository.save(campaign);

        log.debug("Recomputed metrics for campaign {}: sent={}, delivered={}, opened={}, bounced={}",
                campaignId, counters.sent(), counters.delivered(), counters.opened(), counters.bounced());

        return campaign;
    }

    @Transactional
    public CampaignMetrics getMetrics(Long campaignId) {
        return CampaignMetrics.from(recompute(campaignId));
    }

    @Transactional(readOnly = true)
    public List<CampaignMetric> getTimeline(Long campaignId, int days) {
        findCampaign(campaignId);
        LocalDate from = LocalDate.now().minusDays(Math.max(days, 1) - 1L);
        return metricRepository.findByCampaignIdAndPeriodTypeAndMetricDateGreaterThanEqualOrderByMetricDateAsc(
                campaignId, CampaignMetric.PERIOD_DAILY, from);
    }

    @Transactional(readOnly = true)
    public List<CampaignEngagement> getTopPerformers(Long campaignId, int limit) {
        findCampaign(campaignId);
        return engagementRepository.findTopPerformers(campaignId, PageRequest.of(0, Math.max(limit, 1)));
    }

    @Transactional(readOnly = true)
    public List<CampaignEngagement> getConversions(Long campaignId) {
        findCampaign(campaignId);
        return engagementRepository.findConversions(campaignId);
    }

    @Transactional
    public CampaignAnalytics getAnalytics(Long campaignId, int days) {
        Campaign campaign = recompute(campaignId);
        return new CampaignAnalytics(
                CampaignMetrics.from(campaign),
                getTimeline(campaignId, days),
                getTopPerformers(campaignId, topPerformersLimit),
                buildFunnel(campaign));
    }

    /**
     * Store today's counters for a campaign, replacing an existing snapshot
     * for the same day.
     */
    @Transactional
    public CampaignMetric recordDailySnapshot(Long campaignId, LocalDate date) {
        Campaign campaign = recompute(campaignId);

        CampaignMetric snapshot = metricRepository
                .findByCampaignIdAndMetricDateAndPeriodType(campaignId, date, CampaignMetric.PERIOD_DAILY)
                .orElseGet(() -> CampaignMetric.builder()
                        .campaign(campaign)
                        .metricDate(date)
                        .periodType(CampaignMetric.PERIOD_DAILY)
                        .build());

        snapshot.captureFrom(campaign);
        return metricRepository.save(snapshot);
    }

    /**
     * Totals across campaigns, restricted to one owner when ownerId is set.
     */
    @Transactional(readOnly = true)
    public CampaignStatistics getStatistics(Long ownerId) {
        List<Campaign> campaigns = ownerId != null
                ? campaignRepository.findByOwnerId(ownerId)
                : campaignRepository.findAll();

        Map<String, Long> byStatus = new LinkedHashMap<>();
        for (CampaignStatus status : CampaignStatus.values()) {
            byStatus.put(status.name(), 0L);
        }
        Map<String, Long> byType = new LinkedHashMap<>();

        BigDecimal totalBudget = BigDecimal.ZERO;
        BigDecimal totalSpent = BigDecimal.ZERO;
        BigDecimal totalRevenue = BigDecimal.ZERO;
        long totalSent = 0;
        long totalDelivered = 0;
        long totalProspects = 0;
        long totalConversions = 0;

        for (Campaign campaign : campaigns) {
            byStatus.merge(campaign.getStatus().name(), 1L, Long::sum);
            byType.merge(campaign.getType().name(), 1L, Long::sum);
            totalBudget = totalBudget.add(orZero(campaign.getBudget()));
            totalSpent = totalSpent.add(orZero(campaign.getActualCost()));
            totalRevenue = totalRevenue.add(orZero(campaign.getActualRevenue()));
            totalSent += campaign.getSentCount();
            totalDelivered += campaign.getDeliveredCount();
            totalProspects += campaign.getProspectsGenerated();
            totalConversions += campaign.getConvertedCount();
        }

        double overallRoi = totalSpent.signum() > 0
                ? totalRevenue.subtract(totalSpent)
                        .multiply(BigDecimal.valueOf(100))
                        .divide(totalSpent, 2, RoundingMode.HALF_UP)
                        .doubleValue()
                : 0.0;

        return CampaignStatistics.builder()
                .totalCampaigns(campaigns.size())
                .byStatus(byStatus)
                .byType(byType)
                .totalBudget(totalBudget)
                .totalSpent(totalSpent)
                .totalRevenue(totalRevenue)
                .overallRoi(overallRoi)
                .totalSent(totalSent)
                .totalProspects(totalProspects)
                .totalConversions(totalConversions)
                .averageConversionRate(Campaign.rate(totalConversions, totalDelivered))
                .build();
    }

    List<FunnelStage> buildFunnel(Campaign campaign) {
        long sent = campaign.getSentCount();
        List<FunnelStage> funnel = new ArrayList<>();
        funnel.add(new FunnelStage("sent", sent, sent > 0 ? 100.0 : 0.0));
        funnel.add(new FunnelStage("delivered", campaign.getDeliveredCount(),
                Campaign.rate(campaign.getDeliveredCount(), sent)));
        funnel.add(new FunnelStage("opened", campaign.getOpenedCount(),
                Campaign.rate(campaign.getOpenedCount(), sent)));
        funnel.add(new FunnelStage("clicked", campaign.getClickedCount(),
                Campaign.rate(campaign.getClickedCount(), sent)));
        funnel.add(new FunnelStage("responded", campaign.getRespondedCount(),
                Campaign.rate(campaign.getRespondedCount(), sent)));
        funnel.add(new FunnelStage("converted", campaign.getConvertedCount(),
                Campaign.rate(campaign.getConvertedCount(), sent)));
        return funnel;
    }

    private Campaign findCampaign(Long campaignId) {
        return campaignRepository.findById(campaignId)
                .orElseThrow(() -> new ResourceNotFoundException("Campaign", campaignId));
    }

    private static int count(Long value) {
        return value != null ? value.intValue() : 0;
    }

    private static BigDecimal orZero(BigDecimal value) {
        return value != null ? value : BigDecimal.ZERO;
    }
}
