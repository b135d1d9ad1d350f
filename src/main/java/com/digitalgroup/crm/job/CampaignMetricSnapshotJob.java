package com.digitalgroup.crm.job;

import com.digitalgroup.crm.domain.campaign.entity.Campaign;
import com.digitalgroup.crm.domain.campaign.enums.CampaignStatus;
import com.digitalgroup.crm.domain.campaign.repository.CampaignRepository;
import com.digitalgroup.crm.domain.campaign.service.CampaignMetricsService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.List;

/**
 * Campaign Metric Snapshot Job
 * Records the daily metrics snapshot of every active campaign
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CampaignMetricSnapshotJob {

    private final CampaignRepository campaignRepository;
    private final CampaignMetricsService metricsService;

    /**
     * Runs at 1:30 AM every day. Each campaign is snapshotted in its own
     * transaction so one failure does not discard the others.
     */
    @Scheduled(cron = "0 30 1 * * *") // 1:30 AM daily
    public void recordDailySnapshots() {
        log.info("Starting daily campaign metric snapshots");

        LocalDate today = LocalDate.now();
        List<Campaign> campaigns = campaignRepository.findByStatus(CampaignStatus.ACTIVE);

        int recorded = 0;
        for (Campaign campaign : campaigns) {
            try {
                metricsService.recordDailySnapshot(campaign.getId(), today);
                recorded++;
                log.debug("Recorded metric snapshot for campaign {} for date {}", campaign.getId(), today);
            } catch (Exception e) {
                log.error("Failed to record metric snapshot for campaign {}", campaign.getId(), e);
            }
        }

        log.info("Daily campaign metric snapshots completed: {} of {} campaigns", recorded, campaigns.size());
    }
}
