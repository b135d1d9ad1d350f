package com.digitalgroup.crm.job;

import com.digitalgroup.crm.domain.campaign.dto.ExecuteOptions;
import com.digitalgroup.crm.domain.campaign.dto.ExecutionResult;
import com.digitalgroup.crm.domain.campaign.enums.CampaignStatus;
import com.digitalgroup.crm.domain.campaign.repository.CampaignRepository;
import com.digitalgroup.crm.domain.campaign.service.CampaignExecutor;
import com.digitalgroup.crm.domain.campaign.service.CampaignService;
import com.digitalgroup.crm.exception.BusinessException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Scheduled Campaign Job
 * Executes SCHEDULED campaigns once their start date has been reached.
 * A campaign that fails validation (no audience, no template) goes back to DRAFT.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "app.campaigns.scheduler.enabled", havingValue = "true")
public class ScheduledCampaignJob {

    private final CampaignRepository campaignRepository;
    private final CampaignExecutor campaignExecutor;
    private final CampaignService campaignService;

    @Scheduled(cron = "0 * * * * *") // every minute
    public void executeDueCampaigns() {
        List<Long> dueIds = campaignRepository.findDueIds(CampaignStatus.SCHEDULED, LocalDateTime.now());
        if (dueIds.isEmpty()) {
            return;
        }

        log.info("Executing {} scheduled campaigns", dueIds.size());

        for (Long campaignId : dueIds) {
            try {
                ExecutionResult result = campaignExecutor.execute(campaignId, ExecuteOptions.now(), null);
                log.info("Scheduled campaign {} executed: {} sent, {} failed, {} skipped",
                        campaignId, result.sent(), result.failed(), result.skipped());
            } catch (BusinessException e) {
                log.warn("Scheduled campaign {} cannot be sent ({}), returning it to draft", campaignId, e.getMessage());
                unschedule(campaignId);
            } catch (Exception e) {
                log.error("Failed to execute scheduled campaign {}", campaignId, e);
            }
        }
    }

    private void unschedule(Long campaignId) {
        try {
            campaignService.unschedule(campaignId);
        } catch (Exception e) {
            log.error("Failed to return campaign {} to draft", campaignId, e);
        }
    }
}
