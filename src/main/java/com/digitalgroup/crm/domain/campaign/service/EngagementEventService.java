package com.digitalgroup.crm.domain.campaign.service;

import com.digitalgroup.crm.domain.campaign.dto.EngagementEvent;
import com.digitalgroup.crm.domain.campaign.entity.CampaignEngagement;
import com.digitalgroup.crm.domain.campaign.enums.EngagementEventType;
import com.digitalgroup.crm.domain.prospect.dto.ScoreContext;
import com.digitalgroup.crm.domain.prospect.entity.LeadScoreHistory;
import com.digitalgroup.crm.domain.prospect.service.LeadScoreTracker;
import com.digitalgroup.crm.exception.BusinessException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Engagement Event Service
 * Records delivery, open, click, response, bounce and unsubscribe events.
 * Events on prospect recipients also move the prospect's lead score.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class EngagementEventService {

    private final EngagementTracker engagementTracker;
    private final LeadScoreTracker leadScoreTracker;
    private final CampaignMetricsService metricsService;

    @Transactional
    public CampaignEngagement recordEvent(Long campaignId, Long engagementId, EngagementEvent event, Long actorId) {
        if (event == null || event.type() == null) {
            throw new BusinessException("Event type is required");
        }

        CampaignEngagement engagement = engagementTracker.getForCampaign(campaignId, engagementId);
        EngagementEventType type = event.type();

        engagement = switch (type) {
            case DELIVERED -> engagementTracker.markDelivered(engagement);
            case OPENED -> engagementTracker.markOpened(engagement);
            case CLICKED -> engagementTracker.markClicked(engagement);
            case RESPONDED -> engagementTracker.markResponded(engagement);
            case BOUNCED -> engagementTracker.markBounced(engagement, event.bounceType(), event.message());
            case UNSUBSCRIBED -> engagementTracker.markUnsubscribed(engagement);
        };

        if (type.affectsLeadScore() && engagement.getProspect() != null) {
            LeadScoreHistory history = leadScoreTracker.applyDelta(
                    engagement.getProspect(),
                    type.getLeadScoreDelta(),
                    type.getScoreReason(),
                    type.getActivityType(),
                    ScoreContext.fromEngagement(engagement, actorId));
            engagement.addLeadScoreChange(history.getScoreChange());
        }

        metricsService.recompute(campaignId);

        log.info("Recorded {} for engagement {} in campaign {}", type, engagementId, campaignId);
        return engagement;
    }
}
