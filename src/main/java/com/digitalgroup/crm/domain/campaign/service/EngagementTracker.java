package com.digitalgroup.crm.domain.campaign.service;

import com.digitalgroup.crm.domain.campaign.entity.CampaignEngagement;
import com.digitalgroup.crm.domain.campaign.enums.BounceType;
import com.digitalgroup.crm.domain.campaign.repository.CampaignEngagementRepository;
import com.digitalgroup.crm.domain.deal.entity.Deal;
import com.digitalgroup.crm.exception.BusinessException;
import com.digitalgroup.crm.exception.InvalidStateException;
import com.digitalgroup.crm.exception.ResourceNotFoundException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;

/**
 * Engagement Tracker
 * Applies send lifecycle transitions to single engagement records. Each call
 * commits on its own so a send loop leaves processed recipients marked even
 * if it stops half way. Campaign counters are not touched here.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class EngagementTracker {

    private final CampaignEngagementRepository engagementRepository;

    /**
     * Load a record with its recipient, verifying it belongs to the campaign.
     */
    @Transactional(readOnly = true)
    public CampaignEngagement getForCampaign(Long campaignId, Long engagementId) {
        CampaignEngagement engagement = engagementRepository.findWithRecipientById(engagementId)
                .orElseThrow(() -> new ResourceNotFoundException("CampaignEngagement", engagementId));

        if (!engagement.belongsTo(campaignId)) {
            throw new BusinessException("Audience member does not belong to this campaign");
        }
        return engagement;
    }

    @Transactional
    public CampaignEngagement markSent(CampaignEngagement engagement, String sentTo, String subject, String messageId) {
        engagement.markSent(sentTo, subject, messageId);
        return engagementRepository.save(engagement);
    }

    @Transactional
    public CampaignEngagement markDelivered(CampaignEngagement engagement) {
        engagement.markDelivered();
        return engagementRepository.save(engagement);
    }

    @Transactional
    public CampaignEngagement markOpened(CampaignEngagement engagement) {
        requireSent(engagement, "opened");
        engagement.markOpened();
        return engagementRepository.save(engagement);
    }

    @Transactional
    public CampaignEngagement markClicked(CampaignEngagement engagement) {
        requireSent(engagement, "clicked");
        engagement.markClicked();
        return engagementRepository.save(engagement);
    }

    @Transactional
    public CampaignEngagement markResponded(CampaignEngagement engagement) {
        engagement.markResponded();
        return engagementRepository.save(engagement);
    }

    @Transactional
    public CampaignEngagement markConverted(CampaignEngagement engagement, Deal deal, BigDecimal value) {
        engagement.markConverted(deal, value);
        return engagementRepository.save(engagement);
    }

    @Transactional
    public CampaignEngagement markBounced(CampaignEngagement engagement, BounceType type, String errorMessage) {
        engagement.markBounced(type, errorMessage);
        log.debug("Engagement {} bounced ({}): {}", engagement.getId(), engagement.getBounceType(), errorMessage);
        return engagementRepository.save(engagement);
    }

    @Transactional
    public CampaignEngagement markUnsubscribed(CampaignEngagement engagement) {
        engagement.markUnsubscribed();
        return engagementRepository.save(engagement);
    }

    @Transactional
    public CampaignEngagement resetForResend(CampaignEngagement engagement) {
        engagement.resetForResend();
        return engagementRepository.save(engagement);
    }

    private static void requireSent(CampaignEngagement engagement, String event) {
        if (engagement.isAwaitingSend()) {
            throw new InvalidStateException("Audience member cannot be marked " + event + " before it is sent",
                    engagement.getStatus().name());
        }
    }
}
