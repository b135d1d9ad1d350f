package com.digitalgroup.crm.domain.prospect.dto;

import com.digitalgroup.crm.domain.campaign.entity.Campaign;
import com.digitalgroup.crm.domain.campaign.entity.CampaignEngagement;

/**
 * What caused a lead score change. Every field is optional.
 */
public record ScoreContext(Campaign campaign, CampaignEngagement engagement, Long changedBy, String notes) {

    public static ScoreContext by(Long changedBy) {
        return new ScoreContext(null, null, changedBy, null);
    }

    public static ScoreContext by(Long changedBy, String notes) {
        return new ScoreContext(null, null, changedBy, notes);
    }

    public static ScoreContext fromEngagement(CampaignEngagement engagement, Long changedBy) {
        return new ScoreContext(engagement.getCampaign(), engagement, changedBy, null);
    }
}
