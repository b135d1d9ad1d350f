package com.digitalgroup.crm.domain.prospect.dto;

import com.digitalgroup.crm.domain.campaign.entity.CampaignEngagement;

import java.util.List;

/**
 * A prospect's participation across campaigns.
 */
public record EngagementSummary(int campaignCount, int totalOpens, int totalClicks,
                                List<CampaignEngagement> engagements) {

    public static EngagementSummary of(List<CampaignEngagement> engagements) {
        int opens = 0;
        int clicks = 0;
        for (CampaignEngagement engagement : engagements) {
            opens += engagement.getOpenCount();
            clicks += engagement.getClickCount();
        }
        long campaigns = engagements.stream()
                .map(e -> e.getCampaign().getId())
                .distinct()
                .count();
        return new EngagementSummary((int) campaigns, opens, clicks, engagements);
    }
}
