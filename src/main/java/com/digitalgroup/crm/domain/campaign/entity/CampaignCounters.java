package com.digitalgroup.crm.domain.campaign.entity;

/**
 * Aggregated engagement counts for one campaign.
 */
public record CampaignCounters(int sent, int delivered, int opened, int clicked, int responded,
                               int bounced, int unsubscribed, int converted, int prospectsGenerated) {

    public static CampaignCounters empty() {
        return new CampaignCounters(0, 0, 0, 0, 0, 0, 0, 0, 0);
    }
}
