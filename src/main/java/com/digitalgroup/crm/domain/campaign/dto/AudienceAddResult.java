package com.digitalgroup.crm.domain.campaign.dto;

import com.digitalgroup.crm.domain.campaign.entity.CampaignEngagement;

/**
 * The engagement record for a recipient and whether this call created it.
 */
public record AudienceAddResult(CampaignEngagement engagement, boolean created) {
}
