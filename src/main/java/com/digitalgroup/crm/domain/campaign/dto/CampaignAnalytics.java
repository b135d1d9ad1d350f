package com.digitalgroup.crm.domain.campaign.dto;

import com.digitalgroup.crm.domain.campaign.entity.CampaignEngagement;
import com.digitalgroup.crm.domain.campaign.entity.CampaignMetric;

import java.util.List;

public record CampaignAnalytics(
        CampaignMetrics metrics,
        List<CampaignMetric> timeline,
        List<CampaignEngagement> topPerformers,
        List<FunnelStage> funnel
) {
}
