package com.digitalgroup.crm.domain.campaign.dto;

import lombok.Builder;

import java.math.BigDecimal;
import java.util.Map;

@Builder
public record CampaignStatistics(
        long totalCampaigns,
        Map<String, Long> byStatus,
        Map<String, Long> byType,
        BigDecimal totalBudget,
        BigDecimal totalSpent,
        BigDecimal totalRevenue,
        double overallRoi,
        long totalSent,
        long totalProspects,
        long totalConversions,
        double averageConversionRate
) {
}
