package com.digitalgroup.crm.domain.campaign.dto;

import com.digitalgroup.crm.domain.campaign.enums.CampaignType;
import lombok.Builder;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.Map;
import java.util.Set;

/**
 * Writable campaign fields. On update, null means "leave unchanged".
 * Counters and revenue are derived and cannot be set here.
 */
@Builder
public record CampaignRequest(
        String name,
        String description,
        CampaignType type,
        LocalDateTime startDate,
        LocalDateTime endDate,
        BigDecimal budget,
        BigDecimal actualCost,
        BigDecimal expectedRevenue,
        Double targetResponseRate,
        Double targetConversionRate,
        Long emailTemplateId,
        String emailSubject,
        String emailFromName,
        String emailFromEmail,
        Map<String, Object> audienceFilters,
        Boolean automated,
        Map<String, Object> automationConfig,
        Set<String> tags,
        String category,
        String notes,
        Long ownerId
) {
}
