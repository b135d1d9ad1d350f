package com.digitalgroup.crm.domain.prospect.dto;

import lombok.Builder;

import java.util.Map;

@Builder
public record ProspectStatistics(
        long totalProspects,
        Map<String, Long> byStatus,
        double averageLeadScore,
        double conversionRate
) {
}
