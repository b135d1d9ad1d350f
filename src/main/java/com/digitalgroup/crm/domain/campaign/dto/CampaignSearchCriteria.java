package com.digitalgroup.crm.domain.campaign.dto;

import com.digitalgroup.crm.domain.campaign.enums.CampaignStatus;
import com.digitalgroup.crm.domain.campaign.enums.CampaignType;
import lombok.Builder;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;

/**
 * Optional campaign filters. Null or empty values do not restrict.
 */
@Builder
public record CampaignSearchCriteria(
        String search,
        List<CampaignStatus> statuses,
        List<CampaignType> types,
        Long ownerId,
        String category,
        List<String> tags,
        LocalDateTime startFrom,
        LocalDateTime startTo,
        LocalDateTime endFrom,
        LocalDateTime endTo,
        BigDecimal minBudget,
        BigDecimal maxBudget
) {

    public CampaignSearchCriteria withOwner(Long owner) {
        return new CampaignSearchCriteria(search, statuses, types, owner, category, tags,
                startFrom, startTo, endFrom, endTo, minBudget, maxBudget);
    }
}
