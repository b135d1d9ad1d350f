package com.digitalgroup.crm.domain.prospect.dto;

import com.digitalgroup.crm.domain.prospect.enums.ProspectSource;
import com.digitalgroup.crm.domain.prospect.enums.ProspectStatus;
import lombok.Builder;

import java.time.LocalDateTime;
import java.util.List;

@Builder
public record ProspectSearchCriteria(
        String search,
        List<ProspectStatus> statuses,
        List<ProspectSource> sources,
        Long campaignId,
        Long assignedTo,
        Integer minLeadScore,
        Integer maxLeadScore,
        LocalDateTime createdFrom,
        LocalDateTime createdTo,
        Long visibleTo
) {

    public ProspectSearchCriteria restrictedTo(Long userId) {
        return new ProspectSearchCriteria(search, statuses, sources, campaignId, assignedTo,
                minLeadScore, maxLeadScore, createdFrom, createdTo, userId);
    }
}
