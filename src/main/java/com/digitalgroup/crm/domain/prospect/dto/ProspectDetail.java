package com.digitalgroup.crm.domain.prospect.dto;

import com.digitalgroup.crm.domain.prospect.entity.LeadScoreHistory;
import com.digitalgroup.crm.domain.prospect.entity.Prospect;

import java.util.List;

public record ProspectDetail(Prospect prospect, EngagementSummary engagement, List<LeadScoreHistory> scoreHistory) {
}
