package com.digitalgroup.crm.domain.campaign.dto;

import lombok.Builder;

import java.time.LocalDateTime;
import java.util.List;

@Builder
public record ExecutionResult(
        Long campaignId,
        Status status,
        int attempted,
        int sent,
        int failed,
        int skipped,
        LocalDateTime scheduledFor,
        List<String> testRecipients,
        String message
) {

    public enum Status {
        EXECUTED,
        SENT,
        NO_PENDING,
        SCHEDULED,
        TEST_SENT,
        RESENT,
        FAILED
    }
}
