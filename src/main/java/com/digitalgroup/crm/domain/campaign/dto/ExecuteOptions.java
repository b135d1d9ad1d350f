package com.digitalgroup.crm.domain.campaign.dto;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Options for a campaign run. A test send or a schedule request replaces
 * the real send.
 */
public record ExecuteOptions(boolean sendTestEmail, List<String> testEmails, LocalDateTime scheduleFor) {

    public static ExecuteOptions now() {
        return new ExecuteOptions(false, List.of(), null);
    }
}
