package com.digitalgroup.crm.domain.prospect.dto;

import com.digitalgroup.crm.domain.prospect.enums.ProspectSource;
import com.digitalgroup.crm.domain.prospect.enums.ProspectStatus;
import lombok.Builder;

import java.time.LocalDateTime;

/**
 * Writable prospect fields. On update, null leaves a field unchanged and a
 * blank email or phone clears it.
 */
@Builder(toBuilder = true)
public record ProspectRequest(
        String firstName,
        String lastName,
        String email,
        String phone,
        String companyName,
        String jobTitle,
        String industry,
        String description,
        String notes,
        ProspectSource source,
        String sourceDetails,
        ProspectStatus status,
        Integer leadScore,
        Long campaignId,
        Long assignedTo,
        LocalDateTime lastContactedAt,
        String linkedinUrl,
        String twitterHandle,
        String website,
        String city,
        String state,
        String country
) {
}
