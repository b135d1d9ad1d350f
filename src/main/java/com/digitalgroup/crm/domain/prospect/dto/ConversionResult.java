package com.digitalgroup.crm.domain.prospect.dto;

public record ConversionResult(Long prospectId, Long contactId, Long activityId) {
}
