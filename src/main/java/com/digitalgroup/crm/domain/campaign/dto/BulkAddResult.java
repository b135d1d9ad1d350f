package com.digitalgroup.crm.domain.campaign.dto;

public record BulkAddResult(int added, int skipped, int notFound, int totalRequested) {
}
