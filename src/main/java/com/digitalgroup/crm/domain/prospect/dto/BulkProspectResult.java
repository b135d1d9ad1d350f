package com.digitalgroup.crm.domain.prospect.dto;

import java.util.List;

/**
 * Outcome of a bulk import. Rows are reported by their zero-based index.
 */
public record BulkProspectResult(int created, int skipped, int failed, List<Long> createdIds,
                                 List<RowError> errors) {

    public record RowError(int index, String message) {
    }
}
