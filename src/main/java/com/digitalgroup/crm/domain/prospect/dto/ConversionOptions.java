package com.digitalgroup.crm.domain.prospect.dto;

/**
 * How a prospect becomes a contact. A null assignTo falls back to the
 * prospect's assignee, then to the converting user.
 */
public record ConversionOptions(String notes, boolean createActivity, Long assignTo) {

    public static ConversionOptions defaults() {
        return new ConversionOptions(null, true, null);
    }
}
