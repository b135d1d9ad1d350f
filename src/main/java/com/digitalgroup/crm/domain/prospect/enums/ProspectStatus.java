package com.digitalgroup.crm.domain.prospect.enums;

public enum ProspectStatus {
    NEW,
    CONTACTED,
    QUALIFIED,
    REJECTED,
    CONVERTED;

    public boolean isConverted() {
        return this == CONVERTED;
    }
}
