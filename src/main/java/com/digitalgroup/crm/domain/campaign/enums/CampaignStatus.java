package com.digitalgroup.crm.domain.campaign.enums;

import java.util.EnumSet;
import java.util.Set;

public enum CampaignStatus {
    DRAFT,
    SCHEDULED,
    ACTIVE,
    PAUSED,
    COMPLETED,
    CANCELLED;

    private static final Set<CampaignStatus> EXECUTABLE = EnumSet.of(DRAFT, SCHEDULED, ACTIVE);

    public boolean isExecutable() {
        return EXECUTABLE.contains(this);
    }

    public boolean isTerminal() {
        return this == COMPLETED || this == CANCELLED;
    }
}
