package com.digitalgroup.crm.domain.campaign.enums;

import lombok.Getter;

/**
 * Send lifecycle of one recipient within a campaign. Stages with a
 * non-negative rank form the forward progression; BOUNCED and
 * UNSUBSCRIBED sit outside it.
 */
@Getter
public enum EngagementStatus {
    PENDING(0),
    SENT(1),
    DELIVERED(2),
    OPENED(3),
    CLICKED(4),
    RESPONDED(5),
    CONVERTED(6),
    BOUNCED(-1),
    UNSUBSCRIBED(-1);

    private final int rank;

    EngagementStatus(int rank) {
        this.rank = rank;
    }

    public boolean isProgression() {
        return rank >= 0;
    }

    public boolean isBefore(EngagementStatus other) {
        return isProgression() && other.isProgression() && rank < other.rank;
    }
}
