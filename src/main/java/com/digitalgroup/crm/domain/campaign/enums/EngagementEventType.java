package com.digitalgroup.crm.domain.campaign.enums;

import lombok.Getter;

/**
 * Engagement events reported for a recipient after sending, with the lead
 * score delta each one contributes when the recipient is a prospect.
 */
@Getter
public enum EngagementEventType {
    DELIVERED(0, null, null),
    OPENED(5, "Email opened", "email_open"),
    CLICKED(10, "Link clicked", "link_click"),
    RESPONDED(15, "Responded to campaign", "response"),
    BOUNCED(0, null, null),
    UNSUBSCRIBED(-10, "Unsubscribed", "unsubscribe");

    private final int leadScoreDelta;
    private final String scoreReason;
    private final String activityType;

    EngagementEventType(int leadScoreDelta, String scoreReason, String activityType) {
        this.leadScoreDelta = leadScoreDelta;
        this.scoreReason = scoreReason;
        this.activityType = activityType;
    }

    public boolean affectsLeadScore() {
        return leadScoreDelta != 0;
    }
}
