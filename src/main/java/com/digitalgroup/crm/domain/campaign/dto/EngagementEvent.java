package com.digitalgroup.crm.domain.campaign.dto;

import com.digitalgroup.crm.domain.campaign.enums.BounceType;
import com.digitalgroup.crm.domain.campaign.enums.EngagementEventType;

/**
 * An engagement event reported for one audience member. Bounce type and
 * message are only read for BOUNCED.
 */
public record EngagementEvent(EngagementEventType type, BounceType bounceType, String message) {

    public static EngagementEvent of(EngagementEventType type) {
        return new EngagementEvent(type, null, null);
    }
}
