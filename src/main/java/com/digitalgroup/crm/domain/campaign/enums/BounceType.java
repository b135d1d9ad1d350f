package com.digitalgroup.crm.domain.campaign.enums;

public enum BounceType {
    HARD,
    SOFT
}
