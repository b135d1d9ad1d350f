package com.digitalgroup.crm.domain.campaign.enums;

public enum CampaignType {
    EMAIL,
    WEB_FORM,
    PHONE,
    SOCIAL_MEDIA,
    MANUAL_ENTRY,
    EVENT,
    OTHER;

    public boolean isEmail() {
        return this == EMAIL;
    }
}
