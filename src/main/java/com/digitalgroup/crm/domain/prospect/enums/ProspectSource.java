package com.digitalgroup.crm.domain.prospect.enums;

public enum ProspectSource {
    EMAIL_CAMPAIGN,
    WEB_FORM,
    PHONE,
    SOCIAL_MEDIA,
    MANUAL_ENTRY,
    REFERRAL,
    OTHER
}
