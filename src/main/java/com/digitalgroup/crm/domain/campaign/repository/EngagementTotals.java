package com.digitalgroup.crm.domain.campaign.repository;

/**
 * Aggregate projection over a campaign's engagement records.
 * SUM columns come back null when the campaign has no records.
 */
public interface EngagementTotals {

    Long getSent();

    Long getDelivered();

    Long getOpened();

    Long getClicked();

    Long getResponded();

    Long getBounced();

    Long getUnsubscribed();

    Long getConverted();
}
