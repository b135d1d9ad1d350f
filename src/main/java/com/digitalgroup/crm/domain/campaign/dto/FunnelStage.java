package com.digitalgroup.crm.domain.campaign.dto;

/**
 * One step of the conversion funnel; rate is relative to the sent count.
 */
public record FunnelStage(String stage, long count, double rate) {
}
