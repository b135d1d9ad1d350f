package com.digitalgroup.crm.domain.campaign.dto;

import java.math.BigDecimal;

/**
 * Attribute a deal to one audience member, identified by prospect or contact.
 * A null value falls back to the deal's own value.
 */
public record LinkDealRequest(Long prospectId, Long contactId, Long dealId, BigDecimal value) {
}
