package com.digitalgroup.crm.domain.campaign.dto;

import com.digitalgroup.crm.domain.campaign.entity.Campaign;
import lombok.Builder;

import java.math.BigDecimal;

@Builder
public record CampaignMetrics(
        Long campaignId,
        int targetAudienceSize,
        int sent,
        int delivered,
        int opened,
        int clicked,
        int responded,
        int bounced,
        int unsubscribed,
        int converted,
        int prospectsGenerated,
        double deliveryRate,
        double openRate,
        double clickRate,
        double responseRate,
        double conversionRate,
        double bounceRate,
        BigDecimal budget,
        BigDecimal actualCost,
        BigDecimal expectedRevenue,
        BigDecimal actualRevenue,
        double roi
) {

    public static CampaignMetrics from(Campaign campaign) {
        return CampaignMetrics.builder()
                .campaignId(campaign.getId())
                .targetAudienceSize(campaign.getTargetAudienceSize() != null ? campaign.getTargetAudienceSize() : 0)
                .sent(campaign.getSentCount())
                .delivered(campaign.getDeliveredCount())
                .opened(campaign.getOpenedCount())
                .clicked(campaign.getClickedCount())
                .responded(campaign.getRespondedCount())
                .bounced(campaign.getBouncedCount())
                .unsubscribed(campaign.getUnsubscribedCount())
                .converted(campaign.getConvertedCount())
                .prospectsGenerated(campaign.getProspectsGenerated())
                .deliveryRate(campaign.getDeliveryRate())
                .openRate(campaign.getOpenRate())
                .clickRate(campaign.getClickRate())
                .responseRate(campaign.getResponseRate())
                .conversionRate(campaign.getConversionRate())
                .bounceRate(campaign.getBounceRate())
                .budget(campaign.getBudget())
                .actualCost(campaign.getActualCost())
                .expectedRevenue(campaign.getExpectedRevenue())
                .actualRevenue(campaign.getActualRevenue())
                .roi(campaign.getRoi())
                .build();
    }
}
