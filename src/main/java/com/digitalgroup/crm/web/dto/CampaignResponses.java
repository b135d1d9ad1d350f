package com.digitalgroup.crm.web.dto;

import com.digitalgroup.crm.domain.campaign.dto.CampaignMetrics;
import com.digitalgroup.crm.domain.campaign.dto.ExecutionResult;
import com.digitalgroup.crm.domain.campaign.dto.FunnelStage;
import com.digitalgroup.crm.domain.campaign.entity.Campaign;
import com.digitalgroup.crm.domain.campaign.entity.CampaignEngagement;
import com.digitalgroup.crm.domain.campaign.entity.CampaignMetric;
import com.digitalgroup.crm.domain.campaign.service.AudienceService;
import com.digitalgroup.crm.domain.prospect.entity.LeadScoreHistory;
import com.digitalgroup.crm.domain.prospect.entity.Prospect;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.Map;

/**
 * Snake_case response maps shared by the campaign and prospect controllers.
 * Only associations the calling query fetched are read.
 */
public final class CampaignResponses {

    private CampaignResponses() {
    }

    public static Map<String, Object> campaign(Campaign campaign) {
        Map<String, Object> map = new HashMap<>();
        map.put("id", campaign.getId());
        map.put("name", campaign.getName());
        map.put("description", campaign.getDescription());
        map.put("type", campaign.getType().name());
        map.put("status", campaign.getStatus().name());
        map.put("start_date", campaign.getStartDate());
        map.put("end_date", campaign.getEndDate());
        map.put("actual_start_date", campaign.getActualStartDate());
        map.put("actual_end_date", campaign.getActualEndDate());
        map.put("last_executed_at", campaign.getLastExecutedAt());
        map.put("budget", campaign.getBudget());
        map.put("actual_cost", campaign.getActualCost());
        map.put("expected_revenue", campaign.getExpectedRevenue());
        map.put("actual_revenue", campaign.getActualRevenue());
        map.put("target_audience_size", campaign.getTargetAudienceSize());
        map.put("target_response_rate", campaign.getTargetResponseRate());
        map.put("target_conversion_rate", campaign.getTargetConversionRate());
        map.put("sent_count", campaign.getSentCount());
        map.put("delivered_count", campaign.getDeliveredCount());
        map.put("opened_count", campaign.getOpenedCount());
        map.put("clicked_count", campaign.getClickedCount());
        map.put("responded_count", campaign.getRespondedCount());
        map.put("bounced_count", campaign.getBouncedCount());
        map.put("unsubscribed_count", campaign.getUnsubscribedCount());
        map.put("converted_count", campaign.getConvertedCount());
        map.put("prospects_generated", campaign.getProspectsGenerated());
        map.put("open_rate", campaign.getOpenRate());
        map.put("click_rate", campaign.getClickRate());
        map.put("conversion_rate", campaign.getConversionRate());
        map.put("roi", campaign.getRoi());
        map.put("days_remaining", campaign.getDaysRemaining());
        map.put("email_template_id", campaign.getEmailTemplate() != null ? campaign.getEmailTemplate().getId() : null);
        map.put("email_subject", campaign.getEmailSubject());
        map.put("email_from_name", campaign.getEmailFromName());
        map.put("email_from_email", campaign.getEmailFromEmail());
        map.put("audience_filters", campaign.getAudienceFilters());
        map.put("is_automated", campaign.getAutomated());
        map.put("automation_config", campaign.getAutomationConfig());
        map.put("tags", new ArrayList<>(campaign.getTags()));
        map.put("category", campaign.getCategory());
        map.put("notes", campaign.getNotes());
        map.put("owner_id", campaign.getOwnerId());
        map.put("created_by", campaign.getCreatedBy());
        map.put("created_at", campaign.getCreatedAt());
        map.put("updated_at", campaign.getUpdatedAt());
        return map;
    }

    public static Map<String, Object> metrics(CampaignMetrics metrics) {
        Map<String, Object> map = new HashMap<>();
        map.put("campaign_id", metrics.campaignId());
        map.put("target_audience_size", metrics.targetAudienceSize());
        map.put("sent", metrics.sent());
        map.put("delivered", metrics.delivered());
        map.put("opened", metrics.opened());
        map.put("clicked", metrics.clicked());
        map.put("responded", metrics.responded());
        map.put("bounced", metrics.bounced());
        map.put("unsubscribed", metrics.unsubscribed());
        map.put("converted", metrics.converted());
        map.put("prospects_generated", metrics.prospectsGenerated());
        map.put("delivery_rate", metrics.deliveryRate());
        map.put("open_rate", metrics.openRate());
        map.put("click_rate", metrics.clickRate());
        map.put("response_rate", metrics.responseRate());
        map.put("conversion_rate", metrics.conversionRate());
        map.put("bounce_rate", metrics.bounceRate());
        map.put("budget", metrics.budget());
        map.put("actual_cost", metrics.actualCost());
        map.put("expected_revenue", metrics.expectedRevenue());
        map.put("actual_revenue", metrics.actualRevenue());
        map.put("roi", metrics.roi());
        return map;
    }

    public static Map<String, Object> snapshot(CampaignMetric metric) {
        Map<String, Object> map = new HashMap<>();
        map.put("date", metric.getMetricDate());
        map.put("sent", metric.getSentCount());
        map.put("delivered", metric.getDeliveredCount());
        map.put("opened", metric.getOpenedCount());
        map.put("clicked", metric.getClickedCount());
        map.put("responded", metric.getRespondedCount());
        map.put("bounced", metric.getBouncedCount());
        map.put("converted", metric.getConvertedCount());
        map.put("open_rate", metric.getOpenRate());
        map.put("click_rate", metric.getClickRate());
        map.put("conversion_rate", metric.getConversionRate());
        map.put("revenue_to_date", metric.getRevenueToDate());
        map.put("roi", metric.getRoi());
        return map;
    }

    public static Map<String, Object> funnelStage(FunnelStage stage) {
        Map<String, Object> map = new HashMap<>();
        map.put("stage", stage.stage());
        map.put("count", stage.count());
        map.put("rate", stage.rate());
        return map;
    }

    /**
     * Audience member with recipient details. Requires the contact (with its
     * company) or the prospect to be loaded.
     */
    public static Map<String, Object> audienceMember(CampaignEngagement engagement) {
        Map<String, Object> map = engagementCore(engagement);
        map.put("name", AudienceService.recipientName(engagement));
        map.put("company", AudienceService.recipientCompany(engagement));
        map.put("lead_score", engagement.isContactRecipient() ? null : engagement.getProspect().getLeadScore());
        return map;
    }

    /**
     * Engagement record with the recipient's name only.
     */
    public static Map<String, Object> engagement(CampaignEngagement engagement) {
        Map<String, Object> map = engagementCore(engagement);
        map.put("name", AudienceService.recipientName(engagement));
        return map;
    }

    private static Map<String, Object> engagementCore(CampaignEngagement engagement) {
        Map<String, Object> map = new HashMap<>();
        map.put("id", engagement.getId());
        map.put("recipient_type", engagement.getRecipientType());
        map.put("recipient_id", engagement.getRecipientId());
        map.put("email", engagement.getEmailSentTo());
        map.put("status", engagement.getStatus().name());
        map.put("sent_at", engagement.getSentAt());
        map.put("delivered_at", engagement.getDeliveredAt());
        map.put("opened_at", engagement.getOpenedAt());
        map.put("clicked_at", engagement.getClickedAt());
        map.put("responded_at", engagement.getRespondedAt());
        map.put("bounced_at", engagement.getBouncedAt());
        map.put("unsubscribed_at", engagement.getUnsubscribedAt());
        map.put("converted_at", engagement.getConvertedAt());
        map.put("open_count", engagement.getOpenCount());
        map.put("click_count", engagement.getClickCount());
        map.put("lead_score_change", engagement.getLeadScoreChange());
        map.put("engagement_score", engagement.getEngagementScore());
        map.put("bounce_type", engagement.getBounceType() != null ? engagement.getBounceType().name() : null);
        map.put("error_message", engagement.getErrorMessage());
        map.put("conversion_value", engagement.getConversionValue());
        return map;
    }

    public static Map<String, Object> conversion(CampaignEngagement engagement) {
        Map<String, Object> map = engagement(engagement);
        map.put("deal_id", engagement.getDeal() != null ? engagement.getDeal().getId() : null);
        map.put("deal_name", engagement.getDeal() != null ? engagement.getDeal().getName() : null);
        return map;
    }

    public static Map<String, Object> executionResult(ExecutionResult result) {
        Map<String, Object> map = new HashMap<>();
        map.put("campaign_id", result.campaignId());
        map.put("status", result.status().name());
        map.put("attempted", result.attempted());
        map.put("sent", result.sent());
        map.put("failed", result.failed());
        map.put("skipped", result.skipped());
        map.put("scheduled_for", result.scheduledFor());
        map.put("test_recipients", result.testRecipients());
        map.put("message", result.message());
        return map;
    }

    public static Map<String, Object> prospect(Prospect prospect) {
        Map<String, Object> map = new HashMap<>();
        map.put("id", prospect.getId());
        map.put("first_name", prospect.getFirstName());
        map.put("last_name", prospect.getLastName());
        map.put("full_name", prospect.getFullName());
        map.put("email", prospect.getEmail());
        map.put("phone", prospect.getPhone());
        map.put("company_name", prospect.getCompanyName());
        map.put("job_title", prospect.getJobTitle());
        map.put("industry", prospect.getIndustry());
        map.put("description", prospect.getDescription());
        map.put("notes", prospect.getNotes());
        map.put("source", prospect.getSource().name());
        map.put("source_details", prospect.getSourceDetails());
        map.put("status", prospect.getStatus().name());
        map.put("lead_score", prospect.getLeadScore());
        map.put("campaign_id", prospect.getCampaign() != null ? prospect.getCampaign().getId() : null);
        map.put("is_converted", prospect.isConverted());
        map.put("converted_to_contact_id",
                prospect.getConvertedToContact() != null ? prospect.getConvertedToContact().getId() : null);
        map.put("converted_at", prospect.getConvertedAt());
        map.put("assigned_to", prospect.getAssignedTo());
        map.put("created_by", prospect.getCreatedBy());
        map.put("last_contacted_at", prospect.getLastContactedAt());
        map.put("linkedin_url", prospect.getLinkedinUrl());
        map.put("twitter_handle", prospect.getTwitterHandle());
        map.put("website", prospect.getWebsite());
        map.put("city", prospect.getCity());
        map.put("state", prospect.getState());
        map.put("country", prospect.getCountry());
        map.put("created_at", prospect.getCreatedAt());
        map.put("updated_at", prospect.getUpdatedAt());
        return map;
    }

    public static Map<String, Object> scoreHistory(LeadScoreHistory history) {
        Map<String, Object> map = new HashMap<>();
        map.put("id", history.getId());
        map.put("old_score", history.getOldScore());
        map.put("new_score", history.getNewScore());
        map.put("score_change", history.getScoreChange());
        map.put("reason", history.getReason());
        map.put("activity_type", history.getActivityType());
        map.put("campaign_id", history.getCampaign() != null ? history.getCampaign().getId() : null);
        map.put("campaign_engagement_id",
                history.getCampaignEngagement() != null ? history.getCampaignEngagement().getId() : null);
        map.put("changed_by", history.getChangedBy());
        map.put("notes", history.getNotes());
        map.put("created_at", history.getCreatedAt());
        return map;
    }
}
