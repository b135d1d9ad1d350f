package com.digitalgroup.crm.web.admin;

import com.digitalgroup.crm.domain.campaign.dto.CampaignAnalytics;
import com.digitalgroup.crm.domain.campaign.dto.CampaignRequest;
import com.digitalgroup.crm.domain.campaign.dto.CampaignSearchCriteria;
import com.digitalgroup.crm.domain.campaign.dto.CampaignStatistics;
import com.digitalgroup.crm.domain.campaign.dto.LinkDealRequest;
import com.digitalgroup.crm.domain.campaign.entity.Campaign;
import com.digitalgroup.crm.domain.campaign.entity.CampaignEngagement;
import com.digitalgroup.crm.domain.campaign.enums.CampaignStatus;
import com.digitalgroup.crm.domain.campaign.enums.CampaignType;
import com.digitalgroup.crm.domain.campaign.service.CampaignMetricsService;
import com.digitalgroup.crm.domain.campaign.service.CampaignService;
import com.digitalgroup.crm.domain.common.enums.Permission;
import com.digitalgroup.crm.domain.prospect.entity.Prospect;
import com.digitalgroup.crm.domain.prospect.service.ProspectService;
import com.digitalgroup.crm.security.AccessGuard;
import com.digitalgroup.crm.security.CustomUserDetails;
import com.digitalgroup.crm.web.dto.CampaignResponses;
import com.digitalgroup.crm.web.dto.PagedResponse;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import jakarta.validation.constraints.Size;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.AccessDeniedException;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.*;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Campaign Controller
 * Campaign CRUD, lifecycle and reporting endpoints
 */
@Slf4j
@RestController
@RequestMapping("/app/campaigns")
@RequiredArgsConstructor
public class CampaignController {

    private final CampaignService campaignService;
    private final CampaignMetricsService metricsService;
    private final ProspectService prospectService;
    private final AccessGuard accessGuard;

    /**
     * List campaigns. Users without campaigns.view_all only see campaigns they own.
     */
    @GetMapping
    @PreAuthorize("hasAnyAuthority('campaigns.view_all', 'campaigns.view_own')")
    public ResponseEntity<PagedResponse<Map<String, Object>>> index(
            @AuthenticationPrincipal CustomUserDetails currentUser,
            @RequestParam(required = false) String search,
            @RequestParam(required = false) List<CampaignStatus> status,
            @RequestParam(required = false) List<CampaignType> type,
            @RequestParam(name = "owner_id", required = false) Long ownerId,
            @RequestParam(required = false) String category,
            @RequestParam(required = false) List<String> tags,
            @RequestParam(name = "start_from", required = false)
            @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) LocalDateTime startFrom,
            @RequestParam(name = "start_to", required = false)
            @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) LocalDateTime startTo,
            @RequestParam(name = "end_from", required = false)
            @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) LocalDateTime endFrom,
            @RequestParam(name = "end_to", required = false)
            @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) LocalDateTime endTo,
            @RequestParam(name = "min_budget", required = false) BigDecimal minBudget,
            @RequestParam(name = "max_budget", required = false) BigDecimal maxBudget,
            @RequestParam(required = false, defaultValue = "0") int page,
            @RequestParam(required = false, defaultValue = "20") int size) {

        CampaignSearchCriteria criteria = CampaignSearchCriteria.builder()
                .search(search)
                .statuses(status)
                .types(type)
                .ownerId(ownerId)
                .category(category)
                .tags(tags)
                .startFrom(startFrom)
                .startTo(startTo)
                .endFrom(endFrom)
                .endTo(endTo)
                .minBudget(minBudget)
                .maxBudget(maxBudget)
                .build();

        Long restrictedTo = accessGuard.visibilityFilter(currentUser, Permission.CAMPAIGNS_VIEW_ALL);
        if (restrictedTo != null) {
            criteria = criteria.withOwner(restrictedTo);
        }

        Page<Campaign> campaigns = campaignService.search(criteria,
                PageRequest.of(Math.max(page, 0), clampSize(size), Sort.by(Sort.Direction.DESC, "createdAt")));

        return ResponseEntity.ok(PagedResponse.fromPage(campaigns, CampaignResponses::campaign));
    }

    @GetMapping("/statistics")
    @PreAuthorize("hasAnyAuthority('campaigns.view_all', 'campaigns.view_own')")
    public ResponseEntity<Map<String, Object>> statistics(@AuthenticationPrincipal CustomUserDetails currentUser) {
        CampaignStatistics stats = metricsService.getStatistics(
                accessGuard.visibilityFilter(currentUser, Permission.CAMPAIGNS_VIEW_ALL));

        Map<String, Object> response = new HashMap<>();
        response.put("total_campaigns", stats.totalCampaigns());
        response.put("by_status", stats.byStatus());
        response.put("by_type", stats.byType());
        response.put("total_budget", stats.totalBudget());
        response.put("total_spent", stats.totalSpent());
        response.put("total_revenue", stats.totalRevenue());
        response.put("overall_roi", stats.overallRoi());
        response.put("total_sent", stats.totalSent());
        response.put("total_prospects", stats.totalProspects());
        response.put("total_conversions", stats.totalConversions());
        response.put("average_conversion_rate", stats.averageConversionRate());
        return ResponseEntity.ok(response);
    }

    @GetMapping("/{id}")
    @PreAuthorize("hasAnyAuthority('campaigns.view_all', 'campaigns.view_own')")
    public ResponseEntity<Map<String, Object>> show(
            @AuthenticationPrincipal CustomUserDetails currentUser,
            @PathVariable Long id) {

        Campaign campaign = campaignService.findById(id);
        accessGuard.checkCampaign(currentUser, campaign, Permission.CAMPAIGNS_VIEW_ALL, Permission.CAMPAIGNS_VIEW_OWN);

        return ResponseEntity.ok(Map.of("campaign", CampaignResponses.campaign(campaign)));
    }

    @PostMapping
    @PreAuthorize("hasAuthority('campaigns.create')")
    public ResponseEntity<Map<String, Object>> create(
            @AuthenticationPrincipal CustomUserDetails currentUser,
            @Valid @RequestBody CreateCampaignRequest request) {

        // Assigning another owner needs edit rights over every campaign
        if (request.ownerId() != null && !request.ownerId().equals(currentUser.getId())
                && !currentUser.hasPermission(Permission.CAMPAIGNS_EDIT_ALL)) {
            throw new AccessDeniedException(
                    "Not allowed to create campaigns for other users");
        }

        Campaign campaign = campaignService.create(request.toCommand(), currentUser.getId());

        return ResponseEntity.status(HttpStatus.CREATED).body(Map.of(
                "result", "success",
                "campaign", CampaignResponses.campaign(campaign)
        ));
    }

    @PutMapping("/{id}")
    @PreAuthorize("hasAnyAuthority('campaigns.edit_all', 'campaigns.edit_own')")
    public ResponseEntity<Map<String, Object>> update(
            @AuthenticationPrincipal CustomUserDetails currentUser,
            @PathVariable Long id,
            @Valid @RequestBody UpdateCampaignRequest request) {

        checkEdit(currentUser, id);
        Campaign campaign = campaignService.update(id, request.toCommand());

        return ResponseEntity.ok(Map.of(
                "result", "success",
                "campaign", CampaignResponses.campaign(campaign)
        ));
    }

    @DeleteMapping("/{id}")
    @PreAuthorize("hasAnyAuthority('campaigns.delete_all', 'campaigns.delete_own')")
    public ResponseEntity<Map<String, Object>> delete(
            @AuthenticationPrincipal CustomUserDetails currentUser,
            @PathVariable Long id) {

        Campaign campaign = campaignService.findById(id);
        accessGuard.checkCampaign(currentUser, campaign,
                Permission.CAMPAIGNS_DELETE_ALL, Permission.CAMPAIGNS_DELETE_OWN);

        campaignService.delete(id);
        log.info("Campaign {} deleted by user {}", id, currentUser.getId());

        return ResponseEntity.ok(Map.of("result", "success"));
    }

    // Lifecycle

    @PostMapping("/{id}/pause")
    @PreAuthorize("hasAnyAuthority('campaigns.edit_all', 'campaigns.edit_own')")
    public ResponseEntity<Map<String, Object>> pause(
            @AuthenticationPrincipal CustomUserDetails currentUser,
            @PathVariable Long id) {
        checkEdit(currentUser, id);
        return lifecycleResponse(campaignService.pause(id));
    }

    @PostMapping("/{id}/resume")
    @PreAuthorize("hasAnyAuthority('campaigns.edit_all', 'campaigns.edit_own')")
    public ResponseEntity<Map<String, Object>> resume(
            @AuthenticationPrincipal CustomUserDetails currentUser,
            @PathVariable Long id) {
        checkEdit(currentUser, id);
        return lifecycleResponse(campaignService.resume(id));
    }

    @PostMapping("/{id}/complete")
    @PreAuthorize("hasAnyAuthority('campaigns.edit_all', 'campaigns.edit_own')")
    public ResponseEntity<Map<String, Object>> complete(
            @AuthenticationPrincipal CustomUserDetails currentUser,
            @PathVariable Long id) {
        checkEdit(currentUser, id);
        return lifecycleResponse(campaignService.complete(id));
    }

    @PostMapping("/{id}/cancel")
    @PreAuthorize("hasAnyAuthority('campaigns.edit_all', 'campaigns.edit_own')")
    public ResponseEntity<Map<String, Object>> cancel(
            @AuthenticationPrincipal CustomUserDetails currentUser,
            @PathVariable Long id) {
        checkEdit(currentUser, id);
        return lifecycleResponse(campaignService.cancel(id));
    }

    // Reporting

    @GetMapping("/{id}/metrics")
    @PreAuthorize("hasAnyAuthority('campaigns.view_all', 'campaigns.view_own')")
    public ResponseEntity<Map<String, Object>> metrics(
            @AuthenticationPrincipal CustomUserDetails currentUser,
            @PathVariable Long id) {
        checkView(currentUser, id);
        return ResponseEntity.ok(Map.of("metrics", CampaignResponses.metrics(metricsService.getMetrics(id))));
    }

    @GetMapping("/{id}/conversions")
    @PreAuthorize("hasAnyAuthority('campaigns.view_all', 'campaigns.view_own')")
    public ResponseEntity<Map<String, Object>> conversions(
            @AuthenticationPrincipal CustomUserDetails currentUser,
            @PathVariable Long id) {
        checkView(currentUser, id);
        List<Map<String, Object>> data = metricsService.getConversions(id).stream()
                .map(CampaignResponses::conversion)
                .toList();
        return ResponseEntity.ok(Map.of("conversions", data, "total", data.size()));
    }

    @GetMapping("/{id}/analytics")
    @PreAuthorize("hasAnyAuthority('campaigns.view_all', 'campaigns.view_own')")
    public ResponseEntity<Map<String, Object>> analytics(
            @AuthenticationPrincipal CustomUserDetails currentUser,
            @PathVariable Long id,
            @RequestParam(required = false, defaultValue = "30") int days) {
        checkView(currentUser, id);

        CampaignAnalytics analytics = metricsService.getAnalytics(id, Math.max(days, 1));

        Map<String, Object> response = new HashMap<>();
        response.put("metrics", CampaignResponses.metrics(analytics.metrics()));
        response.put("timeline", analytics.timeline().stream().map(CampaignResponses::snapshot).toList());
        response.put("top_performers", analytics.topPerformers().stream().map(CampaignResponses::engagement).toList());
        response.put("funnel", analytics.funnel().stream().map(CampaignResponses::funnelStage).toList());
        return ResponseEntity.ok(response);
    }

    @GetMapping("/{id}/prospects")
    @PreAuthorize("hasAnyAuthority('campaigns.view_all', 'campaigns.view_own')")
    public ResponseEntity<PagedResponse<Map<String, Object>>> prospects(
            @AuthenticationPrincipal CustomUserDetails currentUser,
            @PathVariable Long id,
            @RequestParam(required = false, defaultValue = "0") int page,
            @RequestParam(required = false, defaultValue = "20") int size) {
        checkView(currentUser, id);

        Page<Prospect> prospects = prospectService.findByCampaign(id,
                PageRequest.of(Math.max(page, 0), clampSize(size), Sort.by(Sort.Direction.DESC, "createdAt")));
        return ResponseEntity.ok(PagedResponse.fromPage(prospects, CampaignResponses::prospect));
    }

    @PostMapping("/{id}/link-deal")
    @PreAuthorize("hasAnyAuthority('campaigns.edit_all', 'campaigns.edit_own')")
    public ResponseEntity<Map<String, Object>> linkDeal(
            @AuthenticationPrincipal CustomUserDetails currentUser,
            @PathVariable Long id,
            @Valid @RequestBody LinkDealBody request) {
        checkEdit(currentUser, id);

        CampaignEngagement engagement = campaignService.linkDeal(id,
                new LinkDealRequest(request.prospectId(), request.contactId(), request.dealId(), request.conversionValue()));

        return ResponseEntity.ok(Map.of(
                "result", "success",
                "engagement_id", engagement.getId(),
                "status", engagement.getStatus().name(),
                "message", "Deal linked to campaign"
        ));
    }

    private void checkView(CustomUserDetails currentUser, Long id) {
        accessGuard.checkCampaign(currentUser, campaignService.findById(id),
                Permission.CAMPAIGNS_VIEW_ALL, Permission.CAMPAIGNS_VIEW_OWN);
    }

    private void checkEdit(CustomUserDetails currentUser, Long id) {
        accessGuard.checkCampaign(currentUser, campaignService.findById(id),
                Permission.CAMPAIGNS_EDIT_ALL, Permission.CAMPAIGNS_EDIT_OWN);
    }

    private ResponseEntity<Map<String, Object>> lifecycleResponse(Campaign campaign) {
        return ResponseEntity.ok(Map.of(
                "result", "success",
                "campaign", CampaignResponses.campaign(campaign)
        ));
    }

    static int clampSize(int size) {
        return Math.min(Math.max(size, 1), 100);
    }

    // Request DTOs

    public record CreateCampaignRequest(
            @NotBlank(message = "Name is required") @Size(max = 255) String name,
            String description,
            CampaignType type,
            @JsonProperty("start_date") LocalDateTime startDate,
            @JsonProperty("end_date") LocalDateTime endDate,
            @PositiveOrZero BigDecimal budget,
            @JsonProperty("actual_cost") @PositiveOrZero BigDecimal actualCost,
            @JsonProperty("expected_revenue") BigDecimal expectedRevenue,
            @JsonProperty("target_response_rate") Double targetResponseRate,
            @JsonProperty("target_conversion_rate") Double targetConversionRate,
            @JsonProperty("email_template_id") Long emailTemplateId,
            @JsonProperty("email_subject") String emailSubject,
            @JsonProperty("email_from_name") String emailFromName,
            @JsonProperty("email_from_email") String emailFromEmail,
            @JsonProperty("audience_filters") Map<String, Object> audienceFilters,
            @JsonProperty("is_automated") Boolean automated,
            @JsonProperty("automation_config") Map<String, Object> automationConfig,
            Set<String> tags,
            String category,
            String notes,
            @JsonProperty("owner_id") Long ownerId
    ) {
        CampaignRequest toCommand() {
            return CampaignRequest.builder()
                    .name(name).description(description).type(type)
                    .startDate(startDate).endDate(endDate)
                    .budget(budget).actualCost(actualCost).expectedRevenue(expectedRevenue)
                    .targetResponseRate(targetResponseRate).targetConversionRate(targetConversionRate)
                    .emailTemplateId(emailTemplateId).emailSubject(emailSubject)
                    .emailFromName(emailFromName).emailFromEmail(emailFromEmail)
                    .audienceFilters(audienceFilters).automated(automated).automationConfig(automationConfig)
                    .tags(tags).category(category).notes(notes).ownerId(ownerId)
                    .build();
        }
    }

    public record UpdateCampaignRequest(
            @Size(max = 255) String name,
            String description,
            CampaignType type,
            @JsonProperty("start_date") LocalDateTime startDate,
            @JsonProperty("end_date") LocalDateTime endDate,
            @PositiveOrZero BigDecimal budget,
            @JsonProperty("actual_cost") @PositiveOrZero BigDecimal actualCost,
            @JsonProperty("expected_revenue") BigDecimal expectedRevenue,
            @JsonProperty("target_response_rate") Double targetResponseRate,
            @JsonProperty("target_conversion_rate") Double targetConversionRate,
            @JsonProperty("email_template_id") Long emailTemplateId,
            @JsonProperty("email_subject") String emailSubject,
            @JsonProperty("email_from_name") String emailFromName,
            @JsonProperty("email_from_email") String emailFromEmail,
            @JsonProperty("audience_filters") Map<String, Object> audienceFilters,
            @JsonProperty("is_automated") Boolean automated,
            @JsonProperty("automation_config") Map<String, Object> automationConfig,
            Set<String> tags,
            String category,
            String notes,
            @JsonProperty("owner_id") Long ownerId
    ) {
        CampaignRequest toCommand() {
            return CampaignRequest.builder()
                    .name(name).description(description).type(type)
                    .startDate(startDate).endDate(endDate)
                    .budget(budget).actualCost(actualCost).expectedRevenue(expectedRevenue)
                    .targetResponseRate(targetResponseRate).targetConversionRate(targetConversionRate)
                    .emailTemplateId(emailTemplateId).emailSubject(emailSubject)
                    .emailFromName(emailFromName).emailFromEmail(emailFromEmail)
                    .audienceFilters(audienceFilters).automated(automated).automationConfig(automationConfig)
                    .tags(tags).category(category).notes(notes).ownerId(ownerId)
                    .build();
        }
    }

    public record LinkDealBody(
            @JsonProperty("prospect_id") Long prospectId,
            @JsonProperty("contact_id") Long contactId,
            @JsonProperty("deal_id") @NotNull(message = "deal_id is required") Long dealId,
            @JsonProperty("conversion_value") @PositiveOrZero BigDecimal conversionValue
    ) {}
}
