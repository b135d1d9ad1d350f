package com.digitalgroup.crm.web.admin;

import com.digitalgroup.crm.domain.campaign.dto.AudienceAddResult;
import com.digitalgroup.crm.domain.campaign.dto.BulkAddResult;
import com.digitalgroup.crm.domain.campaign.dto.EngagementEvent;
import com.digitalgroup.crm.domain.campaign.dto.ExecuteOptions;
import com.digitalgroup.crm.domain.campaign.dto.ExecutionResult;
import com.digitalgroup.crm.domain.campaign.entity.Campaign;
import com.digitalgroup.crm.domain.campaign.entity.CampaignEngagement;
import com.digitalgroup.crm.domain.campaign.enums.BounceType;
import com.digitalgroup.crm.domain.campaign.enums.EngagementEventType;
import com.digitalgroup.crm.domain.campaign.enums.EngagementStatus;
import com.digitalgroup.crm.domain.campaign.service.AudienceService;
import com.digitalgroup.crm.domain.campaign.service.CampaignExecutor;
import com.digitalgroup.crm.domain.campaign.service.CampaignService;
import com.digitalgroup.crm.domain.campaign.service.EngagementEventService;
import com.digitalgroup.crm.domain.common.enums.Permission;
import com.digitalgroup.crm.exception.BusinessException;
import com.digitalgroup.crm.security.AccessGuard;
import com.digitalgroup.crm.security.CustomUserDetails;
import com.digitalgroup.crm.web.dto.CampaignResponses;
import com.digitalgroup.crm.web.dto.PagedResponse;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.*;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Campaign Audience Controller
 * Audience membership, sending and engagement event endpoints
 */
@Slf4j
@RestController
@RequestMapping("/app/campaigns/{campaignId}")
@RequiredArgsConstructor
public class CampaignAudienceController {

    private final CampaignService campaignService;
    private final AudienceService audienceService;
    private final CampaignExecutor campaignExecutor;
    private final EngagementEventService engagementEventService;
    private final AccessGuard accessGuard;

    @GetMapping("/audience")
    @PreAuthorize("hasAnyAuthority('campaigns.view_all', 'campaigns.view_own')")
    public ResponseEntity<PagedResponse<Map<String, Object>>> audience(
            @AuthenticationPrincipal CustomUserDetails currentUser,
            @PathVariable Long campaignId,
            @RequestParam(required = false) List<EngagementStatus> status,
            @RequestParam(required = false, defaultValue = "0") int page,
            @RequestParam(required = false, defaultValue = "20") int size) {

        checkCampaign(currentUser, campaignId, Permission.CAMPAIGNS_VIEW_ALL, Permission.CAMPAIGNS_VIEW_OWN);

        Page<CampaignEngagement> members = audienceService.listAudience(campaignId, status,
                PageRequest.of(Math.max(page, 0), CampaignController.clampSize(size),
                        Sort.by(Sort.Direction.ASC, "id")));

        return ResponseEntity.ok(PagedResponse.fromPage(members, CampaignResponses::audienceMember));
    }

    /**
     * Add recipients. Accepts lists of contact and prospect ids, or a single
     * contact or prospect with an optional override address.
     */
    @PostMapping("/audience")
    @PreAuthorize("hasAnyAuthority('campaigns.edit_all', 'campaigns.edit_own')")
    public ResponseEntity<Map<String, Object>> addAudience(
            @AuthenticationPrincipal CustomUserDetails currentUser,
            @PathVariable Long campaignId,
            @RequestBody AddAudienceRequest request) {

        checkCampaign(currentUser, campaignId, Permission.CAMPAIGNS_EDIT_ALL, Permission.CAMPAIGNS_EDIT_OWN);

        boolean hasLists = notEmpty(request.contactIds()) || notEmpty(request.prospectIds());
        boolean hasSingle = request.contactId() != null || request.prospectId() != null;

        if (!hasLists && !hasSingle) {
            throw new BusinessException("Provide contact_ids, prospect_ids, contact_id or prospect_id");
        }
        if (request.contactId() != null && request.prospectId() != null) {
            throw new BusinessException("Provide either contact_id or prospect_id, not both");
        }

        if (hasSingle && !hasLists) {
            AudienceAddResult result = request.contactId() != null
                    ? audienceService.addContact(campaignId, request.contactId(), request.sendTo())
                    : audienceService.addProspect(campaignId, request.prospectId(), request.sendTo());

            Map<String, Object> response = new HashMap<>();
            response.put("result", "success");
            response.put("created", result.created());
            response.put("engagement_id", result.engagement().getId());
            response.put("message", result.created() ? "Added to audience" : "Already in audience");
            return ResponseEntity.status(result.created() ? HttpStatus.CREATED : HttpStatus.OK).body(response);
        }

        Map<String, Object> response = new HashMap<>();
        response.put("result", "success");
        if (notEmpty(request.contactIds())) {
            response.put("contacts", bulkResult(audienceService.bulkAddContacts(campaignId, request.contactIds())));
        }
        if (notEmpty(request.prospectIds())) {
            response.put("prospects", bulkResult(audienceService.bulkAddProspects(campaignId, request.prospectIds())));
        }
        return ResponseEntity.ok(response);
    }

    @DeleteMapping("/audience/{engagementId}")
    @PreAuthorize("hasAnyAuthority('campaigns.edit_all', 'campaigns.edit_own')")
    public ResponseEntity<Map<String, Object>> removeAudienceMember(
            @AuthenticationPrincipal CustomUserDetails currentUser,
            @PathVariable Long campaignId,
            @PathVariable Long engagementId) {

        checkCampaign(currentUser, campaignId, Permission.CAMPAIGNS_EDIT_ALL, Permission.CAMPAIGNS_EDIT_OWN);
        audienceService.remove(campaignId, engagementId);

        return ResponseEntity.ok(Map.of("result", "success"));
    }

    @GetMapping("/audience/export")
    @PreAuthorize("hasAuthority('campaigns.export')")
    public ResponseEntity<byte[]> exportAudience(
            @AuthenticationPrincipal CustomUserDetails currentUser,
            @PathVariable Long campaignId) {

        checkCampaign(currentUser, campaignId, Permission.CAMPAIGNS_VIEW_ALL, Permission.CAMPAIGNS_VIEW_OWN);

        byte[] csv = audienceService.exportAudienceCsv(campaignId);
        String filename = "campaign_" + campaignId + "_audience_"
                + LocalDate.now().format(DateTimeFormatter.BASIC_ISO_DATE) + ".csv";

        return ResponseEntity.ok()
                .header(HttpHeaders.CONTENT_DISPOSITION, "attachment; filename=\"" + filename + "\"")
                .contentType(MediaType.parseMediaType("text/csv; charset=UTF-8"))
                .body(csv);
    }

    // Sending

    @PostMapping("/execute")
    @PreAuthorize("hasAuthority('campaigns.execute')")
    public ResponseEntity<Map<String, Object>> execute(
            @AuthenticationPrincipal CustomUserDetails currentUser,
            @PathVariable Long campaignId,
            @RequestBody(required = false) ExecuteRequest request) {

        checkCampaign(currentUser, campaignId, Permission.CAMPAIGNS_EDIT_ALL, Permission.CAMPAIGNS_EDIT_OWN);

        ExecuteOptions options = request != null
                ? new ExecuteOptions(Boolean.TRUE.equals(request.sendTestEmail()), request.testEmails(),
                        request.scheduleFor())
                : ExecuteOptions.now();

        ExecutionResult result = campaignExecutor.execute(campaignId, options, currentUser.getId());
        return executionResponse(result);
    }

    @PostMapping("/send-pending")
    @PreAuthorize("hasAuthority('campaigns.execute')")
    public ResponseEntity<Map<String, Object>> sendPending(
            @AuthenticationPrincipal CustomUserDetails currentUser,
            @PathVariable Long campaignId) {

        checkCampaign(currentUser, campaignId, Permission.CAMPAIGNS_EDIT_ALL, Permission.CAMPAIGNS_EDIT_OWN);
        return executionResponse(campaignExecutor.sendToPending(campaignId, currentUser.getId()));
    }

    @PostMapping("/audience/{engagementId}/resend")
    @PreAuthorize("hasAuthority('campaigns.execute')")
    public ResponseEntity<Map<String, Object>> resend(
            @AuthenticationPrincipal CustomUserDetails currentUser,
            @PathVariable Long campaignId,
            @PathVariable Long engagementId) {

        checkCampaign(currentUser, campaignId, Permission.CAMPAIGNS_EDIT_ALL, Permission.CAMPAIGNS_EDIT_OWN);
        return executionResponse(campaignExecutor.resendToMember(campaignId, engagementId, currentUser.getId()));
    }

    /**
     * Record a delivery or engagement event reported for one recipient.
     */
    @PostMapping("/audience/{engagementId}/events")
    @PreAuthorize("hasAnyAuthority('campaigns.edit_all', 'campaigns.edit_own')")
    public ResponseEntity<Map<String, Object>> recordEvent(
            @AuthenticationPrincipal CustomUserDetails currentUser,
            @PathVariable Long campaignId,
            @PathVariable Long engagementId,
            @Valid @RequestBody EngagementEventRequest request) {

        checkCampaign(currentUser, campaignId, Permission.CAMPAIGNS_EDIT_ALL, Permission.CAMPAIGNS_EDIT_OWN);

        CampaignEngagement engagement = engagementEventService.recordEvent(campaignId, engagementId,
                new EngagementEvent(request.event(), request.bounceType(), request.message()),
                currentUser.getId());

        return ResponseEntity.ok(Map.of(
                "result", "success",
                "engagement", CampaignResponses.engagement(engagement)
        ));
    }

    private void checkCampaign(CustomUserDetails currentUser, Long campaignId, Permission all, Permission own) {
        Campaign campaign = campaignService.findById(campaignId);
        accessGuard.checkCampaign(currentUser, campaign, all, own);
    }

    private ResponseEntity<Map<String, Object>> executionResponse(ExecutionResult result) {
        Map<String, Object> response = new HashMap<>();
        response.put("result", result.status() == ExecutionResult.Status.FAILED ? "error" : "success");
        response.put("execution", CampaignResponses.executionResult(result));
        return ResponseEntity.ok(response);
    }

    private static Map<String, Object> bulkResult(BulkAddResult result) {
        return Map.of(
                "added", result.added(),
                "skipped", result.skipped(),
                "not_found", result.notFound(),
                "total_requested", result.totalRequested()
        );
    }

    private static boolean notEmpty(List<Long> ids) {
        return ids != null && !ids.isEmpty();
    }

    // Request DTOs

    public record AddAudienceRequest(
            @JsonProperty("contact_ids") List<Long> contactIds,
            @JsonProperty("prospect_ids") List<Long> prospectIds,
            @JsonProperty("contact_id") Long contactId,
            @JsonProperty("prospect_id") Long prospectId,
            @JsonProperty("send_to") String sendTo
    ) {}

    public record ExecuteRequest(
            @JsonProperty("send_test_email") Boolean sendTestEmail,
            @JsonProperty("test_emails") List<String> testEmails,
            @JsonProperty("schedule_for") LocalDateTime scheduleFor
    ) {}

    public record EngagementEventRequest(
            @NotNull(message = "event is required") EngagementEventType event,
            @JsonProperty("bounce_type") BounceType bounceType,
            String message
    ) {}
}
