package com.digitalgroup.crm.web.admin;

import com.digitalgroup.crm.domain.campaign.entity.CampaignEngagement;
import com.digitalgroup.crm.domain.common.enums.Permission;
import com.digitalgroup.crm.domain.prospect.dto.BulkProspectResult;
import com.digitalgroup.crm.domain.prospect.dto.ConversionOptions;
import com.digitalgroup.crm.domain.prospect.dto.ConversionResult;
import com.digitalgroup.crm.domain.prospect.dto.ProspectDetail;
import com.digitalgroup.crm.domain.prospect.dto.ProspectRequest;
import com.digitalgroup.crm.domain.prospect.dto.ProspectSearchCriteria;
import com.digitalgroup.crm.domain.prospect.dto.ProspectStatistics;
import com.digitalgroup.crm.domain.prospect.entity.LeadScoreHistory;
import com.digitalgroup.crm.domain.prospect.entity.Prospect;
import com.digitalgroup.crm.domain.prospect.enums.ProspectSource;
import com.digitalgroup.crm.domain.prospect.enums.ProspectStatus;
import com.digitalgroup.crm.domain.prospect.service.ProspectConversionService;
import com.digitalgroup.crm.domain.prospect.service.ProspectService;
import com.digitalgroup.crm.security.AccessGuard;
import com.digitalgroup.crm.security.CustomUserDetails;
import com.digitalgroup.crm.web.dto.CampaignResponses;
import com.digitalgroup.crm.web.dto.PagedResponse;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.AccessDeniedException;
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
 * Prospect Admin Controller
 * Manages prospects (leads) until they are converted into contacts
 */
@Slf4j
@RestController
@RequestMapping("/app/prospects")
@RequiredArgsConstructor
public class ProspectAdminController {

    private final ProspectService prospectService;
    private final ProspectConversionService conversionService;
    private final AccessGuard accessGuard;

    /**
     * List prospects. Users without prospects.view_all only see prospects
     * assigned to them or created by them.
     */
    @GetMapping
    @PreAuthorize("hasAnyAuthority('prospects.view_all', 'prospects.view_own')")
    public ResponseEntity<PagedResponse<Map<String, Object>>> index(
            @AuthenticationPrincipal CustomUserDetails currentUser,
            @RequestParam(required = false) String search,
            @RequestParam(required = false) List<ProspectStatus> status,
            @RequestParam(required = false) List<ProspectSource> source,
            @RequestParam(name = "campaign_id", required = false) Long campaignId,
            @RequestParam(name = "assigned_to", required = false) Long assignedTo,
            @RequestParam(name = "min_score", required = false) Integer minScore,
            @RequestParam(name = "max_score", required = false) Integer maxScore,
            @RequestParam(name = "created_from", required = false)
            @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) LocalDateTime createdFrom,
            @RequestParam(name = "created_to", required = false)
            @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) LocalDateTime createdTo,
            @RequestParam(required = false, defaultValue = "0") int page,
            @RequestParam(required = false, defaultValue = "20") int size) {

        ProspectSearchCriteria criteria = ProspectSearchCriteria.builder()
                .search(search)
                .statuses(status)
                .sources(source)
                .campaignId(campaignId)
                .assignedTo(assignedTo)
                .minLeadScore(minScore)
                .maxLeadScore(maxScore)
                .createdFrom(createdFrom)
                .createdTo(createdTo)
                .build();

        Long restrictedTo = accessGuard.visibilityFilter(currentUser, Permission.PROSPECTS_VIEW_ALL);
        if (restrictedTo != null) {
            criteria = criteria.restrictedTo(restrictedTo);
        }

        Page<Prospect> prospects = prospectService.search(criteria,
                PageRequest.of(Math.max(page, 0), CampaignController.clampSize(size),
                        Sort.by(Sort.Direction.DESC, "createdAt")));

        return ResponseEntity.ok(PagedResponse.fromPage(prospects, CampaignResponses::prospect));
    }

    @GetMapping("/statistics")
    @PreAuthorize("hasAnyAuthority('prospects.view_all', 'prospects.view_own')")
    public ResponseEntity<Map<String, Object>> statistics(
            @AuthenticationPrincipal CustomUserDetails currentUser,
            @RequestParam(name = "campaign_id", required = false) Long campaignId) {

        ProspectStatistics stats = prospectService.getStatistics(campaignId,
                accessGuard.visibilityFilter(currentUser, Permission.PROSPECTS_VIEW_ALL));

        Map<String, Object> response = new HashMap<>();
        response.put("total_prospects", stats.totalProspects());
        response.put("by_status", stats.byStatus());
        response.put("average_lead_score", stats.averageLeadScore());
        response.put("conversion_rate", stats.conversionRate());
        return ResponseEntity.ok(response);
    }

    /**
     * CSV export of the prospects the user can see, with the list filters.
     */
    @GetMapping("/export")
    @PreAuthorize("hasAuthority('prospects.export')")
    public ResponseEntity<byte[]> export(
            @AuthenticationPrincipal CustomUserDetails currentUser,
            @RequestParam(required = false) String search,
            @RequestParam(required = false) List<ProspectStatus> status,
            @RequestParam(required = false) List<ProspectSource> source,
            @RequestParam(name = "campaign_id", required = false) Long campaignId,
            @RequestParam(name = "assigned_to", required = false) Long assignedTo) {

        ProspectSearchCriteria criteria = ProspectSearchCriteria.builder()
                .search(search)
                .statuses(status)
                .sources(source)
                .campaignId(campaignId)
                .assignedTo(assignedTo)
                .visibleTo(accessGuard.visibilityFilter(currentUser, Permission.PROSPECTS_VIEW_ALL))
                .build();

        byte[] csv = prospectService.exportCsv(criteria);
        String filename = "prospects_" + LocalDate.now().format(DateTimeFormatter.BASIC_ISO_DATE) + ".csv";

        return ResponseEntity.ok()
                .header(HttpHeaders.CONTENT_DISPOSITION, "attachment; filename=\"" + filename + "\"")
                .contentType(MediaType.parseMediaType("text/csv; charset=UTF-8"))
                .body(csv);
    }

    /**
     * Prospect with its campaign participation and score history
     */
    @GetMapping("/{id}")
    @PreAuthorize("hasAnyAuthority('prospects.view_all', 'prospects.view_own')")
    public ResponseEntity<Map<String, Object>> show(
            @AuthenticationPrincipal CustomUserDetails currentUser,
            @PathVariable Long id) {

        ProspectDetail detail = prospectService.getDetail(id);
        accessGuard.checkProspect(currentUser, detail.prospect(),
                Permission.PROSPECTS_VIEW_ALL, Permission.PROSPECTS_VIEW_OWN);

        Map<String, Object> prospect = CampaignResponses.prospect(detail.prospect());
        prospect.put("campaign_name", detail.prospect().getCampaign() != null
                ? detail.prospect().getCampaign().getName() : null);

        Map<String, Object> engagement = new HashMap<>();
        engagement.put("campaign_count", detail.engagement().campaignCount());
        engagement.put("total_opens", detail.engagement().totalOpens());
        engagement.put("total_clicks", detail.engagement().totalClicks());
        engagement.put("campaigns", detail.engagement().engagements().stream()
                .map(this::mapCampaignParticipation)
                .toList());

        Map<String, Object> response = new HashMap<>();
        response.put("prospect", prospect);
        response.put("engagement", engagement);
        response.put("score_history", detail.scoreHistory().stream().map(CampaignResponses::scoreHistory).toList());
        return ResponseEntity.ok(response);
    }

    @PostMapping
    @PreAuthorize("hasAuthority('prospects.create')")
    public ResponseEntity<Map<String, Object>> create(
            @AuthenticationPrincipal CustomUserDetails currentUser,
            @Valid @RequestBody CreateProspectRequest request) {

        Prospect prospect = prospectService.create(request.toCommand(), currentUser.getId());

        return ResponseEntity.status(HttpStatus.CREATED).body(Map.of(
                "result", "success",
                "prospect", CampaignResponses.prospect(prospect)
        ));
    }

    @PostMapping("/bulk")
    @PreAuthorize("hasAuthority('prospects.import')")
    public ResponseEntity<Map<String, Object>> bulkCreate(
            @AuthenticationPrincipal CustomUserDetails currentUser,
            @Valid @RequestBody BulkProspectRequest request) {

        BulkProspectResult result = prospectService.bulkCreate(
                request.prospects().stream().map(CreateProspectRequest::toCommand).toList(),
                request.campaignId(),
                !Boolean.FALSE.equals(request.skipDuplicates()),
                currentUser.getId());

        Map<String, Object> response = new HashMap<>();
        response.put("result", "success");
        response.put("created", result.created());
        response.put("skipped", result.skipped());
        response.put("failed", result.failed());
        response.put("created_ids", result.createdIds());
        response.put("errors", result.errors().stream()
                .map(e -> Map.<String, Object>of("index", e.index(), "message", e.message()))
                .toList());
        return ResponseEntity.ok(response);
    }

    @PutMapping("/{id}")
    @PreAuthorize("hasAnyAuthority('prospects.edit_all', 'prospects.edit_own')")
    public ResponseEntity<Map<String, Object>> update(
            @AuthenticationPrincipal CustomUserDetails currentUser,
            @PathVariable Long id,
            @Valid @RequestBody UpdateProspectRequest request) {

        checkProspect(currentUser, id, Permission.PROSPECTS_EDIT_ALL, Permission.PROSPECTS_EDIT_OWN);

        // Moving to CONVERTED through an update still needs conversion rights
        if (request.status() == ProspectStatus.CONVERTED
                && !currentUser.hasPermission(Permission.PROSPECTS_CONVERT)) {
            throw new AccessDeniedException(
                    "Not allowed to convert prospects");
        }

        Prospect prospect = prospectService.update(id, request.toCommand(), currentUser.getId());

        return ResponseEntity.ok(Map.of(
                "result", "success",
                "prospect", CampaignResponses.prospect(prospect)
        ));
    }

    @DeleteMapping("/{id}")
    @PreAuthorize("hasAnyAuthority('prospects.delete_all', 'prospects.delete_own')")
    public ResponseEntity<Map<String, Object>> delete(
            @AuthenticationPrincipal CustomUserDetails currentUser,
            @PathVariable Long id) {

        checkProspect(currentUser, id, Permission.PROSPECTS_DELETE_ALL, Permission.PROSPECTS_DELETE_OWN);
        prospectService.delete(id);
        log.info("Prospect {} deleted by user {}", id, currentUser.getId());

        return ResponseEntity.ok(Map.of("result", "success"));
    }

    @PostMapping("/{id}/convert")
    @PreAuthorize("hasAuthority('prospects.convert')")
    public ResponseEntity<Map<String, Object>> convert(
            @AuthenticationPrincipal CustomUserDetails currentUser,
            @PathVariable Long id,
            @RequestBody(required = false) ConvertRequest request) {

        checkProspect(currentUser, id, Permission.PROSPECTS_EDIT_ALL, Permission.PROSPECTS_EDIT_OWN);

        ConversionOptions options = request != null
                ? new ConversionOptions(request.notes(), !Boolean.FALSE.equals(request.createActivity()),
                        request.assignTo())
                : ConversionOptions.defaults();

        ConversionResult result = conversionService.convert(id, options, currentUser.getId());

        Map<String, Object> response = new HashMap<>();
        response.put("result", "success");
        response.put("prospect_id", result.prospectId());
        response.put("contact_id", result.contactId());
        response.put("activity_id", result.activityId());
        response.put("message", "Prospect converted to contact");
        return ResponseEntity.ok(response);
    }

    @PostMapping("/{id}/lead-score")
    @PreAuthorize("hasAnyAuthority('prospects.edit_all', 'prospects.edit_own')")
    public ResponseEntity<Map<String, Object>> adjustLeadScore(
            @AuthenticationPrincipal CustomUserDetails currentUser,
            @PathVariable Long id,
            @Valid @RequestBody LeadScoreRequest request) {

        checkProspect(currentUser, id, Permission.PROSPECTS_EDIT_ALL, Permission.PROSPECTS_EDIT_OWN);

        LeadScoreHistory history = prospectService.adjustLeadScore(id, request.scoreChange(),
                request.reason(), request.notes(), currentUser.getId());

        return ResponseEntity.ok(Map.of(
                "result", "success",
                "lead_score", history.getNewScore(),
                "history", CampaignResponses.scoreHistory(history)
        ));
    }

    @GetMapping("/{id}/lead-score-history")
    @PreAuthorize("hasAnyAuthority('prospects.view_all', 'prospects.view_own')")
    public ResponseEntity<Map<String, Object>> leadScoreHistory(
            @AuthenticationPrincipal CustomUserDetails currentUser,
            @PathVariable Long id) {

        checkProspect(currentUser, id, Permission.PROSPECTS_VIEW_ALL, Permission.PROSPECTS_VIEW_OWN);

        List<Map<String, Object>> history = prospectService.getScoreHistory(id).stream()
                .map(CampaignResponses::scoreHistory)
                .toList();

        return ResponseEntity.ok(Map.of("history", history, "total", history.size()));
    }

    private void checkProspect(CustomUserDetails currentUser, Long id, Permission all, Permission own) {
        accessGuard.checkProspect(currentUser, prospectService.findById(id), all, own);
    }

    private Map<String, Object> mapCampaignParticipation(CampaignEngagement engagement) {
        Map<String, Object> map = new HashMap<>();
        map.put("engagement_id", engagement.getId());
        map.put("campaign_id", engagement.getCampaign().getId());
        map.put("campaign_name", engagement.getCampaign().getName());
        map.put("status", engagement.getStatus().name());
        map.put("sent_at", engagement.getSentAt());
        map.put("opened_at", engagement.getOpenedAt());
        map.put("clicked_at", engagement.getClickedAt());
        map.put("open_count", engagement.getOpenCount());
        map.put("click_count", engagement.getClickCount());
        map.put("lead_score_change", engagement.getLeadScoreChange());
        return map;
    }

    // Request DTOs

    public record CreateProspectRequest(
            @JsonProperty("first_name") @NotBlank(message = "First name is required") @Size(max = 100) String firstName,
            @JsonProperty("last_name") @Size(max = 100) String lastName,
            @Email String email,
            @Size(max = 50) String phone,
            @JsonProperty("company_name") String companyName,
            @JsonProperty("job_title") String jobTitle,
            String industry,
            String description,
            String notes,
            ProspectSource source,
            @JsonProperty("source_details") String sourceDetails,
            ProspectStatus status,
            @JsonProperty("lead_score") @Min(0) @Max(100) Integer leadScore,
            @JsonProperty("campaign_id") Long campaignId,
            @JsonProperty("assigned_to") Long assignedTo,
            @JsonProperty("linkedin_url") String linkedinUrl,
            @JsonProperty("twitter_handle") String twitterHandle,
            String website,
            String city,
            String state,
            String country
    ) {
        ProspectRequest toCommand() {
            return ProspectRequest.builder()
                    .firstName(firstName).lastName(lastName).email(email).phone(phone)
                    .companyName(companyName).jobTitle(jobTitle).industry(industry)
                    .description(description).notes(notes)
                    .source(source).sourceDetails(sourceDetails).status(status)
                    .leadScore(leadScore).campaignId(campaignId).assignedTo(assignedTo)
                    .linkedinUrl(linkedinUrl).twitterHandle(twitterHandle).website(website)
                    .city(city).state(state).country(country)
                    .build();
        }
    }

    public record UpdateProspectRequest(
            @JsonProperty("first_name") @Size(max = 100) String firstName,
            @JsonProperty("last_name") @Size(max = 100) String lastName,
            String email,
            @Size(max = 50) String phone,
            @JsonProperty("company_name") String companyName,
            @JsonProperty("job_title") String jobTitle,
            String industry,
            String description,
            String notes,
            ProspectSource source,
            @JsonProperty("source_details") String sourceDetails,
            ProspectStatus status,
            @JsonProperty("lead_score") @Min(0) @Max(100) Integer leadScore,
            @JsonProperty("campaign_id") Long campaignId,
            @JsonProperty("assigned_to") Long assignedTo,
            @JsonProperty("last_contacted_at") LocalDateTime lastContactedAt,
            @JsonProperty("linkedin_url") String linkedinUrl,
            @JsonProperty("twitter_handle") String twitterHandle,
            String website,
            String city,
            String state,
            String country
    ) {
        ProspectRequest toCommand() {
            return ProspectRequest.builder()
                    .firstName(firstName).lastName(lastName).email(email).phone(phone)
                    .companyName(companyName).jobTitle(jobTitle).industry(industry)
                    .description(description).notes(notes)
                    .source(source).sourceDetails(sourceDetails).status(status)
                    .leadScore(leadScore).campaignId(campaignId).assignedTo(assignedTo)
                    .lastContactedAt(lastContactedAt)
                    .linkedinUrl(linkedinUrl).twitterHandle(twitterHandle).website(website)
                    .city(city).state(state).country(country)
                    .build();
        }
    }

    public record BulkProspectRequest(
            @NotEmpty(message = "prospects must not be empty") List<@Valid CreateProspectRequest> prospects,
            @JsonProperty("campaign_id") Long campaignId,
            @JsonProperty("skip_duplicates") Boolean skipDuplicates
    ) {}

    public record ConvertRequest(
            String notes,
            @JsonProperty("create_activity") Boolean createActivity,
            @JsonProperty("assign_to") Long assignTo
    ) {}

    public record LeadScoreRequest(
            @JsonProperty("score_change") @NotNull(message = "score_change is required") Integer scoreChange,
            String reason,
            String notes
    ) {}
}
