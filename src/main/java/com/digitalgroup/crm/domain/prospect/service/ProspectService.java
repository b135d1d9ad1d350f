package com.digitalgroup.crm.domain.prospect.service;

import com.digitalgroup.crm.domain.campaign.entity.Campaign;
import com.digitalgroup.crm.domain.campaign.entity.CampaignEngagement;
import com.digitalgroup.crm.domain.campaign.repository.CampaignEngagementRepository;
import com.digitalgroup.crm.domain.campaign.repository.CampaignRepository;
import com.digitalgroup.crm.domain.campaign.service.AudienceService;
import com.digitalgroup.crm.domain.campaign.service.CampaignMetricsService;
import com.digitalgroup.crm.domain.prospect.dto.BulkProspectResult;
import com.digitalgroup.crm.domain.prospect.dto.ConversionOptions;
import com.digitalgroup.crm.domain.prospect.dto.EngagementSummary;
import com.digitalgroup.crm.domain.prospect.dto.ProspectDetail;
import com.digitalgroup.crm.domain.prospect.dto.ProspectRequest;
import com.digitalgroup.crm.domain.prospect.dto.ProspectSearchCriteria;
import com.digitalgroup.crm.domain.prospect.dto.ProspectStatistics;
import com.digitalgroup.crm.domain.prospect.dto.ScoreContext;
import com.digitalgroup.crm.domain.prospect.entity.LeadScoreHistory;
import com.digitalgroup.crm.domain.prospect.entity.Prospect;
import com.digitalgroup.crm.domain.prospect.enums.ProspectSource;
import com.digitalgroup.crm.domain.prospect.enums.ProspectStatus;
import com.digitalgroup.crm.domain.prospect.repository.LeadScoreHistoryRepository;
import com.digitalgroup.crm.domain.prospect.repository.ProspectRepository;
import com.digitalgroup.crm.domain.prospect.repository.ProspectSpecifications;
import com.digitalgroup.crm.exception.ApplicationException;
import com.digitalgroup.crm.exception.BusinessException;
import com.digitalgroup.crm.exception.ConflictException;
import com.digitalgroup.crm.exception.InvalidStateException;
import com.digitalgroup.crm.exception.ResourceNotFoundException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.nio.charset.StandardCharsets;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Prospect Service
 * Prospect CRUD with duplicate detection on email or phone. Score changes go
 * through {@link LeadScoreTracker}; conversion through
 * {@link ProspectConversionService}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ProspectService {

    static final String AUTO_CONVERSION_NOTES = "Automatically converted via status update";
    private static final String CSV_SEPARATOR = ",";
    private static final DateTimeFormatter DATE_FORMATTER = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private final ProspectRepository prospectRepository;
    private final LeadScoreHistoryRepository historyRepository;
    private final CampaignRepository campaignRepository;
    private final CampaignEngagementRepository engagementRepository;
    private final LeadScoreTracker leadScoreTracker;
    private final ProspectConversionService conversionService;
    private final AudienceService audienceService;
    private final CampaignMetricsService metricsService;

    @Transactional(readOnly = true)
    public Prospect findById(Long id) {
        return prospectRepository.findWithCampaignById(id)
                .orElseThrow(() -> new ResourceNotFoundException("Prospect", id));
    }

    @Transactional(readOnly = true)
    public Page<Prospect> search(ProspectSearchCriteria criteria, Pageable pageable) {
        return prospectRepository.findAll(ProspectSpecifications.matching(criteria), pageable);
    }

    /**
     * Export the prospects matching the filters as CSV, newest first.
     */
    @Transactional(readOnly = true)
    public byte[] exportCsv(ProspectSearchCriteria criteria) {
        List<Prospect> prospects = prospectRepository.findAll(ProspectSpecifications.matching(criteria),
                Sort.by(Sort.Direction.DESC, "createdAt"));

        StringBuilder csv = new StringBuilder();
        csv.append("id,first_name,last_name,email,phone,company_name,job_title,source,status,")
                .append("lead_score,campaign_id,assigned_to,converted_at,created_at\n");

        for (Prospect prospect : prospects) {
            csv.append(escapeCsv(prospect.getId()))
                    .append(CSV_SEPARATOR).append(escapeCsv(prospect.getFirstName()))
                    .append(CSV_SEPARATOR).append(escapeCsv(prospect.getLastName()))
                    .append(CSV_SEPARATOR).append(escapeCsv(prospect.getEmail()))
                    .append(CSV_SEPARATOR).append(escapeCsv(prospect.getPhone()))
                    .append(CSV_SEPARATOR).append(escapeCsv(prospect.getCompanyName()))
                    .append(CSV_SEPARATOR).append(escapeCsv(prospect.getJobTitle()))
                    .append(CSV_SEPARATOR).append(prospect.getSource().name())
                    .append(CSV_SEPARATOR).append(prospect.getStatus().name())
                    .append(CSV_SEPARATOR).append(prospect.getLeadScore())
                    .append(CSV_SEPARATOR).append(escapeCsv(
                            prospect.getCampaign() != null ? prospect.getCampaign().getId() : null))
                    .append(CSV_SEPARATOR).append(escapeCsv(prospect.getAssignedTo()))
                    .append(CSV_SEPARATOR).append(formatDate(prospect.getConvertedAt()))
                    .append(CSV_SEPARATOR).append(formatDate(prospect.getCreatedAt()))
                    .append("\n");
        }

        log.info("Exported {} prospects", prospects.size());
        return csv.toString().getBytes(StandardCharsets.UTF_8);
    }

    @Transactional(readOnly = true)
    public Page<Prospect> findByCampaign(Long campaignId, Pageable pageable) {
        if (!campaignRepository.existsById(campaignId)) {
            throw new ResourceNotFoundException("Campaign", campaignId);
        }
        return prospectRepository.findByCampaignId(campaignId, pageable);
    }

    @Transactional(readOnly = true)
    public ProspectDetail getDetail(Long id) {
        Prospect prospect = findById(id);
        List<CampaignEngagement> engagements = engagementRepository.findByProspectIdWithCampaign(id);
        return new ProspectDetail(prospect, EngagementSummary.of(engagements), leadScoreTracker.getHistory(id));
    }

    @Transactional(readOnly = true)
    public List<LeadScoreHistory> getScoreHistory(Long id) {
        if (!prospectRepository.existsById(id)) {
            throw new ResourceNotFoundException("Prospect", id);
        }
        return leadScoreTracker.getHistory(id);
    }

    @Transactional
    public Prospect create(ProspectRequest request, Long actorId) {
        String email = normalizeEmail(request.email());
        String phone = normalizePhone(request.phone());

        if (findDuplicate(email, phone, null).isPresent()) {
            throw new ConflictException("Prospect with email '" + email + "' or phone '" + phone + "' already exists");
        }

        Prospect prospect = newProspect(request, email, phone, actorId);
        prospect = prospectRepository.save(prospect);

        int initialScore = request.leadScore() != null ? request.leadScore() : 0;
        leadScoreTracker.applyDelta(prospect, initialScore, LeadScoreTracker.REASON_CREATED,
                LeadScoreTracker.ACTIVITY_CREATED, ScoreContext.by(actorId));

        log.info("Prospect {} created by user {}", prospect.getId(), actorId);
        return prospect;
    }

    /**
     * Create many prospects. A bad row never aborts the batch; duplicates are
     * skipped when {@code skipDuplicates} is set and reported as failures
     * otherwise.
     */
    @Transactional
    public BulkProspectResult bulkCreate(List<ProspectRequest> requests, Long campaignId,
                                         boolean skipDuplicates, Long actorId) {
        int skipped = 0;
        int failed = 0;
        List<Long> createdIds = new ArrayList<>();
        List<BulkProspectResult.RowError> errors = new ArrayList<>();

        // Emails and phones taken earlier in this batch
        Set<String> batchEmails = new HashSet<>();
        Set<String> batchPhones = new HashSet<>();

        for (int i = 0; i < requests.size(); i++) {
            ProspectRequest request = requests.get(i);
            try {
                String email = normalizeEmail(request.email());
                String phone = normalizePhone(request.phone());

                boolean duplicate = (email != null && batchEmails.contains(email.toLowerCase(Locale.ROOT)))
                        || (phone != null && batchPhones.contains(phone))
                        || findDuplicate(email, phone, null).isPresent();
                if (duplicate) {
                    if (skipDuplicates) {
                        skipped++;
                    } else {
                        failed++;
                        errors.add(new BulkProspectResult.RowError(i, "Duplicate email or phone"));
                    }
                    continue;
                }

                ProspectRequest effective = request.campaignId() == null && campaignId != null
                        ? request.toBuilder().campaignId(campaignId).build()
                        : request;

                Prospect prospect = prospectRepository.save(newProspect(effective, email, phone, actorId));
                int initialScore = request.leadScore() != null ? request.leadScore() : 0;
                leadScoreTracker.applyDelta(prospect, initialScore, LeadScoreTracker.REASON_CREATED,
                        LeadScoreTracker.ACTIVITY_CREATED, ScoreContext.by(actorId));

                if (email != null) batchEmails.add(email.toLowerCase(Locale.ROOT));
                if (phone != null) batchPhones.add(phone);
                createdIds.add(prospect.getId());
            } catch (ApplicationException e) {
                failed++;
                errors.add(new BulkProspectResult.RowError(i, e.getMessage()));
            }
        }

        log.info("Bulk prospect import by user {}: {} created, {} skipped, {} failed",
                actorId, createdIds.size(), skipped, failed);

        return new BulkProspectResult(createdIds.size(), skipped, failed, createdIds, errors);
    }

    @Transactional
    public Prospect update(Long id, ProspectRequest request, Long actorId) {
        Prospect prospect = findById(id);

        String email = request.email() != null ? normalizeEmail(request.email()) : prospect.getEmail();
        String phone = request.phone() != null ? normalizePhone(request.phone()) : prospect.getPhone();
        if ((request.email() != null || request.phone() != null)
                && findDuplicate(email, phone, id).isPresent()) {
            throw new ConflictException("Another prospect with this email or phone already exists");
        }

        if (request.firstName() != null) {
            if (request.firstName().isBlank()) {
                throw new BusinessException("First name is required");
            }
            prospect.setFirstName(request.firstName().trim());
        }
        if (request.lastName() != null) prospect.setLastName(request.lastName());
        if (request.email() != null) prospect.setEmail(email);
        if (request.phone() != null) prospect.setPhone(phone);
        if (request.companyName() != null) prospect.setCompanyName(request.companyName());
        if (request.jobTitle() != null) prospect.setJobTitle(request.jobTitle());
        if (request.industry() != null) prospect.setIndustry(request.industry());
        if (request.description() != null) prospect.setDescription(request.description());
        if (request.notes() != null) prospect.setNotes(request.notes());
        if (request.source() != null) prospect.setSource(request.source());
        if (request.sourceDetails() != null) prospect.setSourceDetails(request.sourceDetails());
        if (request.assignedTo() != null) prospect.setAssignedTo(request.assignedTo());
        if (request.lastContactedAt() != null) prospect.setLastContactedAt(request.lastContactedAt());
        if (request.linkedinUrl() != null) prospect.setLinkedinUrl(request.linkedinUrl());
        if (request.twitterHandle() != null) prospect.setTwitterHandle(request.twitterHandle());
        if (request.website() != null) prospect.setWebsite(request.website());
        if (request.city() != null) prospect.setCity(request.city());
        if (request.state() != null) prospect.setState(request.state());
        if (request.country() != null) prospect.setCountry(request.country());
        if (request.campaignId() != null) prospect.setCampaign(findCampaign(request.campaignId()));

        prospect = prospectRepository.save(prospect);

        if (request.leadScore() != null && request.leadScore() != prospect.getLeadScore()) {
            leadScoreTracker.setScore(prospect, request.leadScore(), LeadScoreTracker.REASON_MANUAL,
                    LeadScoreTracker.ACTIVITY_MANUAL, ScoreContext.by(actorId));
        }

        ProspectStatus newStatus = request.status();
        if (newStatus != null && newStatus != prospect.getStatus()) {
            if (newStatus == ProspectStatus.CONVERTED) {
                conversionService.convert(id,
                        new ConversionOptions(AUTO_CONVERSION_NOTES, true, prospect.getAssignedTo()),
                        actorId != null ? actorId : prospect.getAssignedTo());
            } else if (prospect.isConverted()) {
                throw new InvalidStateException("Converted prospects cannot change status",
                        prospect.getStatus().name());
            } else {
                prospect.changeStatus(newStatus);
                prospect = prospectRepository.save(prospect);
            }
        }

        return prospect;
    }

    /**
     * Manual score change by a delta, clamped to 0..100.
     */
    @Transactional
    public LeadScoreHistory adjustLeadScore(Long id, int scoreChange, String reason, String notes, Long actorId) {
        Prospect prospect = findById(id);
        String effectiveReason = reason != null && !reason.isBlank() ? reason : LeadScoreTracker.REASON_MANUAL;
        return leadScoreTracker.applyDelta(prospect, scoreChange, effectiveReason,
                LeadScoreTracker.ACTIVITY_MANUAL, ScoreContext.by(actorId, notes));
    }

    /**
     * Delete an unconverted prospect with its score history and campaign
     * records. Affected campaigns are re-counted.
     */
    @Transactional
    public void delete(Long id) {
        Prospect prospect = findById(id);
        if (prospect.isConverted()) {
            throw new InvalidStateException("Converted prospects cannot be deleted", prospect.getStatus().name());
        }

        Set<Long> campaignIds = new LinkedHashSet<>();
        for (CampaignEngagement engagement : engagementRepository.findByProspectIdWithCampaign(id)) {
            campaignIds.add(engagement.getCampaign().getId());
        }

        historyRepository.deleteByProspectId(id);
        engagementRepository.deleteByProspectId(id);
        prospectRepository.delete(prospect);

        for (Long campaignId : campaignIds) {
            audienceService.refreshAudienceSize(campaignId);
            metricsService.recompute(campaignId);
        }

        log.info("Prospect {} deleted ({} campaigns affected)", id, campaignIds.size());
    }

    @Transactional(readOnly = true)
    public ProspectStatistics getStatistics(Long campaignId, Long visibleTo) {
        ProspectSearchCriteria base = ProspectSearchCriteria.builder()
                .campaignId(campaignId)
                .visibleTo(visibleTo)
                .build();

        long total = prospectRepository.count(ProspectSpecifications.matching(base));

        Map<String, Long> byStatus = new LinkedHashMap<>();
        for (ProspectStatus status : ProspectStatus.values()) {
            ProspectSearchCriteria criteria = ProspectSearchCriteria.builder()
                    .campaignId(campaignId)
                    .visibleTo(visibleTo)
                    .statuses(List.of(status))
                    .build();
            byStatus.put(status.name(), prospectRepository.count(ProspectSpecifications.matching(criteria)));
        }

        Double average = prospectRepository.averageLeadScore(campaignId, visibleTo);

        return ProspectStatistics.builder()
                .totalProspects(total)
                .byStatus(byStatus)
                .averageLeadScore(average != null ? Math.round(average * 100.0) / 100.0 : 0.0)
                .conversionRate(Campaign.rate(byStatus.get(ProspectStatus.CONVERTED.name()), total))
                .build();
    }

    private Prospect newProspect(ProspectRequest request, String email, String phone, Long actorId) {
        if (request.firstName() == null || request.firstName().isBlank()) {
            throw new BusinessException("First name is required");
        }
        if (request.status() == ProspectStatus.CONVERTED) {
            throw new BusinessException("New prospects cannot be created as converted");
        }

        Prospect prospect = Prospect.builder()
                .firstName(request.firstName().trim())
                .lastName(request.lastName())
                .email(email)
                .phone(phone)
                .companyName(request.companyName())
                .jobTitle(request.jobTitle())
                .industry(request.industry())
                .description(request.description())
                .notes(request.notes())
                .source(request.source() != null ? request.source() : ProspectSource.MANUAL_ENTRY)
                .sourceDetails(request.sourceDetails())
                .assignedTo(request.assignedTo() != null ? request.assignedTo() : actorId)
                .createdBy(actorId)
                .lastContactedAt(request.lastContactedAt())
                .linkedinUrl(request.linkedinUrl())
                .twitterHandle(request.twitterHandle())
                .website(request.website())
                .city(request.city())
                .state(request.state())
                .country(request.country())
                .build();

        if (request.status() != null) {
            prospect.changeStatus(request.status());
        }
        if (request.campaignId() != null) {
            prospect.setCampaign(findCampaign(request.campaignId()));
        }
        return prospect;
    }

    private Optional<Prospect> findDuplicate(String email, String phone, Long excludeId) {
        if (email != null) {
            Optional<Prospect> byEmail = prospectRepository.findFirstByEmailIgnoreCase(email)
                    .filter(p -> !p.getId().equals(excludeId));
            if (byEmail.isPresent()) {
                return byEmail;
            }
        }
        if (phone != null) {
            return prospectRepository.findFirstByPhone(phone)
                    .filter(p -> !p.getId().equals(excludeId));
        }
        return Optional.empty();
    }

    private Campaign findCampaign(Long campaignId) {
        return campaignRepository.findById(campaignId)
                .orElseThrow(() -> new ResourceNotFoundException("Campaign", campaignId));
    }

    // Blank values become null so the unique indexes only see real values
    private static String normalizeEmail(String email) {
        return email == null || email.isBlank() ? null : email.trim();
    }

    private static String normalizePhone(String phone) {
        return phone == null || phone.isBlank() ? null : phone.trim();
    }

    private static String escapeCsv(Object value) {
        if (value == null) return "";
        String str = value.toString();
        if (str.contains(",") || str.contains("\"") || str.contains("\n") || str.contains("\r")) {
            return "\"" + str.replace("\"", "\"\"") + "\"";
        }
        return str;
    }

    private static String formatDate(LocalDateTime dateTime) {
        return dateTime != null ? dateTime.format(DATE_FORMATTER) : "";
    }
}
