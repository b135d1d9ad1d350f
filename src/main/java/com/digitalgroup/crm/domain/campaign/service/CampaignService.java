package com.digitalgroup.crm.domain.campaign.service;

import com.digitalgroup.crm.domain.campaign.dto.CampaignRequest;
import com.digitalgroup.crm.domain.campaign.dto.CampaignSearchCriteria;
import com.digitalgroup.crm.domain.campaign.dto.LinkDealRequest;
import com.digitalgroup.crm.domain.campaign.entity.Campaign;
import com.digitalgroup.crm.domain.campaign.entity.CampaignEngagement;
import com.digitalgroup.crm.domain.campaign.enums.CampaignStatus;
import com.digitalgroup.crm.domain.campaign.enums.CampaignType;
import com.digitalgroup.crm.domain.campaign.repository.CampaignEngagementRepository;
import com.digitalgroup.crm.domain.campaign.repository.CampaignMetricRepository;
import com.digitalgroup.crm.domain.campaign.repository.CampaignRepository;
import com.digitalgroup.crm.domain.campaign.repository.CampaignSpecifications;
import com.digitalgroup.crm.domain.deal.entity.Deal;
import com.digitalgroup.crm.domain.deal.repository.DealRepository;
import com.digitalgroup.crm.domain.prospect.repository.ProspectRepository;
import com.digitalgroup.crm.domain.template.entity.EmailTemplate;
import com.digitalgroup.crm.domain.template.repository.EmailTemplateRepository;
import com.digitalgroup.crm.exception.BusinessException;
import com.digitalgroup.crm.exception.InvalidStateException;
import com.digitalgroup.crm.exception.ResourceNotFoundException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.HashMap;
import java.util.HashSet;

/**
 * Campaign Service
 * Campaign CRUD, lifecycle transitions and deal attribution
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CampaignService {

    private final CampaignRepository campaignRepository;
    private final CampaignEngagementRepository engagementRepository;
    private final CampaignMetricRepository metricRepository;
    private final EmailTemplateRepository emailTemplateRepository;
    private final ProspectRepository prospectRepository;
    private final DealRepository dealRepository;
    private final EngagementTracker engagementTracker;
    private final CampaignMetricsService metricsService;

    @Transactional(readOnly = true)
    public Campaign findById(Long id) {
        return campaignRepository.findWithTemplateById(id)
                .orElseThrow(() -> new ResourceNotFoundException("Campaign", id));
    }

    @Transactional(readOnly = true)
    public Page<Campaign> search(CampaignSearchCriteria criteria, Pageable pageable) {
        return campaignRepository.findAll(CampaignSpecifications.matching(criteria), pageable);
    }

    @Transactional
    public Campaign create(CampaignRequest request, Long actorId) {
        if (request.name() == null || request.name().isBlank()) {
            throw new BusinessException("Campaign name is required");
        }

        Campaign campaign = Campaign.builder()
                .name(request.name().trim())
                .type(request.type() != null ? request.type() : CampaignType.EMAIL)
                .status(CampaignStatus.DRAFT)
                .ownerId(request.ownerId() != null ? request.ownerId() : actorId)
                .createdBy(actorId)
                .build();

        applyRequest(campaign, request);
        validateDates(campaign);

        campaign = campaignRepository.save(campaign);
        log.info("Campaign {} '{}' created by user {}", campaign.getId(), campaign.getName(), actorId);

        return campaign;
    }

    @Transactional
    public Campaign update(Long id, CampaignRequest request) {
        Campaign campaign = findById(id);

        if (request.name() != null) {
            if (request.name().isBlank()) {
                throw new BusinessException("Campaign name is required");
            }
            campaign.setName(request.name().trim());
        }
        if (request.type() != null) campaign.setType(request.type());
        if (request.ownerId() != null) campaign.setOwnerId(request.ownerId());

        applyRequest(campaign, request);
        validateDates(campaign);

        return campaignRepository.save(campaign);
    }

    /**
     * Delete a campaign with its audience and snapshots. Prospects it
     * generated are kept and lose the link.
     */
    @Transactional
    public void delete(Long id) {
        Campaign campaign = campaignRepository.findById(id)
                .orElseThrow(() -> new ResourceNotFoundException("Campaign", id));

        metricRepository.deleteByCampaignId(id);
        int engagements = engagementRepository.deleteByCampaignId(id);
        prospectRepository.detachFromCampaign(id);
        campaignRepository.delete(campaign);

        log.info("Campaign {} deleted with {} audience records", id, engagements);
    }

    // Lifecycle

    @Transactional
    public Campaign pause(Long id) {
        Campaign campaign = findById(id);
        requireStatus(campaign, "paused", CampaignStatus.ACTIVE);
        campaign.setStatus(CampaignStatus.PAUSED);
        log.info("Campaign {} paused", id);
        return campaignRepository.save(campaign);
    }

    @Transactional
    public Campaign resume(Long id) {
        Campaign campaign = findById(id);
        requireStatus(campaign, "resumed", CampaignStatus.PAUSED);
        campaign.setStatus(CampaignStatus.ACTIVE);
        log.info("Campaign {} resumed", id);
        return campaignRepository.save(campaign);
    }

    @Transactional
    public Campaign complete(Long id) {
        Campaign campaign = findById(id);
        requireStatus(campaign, "completed", CampaignStatus.ACTIVE, CampaignStatus.PAUSED);
        campaign.setStatus(CampaignStatus.COMPLETED);
        campaign.setActualEndDate(LocalDateTime.now());
        log.info("Campaign {} completed", id);
        return campaignRepository.save(campaign);
    }

    @Transactional
    public Campaign cancel(Long id) {
        Campaign campaign = findById(id);
        if (campaign.getStatus().isTerminal()) {
            throw new InvalidStateException("Campaign cannot be cancelled", campaign.getStatus().name());
        }
        campaign.setStatus(CampaignStatus.CANCELLED);
        campaign.setActualEndDate(LocalDateTime.now());
        log.info("Campaign {} cancelled", id);
        return campaignRepository.save(campaign);
    }

    /**
     * Verify a campaign may send. Returns it with the template loaded.
     */
    @Transactional(readOnly = true)
    public Campaign requireExecutable(Long id) {
        Campaign campaign = findById(id);
        if (!campaign.getStatus().isExecutable()) {
            throw new InvalidStateException("Campaign cannot be executed in its current state",
                    campaign.getStatus().name());
        }
        return campaign;
    }

    @Transactional
    public Campaign markExecuted(Long id, LocalDateTime when) {
        Campaign campaign = findById(id);
        campaign.markExecuted(when);
        return campaignRepository.save(campaign);
    }

    @Transactional
    public Campaign schedule(Long id, LocalDateTime when) {
        Campaign campaign = findById(id);
        campaign.scheduleFor(when);
        log.info("Campaign {} scheduled for {}", id, when);
        return campaignRepository.save(campaign);
    }

    /**
     * Return a SCHEDULED campaign to DRAFT so it stops being picked up
     * as due. The start date is kept for the owner to fix and reschedule.
     */
    @Transactional
    public Campaign unschedule(Long id) {
        Campaign campaign = findById(id);
        requireStatus(campaign, "unscheduled", CampaignStatus.SCHEDULED);
        campaign.setStatus(CampaignStatus.DRAFT);
        log.info("Campaign {} returned to draft", id);
        return campaignRepository.save(campaign);
    }

    /**
     * Record a deal won from one audience member and refresh the campaign's
     * revenue.
     */
    @Transactional
    public CampaignEngagement linkDeal(Long campaignId, LinkDealRequest request) {
        findById(campaignId);

        if ((request.prospectId() == null) == (request.contactId() == null)) {
            throw new BusinessException("Exactly one of prospect_id or contact_id is required");
        }
        if (request.dealId() == null) {
            throw new BusinessException("deal_id is required");
        }

        Deal deal = dealRepository.findById(request.dealId())
                .orElseThrow(() -> new ResourceNotFoundException("Deal", request.dealId()));

        CampaignEngagement engagement = (request.prospectId() != null
                ? engagementRepository.findByCampaignIdAndProspectId(campaignId, request.prospectId())
                : engagementRepository.findByCampaignIdAndContactId(campaignId, request.contactId()))
                .orElseThrow(() -> new ResourceNotFoundException("CampaignEngagement",
                        request.prospectId() != null ? "prospect " + request.prospectId()
                                : "contact " + request.contactId()));

        BigDecimal value = request.value() != null ? request.value() : deal.getValue();
        if (value != null && value.signum() < 0) {
            throw new BusinessException("Conversion value cannot be negative");
        }

        engagement = engagementTracker.markConverted(engagement, deal, value);
        metricsService.recompute(campaignId);

        log.info("Deal {} linked to campaign {} engagement {} (value {})",
                deal.getId(), campaignId, engagement.getId(), value);

        return engagement;
    }

    private void applyRequest(Campaign campaign, CampaignRequest request) {
        if (request.description() != null) campaign.setDescription(request.description());
        if (request.startDate() != null) campaign.setStartDate(request.startDate());
        if (request.endDate() != null) campaign.setEndDate(request.endDate());
        if (request.budget() != null) campaign.setBudget(nonNegative(request.budget(), "Budget"));
        if (request.actualCost() != null) campaign.setActualCost(nonNegative(request.actualCost(), "Actual cost"));
        if (request.expectedRevenue() != null) campaign.setExpectedRevenue(request.expectedRevenue());
        if (request.targetResponseRate() != null) campaign.setTargetResponseRate(request.targetResponseRate());
        if (request.targetConversionRate() != null) campaign.setTargetConversionRate(request.targetConversionRate());
        if (request.emailSubject() != null) campaign.setEmailSubject(request.emailSubject());
        if (request.emailFromName() != null) campaign.setEmailFromName(request.emailFromName());
        if (request.emailFromEmail() != null) campaign.setEmailFromEmail(request.emailFromEmail());
        if (request.audienceFilters() != null) campaign.setAudienceFilters(new HashMap<>(request.audienceFilters()));
        if (request.automated() != null) campaign.setAutomated(request.automated());
        if (request.automationConfig() != null) campaign.setAutomationConfig(new HashMap<>(request.automationConfig()));
        if (request.tags() != null) campaign.setTags(new HashSet<>(request.tags()));
        if (request.category() != null) campaign.setCategory(request.category());
        if (request.notes() != null) campaign.setNotes(request.notes());

        if (request.emailTemplateId() != null) {
            EmailTemplate template = emailTemplateRepository.findById(request.emailTemplateId())
                    .orElseThrow(() -> new ResourceNotFoundException("EmailTemplate", request.emailTemplateId()));
            campaign.setEmailTemplate(template);
        }
    }

    private void validateDates(Campaign campaign) {
        if (campaign.getStartDate() != null && campaign.getEndDate() != null
                && campaign.getEndDate().isBefore(campaign.getStartDate())) {
            throw new BusinessException("End date must be after start date");
        }
    }

    private static BigDecimal nonNegative(BigDecimal value, String field) {
        if (value.signum() < 0) {
            throw new BusinessException(field + " cannot be negative");
        }
        return value;
    }

    private static void requireStatus(Campaign campaign, String action, CampaignStatus... allowed) {
        for (CampaignStatus status : allowed) {
            if (campaign.getStatus() == status) {
                return;
            }
        }
        throw new InvalidStateException("Campaign cannot be " + action + " from status " + campaign.getStatus(),
                campaign.getStatus().name());
    }
}
