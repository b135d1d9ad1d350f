package com.digitalgroup.crm.domain.campaign.service;

import com.digitalgroup.crm.domain.campaign.dto.AudienceAddResult;
import com.digitalgroup.crm.domain.campaign.dto.BulkAddResult;
import com.digitalgroup.crm.domain.campaign.entity.Campaign;
import com.digitalgroup.crm.domain.campaign.entity.CampaignEngagement;
import com.digitalgroup.crm.domain.campaign.enums.EngagementStatus;
import com.digitalgroup.crm.domain.campaign.repository.CampaignEngagementRepository;
import com.digitalgroup.crm.domain.campaign.repository.CampaignRepository;
import com.digitalgroup.crm.domain.contact.entity.Contact;
import com.digitalgroup.crm.domain.contact.repository.ContactRepository;
import com.digitalgroup.crm.domain.prospect.entity.Prospect;
import com.digitalgroup.crm.domain.prospect.repository.ProspectRepository;
import com.digitalgroup.crm.exception.BusinessException;
import com.digitalgroup.crm.exception.ResourceNotFoundException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.nio.charset.StandardCharsets;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Audience Service
 * Manages which contacts and prospects belong to a campaign. Adding a
 * recipient twice returns the existing engagement record untouched.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AudienceService {

    private static final String CSV_SEPARATOR = ",";
    private static final DateTimeFormatter DATE_FORMATTER = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private final CampaignRepository campaignRepository;
    private final CampaignEngagementRepository engagementRepository;
    private final ContactRepository contactRepository;
    private final ProspectRepository prospectRepository;

    @Transactional
    public AudienceAddResult addContact(Long campaignId, Long contactId, String sendTo) {
        Campaign campaign = findCampaign(campaignId);
        Contact contact = contactRepository.findById(contactId)
                .orElseThrow(() -> new ResourceNotFoundException("Contact", contactId));

        AudienceAddResult result = addContact(campaign, contact, sendTo);
        refreshAudienceSize(campaign);
        return result;
    }

    @Transactional
    public AudienceAddResult addProspect(Long campaignId, Long prospectId, String sendTo) {
        Campaign campaign = findCampaign(campaignId);
        Prospect prospect = prospectRepository.findById(prospectId)
                .orElseThrow(() -> new ResourceNotFoundException("Prospect", prospectId));

        AudienceAddResult result = addProspect(campaign, prospect, sendTo);
        refreshAudienceSize(campaign);
        return result;
    }

    /**
     * Add many contacts; duplicates (repeats within the batch included) are
     * skipped and unknown ids counted,
     * neither fails the batch.
     */
    @Transactional
    public BulkAddResult bulkAddContacts(Long campaignId, Collection<Long> contactIds) {
        Campaign campaign = findCampaign(campaignId);
        int added = 0;
        int skipped = 0;
        int notFound = 0;

        Map<Long, Boolean> seen = new HashMap<>();
        for (Long contactId : idsOf(contactIds)) {
            Boolean known = seen.get(contactId);
            if (known != null) {
                if (known) skipped++;
                else notFound++;
                continue;
            }
            Optional<Contact> contact = contactRepository.findById(contactId);
            seen.put(contactId, contact.isPresent());
            if (contact.isEmpty()) {
                notFound++;
                continue;
            }
            if (addContact(campaign, contact.get(), null).created()) {
                added++;
            } else {
                skipped++;
            }
        }

        refreshAudienceSize(campaign);
        log.info("Campaign {}: added {} contacts ({} skipped, {} not found)", campaignId, added, skipped, notFound);

        return new BulkAddResult(added, skipped, notFound, sizeOf(contactIds));
    }

    @Transactional
    public BulkAddResult bulkAddProspects(Long campaignId, Collection<Long> prospectIds) {
        Campaign campaign = findCampaign(campaignId);
        int added = 0;
        int skipped = 0;
        int notFound = 0;

        Map<Long, Boolean> seen = new HashMap<>();
        for (Long prospectId : idsOf(prospectIds)) {
            Boolean known = seen.get(prospectId);
            if (known != null) {
                if (known) skipped++;
                else notFound++;
                continue;
            }
            Optional<Prospect> prospect = prospectRepository.findById(prospectId);
            seen.put(prospectId, prospect.isPresent());
            if (prospect.isEmpty()) {
                notFound++;
                continue;
            }
            if (addProspect(campaign, prospect.get(), null).created()) {
                added++;
            } else {
                skipped++;
            }
        }

        refreshAudienceSize(campaign);
        log.info("Campaign {}: added {} prospects ({} skipped, {} not found)", campaignId, added, skipped, notFound);

        return new BulkAddResult(added, skipped, notFound, sizeOf(prospectIds));
    }

    @Transactional
    public void remove(Long campaignId, Long engagementId) {
        Campaign campaign = findCampaign(campaignId);
        CampaignEngagement engagement = engagementRepository.findById(engagementId)
                .orElseThrow(() -> new ResourceNotFoundException("CampaignEngagement", engagementId));

        if (!engagement.belongsTo(campaignId)) {
            throw new BusinessException("Audience member does not belong to this campaign");
        }

        engagementRepository.delete(engagement);
        refreshAudienceSize(campaign);

        log.info("Removed engagement {} from campaign {}", engagementId, campaignId);
    }

    @Transactional(readOnly = true)
    public Page<CampaignEngagement> listAudience(Long campaignId, Collection<EngagementStatus> statuses,
                                                 Pageable pageable) {
        findCampaign(campaignId);
        if (statuses == null || statuses.isEmpty()) {
            return engagementRepository.findAudience(campaignId, pageable);
        }
        return engagementRepository.findAudienceByStatusIn(campaignId, statuses, pageable);
    }

    /**
     * Export the audience with engagement columns as CSV.
     */
    @Transactional(readOnly = true)
    public byte[] exportAudienceCsv(Long campaignId) {
        findCampaign(campaignId);
        List<CampaignEngagement> audience = engagementRepository.findAllWithRecipients(campaignId);

        StringBuilder csv = new StringBuilder();
        csv.append("engagement_id,recipient_type,recipient_id,name,email,company,status,")
                .append("sent_at,opened_at,clicked_at,open_count,click_count,engagement_score,error_message\n");

        for (CampaignEngagement engagement : audience) {
            csv.append(escapeCsv(engagement.getId()))
                    .append(CSV_SEPARATOR).append(escapeCsv(engagement.getRecipientType()))
                    .append(CSV_SEPARATOR).append(escapeCsv(engagement.getRecipientId()))
                    .append(CSV_SEPARATOR).append(escapeCsv(recipientName(engagement)))
                    .append(CSV_SEPARATOR).append(escapeCsv(engagement.getEmailSentTo()))
                    .append(CSV_SEPARATOR).append(escapeCsv(recipientCompany(engagement)))
                    .append(CSV_SEPARATOR).append(escapeCsv(engagement.getStatus().name()))
                    .append(CSV_SEPARATOR).append(formatDate(engagement.getSentAt()))
                    .append(CSV_SEPARATOR).append(formatDate(engagement.getOpenedAt()))
                    .append(CSV_SEPARATOR).append(formatDate(engagement.getClickedAt()))
                    .append(CSV_SEPARATOR).append(engagement.getOpenCount())
                    .append(CSV_SEPARATOR).append(engagement.getClickCount())
                    .append(CSV_SEPARATOR).append(engagement.getEngagementScore())
                    .append(CSV_SEPARATOR).append(escapeCsv(engagement.getErrorMessage()))
                    .append("\n");
        }

        log.info("Exported {} audience members for campaign {}", audience.size(), campaignId);
        return csv.toString().getBytes(StandardCharsets.UTF_8);
    }

    /**
     * Re-sync the stored audience size after records were removed elsewhere.
     */
    @Transactional
    public void refreshAudienceSize(Long campaignId) {
        refreshAudienceSize(findCampaign(campaignId));
    }

    public static String recipientName(CampaignEngagement engagement) {
        return engagement.isContactRecipient()
                ? engagement.getContact().getFullName()
                : engagement.getProspect().getFullName();
    }

    public static String recipientCompany(CampaignEngagement engagement) {
        if (engagement.isContactRecipient()) {
            return engagement.getContact().getCompany() != null ? engagement.getContact().getCompany().getName() : null;
        }
        return engagement.getProspect().getCompanyName();
    }

    private AudienceAddResult addContact(Campaign campaign, Contact contact, String sendTo) {
        Optional<CampaignEngagement> existing =
                engagementRepository.findByCampaignIdAndContactId(campaign.getId(), contact.getId());
        if (existing.isPresent()) {
            return new AudienceAddResult(existing.get(), false);
        }
        CampaignEngagement created = engagementRepository.save(
                CampaignEngagement.forContact(campaign, contact, sendTo));
        return new AudienceAddResult(created, true);
    }

    private AudienceAddResult addProspect(Campaign campaign, Prospect prospect, String sendTo) {
        Optional<CampaignEngagement> existing =
                engagementRepository.findByCampaignIdAndProspectId(campaign.getId(), prospect.getId());
        if (existing.isPresent()) {
            return new AudienceAddResult(existing.get(), false);
        }
        CampaignEngagement created = engagementRepository.save(
                CampaignEngagement.forProspect(campaign, prospect, sendTo));
        return new AudienceAddResult(created, true);
    }

    // Always the live record count, never adjusted incrementally
    private void refreshAudienceSize(Campaign campaign) {
        campaign.setTargetAudienceSize((int) engagementRepository.countByCampaignId(campaign.getId()));
        campaignRepository.save(campaign);
    }

    private Campaign findCampaign(Long campaignId) {
        return campaignRepository.findById(campaignId)
                .orElseThrow(() -> new ResourceNotFoundException("Campaign", campaignId));
    }

    // A repeated id counts once per occurrence against the totals
    private static Collection<Long> idsOf(Collection<Long> ids) {
        return ids == null ? List.of() : ids;
    }

    private static int sizeOf(Collection<Long> ids) {
        return ids == null ? 0 : ids.size();
    }

    private String escapeCsv(Object value) {
        if (value == null) return "";
        String str = value.toString();
        if (str.contains(",") || str.contains("\"") || str.contains("\n") || str.contains("\r")) {
            return "\"" + str.replace("\"", "\"\"") + "\"";
        }
        return str;
    }

    private String formatDate(LocalDateTime dateTime) {
        if (dateTime == null) return "";
        return dateTime.format(DATE_FORMATTER);
    }
}
