package com.digitalgroup.crm.domain.prospect.service;

import com.digitalgroup.crm.domain.activity.entity.Activity;
import com.digitalgroup.crm.domain.activity.repository.ActivityRepository;
import com.digitalgroup.crm.domain.campaign.entity.CampaignEngagement;
import com.digitalgroup.crm.domain.campaign.repository.CampaignEngagementRepository;
import com.digitalgroup.crm.domain.company.repository.CompanyRepository;
import com.digitalgroup.crm.domain.contact.entity.Contact;
import com.digitalgroup.crm.domain.contact.repository.ContactRepository;
import com.digitalgroup.crm.domain.prospect.dto.ConversionOptions;
import com.digitalgroup.crm.domain.prospect.dto.ConversionResult;
import com.digitalgroup.crm.domain.prospect.entity.Prospect;
import com.digitalgroup.crm.domain.prospect.repository.ProspectRepository;
import com.digitalgroup.crm.exception.ConflictException;
import com.digitalgroup.crm.exception.ResourceNotFoundException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Prospect Conversion Service
 * Turns a prospect into a contact in one transaction: creates the contact,
 * marks the prospect converted, logs an activity and moves the prospect's
 * campaign engagement records over to the contact.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ProspectConversionService {

    static final String ACTIVITY_SUBJECT = "Prospect converted to contact";

    private final ProspectRepository prospectRepository;
    private final ContactRepository contactRepository;
    private final CompanyRepository companyRepository;
    private final ActivityRepository activityRepository;
    private final CampaignEngagementRepository engagementRepository;

    @Transactional
    public ConversionResult convert(Long prospectId, ConversionOptions options, Long actorId) {
        ConversionOptions opts = options != null ? options : ConversionOptions.defaults();

        Prospect prospect = prospectRepository.findWithCampaignById(prospectId)
                .orElseThrow(() -> new ResourceNotFoundException("Prospect", prospectId));

        if (prospect.isConverted()) {
            throw new ConflictException("Prospect has already been converted to a contact");
        }
        if (prospect.getEmail() != null && contactRepository.existsByEmailIgnoreCase(prospect.getEmail())) {
            throw new ConflictException("Contact with email '" + prospect.getEmail() + "' already exists");
        }

        Contact contact = Contact.builder()
                .firstName(prospect.getFirstName())
                .lastName(prospect.getLastName())
                .email(prospect.getEmail())
                .phone(prospect.getPhone())
                .mobile(prospect.getPhone())
                .position(prospect.getJobTitle())
                .notes("Converted from prospect. Original notes: "
                        + (prospect.getNotes() != null ? prospect.getNotes() : "None"))
                .status(Contact.STATUS_LEAD)
                .ownerId(firstNonNull(opts.assignTo(), prospect.getAssignedTo(), actorId))
                .createdBy(actorId)
                .build();

        // Existing companies only, matched by exact name ignoring case
        if (prospect.getCompanyName() != null && !prospect.getCompanyName().isBlank()) {
            companyRepository.findFirstByNameIgnoreCase(prospect.getCompanyName().trim())
                    .ifPresent(contact::setCompany);
        }

        contact = contactRepository.save(contact);

        prospect.markConverted(contact, LocalDateTime.now());
        prospectRepository.save(prospect);

        Long activityId = null;
        if (opts.createActivity()) {
            Activity activity = Activity.builder()
                    .type(Activity.TYPE_NOTE)
                    .subject(ACTIVITY_SUBJECT)
                    .description(activityDescription(prospect, opts.notes()))
                    .contact(contact)
                    .userId(actorId)
                    .build();
            activityId = activityRepository.save(activity).getId();
        }

        List<CampaignEngagement> engagements = engagementRepository.findByProspectId(prospectId);
        for (CampaignEngagement engagement : engagements) {
            engagement.relinkToContact(contact);
        }
        engagementRepository.saveAll(engagements);

        log.info("Prospect {} converted to contact {} by user {} ({} campaign records moved)",
                prospectId, contact.getId(), actorId, engagements.size());

        return new ConversionResult(prospectId, contact.getId(), activityId);
    }

    private static String activityDescription(Prospect prospect, String notes) {
        String campaignName = prospect.getCampaign() != null ? prospect.getCampaign().getName() : "N/A";
        return ("Prospect " + prospect.getFullName() + " was converted to a contact. "
                + "Campaign source: " + campaignName + ". "
                + (notes != null ? notes : "")).trim();
    }

    private static Long firstNonNull(Long... values) {
        for (Long value : values) {
            if (value != null) {
                return value;
            }
        }
        return null;
    }
}
