package com.digitalgroup.crm.domain.campaign.service;

import com.digitalgroup.crm.domain.campaign.dto.ExecuteOptions;
import com.digitalgroup.crm.domain.campaign.dto.ExecutionResult;
import com.digitalgroup.crm.domain.campaign.entity.Campaign;
import com.digitalgroup.crm.domain.campaign.entity.CampaignEngagement;
import com.digitalgroup.crm.domain.campaign.enums.BounceType;
import com.digitalgroup.crm.domain.campaign.enums.EngagementStatus;
import com.digitalgroup.crm.domain.campaign.repository.CampaignEngagementRepository;
import com.digitalgroup.crm.domain.company.entity.Company;
import com.digitalgroup.crm.domain.contact.entity.Contact;
import com.digitalgroup.crm.domain.prospect.entity.Prospect;
import com.digitalgroup.crm.domain.template.entity.EmailTemplate;
import com.digitalgroup.crm.exception.BusinessException;
import com.digitalgroup.crm.integration.email.CampaignEmailRenderer;
import com.digitalgroup.crm.integration.email.CampaignMailer;
import com.digitalgroup.crm.integration.email.MailResult;
import com.digitalgroup.crm.integration.email.RenderedEmail;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Campaign Executor
 * Sends a campaign to its pending audience one recipient at a time.
 *
 * The send loop runs outside a transaction. Every engagement update is
 * committed by {@link EngagementTracker} as it happens, so a run that stops
 * part way leaves the recipients already processed marked.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CampaignExecutor {

    private static final DateTimeFormatter CURRENT_DATE_FORMAT =
            DateTimeFormatter.ofPattern("MMMM dd, yyyy", Locale.ENGLISH);

    private final CampaignService campaignService;
    private final CampaignEngagementRepository engagementRepository;
    private final EngagementTracker engagementTracker;
    private final CampaignMetricsService metricsService;
    private final CampaignEmailRenderer emailRenderer;
    private final CampaignMailer campaignMailer;

    @Value("${app.campaigns.send-delay-ms:100}")
    private long sendDelayMs;

    /**
     * Run a campaign: send a test, schedule it, or send to every pending
     * audience member.
     */
    public ExecutionResult execute(Long campaignId, ExecuteOptions options, Long actorId) {
        Campaign campaign = campaignService.requireExecutable(campaignId);
        requireTemplate(campaign);

        List<CampaignEngagement> pending =
                engagementRepository.findWithRecipientsByStatus(campaignId, EngagementStatus.PENDING);
        if (pending.isEmpty()) {
            throw new BusinessException("No audience to send to. Add contacts or prospects first");
        }

        ExecuteOptions effective = options != null ? options : ExecuteOptions.now();

        if (effective.sendTestEmail()) {
            return sendTest(campaign, effective.testEmails());
        }

        if (effective.scheduleFor() != null) {
            campaignService.schedule(campaignId, effective.scheduleFor());
            return ExecutionResult.builder()
                    .campaignId(campaignId)
                    .status(ExecutionResult.Status.SCHEDULED)
                    .attempted(pending.size())
                    .scheduledFor(effective.scheduleFor())
                    .message("Campaign scheduled for " + effective.scheduleFor())
                    .build();
        }

        log.info("Executing campaign {} '{}' for {} recipients (user {})",
                campaignId, campaign.getName(), pending.size(), actorId);

        SendTally tally = sendAll(campaign, pending);
        metricsService.recompute(campaignId);
        campaignService.markExecuted(campaignId, LocalDateTime.now());

        log.info("Campaign {} executed: {}/{} sent, {} failed, {} skipped",
                campaignId, tally.sent, pending.size(), tally.failed, tally.skipped);

        return tally.toResult(campaignId, ExecutionResult.Status.EXECUTED, pending.size(),
                "Campaign executed: " + tally.sent + " of " + pending.size() + " messages sent");
    }

    /**
     * Send to audience members added since the last run. Does not change
     * the campaign status.
     */
    public ExecutionResult sendToPending(Long campaignId, Long actorId) {
        Campaign campaign = campaignService.requireExecutable(campaignId);

        List<CampaignEngagement> pending =
                engagementRepository.findWithRecipientsByStatus(campaignId, EngagementStatus.PENDING);
        if (pending.isEmpty()) {
            return ExecutionResult.builder()
                    .campaignId(campaignId)
                    .status(ExecutionResult.Status.NO_PENDING)
                    .message("No pending recipients")
                    .build();
        }
        requireTemplate(campaign);

        log.info("Sending campaign {} to {} pending recipients (user {})", campaignId, pending.size(), actorId);

        SendTally tally = sendAll(campaign, pending);
        metricsService.recompute(campaignId);

        return tally.toResult(campaignId, ExecutionResult.Status.SENT, pending.size(),
                tally.sent + " of " + pending.size() + " pending messages sent");
    }

    /**
     * Reset one audience member and send to it again.
     */
    public ExecutionResult resendToMember(Long campaignId, Long engagementId, Long actorId) {
        Campaign campaign = campaignService.requireExecutable(campaignId);
        CampaignEngagement engagement = engagementTracker.getForCampaign(campaignId, engagementId);
        requireTemplate(campaign);

        engagementTracker.resetForResend(engagement);
        log.info("Resending campaign {} to engagement {} (user {})", campaignId, engagementId, actorId);

        SendTally tally = sendAll(campaign, List.of(engagement));
        metricsService.recompute(campaignId);

        ExecutionResult.Status status = tally.sent > 0 ? ExecutionResult.Status.RESENT : ExecutionResult.Status.FAILED;
        String message = tally.sent > 0 ? "Message resent"
                : tally.skipped > 0 ? "Recipient has no email address" : "Resend failed";

        return tally.toResult(campaignId, status, 1, message);
    }

    private ExecutionResult sendTest(Campaign campaign, List<String> testEmails) {
        if (testEmails == null || testEmails.isEmpty()) {
            throw new BusinessException("No test recipients provided");
        }
        if (!campaign.getType().isEmail()) {
            throw new BusinessException("Test messages are only available for email campaigns");
        }

        RenderedEmail email = emailRenderer.render(campaign, campaign.getEmailTemplate(), sampleFields(), true);

        int sent = 0;
        int failed = 0;
        for (String address : testEmails) {
            MailResult result = campaignMailer.send(address, email.subject(), email.html(),
                    email.fromEmail(), email.fromName());
            if (result.success()) {
                sent++;
            } else {
                failed++;
                log.warn("Test message for campaign {} to {} failed: {}", campaign.getId(), address, result.message());
            }
        }

        return ExecutionResult.builder()
                .campaignId(campaign.getId())
                .status(ExecutionResult.Status.TEST_SENT)
                .attempted(testEmails.size())
                .sent(sent)
                .failed(failed)
                .testRecipients(List.copyOf(testEmails))
                .message("Test email sent to " + sent + " of " + testEmails.size() + " recipients")
                .build();
    }

    private SendTally sendAll(Campaign campaign, List<CampaignEngagement> recipients) {
        SendTally tally = new SendTally();
        boolean email = campaign.getType().isEmail();

        for (int i = 0; i < recipients.size(); i++) {
            CampaignEngagement engagement = recipients.get(i);

            if (!email) {
                engagementTracker.markSent(engagement, null, null, null);
                tally.sent++;
                continue;
            }

            String address = resolveAddress(engagement);
            if (address == null) {
                tally.skipped++;
                log.debug("Engagement {} has no email address, skipping", engagement.getId());
                continue;
            }

            sendOne(campaign, engagement, address, tally);

            if (i < recipients.size() - 1 && !pause()) {
                log.warn("Campaign {} send loop interrupted after {} recipients", campaign.getId(), i + 1);
                break;
            }
        }
        return tally;
    }

    private void sendOne(Campaign campaign, CampaignEngagement engagement, String address, SendTally tally) {
        try {
            RenderedEmail email = emailRenderer.render(campaign, campaign.getEmailTemplate(),
                    mergeFields(engagement), false);
            MailResult result = campaignMailer.send(address, email.subject(), email.html(),
                    email.fromEmail(), email.fromName());

            if (result.success()) {
                engagementTracker.markSent(engagement, address, email.subject(), result.messageId());
                tally.sent++;
            } else {
                engagementTracker.markBounced(engagement, BounceType.HARD, result.message());
                tally.failed++;
                log.warn("Campaign {} message to {} failed: {}", campaign.getId(), address, result.message());
            }
        } catch (RuntimeException e) {
            engagementTracker.markBounced(engagement, BounceType.HARD, e.getMessage());
            tally.failed++;
            log.error("Campaign {} message to {} failed: {}", campaign.getId(), address, e.getMessage(), e);
        }
    }

    Map<String, String> mergeFields(CampaignEngagement engagement) {
        Map<String, String> fields = new HashMap<>();
        if (engagement.isContactRecipient()) {
            Contact contact = engagement.getContact();
            fields.put("first_name", nullToEmpty(contact.getFirstName()));
            fields.put("last_name", nullToEmpty(contact.getLastName()));
            fields.put("full_name", contact.getFullName());
            fields.put("email", nullToEmpty(contact.getEmail()));
            fields.put("phone", nullToEmpty(contact.getPhone()));
            fields.put("position", nullToEmpty(contact.getPosition()));
            Company company = contact.getCompany();
            fields.put("company_name", company != null ? nullToEmpty(company.getName()) : "");
            fields.put("company_address", company != null ? nullToEmpty(company.getAddress()) : "");
            fields.put("company_phone", company != null ? nullToEmpty(company.getPhone()) : "");
        } else {
            Prospect prospect = engagement.getProspect();
            fields.put("first_name", nullToEmpty(prospect.getFirstName()));
            fields.put("last_name", nullToEmpty(prospect.getLastName()));
            fields.put("full_name", prospect.getFullName());
            fields.put("email", nullToEmpty(prospect.getEmail()));
            fields.put("phone", nullToEmpty(prospect.getPhone()));
            fields.put("position", nullToEmpty(prospect.getJobTitle()));
            fields.put("company_name", nullToEmpty(prospect.getCompanyName()));
            fields.put("company_address", "");
            fields.put("company_phone", "");
        }
        fields.put("current_date", LocalDate.now().format(CURRENT_DATE_FORMAT));
        return fields;
    }

    private Map<String, String> sampleFields() {
        Map<String, String> fields = new HashMap<>();
        fields.put("first_name", "John");
        fields.put("last_name", "Doe");
        fields.put("full_name", "John Doe");
        fields.put("email", "john.doe@example.com");
        fields.put("phone", "+1 555 0100");
        fields.put("position", "Manager");
        fields.put("company_name", "Example Corp");
        fields.put("company_address", "123 Main Street");
        fields.put("company_phone", "+1 555 0199");
        fields.put("current_date", LocalDate.now().format(CURRENT_DATE_FORMAT));
        return fields;
    }

    private static String resolveAddress(CampaignEngagement engagement) {
        String address = engagement.getEmailSentTo();
        if (address == null || address.isBlank()) {
            address = engagement.isContactRecipient()
                    ? engagement.getContact().getEmail()
                    : engagement.getProspect().getEmail();
        }
        return address == null || address.isBlank() ? null : address.trim();
    }

    private void requireTemplate(Campaign campaign) {
        if (campaign.getType().isEmail() && campaign.getEmailTemplate() == null) {
            throw new BusinessException("Email campaigns require an email template");
        }
    }

    // Fixed delay between messages to stay under transport rate limits
    private boolean pause() {
        if (sendDelayMs <= 0) {
            return true;
        }
        try {
            Thread.sleep(sendDelayMs);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private static String nullToEmpty(String value) {
        return value != null ? value : "";
    }

    private static final class SendTally {
        private int sent;
        private int failed;
        private int skipped;

        private ExecutionResult toResult(Long campaignId, ExecutionResult.Status status, int attempted, String message) {
            return ExecutionResult.builder()
                    .campaignId(campaignId)
                    .status(status)
                    .attempted(attempted)
                    .sent(sent)
                    .failed(failed)
                    .skipped(skipped)
                    .message(message)
                    .build();
        }
    }
}
