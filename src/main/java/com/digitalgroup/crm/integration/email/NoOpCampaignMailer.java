package com.digitalgroup.crm.integration.email;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.stereotype.Service;

/**
 * Fallback used when no SMTP server is configured. Every send is reported
 * as failed so recipients end up bounced instead of silently marked sent.
 */
@Slf4j
@Service
@ConditionalOnMissingBean(value = CampaignMailer.class, ignored = NoOpCampaignMailer.class)
public class NoOpCampaignMailer implements CampaignMailer {

    @Override
    public MailResult send(String to, String subject, String htmlBody, String fromEmail, String fromName) {
        log.warn("Email sending is disabled. Would have sent '{}' to {}", subject, to);
        return MailResult.failed("Email transport is not configured");
    }
}
