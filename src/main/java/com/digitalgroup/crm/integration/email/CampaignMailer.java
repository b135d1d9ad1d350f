package com.digitalgroup.crm.integration.email;

public interface CampaignMailer {

    /**
     * Sends an HTML email.
     * @param to recipient address
     * @param subject subject line
     * @param htmlBody rendered HTML body
     * @param fromEmail sender address
     * @param fromName sender display name
     * @return the transport outcome, never null
     */
    MailResult send(String to, String subject, String htmlBody, String fromEmail, String fromName);
}
