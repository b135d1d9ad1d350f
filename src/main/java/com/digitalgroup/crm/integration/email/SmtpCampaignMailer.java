package com.digitalgroup.crm.integration.email;

import jakarta.mail.internet.MimeMessage;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.mail.javamail.JavaMailSender;
import org.springframework.mail.javamail.MimeMessageHelper;
import org.springframework.stereotype.Service;

@Slf4j
@Service
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "spring.mail", name = "host")
public class SmtpCampaignMailer implements CampaignMailer {

    private final JavaMailSender mailSender;

    @Override
    public MailResult send(String to, String subject, String htmlBody, String fromEmail, String fromName) {
        try {
            MimeMessage message = mailSender.createMimeMessage();
            MimeMessageHelper helper = new MimeMessageHelper(message, true, "UTF-8");

            helper.setFrom(fromEmail, fromName);
            helper.setTo(to);
            helper.setSubject(subject);
            helper.setText(htmlBody, true);

            mailSender.send(message);

            String messageId = message.getMessageID();
            log.info("Campaign email sent to {} ({})", to, messageId);
            return MailResult.sent(messageId);

        } catch (Exception e) {
            log.error("Failed to send campaign email to {}: {}", to, e.getMessage());
            return MailResult.failed(e.getMessage());
        }
    }
}
