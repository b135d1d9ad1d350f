package com.digitalgroup.crm.integration.email;

import com.digitalgroup.crm.domain.campaign.entity.Campaign;
import com.digitalgroup.crm.domain.template.entity.EmailTemplate;
import com.digitalgroup.crm.domain.template.service.TemplateMergeService;
import lombok.RequiredArgsConstructor;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.thymeleaf.TemplateEngine;
import org.thymeleaf.context.Context;

import java.util.Map;

/**
 * Campaign Email Renderer
 * Merges recipient fields into the template's subject and body, then wraps
 * the body in the email/campaign layout.
 */
@Service
@RequiredArgsConstructor
public class CampaignEmailRenderer {

    static final String LAYOUT = "email/campaign";
    static final String TEST_PREFIX = "[TEST] ";

    private final TemplateMergeService mergeService;
    private final TemplateEngine templateEngine;

    @Value("${app.campaigns.default-from-email:noreply@crm.local}")
    private String defaultFromEmail;

    @Value("${app.campaigns.default-from-name:CRM System}")
    private String defaultFromName;

    public RenderedEmail render(Campaign campaign, EmailTemplate template,
                                Map<String, String> fields, boolean testMessage) {
        String subjectSource = hasText(campaign.getEmailSubject())
                ? campaign.getEmailSubject()
                : template.getSubject();

        String subject = mergeService.merge(subjectSource, fields);
        if (testMessage) {
            subject = TEST_PREFIX + subject;
        }

        String fromEmail = hasText(campaign.getEmailFromEmail()) ? campaign.getEmailFromEmail() : defaultFromEmail;
        String fromName = hasText(campaign.getEmailFromName()) ? campaign.getEmailFromName() : defaultFromName;

        Context context = new Context();
        context.setVariable("subject", subject);
        context.setVariable("body", mergeService.merge(template.getContent(), fields));
        context.setVariable("testMessage", testMessage);
        context.setVariable("campaignName", campaign.getName());
        context.setVariable("fromName", fromName);

        String html = templateEngine.process(LAYOUT, context);

        return new RenderedEmail(subject, html, fromEmail, fromName);
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}
