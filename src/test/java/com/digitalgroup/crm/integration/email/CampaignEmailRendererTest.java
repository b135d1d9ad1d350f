package com.digitalgroup.crm.integration.email;

import com.digitalgroup.crm.domain.campaign.entity.Campaign;
import com.digitalgroup.crm.domain.template.entity.EmailTemplate;
import com.digitalgroup.crm.domain.template.service.TemplateMergeService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.test.util.ReflectionTestUtils;
import org.thymeleaf.TemplateEngine;
import org.thymeleaf.templatemode.TemplateMode;
import org.thymeleaf.templateresolver.ClassLoaderTemplateResolver;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class CampaignEmailRendererTest {

    private CampaignEmailRenderer renderer;
    private EmailTemplate template;

    @BeforeEach
    void setUp() {
        ClassLoaderTemplateResolver resolver = new ClassLoaderTemplateResolver();
        resolver.setPrefix("templates/");
        resolver.setSuffix(".html");
        resolver.setTemplateMode(TemplateMode.HTML);
        resolver.setCharacterEncoding("UTF-8");

        TemplateEngine engine = new TemplateEngine();
        engine.setTemplateResolver(resolver);

        renderer = new CampaignEmailRenderer(new TemplateMergeService(), engine);
        ReflectionTestUtils.setField(renderer, "defaultFromEmail", "noreply@crm.local");
        ReflectionTestUtils.setField(renderer, "defaultFromName", "CRM System");

        template = EmailTemplate.builder()
                .id(3L)
                .name("Welcome")
                .subject("Welcome {{first_name}}")
                .content("<p>Hello {{first_name}} at {{company}}</p>")
                .build();
    }

    @Test
    void render_UsesTemplateSubjectAndDefaultSender() {
        Campaign campaign = Campaign.builder().id(1L).name("Spring Launch").ownerId(10L).build();

        RenderedEmail email = renderer.render(campaign, template,
                Map.of("first_name", "Ana", "company", "Acme"), false);

        assertEquals("Welcome Ana", email.subject());
        assertEquals("noreply@crm.local", email.fromEmail());
        assertEquals("CRM System", email.fromName());
        assertTrue(email.html().contains("<p>Hello Ana at Acme</p>"));
        assertFalse(email.html().contains("This is a test message"));
    }

    @Test
    void render_CampaignOverridesSubjectAndSender() {
        Campaign campaign = Campaign.builder()
                .id(1L)
                .name("Spring Launch")
                .ownerId(10L)
                .emailSubject("{{first_name}}, last chance")
                .emailFromEmail("sales@acme.com")
                .emailFromName("Acme Sales")
                .build();

        RenderedEmail email = renderer.render(campaign, template, Map.of("first_name", "Ana"), false);

        assertEquals("Ana, last chance", email.subject());
        assertEquals("sales@acme.com", email.fromEmail());
        assertEquals("Acme Sales", email.fromName());
        assertTrue(email.html().contains("Acme Sales"));
    }

    @Test
    void render_TestMessage_PrefixesSubjectAndShowsBanner() {
        Campaign campaign = Campaign.builder().id(1L).name("Spring Launch").ownerId(10L).build();

        RenderedEmail email = renderer.render(campaign, template, Map.of("first_name", "Ana"), true);

        assertEquals("[TEST] Welcome Ana", email.subject());
        assertTrue(email.html().contains("This is a test message"));
        assertTrue(email.html().contains("Spring Launch"));
    }
}
