package com.digitalgroup.crm.domain.campaign.entity;

import com.digitalgroup.crm.domain.campaign.enums.BounceType;
import com.digitalgroup.crm.domain.campaign.enums.EngagementStatus;
import com.digitalgroup.crm.domain.contact.entity.Contact;
import com.digitalgroup.crm.domain.deal.entity.Deal;
import com.digitalgroup.crm.domain.prospect.entity.Prospect;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.test.util.ReflectionTestUtils;

import java.math.BigDecimal;
import java.time.LocalDateTime;

import static org.junit.jupiter.api.Assertions.*;

class CampaignEngagementTest {

    private Campaign campaign;
    private Contact contact;

    @BeforeEach
    void setUp() {
        campaign = Campaign.builder().id(1L).name("Spring Launch").ownerId(10L).build();
        contact = Contact.builder().id(5L).firstName("Ana").lastName("Diaz").email("ana@example.com").build();
    }

    @Test
    void forContact_DefaultsAddressToContactEmail() {
        CampaignEngagement engagement = CampaignEngagement.forContact(campaign, contact, null);

        assertEquals(EngagementStatus.PENDING, engagement.getStatus());
        assertEquals("ana@example.com", engagement.getEmailSentTo());
        assertEquals("contact", engagement.getRecipientType());
        assertEquals(5L, engagement.getRecipientId());
        assertTrue(engagement.belongsTo(1L));
        assertFalse(engagement.belongsTo(2L));
    }

    @Test
    void forProspect_OverrideAddressWins() {
        Prospect prospect = Prospect.builder().id(7L).firstName("Luis").email("luis@example.com").build();

        CampaignEngagement engagement = CampaignEngagement.forProspect(campaign, prospect, "other@example.com");

        assertEquals("other@example.com", engagement.getEmailSentTo());
        assertEquals("prospect", engagement.getRecipientType());
        assertEquals(7L, engagement.getRecipientId());
    }

    @Test
    void forContact_NullRecipient_Throws() {
        assertThrows(IllegalArgumentException.class, () -> CampaignEngagement.forContact(campaign, null, null));
        assertThrows(IllegalArgumentException.class, () -> CampaignEngagement.forProspect(null,
                Prospect.builder().firstName("X").build(), null));
    }

    @Test
    void validateRecipient_SingleRecipient_Passes() {
        CampaignEngagement engagement = CampaignEngagement.forContact(campaign, contact, null);
        engagement.relinkToContact(contact);
        assertDoesNotThrow(engagement::validateRecipient);
    }

    @Test
    void validateRecipient_NoRecipient_Throws() {
        CampaignEngagement engagement = new CampaignEngagement();
        ReflectionTestUtils.setField(engagement, "campaign", campaign);

        assertThrows(IllegalStateException.class, engagement::validateRecipient);
    }

    @Test
    void validateRecipient_BothRecipients_Throws() {
        CampaignEngagement engagement = CampaignEngagement.forContact(campaign, contact, null);
        ReflectionTestUtils.setField(engagement, "prospect", Prospect.builder().id(7L).firstName("Luis").build());

        assertThrows(IllegalStateException.class, engagement::validateRecipient);
    }

    @Test
    void markOpenedAndClicked_BeforeSend_AreRejected() {
        CampaignEngagement engagement = CampaignEngagement.forContact(campaign, contact, null);

        assertThrows(IllegalStateException.class, engagement::markOpened);
        assertThrows(IllegalStateException.class, engagement::markClicked);
        assertEquals(EngagementStatus.PENDING, engagement.getStatus());
        assertNull(engagement.getOpenedAt());
        assertNull(engagement.getClickedAt());
        assertEquals(0, engagement.getOpenCount());
    }

    @Test
    void progression_NeverMovesBackwards() {
        CampaignEngagement engagement = CampaignEngagement.forContact(campaign, contact, null);

        engagement.markSent("ana@example.com", "Hello", "msg-1");
        engagement.markClicked();
        engagement.markOpened();
        engagement.markDelivered();

        assertEquals(EngagementStatus.CLICKED, engagement.getStatus());
        assertNotNull(engagement.getSentAt());
        assertNotNull(engagement.getDeliveredAt());
        assertNotNull(engagement.getOpenedAt());
        assertEquals(1, engagement.getOpenCount());
        assertEquals(1, engagement.getClickCount());
    }

    @Test
    void markOpened_RepeatedEvents_KeepFirstTimestampAndCount() {
        CampaignEngagement engagement = CampaignEngagement.forContact(campaign, contact, null);
        engagement.markSent(null, "Hello", null);

        engagement.markOpened();
        LocalDateTime firstOpen = engagement.getOpenedAt();
        engagement.markOpened();
        engagement.markOpened();

        assertEquals(firstOpen, engagement.getOpenedAt());
        assertEquals(3, engagement.getOpenCount());
        assertEquals("ana@example.com", engagement.getEmailSentTo());
    }

    @Test
    void markBounced_IsSideStateAndTruncatesError() {
        CampaignEngagement engagement = CampaignEngagement.forContact(campaign, contact, null);
        String longError = "x".repeat(CampaignEngagement.MAX_ERROR_LENGTH + 50);

        engagement.markBounced(null, longError);
        engagement.markOpened();

        assertEquals(EngagementStatus.BOUNCED, engagement.getStatus());
        assertEquals(BounceType.HARD, engagement.getBounceType());
        assertEquals(CampaignEngagement.MAX_ERROR_LENGTH, engagement.getErrorMessage().length());
        assertNotNull(engagement.getOpenedAt());
    }

    @Test
    void markResponded_OverridesUnsubscribed() {
        CampaignEngagement engagement = CampaignEngagement.forContact(campaign, contact, null);
        engagement.markUnsubscribed();

        engagement.markResponded();

        assertEquals(EngagementStatus.RESPONDED, engagement.getStatus());
        assertNotNull(engagement.getUnsubscribedAt());
    }

    @Test
    void engagementScore_WeightsEachStage() {
        CampaignEngagement engagement = CampaignEngagement.forContact(campaign, contact, null);
        engagement.markSent(null, null, null);
        engagement.markDelivered();
        engagement.markOpened();
        engagement.markClicked();
        engagement.markResponded();
        assertEquals(11, engagement.getEngagementScore());

        engagement.markConverted(Deal.builder().id(3L).name("Deal").build(), new BigDecimal("500.00"));
        assertEquals(21, engagement.getEngagementScore());
        assertEquals(EngagementStatus.CONVERTED, engagement.getStatus());
    }

    @Test
    void resetForResend_ClearsLifecycleButKeepsAddress() {
        CampaignEngagement engagement = CampaignEngagement.forContact(campaign, contact, "ana@work.com");
        engagement.markSent(null, "Hello", "msg-1");
        engagement.markOpened();
        engagement.markBounced(BounceType.SOFT, "Mailbox full");

        engagement.resetForResend();

        assertEquals(EngagementStatus.PENDING, engagement.getStatus());
        assertNull(engagement.getSentAt());
        assertNull(engagement.getOpenedAt());
        assertNull(engagement.getBouncedAt());
        assertNull(engagement.getBounceType());
        assertNull(engagement.getErrorMessage());
        assertEquals(0, engagement.getOpenCount());
        assertEquals("ana@work.com", engagement.getEmailSentTo());
    }

    @Test
    void relinkToContact_ReplacesProspect() {
        Prospect prospect = Prospect.builder().id(7L).firstName("Luis").build();
        CampaignEngagement engagement = CampaignEngagement.forProspect(campaign, prospect, null);

        engagement.relinkToContact(contact);

        assertTrue(engagement.isContactRecipient());
        assertNull(engagement.getProspect());
        assertEquals(5L, engagement.getRecipientId());
    }
}
