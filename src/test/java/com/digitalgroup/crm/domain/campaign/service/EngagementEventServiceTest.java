package com.digitalgroup.crm.domain.campaign.service;

import com.digitalgroup.crm.domain.campaign.dto.EngagementEvent;
import com.digitalgroup.crm.domain.campaign.entity.Campaign;
import com.digitalgroup.crm.domain.campaign.entity.CampaignEngagement;
import com.digitalgroup.crm.domain.campaign.enums.BounceType;
import com.digitalgroup.crm.domain.campaign.enums.EngagementEventType;
import com.digitalgroup.crm.domain.contact.entity.Contact;
import com.digitalgroup.crm.domain.prospect.dto.ScoreContext;
import com.digitalgroup.crm.domain.prospect.entity.LeadScoreHistory;
import com.digitalgroup.crm.domain.prospect.entity.Prospect;
import com.digitalgroup.crm.domain.prospect.service.LeadScoreTracker;
import com.digitalgroup.crm.exception.BusinessException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class EngagementEventServiceTest {

    @Mock
    private EngagementTracker engagementTracker;

    @Mock
    private LeadScoreTracker leadScoreTracker;

    @Mock
    private CampaignMetricsService metricsService;

    @InjectMocks
    private EngagementEventService engagementEventService;

    private Campaign campaign;
    private Prospect prospect;

    @BeforeEach
    void setUp() {
        campaign = Campaign.builder().id(1L).name("Spring Launch").ownerId(10L).build();
        prospect = Prospect.builder().id(7L).firstName("Luis").email("luis@example.com").build();
    }

    @Test
    void recordEvent_ClickOnProspect_AppliesLeadScoreDelta() {
        CampaignEngagement engagement = CampaignEngagement.forProspect(campaign, prospect, null);
        engagement.setId(100L);
        engagement.markSent(null, "Hello", "msg-1");
        when(engagementTracker.getForCampaign(1L, 100L)).thenReturn(engagement);
        when(engagementTracker.markClicked(engagement)).thenAnswer(inv -> {
            CampaignEngagement e = inv.getArgument(0);
            e.markClicked();
            return e;
        });
        when(leadScoreTracker.applyDelta(eq(prospect), eq(10), eq("Link clicked"), eq("link_click"),
                any(ScoreContext.class)))
                .thenReturn(LeadScoreHistory.builder().oldScore(0).newScore(10).scoreChange(10).build());

        CampaignEngagement result = engagementEventService.recordEvent(1L, 100L,
                EngagementEvent.of(EngagementEventType.CLICKED), 10L);

        assertEquals(10, result.getLeadScoreChange());
        assertEquals(1, result.getClickCount());

        ArgumentCaptor<ScoreContext> context = ArgumentCaptor.forClass(ScoreContext.class);
        verify(leadScoreTracker).applyDelta(eq(prospect), eq(10), any(), any(), context.capture());
        assertSame(campaign, context.getValue().campaign());
        assertSame(engagement, context.getValue().engagement());
        assertEquals(10L, context.getValue().changedBy());
        verify(metricsService).recompute(1L);
    }

    @Test
    void recordEvent_OpenOnContact_DoesNotTouchLeadScore() {
        Contact contact = Contact.builder().id(5L).firstName("Ana").email("ana@example.com").build();
        CampaignEngagement engagement = CampaignEngagement.forContact(campaign, contact, null);
        when(engagementTracker.getForCampaign(1L, 100L)).thenReturn(engagement);
        when(engagementTracker.markOpened(engagement)).thenReturn(engagement);

        engagementEventService.recordEvent(1L, 100L, EngagementEvent.of(EngagementEventType.OPENED), 10L);

        verifyNoInteractions(leadScoreTracker);
        verify(metricsService).recompute(1L);
    }

    @Test
    void recordEvent_Bounce_PassesTypeAndMessageWithoutScoring() {
        CampaignEngagement engagement = CampaignEngagement.forProspect(campaign, prospect, null);
        when(engagementTracker.getForCampaign(1L, 100L)).thenReturn(engagement);
        when(engagementTracker.markBounced(engagement, BounceType.SOFT, "Mailbox full")).thenReturn(engagement);

        engagementEventService.recordEvent(1L, 100L,
                new EngagementEvent(EngagementEventType.BOUNCED, BounceType.SOFT, "Mailbox full"), 10L);

        verify(engagementTracker).markBounced(engagement, BounceType.SOFT, "Mailbox full");
        verify(leadScoreTracker, never()).applyDelta(any(), anyInt(), any(), any(), any());
    }

    @Test
    void recordEvent_UnsubscribeOnProspect_RecordsClampedChange() {
        CampaignEngagement engagement = CampaignEngagement.forProspect(campaign, prospect, null);
        when(engagementTracker.getForCampaign(1L, 100L)).thenReturn(engagement);
        when(engagementTracker.markUnsubscribed(engagement)).thenReturn(engagement);
        when(leadScoreTracker.applyDelta(eq(prospect), eq(-10), any(), any(), any(ScoreContext.class)))
                .thenReturn(LeadScoreHistory.builder().oldScore(4).newScore(0).scoreChange(-4).build());

        CampaignEngagement result = engagementEventService.recordEvent(1L, 100L,
                EngagementEvent.of(EngagementEventType.UNSUBSCRIBED), 10L);

        assertEquals(-4, result.getLeadScoreChange());
    }

    @Test
    void recordEvent_MissingType_ThrowsBusinessException() {
        assertThrows(BusinessException.class,
                () -> engagementEventService.recordEvent(1L, 100L, new EngagementEvent(null, null, null), 10L));
        verifyNoInteractions(engagementTracker, metricsService);
    }
}
