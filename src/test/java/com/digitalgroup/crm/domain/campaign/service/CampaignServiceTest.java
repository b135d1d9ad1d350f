package com.digitalgroup.crm.domain.campaign.service;

import com.digitalgroup.crm.domain.campaign.dto.CampaignRequest;
import com.digitalgroup.crm.domain.campaign.dto.LinkDealRequest;
import com.digitalgroup.crm.domain.campaign.entity.Campaign;
import com.digitalgroup.crm.domain.campaign.entity.CampaignEngagement;
import com.digitalgroup.crm.domain.campaign.enums.CampaignStatus;
import com.digitalgroup.crm.domain.campaign.enums.CampaignType;
import com.digitalgroup.crm.domain.campaign.repository.CampaignEngagementRepository;
import com.digitalgroup.crm.domain.campaign.repository.CampaignMetricRepository;
import com.digitalgroup.crm.domain.campaign.repository.CampaignRepository;
import com.digitalgroup.crm.domain.deal.entity.Deal;
import com.digitalgroup.crm.domain.deal.repository.DealRepository;
import com.digitalgroup.crm.domain.prospect.entity.Prospect;
import com.digitalgroup.crm.domain.prospect.repository.ProspectRepository;
import com.digitalgroup.crm.domain.template.repository.EmailTemplateRepository;
import com.digitalgroup.crm.exception.BusinessException;
import com.digitalgroup.crm.exception.InvalidStateException;
import com.digitalgroup.crm.exception.ResourceNotFoundException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.Optional;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class CampaignServiceTest {

    @Mock
    private CampaignRepository campaignRepository;

    @Mock
    private CampaignEngagementRepository engagementRepository;

    @Mock
    private CampaignMetricRepository metricRepository;

    @Mock
    private EmailTemplateRepository emailTemplateRepository;

    @Mock
    private ProspectRepository prospectRepository;

    @Mock
    private DealRepository dealRepository;

    @Mock
    private EngagementTracker engagementTracker;

    @Mock
    private CampaignMetricsService metricsService;

    @InjectMocks
    private CampaignService campaignService;

    private Campaign campaign;

    @BeforeEach
    void setUp() {
        campaign = Campaign.builder()
                .id(1L)
                .name("Spring Launch")
                .type(CampaignType.EMAIL)
                .status(CampaignStatus.ACTIVE)
                .ownerId(10L)
                .build();
    }

    @Test
    void create_DefaultsOwnerToActorAndStartsAsDraft() {
        when(campaignRepository.save(any(Campaign.class))).thenAnswer(inv -> inv.getArgument(0));

        Campaign created = campaignService.create(CampaignRequest.builder()
                .name("  Autumn Promo ")
                .budget(new BigDecimal("1000"))
                .tags(Set.of("promo"))
                .build(), 10L);

        assertEquals("Autumn Promo", created.getName());
        assertEquals(CampaignStatus.DRAFT, created.getStatus());
        assertEquals(CampaignType.EMAIL, created.getType());
        assertEquals(10L, created.getOwnerId());
        assertEquals(10L, created.getCreatedBy());
        assertEquals(Set.of("promo"), created.getTags());
    }

    @Test
    void create_BlankName_ThrowsBusinessException() {
        assertThrows(BusinessException.class,
                () -> campaignService.create(CampaignRequest.builder().name(" ").build(), 10L));
        verify(campaignRepository, never()).save(any());
    }

    @Test
    void create_NegativeBudget_ThrowsBusinessException() {
        CampaignRequest request = CampaignRequest.builder().name("Promo").budget(new BigDecimal("-1")).build();

        assertThrows(BusinessException.class, () -> campaignService.create(request, 10L));
    }

    @Test
    void create_EndBeforeStart_ThrowsBusinessException() {
        LocalDateTime start = LocalDateTime.of(2024, 5, 10, 9, 0);
        CampaignRequest request = CampaignRequest.builder()
                .name("Promo").startDate(start).endDate(start.minusDays(1)).build();

        assertThrows(BusinessException.class, () -> campaignService.create(request, 10L));
    }

    @Test
    void create_UnknownTemplate_ThrowsNotFound() {
        when(emailTemplateRepository.findById(50L)).thenReturn(Optional.empty());
        CampaignRequest request = CampaignRequest.builder().name("Promo").emailTemplateId(50L).build();

        assertThrows(ResourceNotFoundException.class, () -> campaignService.create(request, 10L));
    }

    @Test
    void update_NullFieldsLeaveValuesUnchanged() {
        campaign.setDescription("Original");
        when(campaignRepository.findWithTemplateById(1L)).thenReturn(Optional.of(campaign));
        when(campaignRepository.save(any(Campaign.class))).thenAnswer(inv -> inv.getArgument(0));

        Campaign updated = campaignService.update(1L, CampaignRequest.builder().category("spring").build());

        assertEquals("Spring Launch", updated.getName());
        assertEquals("Original", updated.getDescription());
        assertEquals("spring", updated.getCategory());
    }

    @Test
    void pause_ActiveCampaign_Pauses() {
        when(campaignRepository.findWithTemplateById(1L)).thenReturn(Optional.of(campaign));
        when(campaignRepository.save(campaign)).thenReturn(campaign);

        assertEquals(CampaignStatus.PAUSED, campaignService.pause(1L).getStatus());
    }

    @Test
    void resume_ActiveCampaign_ThrowsInvalidState() {
        when(campaignRepository.findWithTemplateById(1L)).thenReturn(Optional.of(campaign));

        InvalidStateException ex = assertThrows(InvalidStateException.class, () -> campaignService.resume(1L));
        assertEquals("ACTIVE", ex.getCurrentState());
    }

    @Test
    void complete_PausedCampaign_StampsEndDate() {
        campaign.setStatus(CampaignStatus.PAUSED);
        when(campaignRepository.findWithTemplateById(1L)).thenReturn(Optional.of(campaign));
        when(campaignRepository.save(campaign)).thenReturn(campaign);

        Campaign completed = campaignService.complete(1L);

        assertEquals(CampaignStatus.COMPLETED, completed.getStatus());
        assertNotNull(completed.getActualEndDate());
    }

    @Test
    void cancel_CompletedCampaign_ThrowsInvalidState() {
        campaign.setStatus(CampaignStatus.COMPLETED);
        when(campaignRepository.findWithTemplateById(1L)).thenReturn(Optional.of(campaign));

        assertThrows(InvalidStateException.class, () -> campaignService.cancel(1L));
    }

    @Test
    void unschedule_ScheduledCampaign_ReturnsToDraftKeepingStartDate() {
        LocalDateTime start = LocalDateTime.of(2026, 11, 2, 9, 0);
        campaign.setStatus(CampaignStatus.SCHEDULED);
        campaign.setStartDate(start);
        when(campaignRepository.findWithTemplateById(1L)).thenReturn(Optional.of(campaign));
        when(campaignRepository.save(campaign)).thenReturn(campaign);

        Campaign draft = campaignService.unschedule(1L);

        assertEquals(CampaignStatus.DRAFT, draft.getStatus());
        assertEquals(start, draft.getStartDate());
    }

    @Test
    void unschedule_ActiveCampaign_ThrowsInvalidState() {
        when(campaignRepository.findWithTemplateById(1L)).thenReturn(Optional.of(campaign));

        assertThrows(InvalidStateException.class, () -> campaignService.unschedule(1L));
        verify(campaignRepository, never()).save(any());
    }

    @Test
    void requireExecutable_PausedCampaign_ThrowsInvalidState() {
        campaign.setStatus(CampaignStatus.PAUSED);
        when(campaignRepository.findWithTemplateById(1L)).thenReturn(Optional.of(campaign));

        assertThrows(InvalidStateException.class, () -> campaignService.requireExecutable(1L));
    }

    @Test
    void delete_RemovesChildrenBeforeCampaign() {
        when(campaignRepository.findById(1L)).thenReturn(Optional.of(campaign));

        campaignService.delete(1L);

        InOrder order = inOrder(metricRepository, engagementRepository, prospectRepository, campaignRepository);
        order.verify(metricRepository).deleteByCampaignId(1L);
        order.verify(engagementRepository).deleteByCampaignId(1L);
        order.verify(prospectRepository).detachFromCampaign(1L);
        order.verify(campaignRepository).delete(campaign);
    }

    @Test
    void linkDeal_DefaultsValueToDealValueAndRecomputes() {
        Prospect prospect = Prospect.builder().id(7L).firstName("Luis").build();
        CampaignEngagement engagement = CampaignEngagement.forProspect(campaign, prospect, null);
        Deal deal = Deal.builder().id(3L).name("Enterprise").value(new BigDecimal("2500.00")).build();

        when(campaignRepository.findWithTemplateById(1L)).thenReturn(Optional.of(campaign));
        when(dealRepository.findById(3L)).thenReturn(Optional.of(deal));
        when(engagementRepository.findByCampaignIdAndProspectId(1L, 7L)).thenReturn(Optional.of(engagement));
        when(engagementTracker.markConverted(engagement, deal, new BigDecimal("2500.00"))).thenReturn(engagement);

        campaignService.linkDeal(1L, new LinkDealRequest(7L, null, 3L, null));

        verify(engagementTracker).markConverted(engagement, deal, new BigDecimal("2500.00"));
        verify(metricsService).recompute(1L);
    }

    @Test
    void linkDeal_BothRecipients_ThrowsBusinessException() {
        when(campaignRepository.findWithTemplateById(1L)).thenReturn(Optional.of(campaign));

        assertThrows(BusinessException.class,
                () -> campaignService.linkDeal(1L, new LinkDealRequest(7L, 5L, 3L, null)));
        verifyNoInteractions(dealRepository);
    }

    @Test
    void linkDeal_NegativeValue_ThrowsBusinessException() {
        Deal deal = Deal.builder().id(3L).name("Enterprise").build();
        CampaignEngagement engagement = CampaignEngagement.forProspect(campaign,
                Prospect.builder().id(7L).firstName("Luis").build(), null);

        when(campaignRepository.findWithTemplateById(1L)).thenReturn(Optional.of(campaign));
        when(dealRepository.findById(3L)).thenReturn(Optional.of(deal));
        when(engagementRepository.findByCampaignIdAndProspectId(1L, 7L)).thenReturn(Optional.of(engagement));

        assertThrows(BusinessException.class,
                () -> campaignService.linkDeal(1L, new LinkDealRequest(7L, null, 3L, new BigDecimal("-5"))));
        verify(engagementTracker, never()).markConverted(any(), any(), any());
    }

    @Test
    void linkDeal_RecipientNotInAudience_ThrowsNotFound() {
        when(campaignRepository.findWithTemplateById(1L)).thenReturn(Optional.of(campaign));
        when(dealRepository.findById(3L)).thenReturn(Optional.of(Deal.builder().id(3L).name("D").build()));
        when(engagementRepository.findByCampaignIdAndContactId(eq(1L), eq(5L))).thenReturn(Optional.empty());

        assertThrows(ResourceNotFoundException.class,
                () -> campaignService.linkDeal(1L, new LinkDealRequest(null, 5L, 3L, null)));
    }
}
