package com.digitalgroup.crm.domain.campaign.service;

import com.digitalgroup.crm.domain.campaign.dto.AudienceAddResult;
import com.digitalgroup.crm.domain.campaign.dto.BulkAddResult;
import com.digitalgroup.crm.domain.campaign.entity.Campaign;
import com.digitalgroup.crm.domain.campaign.entity.CampaignEngagement;
import com.digitalgroup.crm.domain.campaign.repository.CampaignEngagementRepository;
import com.digitalgroup.crm.domain.campaign.repository.CampaignRepository;
import com.digitalgroup.crm.domain.company.entity.Company;
import com.digitalgroup.crm.domain.contact.entity.Contact;
import com.digitalgroup.crm.domain.contact.repository.ContactRepository;
import com.digitalgroup.crm.domain.prospect.entity.Prospect;
import com.digitalgroup.crm.domain.prospect.repository.ProspectRepository;
import com.digitalgroup.crm.exception.BusinessException;
import com.digitalgroup.crm.exception.ResourceNotFoundException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class AudienceServiceTest {

    @Mock
    private CampaignRepository campaignRepository;

    @Mock
    private CampaignEngagementRepository engagementRepository;

    @Mock
    private ContactRepository contactRepository;

    @Mock
    private ProspectRepository prospectRepository;

    @InjectMocks
    private AudienceService audienceService;

    private Campaign campaign;
    private Contact contact;

    @BeforeEach
    void setUp() {
        campaign = Campaign.builder().id(1L).name("Spring Launch").ownerId(10L).build();
        contact = Contact.builder().id(5L).firstName("Ana").lastName("Diaz").email("ana@example.com").build();
    }

    @Test
    void addContact_New_CreatesRecordAndRefreshesSize() {
        when(campaignRepository.findById(1L)).thenReturn(Optional.of(campaign));
        when(contactRepository.findById(5L)).thenReturn(Optional.of(contact));
        when(engagementRepository.findByCampaignIdAndContactId(1L, 5L)).thenReturn(Optional.empty());
        when(engagementRepository.save(any(CampaignEngagement.class))).thenAnswer(inv -> inv.getArgument(0));
        when(engagementRepository.countByCampaignId(1L)).thenReturn(1L);

        AudienceAddResult result = audienceService.addContact(1L, 5L, null);

        assertTrue(result.created());
        assertEquals("ana@example.com", result.engagement().getEmailSentTo());
        assertEquals(1, campaign.getTargetAudienceSize());
        verify(campaignRepository).save(campaign);
    }

    @Test
    void addContact_AlreadyPresent_ReturnsExistingUntouched() {
        CampaignEngagement existing = CampaignEngagement.forContact(campaign, contact, "old@example.com");
        existing.setId(20L);
        when(campaignRepository.findById(1L)).thenReturn(Optional.of(campaign));
        when(contactRepository.findById(5L)).thenReturn(Optional.of(contact));
        when(engagementRepository.findByCampaignIdAndContactId(1L, 5L)).thenReturn(Optional.of(existing));
        when(engagementRepository.countByCampaignId(1L)).thenReturn(1L);

        AudienceAddResult result = audienceService.addContact(1L, 5L, "new@example.com");

        assertFalse(result.created());
        assertSame(existing, result.engagement());
        assertEquals("old@example.com", existing.getEmailSentTo());
        verify(engagementRepository, never()).save(any());
    }

    @Test
    void addProspect_UnknownProspect_ThrowsNotFound() {
        when(campaignRepository.findById(1L)).thenReturn(Optional.of(campaign));
        when(prospectRepository.findById(99L)).thenReturn(Optional.empty());

        assertThrows(ResourceNotFoundException.class, () -> audienceService.addProspect(1L, 99L, null));
    }

    @Test
    void addContact_UnknownCampaign_ThrowsNotFound() {
        when(campaignRepository.findById(99L)).thenReturn(Optional.empty());

        assertThrows(ResourceNotFoundException.class, () -> audienceService.addContact(99L, 5L, null));
        verifyNoInteractions(contactRepository);
    }

    @Test
    void bulkAddContacts_CountsAddedSkippedAndMissing() {
        Contact second = Contact.builder().id(6L).firstName("Bea").email("bea@example.com").build();
        CampaignEngagement existing = CampaignEngagement.forContact(campaign, second, null);

        when(campaignRepository.findById(1L)).thenReturn(Optional.of(campaign));
        when(contactRepository.findById(5L)).thenReturn(Optional.of(contact));
        when(contactRepository.findById(6L)).thenReturn(Optional.of(second));
        when(contactRepository.findById(7L)).thenReturn(Optional.empty());
        when(engagementRepository.findByCampaignIdAndContactId(1L, 5L)).thenReturn(Optional.empty());
        when(engagementRepository.findByCampaignIdAndContactId(1L, 6L)).thenReturn(Optional.of(existing));
        when(engagementRepository.save(any(CampaignEngagement.class))).thenAnswer(inv -> inv.getArgument(0));
        when(engagementRepository.countByCampaignId(1L)).thenReturn(2L);

        BulkAddResult result = audienceService.bulkAddContacts(1L, List.of(5L, 6L, 7L, 5L));

        assertEquals(1, result.added());
        assertEquals(2, result.skipped());
        assertEquals(1, result.notFound());
        assertEquals(4, result.totalRequested());
        assertEquals(result.totalRequested(), result.added() + result.skipped() + result.notFound());
        assertEquals(2, campaign.getTargetAudienceSize());
        verify(contactRepository, times(1)).findById(5L);
    }

    @Test
    void bulkAddProspects_RepeatedIds_EachOccurrenceCounted() {
        Prospect prospect = Prospect.builder().id(8L).firstName("Luis").email("luis@example.com").build();
        when(campaignRepository.findById(1L)).thenReturn(Optional.of(campaign));
        when(prospectRepository.findById(8L)).thenReturn(Optional.of(prospect));
        when(prospectRepository.findById(9L)).thenReturn(Optional.empty());
        when(engagementRepository.findByCampaignIdAndProspectId(1L, 8L)).thenReturn(Optional.empty());
        when(engagementRepository.save(any(CampaignEngagement.class))).thenAnswer(inv -> inv.getArgument(0));
        when(engagementRepository.countByCampaignId(1L)).thenReturn(1L);

        BulkAddResult result = audienceService.bulkAddProspects(1L, List.of(8L, 8L, 9L, 9L));

        assertEquals(1, result.added());
        assertEquals(1, result.skipped());
        assertEquals(2, result.notFound());
        assertEquals(4, result.totalRequested());
        verify(engagementRepository, times(1)).save(any(CampaignEngagement.class));
    }

    @Test
    void bulkAddProspects_EmptyList_ChangesNothing() {
        when(campaignRepository.findById(1L)).thenReturn(Optional.of(campaign));
        when(engagementRepository.countByCampaignId(1L)).thenReturn(0L);

        BulkAddResult result = audienceService.bulkAddProspects(1L, List.of());

        assertEquals(0, result.added());
        assertEquals(0, result.totalRequested());
        verifyNoInteractions(prospectRepository);
    }

    @Test
    void remove_RecordOfOtherCampaign_ThrowsBusinessException() {
        Campaign other = Campaign.builder().id(2L).name("Other").build();
        CampaignEngagement engagement = CampaignEngagement.forContact(other, contact, null);
        engagement.setId(30L);
        when(campaignRepository.findById(1L)).thenReturn(Optional.of(campaign));
        when(engagementRepository.findById(30L)).thenReturn(Optional.of(engagement));

        assertThrows(BusinessException.class, () -> audienceService.remove(1L, 30L));
        verify(engagementRepository, never()).delete(any());
    }

    @Test
    void remove_OwnRecord_DeletesAndRefreshesSize() {
        CampaignEngagement engagement = CampaignEngagement.forContact(campaign, contact, null);
        engagement.setId(30L);
        campaign.setTargetAudienceSize(1);
        when(campaignRepository.findById(1L)).thenReturn(Optional.of(campaign));
        when(engagementRepository.findById(30L)).thenReturn(Optional.of(engagement));
        when(engagementRepository.countByCampaignId(1L)).thenReturn(0L);

        audienceService.remove(1L, 30L);

        verify(engagementRepository).delete(engagement);
        assertEquals(0, campaign.getTargetAudienceSize());
    }

    @Test
    void exportAudienceCsv_EscapesValuesAndWritesHeader() {
        contact.setCompany(Company.builder().id(3L).name("Acme, Inc.").build());
        CampaignEngagement engagement = CampaignEngagement.forContact(campaign, contact, null);
        engagement.setId(40L);
        engagement.markSent(null, "Hello", "msg-1");
        when(campaignRepository.findById(1L)).thenReturn(Optional.of(campaign));
        when(engagementRepository.findAllWithRecipients(1L)).thenReturn(List.of(engagement));

        String csv = new String(audienceService.exportAudienceCsv(1L), StandardCharsets.UTF_8);
        String[] lines = csv.split("\n");

        assertEquals(2, lines.length);
        assertTrue(lines[0].startsWith("engagement_id,recipient_type,recipient_id,name,email,company,status"));
        assertTrue(lines[1].startsWith("40,contact,5,Ana Diaz,ana@example.com,\"Acme, Inc.\",SENT,"));
    }

    @Test
    void recipientCompany_ProspectUsesCompanyName() {
        Prospect prospect = Prospect.builder().id(7L).firstName("Luis").companyName("Globex").build();
        CampaignEngagement engagement = CampaignEngagement.forProspect(campaign, prospect, null);

        assertEquals("Globex", AudienceService.recipientCompany(engagement));
        assertEquals("Luis", AudienceService.recipientName(engagement));
    }
}
