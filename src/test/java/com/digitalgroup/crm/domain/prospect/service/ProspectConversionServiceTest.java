package com.digitalgroup.crm.domain.prospect.service;

import com.digitalgroup.crm.domain.activity.entity.Activity;
import com.digitalgroup.crm.domain.activity.repository.ActivityRepository;
import com.digitalgroup.crm.domain.campaign.entity.Campaign;
import com.digitalgroup.crm.domain.campaign.entity.CampaignEngagement;
import com.digitalgroup.crm.domain.campaign.repository.CampaignEngagementRepository;
import com.digitalgroup.crm.domain.company.entity.Company;
import com.digitalgroup.crm.domain.company.repository.CompanyRepository;
import com.digitalgroup.crm.domain.contact.entity.Contact;
import com.digitalgroup.crm.domain.contact.repository.ContactRepository;
import com.digitalgroup.crm.domain.prospect.dto.ConversionOptions;
import com.digitalgroup.crm.domain.prospect.dto.ConversionResult;
import com.digitalgroup.crm.domain.prospect.entity.Prospect;
import com.digitalgroup.crm.domain.prospect.enums.ProspectStatus;
import com.digitalgroup.crm.domain.prospect.repository.ProspectRepository;
import com.digitalgroup.crm.exception.ConflictException;
import com.digitalgroup.crm.exception.ResourceNotFoundException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ProspectConversionServiceTest {

    @Mock
    private ProspectRepository prospectRepository;

    @Mock
    private ContactRepository contactRepository;

    @Mock
    private CompanyRepository companyRepository;

    @Mock
    private ActivityRepository activityRepository;

    @Mock
    private CampaignEngagementRepository engagementRepository;

    @InjectMocks
    private ProspectConversionService conversionService;

    private Campaign campaign;
    private Prospect prospect;

    @BeforeEach
    void setUp() {
        campaign = Campaign.builder().id(1L).name("Spring Launch").ownerId(10L).build();
        prospect = Prospect.builder()
                .id(7L)
                .firstName("Luis")
                .lastName("Perez")
                .email("luis@example.com")
                .phone("+51 999 111 222")
                .companyName(" Globex ")
                .jobTitle("Buyer")
                .notes("Met at expo")
                .assignedTo(20L)
                .campaign(campaign)
                .build();
    }

    @Test
    void convert_CreatesContactActivityAndMovesEngagements() {
        Company globex = Company.builder().id(3L).name("Globex").build();
        CampaignEngagement engagement = CampaignEngagement.forProspect(campaign, prospect, null);

        when(prospectRepository.findWithCampaignById(7L)).thenReturn(Optional.of(prospect));
        when(contactRepository.existsByEmailIgnoreCase("luis@example.com")).thenReturn(false);
        when(companyRepository.findFirstByNameIgnoreCase("Globex")).thenReturn(Optional.of(globex));
        when(contactRepository.save(any(Contact.class))).thenAnswer(inv -> {
            Contact c = inv.getArgument(0);
            c.setId(50L);
            return c;
        });
        when(activityRepository.save(any(Activity.class))).thenAnswer(inv -> {
            Activity a = inv.getArgument(0);
            a.setId(60L);
            return a;
        });
        when(engagementRepository.findByProspectId(7L)).thenReturn(List.of(engagement));

        ConversionResult result = conversionService.convert(7L,
                new ConversionOptions("Ready to buy", true, null), 10L);

        assertEquals(50L, result.contactId());
        assertEquals(60L, result.activityId());

        ArgumentCaptor<Contact> contact = ArgumentCaptor.forClass(Contact.class);
        verify(contactRepository).save(contact.capture());
        assertEquals("Luis", contact.getValue().getFirstName());
        assertEquals("+51 999 111 222", contact.getValue().getMobile());
        assertEquals("Buyer", contact.getValue().getPosition());
        assertEquals(20L, contact.getValue().getOwnerId());
        assertEquals(10L, contact.getValue().getCreatedBy());
        assertSame(globex, contact.getValue().getCompany());
        assertEquals("Converted from prospect. Original notes: Met at expo", contact.getValue().getNotes());

        ArgumentCaptor<Activity> activity = ArgumentCaptor.forClass(Activity.class);
        verify(activityRepository).save(activity.capture());
        assertEquals(ProspectConversionService.ACTIVITY_SUBJECT, activity.getValue().getSubject());
        assertEquals("Prospect Luis Perez was converted to a contact. Campaign source: Spring Launch. Ready to buy",
                activity.getValue().getDescription());

        assertEquals(ProspectStatus.CONVERTED, prospect.getStatus());
        assertNotNull(prospect.getConvertedAt());
        assertTrue(engagement.isContactRecipient());
        assertNull(engagement.getProspect());
        verify(engagementRepository).saveAll(List.of(engagement));
    }

    @Test
    void convert_WithoutActivity_AssignsRequestedOwner() {
        prospect.setCompanyName(null);
        when(prospectRepository.findWithCampaignById(7L)).thenReturn(Optional.of(prospect));
        when(contactRepository.existsByEmailIgnoreCase("luis@example.com")).thenReturn(false);
        when(contactRepository.save(any(Contact.class))).thenAnswer(inv -> inv.getArgument(0));
        when(engagementRepository.findByProspectId(7L)).thenReturn(List.of());

        ConversionResult result = conversionService.convert(7L, new ConversionOptions(null, false, 30L), 10L);

        assertNull(result.activityId());
        ArgumentCaptor<Contact> contact = ArgumentCaptor.forClass(Contact.class);
        verify(contactRepository).save(contact.capture());
        assertEquals(30L, contact.getValue().getOwnerId());
        verifyNoInteractions(activityRepository, companyRepository);
    }

    @Test
    void convert_AlreadyConverted_ThrowsConflict() {
        prospect.markConverted(Contact.builder().id(50L).firstName("Luis").build(), null);
        when(prospectRepository.findWithCampaignById(7L)).thenReturn(Optional.of(prospect));

        assertThrows(ConflictException.class, () -> conversionService.convert(7L, ConversionOptions.defaults(), 10L));
        verify(contactRepository, never()).save(any());
    }

    @Test
    void convert_ContactEmailTaken_ThrowsConflictAndLeavesProspect() {
        when(prospectRepository.findWithCampaignById(7L)).thenReturn(Optional.of(prospect));
        when(contactRepository.existsByEmailIgnoreCase("luis@example.com")).thenReturn(true);

        assertThrows(ConflictException.class, () -> conversionService.convert(7L, ConversionOptions.defaults(), 10L));
        assertEquals(ProspectStatus.NEW, prospect.getStatus());
        verify(prospectRepository, never()).save(any());
    }

    @Test
    void convert_UnknownProspect_ThrowsNotFound() {
        when(prospectRepository.findWithCampaignById(99L)).thenReturn(Optional.empty());

        assertThrows(ResourceNotFoundException.class,
                () -> conversionService.convert(99L, ConversionOptions.defaults(), 10L));
    }
}
