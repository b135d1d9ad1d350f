package com.digitalgroup.crm.web.admin;

import com.digitalgroup.crm.domain.campaign.dto.CampaignRequest;
import com.digitalgroup.crm.domain.campaign.dto.CampaignSearchCriteria;
import com.digitalgroup.crm.domain.campaign.entity.Campaign;
import com.digitalgroup.crm.domain.campaign.enums.CampaignStatus;
import com.digitalgroup.crm.domain.campaign.service.CampaignMetricsService;
import com.digitalgroup.crm.domain.campaign.service.CampaignService;
import com.digitalgroup.crm.domain.common.enums.UserRole;
import com.digitalgroup.crm.domain.prospect.service.ProspectService;
import com.digitalgroup.crm.domain.user.entity.User;
import com.digitalgroup.crm.exception.GlobalExceptionHandler;
import com.digitalgroup.crm.exception.InvalidStateException;
import com.digitalgroup.crm.exception.ResourceNotFoundException;
import com.digitalgroup.crm.security.AccessGuard;
import com.digitalgroup.crm.security.CustomUserDetails;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.domain.PageImpl;
import org.springframework.data.domain.Pageable;
import org.springframework.http.MediaType;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.web.method.annotation.AuthenticationPrincipalArgumentResolver;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@ExtendWith(MockitoExtension.class)
class CampaignControllerTest {

    @Mock
    private CampaignService campaignService;

    @Mock
    private CampaignMetricsService metricsService;

    @Mock
    private ProspectService prospectService;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        CampaignController controller = new CampaignController(
                campaignService, metricsService, prospectService, new AccessGuard());
        mockMvc = MockMvcBuilders.standaloneSetup(controller)
                .setControllerAdvice(new GlobalExceptionHandler())
                .setCustomArgumentResolvers(new AuthenticationPrincipalArgumentResolver())
                .build();
    }

    @AfterEach
    void tearDown() {
        SecurityContextHolder.clearContext();
    }

    @Test
    void index_SalesRep_OnlySeesOwnCampaigns() throws Exception {
        loginAs(2L, UserRole.SALES_REP);
        Campaign campaign = Campaign.builder().id(1L).name("Spring Launch").ownerId(2L).build();
        when(campaignService.search(any(CampaignSearchCriteria.class), any(Pageable.class)))
                .thenReturn(new PageImpl<>(List.of(campaign)));

        mockMvc.perform(get("/app/campaigns").param("owner_id", "9").param("status", "DRAFT"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data[0].name").value("Spring Launch"))
                .andExpect(jsonPath("$.meta.total_items").value(1));

        ArgumentCaptor<CampaignSearchCriteria> criteria = ArgumentCaptor.forClass(CampaignSearchCriteria.class);
        ArgumentCaptor<Pageable> pageable = ArgumentCaptor.forClass(Pageable.class);
        verify(campaignService).search(criteria.capture(), pageable.capture());
        assertEquals(2L, criteria.getValue().ownerId());
        assertEquals(List.of(CampaignStatus.DRAFT), criteria.getValue().statuses());
        assertEquals(20, pageable.getValue().getPageSize());
    }

    @Test
    void index_Manager_KeepsRequestedOwnerAndClampsSize() throws Exception {
        loginAs(1L, UserRole.SALES_MANAGER);
        when(campaignService.search(any(CampaignSearchCriteria.class), any(Pageable.class)))
                .thenReturn(new PageImpl<>(List.of()));

        mockMvc.perform(get("/app/campaigns").param("owner_id", "9").param("size", "500"))
                .andExpect(status().isOk());

        ArgumentCaptor<CampaignSearchCriteria> criteria = ArgumentCaptor.forClass(CampaignSearchCriteria.class);
        ArgumentCaptor<Pageable> pageable = ArgumentCaptor.forClass(Pageable.class);
        verify(campaignService).search(criteria.capture(), pageable.capture());
        assertEquals(9L, criteria.getValue().ownerId());
        assertEquals(100, pageable.getValue().getPageSize());
    }

    @Test
    void show_ForeignCampaignForRep_ReturnsForbidden() throws Exception {
        loginAs(2L, UserRole.SALES_REP);
        when(campaignService.findById(5L))
                .thenReturn(Campaign.builder().id(5L).name("Foreign").ownerId(99L).build());

        mockMvc.perform(get("/app/campaigns/5"))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.error").value("FORBIDDEN"));
    }

    @Test
    void show_Missing_ReturnsNotFound() throws Exception {
        loginAs(1L, UserRole.SALES_MANAGER);
        when(campaignService.findById(5L)).thenThrow(new ResourceNotFoundException("Campaign", 5L));

        mockMvc.perform(get("/app/campaigns/5"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.kind").value("NOT_FOUND"));
    }

    @Test
    void create_ValidRequest_ReturnsCreated() throws Exception {
        loginAs(2L, UserRole.SALES_REP);
        when(campaignService.create(any(CampaignRequest.class), eq(2L)))
                .thenReturn(Campaign.builder().id(1L).name("Spring Launch").ownerId(2L).build());

        mockMvc.perform(post("/app/campaigns")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"name\":\"Spring Launch\",\"budget\":1000,\"email_subject\":\"Hi {{first_name}}\"}"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.result").value("success"))
                .andExpect(jsonPath("$.campaign.status").value("DRAFT"));

        ArgumentCaptor<CampaignRequest> command = ArgumentCaptor.forClass(CampaignRequest.class);
        verify(campaignService).create(command.capture(), eq(2L));
        assertEquals("Hi {{first_name}}", command.getValue().emailSubject());
    }

    @Test
    void create_ForAnotherOwnerWithoutEditAll_ReturnsForbidden() throws Exception {
        loginAs(2L, UserRole.SALES_REP);

        mockMvc.perform(post("/app/campaigns")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"name\":\"Spring Launch\",\"owner_id\":9}"))
                .andExpect(status().isForbidden());

        verify(campaignService, never()).create(any(), any());
    }

    @Test
    void create_BlankName_ReturnsValidationErrors() throws Exception {
        loginAs(2L, UserRole.SALES_REP);

        mockMvc.perform(post("/app/campaigns")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"name\":\"\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errors.name").value("Name is required"));
    }

    @Test
    void pause_InvalidTransition_ReturnsConflictWithCurrentState() throws Exception {
        loginAs(1L, UserRole.SALES_MANAGER);
        when(campaignService.findById(5L))
                .thenReturn(Campaign.builder().id(5L).name("Done").ownerId(1L).build());
        when(campaignService.pause(5L))
                .thenThrow(new InvalidStateException("Only active campaigns can be paused", "COMPLETED"));

        mockMvc.perform(post("/app/campaigns/5/pause"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.kind").value("INVALID_STATE"))
                .andExpect(jsonPath("$.current_state").value("COMPLETED"));
    }

    @Test
    void linkDeal_MissingDealId_ReturnsBadRequest() throws Exception {
        loginAs(1L, UserRole.SALES_MANAGER);

        mockMvc.perform(post("/app/campaigns/5/link-deal")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"prospect_id\":7}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errors.dealId").value("deal_id is required"));

        verify(campaignService, never()).linkDeal(any(), any());
    }

    @Test
    void clampSize_KeepsPageSizeBetweenOneAndHundred() {
        assertEquals(1, CampaignController.clampSize(0));
        assertEquals(20, CampaignController.clampSize(20));
        assertEquals(100, CampaignController.clampSize(1000));
    }

    static CustomUserDetails loginAs(Long id, UserRole role) {
        CustomUserDetails user = new CustomUserDetails(User.builder()
                .id(id)
                .email("user" + id + "@example.com")
                .encryptedPassword("hash")
                .firstName("User")
                .role(role)
                .build());
        SecurityContextHolder.getContext().setAuthentication(
                new UsernamePasswordAuthenticationToken(user, null, user.getAuthorities()));
        return user;
    }
}
