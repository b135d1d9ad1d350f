package com.digitalgroup.crm.security;

import com.digitalgroup.crm.domain.campaign.entity.Campaign;
import com.digitalgroup.crm.domain.common.enums.Permission;
import com.digitalgroup.crm.domain.common.enums.UserRole;
import com.digitalgroup.crm.domain.prospect.entity.Prospect;
import com.digitalgroup.crm.domain.user.entity.User;
import org.junit.jupiter.api.Test;
import org.springframework.security.access.AccessDeniedException;
import org.springframework.security.core.GrantedAuthority;

import static org.junit.jupiter.api.Assertions.*;

class AccessGuardTest {

    private final AccessGuard accessGuard = new AccessGuard();

    private final CustomUserDetails manager = user(1L, UserRole.SALES_MANAGER);
    private final CustomUserDetails rep = user(2L, UserRole.SALES_REP);
    private final CustomUserDetails plainUser = user(3L, UserRole.USER);

    @Test
    void userDetails_GrantsRoleAndPermissionCodes() {
        assertTrue(rep.getAuthorities().stream()
                .map(GrantedAuthority::getAuthority)
                .anyMatch("ROLE_SALES_REP"::equals));
        assertTrue(rep.getAuthorities().stream()
                .map(GrantedAuthority::getAuthority)
                .anyMatch("campaigns.execute"::equals));
        assertFalse(rep.hasPermission(Permission.CAMPAIGNS_VIEW_ALL));
        assertEquals("rep2@example.com", rep.getUsername());
    }

    @Test
    void userDetails_DeactivatedUser_IsDisabled() {
        CustomUserDetails deactivated = new CustomUserDetails(User.builder()
                .id(4L)
                .email("gone@example.com")
                .encryptedPassword("hash")
                .firstName("Gone")
                .role(UserRole.SALES_REP)
                .active(false)
                .build());

        assertTrue(rep.isEnabled());
        assertFalse(deactivated.isEnabled());
    }

    @Test
    void campaign_AllPermission_CoversEveryCampaign() {
        Campaign campaign = Campaign.builder().id(5L).name("Expo").ownerId(99L).build();

        assertTrue(accessGuard.canAccessCampaign(manager, campaign,
                Permission.CAMPAIGNS_VIEW_ALL, Permission.CAMPAIGNS_VIEW_OWN));
    }

    @Test
    void campaign_OwnPermission_OnlyCoversOwnedCampaigns() {
        Campaign own = Campaign.builder().id(5L).name("Own").ownerId(2L).build();
        Campaign foreign = Campaign.builder().id(6L).name("Foreign").ownerId(99L).build();

        assertTrue(accessGuard.canAccessCampaign(rep, own,
                Permission.CAMPAIGNS_EDIT_ALL, Permission.CAMPAIGNS_EDIT_OWN));
        assertThrows(AccessDeniedException.class, () -> accessGuard.checkCampaign(rep, foreign,
                Permission.CAMPAIGNS_EDIT_ALL, Permission.CAMPAIGNS_EDIT_OWN));
    }

    @Test
    void campaign_NoPermission_DeniedEvenForOwner() {
        Campaign own = Campaign.builder().id(5L).name("Own").ownerId(3L).build();

        assertFalse(accessGuard.canAccessCampaign(plainUser, own,
                Permission.CAMPAIGNS_VIEW_ALL, Permission.CAMPAIGNS_VIEW_OWN));
    }

    @Test
    void prospect_OwnPermission_CoversAssignedOrCreated() {
        Prospect assigned = Prospect.builder().id(7L).firstName("A").assignedTo(2L).createdBy(1L).build();
        Prospect created = Prospect.builder().id(8L).firstName("B").assignedTo(1L).createdBy(2L).build();
        Prospect foreign = Prospect.builder().id(9L).firstName("C").assignedTo(1L).createdBy(1L).build();

        assertTrue(accessGuard.canAccessProspect(rep, assigned,
                Permission.PROSPECTS_VIEW_ALL, Permission.PROSPECTS_VIEW_OWN));
        assertTrue(accessGuard.canAccessProspect(rep, created,
                Permission.PROSPECTS_VIEW_ALL, Permission.PROSPECTS_VIEW_OWN));
        assertThrows(AccessDeniedException.class, () -> accessGuard.checkProspect(rep, foreign,
                Permission.PROSPECTS_VIEW_ALL, Permission.PROSPECTS_VIEW_OWN));
    }

    @Test
    void visibilityFilter_NullForAllPermission_OtherwiseUserId() {
        assertNull(accessGuard.visibilityFilter(manager, Permission.CAMPAIGNS_VIEW_ALL));
        assertEquals(2L, accessGuard.visibilityFilter(rep, Permission.CAMPAIGNS_VIEW_ALL));
    }

    static CustomUserDetails user(Long id, UserRole role) {
        return new CustomUserDetails(User.builder()
                .id(id)
                .email("rep" + id + "@example.com")
                .encryptedPassword("hash")
                .firstName("User")
                .lastName(String.valueOf(id))
                .role(role)
                .build());
    }
}
