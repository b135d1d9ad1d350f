package com.digitalgroup.crm.security;

import com.digitalgroup.crm.domain.campaign.entity.Campaign;
import com.digitalgroup.crm.domain.common.enums.Permission;
import com.digitalgroup.crm.domain.prospect.entity.Prospect;
import org.springframework.security.access.AccessDeniedException;
import org.springframework.stereotype.Component;

/**
 * Own-versus-all checks that a plain authority cannot express. An "_ALL"
 * permission covers every record; the "_OWN" variant covers records the
 * user owns (campaigns) or is assigned to or created (prospects).
 */
@Component
public class AccessGuard {

    public void checkCampaign(CustomUserDetails user, Campaign campaign, Permission all, Permission own) {
        if (!canAccessCampaign(user, campaign, all, own)) {
            throw new AccessDeniedException("Not allowed to access campaign " + campaign.getId());
        }
    }

    public boolean canAccessCampaign(CustomUserDetails user, Campaign campaign, Permission all, Permission own) {
        if (user.hasPermission(all)) {
            return true;
        }
        return user.hasPermission(own) && campaign.isOwnedBy(user.getId());
    }

    public void checkProspect(CustomUserDetails user, Prospect prospect, Permission all, Permission own) {
        if (!canAccessProspect(user, prospect, all, own)) {
            throw new AccessDeniedException("Not allowed to access prospect " + prospect.getId());
        }
    }

    public boolean canAccessProspect(CustomUserDetails user, Prospect prospect, Permission all, Permission own) {
        if (user.hasPermission(all)) {
            return true;
        }
        return user.hasPermission(own) && prospect.isOwnedBy(user.getId());
    }

    /**
     * The owner filter for list queries: null when the user may see every
     * record, otherwise the user's id.
     */
    public Long visibilityFilter(CustomUserDetails user, Permission all) {
        return user.hasPermission(all) ? null : user.getId();
    }
}
