package com.digitalgroup.crm.domain.common.enums;

import lombok.Getter;

import java.util.EnumSet;
import java.util.Set;

/**
 * Capabilities checked at the controller boundary. The code is the
 * authority name granted to the authenticated principal.
 */
@Getter
public enum Permission {
    CAMPAIGNS_VIEW_ALL("campaigns.view_all"),
    CAMPAIGNS_VIEW_OWN("campaigns.view_own"),
    CAMPAIGNS_CREATE("campaigns.create"),
    CAMPAIGNS_EDIT_ALL("campaigns.edit_all"),
    CAMPAIGNS_EDIT_OWN("campaigns.edit_own"),
    CAMPAIGNS_DELETE_ALL("campaigns.delete_all"),
    CAMPAIGNS_DELETE_OWN("campaigns.delete_own"),
    CAMPAIGNS_EXECUTE("campaigns.execute"),
    CAMPAIGNS_EXPORT("campaigns.export"),
    PROSPECTS_VIEW_ALL("prospects.view_all"),
    PROSPECTS_VIEW_OWN("prospects.view_own"),
    PROSPECTS_CREATE("prospects.create"),
    PROSPECTS_EDIT_ALL("prospects.edit_all"),
    PROSPECTS_EDIT_OWN("prospects.edit_own"),
    PROSPECTS_DELETE_ALL("prospects.delete_all"),
    PROSPECTS_DELETE_OWN("prospects.delete_own"),
    PROSPECTS_CONVERT("prospects.convert"),
    PROSPECTS_IMPORT("prospects.import"),
    PROSPECTS_EXPORT("prospects.export");

    private final String code;

    Permission(String code) {
        this.code = code;
    }

    public static Permission fromCode(String code) {
        for (Permission permission : values()) {
            if (permission.code.equals(code)) {
                return permission;
            }
        }
        throw new IllegalArgumentException("Unknown permission: " + code);
    }

    public static Set<Permission> all() {
        return EnumSet.allOf(Permission.class);
    }
}
