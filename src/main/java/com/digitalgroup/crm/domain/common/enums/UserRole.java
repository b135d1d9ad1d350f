package com.digitalgroup.crm.domain.common.enums;

import lombok.Getter;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

import static com.digitalgroup.crm.domain.common.enums.Permission.*;

@Getter
public enum UserRole {
    USER(0),
    ADMIN(1),
    SALES_MANAGER(2),
    SALES_REP(3);

    private final int value;

    UserRole(int value) {
        this.value = value;
    }

    public static UserRole fromValue(int value) {
        for (UserRole role : UserRole.values()) {
            if (role.value == value) {
                return role;
            }
        }
        throw new IllegalArgumentException("Unknown UserRole value: " + value);
    }

    /**
     * Parse role from string name (case-insensitive).
     * Returns USER for null/blank/unknown values.
     */
    public static UserRole fromString(String roleName) {
        if (roleName == null || roleName.isBlank()) return USER;
        return switch (roleName.trim().toLowerCase()) {
            case "admin" -> ADMIN;
            case "sales_manager" -> SALES_MANAGER;
            case "sales_rep" -> SALES_REP;
            default -> USER;
        };
    }

    public Set<Permission> getPermissions() {
        return switch (this) {
            case ADMIN, SALES_MANAGER -> Permission.all();
            case SALES_REP -> EnumSet.of(
                    CAMPAIGNS_VIEW_OWN, CAMPAIGNS_CREATE, CAMPAIGNS_EDIT_OWN, CAMPAIGNS_EXECUTE,
                    PROSPECTS_VIEW_OWN, PROSPECTS_CREATE, PROSPECTS_EDIT_OWN, PROSPECTS_CONVERT);
            case USER -> Collections.emptySet();
        };
    }

    public boolean hasPermission(Permission permission) {
        return getPermissions().contains(permission);
    }

    public boolean isAdmin() {
        return this == ADMIN;
    }

    public boolean isManager() {
        return this == SALES_MANAGER;
    }
}
