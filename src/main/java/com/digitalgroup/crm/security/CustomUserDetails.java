package com.digitalgroup.crm.security;

import com.digitalgroup.crm.domain.common.enums.Permission;
import com.digitalgroup.crm.domain.common.enums.UserRole;
import com.digitalgroup.crm.domain.user.entity.User;
import lombok.Getter;
import org.springframework.security.core.GrantedAuthority;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.userdetails.UserDetails;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Set;

/**
 * Authenticated user. Authorities are the role ({@code ROLE_<name>}) plus
 * one authority per permission code, so controllers can check either.
 */
@Getter
public class CustomUserDetails implements UserDetails {

    private final Long id;
    private final String email;
    private final String password;
    private final String firstName;
    private final String lastName;
    private final String role;
    private final UserRole userRole;
    private final boolean active;
    private final Set<Permission> permissions;
    private final Collection<? extends GrantedAuthority> authorities;

    public CustomUserDetails(User user) {
        this.id = user.getId();
        this.email = user.getEmail();
        this.password = user.getEncryptedPassword();
        this.firstName = user.getFirstName();
        this.lastName = user.getLastName();
        this.role = user.getRole().name();
        this.userRole = user.getRole();
        this.active = user.isActive();
        this.permissions = userRole.getPermissions();

        List<GrantedAuthority> granted = new ArrayList<>();
        granted.add(new SimpleGrantedAuthority("ROLE_" + user.getRole().name()));
        for (Permission permission : permissions) {
            granted.add(new SimpleGrantedAuthority(permission.getCode()));
        }
        this.authorities = Collections.unmodifiableList(granted);
    }

    @Override
    public Collection<? extends GrantedAuthority> getAuthorities() {
        return authorities;
    }

    @Override
    public String getPassword() {
        return password;
    }

    @Override
    public String getUsername() {
        return email;
    }

    @Override
    public boolean isAccountNonExpired() {
        return true;
    }

    @Override
    public boolean isAccountNonLocked() {
        return active;
    }

    @Override
    public boolean isCredentialsNonExpired() {
        return true;
    }

    @Override
    public boolean isEnabled() {
        return active;
    }

    public String getFullName() {
        return (firstName + " " + (lastName != null ? lastName : "")).trim();
    }

    public boolean hasPermission(Permission permission) {
        return permissions.contains(permission);
    }

    public boolean isAdmin() {
        return userRole.isAdmin();
    }

    public boolean isManager() {
        return userRole.isManager();
    }
}
