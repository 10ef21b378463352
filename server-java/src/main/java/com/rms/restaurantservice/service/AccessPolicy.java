package com.rms.restaurantservice.service;

import com.rms.restaurantservice.model.Role;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.GrantedAuthority;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.Collection;
import java.util.EnumSet;
import java.util.Optional;
import java.util.Set;

/**
 * Role based access decisions. Controllers reference it from method security, e.g.
 * {@code @PreAuthorize("@accessPolicy.permits(authentication, 'ADMIN', 'STAFF')")}.
 */
@Component("accessPolicy")
public class AccessPolicy {

    /**
     * An empty {@code requiredRoles} admits any known role.
     */
    public boolean isAllowed(Role role, Set<Role> requiredRoles) {
        if (role == null) {
            return false;
        }
        return requiredRoles == null || requiredRoles.isEmpty() || requiredRoles.contains(role);
    }

    public boolean permits(Authentication authentication, String... requiredRoles) {
        if (authentication == null || !authentication.isAuthenticated()) {
            return false;
        }
        Set<Role> required = EnumSet.noneOf(Role.class);
        Arrays.stream(requiredRoles).map(Role::from).forEach(required::add);
        return roleOf(authentication.getAuthorities())
                .map(role -> isAllowed(role, required))
                .orElse(false);
    }

    private Optional<Role> roleOf(Collection<? extends GrantedAuthority> authorities) {
        for (GrantedAuthority authority : authorities) {
            for (Role role : Role.values()) {
                if (role.authority().equals(authority.getAuthority())) {
                    return Optional.of(role);
                }
            }
        }
        return Optional.empty();
    }
}
