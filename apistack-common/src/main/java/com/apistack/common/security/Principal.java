package com.apistack.common.security;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Instant;
import java.util.Set;

/**
 * Verified caller identity extracted from a bearer token.
 * Lives for the duration of one request.
 */
@Value
@Builder
public class Principal {

    String subject;
    Instant issuedAt;
    Instant expiresAt;
    @Singular
    Set<String> roles;

    /**
     * An expired principal must never be treated as authenticated.
     */
    public boolean isExpired(Instant now) {
        return !now.isBefore(expiresAt);
    }

    /**
     * Check if principal has a specific role
     */
    public boolean hasRole(String role) {
        return roles.contains(role);
    }

    /**
     * Check if principal has any of the specified roles
     */
    public boolean hasAnyRole(String... rolesToCheck) {
        if (rolesToCheck == null) {
            return false;
        }
        for (String role : rolesToCheck) {
            if (roles.contains(role)) {
                return true;
            }
        }
        return false;
    }
}
