package com.apistack.service.filter;

import com.apistack.service.cache.FingerprintFunction;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Duration;
import java.util.Locale;
import java.util.Set;

/**
 * Pipeline configuration for one route.
 * Null limits and TTLs fall back to the global defaults.
 */
@Value
@Builder(toBuilder = true)
public class RoutePolicy {

    String id;
    String pathPattern;
    /** empty means every method */
    @Singular
    Set<String> methods;
    @Builder.Default
    boolean authRequired = true;
    @Singular
    Set<String> requiredRoles;
    @Builder.Default
    boolean rateLimited = true;
    Integer rateLimitRequests;
    Integer rateLimitWindowSeconds;
    boolean cacheable;
    Duration cacheTtl;
    /** null means scoped whenever the route requires authentication */
    Boolean principalScoped;
    FingerprintFunction fingerprintFunction;

    /**
     * Whether cache fingerprints include the caller. Authenticated routes are scoped unless they opt out.
     */
    public boolean isPrincipalScoped() {
        return principalScoped != null ? principalScoped : authRequired;
    }

    public boolean matches(String method, String path) {
        if (!methods.isEmpty() && !methods.contains(method.toUpperCase(Locale.ROOT))) {
            return false;
        }
        return PathPatterns.matches(path, pathPattern);
    }
}
