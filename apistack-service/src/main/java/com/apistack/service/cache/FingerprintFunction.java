package com.apistack.service.cache;

import com.apistack.common.security.Principal;
import jakarta.servlet.http.HttpServletRequest;

/**
 * Derives the cache identity of a request. A route may supply its own when the default
 * (method, path, query, optionally subject) is too coarse or too fine.
 */
@FunctionalInterface
public interface FingerprintFunction {

    /**
     * @param principal null on public routes
     */
    String fingerprint(HttpServletRequest request, Principal principal);
}
