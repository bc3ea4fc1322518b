package com.apistack.service.ratelimit;

import com.apistack.common.security.Principal;
import jakarta.servlet.http.HttpServletRequest;

/**
 * Resolves who a request is counted against.
 * Authenticated callers are keyed by subject, everyone else by client address.
 */
public final class ClientKeys {

    private ClientKeys() {
    }

    public static String callerKey(HttpServletRequest request, Principal principal) {
        if (principal != null) {
            return "user:" + principal.getSubject();
        }
        return "ip:" + clientIp(request);
    }

    /**
     * Client address as resolved by the servlet container. Forwarded headers are applied there
     * ({@code server.forward-headers-strategy}) and only when the peer is a trusted proxy, so raw
     * {@code X-Forwarded-For} and {@code X-Real-IP} values sent by the client are never read here.
     */
    public static String clientIp(HttpServletRequest request) {
        String remote = request.getRemoteAddr();
        return remote != null && !remote.isEmpty() ? remote : "unknown";
    }
}
