package com.apistack.service.filter;

import com.apistack.common.exception.AuthException;
import com.apistack.common.security.Principal;
import jakarta.servlet.http.HttpServletRequest;

import java.time.Clock;
import java.util.Optional;

/**
 * Handler-side access to the caller. The principal's expiry is checked again on every access, so a
 * token that expires while a slow handler runs is not used past its lifetime.
 */
public class AuthenticatedRequest {

    public static final String ATTRIBUTE = AuthenticatedRequest.class.getName();

    private final Principal principal;
    private final Clock clock;

    public AuthenticatedRequest(Principal principal, Clock clock) {
        this.principal = principal;
        this.clock = clock;
    }

    /**
     * @return the authenticated caller, if the route required one
     */
    public static Optional<AuthenticatedRequest> from(HttpServletRequest request) {
        Object attribute = request.getAttribute(ATTRIBUTE);
        return attribute instanceof AuthenticatedRequest
                ? Optional.of((AuthenticatedRequest) attribute)
                : Optional.empty();
    }

    /**
     * @throws AuthException EXPIRED once the principal's lifetime has passed
     */
    public Principal principal() {
        if (principal.isExpired(clock.instant())) {
            throw new AuthException(AuthException.Kind.EXPIRED, "Credentials expired during the request");
        }
        return principal;
    }

    public String subject() {
        return principal().getSubject();
    }

    public boolean hasRole(String role) {
        return principal().hasRole(role);
    }
}
