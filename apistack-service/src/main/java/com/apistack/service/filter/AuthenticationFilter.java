package com.apistack.service.filter;

import com.apistack.common.exception.ApiStackException;
import com.apistack.common.exception.AuthException;
import com.apistack.common.exception.ErrorCode;
import com.apistack.common.security.BearerTokens;
import com.apistack.common.security.CredentialVerifier;
import com.apistack.common.security.Principal;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.Ordered;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.time.Clock;

/**
 * Bearer token authentication for routes that require it.
 *
 * Flow:
 * 1. Skip verification when the route is public
 * 2. Extract the token from the Authorization header
 * 3. Verify it into a Principal (401 on any failure)
 * 4. Check the route's required roles (403 when none match)
 * 5. Expose the caller to handlers as an AuthenticatedRequest
 */
@Slf4j
@Component
public class AuthenticationFilter extends OncePerRequestFilter implements Ordered {

    public static final int ORDER = LoggingFilter.ORDER + 10;

    private final CredentialVerifier verifier;
    private final ErrorResponseWriter errorWriter;
    private final Clock clock;

    public AuthenticationFilter(CredentialVerifier verifier, ErrorResponseWriter errorWriter, Clock clock) {
        this.verifier = verifier;
        this.errorWriter = errorWriter;
        this.clock = clock;
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain chain)
            throws ServletException, IOException {
        PipelineContext context = PipelineContext.from(request);
        RoutePolicy route = context.getRoute();

        if (!route.isAuthRequired()) {
            log.trace("Skipping auth for public route {}", route.getId());
            context.advance(RequestStage.AUTHENTICATED);
            chain.doFilter(request, response);
            return;
        }

        Principal principal;
        try {
            String token = BearerTokens.extract(request.getHeader(BearerTokens.AUTHORIZATION_HEADER));
            principal = verifier.verify(token);
        } catch (AuthException e) {
            log.warn("Authentication failed for {} {}: {}", request.getMethod(), request.getRequestURI(), e.getKind());
            reject(context, response, e);
            return;
        }

        if (!route.getRequiredRoles().isEmpty()
                && !principal.hasAnyRole(route.getRequiredRoles().toArray(new String[0]))) {
            log.warn("User {} lacks roles {} for route {}", principal.getSubject(), route.getRequiredRoles(), route.getId());
            reject(context, response, new ApiStackException(ErrorCode.AUTHORIZATION_FAILED));
            return;
        }

        log.debug("Authenticated user: {}, roles: {}", principal.getSubject(), principal.getRoles());
        context.setPrincipal(principal);
        request.setAttribute(AuthenticatedRequest.ATTRIBUTE, new AuthenticatedRequest(principal, clock));
        context.advance(RequestStage.AUTHENTICATED);
        chain.doFilter(request, response);
    }

    private void reject(PipelineContext context, HttpServletResponse response, ApiStackException e) throws IOException {
        errorWriter.write(response, e);
        context.advance(RequestStage.RESPONDED);
    }

    @Override
    public int getOrder() {
        return ORDER;
    }
}
