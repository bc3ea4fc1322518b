package com.apistack.service.filter;

import com.apistack.common.exception.RateLimitExceededException;
import com.apistack.service.config.ApiStackProperties;
import com.apistack.service.ratelimit.ClientKeys;
import com.apistack.service.ratelimit.FixedWindowRateLimiter;
import com.apistack.service.ratelimit.RateLimitDecision;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.Ordered;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;

/**
 * Per-route, per-caller admission check. Rejections answer 429 with Retry-After.
 */
@Slf4j
@Component
public class RateLimitFilter extends OncePerRequestFilter implements Ordered {

    public static final int ORDER = AuthenticationFilter.ORDER + 10;
    public static final String LIMIT_HEADER = "X-RateLimit-Limit";
    public static final String REMAINING_HEADER = "X-RateLimit-Remaining";

    private final FixedWindowRateLimiter limiter;
    private final ApiStackProperties.RateLimitConfig config;
    private final ErrorResponseWriter errorWriter;

    public RateLimitFilter(FixedWindowRateLimiter limiter, ApiStackProperties properties,
                           ErrorResponseWriter errorWriter) {
        this.limiter = limiter;
        this.config = properties.getRateLimit();
        this.errorWriter = errorWriter;
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain chain)
            throws ServletException, IOException {
        PipelineContext context = PipelineContext.from(request);
        RoutePolicy route = context.getRoute();

        if (!Boolean.TRUE.equals(config.getEnabled()) || !route.isRateLimited()) {
            context.advance(RequestStage.RATE_CHECKED);
            chain.doFilter(request, response);
            return;
        }

        int limit = route.getRateLimitRequests() != null ? route.getRateLimitRequests() : config.getRequests();
        int window = route.getRateLimitWindowSeconds() != null
                ? route.getRateLimitWindowSeconds() : config.getWindowSeconds();
        String key = route.getId() + ":" + ClientKeys.callerKey(request, context.getPrincipal());

        RateLimitDecision decision = limiter.admit(key, limit, window);
        response.setHeader(LIMIT_HEADER, String.valueOf(limit));
        response.setHeader(REMAINING_HEADER, String.valueOf(decision.getRemaining()));

        if (!decision.isAdmitted()) {
            log.warn("Rate limit exceeded for {} (count={}, limit={}, retryAfter={}s)",
                    key, decision.getCount(), limit, decision.getRetryAfterSeconds());
            errorWriter.write(response, new RateLimitExceededException(decision.getRetryAfterSeconds()));
            context.advance(RequestStage.RESPONDED);
            return;
        }

        context.advance(RequestStage.RATE_CHECKED);
        chain.doFilter(request, response);
    }

    @Override
    public int getOrder() {
        return ORDER;
    }
}
