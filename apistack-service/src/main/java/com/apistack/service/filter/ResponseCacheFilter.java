package com.apistack.service.filter;

import com.apistack.service.cache.CachedResponse;
import com.apistack.service.cache.FingerprintFunction;
import com.apistack.service.cache.RequestFingerprinter;
import com.apistack.service.cache.ResponseCache;
import com.apistack.service.config.ApiStackProperties;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.Ordered;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;
import org.springframework.web.util.ContentCachingResponseWrapper;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.util.Optional;

/**
 * Serves cacheable routes from the response cache and stores successful GET/HEAD responses.
 * Each route caches under its own namespace, named after the route id.
 */
@Slf4j
@Component
public class ResponseCacheFilter extends OncePerRequestFilter implements Ordered {

    public static final int ORDER = RateLimitFilter.ORDER + 10;
    public static final String CACHE_HEADER = "X-Cache";

    private final ResponseCache cache;
    private final ApiStackProperties.CacheConfig config;
    private final Clock clock;

    public ResponseCacheFilter(ResponseCache cache, ApiStackProperties properties, Clock clock) {
        this.cache = cache;
        this.config = properties.getCache();
        this.clock = clock;
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain chain)
            throws ServletException, IOException {
        PipelineContext context = PipelineContext.from(request);
        RoutePolicy route = context.getRoute();

        if (!Boolean.TRUE.equals(config.getEnabled()) || !route.isCacheable() || !isCacheableMethod(request)) {
            context.advance(RequestStage.CACHE_MISS);
            chain.doFilter(request, response);
            context.advance(RequestStage.HANDLED);
            return;
        }

        FingerprintFunction function = route.getFingerprintFunction() != null
                ? route.getFingerprintFunction()
                : RequestFingerprinter.standard(route.isPrincipalScoped());
        String fingerprint = function.fingerprint(request, context.getPrincipal());

        Optional<CachedResponse> hit = cache.get(route.getId(), fingerprint);
        if (hit.isPresent()) {
            context.advance(RequestStage.CACHE_HIT);
            log.debug("Cache hit for route {}", route.getId());
            writeCached(request, response, hit.get());
            return;
        }

        context.advance(RequestStage.CACHE_MISS);
        ContentCachingResponseWrapper wrapper = new ContentCachingResponseWrapper(response);
        try {
            chain.doFilter(request, wrapper);
            context.advance(RequestStage.HANDLED);
            if (wrapper.getStatus() == HttpStatus.OK.value()) {
                context.advance(RequestStage.MAYBE_CACHED);
                wrapper.setHeader(CACHE_HEADER, "MISS");
                cache.put(route.getId(), fingerprint, CachedResponse.builder()
                        .status(wrapper.getStatus())
                        .contentType(wrapper.getContentType())
                        .body(wrapper.getContentAsByteArray())
                        .storedAt(clock.instant())
                        .build(), ttlFor(route));
            }
        } finally {
            wrapper.copyBodyToResponse();
        }
    }

    private void writeCached(HttpServletRequest request, HttpServletResponse response, CachedResponse cached)
            throws IOException {
        response.setStatus(cached.getStatus());
        if (cached.getContentType() != null) {
            response.setContentType(cached.getContentType());
        }
        response.setHeader(CACHE_HEADER, "HIT");
        byte[] body = cached.getBody() != null ? cached.getBody() : new byte[0];
        response.setContentLength(body.length);
        if (!"HEAD".equals(request.getMethod())) {
            response.getOutputStream().write(body);
        }
    }

    private Duration ttlFor(RoutePolicy route) {
        return route.getCacheTtl() != null ? route.getCacheTtl() : config.getDefaultTtl();
    }

    private static boolean isCacheableMethod(HttpServletRequest request) {
        return "GET".equals(request.getMethod()) || "HEAD".equals(request.getMethod());
    }

    @Override
    public int getOrder() {
        return ORDER;
    }
}
