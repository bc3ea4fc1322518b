package com.apistack.service.filter;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.core.Ordered;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.UUID;

/**
 * Outermost filter: assigns the request id, resolves the route policy and logs request/response.
 */
@Slf4j
@Component
public class LoggingFilter extends OncePerRequestFilter implements Ordered {

    public static final int ORDER = Ordered.HIGHEST_PRECEDENCE + 10;
    public static final String REQUEST_ID_HEADER = "X-Request-Id";
    public static final String MDC_REQUEST_ID = "requestId";

    private final RoutePolicyRegistry routes;

    public LoggingFilter(RoutePolicyRegistry routes) {
        this.routes = routes;
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain chain)
            throws ServletException, IOException {
        long startTime = System.currentTimeMillis();
        String requestId = request.getHeader(REQUEST_ID_HEADER);
        if (requestId == null || requestId.isBlank()) {
            requestId = UUID.randomUUID().toString();
        }
        String path = PathPatterns.pathOf(request);

        PipelineContext context = new PipelineContext(requestId, routes.resolve(request.getMethod(), path));
        request.setAttribute(PipelineContext.ATTRIBUTE, context);
        response.setHeader(REQUEST_ID_HEADER, requestId);
        MDC.put(MDC_REQUEST_ID, requestId);

        log.debug("Incoming request: {} {} | Route: {} | RemoteAddr: {}",
                request.getMethod(), path, context.getRoute().getId(), request.getRemoteAddr());
        try {
            chain.doFilter(request, response);
        } finally {
            context.finish();
            log.info("Outgoing response: {} {} | Status: {} | Duration: {}ms | Stages: {}",
                    request.getMethod(), path, response.getStatus(),
                    System.currentTimeMillis() - startTime, context.getHistory());
            MDC.remove(MDC_REQUEST_ID);
        }
    }

    @Override
    public int getOrder() {
        return ORDER;
    }
}
