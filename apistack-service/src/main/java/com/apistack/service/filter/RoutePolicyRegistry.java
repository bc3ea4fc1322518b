package com.apistack.service.filter;

import com.apistack.service.config.ApiStackProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Route policies from configuration plus any registered in code. First match wins.
 * Paths without a policy get the default one: authenticated unless listed as public,
 * rate limited with the global limit, never cached.
 */
@Slf4j
@Component
public class RoutePolicyRegistry {

    static final String DEFAULT_ROUTE_ID = "default";
    static final String PUBLIC_ROUTE_ID = "public";

    private final List<RoutePolicy> policies = new CopyOnWriteArrayList<>();
    private final List<String> publicPaths;

    public RoutePolicyRegistry(ApiStackProperties properties) {
        this.publicPaths = List.copyOf(properties.getSecurity().getPublicPaths());
        for (ApiStackProperties.RouteConfig route : properties.getRoutes()) {
            register(fromConfig(route));
        }
        log.info("Loaded {} route policies, {} public paths", policies.size(), publicPaths.size());
    }

    public void register(RoutePolicy policy) {
        if (policy.getId() == null || policy.getPathPattern() == null) {
            throw new IllegalArgumentException("Route policy needs an id and a path pattern");
        }
        policies.add(policy);
        log.debug("Registered route policy {} for {} {}", policy.getId(), policy.getMethods(), policy.getPathPattern());
    }

    public RoutePolicy resolve(String method, String path) {
        for (RoutePolicy policy : policies) {
            if (policy.matches(method, path)) {
                return policy;
            }
        }
        boolean isPublic = publicPaths.stream().anyMatch(pattern -> PathPatterns.matches(path, pattern));
        return RoutePolicy.builder()
                .id(isPublic ? PUBLIC_ROUTE_ID : DEFAULT_ROUTE_ID)
                .pathPattern(path)
                .authRequired(!isPublic)
                .build();
    }

    private static RoutePolicy fromConfig(ApiStackProperties.RouteConfig route) {
        RoutePolicy.RoutePolicyBuilder builder = RoutePolicy.builder()
                .id(route.getId())
                .pathPattern(route.getPath())
                .authRequired(!Boolean.FALSE.equals(route.getAuthRequired()))
                .rateLimited(!Boolean.FALSE.equals(route.getRateLimited()))
                .rateLimitRequests(route.getRateLimitRequests())
                .rateLimitWindowSeconds(route.getRateLimitWindowSeconds())
                .cacheable(Boolean.TRUE.equals(route.getCacheable()))
                .cacheTtl(route.getCacheTtl())
                .principalScoped(route.getPrincipalScoped());
        route.getMethods().forEach(method -> builder.method(method.toUpperCase(Locale.ROOT)));
        route.getRequiredRoles().forEach(builder::requiredRole);
        return builder.build();
    }
}
