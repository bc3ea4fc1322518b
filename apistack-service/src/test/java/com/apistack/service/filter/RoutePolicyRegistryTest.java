package com.apistack.service.filter;

import com.apistack.service.config.ApiStackProperties;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class RoutePolicyRegistryTest {

    @Test
    void testConfiguredRouteIsResolved() {
        ApiStackProperties properties = new ApiStackProperties();
        ApiStackProperties.RouteConfig route = new ApiStackProperties.RouteConfig();
        route.setId("catalog");
        route.setPath("/catalog/**");
        route.setMethods(List.of("get", "head"));
        route.setCacheable(true);
        route.setCacheTtl(Duration.ofMinutes(5));
        route.setRateLimitRequests(20);
        route.setRequiredRoles(List.of("READER"));
        properties.setRoutes(List.of(route));

        RoutePolicy policy = new RoutePolicyRegistry(properties).resolve("GET", "/catalog/books/1");

        assertEquals("catalog", policy.getId());
        assertTrue(policy.isCacheable());
        assertTrue(policy.isAuthRequired());
        assertEquals(Duration.ofMinutes(5), policy.getCacheTtl());
        assertEquals(20, policy.getRateLimitRequests());
        assertEquals(java.util.Set.of("READER"), policy.getRequiredRoles());
    }

    @Test
    void testMethodMismatchFallsBackToDefault() {
        RoutePolicyRegistry registry = new RoutePolicyRegistry(new ApiStackProperties());
        registry.register(RoutePolicy.builder().id("reads").pathPattern("/data/**").method("GET").build());

        assertEquals("reads", registry.resolve("GET", "/data/x").getId());
        assertEquals(RoutePolicyRegistry.DEFAULT_ROUTE_ID, registry.resolve("POST", "/data/x").getId());
    }

    @Test
    void testPublicPathsSkipAuthentication() {
        RoutePolicyRegistry registry = new RoutePolicyRegistry(new ApiStackProperties());

        RoutePolicy health = registry.resolve("GET", "/health/ready");
        RoutePolicy other = registry.resolve("GET", "/orders");

        assertEquals(RoutePolicyRegistry.PUBLIC_ROUTE_ID, health.getId());
        assertFalse(health.isAuthRequired());
        assertTrue(other.isAuthRequired());
        assertFalse(other.isCacheable());
    }

    @Test
    void testFirstMatchWins() {
        RoutePolicyRegistry registry = new RoutePolicyRegistry(new ApiStackProperties());
        registry.register(RoutePolicy.builder().id("specific").pathPattern("/a/b").build());
        registry.register(RoutePolicy.builder().id("broad").pathPattern("/a/**").build());

        assertEquals("specific", registry.resolve("GET", "/a/b").getId());
        assertEquals("broad", registry.resolve("GET", "/a/c/d").getId());
    }

    @Test
    void testPathPatterns() {
        assertTrue(PathPatterns.matches("/a", "/a/**"));
        assertTrue(PathPatterns.matches("/a/b/c", "/a/**"));
        assertFalse(PathPatterns.matches("/ab", "/a/**"));
        assertTrue(PathPatterns.matches("/a/b", "/a/*"));
        assertFalse(PathPatterns.matches("/a/b/c", "/a/*"));
        assertTrue(PathPatterns.matches("/exact", " /exact "));
    }

    @Test
    void testCacheableAuthenticatedRouteIsScopedToCallerByDefault() {
        RoutePolicy authenticated = RoutePolicy.builder().id("a").pathPattern("/a").cacheable(true).build();
        RoutePolicy open = RoutePolicy.builder().id("b").pathPattern("/b").cacheable(true).authRequired(false).build();
        RoutePolicy shared = authenticated.toBuilder().principalScoped(false).build();

        assertTrue(authenticated.isPrincipalScoped());
        assertFalse(open.isPrincipalScoped());
        assertFalse(shared.isPrincipalScoped());
    }

    @Test
    void testConfiguredRouteKeepsCallerScopeUnlessDisabled() {
        ApiStackProperties properties = new ApiStackProperties();
        ApiStackProperties.RouteConfig scoped = new ApiStackProperties.RouteConfig();
        scoped.setId("me");
        scoped.setPath("/me");
        scoped.setCacheable(true);
        ApiStackProperties.RouteConfig shared = new ApiStackProperties.RouteConfig();
        shared.setId("news");
        shared.setPath("/news");
        shared.setCacheable(true);
        shared.setPrincipalScoped(false);
        properties.setRoutes(List.of(scoped, shared));

        RoutePolicyRegistry registry = new RoutePolicyRegistry(properties);

        assertTrue(registry.resolve("GET", "/me").isPrincipalScoped());
        assertFalse(registry.resolve("GET", "/news").isPrincipalScoped());
    }
}
