package com.apistack.service.config;

import com.apistack.service.filter.LoggingFilter;
import com.apistack.service.filter.RateLimitFilter;
import com.apistack.service.filter.ResponseCacheFilter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.web.servlet.FilterRegistrationBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.Ordered;
import org.springframework.http.HttpHeaders;
import org.springframework.web.cors.CorsConfiguration;
import org.springframework.web.cors.UrlBasedCorsConfigurationSource;
import org.springframework.web.filter.CorsFilter;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Cross-origin access for browser clients listed in {@code apistack.security.cors-origins}.
 * Runs ahead of the request pipeline so preflight requests are answered without a token.
 */
@Slf4j
@Configuration
public class CorsConfig {

    @Bean
    public FilterRegistrationBean<CorsFilter> corsFilter(ApiStackProperties properties) {
        List<String> origins = properties.getSecurity().getCorsOrigins().stream()
                .map(String::trim)
                .filter(origin -> !origin.isEmpty())
                .collect(Collectors.toList());

        UrlBasedCorsConfigurationSource source = new UrlBasedCorsConfigurationSource();
        if (!origins.isEmpty()) {
            CorsConfiguration cors = new CorsConfiguration();
            cors.setAllowCredentials(true);
            cors.setAllowedOriginPatterns(origins);
            cors.addAllowedHeader("*");
            cors.addAllowedMethod("*");
            cors.setExposedHeaders(List.of(
                    HttpHeaders.RETRY_AFTER,
                    RateLimitFilter.LIMIT_HEADER,
                    RateLimitFilter.REMAINING_HEADER,
                    ResponseCacheFilter.CACHE_HEADER,
                    LoggingFilter.REQUEST_ID_HEADER));
            source.registerCorsConfiguration("/**", cors);
            log.info("CORS enabled for origins: {}", origins);
        } else {
            log.info("CORS disabled: no origins configured");
        }

        FilterRegistrationBean<CorsFilter> registration = new FilterRegistrationBean<>(new CorsFilter(source));
        registration.setOrder(Ordered.HIGHEST_PRECEDENCE);
        return registration;
    }
}
