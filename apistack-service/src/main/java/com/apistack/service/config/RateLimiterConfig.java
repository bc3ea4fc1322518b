package com.apistack.service.config;

import com.apistack.service.ratelimit.CounterStore;
import com.apistack.service.ratelimit.FixedWindowRateLimiter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Rate Limiting Configuration.
 * Fixed windows counted in the shared counter store, keyed by route and caller.
 */
@Slf4j
@Configuration
public class RateLimiterConfig {

    @Bean
    public FixedWindowRateLimiter fixedWindowRateLimiter(CounterStore counterStore, Clock clock,
                                                         ApiStackProperties properties) {
        ApiStackProperties.RateLimitConfig config = properties.getRateLimit();
        log.info("Rate limiting {}: {} requests per {}s, failure mode {}",
                Boolean.TRUE.equals(config.getEnabled()) ? "enabled" : "disabled",
                config.getRequests(), config.getWindowSeconds(), config.getFailureMode());
        return new FixedWindowRateLimiter(counterStore, clock, config.getFailureMode());
    }
}
