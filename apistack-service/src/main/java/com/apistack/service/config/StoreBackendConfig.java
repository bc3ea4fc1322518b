package com.apistack.service.config;

import com.apistack.service.cache.LocalResponseCacheStore;
import com.apistack.service.cache.RedisResponseCacheStore;
import com.apistack.service.cache.ResponseCacheStore;
import com.apistack.service.ratelimit.CounterStore;
import com.apistack.service.ratelimit.LocalCounterStore;
import com.apistack.service.ratelimit.RedisCounterStore;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.time.Clock;

/**
 * Counter and response stores. Redis is the shared default; local mode keeps both in process.
 */
@Slf4j
@Configuration
public class StoreBackendConfig {

    @Configuration
    @ConditionalOnProperty(prefix = "apistack.store", name = "mode", havingValue = "redis", matchIfMissing = true)
    static class RedisStores {

        @Bean
        public CounterStore counterStore(StringRedisTemplate redisTemplate) {
            log.info("Using Redis counter store");
            return new RedisCounterStore(redisTemplate);
        }

        @Bean
        public ResponseCacheStore responseCacheStore(StringRedisTemplate redisTemplate, ObjectMapper objectMapper) {
            return new RedisResponseCacheStore(redisTemplate, objectMapper);
        }
    }

    @Configuration
    @ConditionalOnProperty(prefix = "apistack.store", name = "mode", havingValue = "local")
    static class LocalStores {

        @Bean
        public CounterStore counterStore(Clock clock, ApiStackProperties properties) {
            log.warn("Using in-process counter store: rate limits are not shared between instances");
            return new LocalCounterStore(clock, properties.getStore().getLocalMaximumSize());
        }

        @Bean
        public ResponseCacheStore responseCacheStore(Clock clock, ApiStackProperties properties) {
            return new LocalResponseCacheStore(clock, properties.getStore().getLocalMaximumSize());
        }
    }
}
