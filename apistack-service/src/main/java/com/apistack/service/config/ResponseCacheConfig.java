package com.apistack.service.config;

import com.apistack.service.cache.ResponseCache;
import com.apistack.service.cache.ResponseCacheStore;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.Executor;

/**
 * Cache configuration for the response cache.
 */
@Configuration
public class ResponseCacheConfig {

    @Bean
    public ResponseCache responseCache(ResponseCacheStore store,
                                       @Qualifier("cacheWriteExecutor") Executor cacheWriteExecutor,
                                       ApiStackProperties properties) {
        return new ResponseCache(store, cacheWriteExecutor, properties.getCache().getDefaultNamespace());
    }
}
