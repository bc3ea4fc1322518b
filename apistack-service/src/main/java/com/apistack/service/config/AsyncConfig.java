package com.apistack.service.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * Async configuration for cache writes
 * Keeps store round-trips off the request thread
 */
@Slf4j
@Configuration
public class AsyncConfig {

    @Bean(name = "cacheWriteExecutor")
    public Executor cacheWriteExecutor(ApiStackProperties properties) {
        ApiStackProperties.ExecutorConfig config = properties.getCache().getWriter();
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(config.getCorePoolSize());
        executor.setMaxPoolSize(config.getMaxPoolSize());
        executor.setQueueCapacity(config.getQueueCapacity());
        executor.setThreadNamePrefix("cache-write-");

        // Rejection policy - caller runs if queue full (back-pressure)
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());

        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(10);
        executor.initialize();

        log.info("Cache write executor initialized: core={}, max={}, queue={}",
                executor.getCorePoolSize(), executor.getMaxPoolSize(), config.getQueueCapacity());
        return executor;
    }
}
