package com.apistack.service.ratelimit;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * In-process counters for single-node deployments and tests. Counts are not shared between instances.
 */
public class LocalCounterStore implements CounterStore {

    private final Clock clock;
    private final Cache<String, Window> counters;

    public LocalCounterStore(Clock clock, long maximumSize) {
        this.clock = clock;
        this.counters = Caffeine.newBuilder()
                .maximumSize(maximumSize)
                .ticker(() -> TimeUnit.MILLISECONDS.toNanos(clock.millis()))
                .expireAfter(new Expiry<String, Window>() {
                    @Override
                    public long expireAfterCreate(String key, Window window, long currentTime) {
                        return remainingNanos(window);
                    }

                    @Override
                    public long expireAfterUpdate(String key, Window window, long currentTime, long currentDuration) {
                        return remainingNanos(window);
                    }

                    @Override
                    public long expireAfterRead(String key, Window window, long currentTime, long currentDuration) {
                        return currentDuration;
                    }
                })
                .build();
    }

    @Override
    public long incrementAndGet(String key, Duration ttl) {
        long now = clock.millis();
        Window updated = counters.asMap().compute(key, (k, current) ->
                current == null || current.expiresAtMillis <= now
                        ? new Window(1, now + ttl.toMillis())
                        : new Window(current.count + 1, current.expiresAtMillis));
        return updated.count;
    }

    @Override
    public void delete(String key) {
        counters.invalidate(key);
    }

    @Override
    public boolean ping() {
        return true;
    }

    private long remainingNanos(Window window) {
        return TimeUnit.MILLISECONDS.toNanos(Math.max(0, window.expiresAtMillis - clock.millis()));
    }

    private static final class Window {
        private final long count;
        private final long expiresAtMillis;

        private Window(long count, long expiresAtMillis) {
            this.count = count;
            this.expiresAtMillis = expiresAtMillis;
        }
    }
}
