package com.apistack.service.cache;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

/**
 * Caffeine-backed response store for single-node deployments and tests.
 * Expiry follows the injected clock, so a simulated clock drives eviction.
 */
public class LocalResponseCacheStore implements ResponseCacheStore {

    private final Cache<String, Entry> entries;

    public LocalResponseCacheStore(Clock clock, long maximumSize) {
        this.entries = Caffeine.newBuilder()
                .maximumSize(maximumSize)
                .ticker(() -> TimeUnit.MILLISECONDS.toNanos(clock.millis()))
                .expireAfter(new Expiry<String, Entry>() {
                    @Override
                    public long expireAfterCreate(String key, Entry entry, long currentTime) {
                        return entry.ttl.toNanos();
                    }

                    @Override
                    public long expireAfterUpdate(String key, Entry entry, long currentTime, long currentDuration) {
                        return entry.ttl.toNanos();
                    }

                    @Override
                    public long expireAfterRead(String key, Entry entry, long currentTime, long currentDuration) {
                        return currentDuration;
                    }
                })
                .build();
    }

    @Override
    public Optional<CachedResponse> get(String key) {
        Entry entry = entries.getIfPresent(key);
        return entry != null ? Optional.of(entry.response) : Optional.empty();
    }

    @Override
    public void put(String key, CachedResponse response, Duration ttl) {
        entries.put(key, new Entry(response, ttl));
    }

    @Override
    public void delete(String key) {
        entries.invalidate(key);
    }

    @Override
    public long deleteByPrefix(String prefix) {
        List<String> keys = entries.asMap().keySet().stream()
                .filter(key -> key.startsWith(prefix))
                .collect(Collectors.toList());
        entries.invalidateAll(keys);
        return keys.size();
    }

    private static final class Entry {
        private final CachedResponse response;
        private final Duration ttl;

        private Entry(CachedResponse response, Duration ttl) {
            this.response = response;
            this.ttl = ttl;
        }
    }
}
