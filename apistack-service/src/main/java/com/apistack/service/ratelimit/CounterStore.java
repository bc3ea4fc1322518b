package com.apistack.service.ratelimit;

import java.time.Duration;

/**
 * Shared counters with expiry. Implementations must increment atomically on the store side.
 */
public interface CounterStore {

    /**
     * Increment the counter and make sure it expires after {@code ttl}.
     *
     * @return the value after incrementing
     * @throws com.apistack.common.exception.CacheException when the store is unreachable
     */
    long incrementAndGet(String key, Duration ttl);

    void delete(String key);

    boolean ping();
}
