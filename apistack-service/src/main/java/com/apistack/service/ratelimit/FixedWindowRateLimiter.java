package com.apistack.service.ratelimit;

import com.apistack.common.exception.CacheException;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;

/**
 * Fixed-window limiter over a shared {@link CounterStore}.
 *
 * <p>Time is split into buckets of {@code windowSeconds}; every call increments the counter of the
 * current bucket and is admitted while the count stays within the limit. Rejected calls stay counted.
 * A burst of up to twice the limit is possible across a bucket boundary.
 */
@Slf4j
public class FixedWindowRateLimiter {

    public static final String KEY_PREFIX = "apistack:rl:";

    private final CounterStore store;
    private final Clock clock;
    private final FailureMode failureMode;

    public FixedWindowRateLimiter(CounterStore store, Clock clock, FailureMode failureMode) {
        this.store = store;
        this.clock = clock;
        this.failureMode = failureMode;
    }

    public RateLimitDecision admit(String key, int limit, int windowSeconds) {
        validate(limit, windowSeconds);

        long nowMillis = clock.millis();
        long bucket = bucketOf(nowMillis, windowSeconds);
        long retryAfter = retryAfterSeconds(nowMillis, bucket, windowSeconds);
        String storeKey = storeKey(key, bucket);

        long count;
        try {
            count = store.incrementAndGet(storeKey, Duration.ofSeconds(windowSeconds));
        } catch (CacheException e) {
            return degraded(key, limit, retryAfter, e);
        }

        boolean admitted = count <= limit;
        if (!admitted) {
            log.debug("Rate limit reached for {}: count={}, limit={}, retryAfter={}s", key, count, limit, retryAfter);
        }
        return RateLimitDecision.builder()
                .admitted(admitted)
                .count(count)
                .limit(limit)
                .remaining(Math.max(0, limit - count))
                .retryAfterSeconds(admitted ? 0 : retryAfter)
                .build();
    }

    /**
     * Drop the counter of the current window for {@code key}.
     */
    public void reset(String key, int windowSeconds) {
        validate(1, windowSeconds);
        store.delete(storeKey(key, bucketOf(clock.millis(), windowSeconds)));
    }

    private RateLimitDecision degraded(String key, int limit, long retryAfter, CacheException e) {
        boolean admitted = failureMode == FailureMode.FAIL_OPEN;
        log.warn("Counter store unavailable for {}, {} ({})", key,
                admitted ? "admitting" : "rejecting", e.getMessage());
        return RateLimitDecision.builder()
                .admitted(admitted)
                .count(0)
                .limit(limit)
                .remaining(admitted ? limit : 0)
                .retryAfterSeconds(admitted ? 0 : retryAfter)
                .degraded(true)
                .build();
    }

    static long bucketOf(long nowMillis, int windowSeconds) {
        return Math.floorDiv(Math.floorDiv(nowMillis, 1000L), windowSeconds);
    }

    static long retryAfterSeconds(long nowMillis, long bucket, int windowSeconds) {
        long windowEndMillis = (bucket + 1) * windowSeconds * 1000L;
        long seconds = (windowEndMillis - nowMillis + 999) / 1000;
        return Math.max(1, seconds);
    }

    static String storeKey(String key, long bucket) {
        return KEY_PREFIX + key + ":" + bucket;
    }

    private static void validate(int limit, int windowSeconds) {
        if (limit <= 0) {
            throw new IllegalArgumentException("Limit must be positive: " + limit);
        }
        if (windowSeconds <= 0) {
            throw new IllegalArgumentException("Window must be positive: " + windowSeconds);
        }
    }
}
