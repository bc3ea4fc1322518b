package com.apistack.service.ratelimit;

import com.apistack.common.exception.CacheException;
import com.apistack.common.exception.ErrorCode;
import com.apistack.common.util.ManualClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

/**
 * Tests for fixed-window admission over the in-process counter store
 */
public class FixedWindowRateLimiterTest {

    // 10 seconds into a 60 second bucket
    private static final Instant START = Instant.parse("2024-01-01T00:00:10Z");

    private ManualClock clock;
    private FixedWindowRateLimiter limiter;

    @BeforeEach
    void setUp() {
        clock = new ManualClock(START);
        limiter = new FixedWindowRateLimiter(new LocalCounterStore(clock, 1000), clock, FailureMode.FAIL_OPEN);
    }

    @Test
    void testLimitPlusOneIsRejected() {
        for (int i = 1; i <= 5; i++) {
            RateLimitDecision decision = limiter.admit("route:user:alice", 5, 60);
            assertTrue(decision.isAdmitted(), "call " + i + " should be admitted");
            assertEquals(5 - i, decision.getRemaining());
        }

        RateLimitDecision rejected = limiter.admit("route:user:alice", 5, 60);

        assertFalse(rejected.isAdmitted());
        assertEquals(0, rejected.getRemaining());
        assertEquals(6, rejected.getCount());
        assertEquals(50, rejected.getRetryAfterSeconds());
    }

    @Test
    void testRejectedCallsStayCounted() {
        for (int i = 0; i < 4; i++) {
            limiter.admit("k", 2, 60);
        }

        assertEquals(5, limiter.admit("k", 2, 60).getCount());
    }

    @Test
    void testNewWindowResetsCount() {
        for (int i = 0; i < 3; i++) {
            limiter.admit("k", 3, 60);
        }
        assertFalse(limiter.admit("k", 3, 60).isAdmitted());

        clock.advance(Duration.ofSeconds(50));
        RateLimitDecision decision = limiter.admit("k", 3, 60);

        assertTrue(decision.isAdmitted());
        assertEquals(1, decision.getCount());
    }

    @Test
    void testRetryAfterIsAtLeastOneSecond() {
        clock.set(Instant.parse("2024-01-01T00:00:59.900Z"));
        limiter.admit("k", 1, 60);

        RateLimitDecision rejected = limiter.admit("k", 1, 60);

        assertFalse(rejected.isAdmitted());
        assertEquals(1, rejected.getRetryAfterSeconds());
    }

    @Test
    void testKeysDoNotShareCounters() {
        limiter.admit("orders:user:alice", 1, 60);

        assertTrue(limiter.admit("orders:user:bob", 1, 60).isAdmitted());
        assertTrue(limiter.admit("reports:user:alice", 1, 60).isAdmitted());
        assertFalse(limiter.admit("orders:user:alice", 1, 60).isAdmitted());
    }

    @Test
    void testReset() {
        limiter.admit("k", 1, 60);
        assertFalse(limiter.admit("k", 1, 60).isAdmitted());

        limiter.reset("k", 60);

        assertTrue(limiter.admit("k", 1, 60).isAdmitted());
    }

    @Test
    void testFailOpenAdmitsWhenStoreIsDown() {
        FixedWindowRateLimiter failing = new FixedWindowRateLimiter(brokenStore(), clock, FailureMode.FAIL_OPEN);

        RateLimitDecision decision = failing.admit("k", 5, 60);

        assertTrue(decision.isAdmitted());
        assertTrue(decision.isDegraded());
    }

    @Test
    void testFailClosedRejectsWhenStoreIsDown() {
        FixedWindowRateLimiter failing = new FixedWindowRateLimiter(brokenStore(), clock, FailureMode.FAIL_CLOSED);

        RateLimitDecision decision = failing.admit("k", 5, 60);

        assertFalse(decision.isAdmitted());
        assertTrue(decision.isDegraded());
        assertEquals(50, decision.getRetryAfterSeconds());
    }

    @Test
    void testInvalidArguments() {
        assertThrows(IllegalArgumentException.class, () -> limiter.admit("k", 0, 60));
        assertThrows(IllegalArgumentException.class, () -> limiter.admit("k", 1, 0));
    }

    @Test
    void testStoreKeyLayout() {
        assertEquals(28401120L, FixedWindowRateLimiter.bucketOf(START.toEpochMilli(), 60));
        assertEquals("apistack:rl:orders:ip:10.0.0.1:28401120",
                FixedWindowRateLimiter.storeKey("orders:ip:10.0.0.1", 28401120L));
    }

    private static CounterStore brokenStore() {
        CounterStore store = mock(CounterStore.class);
        when(store.incrementAndGet(anyString(), any(Duration.class)))
                .thenThrow(new CacheException(ErrorCode.COUNTER_STORE_UNREACHABLE, "connection refused", null));
        return store;
    }
}
