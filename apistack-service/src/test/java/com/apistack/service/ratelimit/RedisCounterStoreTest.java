package com.apistack.service.ratelimit;

import com.apistack.common.exception.CacheException;
import com.apistack.common.exception.ErrorCode;
import org.junit.jupiter.api.Test;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * Verifies the store talks to Redis through the atomic increment script
 */
public class RedisCounterStoreTest {

    @Test
    void testIncrementRunsScriptWithTtl() {
        StringRedisTemplate redis = mock(StringRedisTemplate.class);
        when(redis.execute(eq(RedisCounterStore.INCREMENT_SCRIPT), eq(List.of("apistack:rl:k:1")), eq("60")))
                .thenReturn(3L);

        long count = new RedisCounterStore(redis).incrementAndGet("apistack:rl:k:1", Duration.ofSeconds(60));

        assertEquals(3L, count);
        verify(redis, never()).opsForValue();
    }

    @Test
    void testScriptSetsExpiryOnFirstIncrementOnly() {
        String script = RedisCounterStore.INCREMENT_SCRIPT.getScriptAsString();

        assertTrue(script.contains("INCR"));
        assertTrue(script.contains("current == 1"));
        assertTrue(script.contains("EXPIRE"));
    }

    @Test
    void testConnectionFailureBecomesCacheException() {
        StringRedisTemplate redis = mock(StringRedisTemplate.class);
        when(redis.execute(eq(RedisCounterStore.INCREMENT_SCRIPT), anyList(), eq("1")))
                .thenThrow(new RedisConnectionFailureException("refused"));

        CacheException e = assertThrows(CacheException.class,
                () -> new RedisCounterStore(redis).incrementAndGet("k", Duration.ofSeconds(1)));

        assertEquals(ErrorCode.COUNTER_STORE_UNREACHABLE, e.getErrorCode());
    }
}
