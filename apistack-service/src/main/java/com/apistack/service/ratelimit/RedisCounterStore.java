package com.apistack.service.ratelimit;

import com.apistack.common.exception.CacheException;
import com.apistack.common.exception.ErrorCode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.connection.RedisConnection;
import org.springframework.data.redis.core.RedisCallback;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;
import org.springframework.data.redis.core.script.RedisScript;

import java.time.Duration;
import java.util.List;

/**
 * Redis counters. INCR and EXPIRE run in one Lua script so a counter can never be left without a TTL.
 */
@Slf4j
public class RedisCounterStore implements CounterStore {

    static final RedisScript<Long> INCREMENT_SCRIPT = new DefaultRedisScript<>(
            "local current = redis.call('INCR', KEYS[1])\n"
                    + "if current == 1 or redis.call('TTL', KEYS[1]) < 0 then\n"
                    + "  redis.call('EXPIRE', KEYS[1], ARGV[1])\n"
                    + "end\n"
                    + "return current",
            Long.class);

    private final StringRedisTemplate redisTemplate;

    public RedisCounterStore(StringRedisTemplate redisTemplate) {
        this.redisTemplate = redisTemplate;
    }

    @Override
    public long incrementAndGet(String key, Duration ttl) {
        long ttlSeconds = Math.max(1, ttl.toSeconds());
        Long count;
        try {
            count = redisTemplate.execute(INCREMENT_SCRIPT, List.of(key), String.valueOf(ttlSeconds));
        } catch (DataAccessException e) {
            throw new CacheException(ErrorCode.COUNTER_STORE_UNREACHABLE, "Failed to increment " + key, e);
        }
        if (count == null) {
            throw new CacheException(ErrorCode.COUNTER_STORE_UNREACHABLE, "No reply incrementing " + key, null);
        }
        return count;
    }

    @Override
    public void delete(String key) {
        try {
            redisTemplate.delete(key);
        } catch (DataAccessException e) {
            throw new CacheException(ErrorCode.COUNTER_STORE_UNREACHABLE, "Failed to delete " + key, e);
        }
    }

    @Override
    public boolean ping() {
        try {
            String reply = redisTemplate.execute((RedisCallback<String>) RedisConnection::ping);
            return "PONG".equalsIgnoreCase(reply);
        } catch (DataAccessException e) {
            log.warn("Counter store ping failed: {}", e.getMessage());
            return false;
        }
    }
}
