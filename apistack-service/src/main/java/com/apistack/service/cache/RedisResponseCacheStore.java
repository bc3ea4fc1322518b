package com.apistack.service.cache;

import com.apistack.common.exception.CacheException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.Cursor;
import org.springframework.data.redis.core.ScanOptions;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Redis-backed response store. Entries are JSON strings written with SET ... EX.
 */
@Slf4j
public class RedisResponseCacheStore implements ResponseCacheStore {

    private static final int SCAN_BATCH = 500;

    private final StringRedisTemplate redisTemplate;
    private final ObjectMapper objectMapper;

    public RedisResponseCacheStore(StringRedisTemplate redisTemplate, ObjectMapper objectMapper) {
        this.redisTemplate = redisTemplate;
        this.objectMapper = objectMapper;
    }

    @Override
    public Optional<CachedResponse> get(String key) {
        String json;
        try {
            json = redisTemplate.opsForValue().get(key);
        } catch (DataAccessException e) {
            throw new CacheException("Failed to read " + key, e);
        }
        if (json == null) {
            return Optional.empty();
        }
        try {
            return Optional.of(objectMapper.readValue(json, CachedResponse.class));
        } catch (JsonProcessingException e) {
            log.warn("Discarding unreadable cache entry {}: {}", key, e.getOriginalMessage());
            delete(key);
            return Optional.empty();
        }
    }

    @Override
    public void put(String key, CachedResponse response, Duration ttl) {
        String json;
        try {
            json = objectMapper.writeValueAsString(response);
        } catch (JsonProcessingException e) {
            throw new CacheException("Failed to serialize response for " + key, e);
        }
        try {
            redisTemplate.opsForValue().set(key, json, ttl);
        } catch (DataAccessException e) {
            throw new CacheException("Failed to write " + key, e);
        }
    }

    @Override
    public void delete(String key) {
        try {
            redisTemplate.delete(key);
        } catch (DataAccessException e) {
            throw new CacheException("Failed to delete " + key, e);
        }
    }

    @Override
    public long deleteByPrefix(String prefix) {
        ScanOptions options = ScanOptions.scanOptions().match(prefix + "*").count(SCAN_BATCH).build();
        long removed = 0;
        try (Cursor<String> cursor = redisTemplate.scan(options)) {
            List<String> batch = new ArrayList<>(SCAN_BATCH);
            while (cursor.hasNext()) {
                batch.add(cursor.next());
                if (batch.size() == SCAN_BATCH) {
                    removed += deleteBatch(batch);
                }
            }
            removed += deleteBatch(batch);
        } catch (DataAccessException e) {
            throw new CacheException("Failed to invalidate prefix " + prefix, e);
        }
        log.debug("Removed {} cache entries under {}", removed, prefix);
        return removed;
    }

    private long deleteBatch(List<String> batch) {
        if (batch.isEmpty()) {
            return 0;
        }
        Long deleted = redisTemplate.delete(batch);
        batch.clear();
        return deleted != null ? deleted : 0;
    }
}
