package com.apistack.service.cache;

import com.apistack.common.exception.CacheException;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.Executor;

/**
 * Response cache facade used by the pipeline and by application code that needs to invalidate.
 *
 * <p>Reads that fail are treated as misses and writes run on a background executor, so a broken
 * store slows nothing down and never fails a request. Invalidation is manual: nothing tracks which
 * data a cached response was built from, and entries stay until their TTL runs out or someone
 * calls {@link #invalidate} or {@link #invalidateNamespace}.
 */
@Slf4j
public class ResponseCache {

    public static final String KEY_PREFIX = "apistack:cache:";

    private final ResponseCacheStore store;
    private final Executor writeExecutor;
    private final String defaultNamespace;

    public ResponseCache(ResponseCacheStore store, Executor writeExecutor, String defaultNamespace) {
        this.store = store;
        this.writeExecutor = writeExecutor;
        this.defaultNamespace = defaultNamespace;
    }

    public Optional<CachedResponse> get(String fingerprint) {
        return get(defaultNamespace, fingerprint);
    }

    public Optional<CachedResponse> get(String namespace, String fingerprint) {
        String key = key(namespace, fingerprint);
        try {
            return store.get(key);
        } catch (CacheException e) {
            log.warn("Cache read failed for {}, treating as miss: {}", key, e.getMessage());
            return Optional.empty();
        }
    }

    public void put(String fingerprint, CachedResponse response, Duration ttl) {
        put(defaultNamespace, fingerprint, response, ttl);
    }

    /**
     * Store asynchronously. Failures are logged and dropped.
     */
    public void put(String namespace, String fingerprint, CachedResponse response, Duration ttl) {
        if (ttl == null || ttl.isZero() || ttl.isNegative()) {
            log.debug("Not caching {} with non-positive ttl {}", fingerprint, ttl);
            return;
        }
        String key = key(namespace, fingerprint);
        writeExecutor.execute(() -> {
            try {
                store.put(key, response, ttl);
                log.debug("Cached {} for {}s", key, ttl.toSeconds());
            } catch (RuntimeException e) {
                log.warn("Cache write failed for {}: {}", key, e.getMessage());
            }
        });
    }

    public void invalidate(String fingerprint) {
        invalidate(defaultNamespace, fingerprint);
    }

    public void invalidate(String namespace, String fingerprint) {
        store.delete(key(namespace, fingerprint));
    }

    /**
     * Drop every entry in a namespace.
     *
     * @return number of entries removed
     */
    public long invalidateNamespace(String namespace) {
        long removed = store.deleteByPrefix(KEY_PREFIX + namespace + ":");
        log.info("Invalidated {} cached responses in namespace {}", removed, namespace);
        return removed;
    }

    public String getDefaultNamespace() {
        return defaultNamespace;
    }

    static String key(String namespace, String fingerprint) {
        return KEY_PREFIX + namespace + ":" + fingerprint;
    }
}
