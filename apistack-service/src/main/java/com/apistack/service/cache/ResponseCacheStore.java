package com.apistack.service.cache;

import java.time.Duration;
import java.util.Optional;

/**
 * Key/value storage for cached responses with store-enforced expiry.
 * All methods throw {@link com.apistack.common.exception.CacheException} when the store cannot be reached.
 */
public interface ResponseCacheStore {

    Optional<CachedResponse> get(String key);

    /**
     * Write the entry and its expiry in one step, so readers never see an entry without a TTL.
     */
    void put(String key, CachedResponse response, Duration ttl);

    void delete(String key);

    /**
     * @return number of entries removed
     */
    long deleteByPrefix(String prefix);
}
