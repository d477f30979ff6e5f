package com.priceradar.cache;

import java.time.Duration;
import java.util.Optional;

/**
 * Key/value store with per-entry TTL. Reads after expiry are misses.
 */
public interface CacheStore {

    <T> Optional<T> get(String key, Class<T> type);

    /**
     * Untyped read for generic values such as lists; the caller asserts the type it stored under this key.
     */
    <T> Optional<T> get(String key);

    void set(String key, Object value, Duration ttl);

    void delete(String key);

    void clear();
}
