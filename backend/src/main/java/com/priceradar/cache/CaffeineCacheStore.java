package com.priceradar.cache;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * In-process {@link CacheStore} on Caffeine with variable per-entry expiry.
 * Expiry is also checked lazily on read against the injected clock, so an entry is never served past expiresAt.
 */
@Slf4j
public class CaffeineCacheStore implements CacheStore {

    private final Cache<String, CacheEntry> cache;
    private final Clock clock;

    public CaffeineCacheStore(long maximumSize, Clock clock) {
        this.clock = clock;
        this.cache = Caffeine.newBuilder()
                .maximumSize(maximumSize)
                .expireAfter(new EntryExpiry(clock))
                .build();
    }

    @Override
    public <T> Optional<T> get(String key, Class<T> type) {
        Optional<Object> value = liveValue(key);
        if (value.isPresent() && !type.isInstance(value.get())) {
            log.debug("Cache entry {} holds {}, expected {}", key, value.get().getClass().getSimpleName(), type.getSimpleName());
            return Optional.empty();
        }
        return value.map(type::cast);
    }

    @Override
    @SuppressWarnings("unchecked")
    public <T> Optional<T> get(String key) {
        return (Optional<T>) liveValue(key);
    }

    private Optional<Object> liveValue(String key) {
        if (key == null) {
            return Optional.empty();
        }
        CacheEntry entry = cache.getIfPresent(key);
        if (entry == null) {
            return Optional.empty();
        }
        if (entry.isExpiredAt(clock.instant())) {
            cache.asMap().remove(key, entry);
            return Optional.empty();
        }
        return Optional.of(entry.value());
    }

    @Override
    public void set(String key, Object value, Duration ttl) {
        if (key == null || value == null || ttl == null || ttl.isNegative() || ttl.isZero()) {
            return;
        }
        cache.put(key, new CacheEntry(key, value, clock.instant().plus(ttl)));
    }

    @Override
    public void delete(String key) {
        if (key != null) {
            cache.invalidate(key);
        }
    }

    @Override
    public void clear() {
        cache.invalidateAll();
    }

    private static final class EntryExpiry implements Expiry<String, CacheEntry> {

        private final Clock clock;

        private EntryExpiry(Clock clock) {
            this.clock = clock;
        }

        @Override
        public long expireAfterCreate(String key, CacheEntry value, long currentTime) {
            return remainingNanos(value);
        }

        @Override
        public long expireAfterUpdate(String key, CacheEntry value, long currentTime, long currentDuration) {
            return remainingNanos(value);
        }

        @Override
        public long expireAfterRead(String key, CacheEntry value, long currentTime, long currentDuration) {
            return currentDuration;
        }

        private long remainingNanos(CacheEntry value) {
            Duration remaining = Duration.between(Instant.now(clock), value.expiresAt());
            return remaining.isNegative() ? 0L : remaining.toNanos();
        }
    }
}
