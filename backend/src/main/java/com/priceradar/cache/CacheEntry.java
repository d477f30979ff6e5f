package com.priceradar.cache;

import java.time.Instant;

/**
 * Stored value with its absolute expiry. Never partially updated; a write replaces the whole entry.
 */
public record CacheEntry(String key, Object value, Instant expiresAt) {

    public boolean isExpiredAt(Instant now) {
        return !now.isBefore(expiresAt);
    }
}
