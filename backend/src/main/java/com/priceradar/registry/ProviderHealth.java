package com.priceradar.registry;

import java.time.Instant;

/**
 * Consecutive failure count and time of the last failure for one provider.
 */
public record ProviderHealth(int consecutiveFailures, Instant lastFailureAt) {

    public static final ProviderHealth HEALTHY = new ProviderHealth(0, null);
}
