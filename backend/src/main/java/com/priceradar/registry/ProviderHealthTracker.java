package com.priceradar.registry;

import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Remembers provider failures across calls. Outcomes are always recorded; skipping only happens when enabled:
 * a provider with at least failureThreshold consecutive failures is skipped until cooldown has elapsed since its
 * last failure, then it is tried again. A success resets the record.
 */
@Slf4j
public class ProviderHealthTracker {

    private final boolean enabled;
    private final int failureThreshold;
    private final Duration cooldown;
    private final Clock clock;
    private final Map<String, ProviderHealth> health = new ConcurrentHashMap<>();

    public ProviderHealthTracker(boolean enabled, int failureThreshold, Duration cooldown, Clock clock) {
        if (failureThreshold <= 0) {
            throw new IllegalArgumentException("failureThreshold must be positive");
        }
        this.enabled = enabled;
        this.failureThreshold = failureThreshold;
        this.cooldown = cooldown;
        this.clock = clock;
    }

    public static ProviderHealthTracker disabled(Clock clock) {
        return new ProviderHealthTracker(false, 1, Duration.ZERO, clock);
    }

    public void recordSuccess(String provider) {
        health.remove(provider);
    }

    public void recordFailure(String provider) {
        Instant now = clock.instant();
        ProviderHealth updated = health.merge(provider, new ProviderHealth(1, now),
                (old, one) -> new ProviderHealth(old.consecutiveFailures() + 1, now));
        if (enabled && updated.consecutiveFailures() == failureThreshold) {
            log.warn("Provider {} reached {} consecutive failures, cooling down for {}", provider, failureThreshold, cooldown);
        }
    }

    /**
     * True when tracking is enabled and the provider is inside its cooldown window.
     */
    public boolean isCoolingDown(String provider) {
        if (!enabled) {
            return false;
        }
        ProviderHealth h = health.get(provider);
        if (h == null || h.consecutiveFailures() < failureThreshold) {
            return false;
        }
        return clock.instant().isBefore(h.lastFailureAt().plus(cooldown));
    }

    public ProviderHealth get(String provider) {
        return health.getOrDefault(provider, ProviderHealth.HEALTHY);
    }

    public void forget(String provider) {
        health.remove(provider);
    }

    public boolean isEnabled() {
        return enabled;
    }
}
