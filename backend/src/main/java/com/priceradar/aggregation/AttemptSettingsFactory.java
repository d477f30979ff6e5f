package com.priceradar.aggregation;

import com.priceradar.aggregation.config.AggregationProperties;
import com.priceradar.common.RetryPolicy;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Resolves per-provider attempt settings from global defaults and priceradar.aggregation.providers overrides.
 */
@Component
@RequiredArgsConstructor
public class AttemptSettingsFactory {

    private final AggregationProperties properties;

    /**
     * Current price: per-call timeout wins over the provider override, which wins over the default.
     */
    public AttemptSettings forCurrentPrice(String provider, Long callTimeoutMs) {
        Duration timeout = callTimeoutMs != null && callTimeoutMs > 0
                ? Duration.ofMillis(callTimeoutMs)
                : providerTimeout(provider);
        return new AttemptSettings(timeout, retryPolicy(provider));
    }

    public AttemptSettings forHistoricalData(String provider) {
        int multiplier = Math.max(1, properties.getHistoricalTimeoutMultiplier());
        return new AttemptSettings(providerTimeout(provider).multipliedBy(multiplier), retryPolicy(provider));
    }

    /**
     * One attempt per provider, used by listing, details and market info.
     */
    public AttemptSettings singleAttempt(String provider) {
        return new AttemptSettings(providerTimeout(provider), new RetryPolicy(0L, 0.0, 0));
    }

    public Duration defaultTimeout() {
        return Duration.ofMillis(properties.getTimeoutMs());
    }

    private Duration providerTimeout(String provider) {
        AggregationProperties.ProviderOverride o = properties.getProviders().get(provider);
        long ms = o != null && o.getTimeoutMs() != null ? o.getTimeoutMs() : properties.getTimeoutMs();
        return Duration.ofMillis(ms);
    }

    private RetryPolicy retryPolicy(String provider) {
        AggregationProperties.ProviderOverride o = properties.getProviders().get(provider);
        long baseDelay = o != null && o.getBaseDelayMs() != null ? o.getBaseDelayMs() : properties.getBaseDelayMs();
        int retries = o != null && o.getMaxRetries() != null ? o.getMaxRetries() : properties.getMaxRetries();
        return new RetryPolicy(baseDelay, properties.getJitterFactor(), retries);
    }
}
