package com.priceradar.aggregation.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Fallback, retry, timeout and cache policy settings. Documented in application.yml under priceradar.aggregation.
 */
@ConfigurationProperties(prefix = "priceradar.aggregation")
@Getter
@Setter
public class AggregationProperties {

    /** Per-attempt timeout for current price and the single-attempt lookups. */
    private long timeoutMs = 10_000;

    /** Retries per provider after the first attempt. */
    private int maxRetries = 2;

    /** Backoff base: wait baseDelayMs * (attempt + 1) before retrying the same provider. */
    private long baseDelayMs = 500;

    /** Jitter factor in [0, 1/3) applied to backoff delays, so each delay stays above the previous one. 0 keeps delays exact. */
    private double jitterFactor = 0.0;

    /** Historical series are larger: their per-attempt timeout is timeoutMs times this. */
    private int historicalTimeoutMultiplier = 2;

    /** Initial fallback order. Names without an adapter are kept and skipped. */
    private List<String> priority = new ArrayList<>(List.of("coinGecko", "coinMarketCap", "binance", "coinGlass", "coinApi"));

    /** Assets cached for 60s instead of 300s. */
    private List<String> highVolatilityAssets = new ArrayList<>(List.of("BTC", "ETH", "BNB", "SOL", "XRP", "ADA"));

    /** Per-provider overrides keyed by provider name; unset fields use the values above. */
    private Map<String, ProviderOverride> providers = new HashMap<>();

    private Health health = new Health();

    @Getter
    @Setter
    public static class ProviderOverride {
        private Long timeoutMs;
        private Integer maxRetries;
        private Long baseDelayMs;
    }

    /**
     * Cross-call provider health tracking. Off by default: every call then retries every provider from a clean slate.
     */
    @Getter
    @Setter
    public static class Health {
        private boolean enabled = false;
        /** Consecutive failed attempts before a provider is skipped. */
        private int failureThreshold = 5;
        /** How long a failing provider is skipped before being tried again. */
        private long cooldownMs = 60_000;
    }
}
