package com.priceradar.cache;

import java.time.Duration;
import java.util.Collection;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * TTLs for cached results. Pure: depends only on the asset symbol, the history period and the configured
 * high-volatility allow-list.
 */
public final class CacheTtlPolicy {

    public static final Set<String> DEFAULT_HIGH_VOLATILITY_ASSETS = Set.of("BTC", "ETH", "BNB", "SOL", "XRP", "ADA");

    public static final Duration VOLATILE_PRICE_TTL = Duration.ofSeconds(60);
    public static final Duration PRICE_TTL = Duration.ofSeconds(300);
    public static final Duration ASSET_LIST_TTL = Duration.ofHours(24);
    public static final Duration ASSET_DETAILS_TTL = Duration.ofHours(1);
    public static final Duration MARKET_INFO_TTL = Duration.ofMinutes(5);

    private final Set<String> highVolatilityAssets;

    public CacheTtlPolicy(Collection<String> highVolatilityAssets) {
        this.highVolatilityAssets = highVolatilityAssets == null
                ? DEFAULT_HIGH_VOLATILITY_ASSETS
                : highVolatilityAssets.stream()
                        .filter(s -> s != null && !s.isBlank())
                        .map(s -> s.strip().toUpperCase(Locale.ROOT))
                        .collect(Collectors.toUnmodifiableSet());
    }

    public static CacheTtlPolicy defaultPolicy() {
        return new CacheTtlPolicy(DEFAULT_HIGH_VOLATILITY_ASSETS);
    }

    /**
     * 60s for high-volatility assets (case-insensitive), 300s otherwise.
     */
    public Duration priceTtl(String asset) {
        if (asset != null && highVolatilityAssets.contains(asset.strip().toUpperCase(Locale.ROOT))) {
            return VOLATILE_PRICE_TTL;
        }
        return PRICE_TTL;
    }

    /**
     * 1D → 30min, 1W → 1h, 1M → 2h, anything longer → 24h. Interval does not change the TTL.
     */
    public Duration historicalTtl(String period, String interval) {
        if (period == null) {
            return Duration.ofHours(24);
        }
        switch (period.strip().toUpperCase(Locale.ROOT)) {
            case "1D":
                return Duration.ofMinutes(30);
            case "1W":
                return Duration.ofHours(1);
            case "1M":
                return Duration.ofHours(2);
            default:
                return Duration.ofHours(24);
        }
    }
}
