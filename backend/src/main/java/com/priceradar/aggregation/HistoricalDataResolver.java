package com.priceradar.aggregation;

import com.priceradar.cache.CacheKeys;
import com.priceradar.cache.CacheStore;
import com.priceradar.cache.CacheTtlPolicy;
import com.priceradar.common.PriceUnavailableException;
import com.priceradar.provider.HistoricalPricePoint;
import com.priceradar.provider.HistoricalQuery;
import com.priceradar.provider.ProviderCapability;
import com.priceradar.registry.ProviderRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

/**
 * Historical series with the same fallback discipline as current price, a longer per-attempt timeout, and
 * "non-empty series" as the success predicate. TTL depends on the requested period.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class HistoricalDataResolver {

    private final ProviderRegistry registry;
    private final FallbackChain fallbackChain;
    private final AttemptSettingsFactory attemptSettings;
    private final CacheStore cacheStore;
    private final CacheTtlPolicy ttlPolicy;

    public List<HistoricalPricePoint> resolve(String asset, String currency, HistoricalDataOptions options) {
        HistoricalQuery query = options.toQuery();
        String key = cacheKey(asset, currency, query);
        if (!options.isForceRefresh()) {
            Optional<List<HistoricalPricePoint>> cached = cacheStore.get(key);
            if (cached.isPresent()) {
                log.debug("History cache hit {}", key);
                return cached.get();
            }
        }
        List<HistoricalPricePoint> series = fallbackChain.resolve(
                "History " + asset + "/" + currency + " " + query.period(),
                registry.effectiveOrder(options.getPreferredApi()),
                ProviderCapability.HISTORICAL_DATA,
                p -> p.getHistoricalData(asset, currency, query),
                s -> s != null && !s.isEmpty(),
                attemptSettings::forHistoricalData,
                last -> PriceUnavailableException.forPair("historical data", asset, currency, last));
        List<HistoricalPricePoint> copy = List.copyOf(series);
        cacheStore.set(key, copy, ttlPolicy.historicalTtl(query.period(), query.interval()));
        return copy;
    }

    /**
     * Explicit date ranges get their own entry so they never collide with the period-based series.
     */
    static String cacheKey(String asset, String currency, HistoricalQuery query) {
        String key = CacheKeys.history(asset, currency, query.period(), query.interval());
        return query.hasDateRange() ? key + "_" + query.startDate() + "_" + query.endDate() : key;
    }
}
