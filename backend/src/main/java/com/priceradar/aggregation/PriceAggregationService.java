package com.priceradar.aggregation;

import com.priceradar.cache.CacheKeys;
import com.priceradar.cache.CacheStore;
import com.priceradar.cache.CacheTtlPolicy;
import com.priceradar.common.PriceUnavailableException;
import com.priceradar.common.ProviderException;
import com.priceradar.provider.AssetDetails;
import com.priceradar.provider.AssetSummary;
import com.priceradar.provider.HistoricalPricePoint;
import com.priceradar.provider.MarketInfo;
import com.priceradar.provider.PriceProvider;
import com.priceradar.provider.ProviderCapability;
import com.priceradar.registry.ProviderRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Entry point for price data: current and historical prices, cross-source comparison, asset listing and details,
 * market summary, provider status, and provider registry management.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PriceAggregationService {

    private final ProviderRegistry registry;
    private final CurrentPriceResolver currentPriceResolver;
    private final HistoricalDataResolver historicalDataResolver;
    private final CrossSourceReconciler reconciler;
    private final FallbackChain fallbackChain;
    private final AttemptSettingsFactory attemptSettings;
    private final ProviderCallExecutor callExecutor;
    private final CacheStore cacheStore;

    /**
     * @throws PriceUnavailableException when no provider returned a valid price
     */
    public BigDecimal getCurrentPrice(String asset, String currency, CurrentPriceOptions options) {
        return currentPriceResolver.resolve(requireSymbol(asset, "asset"), requireSymbol(currency, "currency"),
                options != null ? options : CurrentPriceOptions.defaults());
    }

    /**
     * Asks every provider at once and summarises the answers. Never throws for provider failures.
     */
    public AggregationResult compareAllSources(String asset, String currency, Long timeoutMs) {
        Duration timeout = timeoutMs != null && timeoutMs > 0 ? Duration.ofMillis(timeoutMs) : attemptSettings.defaultTimeout();
        return reconciler.compareAll(requireSymbol(asset, "asset"), requireSymbol(currency, "currency"), timeout);
    }

    public List<HistoricalPricePoint> getHistoricalData(String asset, String currency, HistoricalDataOptions options) {
        return historicalDataResolver.resolve(requireSymbol(asset, "asset"), requireSymbol(currency, "currency"),
                options != null ? options : HistoricalDataOptions.defaults());
    }

    public List<AssetSummary> getAvailableCryptos(LookupOptions options) {
        LookupOptions o = options != null ? options : LookupOptions.defaults();
        int limit = positiveLimit(o.getLimit());
        String key = CacheKeys.assetList(limit, o.isIncludeMetadata());
        if (!o.isForceRefresh()) {
            Optional<List<AssetSummary>> cached = cacheStore.get(key);
            if (cached.isPresent()) {
                return cached.get();
            }
        }
        List<AssetSummary> list = List.copyOf(fallbackChain.resolve(
                "Asset listing",
                registry.effectiveOrder(o.getPreferredApi()),
                ProviderCapability.ASSET_LISTING,
                p -> p.getAvailableCryptos(limit, o.isIncludeMetadata()),
                l -> l != null && !l.isEmpty(),
                attemptSettings::singleAttempt,
                last -> PriceUnavailableException.forOperation("the asset list", last)));
        cacheStore.set(key, list, CacheTtlPolicy.ASSET_LIST_TTL);
        return list;
    }

    public AssetDetails getCryptoDetails(String asset, LookupOptions options) {
        LookupOptions o = options != null ? options : LookupOptions.defaults();
        String symbol = requireSymbol(asset, "asset");
        String currency = requireSymbol(o.getCurrency(), "currency");
        String key = CacheKeys.assetDetails(symbol, currency);
        if (!o.isForceRefresh()) {
            Optional<AssetDetails> cached = cacheStore.get(key, AssetDetails.class);
            if (cached.isPresent()) {
                return cached.get();
            }
        }
        AssetDetails details = fallbackChain.resolve(
                "Details " + symbol,
                registry.effectiveOrder(o.getPreferredApi()),
                ProviderCapability.ASSET_DETAILS,
                p -> p.getCryptoDetails(symbol, currency),
                d -> d != null,
                attemptSettings::singleAttempt,
                last -> PriceUnavailableException.forPair("details", symbol, currency, last));
        cacheStore.set(key, details, CacheTtlPolicy.ASSET_DETAILS_TTL);
        return details;
    }

    public MarketInfo getMarketInfo(LookupOptions options) {
        LookupOptions o = options != null ? options : LookupOptions.defaults();
        int limit = positiveLimit(o.getLimit());
        String currency = requireSymbol(o.getCurrency(), "currency");
        String key = CacheKeys.marketInfo(limit, currency);
        if (!o.isForceRefresh()) {
            Optional<MarketInfo> cached = cacheStore.get(key, MarketInfo.class);
            if (cached.isPresent()) {
                return cached.get();
            }
        }
        MarketInfo info = fallbackChain.resolve(
                "Market info",
                registry.effectiveOrder(o.getPreferredApi()),
                ProviderCapability.MARKET_INFO,
                p -> p.getMarketInfo(limit, currency),
                m -> m != null,
                attemptSettings::singleAttempt,
                last -> PriceUnavailableException.forOperation("market info in " + currency, last));
        cacheStore.set(key, info, CacheTtlPolicy.MARKET_INFO_TTL);
        return info;
    }

    /**
     * Probes every registered provider in turn. Probe errors are reported, not thrown.
     */
    public Map<String, ProviderStatus> checkApiStatus() {
        Map<String, ProviderStatus> results = new LinkedHashMap<>();
        for (Map.Entry<String, PriceProvider> e : registry.getProviders().entrySet()) {
            String name = e.getKey();
            PriceProvider provider = e.getValue();
            boolean requiresKey = provider.requiresApiKey();
            boolean hasKey = provider.hasValidApiKey();
            if (!provider.supports(ProviderCapability.AVAILABILITY_PROBE)) {
                results.put(name, new ProviderStatus(false, "availability probe not supported", requiresKey, hasKey));
                continue;
            }
            try {
                boolean available = Boolean.TRUE.equals(
                        callExecutor.call(name, provider::checkAvailability, attemptSettings.defaultTimeout()));
                results.put(name, new ProviderStatus(available,
                        available ? "OK" : "API did not respond correctly", requiresKey, hasKey));
            } catch (ProviderException ex) {
                log.debug("Availability probe for {} failed: {}", name, ex.getMessage());
                results.put(name, new ProviderStatus(false, ex.getMessage(), requiresKey, hasKey));
            }
        }
        return results;
    }

    public void clearPriceCache(String asset, String currency) {
        cacheStore.delete(CacheKeys.price(requireSymbol(asset, "asset"), requireSymbol(currency, "currency")));
    }

    public boolean addApiSource(String name, PriceProvider provider) {
        return registry.addApiSource(name, provider);
    }

    public boolean addApiSource(String name, PriceProvider provider, int priority) {
        return registry.addApiSource(name, provider, priority);
    }

    public boolean removeApiSource(String name) {
        return registry.removeApiSource(name);
    }

    public boolean updateApiKey(String name, String apiKey) {
        return registry.updateApiKey(name, apiKey);
    }

    public boolean updateApiPriority(List<String> newOrder) {
        return registry.updateApiPriority(newOrder);
    }

    public List<String> getApiPriority() {
        return registry.priorityList();
    }

    private static String requireSymbol(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(field + " is required");
        }
        return value.strip();
    }

    private static int positiveLimit(int limit) {
        return limit > 0 ? limit : LookupOptions.DEFAULT_LIMIT;
    }
}
