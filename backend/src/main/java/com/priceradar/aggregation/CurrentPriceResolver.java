package com.priceradar.aggregation;

import com.priceradar.cache.CacheKeys;
import com.priceradar.cache.CacheStore;
import com.priceradar.cache.CacheTtlPolicy;
import com.priceradar.common.PriceUnavailableException;
import com.priceradar.provider.ProviderCapability;
import com.priceradar.registry.ProviderRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;

/**
 * Current price: cache, then providers in priority order with retry/backoff/timeout. A valid price is positive;
 * the first one found is cached with the asset's TTL and returned.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class CurrentPriceResolver {

    private final ProviderRegistry registry;
    private final FallbackChain fallbackChain;
    private final AttemptSettingsFactory attemptSettings;
    private final CacheStore cacheStore;
    private final CacheTtlPolicy ttlPolicy;

    public BigDecimal resolve(String asset, String currency, CurrentPriceOptions options) {
        String key = CacheKeys.price(asset, currency);
        if (!options.isForceRefresh()) {
            Optional<BigDecimal> cached = cacheStore.get(key, BigDecimal.class);
            if (cached.isPresent()) {
                log.debug("Price cache hit {}", key);
                return cached.get();
            }
        }
        List<String> order = registry.effectiveOrder(options.getPreferredApi());
        BigDecimal price = fallbackChain.resolve(
                "Price " + asset + "/" + currency,
                order,
                ProviderCapability.CURRENT_PRICE,
                p -> p.getCurrentPrice(asset, currency),
                CurrentPriceResolver::isValidPrice,
                name -> attemptSettings.forCurrentPrice(name, options.getTimeoutMs()),
                last -> PriceUnavailableException.forPair("price", asset, currency, last));
        cacheStore.set(key, price, ttlPolicy.priceTtl(asset));
        return price;
    }

    static boolean isValidPrice(BigDecimal price) {
        return price != null && price.signum() > 0;
    }
}
