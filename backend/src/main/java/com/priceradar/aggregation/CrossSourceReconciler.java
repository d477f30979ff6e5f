package com.priceradar.aggregation;

import com.priceradar.common.ProviderException;
import com.priceradar.provider.PriceProvider;
import com.priceradar.provider.ProviderCapability;
import com.priceradar.registry.ProviderHealthTracker;
import com.priceradar.registry.ProviderRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Future;

/**
 * Queries every registered provider with the current-price capability concurrently and waits until all of them
 * have settled. Every call is submitted straight to the provider-call pool and measured against one shared
 * deadline, so the whole comparison takes at most one timeout. Failures are reported per source and never raised.
 * Results are not cached.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class CrossSourceReconciler {

    private final ProviderRegistry registry;
    private final ProviderCallExecutor callExecutor;
    private final Clock clock;

    public AggregationResult compareAll(String asset, String currency, Duration timeout) {
        Instant startedAt = clock.instant();
        long deadline = System.nanoTime() + timeout.toNanos();
        Map<String, Submitted> submitted = new LinkedHashMap<>();
        for (String name : registry.priorityList()) {
            Optional<PriceProvider> provider = registry.getProvider(name);
            if (provider.isEmpty() || !provider.get().supports(ProviderCapability.CURRENT_PRICE)) {
                continue;
            }
            PriceProvider p = provider.get();
            try {
                submitted.put(name, new Submitted(callExecutor.submit(name, () -> p.getCurrentPrice(asset, currency)), null));
            } catch (ProviderException e) {
                submitted.put(name, new Submitted(null, e));
            }
        }

        Map<String, SourceResult> sources = new LinkedHashMap<>();
        submitted.forEach((name, s) -> sources.put(name, settle(name, s, deadline, timeout, asset, currency)));
        List<BigDecimal> prices = sources.values().stream()
                .filter(SourceResult::success)
                .map(SourceResult::price)
                .toList();
        AggregationResult result = AggregationResult.of(asset, currency, startedAt, sources,
                PriceStatistics.of(prices).orElse(null));
        log.info("Compared {} sources for {}/{}: {} succeeded", sources.size(), asset, currency, result.successCount());
        return result;
    }

    private SourceResult settle(String name, Submitted submitted, long deadline, Duration timeout,
                                String asset, String currency) {
        ProviderHealthTracker health = registry.getHealthTracker();
        try {
            if (submitted.rejection() != null) {
                throw submitted.rejection();
            }
            BigDecimal price = callExecutor.await(name, submitted.future(), deadline, timeout);
            if (!CurrentPriceResolver.isValidPrice(price)) {
                health.recordFailure(name);
                return SourceResult.failure("Invalid price returned", clock.instant());
            }
            health.recordSuccess(name);
            return SourceResult.success(price, clock.instant());
        } catch (ProviderException e) {
            if (e.getKind() != ProviderException.Kind.INTERRUPTED) {
                health.recordFailure(name);
            }
            log.warn("Comparison query to {} for {}/{} failed: {}", name, asset, currency, e.getMessage());
            return SourceResult.failure(e.getMessage(), clock.instant());
        }
    }

    private record Submitted(Future<BigDecimal> future, ProviderException rejection) {}
}
