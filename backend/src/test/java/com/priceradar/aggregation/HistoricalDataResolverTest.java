package com.priceradar.aggregation;

import com.priceradar.aggregation.config.AggregationProperties;
import com.priceradar.cache.CacheTtlPolicy;
import com.priceradar.cache.CaffeineCacheStore;
import com.priceradar.common.PriceUnavailableException;
import com.priceradar.provider.HistoricalPricePoint;
import com.priceradar.provider.HistoricalQuery;
import com.priceradar.provider.StubPriceProvider;
import com.priceradar.registry.ProviderHealthTracker;
import com.priceradar.registry.ProviderRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class HistoricalDataResolverTest {

    private static final List<HistoricalPricePoint> SERIES = List.of(
            new HistoricalPricePoint(Instant.parse("2024-01-01T00:00:00Z"), new BigDecimal("42000"), null, null),
            new HistoricalPricePoint(Instant.parse("2024-01-02T00:00:00Z"), new BigDecimal("43000"), null, null));

    private ExecutorService executor;
    private ProviderRegistry registry;
    private HistoricalDataResolver resolver;
    private StubPriceProvider first;
    private StubPriceProvider second;

    @BeforeEach
    void setUp() {
        executor = Executors.newCachedThreadPool();
        Clock clock = Clock.systemUTC();
        registry = new ProviderRegistry(List.of("first", "second"), ProviderHealthTracker.disabled(clock));
        first = StubPriceProvider.full("first");
        second = StubPriceProvider.full("second");
        registry.addApiSource("first", first);
        registry.addApiSource("second", second);
        AggregationProperties properties = new AggregationProperties();
        properties.setBaseDelayMs(1);
        resolver = new HistoricalDataResolver(registry, new FallbackChain(registry, new ProviderCallExecutor(executor)),
                new AttemptSettingsFactory(properties), new CaffeineCacheStore(100, clock), CacheTtlPolicy.defaultPolicy());
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    @DisplayName("empty series counts as failure and the next provider is used")
    void emptySeriesFallsThrough() {
        first.history(call -> List.of());
        second.history(call -> SERIES);

        List<HistoricalPricePoint> result = resolver.resolve("BTC", "USD", HistoricalDataOptions.defaults());

        assertThat(result).containsExactlyElementsOf(SERIES);
        assertThat(first.historyCalls()).isEqualTo(3);
    }

    @Test
    void cachedPerPeriodAndInterval() {
        first.history(call -> SERIES);

        resolver.resolve("BTC", "USD", HistoricalDataOptions.defaults());
        resolver.resolve("BTC", "USD", HistoricalDataOptions.defaults());
        assertThat(first.historyCalls()).isEqualTo(1);

        resolver.resolve("BTC", "USD", HistoricalDataOptions.builder().period("1W").build());
        assertThat(first.historyCalls()).isEqualTo(2);

        resolver.resolve("BTC", "USD", HistoricalDataOptions.builder().forceRefresh(true).build());
        assertThat(first.historyCalls()).isEqualTo(3);
    }

    @Test
    void exhaustionNamesPair() {
        first.history(call -> {
            throw new IllegalStateException("boom");
        });
        second.history(call -> null);

        assertThatThrownBy(() -> resolver.resolve("DOGE", "EUR", HistoricalDataOptions.defaults()))
                .isInstanceOf(PriceUnavailableException.class)
                .hasMessageContaining("DOGE")
                .hasMessageContaining("EUR");
    }

    @Test
    void dateRangeGetsItsOwnCacheKey() {
        HistoricalQuery plain = new HistoricalQuery("1M", "daily", null, null);
        HistoricalQuery ranged = new HistoricalQuery("1M", "daily", LocalDate.of(2024, 1, 1), LocalDate.of(2024, 1, 31));

        assertThat(HistoricalDataResolver.cacheKey("BTC", "USD", plain)).isEqualTo("history_BTC_USD_1M_daily");
        assertThat(HistoricalDataResolver.cacheKey("BTC", "USD", ranged))
                .isEqualTo("history_BTC_USD_1M_daily_2024-01-01_2024-01-31");
    }
}
