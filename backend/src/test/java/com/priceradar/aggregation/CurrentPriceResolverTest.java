package com.priceradar.aggregation;

import com.priceradar.aggregation.config.AggregationProperties;
import com.priceradar.cache.CacheKeys;
import com.priceradar.cache.CacheTtlPolicy;
import com.priceradar.cache.CaffeineCacheStore;
import com.priceradar.common.PriceUnavailableException;
import com.priceradar.common.ProviderException;
import com.priceradar.provider.ProviderCapability;
import com.priceradar.provider.StubPriceProvider;
import com.priceradar.registry.ProviderHealthTracker;
import com.priceradar.registry.ProviderRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.util.EnumSet;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowableOfType;

class CurrentPriceResolverTest {

    private ExecutorService executor;
    private ProviderRegistry registry;
    private CaffeineCacheStore cache;
    private AggregationProperties properties;
    private CurrentPriceResolver resolver;

    private StubPriceProvider a;
    private StubPriceProvider b;
    private StubPriceProvider c;

    @BeforeEach
    void setUp() {
        executor = Executors.newCachedThreadPool();
        Clock clock = Clock.systemUTC();
        registry = new ProviderRegistry(List.of("a", "b", "c"), ProviderHealthTracker.disabled(clock));
        a = StubPriceProvider.full("a");
        b = StubPriceProvider.full("b");
        c = StubPriceProvider.full("c");
        registry.addApiSource("a", a);
        registry.addApiSource("b", b);
        registry.addApiSource("c", c);

        properties = new AggregationProperties();
        properties.setBaseDelayMs(1);
        properties.setTimeoutMs(2_000);
        cache = new CaffeineCacheStore(1_000, clock);
        FallbackChain chain = new FallbackChain(registry, new ProviderCallExecutor(executor));
        resolver = new CurrentPriceResolver(registry, chain, new AttemptSettingsFactory(properties), cache,
                CacheTtlPolicy.defaultPolicy());
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    @DisplayName("first valid price wins and later providers are never asked")
    void shortCircuitsOnFirstValidPrice() {
        a.failing("connection refused");
        b.fixedPrice("50000");
        c.fixedPrice("1");

        BigDecimal price = resolver.resolve("BTC", "USD", CurrentPriceOptions.defaults());

        assertThat(price).isEqualByComparingTo("50000");
        assertThat(a.priceCalls()).isEqualTo(3);
        assertThat(b.priceCalls()).isEqualTo(1);
        assertThat(c.priceCalls()).isZero();
        assertThat(cache.get(CacheKeys.price("BTC", "USD"), BigDecimal.class)).contains(new BigDecimal("50000"));
    }

    @Test
    @DisplayName("zero, negative and NaN answers count as failed attempts")
    void rejectsNonPositiveAndNaN() {
        a.price(call -> BigDecimal.valueOf(Double.NaN));
        b.price(call -> call == 0 ? BigDecimal.ZERO : new BigDecimal("-5"));
        c.fixedPrice("3000");

        assertThat(resolver.resolve("ETH", "USD", CurrentPriceOptions.defaults())).isEqualByComparingTo("3000");
        assertThat(a.priceCalls()).isEqualTo(3);
        assertThat(b.priceCalls()).isEqualTo(3);
    }

    @Test
    void retriesSameProviderBeforeMovingOn() {
        a.price(call -> call < 2 ? null : new BigDecimal("42"));

        assertThat(resolver.resolve("SOL", "USD", CurrentPriceOptions.defaults())).isEqualByComparingTo("42");
        assertThat(a.priceCalls()).isEqualTo(3);
        assertThat(b.priceCalls()).isZero();
    }

    @Test
    void maxRetriesZero_meansSingleAttemptPerProvider() {
        properties.setMaxRetries(0);
        a.failing("down");
        b.fixedPrice("7");

        assertThat(resolver.resolve("DOT", "USD", CurrentPriceOptions.defaults())).isEqualByComparingTo("7");
        assertThat(a.priceCalls()).isEqualTo(1);
    }

    @Test
    @DisplayName("cached price is served without calling providers; forceRefresh bypasses it")
    void cacheHitAndForceRefresh() {
        b.fixedPrice("50000");
        a.failing("down");
        resolver.resolve("BTC", "USD", CurrentPriceOptions.defaults());
        int callsAfterFirst = b.priceCalls();

        assertThat(resolver.resolve("btc", "usd", CurrentPriceOptions.defaults())).isEqualByComparingTo("50000");
        assertThat(b.priceCalls()).isEqualTo(callsAfterFirst);

        b.fixedPrice("51000");
        BigDecimal refreshed = resolver.resolve("BTC", "USD", CurrentPriceOptions.builder().forceRefresh(true).build());
        assertThat(refreshed).isEqualByComparingTo("51000");
        assertThat(cache.get(CacheKeys.price("BTC", "USD"), BigDecimal.class)).contains(new BigDecimal("51000"));
    }

    @Test
    @DisplayName("exhaustion names the pair and leaves the cache untouched")
    void exhaustion() {
        a.failing("a down");
        b.failing("b down");
        c.failing("c down");

        PriceUnavailableException ex = catchThrowableOfType(
                () -> resolver.resolve("XRP", "BRL", CurrentPriceOptions.defaults()), PriceUnavailableException.class);

        assertThat(ex).hasMessageContaining("XRP").hasMessageContaining("BRL");
        assertThat(ex.getCause()).isInstanceOf(ProviderException.class);
        assertThat(ex.getErrorCode()).isEqualTo(PriceUnavailableException.SOURCES_EXHAUSTED);
        assertThat(cache.get(CacheKeys.price("XRP", "BRL"), BigDecimal.class)).isEmpty();
        assertThat(a.priceCalls() + b.priceCalls() + c.priceCalls()).isEqualTo(9);
    }

    @Test
    void preferredApiIsTriedFirst() {
        a.fixedPrice("1");
        c.fixedPrice("3");

        BigDecimal price = resolver.resolve("ADA", "USD", CurrentPriceOptions.builder().preferredApi("c").build());

        assertThat(price).isEqualByComparingTo("3");
        assertThat(a.priceCalls()).isZero();
        assertThat(registry.priorityList()).containsExactly("a", "b", "c");
    }

    @Test
    void unknownPreferredApiFallsBackToStoredOrder() {
        a.fixedPrice("1");
        assertThat(resolver.resolve("ADA", "USD", CurrentPriceOptions.builder().preferredApi("nope").build()))
                .isEqualByComparingTo("1");
    }

    @Test
    @DisplayName("an attempt exceeding the timeout fails and the next provider is used")
    void slowProviderTimesOut() {
        a.slowPrice(5_000, "1");
        b.fixedPrice("2");

        long started = System.nanoTime();
        BigDecimal price = resolver.resolve("LINK", "USD", CurrentPriceOptions.builder().timeoutMs(50L).build());
        long elapsedMs = (System.nanoTime() - started) / 1_000_000;

        assertThat(price).isEqualByComparingTo("2");
        assertThat(a.priceCalls()).isEqualTo(3);
        assertThat(elapsedMs).isLessThan(3_000);
    }

    @Test
    void namesWithoutAdapterAreSkipped() {
        registry.updateApiPriority(List.of("ghost", "c"));
        c.fixedPrice("9");

        assertThat(resolver.resolve("BNB", "USD", CurrentPriceOptions.defaults())).isEqualByComparingTo("9");
    }

    @Test
    void providersWithoutCapabilityAreSkipped() {
        registry.addApiSource("historyOnly", new StubPriceProvider("historyOnly",
                EnumSet.of(ProviderCapability.HISTORICAL_DATA)), 0);
        a.fixedPrice("11");

        assertThat(resolver.resolve("AVAX", "USD", CurrentPriceOptions.defaults())).isEqualByComparingTo("11");
    }

    @Test
    void healthTrackingSkipsProviderInCooldown() {
        ProviderRegistry tracked = new ProviderRegistry(List.of("a", "b"),
                new ProviderHealthTracker(true, 3, Duration.ofMinutes(1), Clock.systemUTC()));
        tracked.addApiSource("a", a);
        tracked.addApiSource("b", b);
        FallbackChain chain = new FallbackChain(tracked, new ProviderCallExecutor(executor));
        CurrentPriceResolver trackedResolver = new CurrentPriceResolver(tracked, chain,
                new AttemptSettingsFactory(properties), cache, CacheTtlPolicy.defaultPolicy());
        a.failing("down");
        b.fixedPrice("5");

        trackedResolver.resolve("X1", "USD", CurrentPriceOptions.defaults());
        trackedResolver.resolve("X2", "USD", CurrentPriceOptions.defaults());

        assertThat(a.priceCalls()).isEqualTo(3);
        assertThat(b.priceCalls()).isEqualTo(2);
    }

    @Test
    @DisplayName("an interrupted caller stops the chain and is not recorded against the provider")
    void interruptedCallerStopsWithoutBlamingProvider() {
        ProviderHealthTracker health = new ProviderHealthTracker(true, 3, Duration.ofMinutes(1), Clock.systemUTC());
        ProviderRegistry tracked = new ProviderRegistry(List.of("a", "b"), health);
        tracked.addApiSource("a", a);
        tracked.addApiSource("b", b);
        FallbackChain chain = new FallbackChain(tracked, new ProviderCallExecutor(executor));
        CurrentPriceResolver trackedResolver = new CurrentPriceResolver(tracked, chain,
                new AttemptSettingsFactory(properties), cache, CacheTtlPolicy.defaultPolicy());
        a.slowPrice(5_000, "1");
        b.fixedPrice("5");

        Thread.currentThread().interrupt();
        PriceUnavailableException ex;
        try {
            ex = catchThrowableOfType(
                    () -> trackedResolver.resolve("BTC", "USD", CurrentPriceOptions.defaults()),
                    PriceUnavailableException.class);
        } finally {
            Thread.interrupted();
        }

        assertThat(ex).isNotNull();
        assertThat(ex.getCause()).isInstanceOf(ProviderException.class);
        assertThat(((ProviderException) ex.getCause()).getKind()).isEqualTo(ProviderException.Kind.INTERRUPTED);
        assertThat(b.priceCalls()).isZero();
        assertThat(health.get("a").consecutiveFailures()).isZero();
        assertThat(cache.get(CacheKeys.price("BTC", "USD"), BigDecimal.class)).isEmpty();
    }
}
