package com.priceradar.registry;

import com.priceradar.provider.ProviderCapability;
import com.priceradar.provider.StubPriceProvider;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.util.Arrays;
import java.util.EnumSet;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ProviderRegistryTest {

    private ProviderRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new ProviderRegistry(List.of("coinGecko", "coinMarketCap", "binance"),
                ProviderHealthTracker.disabled(Clock.systemUTC()));
        registry.addApiSource("coinGecko", StubPriceProvider.full("coinGecko"));
        registry.addApiSource("binance", StubPriceProvider.full("binance"));
    }

    @Test
    @DisplayName("configured names without an adapter stay in the priority list")
    void unregisteredNamesKept() {
        assertThat(registry.priorityList()).containsExactly("coinGecko", "coinMarketCap", "binance");
        assertThat(registry.getProvider("coinMarketCap")).isEmpty();
        assertThat(registry.getProviders()).containsOnlyKeys("coinGecko", "binance");
    }

    @Test
    void addApiSource_appendsNewName() {
        registry.addApiSource("kraken", StubPriceProvider.full("kraken"));
        assertThat(registry.priorityList()).containsExactly("coinGecko", "coinMarketCap", "binance", "kraken");
    }

    @Test
    void addApiSource_withPosition_movesNameAndClamps() {
        registry.addApiSource("binance", StubPriceProvider.full("binance"), 0);
        assertThat(registry.priorityList()).containsExactly("binance", "coinGecko", "coinMarketCap");

        registry.addApiSource("kraken", StubPriceProvider.full("kraken"), 99);
        assertThat(registry.priorityList()).containsExactly("binance", "coinGecko", "coinMarketCap", "kraken");
    }

    @Test
    void addApiSource_replacingKeepsSinglePriorityEntry() {
        registry.addApiSource("binance", StubPriceProvider.full("binance"));
        assertThat(registry.priorityList()).filteredOn("binance"::equals).hasSize(1);
    }

    @Test
    void removeApiSource() {
        assertThat(registry.removeApiSource("binance")).isTrue();
        assertThat(registry.priorityList()).doesNotContain("binance");
        assertThat(registry.getProvider("binance")).isEmpty();

        assertThat(registry.removeApiSource("binance")).isFalse();
        assertThat(registry.removeApiSource("nope")).isFalse();
    }

    @Test
    @DisplayName("updateApiPriority appends registered providers missing from the new order")
    void updateApiPriority_completesList() {
        assertThat(registry.updateApiPriority(List.of("binance"))).isTrue();
        assertThat(registry.priorityList()).containsExactly("binance", "coinGecko");
    }

    @Test
    void updateApiPriority_dropsDuplicatesAndKeepsUnknownNames() {
        assertThat(registry.updateApiPriority(List.of("binance", "coinApi", "binance", "coinGecko"))).isTrue();
        assertThat(registry.priorityList()).containsExactly("binance", "coinApi", "coinGecko");
    }

    @Test
    void updateApiPriority_rejectsEmpty() {
        assertThat(registry.updateApiPriority(List.of())).isFalse();
        assertThat(registry.updateApiPriority(null)).isFalse();
        assertThat(registry.updateApiPriority(Arrays.asList(" ", null))).isFalse();
        assertThat(registry.priorityList()).containsExactly("coinGecko", "coinMarketCap", "binance");
    }

    @Test
    void effectiveOrder_putsRegisteredPreferredFirstWithoutChangingStoredList() {
        assertThat(registry.effectiveOrder("binance")).containsExactly("binance", "coinGecko", "coinMarketCap");
        assertThat(registry.effectiveOrder("coinMarketCap")).containsExactly("coinGecko", "coinMarketCap", "binance");
        assertThat(registry.effectiveOrder("unknown")).containsExactly("coinGecko", "coinMarketCap", "binance");
        assertThat(registry.priorityList()).containsExactly("coinGecko", "coinMarketCap", "binance");
    }

    @Test
    void updateApiKey_rotatesKeyOnProvidersThatSupportIt() {
        StubPriceProvider keyed = StubPriceProvider.full("keyed");
        StubPriceProvider keyless = new StubPriceProvider("keyless", EnumSet.of(ProviderCapability.CURRENT_PRICE));
        registry.addApiSource("keyed", keyed);
        registry.addApiSource("keyless", keyless);

        assertThat(registry.updateApiKey("keyed", "k-1")).isTrue();
        assertThat(registry.updateApiKey("keyless", "k-2")).isTrue();
        assertThat(registry.updateApiKey("coinApi", "k-3")).isTrue();

        assertThat(keyed.currentApiKey()).isEqualTo("k-1");
        assertThat(keyless.currentApiKey()).isNull();
        assertThat(registry.getApiKey("keyless")).contains("k-2");
        assertThat(registry.getApiKey("coinApi")).contains("k-3");
    }

    @Test
    void priorityList_isSnapshot() {
        List<String> before = registry.priorityList();
        registry.removeApiSource("coinGecko");
        assertThat(before).containsExactly("coinGecko", "coinMarketCap", "binance");
    }
}
