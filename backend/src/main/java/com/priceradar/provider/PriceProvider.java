package com.priceradar.provider;

import java.math.BigDecimal;
import java.util.List;
import java.util.Set;

/**
 * Adapter for one external market-data source. Implementations declare what they can do through
 * {@link #getCapabilities()}; undeclared operations keep the throwing defaults and are never called by the
 * aggregation layer.
 * <p>
 * Calls are blocking. They run on a dedicated executor and may be interrupted when the caller stops waiting;
 * implementations should let interruption abort the underlying request.
 */
public interface PriceProvider {

    /**
     * Stable name used in the priority list (e.g. "coinGecko").
     */
    String getName();

    Set<ProviderCapability> getCapabilities();

    default boolean supports(ProviderCapability capability) {
        return getCapabilities().contains(capability);
    }

    /**
     * Current price of asset quoted in currency. May return null or a non-positive value; callers validate.
     */
    default BigDecimal getCurrentPrice(String asset, String currency) {
        throw new UnsupportedCapabilityException(getName(), ProviderCapability.CURRENT_PRICE);
    }

    /**
     * Price series ordered by timestamp ascending.
     */
    default List<HistoricalPricePoint> getHistoricalData(String asset, String currency, HistoricalQuery query) {
        throw new UnsupportedCapabilityException(getName(), ProviderCapability.HISTORICAL_DATA);
    }

    default List<AssetSummary> getAvailableCryptos(int limit, boolean includeMetadata) {
        throw new UnsupportedCapabilityException(getName(), ProviderCapability.ASSET_LISTING);
    }

    default AssetDetails getCryptoDetails(String asset, String currency) {
        throw new UnsupportedCapabilityException(getName(), ProviderCapability.ASSET_DETAILS);
    }

    default MarketInfo getMarketInfo(int limit, String currency) {
        throw new UnsupportedCapabilityException(getName(), ProviderCapability.MARKET_INFO);
    }

    default boolean checkAvailability() {
        throw new UnsupportedCapabilityException(getName(), ProviderCapability.AVAILABILITY_PROBE);
    }

    default void setApiKey(String apiKey) {
        throw new UnsupportedCapabilityException(getName(), ProviderCapability.KEY_ROTATION);
    }

    default boolean requiresApiKey() {
        return false;
    }

    default boolean hasValidApiKey() {
        return false;
    }
}
