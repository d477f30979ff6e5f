package com.priceradar.provider;

/**
 * Operations a {@link PriceProvider} may implement. Absence of a capability is a normal condition: callers skip
 * the provider for that operation.
 */
public enum ProviderCapability {
    CURRENT_PRICE,
    HISTORICAL_DATA,
    ASSET_LISTING,
    ASSET_DETAILS,
    MARKET_INFO,
    AVAILABILITY_PROBE,
    KEY_ROTATION
}
