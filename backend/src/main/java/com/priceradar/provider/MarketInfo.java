package com.priceradar.provider;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Global market summary in one quote currency plus the top markets by capitalisation.
 * Immutable: the same instance is cached and handed to every caller.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record MarketInfo(
        BigDecimal totalMarketCap,
        BigDecimal totalVolume,
        Map<String, BigDecimal> marketCapPercentage,
        List<AssetSummary> markets
) {

    public MarketInfo {
        // percentages keep provider order and may hold nulls, so Map.copyOf does not fit
        marketCapPercentage = marketCapPercentage == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(marketCapPercentage));
        markets = markets == null ? List.of() : List.copyOf(markets);
    }
}
