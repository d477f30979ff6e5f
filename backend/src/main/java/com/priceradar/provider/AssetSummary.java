package com.priceradar.provider;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.math.BigDecimal;

/**
 * Listed asset. Metadata fields (image, currentPrice, marketCap, marketCapRank, priceChangePercentage24h) are
 * populated only when metadata was requested.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record AssetSummary(
        String id,
        String symbol,
        String name,
        String image,
        BigDecimal currentPrice,
        BigDecimal marketCap,
        Integer marketCapRank,
        BigDecimal priceChangePercentage24h
) {

    public static AssetSummary basic(String id, String symbol, String name) {
        return new AssetSummary(id, symbol, name, null, null, null, null, null);
    }
}
