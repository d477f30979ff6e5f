package com.priceradar.provider;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.math.BigDecimal;
import java.time.Instant;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record AssetDetails(
        String id,
        String symbol,
        String name,
        String description,
        String image,
        BigDecimal currentPrice,
        BigDecimal marketCap,
        Integer marketCapRank,
        BigDecimal totalVolume,
        BigDecimal high24h,
        BigDecimal low24h,
        BigDecimal priceChange24h,
        BigDecimal priceChangePercentage24h,
        BigDecimal circulatingSupply,
        BigDecimal totalSupply,
        BigDecimal maxSupply,
        BigDecimal allTimeHigh,
        Instant allTimeHighDate,
        BigDecimal allTimeLow,
        Instant allTimeLowDate
) {}
