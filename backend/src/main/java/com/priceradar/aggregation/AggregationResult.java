package com.priceradar.aggregation;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Map;

/**
 * Cross-source comparison: every queried provider's outcome plus statistics over the successful ones.
 * The statistics are all null when no provider succeeded.
 */
public record AggregationResult(
        String asset,
        String currency,
        Instant timestamp,
        Map<String, SourceResult> sources,
        BigDecimal averagePrice,
        BigDecimal medianPrice,
        BigDecimal minPrice,
        BigDecimal maxPrice,
        BigDecimal stdDeviation
) {

    public static AggregationResult of(String asset, String currency, Instant timestamp,
                                       Map<String, SourceResult> sources, PriceStatistics stats) {
        if (stats == null) {
            return new AggregationResult(asset, currency, timestamp, sources, null, null, null, null, null);
        }
        return new AggregationResult(asset, currency, timestamp, sources,
                stats.mean(), stats.median(), stats.min(), stats.max(), stats.stdDeviation());
    }

    public long successCount() {
        return sources.values().stream().filter(SourceResult::success).count();
    }
}
