package com.priceradar.aggregation;

import lombok.Builder;
import lombok.Value;

/**
 * Options for listing, details and market info lookups. Each operation reads the fields it needs.
 */
@Value
@Builder
public class LookupOptions {

    public static final int DEFAULT_LIMIT = 100;
    public static final String DEFAULT_CURRENCY = "USD";

    String preferredApi;
    boolean forceRefresh;
    @Builder.Default
    int limit = DEFAULT_LIMIT;
    boolean includeMetadata;
    @Builder.Default
    String currency = DEFAULT_CURRENCY;

    public static LookupOptions defaults() {
        return LookupOptions.builder().build();
    }
}
