package com.priceradar.aggregation;

import lombok.Builder;
import lombok.Value;

/**
 * Options for a current price lookup. timeoutMs overrides the configured per-attempt timeout when set.
 */
@Value
@Builder
public class CurrentPriceOptions {

    String preferredApi;
    boolean forceRefresh;
    Long timeoutMs;

    public static CurrentPriceOptions defaults() {
        return CurrentPriceOptions.builder().build();
    }
}
