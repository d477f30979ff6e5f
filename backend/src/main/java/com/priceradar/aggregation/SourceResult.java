package com.priceradar.aggregation;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Outcome of one provider in a cross-source comparison: a price on success, an error message otherwise.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record SourceResult(boolean success, BigDecimal price, String error, Instant timestamp) {

    public static SourceResult success(BigDecimal price, Instant timestamp) {
        return new SourceResult(true, price, null, timestamp);
    }

    public static SourceResult failure(String error, Instant timestamp) {
        return new SourceResult(false, null, error, timestamp);
    }
}
