package com.priceradar.provider;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.math.BigDecimal;
import java.time.Instant;

/** One point of a price series; volume and marketCap are null when the source does not report them. */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record HistoricalPricePoint(Instant timestamp, BigDecimal price, BigDecimal volume, BigDecimal marketCap) {}
