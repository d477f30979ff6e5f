package com.priceradar.aggregation;

import com.priceradar.provider.HistoricalQuery;
import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;

@Value
@Builder
public class HistoricalDataOptions {

    String preferredApi;
    boolean forceRefresh;
    @Builder.Default
    String period = HistoricalQuery.DEFAULT_PERIOD;
    @Builder.Default
    String interval = HistoricalQuery.DEFAULT_INTERVAL;
    LocalDate startDate;
    LocalDate endDate;

    public static HistoricalDataOptions defaults() {
        return HistoricalDataOptions.builder().build();
    }

    public HistoricalQuery toQuery() {
        return new HistoricalQuery(period, interval, startDate, endDate);
    }
}
