package com.priceradar.provider;

import java.time.LocalDate;
import java.util.Locale;

/**
 * Historical series request. period: 1D, 1W, 1M, 3M, 6M, 1Y, ALL. interval: hourly, daily, weekly.
 * startDate/endDate are optional and, when both present, take precedence over period.
 */
public record HistoricalQuery(String period, String interval, LocalDate startDate, LocalDate endDate) {

    public static final String DEFAULT_PERIOD = "1M";
    public static final String DEFAULT_INTERVAL = "daily";

    public HistoricalQuery {
        period = period == null || period.isBlank() ? DEFAULT_PERIOD : period.strip().toUpperCase(Locale.ROOT);
        interval = interval == null || interval.isBlank() ? DEFAULT_INTERVAL : interval.strip().toLowerCase(Locale.ROOT);
    }

    public boolean hasDateRange() {
        return startDate != null && endDate != null && !endDate.isBefore(startDate);
    }
}
