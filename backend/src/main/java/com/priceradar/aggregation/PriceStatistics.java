package com.priceradar.aggregation;

import java.math.BigDecimal;
import java.math.MathContext;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Mean, median, min, max and population standard deviation of a set of prices.
 */
public record PriceStatistics(BigDecimal mean, BigDecimal median, BigDecimal min, BigDecimal max, BigDecimal stdDeviation) {

    private static final MathContext MC = MathContext.DECIMAL64;
    private static final BigDecimal TWO = BigDecimal.valueOf(2);

    /**
     * Empty when prices is empty. Zero is a valid price, so it is never used as a placeholder.
     */
    public static Optional<PriceStatistics> of(Collection<BigDecimal> prices) {
        if (prices == null || prices.isEmpty()) {
            return Optional.empty();
        }
        List<BigDecimal> sorted = new ArrayList<>(prices);
        sorted.sort(BigDecimal::compareTo);
        int n = sorted.size();
        BigDecimal count = BigDecimal.valueOf(n);

        BigDecimal sum = BigDecimal.ZERO;
        for (BigDecimal p : sorted) {
            sum = sum.add(p);
        }
        BigDecimal mean = sum.divide(count, MC);

        int mid = n / 2;
        BigDecimal median = n % 2 == 0
                ? sorted.get(mid - 1).add(sorted.get(mid)).divide(TWO, MC)
                : sorted.get(mid);

        BigDecimal squares = BigDecimal.ZERO;
        for (BigDecimal p : sorted) {
            BigDecimal d = p.subtract(mean);
            squares = squares.add(d.multiply(d));
        }
        BigDecimal std = squares.divide(count, MC).sqrt(MC);

        return Optional.of(new PriceStatistics(mean, median, sorted.get(0), sorted.get(n - 1), std));
    }
}
