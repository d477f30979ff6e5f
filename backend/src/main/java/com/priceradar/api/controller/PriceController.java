package com.priceradar.api.controller;

import com.priceradar.aggregation.CurrentPriceOptions;
import com.priceradar.aggregation.HistoricalDataOptions;
import com.priceradar.aggregation.PriceAggregationService;
import com.priceradar.api.dto.PriceResponse;
import com.priceradar.provider.HistoricalPricePoint;
import lombok.RequiredArgsConstructor;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.LocalDate;
import java.util.List;
import java.util.Locale;

/**
 * Current and historical prices. Provider calls block, so they run on the bounded elastic scheduler.
 */
@RestController
@RequestMapping("/api/v1/prices")
@RequiredArgsConstructor
public class PriceController {

    private final PriceAggregationService aggregationService;

    /**
     * Single best price, or with compareAll=true every source's answer plus summary statistics.
     */
    @GetMapping("/{asset}")
    public Mono<ResponseEntity<?>> getPrice(
            @PathVariable String asset,
            @RequestParam(defaultValue = "USD") String currency,
            @RequestParam(required = false) String preferredApi,
            @RequestParam(defaultValue = "false") boolean forceRefresh,
            @RequestParam(defaultValue = "false") boolean compareAll,
            @RequestParam(required = false) Long timeoutMs
    ) {
        String symbol = asset.strip().toUpperCase(Locale.ROOT);
        String quote = currency.strip().toUpperCase(Locale.ROOT);
        if (compareAll) {
            return Mono.fromCallable(() -> aggregationService.compareAllSources(symbol, quote, timeoutMs))
                    .subscribeOn(Schedulers.boundedElastic())
                    .<ResponseEntity<?>>map(ResponseEntity::ok);
        }
        CurrentPriceOptions options = CurrentPriceOptions.builder()
                .preferredApi(preferredApi)
                .forceRefresh(forceRefresh)
                .timeoutMs(timeoutMs)
                .build();
        return Mono.fromCallable(() -> aggregationService.getCurrentPrice(symbol, quote, options))
                .subscribeOn(Schedulers.boundedElastic())
                .<ResponseEntity<?>>map(price -> ResponseEntity.ok(new PriceResponse(symbol, quote, price)));
    }

    @GetMapping("/{asset}/history")
    public Mono<List<HistoricalPricePoint>> getHistory(
            @PathVariable String asset,
            @RequestParam(defaultValue = "USD") String currency,
            @RequestParam(required = false) String period,
            @RequestParam(required = false) String interval,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate startDate,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate endDate,
            @RequestParam(required = false) String preferredApi,
            @RequestParam(defaultValue = "false") boolean forceRefresh
    ) {
        if (startDate != null && endDate != null && endDate.isBefore(startDate)) {
            return Mono.error(new IllegalArgumentException("endDate must not be before startDate"));
        }
        HistoricalDataOptions.HistoricalDataOptionsBuilder options = HistoricalDataOptions.builder()
                .preferredApi(preferredApi)
                .forceRefresh(forceRefresh)
                .startDate(startDate)
                .endDate(endDate);
        if (period != null && !period.isBlank()) {
            options.period(period);
        }
        if (interval != null && !interval.isBlank()) {
            options.interval(interval);
        }
        HistoricalDataOptions built = options.build();
        return Mono.fromCallable(() -> aggregationService.getHistoricalData(
                        asset.strip().toUpperCase(Locale.ROOT), currency.strip().toUpperCase(Locale.ROOT), built))
                .subscribeOn(Schedulers.boundedElastic());
    }

    @DeleteMapping("/{asset}/cache")
    public ResponseEntity<Void> clearCache(@PathVariable String asset, @RequestParam(defaultValue = "USD") String currency) {
        aggregationService.clearPriceCache(asset, currency);
        return ResponseEntity.noContent().build();
    }
}
