package com.priceradar.api.controller;

import com.priceradar.aggregation.LookupOptions;
import com.priceradar.aggregation.PriceAggregationService;
import com.priceradar.provider.AssetDetails;
import com.priceradar.provider.AssetSummary;
import com.priceradar.provider.MarketInfo;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.List;
import java.util.Locale;

/**
 * Asset listing, asset details and market summary.
 */
@RestController
@RequestMapping("/api/v1")
@RequiredArgsConstructor
public class AssetController {

    private final PriceAggregationService aggregationService;

    @GetMapping("/assets")
    public Mono<List<AssetSummary>> listAssets(
            @RequestParam(defaultValue = "100") int limit,
            @RequestParam(defaultValue = "false") boolean includeMetadata,
            @RequestParam(required = false) String preferredApi,
            @RequestParam(defaultValue = "false") boolean forceRefresh
    ) {
        LookupOptions options = LookupOptions.builder()
                .limit(limit)
                .includeMetadata(includeMetadata)
                .preferredApi(preferredApi)
                .forceRefresh(forceRefresh)
                .build();
        return Mono.fromCallable(() -> aggregationService.getAvailableCryptos(options))
                .subscribeOn(Schedulers.boundedElastic());
    }

    @GetMapping("/assets/{asset}")
    public Mono<AssetDetails> getAsset(
            @PathVariable String asset,
            @RequestParam(defaultValue = "USD") String currency,
            @RequestParam(required = false) String preferredApi,
            @RequestParam(defaultValue = "false") boolean forceRefresh
    ) {
        LookupOptions options = LookupOptions.builder()
                .currency(currency.strip().toUpperCase(Locale.ROOT))
                .preferredApi(preferredApi)
                .forceRefresh(forceRefresh)
                .build();
        return Mono.fromCallable(() -> aggregationService.getCryptoDetails(asset.strip().toUpperCase(Locale.ROOT), options))
                .subscribeOn(Schedulers.boundedElastic());
    }

    @GetMapping("/market")
    public Mono<MarketInfo> getMarket(
            @RequestParam(defaultValue = "100") int limit,
            @RequestParam(defaultValue = "USD") String currency,
            @RequestParam(required = false) String preferredApi,
            @RequestParam(defaultValue = "false") boolean forceRefresh
    ) {
        LookupOptions options = LookupOptions.builder()
                .limit(limit)
                .currency(currency.strip().toUpperCase(Locale.ROOT))
                .preferredApi(preferredApi)
                .forceRefresh(forceRefresh)
                .build();
        return Mono.fromCallable(() -> aggregationService.getMarketInfo(options))
                .subscribeOn(Schedulers.boundedElastic());
    }
}
