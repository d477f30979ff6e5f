package com.priceradar.provider.binance;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.priceradar.common.ProviderException;
import com.priceradar.provider.HistoricalPricePoint;
import com.priceradar.provider.HistoricalQuery;
import com.priceradar.provider.ProviderCapability;
import com.priceradar.provider.WebClientPriceProvider;
import io.github.resilience4j.ratelimiter.RateLimiter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.reactive.function.client.WebClient;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Binance spot adapter: /api/v3/ticker/price, /api/v3/klines, /api/v3/ping.
 * No listing, details or market info. Trading pair is ASSET + quote, with USD quoted as USDT.
 */
@Slf4j
public class BinancePriceProvider extends WebClientPriceProvider {

    public static final String NAME = "binance";
    static final String API_KEY_HEADER = "X-MBX-APIKEY";
    static final int MAX_KLINES = 1000;

    private static final Set<ProviderCapability> CAPABILITIES = Collections.unmodifiableSet(EnumSet.of(
            ProviderCapability.CURRENT_PRICE,
            ProviderCapability.HISTORICAL_DATA,
            ProviderCapability.AVAILABILITY_PROBE,
            ProviderCapability.KEY_ROTATION));

    private static final Map<String, String> QUOTE_ALIASES = Map.of("USD", "USDT");

    private static final Map<String, Integer> PERIOD_DAYS = Map.of(
            "1D", 1,
            "1W", 7,
            "1M", 30,
            "3M", 90,
            "6M", 180,
            "1Y", 365,
            "ALL", 3650
    );

    private final String baseUrl;

    public BinancePriceProvider(String baseUrl, String apiKey, WebClient.Builder webClientBuilder,
                                RateLimiter rateLimiter, ObjectMapper objectMapper) {
        super(webClientBuilder, rateLimiter, objectMapper, apiKey);
        this.baseUrl = baseUrl;
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public Set<ProviderCapability> getCapabilities() {
        return CAPABILITIES;
    }

    @Override
    protected String apiKeyHeader() {
        return API_KEY_HEADER;
    }

    @Override
    public BigDecimal getCurrentPrice(String asset, String currency) {
        String symbol = toSymbol(asset, currency);
        JsonNode root = getJson(baseUrl + "/api/v3/ticker/price?symbol=" + symbol);
        BigDecimal price = decimalOrNull(root.path("price"));
        if (price == null) {
            throw ProviderException.invalidResult(NAME, "no price for " + symbol);
        }
        return price;
    }

    @Override
    public List<HistoricalPricePoint> getHistoricalData(String asset, String currency, HistoricalQuery query) {
        String symbol = toSymbol(asset, currency);
        StringBuilder url = new StringBuilder(baseUrl)
                .append("/api/v3/klines?symbol=").append(symbol)
                .append("&interval=").append(toKlineInterval(query.interval()));
        if (query.hasDateRange()) {
            url.append("&startTime=").append(query.startDate().atStartOfDay(ZoneOffset.UTC).toInstant().toEpochMilli())
                    .append("&endTime=").append(query.endDate().plusDays(1).atStartOfDay(ZoneOffset.UTC).toInstant().toEpochMilli() - 1)
                    .append("&limit=").append(MAX_KLINES);
        } else {
            url.append("&limit=").append(klineLimit(query.period(), query.interval()));
        }
        return parseKlines(getJson(url.toString()));
    }

    @Override
    public boolean checkAvailability() {
        try {
            getBody(baseUrl + "/api/v3/ping");
            return true;
        } catch (ProviderException e) {
            log.debug("Binance ping failed: {}", e.getMessage());
            return false;
        }
    }

    static String toSymbol(String asset, String currency) {
        String quote = currency.strip().toUpperCase(Locale.ROOT);
        return asset.strip().toUpperCase(Locale.ROOT) + QUOTE_ALIASES.getOrDefault(quote, quote);
    }

    static String toKlineInterval(String interval) {
        if ("hourly".equalsIgnoreCase(interval)) {
            return "1h";
        }
        if ("weekly".equalsIgnoreCase(interval)) {
            return "1w";
        }
        return "1d";
    }

    /**
     * Number of candles covering the period at the given interval, clamped to [1, 1000].
     */
    static int klineLimit(String period, String interval) {
        int days = PERIOD_DAYS.getOrDefault(period == null ? "1M" : period.toUpperCase(Locale.ROOT), 30);
        long candles;
        if ("hourly".equalsIgnoreCase(interval)) {
            candles = days * 24L;
        } else if ("weekly".equalsIgnoreCase(interval)) {
            candles = (days + 6) / 7;
        } else {
            candles = days;
        }
        return (int) Math.max(1, Math.min(MAX_KLINES, candles));
    }

    /**
     * Kline row: [openTime, open, high, low, close, volume, closeTime, ...]. Close is used as the price.
     */
    static List<HistoricalPricePoint> parseKlines(JsonNode root) {
        if (!root.isArray()) {
            throw ProviderException.invalidResult(NAME, "klines is not an array");
        }
        List<HistoricalPricePoint> points = new ArrayList<>(root.size());
        for (JsonNode row : root) {
            BigDecimal close = decimalOrNull(row.path(4));
            if (close == null) {
                continue;
            }
            points.add(new HistoricalPricePoint(
                    Instant.ofEpochMilli(row.path(0).asLong()),
                    close,
                    decimalOrNull(row.path(5)),
                    null));
        }
        return points;
    }
}
