package com.priceradar.provider.coingecko;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.priceradar.common.ProviderException;
import com.priceradar.provider.AssetDetails;
import com.priceradar.provider.AssetSummary;
import com.priceradar.provider.HistoricalPricePoint;
import com.priceradar.provider.HistoricalQuery;
import com.priceradar.provider.MarketInfo;
import com.priceradar.provider.ProviderCapability;
import com.priceradar.provider.WebClientPriceProvider;
import io.github.resilience4j.ratelimiter.RateLimiter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.reactive.function.client.WebClient;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * CoinGecko adapter: /simple/price, /coins/{id}/market_chart, /coins/markets, /coins/{id}, /global, /ping.
 * Works without a key on the public API; a key switches to the pro base URL.
 */
@Slf4j
public class CoinGeckoPriceProvider extends WebClientPriceProvider {

    public static final String NAME = "coinGecko";
    static final String API_KEY_HEADER = "x-cg-pro-api-key";

    private static final Set<ProviderCapability> CAPABILITIES =
            Collections.unmodifiableSet(EnumSet.allOf(ProviderCapability.class));

    private final String baseUrl;
    private final String proBaseUrl;

    public CoinGeckoPriceProvider(String baseUrl, String proBaseUrl, String apiKey,
                                  WebClient.Builder webClientBuilder, RateLimiter rateLimiter,
                                  ObjectMapper objectMapper) {
        super(webClientBuilder, rateLimiter, objectMapper, apiKey);
        this.baseUrl = baseUrl;
        this.proBaseUrl = proBaseUrl;
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
        String coinId = CoinGeckoIds.toCoinId(asset);
        String vs = currency.toLowerCase(Locale.ROOT);
        JsonNode root = getJson(endpoint() + "/simple/price?ids=" + coinId + "&vs_currencies=" + vs);
        BigDecimal price = parsePrice(root, coinId, vs);
        if (price == null) {
            throw ProviderException.invalidResult(NAME, "price not available for " + asset + " in " + currency);
        }
        return price;
    }

    @Override
    public List<HistoricalPricePoint> getHistoricalData(String asset, String currency, HistoricalQuery query) {
        String coinId = CoinGeckoIds.toCoinId(asset);
        String vs = currency.toLowerCase(Locale.ROOT);
        String url;
        if (query.hasDateRange()) {
            long from = query.startDate().atStartOfDay(ZoneOffset.UTC).toEpochSecond();
            long to = query.endDate().plusDays(1).atStartOfDay(ZoneOffset.UTC).toEpochSecond();
            url = endpoint() + "/coins/" + coinId + "/market_chart/range?vs_currency=" + vs + "&from=" + from + "&to=" + to;
        } else {
            url = endpoint() + "/coins/" + coinId + "/market_chart?vs_currency=" + vs
                    + "&days=" + CoinGeckoIds.toDays(query.period())
                    + "&interval=" + CoinGeckoIds.toInterval(query.interval());
        }
        return parseMarketChart(getJson(url));
    }

    @Override
    public List<AssetSummary> getAvailableCryptos(int limit, boolean includeMetadata) {
        return listMarkets(limit, includeMetadata, "usd");
    }

    @Override
    public AssetDetails getCryptoDetails(String asset, String currency) {
        String coinId = CoinGeckoIds.toCoinId(asset);
        JsonNode root = getJson(endpoint() + "/coins/" + coinId
                + "?localization=false&tickers=false&market_data=true&community_data=false&developer_data=false");
        return parseDetails(root, currency.toLowerCase(Locale.ROOT));
    }

    @Override
    public MarketInfo getMarketInfo(int limit, String currency) {
        String vs = currency.toLowerCase(Locale.ROOT);
        JsonNode data = getJson(endpoint() + "/global").path("data");
        Map<String, BigDecimal> percentages = new LinkedHashMap<>();
        data.path("market_cap_percentage").fields()
                .forEachRemaining(e -> percentages.put(e.getKey(), decimalOrNull(e.getValue())));
        List<AssetSummary> markets = listMarkets(limit, true, vs);
        return new MarketInfo(
                decimalOrNull(data.path("total_market_cap").path(vs)),
                decimalOrNull(data.path("total_volume").path(vs)),
                percentages,
                markets);
    }

    @Override
    public boolean checkAvailability() {
        try {
            getBody(endpoint() + "/ping");
            return true;
        } catch (ProviderException e) {
            log.debug("CoinGecko ping failed: {}", e.getMessage());
            return false;
        }
    }

    private List<AssetSummary> listMarkets(int limit, boolean includeMetadata, String vs) {
        JsonNode root = getJson(endpoint() + "/coins/markets?vs_currency=" + vs
                + "&order=market_cap_desc&per_page=" + limit + "&page=1");
        return parseMarkets(root, includeMetadata);
    }

    private String endpoint() {
        return hasValidApiKey() ? proBaseUrl : baseUrl;
    }

    static BigDecimal parsePrice(JsonNode root, String coinId, String vs) {
        JsonNode price = root.path(coinId).path(vs);
        if (price.isMissingNode() || !price.isNumber()) {
            return null;
        }
        return price.decimalValue();
    }

    static List<HistoricalPricePoint> parseMarketChart(JsonNode root) {
        JsonNode prices = root.path("prices");
        if (!prices.isArray()) {
            throw ProviderException.invalidResult(NAME, "market_chart without prices array");
        }
        Map<Long, BigDecimal> volumes = indexByTimestamp(root.path("total_volumes"));
        Map<Long, BigDecimal> marketCaps = indexByTimestamp(root.path("market_caps"));
        List<HistoricalPricePoint> points = new ArrayList<>(prices.size());
        for (JsonNode item : prices) {
            long ts = item.path(0).asLong();
            BigDecimal price = decimalOrNull(item.path(1));
            if (price == null) {
                continue;
            }
            points.add(new HistoricalPricePoint(Instant.ofEpochMilli(ts), price, volumes.get(ts), marketCaps.get(ts)));
        }
        return points;
    }

    static List<AssetSummary> parseMarkets(JsonNode root, boolean includeMetadata) {
        if (!root.isArray()) {
            throw ProviderException.invalidResult(NAME, "coins/markets is not an array");
        }
        List<AssetSummary> list = new ArrayList<>(root.size());
        for (JsonNode coin : root) {
            String id = textOrNull(coin.path("id"));
            String symbol = coin.path("symbol").asText("").toUpperCase(Locale.ROOT);
            String name = textOrNull(coin.path("name"));
            if (!includeMetadata) {
                list.add(AssetSummary.basic(id, symbol, name));
                continue;
            }
            JsonNode rank = coin.path("market_cap_rank");
            list.add(new AssetSummary(
                    id,
                    symbol,
                    name,
                    textOrNull(coin.path("image")),
                    decimalOrNull(coin.path("current_price")),
                    decimalOrNull(coin.path("market_cap")),
                    rank.isNumber() ? rank.asInt() : null,
                    decimalOrNull(coin.path("price_change_percentage_24h"))));
        }
        return list;
    }

    static AssetDetails parseDetails(JsonNode root, String vs) {
        if (root.path("id").isMissingNode()) {
            throw ProviderException.invalidResult(NAME, "coin details without id");
        }
        JsonNode md = root.path("market_data");
        JsonNode rank = root.path("market_cap_rank");
        return new AssetDetails(
                textOrNull(root.path("id")),
                root.path("symbol").asText("").toUpperCase(Locale.ROOT),
                textOrNull(root.path("name")),
                root.path("description").path("en").asText(""),
                textOrNull(root.path("image").path("large")),
                decimalOrNull(md.path("current_price").path(vs)),
                decimalOrNull(md.path("market_cap").path(vs)),
                rank.isNumber() ? rank.asInt() : null,
                decimalOrNull(md.path("total_volume").path(vs)),
                decimalOrNull(md.path("high_24h").path(vs)),
                decimalOrNull(md.path("low_24h").path(vs)),
                decimalOrNull(md.path("price_change_24h")),
                decimalOrNull(md.path("price_change_percentage_24h")),
                decimalOrNull(md.path("circulating_supply")),
                decimalOrNull(md.path("total_supply")),
                decimalOrNull(md.path("max_supply")),
                decimalOrNull(md.path("ath").path(vs)),
                instantOrNull(md.path("ath_date").path(vs)),
                decimalOrNull(md.path("atl").path(vs)),
                instantOrNull(md.path("atl_date").path(vs)));
    }

    private static Map<Long, BigDecimal> indexByTimestamp(JsonNode series) {
        if (!series.isArray()) {
            return Map.of();
        }
        Map<Long, BigDecimal> byTs = new HashMap<>();
        for (JsonNode item : series) {
            BigDecimal value = decimalOrNull(item.path(1));
            if (value != null) {
                byTs.put(item.path(0).asLong(), value);
            }
        }
        return byTs;
    }

    private static Instant instantOrNull(JsonNode node) {
        String text = textOrNull(node);
        if (text == null || text.isBlank()) {
            return null;
        }
        try {
            return Instant.parse(text);
        } catch (DateTimeParseException e) {
            return null;
        }
    }
}
