package com.priceradar.provider.coingecko;

import java.util.Locale;
import java.util.Map;

/**
 * Maps ticker symbols and request periods to CoinGecko API parameters.
 */
public final class CoinGeckoIds {

    private CoinGeckoIds() {}

    private static final Map<String, String> COIN_IDS = Map.ofEntries(
            Map.entry("BTC", "bitcoin"),
            Map.entry("ETH", "ethereum"),
            Map.entry("USDT", "tether"),
            Map.entry("BNB", "binancecoin"),
            Map.entry("USDC", "usd-coin"),
            Map.entry("XRP", "ripple"),
            Map.entry("SOL", "solana"),
            Map.entry("ADA", "cardano"),
            Map.entry("DOGE", "dogecoin"),
            Map.entry("TON", "the-open-network")
    );

    private static final Map<String, String> PERIOD_DAYS = Map.of(
            "1D", "1",
            "1W", "7",
            "1M", "30",
            "3M", "90",
            "6M", "180",
            "1Y", "365",
            "ALL", "max"
    );

    /**
     * CoinGecko coin id for a symbol, or the lower-cased symbol when not mapped.
     */
    public static String toCoinId(String symbol) {
        String upper = symbol.strip().toUpperCase(Locale.ROOT);
        return COIN_IDS.getOrDefault(upper, symbol.strip().toLowerCase(Locale.ROOT));
    }

    /** "days" parameter for market_chart; unknown periods fall back to 30. */
    public static String toDays(String period) {
        return period == null ? "30" : PERIOD_DAYS.getOrDefault(period.toUpperCase(Locale.ROOT), "30");
    }

    /** CoinGecko has no weekly granularity: weekly and unknown values map to daily. */
    public static String toInterval(String interval) {
        return "hourly".equalsIgnoreCase(interval) ? "hourly" : "daily";
    }
}
