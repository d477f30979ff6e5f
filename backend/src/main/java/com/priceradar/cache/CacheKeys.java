package com.priceradar.cache;

import java.util.Locale;

/**
 * Cache key scheme shared by the facade and resolvers.
 */
public final class CacheKeys {

    private CacheKeys() {}

    public static String price(String asset, String currency) {
        return "price_" + upper(asset) + "_" + upper(currency);
    }

    public static String history(String asset, String currency, String period, String interval) {
        return "history_" + upper(asset) + "_" + upper(currency) + "_" + period + "_" + interval;
    }

    public static String assetList(int limit, boolean includeMetadata) {
        return "cryptos_list_" + limit + "_" + includeMetadata;
    }

    public static String assetDetails(String asset, String currency) {
        return "crypto_details_" + upper(asset) + "_" + upper(currency);
    }

    public static String marketInfo(int limit, String currency) {
        return "market_info_" + limit + "_" + upper(currency);
    }

    private static String upper(String s) {
        return s == null ? "" : s.strip().toUpperCase(Locale.ROOT);
    }
}
