package com.priceradar.provider.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Provider adapter configuration. Documented in application.yml under priceradar.providers.
 */
@ConfigurationProperties(prefix = "priceradar.providers")
@Getter
@Setter
public class ProviderProperties {

    private CoinGecko coingecko = new CoinGecko();

    private Binance binance = new Binance();

    @Getter
    @Setter
    public static class CoinGecko {
        /** Register the adapter at startup. */
        private boolean enabled = true;
        /** Public API base URL (no key). */
        private String baseUrl = "https://api.coingecko.com/api/v3";
        /** Pro API base URL, used once a key is set. */
        private String proBaseUrl = "https://pro-api.coingecko.com/api/v3";
        /** Optional API key. */
        private String apiKey;
        /** Request budget per minute (public tier allows ~30). */
        private int requestsPerMinute = 30;
    }

    @Getter
    @Setter
    public static class Binance {
        private boolean enabled = true;
        private String baseUrl = "https://api.binance.com";
        /** Optional; public market data does not need a key. */
        private String apiKey;
        /** Request budget per second. */
        private int requestsPerSecond = 10;
    }
}
