package com.priceradar.provider.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.priceradar.provider.binance.BinancePriceProvider;
import com.priceradar.provider.coingecko.CoinGeckoPriceProvider;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;

/**
 * Builds the provider adapters enabled in priceradar.providers, each behind its own request budget.
 * A call that cannot get a permit immediately fails that attempt instead of waiting.
 */
@Configuration
@EnableConfigurationProperties(ProviderProperties.class)
public class ProviderConfig {

    @Bean
    @ConditionalOnProperty(prefix = "priceradar.providers.coingecko", name = "enabled", havingValue = "true", matchIfMissing = true)
    public CoinGeckoPriceProvider coinGeckoPriceProvider(ProviderProperties properties,
                                                         WebClient.Builder webClientBuilder,
                                                         ObjectMapper objectMapper) {
        ProviderProperties.CoinGecko cg = properties.getCoingecko();
        RateLimiter limiter = RateLimiter.of("coingecko", RateLimiterConfig.custom()
                .limitRefreshPeriod(Duration.ofMinutes(1))
                .limitForPeriod(Math.max(1, cg.getRequestsPerMinute()))
                .timeoutDuration(Duration.ZERO)
                .build());
        return new CoinGeckoPriceProvider(cg.getBaseUrl(), cg.getProBaseUrl(), cg.getApiKey(),
                webClientBuilder, limiter, objectMapper);
    }

    @Bean
    @ConditionalOnProperty(prefix = "priceradar.providers.binance", name = "enabled", havingValue = "true", matchIfMissing = true)
    public BinancePriceProvider binancePriceProvider(ProviderProperties properties,
                                                     WebClient.Builder webClientBuilder,
                                                     ObjectMapper objectMapper) {
        ProviderProperties.Binance bn = properties.getBinance();
        RateLimiter limiter = RateLimiter.of("binance", RateLimiterConfig.custom()
                .limitRefreshPeriod(Duration.ofSeconds(1))
                .limitForPeriod(Math.max(1, bn.getRequestsPerSecond()))
                .timeoutDuration(Duration.ZERO)
                .build());
        return new BinancePriceProvider(bn.getBaseUrl(), bn.getApiKey(), webClientBuilder, limiter, objectMapper);
    }
}
