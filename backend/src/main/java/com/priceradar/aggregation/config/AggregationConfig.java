package com.priceradar.aggregation.config;

import com.priceradar.aggregation.ProviderCallExecutor;
import com.priceradar.cache.CacheTtlPolicy;
import com.priceradar.config.AsyncConfig;
import com.priceradar.provider.PriceProvider;
import com.priceradar.registry.ProviderHealthTracker;
import com.priceradar.registry.ProviderRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Clock;
import java.time.Duration;

/**
 * Wires the registry with every adapter bean, the health tracker and the cache TTL policy.
 */
@Configuration
@EnableConfigurationProperties(AggregationProperties.class)
@Slf4j
public class AggregationConfig {

    @Bean
    public ProviderHealthTracker providerHealthTracker(AggregationProperties properties, Clock clock) {
        AggregationProperties.Health h = properties.getHealth();
        return new ProviderHealthTracker(h.isEnabled(), h.getFailureThreshold(), Duration.ofMillis(h.getCooldownMs()), clock);
    }

    @Bean
    public ProviderRegistry providerRegistry(AggregationProperties properties,
                                             ProviderHealthTracker healthTracker,
                                             ObjectProvider<PriceProvider> providers) {
        ProviderRegistry registry = new ProviderRegistry(properties.getPriority(), healthTracker);
        providers.orderedStream().forEach(p -> registry.addApiSource(p.getName(), p));
        log.info("Price providers registered: {}, priority {}", registry.getProviders().keySet(), registry.priorityList());
        return registry;
    }

    @Bean
    public CacheTtlPolicy cacheTtlPolicy(AggregationProperties properties) {
        return new CacheTtlPolicy(properties.getHighVolatilityAssets());
    }

    @Bean
    public ProviderCallExecutor providerCallExecutor(
            @Qualifier(AsyncConfig.PROVIDER_CALL_EXECUTOR) ThreadPoolTaskExecutor executor) {
        return new ProviderCallExecutor(executor.getThreadPoolExecutor());
    }
}
