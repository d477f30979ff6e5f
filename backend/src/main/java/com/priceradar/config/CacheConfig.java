package com.priceradar.config;

import com.priceradar.cache.CacheStore;
import com.priceradar.cache.CaffeineCacheStore;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Caffeine-backed response cache. Entries carry their own TTL, checked against the clock on every read.
 */
@Configuration
@EnableConfigurationProperties(CacheProperties.class)
public class CacheConfig {

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public CacheStore priceCacheStore(CacheProperties properties, Clock clock) {
        return new CaffeineCacheStore(properties.getMaximumSize(), clock);
    }
}
