package com.priceradar.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "priceradar.cache")
@Getter
@Setter
public class CacheProperties {

    /** Upper bound on cached entries across all keys; least recently used entries go first. */
    private long maximumSize = 10_000;
}
