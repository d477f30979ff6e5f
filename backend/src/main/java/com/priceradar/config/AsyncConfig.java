package com.priceradar.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Named thread pool for provider calls. Every attempt, sequential or part of a cross-source comparison, runs here
 * so it can be timed out and interrupted.
 */
@Configuration
public class AsyncConfig {

    public static final String PROVIDER_CALL_EXECUTOR = "provider-call-executor";

    /** No queue: when all threads are busy the attempt is rejected and counts as a failure. */
    @Bean(name = PROVIDER_CALL_EXECUTOR)
    public ThreadPoolTaskExecutor providerCallExecutor() {
        ThreadPoolTaskExecutor e = new ThreadPoolTaskExecutor();
        e.setCorePoolSize(16);
        e.setMaxPoolSize(64);
        e.setQueueCapacity(0);
        e.setThreadNamePrefix("provider-call-");
        e.initialize();
        return e;
    }
}
