package com.priceradar.common;

import java.util.concurrent.ThreadLocalRandom;

/**
 * Linear backoff for provider retries: delay before the retry that follows zero-based attempt n is
 * baseDelay * (n + 1), with optional ±jitter. Jitter is kept below 1/3 so a delay never falls under the one
 * before it.
 */
public final class RetryPolicy {

    /** 2b(1 - f) > b(1 + f) holds only for f < 1/3. */
    static final double MAX_JITTER_FACTOR = 1.0 / 3.0;

    private final long baseDelayMs;
    private final double jitterFactor;
    private final int maxRetries;

    public RetryPolicy(long baseDelayMs, double jitterFactor, int maxRetries) {
        if (baseDelayMs < 0) {
            throw new IllegalArgumentException("baseDelayMs must not be negative");
        }
        if (jitterFactor < 0 || jitterFactor >= MAX_JITTER_FACTOR) {
            throw new IllegalArgumentException("jitterFactor must be in [0, 1/3)");
        }
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must not be negative");
        }
        this.baseDelayMs = baseDelayMs;
        this.jitterFactor = jitterFactor;
        this.maxRetries = maxRetries;
    }

    /**
     * Delay in milliseconds to wait after the given zero-based failed attempt.
     */
    public long delayMs(int attempt) {
        long linear = baseDelayMs * (Math.max(0, attempt) + 1L);
        return jitter(linear);
    }

    private long jitter(long value) {
        if (jitterFactor <= 0) {
            return value;
        }
        ThreadLocalRandom r = ThreadLocalRandom.current();
        double jitter = 1.0 + (r.nextDouble() * 2.0 - 1.0) * jitterFactor;
        return Math.max(0, (long) (value * jitter));
    }

    /** Retries after the first attempt; total attempts per provider is maxRetries + 1. */
    public int getMaxRetries() {
        return maxRetries;
    }

    public int getTotalAttempts() {
        return maxRetries + 1;
    }

    /**
     * Default: 500ms base, no jitter, 2 retries.
     */
    public static RetryPolicy defaultPolicy() {
        return new RetryPolicy(500L, 0.0, 2);
    }
}
