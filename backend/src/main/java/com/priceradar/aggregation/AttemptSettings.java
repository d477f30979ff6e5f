package com.priceradar.aggregation;

import com.priceradar.common.RetryPolicy;

import java.time.Duration;

/**
 * Timeout and retry policy applied to one provider during one resolution.
 */
public record AttemptSettings(Duration timeout, RetryPolicy retryPolicy) {}
