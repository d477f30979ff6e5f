package com.priceradar.aggregation;

/**
 * Availability probe outcome for one registered provider.
 */
public record ProviderStatus(boolean available, String reason, boolean requiresKey, boolean hasValidKey) {}
