package com.priceradar.provider;

import lombok.Getter;

/**
 * Thrown by default {@link PriceProvider} methods for capabilities the adapter does not declare.
 */
@Getter
public class UnsupportedCapabilityException extends UnsupportedOperationException {

    private final String providerName;
    private final ProviderCapability capability;

    public UnsupportedCapabilityException(String providerName, ProviderCapability capability) {
        super(providerName + " does not support " + capability);
        this.providerName = providerName;
        this.capability = capability;
    }
}
