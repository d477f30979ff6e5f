package com.priceradar.common;

import lombok.Getter;

/**
 * Failure of a single provider attempt (timeout, invalid result, call error). Recovered locally by the resolvers
 * and never surfaced to callers on its own.
 */
@Getter
public class ProviderException extends RuntimeException {

    public enum Kind {
        TIMEOUT,
        INVALID_RESULT,
        CALL_FAILED,
        INTERRUPTED
    }

    private final String providerName;
    private final Kind kind;

    public ProviderException(String providerName, Kind kind, String message) {
        super(message);
        this.providerName = providerName;
        this.kind = kind;
    }

    public ProviderException(String providerName, Kind kind, String message, Throwable cause) {
        super(message, cause);
        this.providerName = providerName;
        this.kind = kind;
    }

    public static ProviderException timeout(String providerName, long timeoutMs) {
        return new ProviderException(providerName, Kind.TIMEOUT,
                "Timed out after " + timeoutMs + "ms waiting for " + providerName);
    }

    public static ProviderException invalidResult(String providerName, String detail) {
        return new ProviderException(providerName, Kind.INVALID_RESULT, "Invalid result from " + providerName + ": " + detail);
    }
}
