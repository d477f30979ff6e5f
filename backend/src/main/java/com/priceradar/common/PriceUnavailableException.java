package com.priceradar.common;

import lombok.Getter;

/**
 * Thrown when every provider and every retry failed for an operation (exhaustion).
 * API layer maps it to 503 SOURCES_EXHAUSTED.
 */
@Getter
public class PriceUnavailableException extends RuntimeException {

    public static final String SOURCES_EXHAUSTED = "SOURCES_EXHAUSTED";

    /** Error code surfaced in ErrorBody. */
    private final String errorCode;

    public PriceUnavailableException(String message, Throwable cause) {
        super(message, cause);
        this.errorCode = SOURCES_EXHAUSTED;
    }

    public static PriceUnavailableException forPair(String what, String asset, String currency, Throwable lastError) {
        return new PriceUnavailableException(
                "Could not obtain " + what + " for " + asset + " in " + currency + " from any source", lastError);
    }

    public static PriceUnavailableException forOperation(String what, Throwable lastError) {
        return new PriceUnavailableException("Could not obtain " + what + " from any source", lastError);
    }
}
