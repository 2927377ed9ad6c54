package com.finopsguard.pricing.live;

/**
 * Raised when a provider pricing API cannot be reached or returns an unusable payload.
 */
public class LivePricingException extends RuntimeException {

    public LivePricingException(String message) {
        super(message);
    }

    public LivePricingException(String message, Throwable cause) {
        super(message, cause);
    }
}
