package com.finopsguard.simulation;

import java.time.Duration;

/**
 * Raised when the simulation timed out before any resource could be priced.
 */
public class AnalysisTimeoutException extends RuntimeException {

    private final Duration timeout;

    public AnalysisTimeoutException(Duration timeout, int resourceCount) {
        super(String.format("Cost analysis timed out after %d ms before pricing any of %d resources",
                timeout.toMillis(), resourceCount));
        this.timeout = timeout;
    }

    public Duration getTimeout() {
        return timeout;
    }
}
