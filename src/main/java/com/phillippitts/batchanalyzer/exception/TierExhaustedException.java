package com.phillippitts.batchanalyzer.exception;

import java.time.Duration;
import java.util.Optional;

/**
 * Thrown when every eligible tier failed for a representative and no result was obtained.
 *
 * <p>The batch coordinator treats this as one failed attempt and decides whether to retry
 * based on {@link #isRetryable()}.
 */
public class TierExhaustedException extends BatchAnalysisException {

    private final CapabilityException lastFailure;
    private final boolean retryable;

    public TierExhaustedException(String message, CapabilityException lastFailure, boolean retryable) {
        super(message, lastFailure);
        this.lastFailure = lastFailure;
        this.retryable = retryable;
    }

    public CapabilityException getLastFailure() {
        return lastFailure;
    }

    public boolean isRetryable() {
        return retryable;
    }

    public Optional<Duration> getRetryAfter() {
        return lastFailure == null ? Optional.empty() : lastFailure.getRetryAfter();
    }
}
