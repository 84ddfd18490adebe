package com.phillippitts.batchanalyzer.exception;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

/**
 * Thrown by a vision capability when a single invocation fails.
 *
 * <p>The {@link Kind} discriminates the provider-side failure. Only {@link Kind#AUTH_FAILURE}
 * and {@link Kind#FATAL} are non-retryable; everything else may succeed on a later attempt.
 */
public class CapabilityException extends BatchAnalysisException {

    public enum Kind { RATE_LIMITED, TIMEOUT, AUTH_FAILURE, TRANSIENT, FATAL }

    private final Kind kind;
    private final String tierName;
    private final Duration retryAfter;

    public CapabilityException(Kind kind, String message, String tierName) {
        this(kind, message, tierName, null, null);
    }

    public CapabilityException(Kind kind, String message, String tierName, Duration retryAfter, Throwable cause) {
        super(message + " (tier: " + (tierName == null ? "unknown" : tierName) + ", kind: " + kind + ")", cause);
        this.kind = Objects.requireNonNull(kind, "kind");
        this.tierName = tierName == null ? "unknown" : tierName;
        this.retryAfter = retryAfter;
    }

    public static CapabilityException rateLimited(String tierName, Duration retryAfter) {
        return new CapabilityException(Kind.RATE_LIMITED, "Rate limited by provider", tierName, retryAfter, null);
    }

    public static CapabilityException timeout(String tierName, long timeoutMs) {
        return new CapabilityException(Kind.TIMEOUT, "Capability call timed out after " + timeoutMs + "ms", tierName);
    }

    public static CapabilityException authFailure(String tierName) {
        return new CapabilityException(Kind.AUTH_FAILURE, "Provider rejected credentials", tierName);
    }

    public static CapabilityException transientError(String tierName, String message) {
        return new CapabilityException(Kind.TRANSIENT, message, tierName);
    }

    public static CapabilityException fatal(String tierName, String message) {
        return new CapabilityException(Kind.FATAL, message, tierName);
    }

    public Kind getKind() {
        return kind;
    }

    public String getTierName() {
        return tierName;
    }

    public Optional<Duration> getRetryAfter() {
        return Optional.ofNullable(retryAfter);
    }

    public boolean isRetryable() {
        return kind != Kind.AUTH_FAILURE && kind != Kind.FATAL;
    }
}
