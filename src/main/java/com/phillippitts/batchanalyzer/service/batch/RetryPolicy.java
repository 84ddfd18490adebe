package com.phillippitts.batchanalyzer.service.batch;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * Exponential backoff with jitter over a fixed number of attempts.
 *
 * <p>The delay after the n-th failed attempt is {@code base * 2^(n-1)} plus up to
 * {@code jitterRatio} of that, capped at {@code maxDelay}. A provider retry-after hint raises
 * the delay to at least the hint, still capped at {@code maxDelay}.
 */
final class RetryPolicy {

    private final int maxAttempts;
    private final long baseDelayMs;
    private final long maxDelayMs;
    private final double jitterRatio;
    private final DoubleSupplier random;

    RetryPolicy(int maxAttempts, long baseDelayMs, long maxDelayMs, double jitterRatio) {
        this(maxAttempts, baseDelayMs, maxDelayMs, jitterRatio, () -> ThreadLocalRandom.current().nextDouble());
    }

    RetryPolicy(int maxAttempts, long baseDelayMs, long maxDelayMs, double jitterRatio, DoubleSupplier random) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1, got: " + maxAttempts);
        }
        if (baseDelayMs < 0 || maxDelayMs < 0) {
            throw new IllegalArgumentException("delays must be >= 0");
        }
        if (jitterRatio < 0.0 || jitterRatio > 1.0) {
            throw new IllegalArgumentException("jitterRatio must be in [0,1], got: " + jitterRatio);
        }
        this.maxAttempts = maxAttempts;
        this.baseDelayMs = baseDelayMs;
        this.maxDelayMs = maxDelayMs;
        this.jitterRatio = jitterRatio;
        this.random = random;
    }

    int maxAttempts() {
        return maxAttempts;
    }

    /**
     * @param attemptsMade attempts already made, including the one that just failed
     * @param retryable    whether the failure may succeed on another attempt
     */
    boolean shouldRetry(int attemptsMade, boolean retryable) {
        return retryable && attemptsMade < maxAttempts;
    }

    /**
     * @param failedAttempt 1-based number of the attempt that just failed
     * @param retryAfter    provider hint, if any
     * @return delay before the next attempt in milliseconds
     */
    long delayMillis(int failedAttempt, Optional<Duration> retryAfter) {
        int shift = Math.min(Math.max(failedAttempt - 1, 0), 30);
        double exponential = Math.min((double) maxDelayMs, (double) baseDelayMs * (1L << shift));
        double jitter = exponential * jitterRatio * random.getAsDouble();
        long delay = (long) Math.min((double) maxDelayMs, exponential + jitter);
        if (retryAfter.isPresent()) {
            long hinted = Math.min(maxDelayMs, Math.max(0L, retryAfter.get().toMillis()));
            delay = Math.max(delay, hinted);
        }
        return delay;
    }
}
