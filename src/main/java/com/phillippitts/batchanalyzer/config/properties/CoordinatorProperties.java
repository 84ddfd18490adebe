package com.phillippitts.batchanalyzer.config.properties;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Defaults and tuning for the batch coordinator.
 *
 * <p>Concurrency, call spacing, attempt count and cost ceiling are per-run defaults that a
 * request may override. Backoff and call timeout apply to every run.
 */
@ConfigurationProperties(prefix = "batch.coordinator")
@Validated
public class CoordinatorProperties {

    /** Maximum analyses in flight at once. */
    @Min(value = 1, message = "Concurrency must be at least 1")
    private int concurrency = 5;

    /** Minimum spacing between two capability calls, across all slots. */
    @PositiveOrZero(message = "Min call spacing must be >= 0")
    private long minCallSpacingMs = 100;

    /** Attempts per item including the first one. */
    @Min(value = 1, message = "Max attempts must be at least 1")
    private int maxAttempts = 3;

    /** First retry delay; doubles with each further attempt. */
    @Positive(message = "Base backoff must be positive")
    private long baseBackoffMs = 1000;

    /** Upper bound for a single retry delay, including a provider's retry-after hint. */
    @Positive(message = "Max backoff must be positive")
    private long maxBackoffMs = 30_000;

    /** Random jitter added on top of the exponential delay, as a fraction of it. */
    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double jitterRatio = 0.25;

    /** Timeout for one capability call; a timeout counts as a retryable failure. */
    @Positive(message = "Call timeout must be positive")
    private long callTimeoutMs = 60_000;

    /** Optional total cost ceiling; unset means unlimited. */
    @PositiveOrZero(message = "Max cost must be >= 0")
    private Double maxCost;

    /** Estimates above this value are logged as warnings. */
    @PositiveOrZero
    private double costWarningThreshold = 10.0;

    public int getConcurrency() {
        return concurrency;
    }

    public void setConcurrency(int concurrency) {
        this.concurrency = concurrency;
    }

    public long getMinCallSpacingMs() {
        return minCallSpacingMs;
    }

    public void setMinCallSpacingMs(long minCallSpacingMs) {
        this.minCallSpacingMs = minCallSpacingMs;
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    public void setMaxAttempts(int maxAttempts) {
        this.maxAttempts = maxAttempts;
    }

    public long getBaseBackoffMs() {
        return baseBackoffMs;
    }

    public void setBaseBackoffMs(long baseBackoffMs) {
        this.baseBackoffMs = baseBackoffMs;
    }

    public long getMaxBackoffMs() {
        return maxBackoffMs;
    }

    public void setMaxBackoffMs(long maxBackoffMs) {
        this.maxBackoffMs = maxBackoffMs;
    }

    public double getJitterRatio() {
        return jitterRatio;
    }

    public void setJitterRatio(double jitterRatio) {
        this.jitterRatio = jitterRatio;
    }

    public long getCallTimeoutMs() {
        return callTimeoutMs;
    }

    public void setCallTimeoutMs(long callTimeoutMs) {
        this.callTimeoutMs = callTimeoutMs;
    }

    public Double getMaxCost() {
        return maxCost;
    }

    public void setMaxCost(Double maxCost) {
        this.maxCost = maxCost;
    }

    public double getCostWarningThreshold() {
        return costWarningThreshold;
    }

    public void setCostWarningThreshold(double costWarningThreshold) {
        this.costWarningThreshold = costWarningThreshold;
    }
}
