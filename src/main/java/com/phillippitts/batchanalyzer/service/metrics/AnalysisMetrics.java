package com.phillippitts.batchanalyzer.service.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

/**
 * Centralized metrics for batch analysis.
 *
 * <p>Provides instrumentation for:
 * <ul>
 *   <li>Capability call latency and outcome per tier</li>
 *   <li>Tier escalations by reason</li>
 *   <li>Item outcomes (succeeded, derived, failed, skipped)</li>
 *   <li>Cost per run</li>
 * </ul>
 *
 * <p>All metrics are exposed via Micrometer and available through the actuator endpoints.
 */
@Component
public class AnalysisMetrics {

    private static final String METRIC_PREFIX = "batchanalyzer";

    private final MeterRegistry registry;

    public AnalysisMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    /**
     * Records the latency of one capability call.
     *
     * @param tier          tier name
     * @param durationNanos duration in nanoseconds
     */
    public void recordCallLatency(String tier, long durationNanos) {
        Timer.builder(METRIC_PREFIX + ".capability.latency")
                .description("Time taken by one capability call")
                .tag("tier", tier)
                .register(registry)
                .record(durationNanos, TimeUnit.NANOSECONDS);
    }

    public void incrementCallSuccess(String tier) {
        Counter.builder(METRIC_PREFIX + ".capability.success")
                .description("Number of successful capability calls")
                .tag("tier", tier)
                .register(registry)
                .increment();
    }

    /**
     * @param tier tier name
     * @param kind failure kind (rate_limited, timeout, ...)
     */
    public void incrementCallFailure(String tier, String kind) {
        Counter.builder(METRIC_PREFIX + ".capability.failure")
                .description("Number of failed capability calls")
                .tag("tier", tier)
                .tag("kind", kind)
                .register(registry)
                .increment();
    }

    /**
     * @param fromTier tier that was left
     * @param reason   "failure" or "insufficient"
     */
    public void incrementEscalation(String fromTier, String reason) {
        Counter.builder(METRIC_PREFIX + ".escalation")
                .description("Number of tier escalations")
                .tag("from", fromTier)
                .tag("reason", reason)
                .register(registry)
                .increment();
    }

    /**
     * @param status outcome status name (succeeded, derived, failed, skipped)
     * @param count  number of items with that outcome
     */
    public void recordItemOutcomes(String status, int count) {
        if (count <= 0) {
            return;
        }
        Counter.builder(METRIC_PREFIX + ".items")
                .description("Number of batch items by outcome")
                .tag("status", status)
                .register(registry)
                .increment(count);
    }

    public void recordRunCost(double cost) {
        DistributionSummary.builder(METRIC_PREFIX + ".run.cost")
                .description("Cost incurred per batch run")
                .register(registry)
                .record(cost);
    }
}
