package com.phillippitts.batchanalyzer.service.tier;

import com.phillippitts.batchanalyzer.domain.AnalysisResult;
import com.phillippitts.batchanalyzer.domain.Tier;
import com.phillippitts.batchanalyzer.exception.BatchConfigurationException;
import com.phillippitts.batchanalyzer.exception.BudgetExceededException;
import com.phillippitts.batchanalyzer.exception.CapabilityException;
import com.phillippitts.batchanalyzer.exception.TierExhaustedException;
import com.phillippitts.batchanalyzer.service.capability.CapabilityResponse;
import com.phillippitts.batchanalyzer.service.capability.VisionCapability;
import com.phillippitts.batchanalyzer.service.events.TierEscalatedEvent;
import com.phillippitts.batchanalyzer.service.metrics.AnalysisMetrics;
import com.phillippitts.batchanalyzer.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.ApplicationEventPublisher;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Cost-escalating analysis of one image.
 *
 * <p>Starts at the cheapest tier (or the pinned tier only) and moves to the next tier when a
 * call fails or its result is insufficient. The final tier accepts any successful result.
 * When no tier accepts, the last successful result is returned; when no call succeeded at all,
 * {@link TierExhaustedException} is thrown, retryable unless every failure was permanent.
 *
 * <p>Each call runs on the capability executor and is bounded by the call timeout, which
 * surfaces as a {@link CapabilityException.Kind#TIMEOUT} failure. If the budget refuses a call
 * after an insufficient result was already obtained, that result is returned instead.
 */
public class TierSelector {

    private static final Logger LOG = LogManager.getLogger(TierSelector.class);
    private static final int MAX_LOG_MESSAGE = 200;

    private final VisionCapability capability;
    private final List<Tier> tiers;
    private final SufficiencyPolicy policy;
    private final Executor callExecutor;
    private final long callTimeoutMs;
    private final AnalysisMetrics metrics;
    private final ApplicationEventPublisher publisher;

    public TierSelector(VisionCapability capability,
                        List<Tier> tiers,
                        SufficiencyPolicy policy,
                        Executor callExecutor,
                        long callTimeoutMs,
                        AnalysisMetrics metrics,
                        ApplicationEventPublisher publisher) {
        this.capability = Objects.requireNonNull(capability, "capability");
        this.policy = Objects.requireNonNull(policy, "policy");
        this.callExecutor = Objects.requireNonNull(callExecutor, "callExecutor");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.publisher = Objects.requireNonNull(publisher, "publisher");
        if (callTimeoutMs <= 0) {
            throw new IllegalArgumentException("callTimeoutMs must be positive, got: " + callTimeoutMs);
        }
        this.callTimeoutMs = callTimeoutMs;
        List<Tier> sorted = new ArrayList<>(tiers);
        sorted.sort(Comparator.comparingInt(Tier::level));
        this.tiers = List.copyOf(sorted);
    }

    /** Configured tiers, cheapest first. */
    public List<Tier> tiers() {
        return tiers;
    }

    public Optional<Tier> findTier(String name) {
        return tiers.stream().filter(t -> t.name().equals(name)).findFirst();
    }

    /**
     * Tier whose estimate is used when pricing a run: the pinned tier, else the cheapest.
     */
    public Tier pricingTier(String pinnedTier) {
        if (pinnedTier != null) {
            return findTier(pinnedTier).orElseThrow(() ->
                    new BatchConfigurationException("Unknown tier: " + pinnedTier));
        }
        if (tiers.isEmpty()) {
            throw new BatchConfigurationException("No analysis tiers configured");
        }
        return tiers.get(0);
    }

    /**
     * Analyzes one image, escalating through tiers as needed.
     *
     * @param itemId       item identifier for logs and events
     * @param image        encoded image bytes
     * @param instructions instruction text for the capability
     * @param pinnedTier   tier name to use exclusively, or null to escalate from the cheapest
     * @param gate         admission control for each call
     * @return the accepted result and call history
     * @throws TierExhaustedException  if no call succeeded
     * @throws BudgetExceededException if the budget refused the first call
     */
    public TierSelection select(String itemId, byte[] image, String instructions, String pinnedTier, CallGate gate) {
        List<Tier> plan = pinnedTier == null ? tiers : List.of(pricingTier(pinnedTier));
        if (plan.isEmpty()) {
            throw new BatchConfigurationException("No analysis tiers configured");
        }

        List<TierAttempt> attempts = new ArrayList<>(plan.size());
        AnalysisResult last = null;
        CapabilityException lastFailure = null;
        boolean anyRetryable = false;
        double cost = 0.0;

        for (int i = 0; i < plan.size(); i++) {
            Tier tier = plan.get(i);
            boolean finalTier = i == plan.size() - 1;

            double reserved;
            try {
                reserved = gate.beforeCall(tier);
            } catch (BudgetExceededException e) {
                if (last != null) {
                    LOG.info("Budget does not cover tier {} for item {}; keeping result from tier {}",
                            tier.name(), itemId, last.tier());
                    return new TierSelection(last, attempts, cost);
                }
                throw e;
            }

            long start = System.nanoTime();
            CapabilityResponse response;
            try {
                response = invoke(tier, image, instructions);
            } catch (CapabilityException e) {
                long ms = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);
                gate.afterFailure(tier, reserved);
                metrics.incrementCallFailure(tier.name(), e.getKind().name().toLowerCase(Locale.ROOT));
                attempts.add(new TierAttempt(tier.name(), TierAttempt.Outcome.FAILED, e.getMessage(), ms));
                lastFailure = e;
                anyRetryable |= e.isRetryable();
                LOG.warn("Tier {} failed for item {} after {} ms: {}",
                        tier.name(), itemId, ms, LogSanitizer.preview(e.getMessage(), MAX_LOG_MESSAGE));
                if (!finalTier) {
                    escalate(itemId, tier, plan.get(i + 1), "failure");
                }
                continue;
            }

            long durationNanos = System.nanoTime() - start;
            gate.afterSuccess(tier, reserved, response.cost());
            metrics.recordCallLatency(tier.name(), durationNanos);
            metrics.incrementCallSuccess(tier.name());
            cost += response.cost();
            AnalysisResult result = response.toResult(tier);
            last = result;

            List<String> gaps = policy.deficiencies(result);
            long ms = TimeUnit.NANOSECONDS.toMillis(durationNanos);
            if (finalTier || gaps.isEmpty()) {
                attempts.add(new TierAttempt(tier.name(), TierAttempt.Outcome.ACCEPTED, null, ms));
                LOG.debug("Item {} analyzed at tier {} (cost {})", itemId, tier.name(), response.cost());
                return new TierSelection(result, attempts, cost);
            }
            attempts.add(new TierAttempt(tier.name(), TierAttempt.Outcome.INSUFFICIENT, String.join(", ", gaps), ms));
            escalate(itemId, tier, plan.get(i + 1), "insufficient");
        }

        if (last != null) {
            return new TierSelection(last, attempts, cost);
        }
        throw new TierExhaustedException(
                "All " + plan.size() + " tier(s) failed for item " + itemId + "; last error: "
                        + (lastFailure == null ? "none" : lastFailure.getMessage()),
                lastFailure, anyRetryable);
    }

    private CapabilityResponse invoke(Tier tier, byte[] image, String instructions) {
        CompletableFuture<CapabilityResponse> future =
                CompletableFuture.supplyAsync(() -> capability.analyze(tier, image, instructions), callExecutor);
        try {
            return future.get(callTimeoutMs, TimeUnit.MILLISECONDS);
        } catch (TimeoutException te) {
            future.cancel(true);
            throw CapabilityException.timeout(tier.name(), callTimeoutMs);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            throw new CapabilityException(CapabilityException.Kind.TRANSIENT,
                    "Interrupted while waiting for capability", tier.name(), null, ie);
        } catch (ExecutionException ee) {
            Throwable cause = ee.getCause();
            if (cause instanceof CapabilityException ce) {
                throw ce;
            }
            throw new CapabilityException(CapabilityException.Kind.TRANSIENT,
                    "Unexpected capability error: " + cause, tier.name(), null, cause);
        }
    }

    private void escalate(String itemId, Tier from, Tier to, String reason) {
        metrics.incrementEscalation(from.name(), reason);
        publisher.publishEvent(new TierEscalatedEvent(itemId, from.name(), to.name(), reason, Instant.now()));
    }
}
