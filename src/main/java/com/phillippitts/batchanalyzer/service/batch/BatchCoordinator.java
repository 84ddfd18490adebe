package com.phillippitts.batchanalyzer.service.batch;

import com.phillippitts.batchanalyzer.config.properties.CheckpointProperties;
import com.phillippitts.batchanalyzer.config.properties.CoordinatorProperties;
import com.phillippitts.batchanalyzer.domain.AnalysisResult;
import com.phillippitts.batchanalyzer.domain.BatchItem;
import com.phillippitts.batchanalyzer.domain.SimilarityGroup;
import com.phillippitts.batchanalyzer.domain.Tier;
import com.phillippitts.batchanalyzer.exception.BatchConfigurationException;
import com.phillippitts.batchanalyzer.exception.BudgetExceededException;
import com.phillippitts.batchanalyzer.exception.CapabilityException;
import com.phillippitts.batchanalyzer.exception.TierExhaustedException;
import com.phillippitts.batchanalyzer.service.events.BatchCompletedEvent;
import com.phillippitts.batchanalyzer.service.events.ItemDeadLetteredEvent;
import com.phillippitts.batchanalyzer.service.grouping.SimilarityGrouper;
import com.phillippitts.batchanalyzer.service.metrics.AnalysisMetrics;
import com.phillippitts.batchanalyzer.service.progress.CheckpointStore;
import com.phillippitts.batchanalyzer.service.progress.ProgressLedger;
import com.phillippitts.batchanalyzer.service.progress.RunState;
import com.phillippitts.batchanalyzer.service.propagation.ResultPropagator;
import com.phillippitts.batchanalyzer.service.tier.CallGate;
import com.phillippitts.batchanalyzer.service.tier.TierSelection;
import com.phillippitts.batchanalyzer.service.tier.TierSelector;
import com.phillippitts.batchanalyzer.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.DoubleAdder;

/**
 * Runs a batch of items through grouping, tier selection and result propagation.
 *
 * <p>Flow per run:
 * <ol>
 *   <li>Validate the request; invalid parameters fail the run before any capability call.</li>
 *   <li>Restore the checkpoint (when resuming) and report already processed items as skipped.</li>
 *   <li>Group the remaining items by perceptual similarity.</li>
 *   <li>Analyze one representative per group on the analysis executor, at most C at a time,
 *       with all capability calls spaced by at least R and charged against the budget.</li>
 *   <li>Retry retryable failures with exponential backoff up to M attempts; copy each
 *       representative's result onto the rest of its group.</li>
 *   <li>Complete the ledger (or abort it when stopped) and return a report with exactly one
 *       outcome per submitted item.</li>
 * </ol>
 *
 * <p>Item-level failures never fail the run. Only {@link BatchConfigurationException} is thrown.
 */
@Service
public class BatchCoordinator {

    private static final Logger LOG = LogManager.getLogger(BatchCoordinator.class);

    static final String MDC_RUN_TOKEN = "runToken";
    static final String MDC_ITEM_ID = "itemId";
    static final String PREVIOUSLY_PROCESSED = "previously processed";
    private static final long STOP_POLL_MS = 50;

    private final SimilarityGrouper grouper;
    private final TierSelector tierSelector;
    private final ResultPropagator propagator;
    private final CheckpointStore checkpointStore;
    private final CoordinatorProperties properties;
    private final CheckpointProperties checkpointProperties;
    private final Executor analysisExecutor;
    private final ApplicationEventPublisher publisher;
    private final AnalysisMetrics metrics;

    public BatchCoordinator(SimilarityGrouper grouper,
                            TierSelector tierSelector,
                            ResultPropagator propagator,
                            CheckpointStore checkpointStore,
                            CoordinatorProperties properties,
                            CheckpointProperties checkpointProperties,
                            @Qualifier("analysisExecutor") Executor analysisExecutor,
                            ApplicationEventPublisher publisher,
                            AnalysisMetrics metrics) {
        this.grouper = Objects.requireNonNull(grouper, "grouper");
        this.tierSelector = Objects.requireNonNull(tierSelector, "tierSelector");
        this.propagator = Objects.requireNonNull(propagator, "propagator");
        this.checkpointStore = Objects.requireNonNull(checkpointStore, "checkpointStore");
        this.properties = Objects.requireNonNull(properties, "properties");
        this.checkpointProperties = Objects.requireNonNull(checkpointProperties, "checkpointProperties");
        this.analysisExecutor = Objects.requireNonNull(analysisExecutor, "analysisExecutor");
        this.publisher = Objects.requireNonNull(publisher, "publisher");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
    }

    /**
     * Request builder seeded with the configured defaults for C, R, M and B.
     */
    public BatchRequest.Builder requestBuilder(List<BatchItem> items) {
        return BatchRequest.builder(items)
                .concurrency(properties.getConcurrency())
                .minCallSpacing(Duration.ofMillis(properties.getMinCallSpacingMs()))
                .maxAttempts(properties.getMaxAttempts())
                .maxCost(properties.getMaxCost());
    }

    /**
     * Groups the items and prices the run without calling the capability.
     *
     * @param items      items to price
     * @param pinnedTier tier to price at, or null for the cheapest tier
     * @throws BatchConfigurationException if ids repeat or the tier is unknown
     */
    public CostEstimate estimate(List<BatchItem> items, String pinnedTier) {
        List<String> violations = new ArrayList<>();
        checkItems(items, violations);
        checkTiers(pinnedTier, violations);
        if (!violations.isEmpty()) {
            throw new BatchConfigurationException(violations);
        }
        Tier tier = tierSelector.pricingTier(pinnedTier);
        List<SimilarityGroup> groups = grouper.group(items);
        double naive = items.size() * tier.estimatedCost();
        double optimized = groups.size() * tier.estimatedCost();
        CostEstimate estimate = new CostEstimate(items.size(), groups.size(), tier.name(),
                tier.estimatedCost(), naive, optimized);
        if (optimized > properties.getCostWarningThreshold()) {
            LOG.warn("Estimated cost {} at tier {} exceeds warning threshold {}",
                    format(optimized), tier.name(), format(properties.getCostWarningThreshold()));
        }
        LOG.info("Estimate: {} items in {} groups at tier {}: {} (saves {} against {})",
                items.size(), groups.size(), tier.name(), format(optimized),
                format(estimate.estimatedSavings()), format(naive));
        return estimate;
    }

    /**
     * Executes a batch run.
     *
     * @return report with one outcome per submitted item, in submission order
     * @throws BatchConfigurationException if the request is invalid; nothing is called in that case
     */
    public BatchReport run(BatchRequest request) {
        validate(request);
        String token = request.runToken() != null ? request.runToken() : RunTokens.derive(request.items());
        ThreadContext.put(MDC_RUN_TOKEN, token);
        try {
            return execute(request, token);
        } finally {
            ThreadContext.remove(MDC_RUN_TOKEN);
        }
    }

    private BatchReport execute(BatchRequest request, String token) {
        long startNanos = System.nanoTime();
        ProgressLedger ledger = new ProgressLedger(token, checkpointStore, checkpointProperties.getInterval());
        if (request.resume()) {
            ledger.restore();
        }
        ledger.start(request.items().size());
        Run run = new Run(request, token, ledger);
        Runnable onStop = run::checkpointOnStop;
        request.stopSignal().addListener(onStop);
        try {
            return execute(run, startNanos);
        } finally {
            request.stopSignal().removeListener(onStop);
        }
    }

    private BatchReport execute(Run run, long startNanos) {
        BatchRequest request = run.request;
        ProgressLedger ledger = run.ledger;
        String token = run.token;

        List<BatchItem> pending = new ArrayList<>();
        for (BatchItem item : request.items()) {
            if (ledger.isProcessed(item.id())) {
                run.outcomes.put(item.id(), ItemOutcome.skipped(item.id(), PREVIOUSLY_PROCESSED, null));
            } else {
                pending.add(item);
            }
        }
        LOG.info("Run {} started: {} items, {} already processed, concurrency={}, spacing={}ms, attempts={}, budget={}",
                token, request.items().size(), request.items().size() - pending.size(), request.concurrency(),
                request.minCallSpacing().toMillis(), request.maxAttempts(),
                request.maxCost() == null ? "unlimited" : format(request.maxCost()));

        List<SimilarityGroup> groups = grouper.group(pending);
        Map<String, BatchItem> byId = new LinkedHashMap<>();
        pending.forEach(item -> byId.put(item.id(), item));

        schedule(run, groups, byId);

        if (run.stoppedEarly.get() || run.stopRequested()) {
            ledger.abort();
        } else {
            ledger.complete();
        }
        return report(run, groups.size(), startNanos);
    }

    private void schedule(Run run, List<SimilarityGroup> groups, Map<String, BatchItem> byId) {
        Semaphore slots = new Semaphore(run.request.concurrency());
        List<CompletableFuture<Void>> inFlight = new ArrayList<>(groups.size());

        for (SimilarityGroup group : groups) {
            if (run.stopRequested()) {
                run.checkpointOnStop();
                skipGroup(run, group, "stopped before analysis");
                run.stoppedEarly.set(true);
                continue;
            }
            try {
                slots.acquire();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                run.request.stopSignal().requestStop();
                skipGroup(run, group, "interrupted before analysis");
                run.stoppedEarly.set(true);
                continue;
            }
            BatchItem representative = byId.get(group.representativeId());
            CompletableFuture<Void> task;
            try {
                task = CompletableFuture.runAsync(() -> {
                    try {
                        processGroup(run, group, representative);
                    } finally {
                        slots.release();
                    }
                }, analysisExecutor);
            } catch (RejectedExecutionException e) {
                slots.release();
                failUnresolved(run, group, "analysis executor rejected task");
                continue;
            }
            inFlight.add(task.exceptionally(ex -> {
                LOG.error("Unexpected error analyzing group of {}", group.representativeId(), ex);
                failUnresolved(run, group, "unexpected error: " + ex.getMessage());
                return null;
            }));
        }
        CompletableFuture.allOf(inFlight.toArray(new CompletableFuture[0])).join();
    }

    private void processGroup(Run run, SimilarityGroup group, BatchItem representative) {
        String repId = group.representativeId();
        ThreadContext.put(MDC_ITEM_ID, repId);
        try {
            byte[] image;
            try {
                image = representative.source().read();
            } catch (IOException e) {
                failGroup(run, group, "unreadable image: " + e.getMessage(), 0);
                return;
            }
            String instructions = run.request.options().toInstructions();
            int attempt = 0;
            while (true) {
                attempt++;
                try {
                    TierSelection selection = tierSelector.select(
                            repId, image, instructions, run.request.pinnedTier(), run.gate);
                    succeed(run, group, selection, attempt - 1);
                    return;
                } catch (BudgetExceededException e) {
                    LOG.info("Skipping group of {} ({} items): {}", repId, group.size(), e.getMessage());
                    skipGroup(run, group, "budget exhausted");
                    return;
                } catch (TierExhaustedException e) {
                    if (!run.retryPolicy.shouldRetry(attempt, e.isRetryable())) {
                        failGroup(run, group, e.getMessage(), attempt - 1);
                        return;
                    }
                    long delay = run.retryPolicy.delayMillis(attempt, e.getRetryAfter());
                    LOG.warn("Attempt {}/{} failed for {}; retrying in {} ms: {}",
                            attempt, run.retryPolicy.maxAttempts(), repId, delay,
                            LogSanitizer.preview(e.getMessage(), 200));
                    if (!sleepUnlessStopped(run, delay)) {
                        run.checkpointOnStop();
                        skipGroup(run, group, "stopped before retry");
                        run.stoppedEarly.set(true);
                        return;
                    }
                } catch (CapabilityException e) {
                    // raised by the gate when interrupted while waiting for a call slot
                    LOG.warn("Analysis of {} interrupted: {}", repId, e.getMessage());
                    skipGroup(run, group, "interrupted");
                    run.stoppedEarly.set(true);
                    return;
                }
            }
        } finally {
            ThreadContext.remove(MDC_ITEM_ID);
        }
    }

    private void succeed(Run run, SimilarityGroup group, TierSelection selection, int retries) {
        String repId = group.representativeId();
        AnalysisResult result = selection.result();
        run.ledger.recordSuccess(repId, selection.totalCost());
        run.runCost.add(selection.totalCost());
        run.outcomes.put(repId, ItemOutcome.succeeded(repId, result, retries));

        Map<String, AnalysisResult> derived = propagator.propagate(group.withRepresentativeResult(result));
        derived.forEach((memberId, memberResult) -> {
            run.ledger.recordDerived(memberId);
            run.outcomes.put(memberId, ItemOutcome.derived(memberId, memberResult, repId));
        });
        if (!derived.isEmpty()) {
            LOG.debug("Result of {} copied to {} similar item(s)", repId, derived.size());
        }
    }

    private void failGroup(Run run, SimilarityGroup group, String reason, int retries) {
        String repId = group.representativeId();
        run.ledger.recordFailure(repId, reason);
        run.outcomes.put(repId, ItemOutcome.failed(repId, reason, retries, repId));
        String memberReason = "representative " + repId + " failed: " + reason;
        for (String memberId : group.derivedMemberIds()) {
            run.ledger.recordFailure(memberId, memberReason);
            run.outcomes.put(memberId, ItemOutcome.failed(memberId, memberReason, retries, repId));
        }
        publisher.publishEvent(new ItemDeadLetteredEvent(
                run.token, repId, reason, retries + 1, group.size(), Instant.now()));
    }

    private void skipGroup(Run run, SimilarityGroup group, String reason) {
        for (String memberId : group.memberIds()) {
            run.ledger.recordSkipped(memberId, reason);
            run.outcomes.put(memberId, ItemOutcome.skipped(memberId, reason, group.representativeId()));
        }
    }

    private void failUnresolved(Run run, SimilarityGroup group, String reason) {
        for (String memberId : group.memberIds()) {
            if (!run.outcomes.containsKey(memberId)) {
                run.ledger.recordFailure(memberId, reason);
                run.outcomes.put(memberId, ItemOutcome.failed(memberId, reason, 0, group.representativeId()));
            }
        }
    }

    private boolean sleepUnlessStopped(Run run, long delayMs) {
        long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(delayMs);
        while (!run.stopRequested()) {
            long remainingMs = TimeUnit.NANOSECONDS.toMillis(deadline - System.nanoTime());
            if (remainingMs <= 0) {
                return true;
            }
            try {
                Thread.sleep(Math.min(remainingMs, STOP_POLL_MS));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return false;
            }
        }
        return false;
    }

    private BatchReport report(Run run, int groupCount, long startNanos) {
        List<ItemOutcome> ordered = new ArrayList<>(run.request.items().size());
        for (BatchItem item : run.request.items()) {
            ItemOutcome outcome = run.outcomes.get(item.id());
            if (outcome == null) {
                LOG.error("No outcome recorded for item {}", item.id());
                outcome = ItemOutcome.failed(item.id(), "no outcome recorded", 0, null);
            }
            ordered.add(outcome);
        }
        Tier pricing = tierSelector.pricingTier(run.request.pinnedTier());
        int derived = (int) ordered.stream().filter(o -> o.status() == OutcomeStatus.DERIVED).count();
        BatchReport report = new BatchReport(
                run.token,
                run.ledger.state(),
                ordered,
                groupCount,
                run.calls.get(),
                derived,
                run.runCost.sum(),
                run.ledger.cumulativeCost(),
                derived * pricing.estimatedCost(),
                Duration.ofNanos(System.nanoTime() - startNanos),
                run.ledger.isResumabilityCompromised());

        for (OutcomeStatus status : OutcomeStatus.values()) {
            metrics.recordItemOutcomes(status.name().toLowerCase(Locale.ROOT), report.count(status));
        }
        metrics.recordRunCost(report.runCost());
        LOG.info("Run {} {} in {} ms: {} analyzed, {} derived, {} failed, {} skipped; {} calls, cost {}",
                run.token, report.state(), report.duration().toMillis(),
                report.count(OutcomeStatus.SUCCEEDED), derived, report.count(OutcomeStatus.FAILED),
                report.count(OutcomeStatus.SKIPPED), report.capabilityCalls(), format(report.runCost()));
        publisher.publishEvent(new BatchCompletedEvent(run.token, report.state(),
                report.count(OutcomeStatus.SUCCEEDED), derived, report.count(OutcomeStatus.FAILED),
                report.count(OutcomeStatus.SKIPPED), report.runCost(), Instant.now()));
        return report;
    }

    private void validate(BatchRequest request) {
        List<String> violations = new ArrayList<>();
        if (request.concurrency() < 1) {
            violations.add("concurrency must be >= 1, got: " + request.concurrency());
        }
        if (request.minCallSpacing().isNegative()) {
            violations.add("minCallSpacing must be >= 0, got: " + request.minCallSpacing());
        }
        if (request.maxAttempts() < 1) {
            violations.add("maxAttempts must be >= 1, got: " + request.maxAttempts());
        }
        Double maxCost = request.maxCost();
        if (maxCost != null && (maxCost.isNaN() || maxCost < 0.0)) {
            violations.add("maxCost must be >= 0, got: " + maxCost);
        }
        if (request.runToken() != null && request.runToken().isBlank()) {
            violations.add("runToken must not be blank");
        }
        checkItems(request.items(), violations);
        checkTiers(request.pinnedTier(), violations);
        if (!violations.isEmpty()) {
            throw new BatchConfigurationException(violations);
        }
    }

    private static void checkItems(List<BatchItem> items, List<String> violations) {
        Set<String> seen = new HashSet<>();
        for (BatchItem item : items) {
            if (!seen.add(item.id())) {
                violations.add("duplicate item id: " + item.id());
            }
        }
    }

    private void checkTiers(String pinnedTier, List<String> violations) {
        if (tierSelector.tiers().isEmpty()) {
            violations.add("no analysis tiers configured");
        } else if (pinnedTier != null && tierSelector.findTier(pinnedTier).isEmpty()) {
            violations.add("unknown tier: " + pinnedTier);
        }
    }

    private static String format(double value) {
        return String.format(Locale.ROOT, "%.4f", value);
    }

    /**
     * Mutable state of one run, shared by its group tasks.
     */
    private final class Run {
        final BatchRequest request;
        final String token;
        final ProgressLedger ledger;
        final BudgetGuard budget;
        final CallSpacingLimiter limiter;
        final RetryPolicy retryPolicy;
        final Map<String, ItemOutcome> outcomes = new ConcurrentHashMap<>();
        final AtomicInteger calls = new AtomicInteger();
        final DoubleAdder runCost = new DoubleAdder();
        final AtomicBoolean stoppedEarly = new AtomicBoolean(false);
        final AtomicBoolean stopCheckpointed = new AtomicBoolean(false);
        final CallGate gate;

        Run(BatchRequest request, String token, ProgressLedger ledger) {
            this.request = request;
            this.token = token;
            this.ledger = ledger;
            this.budget = new BudgetGuard(request.maxCost(), ledger.cumulativeCost());
            this.limiter = new CallSpacingLimiter(request.minCallSpacing());
            this.retryPolicy = new RetryPolicy(request.maxAttempts(), properties.getBaseBackoffMs(),
                    properties.getMaxBackoffMs(), properties.getJitterRatio());
            this.gate = new RunGate(this);
        }

        boolean stopRequested() {
            return request.stopSignal().isStopRequested();
        }

        /** Persists progress the first time a stop is observed. */
        void checkpointOnStop() {
            if (stopCheckpointed.compareAndSet(false, true)) {
                LOG.info("Stop requested for run {}; writing checkpoint, no further groups or retries", token);
                ledger.checkpointNow();
            }
        }
    }

    /**
     * Applies the run's budget and call spacing to every capability call.
     */
    private static final class RunGate implements CallGate {
        private final Run run;

        RunGate(Run run) {
            this.run = run;
        }

        @Override
        public double beforeCall(Tier tier) {
            double reserved = run.budget.reserve(tier.estimatedCost());
            try {
                run.limiter.acquire();
            } catch (InterruptedException e) {
                run.budget.release(reserved);
                Thread.currentThread().interrupt();
                throw new CapabilityException(CapabilityException.Kind.TRANSIENT,
                        "Interrupted while waiting for a call slot", tier.name(), null, e);
            }
            run.calls.incrementAndGet();
            return reserved;
        }

        @Override
        public void afterSuccess(Tier tier, double reserved, double actualCost) {
            run.budget.commit(reserved, actualCost);
        }

        @Override
        public void afterFailure(Tier tier, double reserved) {
            run.budget.release(reserved);
        }
    }
}
