package com.phillippitts.batchanalyzer.service.progress;

import com.phillippitts.batchanalyzer.exception.CheckpointException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Authoritative progress record of one batch run.
 *
 * <p>Every mutation is synchronized on the ledger, so counters, identifier sets and cumulative
 * cost always form a consistent snapshot. A checkpoint is written every {@code checkpointInterval}
 * processed items, when the run is aborted, and when it completes with failures. A run that
 * completes with zero failures deletes its checkpoint.
 *
 * <p>Checkpoint I/O failures never fail the run: they are logged and the ledger is flagged as
 * {@linkplain #isResumabilityCompromised() no longer reliably resumable}.
 *
 * <p>Failed items are not considered processed, so a resumed run retries them.
 */
public class ProgressLedger {

    private static final Logger LOG = LogManager.getLogger(ProgressLedger.class);

    private final String runToken;
    private final CheckpointStore store;
    private final int checkpointInterval;

    private RunState state = RunState.FRESH;
    private int total;
    private int processed;
    private int succeeded;
    private int failed;
    private int skipped;
    private double cumulativeCost;
    private final Set<String> processedIds = new LinkedHashSet<>();
    private final Map<String, String> failedIds = new LinkedHashMap<>();
    private int processedSinceCheckpoint;
    private boolean resumabilityCompromised;
    private boolean resumed;

    public ProgressLedger(String runToken, CheckpointStore store, int checkpointInterval) {
        this.runToken = Objects.requireNonNull(runToken, "runToken");
        this.store = Objects.requireNonNull(store, "store");
        if (checkpointInterval < 1) {
            throw new IllegalArgumentException("checkpointInterval must be >= 1, got: " + checkpointInterval);
        }
        this.checkpointInterval = checkpointInterval;
    }

    public String runToken() {
        return runToken;
    }

    /**
     * Loads the checkpoint for this run token, if any. Only valid before {@link #start(int)}.
     *
     * @return true when previous progress was restored
     */
    public synchronized boolean restore() {
        requireState(RunState.FRESH, "restore");
        Optional<ProgressSnapshot> loaded;
        try {
            loaded = store.load(runToken);
        } catch (CheckpointException e) {
            LOG.warn("Cannot load checkpoint for run {}; starting from scratch: {}", runToken, e.getMessage());
            resumabilityCompromised = true;
            return false;
        }
        if (loaded.isEmpty()) {
            LOG.info("No checkpoint found for run {}; starting from scratch", runToken);
            return false;
        }
        ProgressSnapshot s = loaded.get();
        processedIds.addAll(s.processedIds());
        failedIds.putAll(s.failedIds());
        failedIds.keySet().removeAll(processedIds);
        succeeded = processedIds.size();
        failed = failedIds.size();
        processed = succeeded + failed;
        cumulativeCost = s.cumulativeCost();
        resumed = true;
        LOG.info("Resuming run {}: {} processed, {} to retry, cost so far {}",
                runToken, processedIds.size(), failedIds.size(), cumulativeCost);
        return true;
    }

    public synchronized void start(int totalItems) {
        requireState(RunState.FRESH, "start");
        if (totalItems < 0) {
            throw new IllegalArgumentException("totalItems must be >= 0");
        }
        this.total = totalItems;
        this.state = RunState.RUNNING;
    }

    public synchronized boolean isProcessed(String itemId) {
        return processedIds.contains(itemId);
    }

    /**
     * Records a representative analyzed by the capability.
     *
     * @param cost cost incurred for this item across all tiers tried
     */
    public synchronized void recordSuccess(String itemId, double cost) {
        requireRunning();
        if (cost < 0.0) {
            throw new IllegalArgumentException("cost must be >= 0");
        }
        markProcessed(itemId);
        cumulativeCost += cost;
    }

    /**
     * Records a member whose result was copied from its representative.
     */
    public synchronized void recordDerived(String itemId) {
        requireRunning();
        markProcessed(itemId);
    }

    public synchronized void recordFailure(String itemId, String reason) {
        requireRunning();
        if (processedIds.contains(itemId)) {
            return;
        }
        if (failedIds.put(itemId, reason == null ? "unknown" : reason) == null) {
            failed++;
            processed++;
            tick();
        }
    }

    public synchronized void recordSkipped(String itemId, String reason) {
        requireRunning();
        skipped++;
        LOG.debug("Item {} skipped: {}", itemId, reason);
    }

    /**
     * Writes a checkpoint immediately, regardless of the interval. Does nothing once the run has
     * completed or aborted, since those transitions persist their own final state.
     *
     * @return true when a checkpoint write was attempted
     */
    public synchronized boolean checkpointNow() {
        if (state != RunState.RUNNING) {
            return false;
        }
        writeCheckpoint();
        return true;
    }

    /**
     * Marks the run completed. The checkpoint is deleted when nothing failed and kept otherwise.
     */
    public synchronized void complete() {
        requireRunning();
        state = RunState.COMPLETED;
        if (failedIds.isEmpty()) {
            try {
                store.delete(runToken);
            } catch (CheckpointException e) {
                LOG.warn("Could not remove checkpoint for completed run {}: {}", runToken, e.getMessage());
                resumabilityCompromised = true;
            }
        } else {
            writeCheckpoint();
        }
    }

    /**
     * Marks the run aborted and persists its progress for a later resume.
     */
    public synchronized void abort() {
        requireRunning();
        state = RunState.ABORTED;
        writeCheckpoint();
    }

    public synchronized RunState state() {
        return state;
    }

    public synchronized double cumulativeCost() {
        return cumulativeCost;
    }

    public synchronized boolean isResumabilityCompromised() {
        return resumabilityCompromised;
    }

    public synchronized boolean isResumed() {
        return resumed;
    }

    public synchronized Optional<String> failureReason(String itemId) {
        return Optional.ofNullable(failedIds.get(itemId));
    }

    public synchronized ProgressSnapshot snapshot() {
        return new ProgressSnapshot(runToken, state, total, processed, succeeded, failed, skipped,
                cumulativeCost, new ArrayList<>(processedIds), failedIds, Instant.now());
    }

    private void markProcessed(String itemId) {
        if (!processedIds.add(itemId)) {
            return;
        }
        succeeded++;
        if (failedIds.remove(itemId) != null) {
            failed--;
        } else {
            processed++;
        }
        tick();
    }

    private void tick() {
        processedSinceCheckpoint++;
        if (processedSinceCheckpoint >= checkpointInterval) {
            writeCheckpoint();
        }
    }

    private void writeCheckpoint() {
        processedSinceCheckpoint = 0;
        try {
            store.save(snapshot());
        } catch (CheckpointException e) {
            if (!resumabilityCompromised) {
                LOG.warn("Checkpoint write failed for run {}; continuing without resumability: {}",
                        runToken, e.getMessage());
            }
            resumabilityCompromised = true;
        }
    }

    private void requireRunning() {
        if (state != RunState.RUNNING) {
            throw new IllegalStateException("Run " + runToken + " is " + state + ", expected RUNNING");
        }
    }

    private void requireState(RunState expected, String operation) {
        if (state != expected) {
            throw new IllegalStateException("Cannot " + operation + " run " + runToken + " in state " + state);
        }
    }
}
