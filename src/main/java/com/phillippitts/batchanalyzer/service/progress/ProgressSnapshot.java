package com.phillippitts.batchanalyzer.service.progress;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Point-in-time copy of a run's progress; this is what a checkpoint stores.
 *
 * @param runToken       run identifier
 * @param state          run state when the snapshot was taken
 * @param total          number of items in the run
 * @param processed      items that went through analysis or derivation (succeeded, derived, failed)
 * @param succeeded      items with a result (analyzed or derived)
 * @param failed         items whose last attempt failed
 * @param skipped        items skipped in this run (budget, stop)
 * @param cumulativeCost cost incurred across this run and any resumed predecessors
 * @param processedIds   ids that need no further work
 * @param failedIds      failed id to reason; these are retried on resume
 * @param savedAt        snapshot time
 */
public record ProgressSnapshot(
        String runToken,
        RunState state,
        int total,
        int processed,
        int succeeded,
        int failed,
        int skipped,
        double cumulativeCost,
        List<String> processedIds,
        Map<String, String> failedIds,
        Instant savedAt
) {

    public ProgressSnapshot {
        Objects.requireNonNull(runToken, "runToken");
        Objects.requireNonNull(state, "state");
        processedIds = List.copyOf(processedIds);
        failedIds = Collections.unmodifiableMap(new LinkedHashMap<>(failedIds));
        if (savedAt == null) {
            savedAt = Instant.now();
        }
    }
}
