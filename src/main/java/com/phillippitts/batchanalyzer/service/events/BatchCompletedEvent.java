package com.phillippitts.batchanalyzer.service.events;

import com.phillippitts.batchanalyzer.service.progress.RunState;

import java.time.Instant;

/**
 * Published once per run after its report is assembled, whether it completed or was stopped.
 */
public record BatchCompletedEvent(
        String runToken,
        RunState state,
        int succeeded,
        int derived,
        int failed,
        int skipped,
        double cost,
        Instant at
) {
    public BatchCompletedEvent {
        if (at == null) {
            at = Instant.now();
        }
    }
}
