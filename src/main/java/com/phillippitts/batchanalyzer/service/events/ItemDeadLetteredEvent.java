package com.phillippitts.batchanalyzer.service.events;

import java.time.Instant;

/**
 * Published when a representative is given up on after its final attempt. Every member of its
 * group is reported as failed with it.
 */
public record ItemDeadLetteredEvent(
        String runToken,
        String itemId,
        String reason,
        int attempts,
        int groupSize,
        Instant at
) {
    public ItemDeadLetteredEvent {
        if (at == null) {
            at = Instant.now();
        }
    }
}
