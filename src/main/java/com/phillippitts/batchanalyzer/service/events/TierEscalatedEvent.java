package com.phillippitts.batchanalyzer.service.events;

import java.time.Instant;

/**
 * Published when a representative moves from one tier to the next, either because the call
 * failed or because its result was not detailed enough.
 *
 * <p>Does not carry image content or analysis text.
 */
public record TierEscalatedEvent(
        String itemId,
        String fromTier,
        String toTier,
        String reason,
        Instant at
) {
    public TierEscalatedEvent {
        if (at == null) {
            at = Instant.now();
        }
    }
}
