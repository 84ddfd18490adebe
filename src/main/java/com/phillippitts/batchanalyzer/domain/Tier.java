package com.phillippitts.batchanalyzer.domain;

import java.util.Objects;

/**
 * One cost/quality level of the external vision capability.
 *
 * @param name          provider/model identifier understood by the capability
 * @param level         position in the escalation order (0 = cheapest)
 * @param estimatedCost estimated cost of a single call at this tier
 */
public record Tier(String name, int level, double estimatedCost) {

    public Tier {
        Objects.requireNonNull(name, "name");
        if (name.isBlank()) {
            throw new IllegalArgumentException("Tier name must not be blank");
        }
        if (level < 0) {
            throw new IllegalArgumentException("Tier level must be >= 0, got: " + level);
        }
        if (estimatedCost < 0.0) {
            throw new IllegalArgumentException("Estimated cost must be >= 0, got: " + estimatedCost);
        }
    }
}
