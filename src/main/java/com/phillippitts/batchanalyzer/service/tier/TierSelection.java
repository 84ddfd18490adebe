package com.phillippitts.batchanalyzer.service.tier;

import com.phillippitts.batchanalyzer.domain.AnalysisResult;

import java.util.List;
import java.util.Objects;

/**
 * Result of tier selection for one representative.
 *
 * @param result    the accepted result
 * @param attempts  every call made, in order
 * @param totalCost cost summed over all successful calls, including insufficient ones
 */
public record TierSelection(AnalysisResult result, List<TierAttempt> attempts, double totalCost) {

    public TierSelection {
        Objects.requireNonNull(result, "result");
        attempts = List.copyOf(attempts);
    }

    public int callCount() {
        return attempts.size();
    }
}
