package com.phillippitts.batchanalyzer.service.batch;

import com.phillippitts.batchanalyzer.domain.AnalysisResult;

import java.util.Objects;

/**
 * Outcome of one item.
 *
 * @param itemId           item identifier
 * @param status           final status
 * @param result           analysis result for SUCCEEDED and DERIVED, otherwise null
 * @param reason           failure or skip reason, otherwise null
 * @param retries          retries spent on the representative of this item's group
 * @param representativeId representative the result came from (the item itself when analyzed)
 */
public record ItemOutcome(
        String itemId,
        OutcomeStatus status,
        AnalysisResult result,
        String reason,
        int retries,
        String representativeId
) {

    public ItemOutcome {
        Objects.requireNonNull(itemId, "itemId");
        Objects.requireNonNull(status, "status");
        boolean hasResult = status == OutcomeStatus.SUCCEEDED || status == OutcomeStatus.DERIVED;
        if (hasResult != (result != null)) {
            throw new IllegalArgumentException("Result must be present exactly for SUCCEEDED and DERIVED");
        }
    }

    static ItemOutcome succeeded(String itemId, AnalysisResult result, int retries) {
        return new ItemOutcome(itemId, OutcomeStatus.SUCCEEDED, result, null, retries, itemId);
    }

    static ItemOutcome derived(String itemId, AnalysisResult result, String representativeId) {
        return new ItemOutcome(itemId, OutcomeStatus.DERIVED, result, null, 0, representativeId);
    }

    static ItemOutcome failed(String itemId, String reason, int retries, String representativeId) {
        return new ItemOutcome(itemId, OutcomeStatus.FAILED, null, reason, retries, representativeId);
    }

    static ItemOutcome skipped(String itemId, String reason, String representativeId) {
        return new ItemOutcome(itemId, OutcomeStatus.SKIPPED, null, reason, 0, representativeId);
    }
}
