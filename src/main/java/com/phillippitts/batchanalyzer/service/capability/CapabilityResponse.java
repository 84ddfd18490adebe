package com.phillippitts.batchanalyzer.service.capability;

import com.phillippitts.batchanalyzer.domain.AnalysisResult;
import com.phillippitts.batchanalyzer.domain.Tier;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Successful response of one capability call.
 *
 * @param description free-text description
 * @param tags        category to tags
 * @param prompt      reproduction prompt, may be null
 * @param cost        actual cost charged for the call
 * @param confidence  provider confidence in (0,1]
 * @param raw         raw provider payload, may be null
 */
public record CapabilityResponse(
        String description,
        Map<String, List<String>> tags,
        String prompt,
        double cost,
        double confidence,
        String raw
) {

    public CapabilityResponse {
        Objects.requireNonNull(description, "description");
        tags = tags == null ? Map.of() : tags;
        if (cost < 0.0) {
            throw new IllegalArgumentException("Cost must be >= 0, got: " + cost);
        }
        if (confidence <= 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("Confidence must be in (0,1], got: " + confidence);
        }
    }

    /**
     * Converts the response to a result attributed to the tier that produced it.
     */
    public AnalysisResult toResult(Tier tier) {
        return new AnalysisResult(description, tags, prompt, cost, tier.name(), confidence, null, raw);
    }
}
