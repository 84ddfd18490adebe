package com.phillippitts.batchanalyzer.domain;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable analysis of one image, either obtained from the capability or derived from a
 * similar image's result.
 *
 * @param description free-text description
 * @param tags        category to tag-list mapping (deep-copied, unmodifiable)
 * @param prompt      generated reproduction prompt, may be null
 * @param cost        cost incurred producing this result (0 for derived results)
 * @param tier        tier that produced the result, or {@link #DERIVED_TIER}
 * @param confidence  confidence between 0.0 and 1.0
 * @param sourceTier  for derived results, the tier of the original result; otherwise null
 * @param raw         raw provider response, may be null
 */
public record AnalysisResult(
        String description,
        Map<String, List<String>> tags,
        String prompt,
        double cost,
        String tier,
        double confidence,
        String sourceTier,
        String raw
) {

    public static final String DERIVED_TIER = "derived";

    public AnalysisResult {
        Objects.requireNonNull(description, "description");
        Objects.requireNonNull(tier, "tier");
        if (confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("Confidence must be between 0.0 and 1.0, got: " + confidence);
        }
        if (cost < 0.0) {
            throw new IllegalArgumentException("Cost must be >= 0, got: " + cost);
        }
        tags = copyTags(tags);
    }

    /**
     * Total number of tags across all categories.
     */
    public int tagCount() {
        return tags.values().stream().mapToInt(List::size).sum();
    }

    /**
     * Number of categories holding at least one tag.
     */
    public int populatedCategoryCount() {
        return (int) tags.values().stream().filter(l -> !l.isEmpty()).count();
    }

    public boolean isDerived() {
        return DERIVED_TIER.equals(tier);
    }

    public Optional<String> generatedPrompt() {
        return Optional.ofNullable(prompt);
    }

    private static Map<String, List<String>> copyTags(Map<String, List<String>> tags) {
        if (tags == null || tags.isEmpty()) {
            return Map.of();
        }
        Map<String, List<String>> copy = new LinkedHashMap<>();
        tags.forEach((category, values) -> copy.put(category, values == null ? List.of() : List.copyOf(values)));
        return Collections.unmodifiableMap(copy);
    }
}
