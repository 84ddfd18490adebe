package com.phillippitts.batchanalyzer.service.tier;

import com.phillippitts.batchanalyzer.domain.AnalysisResult;

import java.util.ArrayList;
import java.util.List;

/**
 * Decides whether a result is detailed enough to stop escalating.
 *
 * <p>A result is insufficient when it has fewer than {@code minTags} tags, a description shorter
 * than {@code minDescriptionLength} characters, or fewer than {@code minCategories} populated tag
 * categories.
 */
public class SufficiencyPolicy {

    private final int minTags;
    private final int minDescriptionLength;
    private final int minCategories;

    public SufficiencyPolicy(int minTags, int minDescriptionLength, int minCategories) {
        if (minTags < 0 || minDescriptionLength < 0 || minCategories < 0) {
            throw new IllegalArgumentException("Sufficiency thresholds must be >= 0");
        }
        this.minTags = minTags;
        this.minDescriptionLength = minDescriptionLength;
        this.minCategories = minCategories;
    }

    public boolean isSufficient(AnalysisResult result) {
        return deficiencies(result).isEmpty();
    }

    /**
     * Human-readable list of unmet thresholds; empty when the result is sufficient.
     */
    public List<String> deficiencies(AnalysisResult result) {
        List<String> out = new ArrayList<>(3);
        if (result.tagCount() < minTags) {
            out.add("tags " + result.tagCount() + " < " + minTags);
        }
        int len = result.description().strip().length();
        if (len < minDescriptionLength) {
            out.add("description length " + len + " < " + minDescriptionLength);
        }
        if (result.populatedCategoryCount() < minCategories) {
            out.add("categories " + result.populatedCategoryCount() + " < " + minCategories);
        }
        return out;
    }
}
