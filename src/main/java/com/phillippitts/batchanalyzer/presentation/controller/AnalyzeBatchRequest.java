package com.phillippitts.batchanalyzer.presentation.controller;

import com.phillippitts.batchanalyzer.domain.AnalysisOptions;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.PositiveOrZero;

import java.util.List;

/**
 * Request body for {@code POST /api/batch/analyze}. Unset fields fall back to the configured
 * {@code batch.coordinator.*} defaults.
 */
public record AnalyzeBatchRequest(
        @NotEmpty List<@NotBlank String> paths,
        @Min(1) Integer concurrency,
        @PositiveOrZero Long minCallSpacingMs,
        @Min(1) Integer maxAttempts,
        @PositiveOrZero Double maxCost,
        Boolean resume,
        String runToken,
        String tier,
        Boolean generatePrompt,
        Boolean extractTags,
        Boolean detailed,
        String instructions
) {

    public AnalysisOptions toOptions() {
        AnalysisOptions defaults = AnalysisOptions.defaults();
        return new AnalysisOptions(
                generatePrompt == null ? defaults.generatePrompt() : generatePrompt,
                extractTags == null ? defaults.extractTags() : extractTags,
                detailed == null ? defaults.detailed() : detailed,
                instructions);
    }
}
