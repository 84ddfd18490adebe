package com.phillippitts.batchanalyzer.presentation.controller;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;

import java.util.List;

/**
 * Request body for {@code POST /api/batch/estimate}.
 *
 * @param paths image files to price
 * @param tier  tier to price at; the cheapest tier when null
 */
public record EstimateBatchRequest(@NotEmpty List<@NotBlank String> paths, String tier) {
}
