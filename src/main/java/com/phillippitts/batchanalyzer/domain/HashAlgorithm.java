package com.phillippitts.batchanalyzer.domain;

/**
 * Perceptual hash algorithms supported by the hasher.
 */
public enum HashAlgorithm {
    /** aHash: per-pixel comparison against mean brightness. */
    AVERAGE,
    /** dHash: sign of horizontal adjacent-pixel brightness differences. */
    DIFFERENCE,
    /** pHash: low-frequency DCT coefficients compared against their median. */
    FREQUENCY
}
