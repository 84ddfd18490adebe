package com.phillippitts.batchanalyzer.config.properties;

import com.phillippitts.batchanalyzer.domain.HashAlgorithm;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Typed properties for similarity grouping.
 */
@Validated
@ConfigurationProperties(prefix = "batch.grouping")
public class GroupingProperties {

    /** Composite similarity at or above which an item joins a group (0..1]. */
    @DecimalMin(value = "0.0", inclusive = false)
    @DecimalMax("1.0")
    private final double similarityThreshold;

    /** Side length of the hash grid; 8 gives 64-bit average and frequency hashes. */
    @Min(2)
    private final int hashSize;

    /** Oversampling factor for the frequency hash (image is resized to hashSize * factor). */
    @Min(1)
    private final int highFrequencyFactor;

    /** Weight per algorithm in the composite score; normalized by their sum. */
    private final Map<HashAlgorithm, Double> weights;

    @ConstructorBinding
    public GroupingProperties(Double similarityThreshold, Integer hashSize, Integer highFrequencyFactor,
                              Map<HashAlgorithm, Double> weights) {
        double t = similarityThreshold == null ? 0.9 : similarityThreshold;
        if (t <= 0.0 || t > 1.0) {
            throw new IllegalArgumentException("batch.grouping.similarity-threshold must be in (0,1]");
        }
        this.similarityThreshold = t;
        this.hashSize = hashSize == null ? 8 : hashSize;
        this.highFrequencyFactor = highFrequencyFactor == null ? 4 : highFrequencyFactor;
        Map<HashAlgorithm, Double> w = new EnumMap<>(HashAlgorithm.class);
        if (weights == null || weights.isEmpty()) {
            w.put(HashAlgorithm.FREQUENCY, 0.7);
            w.put(HashAlgorithm.DIFFERENCE, 0.3);
        } else {
            w.putAll(weights);
        }
        this.weights = Collections.unmodifiableMap(w);
    }

    public static GroupingProperties defaults() {
        return new GroupingProperties(null, null, null, null);
    }

    public double getSimilarityThreshold() {
        return similarityThreshold;
    }

    public int getHashSize() {
        return hashSize;
    }

    public int getHighFrequencyFactor() {
        return highFrequencyFactor;
    }

    public Map<HashAlgorithm, Double> getWeights() {
        return weights;
    }
}
