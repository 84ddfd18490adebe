package com.phillippitts.batchanalyzer.service.hash;

import com.phillippitts.batchanalyzer.domain.Fingerprint;
import com.phillippitts.batchanalyzer.domain.HashAlgorithm;
import com.phillippitts.batchanalyzer.exception.FingerprintMismatchException;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class SimilarityMetricTest {

    private static final Map<HashAlgorithm, Double> DEFAULT_WEIGHTS =
            Map.of(HashAlgorithm.FREQUENCY, 0.7, HashAlgorithm.DIFFERENCE, 0.3);

    @Test
    void singleBitDifferenceGivesDistanceOne() {
        assertThat(SimilarityMetric.hammingDistance("f0f0f0f0f0f0f0f0", "f0f0f0f0f0f0f0f1")).isEqualTo(1);
    }

    @Test
    void similarityIsOneMinusNormalizedDistance() {
        Fingerprint a = new Fingerprint(HashAlgorithm.FREQUENCY, 64, "f0f0f0f0f0f0f0f0");
        Fingerprint b = new Fingerprint(HashAlgorithm.FREQUENCY, 64, "f0f0f0f0f0f0f0f1");

        assertThat(SimilarityMetric.similarity(a, b)).isCloseTo(63.0 / 64.0, within(1e-12));
        assertThat(SimilarityMetric.similarity(a, a)).isEqualTo(1.0);
    }

    @Test
    void completelyInvertedHashesHaveZeroSimilarity() {
        Fingerprint a = new Fingerprint(HashAlgorithm.DIFFERENCE, 64, "0000000000000000");
        Fingerprint b = new Fingerprint(HashAlgorithm.DIFFERENCE, 64, "ffffffffffffffff");

        assertThat(SimilarityMetric.hammingDistance(a, b)).isEqualTo(64);
        assertThat(SimilarityMetric.similarity(a, b)).isEqualTo(0.0);
    }

    @Test
    void rejectsHashesOfDifferentLength() {
        assertThatThrownBy(() -> SimilarityMetric.hammingDistance("abcd", "abcdef"))
                .isInstanceOf(FingerprintMismatchException.class);
    }

    @Test
    void rejectsFingerprintsOfDifferentAlgorithms() {
        Fingerprint a = new Fingerprint(HashAlgorithm.FREQUENCY, 64, "0000000000000000");
        Fingerprint b = new Fingerprint(HashAlgorithm.AVERAGE, 64, "0000000000000000");

        assertThatThrownBy(() -> SimilarityMetric.similarity(a, b))
                .isInstanceOf(FingerprintMismatchException.class)
                .hasMessageContaining("FREQUENCY");
    }

    @Test
    void compositeWeightsFrequencyOverDifference() {
        SimilarityMetric metric = new SimilarityMetric(DEFAULT_WEIGHTS);
        Map<HashAlgorithm, Fingerprint> a = Map.of(
                HashAlgorithm.FREQUENCY, new Fingerprint(HashAlgorithm.FREQUENCY, 64, "1234567890abcdef"),
                HashAlgorithm.DIFFERENCE, new Fingerprint(HashAlgorithm.DIFFERENCE, 64, "0000000000000000"));
        Map<HashAlgorithm, Fingerprint> b = Map.of(
                HashAlgorithm.FREQUENCY, new Fingerprint(HashAlgorithm.FREQUENCY, 64, "1234567890abcdef"),
                HashAlgorithm.DIFFERENCE, new Fingerprint(HashAlgorithm.DIFFERENCE, 64, "ffffffffffffffff"));

        assertThat(metric.composite(a, b)).isCloseTo(0.7, within(1e-12));
    }

    @Test
    void weightsAreNormalizedBySum() {
        SimilarityMetric metric = new SimilarityMetric(Map.of(HashAlgorithm.FREQUENCY, 7.0, HashAlgorithm.DIFFERENCE, 3.0));

        assertThat(metric.weights().get(HashAlgorithm.FREQUENCY)).isCloseTo(0.7, within(1e-12));
        assertThat(metric.weights().get(HashAlgorithm.DIFFERENCE)).isCloseTo(0.3, within(1e-12));
        assertThat(metric.algorithms()).containsExactlyInAnyOrder(HashAlgorithm.FREQUENCY, HashAlgorithm.DIFFERENCE);
    }

    @Test
    void zeroWeightAlgorithmsAreNotRequired() {
        SimilarityMetric metric = new SimilarityMetric(Map.of(HashAlgorithm.FREQUENCY, 1.0, HashAlgorithm.AVERAGE, 0.0));
        Map<HashAlgorithm, Fingerprint> fp = Map.of(
                HashAlgorithm.FREQUENCY, new Fingerprint(HashAlgorithm.FREQUENCY, 64, "00000000000000ff"));

        assertThat(metric.algorithms()).containsExactly(HashAlgorithm.FREQUENCY);
        assertThat(metric.composite(fp, fp)).isEqualTo(1.0);
    }

    @Test
    void compositeRequiresEveryWeightedAlgorithm() {
        SimilarityMetric metric = new SimilarityMetric(DEFAULT_WEIGHTS);
        Map<HashAlgorithm, Fingerprint> onlyFrequency = Map.of(
                HashAlgorithm.FREQUENCY, new Fingerprint(HashAlgorithm.FREQUENCY, 64, "0000000000000000"));

        assertThatThrownBy(() -> metric.composite(onlyFrequency, onlyFrequency))
                .isInstanceOf(FingerprintMismatchException.class)
                .hasMessageContaining("DIFFERENCE");
    }

    @Test
    void rejectsInvalidWeights() {
        assertThatThrownBy(() -> new SimilarityMetric(Map.of(HashAlgorithm.FREQUENCY, -1.0)))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new SimilarityMetric(Map.of(HashAlgorithm.FREQUENCY, 0.0)))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
