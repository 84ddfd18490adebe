package com.phillippitts.batchanalyzer.service.hash;

import com.phillippitts.batchanalyzer.domain.Fingerprint;
import com.phillippitts.batchanalyzer.domain.HashAlgorithm;
import com.phillippitts.batchanalyzer.exception.FingerprintMismatchException;

import java.math.BigInteger;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Hamming-distance based similarity between fingerprints.
 *
 * <p>Similarity of two fingerprints is {@code 1 - distance / bitWidth}. The composite score
 * over several algorithms is the weighted mean of their similarities, with weights normalized
 * by their sum (default FREQUENCY 0.7, DIFFERENCE 0.3).
 */
public class SimilarityMetric {

    private final Map<HashAlgorithm, Double> weights;

    public SimilarityMetric(Map<HashAlgorithm, Double> weights) {
        Objects.requireNonNull(weights, "weights");
        double total = 0.0;
        for (Map.Entry<HashAlgorithm, Double> e : weights.entrySet()) {
            Double w = e.getValue();
            if (w == null || w < 0.0 || w.isNaN()) {
                throw new IllegalArgumentException("Weight for " + e.getKey() + " must be >= 0, got: " + w);
            }
            total += w;
        }
        if (total <= 0.0) {
            throw new IllegalArgumentException("At least one similarity weight must be positive");
        }
        Map<HashAlgorithm, Double> normalized = new EnumMap<>(HashAlgorithm.class);
        for (Map.Entry<HashAlgorithm, Double> e : weights.entrySet()) {
            if (e.getValue() > 0.0) {
                normalized.put(e.getKey(), e.getValue() / total);
            }
        }
        this.weights = Collections.unmodifiableMap(normalized);
    }

    /**
     * Algorithms that contribute to the composite score.
     */
    public Set<HashAlgorithm> algorithms() {
        return weights.keySet();
    }

    public Map<HashAlgorithm, Double> weights() {
        return weights;
    }

    /**
     * Number of differing bits between two equal-length hex hashes.
     *
     * @throws FingerprintMismatchException if the lengths differ
     */
    public static int hammingDistance(String hexA, String hexB) {
        Objects.requireNonNull(hexA, "hexA");
        Objects.requireNonNull(hexB, "hexB");
        if (hexA.length() != hexB.length()) {
            throw new FingerprintMismatchException(
                    "Cannot compare hashes of different length: " + hexA.length() + " vs " + hexB.length());
        }
        return new BigInteger(hexA, 16).xor(new BigInteger(hexB, 16)).bitCount();
    }

    /**
     * @throws FingerprintMismatchException if algorithms or widths differ
     */
    public static int hammingDistance(Fingerprint a, Fingerprint b) {
        requireComparable(a, b);
        return a.toBigInteger().xor(b.toBigInteger()).bitCount();
    }

    /**
     * Similarity in [0,1]; 1.0 for identical fingerprints.
     */
    public static double similarity(Fingerprint a, Fingerprint b) {
        int distance = hammingDistance(a, b);
        return 1.0 - (double) distance / a.bitWidth();
    }

    /**
     * Weighted composite similarity of two items' fingerprint sets.
     *
     * @throws FingerprintMismatchException if either side lacks a weighted algorithm
     */
    public double composite(Map<HashAlgorithm, Fingerprint> a, Map<HashAlgorithm, Fingerprint> b) {
        double score = 0.0;
        for (Map.Entry<HashAlgorithm, Double> e : weights.entrySet()) {
            Fingerprint fa = a.get(e.getKey());
            Fingerprint fb = b.get(e.getKey());
            if (fa == null || fb == null) {
                throw new FingerprintMismatchException("Missing " + e.getKey() + " fingerprint");
            }
            score += e.getValue() * similarity(fa, fb);
        }
        return Math.min(1.0, Math.max(0.0, score));
    }

    private static void requireComparable(Fingerprint a, Fingerprint b) {
        Objects.requireNonNull(a, "a");
        Objects.requireNonNull(b, "b");
        if (a.algorithm() != b.algorithm()) {
            throw new FingerprintMismatchException(
                    "Cannot compare " + a.algorithm() + " with " + b.algorithm());
        }
        if (a.bitWidth() != b.bitWidth()) {
            throw new FingerprintMismatchException(
                    "Cannot compare " + a.bitWidth() + "-bit hash with " + b.bitWidth() + "-bit hash");
        }
    }
}
