package com.phillippitts.batchanalyzer.domain;

import java.math.BigInteger;
import java.util.Locale;
import java.util.Objects;

/**
 * Immutable perceptual fingerprint of one image.
 *
 * @param algorithm hash algorithm that produced the value
 * @param bitWidth  number of bits in the hash (64 for the default 8x8 size)
 * @param value     lowercase hex string, zero-padded to {@code bitWidth / 4} characters
 */
public record Fingerprint(HashAlgorithm algorithm, int bitWidth, String value) {

    public Fingerprint {
        Objects.requireNonNull(algorithm, "algorithm");
        Objects.requireNonNull(value, "value");
        if (bitWidth <= 0 || bitWidth % 4 != 0) {
            throw new IllegalArgumentException("bitWidth must be a positive multiple of 4, got: " + bitWidth);
        }
        value = value.toLowerCase(Locale.ROOT);
        if (value.length() != bitWidth / 4) {
            throw new IllegalArgumentException(
                    "Expected " + (bitWidth / 4) + " hex characters, got " + value.length());
        }
        if (!value.chars().allMatch(c -> Character.digit(c, 16) >= 0)) {
            throw new IllegalArgumentException("Fingerprint value is not hex: " + value);
        }
    }

    /**
     * Packs a bit vector (most significant bit first) into a fingerprint.
     *
     * @param algorithm producing algorithm
     * @param bits      hash bits in row-major order
     * @return fingerprint with {@code bits.length} bit width
     */
    public static Fingerprint fromBits(HashAlgorithm algorithm, boolean[] bits) {
        BigInteger v = BigInteger.ZERO;
        for (boolean bit : bits) {
            v = v.shiftLeft(1);
            if (bit) {
                v = v.setBit(0);
            }
        }
        String hex = v.toString(16);
        int width = bits.length / 4;
        StringBuilder sb = new StringBuilder(width);
        for (int i = hex.length(); i < width; i++) {
            sb.append('0');
        }
        sb.append(hex);
        return new Fingerprint(algorithm, bits.length, sb.toString());
    }

    /** Unsigned numeric value of the hash. */
    public BigInteger toBigInteger() {
        return new BigInteger(value, 16);
    }
}
