package com.phillippitts.batchanalyzer.service.hash;

import com.phillippitts.batchanalyzer.domain.Fingerprint;
import com.phillippitts.batchanalyzer.domain.HashAlgorithm;
import dev.brachtendorf.jimagehash.hash.Hash;
import dev.brachtendorf.jimagehash.hashAlgorithms.AverageHash;
import dev.brachtendorf.jimagehash.hashAlgorithms.DifferenceHash;
import dev.brachtendorf.jimagehash.hashAlgorithms.HashingAlgorithm;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.imgscalr.Scalr;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.math.BigInteger;
import java.util.Arrays;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Computes perceptual fingerprints of encoded images.
 *
 * <ul>
 *   <li>{@link HashAlgorithm#AVERAGE}: JImageHash {@link AverageHash} over an N x N grid</li>
 *   <li>{@link HashAlgorithm#DIFFERENCE}: JImageHash {@link DifferenceHash} with simple
 *       precision; the library picks a near-square grid, so N = 8 yields 72 bits</li>
 *   <li>{@link HashAlgorithm#FREQUENCY}: image shrunk to (N*F) x (N*F) with imgscalr, 2D DCT-II,
 *       top-left N x N coefficients, bit set when the coefficient exceeds their median</li>
 * </ul>
 * Library hashes are rendered as lowercase hex, zero-padded to the hash's bit resolution.
 *
 * <p>Hashing never throws for bad input: undecodable images yield an empty result and a
 * warning, and the caller treats the item as incomparable.
 *
 * <p>Thread-safe: the JImageHash algorithms keep no per-image state.
 */
public class PerceptualHasher {

    private static final Logger LOG = LogManager.getLogger(PerceptualHasher.class);

    private final int hashSize;
    private final int highFrequencyFactor;
    private final HashingAlgorithm averageHash;
    private final HashingAlgorithm differenceHash;
    private final double[][] dctBasis;

    /**
     * @param hashSize            grid side length N (8 gives 64-bit average and frequency hashes)
     * @param highFrequencyFactor oversampling factor F for the frequency hash
     */
    public PerceptualHasher(int hashSize, int highFrequencyFactor) {
        if (hashSize < 2) {
            throw new IllegalArgumentException("hashSize must be >= 2, got: " + hashSize);
        }
        if ((hashSize * hashSize) % 4 != 0) {
            throw new IllegalArgumentException("hashSize squared must be a multiple of 4, got: " + hashSize);
        }
        if (highFrequencyFactor < 1) {
            throw new IllegalArgumentException("highFrequencyFactor must be >= 1, got: " + highFrequencyFactor);
        }
        this.hashSize = hashSize;
        this.highFrequencyFactor = highFrequencyFactor;
        this.averageHash = new AverageHash(hashSize * hashSize);
        this.differenceHash = new DifferenceHash(hashSize * hashSize, DifferenceHash.Precision.Simple);
        this.dctBasis = dctBasis(hashSize * highFrequencyFactor, hashSize);
    }

    public int hashSize() {
        return hashSize;
    }

    /**
     * Decodes the image and computes one fingerprint.
     *
     * @return the fingerprint, or empty when the bytes are not a decodable image
     */
    public Optional<Fingerprint> fingerprint(byte[] imageBytes, HashAlgorithm algorithm) {
        Map<HashAlgorithm, Fingerprint> all = fingerprintAll(imageBytes, Set.of(algorithm));
        return Optional.ofNullable(all.get(algorithm));
    }

    /**
     * Decodes the image once and computes every requested fingerprint.
     *
     * @return algorithm to fingerprint; empty map when the image cannot be decoded
     */
    public Map<HashAlgorithm, Fingerprint> fingerprintAll(byte[] imageBytes, Set<HashAlgorithm> algorithms) {
        if (imageBytes == null || imageBytes.length == 0) {
            LOG.warn("Cannot fingerprint empty image data");
            return Map.of();
        }
        BufferedImage image;
        try {
            image = ImageIO.read(new ByteArrayInputStream(imageBytes));
        } catch (IOException | RuntimeException e) {
            LOG.warn("Failed to decode image ({} bytes): {}", imageBytes.length, e.getMessage());
            return Map.of();
        }
        if (image == null) {
            LOG.warn("Unsupported image format ({} bytes)", imageBytes.length);
            return Map.of();
        }
        return fingerprintAll(image, algorithms);
    }

    /**
     * Computes every requested fingerprint of an already decoded image.
     */
    public Map<HashAlgorithm, Fingerprint> fingerprintAll(BufferedImage image, Set<HashAlgorithm> algorithms) {
        try {
            Map<HashAlgorithm, Fingerprint> out = new EnumMap<>(HashAlgorithm.class);
            for (HashAlgorithm algorithm : algorithms) {
                out.put(algorithm, compute(image, algorithm));
            }
            return Collections.unmodifiableMap(out);
        } catch (RuntimeException e) {
            LOG.warn("Failed to fingerprint {}x{} image: {}", image.getWidth(), image.getHeight(), e.getMessage());
            return Map.of();
        }
    }

    private Fingerprint compute(BufferedImage image, HashAlgorithm algorithm) {
        return switch (algorithm) {
            case AVERAGE -> toFingerprint(HashAlgorithm.AVERAGE, averageHash.hash(image));
            case DIFFERENCE -> toFingerprint(HashAlgorithm.DIFFERENCE, differenceHash.hash(image));
            case FREQUENCY -> frequencyHash(image);
        };
    }

    /**
     * Renders a library hash as a fingerprint whose width is the hash's bit resolution rounded
     * up to a whole hex digit.
     */
    static Fingerprint toFingerprint(HashAlgorithm algorithm, Hash hash) {
        int bits = hash.getBitResolution();
        int width = ((bits + 3) / 4) * 4;
        BigInteger value = hash.getHashValue().and(BigInteger.ONE.shiftLeft(bits).subtract(BigInteger.ONE));
        String hex = value.toString(16);
        StringBuilder sb = new StringBuilder(width / 4);
        for (int i = hex.length(); i < width / 4; i++) {
            sb.append('0');
        }
        sb.append(hex);
        return new Fingerprint(algorithm, width, sb.toString());
    }

    private Fingerprint frequencyHash(BufferedImage image) {
        int n = hashSize * highFrequencyFactor;
        BufferedImage small = Scalr.resize(image, Scalr.Method.ULTRA_QUALITY, Scalr.Mode.FIT_EXACT, n, n);
        double[][] luma = new double[n][n];
        try {
            for (int y = 0; y < n; y++) {
                for (int x = 0; x < n; x++) {
                    int rgb = small.getRGB(x, y);
                    luma[y][x] = 0.299 * ((rgb >> 16) & 0xff) + 0.587 * ((rgb >> 8) & 0xff) + 0.114 * (rgb & 0xff);
                }
            }
        } finally {
            if (small != image) {
                small.flush();
            }
        }

        // Row transform restricted to the first hashSize frequencies: tmp[u][x] = sum_y B[u][y] f[y][x]
        double[][] tmp = new double[hashSize][n];
        for (int u = 0; u < hashSize; u++) {
            for (int x = 0; x < n; x++) {
                double s = 0.0;
                for (int y = 0; y < n; y++) {
                    s += dctBasis[u][y] * luma[y][x];
                }
                tmp[u][x] = s;
            }
        }
        double[] coefficients = new double[hashSize * hashSize];
        for (int u = 0; u < hashSize; u++) {
            for (int v = 0; v < hashSize; v++) {
                double s = 0.0;
                for (int x = 0; x < n; x++) {
                    s += tmp[u][x] * dctBasis[v][x];
                }
                coefficients[u * hashSize + v] = s;
            }
        }

        double median = median(coefficients);
        boolean[] bits = new boolean[coefficients.length];
        for (int i = 0; i < coefficients.length; i++) {
            bits[i] = coefficients[i] > median;
        }
        return Fingerprint.fromBits(HashAlgorithm.FREQUENCY, bits);
    }

    static double median(double[] values) {
        double[] sorted = values.clone();
        Arrays.sort(sorted);
        int mid = sorted.length / 2;
        if (sorted.length % 2 == 0) {
            return (sorted[mid - 1] + sorted[mid]) / 2.0;
        }
        return sorted[mid];
    }

    /**
     * Orthonormal DCT-II basis rows for the lowest {@code frequencies} frequencies of an
     * {@code n}-point transform.
     */
    private static double[][] dctBasis(int n, int frequencies) {
        double[][] basis = new double[frequencies][n];
        for (int k = 0; k < frequencies; k++) {
            double scale = k == 0 ? Math.sqrt(1.0 / n) : Math.sqrt(2.0 / n);
            for (int i = 0; i < n; i++) {
                basis[k][i] = scale * Math.cos(Math.PI * (2 * i + 1) * k / (2.0 * n));
            }
        }
        return basis;
    }
}
