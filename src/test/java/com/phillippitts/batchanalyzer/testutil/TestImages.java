package com.phillippitts.batchanalyzer.testutil;

import com.phillippitts.batchanalyzer.domain.BatchItem;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.Random;

/**
 * Deterministic PNG fixtures.
 *
 * <p>{@link #blocks(long)} draws a 16x16 grid of random gray blocks (64x64 pixels) from the seed,
 * so different seeds give unrelated images and the same seed gives identical bytes.
 */
public final class TestImages {

    private static final int GRID = 16;
    private static final int BLOCK = 4;

    private TestImages() {
    }

    public static BufferedImage blockImage(long seed) {
        Random random = new Random(seed);
        int size = GRID * BLOCK;
        BufferedImage image = new BufferedImage(size, size, BufferedImage.TYPE_INT_RGB);
        for (int gy = 0; gy < GRID; gy++) {
            for (int gx = 0; gx < GRID; gx++) {
                int v = random.nextInt(256);
                int rgb = (v << 16) | (v << 8) | v;
                for (int y = 0; y < BLOCK; y++) {
                    for (int x = 0; x < BLOCK; x++) {
                        image.setRGB(gx * BLOCK + x, gy * BLOCK + y, rgb);
                    }
                }
            }
        }
        return image;
    }

    public static byte[] blocks(long seed) {
        return png(blockImage(seed));
    }

    /**
     * Horizontal gradient, dark on the left and bright on the right.
     */
    public static BufferedImage gradient(int width, int height) {
        BufferedImage image = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                int v = width == 1 ? 0 : x * 255 / (width - 1);
                image.setRGB(x, y, (v << 16) | (v << 8) | v);
            }
        }
        return image;
    }

    public static BufferedImage solid(int width, int height, int gray) {
        BufferedImage image = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
        int rgb = (gray << 16) | (gray << 8) | gray;
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                image.setRGB(x, y, rgb);
            }
        }
        return image;
    }

    public static byte[] png(BufferedImage image) {
        try (ByteArrayOutputStream out = new ByteArrayOutputStream()) {
            ImageIO.write(image, "png", out);
            return out.toByteArray();
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    public static byte[] notAnImage() {
        return "definitely not an image".getBytes(StandardCharsets.UTF_8);
    }

    public static BatchItem item(String id, long seed) {
        return BatchItem.ofBytes(id, blocks(seed));
    }

    public static BatchItem unreadable(String id) {
        return new BatchItem(id, () -> {
            throw new IOException("disk gone");
        });
    }
}
