package com.phillippitts.batchanalyzer.domain;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * One content item submitted for analysis.
 *
 * @param id     stable identifier, unique within a batch (used in checkpoints)
 * @param source supplier of the encoded image bytes
 */
public record BatchItem(String id, ImageSource source) {

    public BatchItem {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(source, "source");
    }

    public static BatchItem ofPath(Path path) {
        Objects.requireNonNull(path, "path");
        return new BatchItem(path.toString(), () -> Files.readAllBytes(path));
    }

    public static BatchItem ofBytes(String id, byte[] bytes) {
        Objects.requireNonNull(bytes, "bytes");
        byte[] copy = bytes.clone();
        return new BatchItem(id, copy::clone);
    }
}
