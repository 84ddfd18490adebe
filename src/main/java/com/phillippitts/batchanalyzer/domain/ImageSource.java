package com.phillippitts.batchanalyzer.domain;

import java.io.IOException;

/**
 * Lazily supplies the raw encoded bytes of an image.
 */
@FunctionalInterface
public interface ImageSource {

    byte[] read() throws IOException;
}
