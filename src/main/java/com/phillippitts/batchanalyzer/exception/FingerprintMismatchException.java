package com.phillippitts.batchanalyzer.exception;

/**
 * Thrown when two fingerprints cannot be compared (different length or algorithm).
 */
public class FingerprintMismatchException extends BatchAnalysisException {

    public FingerprintMismatchException(String message) {
        super(message);
    }
}
