package com.phillippitts.batchanalyzer.exception;

/**
 * Thrown when a checkpoint cannot be read, written or deleted.
 * The batch coordinator downgrades this to a warning and keeps the run going in memory.
 */
public class CheckpointException extends BatchAnalysisException {

    private final String runToken;

    public CheckpointException(String message, String runToken, Throwable cause) {
        super(message + " (run: " + runToken + ")", cause);
        this.runToken = runToken;
    }

    public String getRunToken() {
        return runToken;
    }
}
