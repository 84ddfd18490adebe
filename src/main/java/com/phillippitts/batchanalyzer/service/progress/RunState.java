package com.phillippitts.batchanalyzer.service.progress;

/**
 * Lifecycle of one batch run: FRESH, then RUNNING, then COMPLETED or ABORTED.
 */
public enum RunState {
    FRESH,
    RUNNING,
    COMPLETED,
    ABORTED;

    public boolean isTerminal() {
        return this == COMPLETED || this == ABORTED;
    }
}
