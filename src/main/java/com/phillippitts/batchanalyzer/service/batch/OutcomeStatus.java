package com.phillippitts.batchanalyzer.service.batch;

/**
 * Final status of one item in a batch report.
 */
public enum OutcomeStatus {
    /** Analyzed by the capability. */
    SUCCEEDED,
    /** Result copied from a similar representative. */
    DERIVED,
    /** Gave up after the final attempt. */
    FAILED,
    /** Not attempted in this run (budget, stop, or processed in an earlier run). */
    SKIPPED
}
