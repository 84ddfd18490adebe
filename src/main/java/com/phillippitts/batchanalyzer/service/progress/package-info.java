/**
 * Run progress tracking and checkpoint persistence.
 *
 * <p>{@link com.phillippitts.batchanalyzer.service.progress.ProgressLedger} is the single,
 * synchronized record of what a run has done;
 * {@link com.phillippitts.batchanalyzer.service.progress.FileCheckpointStore} persists its
 * snapshots as JSON so an interrupted run can resume without repeating paid calls.
 */
package com.phillippitts.batchanalyzer.service.progress;
