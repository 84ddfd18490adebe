package com.phillippitts.batchanalyzer.service.progress;

import com.phillippitts.batchanalyzer.exception.CheckpointException;

import java.util.Optional;

/**
 * Durable storage for run checkpoints, keyed by run token.
 *
 * <p>All methods throw {@link CheckpointException} on I/O failure.
 */
public interface CheckpointStore {

    Optional<ProgressSnapshot> load(String runToken);

    /**
     * Replaces the checkpoint for the snapshot's run token. A partially written checkpoint must
     * never replace a complete one.
     */
    void save(ProgressSnapshot snapshot);

    void delete(String runToken);
}
