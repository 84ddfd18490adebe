package com.phillippitts.batchanalyzer.testutil;

import com.phillippitts.batchanalyzer.exception.CheckpointException;
import com.phillippitts.batchanalyzer.service.progress.CheckpointStore;
import com.phillippitts.batchanalyzer.service.progress.ProgressSnapshot;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * CheckpointStore kept in memory, with an optional write failure switch.
 */
public class InMemoryCheckpointStore implements CheckpointStore {

    private final Map<String, ProgressSnapshot> snapshots = new ConcurrentHashMap<>();
    public final AtomicInteger saves = new AtomicInteger();
    public final AtomicInteger deletes = new AtomicInteger();
    public volatile boolean failWrites;

    @Override
    public Optional<ProgressSnapshot> load(String runToken) {
        return Optional.ofNullable(snapshots.get(runToken));
    }

    @Override
    public void save(ProgressSnapshot snapshot) {
        if (failWrites) {
            throw new CheckpointException("Simulated write failure", snapshot.runToken(), null);
        }
        saves.incrementAndGet();
        snapshots.put(snapshot.runToken(), snapshot);
    }

    @Override
    public void delete(String runToken) {
        deletes.incrementAndGet();
        snapshots.remove(runToken);
    }

    public boolean contains(String runToken) {
        return snapshots.containsKey(runToken);
    }
}
