package com.phillippitts.batchanalyzer.service.batch;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative stop request for a running batch.
 *
 * <p>Once raised, no new group is scheduled and no retry is attempted; calls already in flight
 * finish and their results are recorded. Listeners run once, on the thread that raises the stop.
 */
public final class StopSignal {

    private static final Logger LOG = LogManager.getLogger(StopSignal.class);

    private final AtomicBoolean stopRequested = new AtomicBoolean(false);
    private final List<Runnable> listeners = new CopyOnWriteArrayList<>();

    public void requestStop() {
        if (!stopRequested.compareAndSet(false, true)) {
            return;
        }
        for (Runnable listener : listeners) {
            try {
                listener.run();
            } catch (RuntimeException e) {
                LOG.warn("Stop listener failed: {}", e.getMessage(), e);
            }
        }
    }

    public boolean isStopRequested() {
        return stopRequested.get();
    }

    void addListener(Runnable listener) {
        listeners.add(listener);
    }

    void removeListener(Runnable listener) {
        listeners.remove(listener);
    }
}
