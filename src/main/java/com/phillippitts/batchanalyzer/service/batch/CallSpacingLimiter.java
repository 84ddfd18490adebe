package com.phillippitts.batchanalyzer.service.batch;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * Enforces a minimum interval between consecutive capability calls across all threads.
 *
 * <p>Each caller claims the next free slot under the lock and then sleeps outside it, so
 * waiting callers do not serialize on the lock itself.
 */
final class CallSpacingLimiter {

    private final long spacingNanos;
    private long nextSlotNanos;

    CallSpacingLimiter(Duration spacing) {
        if (spacing.isNegative()) {
            throw new IllegalArgumentException("spacing must be >= 0, got: " + spacing);
        }
        this.spacingNanos = spacing.toNanos();
        this.nextSlotNanos = System.nanoTime();
    }

    /**
     * Blocks until this caller's slot is reached.
     *
     * @throws InterruptedException if interrupted while waiting
     */
    void acquire() throws InterruptedException {
        if (spacingNanos == 0) {
            return;
        }
        long waitNanos;
        synchronized (this) {
            long now = System.nanoTime();
            long slot = Math.max(now, nextSlotNanos);
            nextSlotNanos = slot + spacingNanos;
            waitNanos = slot - now;
        }
        if (waitNanos > 0) {
            TimeUnit.NANOSECONDS.sleep(waitNanos);
        }
    }
}
