package com.postmarksystems.scheduler;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Scope-bound token telling the {@link Scheduler} not to advance time while it is held.
 * Closing it releases the hold; closing it again does nothing.
 */
public final class NoAdvanceTimeGuard implements AutoCloseable {

    private final Scheduler scheduler;
    private final AtomicBoolean released = new AtomicBoolean(false);

    NoAdvanceTimeGuard(Scheduler scheduler) {
        this.scheduler = scheduler;
    }

    /**
     * Returns true once the guard has been released.
     */
    public boolean isReleased() {
        return released.get();
    }

    @Override
    public void close() {
        if (released.compareAndSet(false, true)) {
            scheduler.release();
        }
    }
}
