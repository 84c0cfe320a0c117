package com.postmarksystems.scheduler;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Keeps track of the messages currently in flight so that simulated time is never
 * advanced while one of them is still waiting to be handled.
 *
 * <p>Every message sent to an actor holds a {@link NoAdvanceTimeGuard} for as long as its
 * envelope lives. A time-advancement mechanism may only move the clock forward when
 * {@link #isTimeAdvanceAllowed()} returns true.</p>
 */
public class Scheduler {
    private static final Logger logger = LoggerFactory.getLogger(Scheduler.class);

    private final AtomicLong inFlightGuards = new AtomicLong();

    /**
     * Acquires a guard preventing time from advancing until it is closed.
     *
     * @return A new guard, already counted
     */
    public NoAdvanceTimeGuard noAdvanceTimeGuard() {
        long count = inFlightGuards.incrementAndGet();
        logger.trace("Acquired no-advance-time guard ({} in flight)", count);
        return new NoAdvanceTimeGuard(this);
    }

    /**
     * Gets the number of guards that have been acquired and not yet released.
     *
     * @return The number of in-flight guards
     */
    public long inFlightGuards() {
        return inFlightGuards.get();
    }

    /**
     * Returns true if no guard is currently held.
     */
    public boolean isTimeAdvanceAllowed() {
        return inFlightGuards.get() == 0;
    }

    void release() {
        long count = inFlightGuards.decrementAndGet();
        if (count < 0) {
            // A guard releases its count once, so this means the counter was corrupted.
            logger.error("No-advance-time guard count went negative: {}", count);
        } else {
            logger.trace("Released no-advance-time guard ({} in flight)", count);
        }
    }
}
