package com.postmarksystems;

import com.postmarksystems.scheduler.Scheduler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Execution context handed to handlers together with the actor.
 * Envelopes pass it through untouched; only handlers look inside.
 *
 * @param <A> The type of actor this context belongs to
 */
public final class ActorContext<A extends Actor> {

    private final String actorId;
    private final Scheduler scheduler;
    private final Logger logger;

    /**
     * Creates a new context.
     *
     * @param actorId   The ID of the actor
     * @param scheduler The scheduler the actor's messages are tracked by
     */
    public ActorContext(String actorId, Scheduler scheduler) {
        this.actorId = Objects.requireNonNull(actorId, "actorId");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.logger = LoggerFactory.getLogger("postmark.actor." + actorId);
    }

    /**
     * Gets the actor ID.
     *
     * @return The actor ID
     */
    public String getActorId() {
        return actorId;
    }

    /**
     * Gets the scheduler in charge of (virtual) time for this actor.
     *
     * @return The scheduler
     */
    public Scheduler getScheduler() {
        return scheduler;
    }

    /**
     * Gets a logger for this actor with the actor ID as context.
     *
     * @return A logger instance configured for this actor
     */
    public Logger getLogger() {
        return logger;
    }

    @Override
    public String toString() {
        return "ActorContext(" + actorId + ")";
    }
}
