package com.postmarksystems.envelope;

import com.postmarksystems.Actor;
import com.postmarksystems.ActorContext;

import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * The part of an envelope that knows the concrete payload type and hides it from the
 * mailbox. There is one implementation per (payload, actor) pairing, created by
 * {@link Envelopes}, but the queue only ever sees this interface.
 *
 * @param <A> The actor type
 */
interface HandlerEnvelope<A extends Actor> {

    /**
     * Describes the payload, or returns {@link Envelope#CONSUMED_MARKER} once it is gone.
     */
    String debugMessage();

    /**
     * Removes the payload and drops the reply sender.
     * Only useful for tests and diagnostics.
     *
     * @return The payload, or an empty Optional if it was already consumed
     */
    Optional<Object> takeMessage();

    /**
     * Removes the payload together with its reply sender and runs the captured handler.
     *
     * @throws EnvelopeConsumedException if the payload was already consumed
     */
    CompletableFuture<Void> handleMessage(A actor, ActorContext<A> context);

    /**
     * Drops the payload and its reply sender without handling, if they are still there.
     */
    void discard();

    boolean isConsumed();
}
