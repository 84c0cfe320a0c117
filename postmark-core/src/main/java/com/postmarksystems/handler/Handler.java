package com.postmarksystems.handler;

import com.postmarksystems.Actor;
import com.postmarksystems.ActorContext;
import com.postmarksystems.ActorExitStatus;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;

/**
 * Handles one payload type for one actor type and produces the reply for it.
 * A handler instance is what ties a message type {@code M} to its reply type {@code R}
 * for actors of type {@code A}.
 *
 * <p>Example:</p>
 * <pre>{@code
 * record Increment(int amount) {}
 *
 * Handler<Counter, Increment, Integer> increment = Handler.sync((counter, msg, ctx) -> {
 *     counter.count += msg.amount();
 *     return counter.count;
 * });
 * }</pre>
 *
 * @param <A> The actor type
 * @param <M> The payload type
 * @param <R> The reply type
 */
@FunctionalInterface
public interface Handler<A extends Actor, M, R> {

    /**
     * Handles a message. The returned stage completes with the reply, or exceptionally
     * with an {@link ActorExitStatus} when the actor should terminate.
     *
     * @param actor   The actor owning the state
     * @param message The message to process
     * @param context The execution context of the actor
     * @return A stage completing with the reply
     * @throws ActorExitStatus if the handler decides to terminate the actor right away
     */
    CompletionStage<R> handle(A actor, M message, ActorContext<A> context) throws ActorExitStatus;

    /**
     * Adapts a handler that computes its reply immediately.
     *
     * @param handler The synchronous handler
     * @return An asynchronous handler completing with the computed reply
     */
    static <A extends Actor, M, R> Handler<A, M, R> sync(SyncHandler<A, M, R> handler) {
        return (actor, message, context) ->
            CompletableFuture.completedFuture(handler.handle(actor, message, context));
    }

    /**
     * A handler whose reply is available as soon as it returns.
     */
    @FunctionalInterface
    interface SyncHandler<A extends Actor, M, R> {
        R handle(A actor, M message, ActorContext<A> context) throws ActorExitStatus;
    }
}
