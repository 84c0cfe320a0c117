package com.postmarksystems.envelope;

import com.postmarksystems.Actor;
import com.postmarksystems.ActorContext;
import com.postmarksystems.scheduler.NoAdvanceTimeGuard;

import java.lang.ref.Cleaner;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * An {@code Envelope} captures the handler of a message and hides the message type.
 *
 * <p>Messages can have different types but still need to be pushed to a queue with a
 * single element type. Before enqueueing, the right handler is captured together with the
 * message and its reply channel, and only the envelope goes into the mailbox.</p>
 *
 * <p>An envelope may hold a {@link NoAdvanceTimeGuard}. The guard stays held for as long as
 * the envelope lives and is released by {@link #close()}. An envelope that becomes
 * unreachable without being closed is released by a {@link Cleaner}; an undispatched
 * payload is dropped at the same time, resolving the sender's receiver to "no reply".</p>
 *
 * <p>Envelopes are built by {@link Envelopes#wrap}.</p>
 *
 * @param <A> The actor type
 */
public final class Envelope<A extends Actor> implements AutoCloseable {

    /**
     * Debug text of an envelope whose payload is gone.
     */
    public static final String CONSUMED_MARKER = "<consumed>";

    private static final Cleaner CLEANER = Cleaner.create();

    private static final Map<Class<?>, Class<?>> WRAPPERS = Map.of(
        boolean.class, Boolean.class,
        byte.class, Byte.class,
        char.class, Character.class,
        short.class, Short.class,
        int.class, Integer.class,
        long.class, Long.class,
        float.class, Float.class,
        double.class, Double.class,
        void.class, Void.class);

    private final HandlerEnvelope<A> handlerEnvelope;
    private final Cleaner.Cleanable cleanable;

    Envelope(HandlerEnvelope<A> handlerEnvelope, NoAdvanceTimeGuard noAdvanceTimeGuard) {
        this.handlerEnvelope = handlerEnvelope;
        this.cleanable = CLEANER.register(this, new Release(handlerEnvelope, noAdvanceTimeGuard));
    }

    /**
     * Returns the message, removing it from the envelope.
     *
     * <p>This method is only useful in unit tests.</p>
     *
     * @return The message, or an empty Optional if it was already consumed
     */
    public Optional<Object> message() {
        return handlerEnvelope.takeMessage();
    }

    /**
     * Returns the message as the given type, removing it from the envelope.
     * The message is consumed even if it is not of the requested type. A primitive class
     * matches its wrapper, so {@code message(int.class)} returns a boxed {@code Integer}.
     *
     * @param type The expected message class
     * @param <M>  The expected message type
     * @return The message, or an empty Optional if it was consumed or has another type
     */
    @SuppressWarnings("unchecked")
    public <M> Optional<M> message(Class<M> type) {
        Class<?> boxed = type.isPrimitive() ? WRAPPERS.get(type) : type;
        return message()
            .filter(boxed::isInstance)
            .map(message -> (M) message);
    }

    /**
     * Executes the captured handler against the actor.
     * Must be called at most once per envelope; the returned future fails with the handler's error,
     * typically an {@link com.postmarksystems.ActorExitStatus}, unchanged.
     *
     * @param actor   The actor owning the state
     * @param context The execution context passed to the handler
     * @return A future completing once the handler is done and the reply was sent
     * @throws EnvelopeConsumedException if the message was already consumed
     */
    public CompletableFuture<Void> dispatch(A actor, ActorContext<A> context) {
        return handlerEnvelope.handleMessage(actor, context);
    }

    /**
     * Returns true once the message was handled, extracted or discarded.
     */
    public boolean isConsumed() {
        return handlerEnvelope.isConsumed();
    }

    /**
     * Ends the envelope's lifetime: drops the message if it was never handled and releases
     * the no-advance-time guard. Calling it again has no effect.
     */
    @Override
    public void close() {
        cleanable.clean();
    }

    @Override
    public String toString() {
        return "Envelope(" + handlerEnvelope.debugMessage() + ")";
    }

    // Must not reference the envelope, otherwise the Cleaner would never run.
    private static final class Release implements Runnable {
        private final HandlerEnvelope<?> handlerEnvelope;
        private final NoAdvanceTimeGuard noAdvanceTimeGuard;

        Release(HandlerEnvelope<?> handlerEnvelope, NoAdvanceTimeGuard noAdvanceTimeGuard) {
            this.handlerEnvelope = handlerEnvelope;
            this.noAdvanceTimeGuard = noAdvanceTimeGuard;
        }

        @Override
        public void run() {
            handlerEnvelope.discard();
            if (noAdvanceTimeGuard != null) {
                noAdvanceTimeGuard.close();
            }
        }
    }
}
