package com.postmarksystems.envelope;

import com.postmarksystems.Actor;
import com.postmarksystems.ActorContext;
import com.postmarksystems.handler.Handler;
import com.postmarksystems.reply.ReplySender;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Holds one payload and the sender of its reply until something consumes them.
 * Every consuming operation goes through the same atomic removal of the slot, so the
 * pair can leave the envelope only once.
 *
 * @param <A> The actor type
 * @param <M> The payload type
 * @param <R> The reply type
 */
final class LoadedEnvelope<A extends Actor, M, R> implements HandlerEnvelope<A> {
    private static final Logger logger = LoggerFactory.getLogger(LoadedEnvelope.class);

    private record Slot<M, R>(ReplySender<R> replySender, M message) {}

    private final Handler<A, M, R> handler;
    private final AtomicReference<Slot<M, R>> slot;

    LoadedEnvelope(ReplySender<R> replySender, M message, Handler<A, M, R> handler) {
        this.handler = handler;
        this.slot = new AtomicReference<>(new Slot<>(replySender, message));
    }

    @Override
    public String debugMessage() {
        Slot<M, R> current = slot.get();
        if (current == null) {
            return Envelope.CONSUMED_MARKER;
        }
        M message = current.message();
        try {
            return String.valueOf(message);
        } catch (RuntimeException e) {
            logger.debug("toString of {} failed", message.getClass().getName(), e);
            return message.getClass().getName() + "@" + Integer.toHexString(System.identityHashCode(message))
                + " (toString failed)";
        }
    }

    @Override
    public Optional<Object> takeMessage() {
        Slot<M, R> taken = slot.getAndSet(null);
        if (taken == null) {
            return Optional.empty();
        }
        taken.replySender().drop();
        return Optional.of(taken.message());
    }

    @Override
    public CompletableFuture<Void> handleMessage(A actor, ActorContext<A> context) {
        Slot<M, R> taken = slot.getAndSet(null);
        if (taken == null) {
            throw new EnvelopeConsumedException("handleMessage should never be called twice");
        }
        ReplySender<R> replySender = taken.replySender();
        CompletionStage<R> response;
        try {
            response = Objects.requireNonNull(
                handler.handle(actor, taken.message(), context),
                "handler returned a null stage");
        } catch (Throwable e) {
            // Errors included: the receiver must resolve whatever way the handler ends.
            replySender.drop();
            return CompletableFuture.failedFuture(e);
        }

        CompletableFuture<Void> handled = new CompletableFuture<>();
        response.whenComplete((reply, error) -> {
            if (error != null) {
                replySender.drop();
                handled.completeExceptionally(unwrap(error));
                return;
            }
            // A false return is fine here: the caller did not wait for the reply.
            replySender.send(reply);
            handled.complete(null);
        });
        return handled;
    }

    @Override
    public void discard() {
        Slot<M, R> taken = slot.getAndSet(null);
        if (taken != null) {
            logger.debug("Discarding unhandled message {}", taken.message());
            taken.replySender().drop();
        }
    }

    @Override
    public boolean isConsumed() {
        return slot.get() == null;
    }

    private static Throwable unwrap(Throwable error) {
        if (error instanceof CompletionException && error.getCause() != null) {
            return error.getCause();
        }
        return error;
    }
}
