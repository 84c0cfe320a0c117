package com.postmarksystems.envelope;

import com.postmarksystems.Actor;
import com.postmarksystems.handler.Handler;
import com.postmarksystems.reply.ReplyChannel;
import com.postmarksystems.scheduler.NoAdvanceTimeGuard;

import java.util.Objects;

/**
 * The only way to build an {@link Envelope}.
 */
public final class Envelopes {

    private Envelopes() {
    }

    /**
     * Wraps a message without a no-advance-time guard.
     *
     * @see #wrap(Object, Handler, NoAdvanceTimeGuard)
     */
    public static <A extends Actor, M, R> WrappedEnvelope<A, R> wrap(M message, Handler<A, M, R> handler) {
        return wrap(message, handler, null);
    }

    /**
     * Wraps a message and the handler that will process it.
     *
     * @param message            The message
     * @param handler            The handler for this message type
     * @param noAdvanceTimeGuard A guard to hold for the envelope's lifetime, or null
     * @return The envelope for the mailbox and the receiver for the caller
     */
    public static <A extends Actor, M, R> WrappedEnvelope<A, R> wrap(
            M message,
            Handler<A, M, R> handler,
            NoAdvanceTimeGuard noAdvanceTimeGuard) {
        Objects.requireNonNull(message, "Message cannot be null");
        Objects.requireNonNull(handler, "Handler cannot be null");
        ReplyChannel<R> channel = ReplyChannel.open();
        LoadedEnvelope<A, M, R> handlerEnvelope = new LoadedEnvelope<>(channel.sender(), message, handler);
        Envelope<A> envelope = new Envelope<>(handlerEnvelope, noAdvanceTimeGuard);
        return new WrappedEnvelope<>(envelope, channel.receiver());
    }
}
