package com.postmarksystems.envelope;

import com.postmarksystems.Actor;
import com.postmarksystems.reply.ReplyReceiver;

/**
 * The two halves produced when a message is wrapped: the envelope goes to the mailbox,
 * the receiver stays with whoever sent the message.
 *
 * @param envelope The envelope to enqueue
 * @param receiver The end awaiting the handler's reply
 * @param <A>      The actor type
 * @param <R>      The reply type
 */
public record WrappedEnvelope<A extends Actor, R>(Envelope<A> envelope, ReplyReceiver<R> receiver) {}
