package com.postmarksystems.mailbox;

import com.postmarksystems.Actor;
import com.postmarksystems.envelope.Envelope;
import com.postmarksystems.envelope.Envelopes;
import com.postmarksystems.envelope.WrappedEnvelope;
import com.postmarksystems.handler.Handler;
import com.postmarksystems.mailbox.config.DispatcherConfig;
import com.postmarksystems.reply.ReplyReceiver;
import com.postmarksystems.scheduler.Scheduler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * Sending side of an actor's mailbox.
 *
 * <p>Every message is wrapped in an {@link Envelope} holding a no-advance-time guard from the
 * actor's {@link Scheduler}, so simulated time stands still until the envelope is done with.
 * Once the mailbox is closed, new envelopes are closed right away and their receivers
 * resolve to {@link com.postmarksystems.reply.NoReplyException}.</p>
 *
 * @param <A> The actor type
 */
public class ActorMailbox<A extends Actor> {
    private static final Logger logger = LoggerFactory.getLogger(ActorMailbox.class);

    private final String actorId;
    private final Scheduler scheduler;
    private final Mailbox<Envelope<A>> queue;
    private volatile boolean closed = false;

    /**
     * Creates a mailbox backed by an {@link MpscMailbox} sized from the given config.
     */
    public ActorMailbox(String actorId, Scheduler scheduler, DispatcherConfig config) {
        this(actorId, scheduler, new MpscMailbox<>(config.getInitialCapacity()));
    }

    public ActorMailbox(String actorId, Scheduler scheduler, Mailbox<Envelope<A>> queue) {
        this.actorId = Objects.requireNonNull(actorId, "actorId");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.queue = Objects.requireNonNull(queue, "queue");
    }

    /**
     * Sends a message and returns the receiver for its reply.
     *
     * @param message The message
     * @param handler The handler that will process it
     * @return The receiver resolving to the handler's reply
     */
    public <M, R> ReplyReceiver<R> ask(M message, Handler<A, M, R> handler) {
        WrappedEnvelope<A, R> wrapped = Envelopes.wrap(message, handler, scheduler.noAdvanceTimeGuard());
        enqueue(wrapped.envelope());
        return wrapped.receiver();
    }

    /**
     * Sends a message without waiting for its reply.
     */
    public <M> void tell(M message, Handler<A, M, ?> handler) {
        ask(message, handler).drop();
    }

    private void enqueue(Envelope<A> envelope) {
        if (closed) {
            logger.debug("Actor {} mailbox is closed, dropping {}", actorId, envelope);
            envelope.close();
            return;
        }
        if (!queue.offer(envelope)) {
            logger.warn("Actor {} mailbox refused {}", actorId, envelope);
            envelope.close();
            return;
        }
        // close() may have drained the queue between the check above and the offer.
        if (closed) {
            drainAndClose();
        }
    }

    Envelope<A> poll(long timeout, TimeUnit unit) throws InterruptedException {
        return queue.poll(timeout, unit);
    }

    /**
     * Closes the mailbox and every envelope still waiting in it.
     * Must only be called once nothing polls the mailbox anymore.
     */
    public void close() {
        closed = true;
        int dropped = drainAndClose();
        logger.debug("Closed actor {} mailbox, dropped {} pending envelopes", actorId, dropped);
    }

    private synchronized int drainAndClose() {
        List<Envelope<A>> pending = new ArrayList<>();
        queue.drainTo(pending, Integer.MAX_VALUE);
        for (Envelope<A> envelope : pending) {
            envelope.close();
        }
        return pending.size();
    }

    public boolean isClosed() {
        return closed;
    }

    public int size() {
        return queue.size();
    }

    public String getActorId() {
        return actorId;
    }
}
