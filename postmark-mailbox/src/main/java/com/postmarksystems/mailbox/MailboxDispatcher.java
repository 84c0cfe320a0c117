package com.postmarksystems.mailbox;

import com.postmarksystems.Actor;
import com.postmarksystems.ActorContext;
import com.postmarksystems.ActorExitStatus;
import com.postmarksystems.envelope.Envelope;
import com.postmarksystems.mailbox.config.DispatcherConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.TimeUnit;

/**
 * Runs an actor's envelopes one at a time.
 *
 * <p>Each envelope is dispatched and awaited before the next one is taken, and is closed
 * whatever the outcome, which releases its no-advance-time guard. The first failing handler
 * ends the loop: an {@link ActorExitStatus} is recorded as is, anything else is recorded as
 * {@link ActorExitStatus.Kind#PANICKED}. Envelopes still queued at that point are closed
 * without being handled.</p>
 *
 * <p>The loop can run on its own thread ({@link #start()}) or be stepped by the caller
 * ({@link #processNext(long, TimeUnit)}), but not both.</p>
 *
 * @param <A> The actor type
 */
public class MailboxDispatcher<A extends Actor> {
    private static final Logger logger = LoggerFactory.getLogger(MailboxDispatcher.class);

    private final A actor;
    private final ActorContext<A> context;
    private final ActorMailbox<A> mailbox;
    private final DispatcherConfig config;
    private final CompletableFuture<ActorExitStatus> exitStatus = new CompletableFuture<>();

    private volatile boolean running = false;
    private volatile Thread thread;

    /**
     * Creates a dispatcher.
     *
     * @param actor   The actor whose state the handlers operate on
     * @param context The context passed to every handler
     * @param mailbox The mailbox to take envelopes from
     * @param config  Thread and polling settings
     */
    public MailboxDispatcher(A actor, ActorContext<A> context, ActorMailbox<A> mailbox, DispatcherConfig config) {
        this.actor = Objects.requireNonNull(actor, "actor");
        this.context = Objects.requireNonNull(context, "context");
        this.mailbox = Objects.requireNonNull(mailbox, "mailbox");
        this.config = Objects.requireNonNull(config, "config");
    }

    /**
     * Starts the dispatch loop on a thread from the configured thread factory.
     */
    public synchronized void start() {
        if (running) {
            logger.debug("Actor {} dispatcher already running", context.getActorId());
            return;
        }
        if (exitStatus.isDone()) {
            throw new IllegalStateException("Actor " + context.getActorId() + " already exited");
        }
        running = true;
        logger.info("Starting actor {} ({})", context.getActorId(), actor.name());
        thread = config.createThreadFactory(context.getActorId()).newThread(this::dispatchLoop);
        thread.start();
    }

    /**
     * Kills the actor: stops the loop after the envelope in progress, if any, and closes
     * the mailbox.
     *
     * <p>When the loop runs on its own thread, that thread closes the mailbox on its way out,
     * so the queue keeps a single consumer. The status may complete after this method returns
     * if the handler in progress ignores the interrupt.</p>
     */
    public void stop() {
        Thread current;
        synchronized (this) {
            running = false;
            current = thread;
            thread = null;
        }
        if (current == null || Thread.currentThread() == current) {
            exit(ActorExitStatus.killed());
            return;
        }
        current.interrupt();
        try {
            current.join(TimeUnit.SECONDS.toMillis(1));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        if (current.isAlive()) {
            logger.warn("Actor {} dispatcher did not stop within 1s", context.getActorId());
        }
    }

    /**
     * Takes the next envelope, waiting up to the given time, and dispatches it.
     *
     * @return true if an envelope was handled, false if none arrived or the actor exited
     * @throws InterruptedException if interrupted while waiting for an envelope
     */
    public boolean processNext(long timeout, TimeUnit unit) throws InterruptedException {
        if (exitStatus.isDone()) {
            return false;
        }
        Envelope<A> next = mailbox.poll(timeout, unit);
        if (next == null) {
            return false;
        }
        dispatch(next);
        return true;
    }

    /**
     * Gets the exit status, completed once the actor stopped processing messages.
     */
    public CompletableFuture<ActorExitStatus> exitStatus() {
        return exitStatus;
    }

    public boolean isRunning() {
        return running;
    }

    private void dispatchLoop() {
        try {
            while (running && !exitStatus.isDone()) {
                processNext(config.getPollTimeoutMs(), TimeUnit.MILLISECONDS);
            }
        } catch (InterruptedException e) {
            logger.debug("Actor {} dispatcher interrupted", context.getActorId());
            Thread.currentThread().interrupt();
        } finally {
            running = false;
            // No-op when a handler already ended the actor.
            exit(ActorExitStatus.killed());
        }
    }

    private void dispatch(Envelope<A> next) {
        try (Envelope<A> envelope = next) {
            logger.trace("Actor {} handling {}", context.getActorId(), envelope);
            envelope.dispatch(actor, context).join();
        } catch (CompletionException e) {
            exit(toExitStatus(e.getCause() != null ? e.getCause() : e));
        } catch (RuntimeException e) {
            exit(toExitStatus(e));
        } catch (Error e) {
            exit(toExitStatus(e));
            if (e instanceof VirtualMachineError) {
                throw e;
            }
        }
    }

    private ActorExitStatus toExitStatus(Throwable error) {
        if (error instanceof ActorExitStatus status) {
            return status;
        }
        logger.error("Actor {} handler failed unexpectedly", context.getActorId(), error);
        return ActorExitStatus.panicked(error);
    }

    private void exit(ActorExitStatus status) {
        if (!exitStatus.complete(status)) {
            return;
        }
        running = false;
        if (status.isSuccess()) {
            logger.info("Actor {} exited: {}", context.getActorId(), status.getKind());
        } else {
            logger.warn("Actor {} exited: {}", context.getActorId(), status.getMessage());
        }
        mailbox.close();
    }
}
