package com.postmarksystems;

import java.util.Objects;

/**
 * Termination signal returned by handlers.
 * Dispatch propagates it verbatim; deciding what it means for the actor is up to the
 * loop running the actor.
 */
public class ActorExitStatus extends Exception {

    /**
     * The different ways an actor can exit.
     */
    public enum Kind {
        /** The actor finished its work. */
        SUCCESS,
        /** The actor was asked to quit. */
        QUIT,
        /** A downstream actor is gone, so there is no point in going on. */
        DOWNSTREAM_CLOSED,
        /** The actor was killed from the outside. */
        KILLED,
        /** The handler failed. */
        FAILURE,
        /** The handler threw something it was not supposed to. */
        PANICKED
    }

    private final Kind kind;

    private ActorExitStatus(Kind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = Objects.requireNonNull(kind, "kind");
    }

    public static ActorExitStatus success() {
        return new ActorExitStatus(Kind.SUCCESS, "success", null);
    }

    public static ActorExitStatus quit() {
        return new ActorExitStatus(Kind.QUIT, "quit", null);
    }

    public static ActorExitStatus downstreamClosed() {
        return new ActorExitStatus(Kind.DOWNSTREAM_CLOSED, "downstream actor closed", null);
    }

    public static ActorExitStatus killed() {
        return new ActorExitStatus(Kind.KILLED, "killed", null);
    }

    public static ActorExitStatus failure(String message) {
        return new ActorExitStatus(Kind.FAILURE, message, null);
    }

    public static ActorExitStatus failure(String message, Throwable cause) {
        return new ActorExitStatus(Kind.FAILURE, message, cause);
    }

    public static ActorExitStatus panicked(Throwable cause) {
        return new ActorExitStatus(Kind.PANICKED, "panicked: " + cause, cause);
    }

    /**
     * Gets the kind of exit.
     *
     * @return The exit kind
     */
    public Kind getKind() {
        return kind;
    }

    /**
     * Returns true if the actor exited without an error.
     */
    public boolean isSuccess() {
        return kind == Kind.SUCCESS;
    }

    @Override
    public String toString() {
        return "ActorExitStatus(" + kind + ": " + getMessage() + ")";
    }
}
