package com.postmarksystems;

/**
 * Capability implemented by every actor that receives messages through envelopes.
 * An actor owns its per-instance state; the messages it understands, and the reply
 * type for each of them, are declared by the {@link com.postmarksystems.handler.Handler}
 * instances registered against it.
 */
public interface Actor {

    /**
     * Gets a human-readable name for this actor, used for logging and thread names.
     *
     * @return The actor name
     */
    default String name() {
        return getClass().getSimpleName();
    }
}
