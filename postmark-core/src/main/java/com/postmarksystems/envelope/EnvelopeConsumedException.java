package com.postmarksystems.envelope;

/**
 * Thrown when an envelope is handled after its payload was already consumed.
 * This is a bug in the caller's dispatch loop, not a condition to recover from.
 */
public class EnvelopeConsumedException extends IllegalStateException {

    public EnvelopeConsumedException(String message) {
        super(message);
    }
}
