package com.postmarksystems.reply;

/**
 * Unchecked exception thrown when waiting on a reply fails.
 */
public class ReplyException extends RuntimeException {

    public ReplyException(String message) {
        super(message);
    }

    public ReplyException(String message, Throwable cause) {
        super(message, cause);
    }
}
