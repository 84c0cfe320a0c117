package com.postmarksystems.reply;

/**
 * Signals that the sending end of a reply channel was dropped, so no reply will ever arrive.
 * This happens when a message is discarded before dispatch or when its handler fails.
 */
public class NoReplyException extends ReplyException {

    public NoReplyException(String message) {
        super(message);
    }
}
