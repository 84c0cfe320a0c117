package com.postmarksystems.reply;

import java.util.concurrent.CompletableFuture;

/**
 * Sending end of a {@link ReplyChannel}. Never blocks, and never fails loudly when
 * nobody is listening anymore.
 *
 * @param <T> The reply type
 */
public final class ReplySender<T> {

    private final CompletableFuture<T> future;

    ReplySender(CompletableFuture<T> future) {
        this.future = future;
    }

    /**
     * Delivers the reply.
     *
     * @param value The reply
     * @return false if the receiver was dropped or the channel was already used
     */
    public boolean send(T value) {
        return future.complete(value);
    }

    /**
     * Drops this end without sending; the receiver resolves to {@link NoReplyException}.
     */
    public void drop() {
        future.completeExceptionally(new NoReplyException("Reply sender dropped"));
    }

    /**
     * Returns true if the receiving end was dropped and any reply would be discarded.
     */
    public boolean isReceiverDropped() {
        return future.isCancelled();
    }
}
