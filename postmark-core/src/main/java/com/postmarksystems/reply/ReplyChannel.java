package com.postmarksystems.reply;

import java.util.concurrent.CompletableFuture;

/**
 * A single-use channel carrying at most one reply from a handler back to the sender
 * of the message.
 *
 * @param sender   The end moved into the envelope
 * @param receiver The end handed back to the caller
 * @param <T>      The reply type
 */
public record ReplyChannel<T>(ReplySender<T> sender, ReplyReceiver<T> receiver) {

    /**
     * Opens a fresh channel.
     *
     * @param <T> The reply type
     * @return A connected sender/receiver pair
     */
    public static <T> ReplyChannel<T> open() {
        CompletableFuture<T> future = new CompletableFuture<>();
        return new ReplyChannel<>(new ReplySender<>(future), new PendingReply<>(future));
    }
}
