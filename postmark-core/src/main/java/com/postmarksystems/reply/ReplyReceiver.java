package com.postmarksystems.reply;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeoutException;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Receiving end of a {@link ReplyChannel}: yields the handler's reply, or an indication
 * ({@link NoReplyException}) that no reply will ever arrive.
 * Provides three tiers of API:
 * 1. Simple: get() - just blocks and returns value
 * 2. Safe: await() - returns Result for pattern matching
 * 3. Advanced: future() - access underlying CompletableFuture
 */
public interface ReplyReceiver<T> {

    // ========== TIER 1: SIMPLE API ==========

    /**
     * Blocks until the reply is available and returns it.
     * @throws NoReplyException if the sender was dropped
     * @throws ReplyException if waiting fails for another reason
     */
    T get();

    /**
     * Blocks until the reply is available or the timeout expires.
     * @throws TimeoutException if the timeout expires before the reply
     * @throws ReplyException if waiting fails
     */
    T get(Duration timeout) throws TimeoutException;

    // ========== TIER 2: SAFE API ==========

    /**
     * Blocks until the reply is available and returns a Result.
     */
    Result<T> await();

    /**
     * Blocks until the reply is available or the timeout expires.
     * Returns a Result holding a TimeoutException on timeout.
     */
    Result<T> await(Duration timeout);

    /**
     * Non-blocking check. Returns an empty Optional if nothing arrived yet.
     */
    Optional<Result<T>> poll();

    // ========== TIER 3: ADVANCED API ==========

    /**
     * Access the underlying CompletableFuture for composition.
     */
    CompletableFuture<T> future();

    /**
     * Transform the reply value when it arrives.
     */
    <U> ReplyReceiver<U> map(Function<T, U> fn);

    /**
     * Register callbacks for success and failure. Non-blocking.
     */
    void onComplete(Consumer<T> onSuccess, Consumer<Throwable> onFailure);

    /**
     * Abandons interest in the reply. A reply sent afterwards is silently discarded.
     */
    void drop();

    /**
     * Returns true if the reply arrived, the sender was dropped, or this end was dropped.
     */
    boolean isDone();
}
