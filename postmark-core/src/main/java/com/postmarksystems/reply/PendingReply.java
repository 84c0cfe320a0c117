package com.postmarksystems.reply;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Implementation of ReplyReceiver backed by CompletableFuture.
 */
record PendingReply<T>(CompletableFuture<T> future) implements ReplyReceiver<T> {

    @Override
    public T get() {
        try {
            return future.join();
        } catch (CompletionException e) {
            throw unwrap(e.getCause());
        } catch (CancellationException e) {
            throw new ReplyException("Reply receiver was dropped", e);
        }
    }

    @Override
    public T get(Duration timeout) throws TimeoutException {
        try {
            return future.get(timeout.toNanos(), TimeUnit.NANOSECONDS);
        } catch (TimeoutException e) {
            throw e;
        } catch (ExecutionException e) {
            throw unwrap(e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ReplyException("Interrupted while waiting for reply", e);
        } catch (CancellationException e) {
            throw new ReplyException("Reply receiver was dropped", e);
        }
    }

    @Override
    public Result<T> await() {
        try {
            return Result.success(future.join());
        } catch (CompletionException e) {
            return Result.failure(e.getCause());
        } catch (Exception e) {
            return Result.failure(e);
        }
    }

    @Override
    public Result<T> await(Duration timeout) {
        try {
            T value = future.get(timeout.toNanos(), TimeUnit.NANOSECONDS);
            return Result.success(value);
        } catch (TimeoutException e) {
            return Result.failure(e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return Result.failure(e);
        } catch (Exception e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            return Result.failure(cause);
        }
    }

    @Override
    public Optional<Result<T>> poll() {
        if (!future.isDone()) {
            return Optional.empty();
        }
        return Optional.of(await());
    }

    @Override
    public <U> ReplyReceiver<U> map(Function<T, U> fn) {
        return new PendingReply<>(future.thenApply(fn));
    }

    @Override
    public void onComplete(Consumer<T> onSuccess, Consumer<Throwable> onFailure) {
        future.whenComplete((value, error) -> {
            if (error != null) {
                Throwable cause = error instanceof CompletionException
                    ? error.getCause()
                    : error;
                onFailure.accept(cause);
            } else {
                onSuccess.accept(value);
            }
        });
    }

    @Override
    public void drop() {
        future.cancel(false);
    }

    @Override
    public boolean isDone() {
        return future.isDone();
    }

    private static ReplyException unwrap(Throwable cause) {
        if (cause instanceof ReplyException re) {
            return re;
        }
        return new ReplyException("Reply failed", cause);
    }
}
