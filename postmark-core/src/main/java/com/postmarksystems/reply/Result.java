package com.postmarksystems.reply;

import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Outcome of waiting on a reply, for callers that prefer values over exceptions.
 * Sealed to ensure exhaustive matching.
 */
public sealed interface Result<T> permits Result.Success, Result.Failure {

    /**
     * Successful result containing the reply.
     */
    record Success<T>(T value) implements Result<T> {
        @Override
        public boolean isSuccess() {
            return true;
        }

        @Override
        public T getOrThrow() {
            return value;
        }

        @Override
        public T getOrElse(T defaultValue) {
            return value;
        }
    }

    /**
     * Failed result. The error is a {@link NoReplyException} when no reply will ever arrive.
     */
    record Failure<T>(Throwable error) implements Result<T> {
        @Override
        public boolean isSuccess() {
            return false;
        }

        @Override
        public T getOrThrow() {
            if (error instanceof RuntimeException re) {
                throw re;
            }
            throw new ReplyException("Reply failed", error);
        }

        @Override
        public T getOrElse(T defaultValue) {
            return defaultValue;
        }
    }

    boolean isSuccess();

    T getOrThrow();

    T getOrElse(T defaultValue);

    default <U> Result<U> map(Function<T, U> fn) {
        if (this instanceof Success<T> success) {
            try {
                return new Success<>(fn.apply(success.value()));
            } catch (Exception e) {
                return new Failure<>(e);
            }
        }
        return new Failure<>(((Failure<T>) this).error());
    }

    default <U> Result<U> flatMap(Function<T, Result<U>> fn) {
        if (this instanceof Success<T> success) {
            try {
                return fn.apply(success.value());
            } catch (Exception e) {
                return new Failure<>(e);
            }
        }
        return new Failure<>(((Failure<T>) this).error());
    }

    default Result<T> recover(Function<Throwable, T> fn) {
        if (this instanceof Failure<T> failure) {
            try {
                return new Success<>(fn.apply(failure.error()));
            } catch (Exception e) {
                return new Failure<>(e);
            }
        }
        return this;
    }

    default void ifSuccess(Consumer<T> consumer) {
        if (this instanceof Success<T> success) {
            consumer.accept(success.value());
        }
    }

    default void ifFailure(Consumer<Throwable> consumer) {
        if (this instanceof Failure<T> failure) {
            consumer.accept(failure.error());
        }
    }

    static <T> Result<T> success(T value) {
        return new Success<>(value);
    }

    static <T> Result<T> failure(Throwable error) {
        return new Failure<>(error);
    }
}
