package com.cellgraph.api;

import java.util.Objects;
import java.util.function.Function;

/**
 * Outcome of a synchronous computation: a value or the error it raised.
 *
 * Produced by safe derived nodes, whose compute errors never reach the reader.
 * Equality is structural for {@link Success} and by error instance for
 * {@link Failure}, so two failures raised by different evaluations always
 * count as a change.
 *
 * @param <T> the value type.
 */
public interface Result<T> {

    static <T> Result<T> success(T value) {
        return new Success<>(value);
    }

    static <T> Result<T> failure(Throwable error) {
        return new Failure<>(error);
    }

    boolean isSuccess();

    default boolean isFailure() {
        return !isSuccess();
    }

    /** Returns the value, or null on failure. */
    T valueOrNull();

    /**
     * Returns the value, or rethrows the captured error. Checked errors are
     * wrapped in an {@link IllegalStateException}.
     */
    T requireValue();

    /** Returns the value, or {@code fallback} on failure. */
    T getOrElse(T fallback);

    /** Deconstructs the result. */
    <R> R when(Function<? super T, ? extends R> success, Function<? super Throwable, ? extends R> failure);

    /**
     * Transforms a success; a failure is passed through. An error raised by
     * {@code transform} becomes a failure.
     */
    <R> Result<R> map(Function<? super T, ? extends R> transform);

    record Success<T>(T value) implements Result<T> {

        @Override
        public boolean isSuccess() {
            return true;
        }

        @Override
        public T valueOrNull() {
            return value;
        }

        @Override
        public T requireValue() {
            return value;
        }

        @Override
        public T getOrElse(T fallback) {
            return value;
        }

        @Override
        public <R> R when(Function<? super T, ? extends R> success, Function<? super Throwable, ? extends R> failure) {
            return success.apply(value);
        }

        @Override
        public <R> Result<R> map(Function<? super T, ? extends R> transform) {
            try {
                return new Success<>(transform.apply(value));
            } catch (RuntimeException e) {
                return new Failure<>(e);
            }
        }
    }

    /**
     * A captured error. The trace is the error's own stack trace.
     */
    record Failure<T>(Throwable error) implements Result<T> {

        public Failure {
            Objects.requireNonNull(error, "error");
        }

        public StackTraceElement[] trace() {
            return error.getStackTrace();
        }

        @Override
        public boolean isSuccess() {
            return false;
        }

        @Override
        public T valueOrNull() {
            return null;
        }

        @Override
        public T requireValue() {
            if (error instanceof RuntimeException re)
                throw re;
            if (error instanceof Error e)
                throw e;
            throw new IllegalStateException("Computation failed", error);
        }

        @Override
        public T getOrElse(T fallback) {
            return fallback;
        }

        @Override
        public <R> R when(Function<? super T, ? extends R> success, Function<? super Throwable, ? extends R> failure) {
            return failure.apply(error);
        }

        @Override
        public <R> Result<R> map(Function<? super T, ? extends R> transform) {
            return new Failure<>(error);
        }
    }
}
