package com.cellgraph.api;

import java.util.Objects;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Tri-state value of an async derived node.
 *
 * {@link Loading} optionally carries the last successful value so consumers can
 * keep showing stale data while a recomputation is in flight.
 *
 * @param <T> the value type.
 */
public interface AsyncValue<T> {

    static <T> AsyncValue<T> loading() {
        return new Loading<>(null);
    }

    static <T> AsyncValue<T> loading(T previous) {
        return new Loading<>(previous);
    }

    static <T> AsyncValue<T> data(T value) {
        return new Data<>(value);
    }

    static <T> AsyncValue<T> failure(Throwable error) {
        return new Failure<>(error);
    }

    /** Data value, previous value while loading, or null. */
    T valueOrNull();

    default boolean isLoading() {
        return this instanceof Loading;
    }

    default boolean hasData() {
        return this instanceof Data;
    }

    default boolean hasError() {
        return this instanceof Failure;
    }

    <R> R when(Supplier<? extends R> loading, Function<? super T, ? extends R> data,
            Function<? super Throwable, ? extends R> error);

    record Loading<T>(T previous) implements AsyncValue<T> {

        @Override
        public T valueOrNull() {
            return previous;
        }

        @Override
        public <R> R when(Supplier<? extends R> loading, Function<? super T, ? extends R> data,
                Function<? super Throwable, ? extends R> error) {
            return loading.get();
        }
    }

    record Data<T>(T value) implements AsyncValue<T> {

        @Override
        public T valueOrNull() {
            return value;
        }

        @Override
        public <R> R when(Supplier<? extends R> loading, Function<? super T, ? extends R> data,
                Function<? super Throwable, ? extends R> error) {
            return data.apply(value);
        }
    }

    record Failure<T>(Throwable error) implements AsyncValue<T> {

        public Failure {
            Objects.requireNonNull(error, "error");
        }

        public StackTraceElement[] trace() {
            return error.getStackTrace();
        }

        @Override
        public T valueOrNull() {
            return null;
        }

        @Override
        public <R> R when(Supplier<? extends R> loading, Function<? super T, ? extends R> data,
                Function<? super Throwable, ? extends R> error) {
            return error.apply(this.error);
        }
    }
}
