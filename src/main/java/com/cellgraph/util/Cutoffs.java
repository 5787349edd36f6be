package com.cellgraph.util;

import com.cellgraph.api.Cutoff;

import java.util.Objects;
import java.util.function.BiPredicate;

/**
 * Standard implementations of {@link Cutoff}.
 *
 * This utility class provides common strategies for deciding whether a node's
 * new value differs enough from the previous one to notify its consumers.
 */
public final class Cutoffs {
    private Cutoffs() {
        // Utility class
    }

    private static final Cutoff<Object> EQUALITY = (p, c) -> !Objects.equals(p, c);
    private static final Cutoff<Object> IDENTITY = (p, c) -> p != c;
    private static final Cutoff<Object> ALWAYS = (p, c) -> true;
    private static final Cutoff<Object> NEVER = (p, c) -> false;

    /**
     * Propagates if the values are not {@link Object#equals(Object) equal}.
     * Default for every state and computed atom.
     */
    @SuppressWarnings("unchecked")
    public static <T> Cutoff<T> equality() {
        return (Cutoff<T>) EQUALITY;
    }

    /** Propagates if the values are different references. */
    @SuppressWarnings("unchecked")
    public static <T> Cutoff<T> identity() {
        return (Cutoff<T>) IDENTITY;
    }

    /** Always propagates, even when the same value is written again. */
    @SuppressWarnings("unchecked")
    public static <T> Cutoff<T> always() {
        return (Cutoff<T>) ALWAYS;
    }

    /**
     * Never propagates. The stored value still changes, consumers are just not
     * told about it.
     */
    @SuppressWarnings("unchecked")
    public static <T> Cutoff<T> never() {
        return (Cutoff<T>) NEVER;
    }

    /**
     * Propagates unless {@code equals} reports the values equivalent.
     * Logic: !equals(previous, current)
     */
    public static <T> Cutoff<T> by(BiPredicate<? super T, ? super T> equals) {
        Objects.requireNonNull(equals, "equals");
        return (p, c) -> !equals.test(p, c);
    }
}
