package com.cellgraph.api;

import com.cellgraph.util.Cutoffs;

import java.time.Duration;
import java.util.Objects;

/**
 * Static factories for atom descriptors.
 *
 * Usage Pattern:
 * 1. Declare atoms once, typically as static finals:
 * {@code static final StateAtom<Integer> COUNT = Atoms.state(0);}
 * 2. Derive from them:
 * {@code static final ComputedAtom<Integer> DOUBLED = Atoms.computed(w -> w.get(COUNT) * 2);}
 * 3. Read, write and subscribe through a
 * {@link com.cellgraph.engine.GraphContainer}.
 *
 * Unnamed atoms get a generated diagnostic name such as {@code computed#12}.
 */
public final class Atoms {
    private Atoms() {
        // Utility class
    }

    // ── State cells ──────────────────────────────────────────────

    public static <T> StateAtom<T> state(T initialValue) {
        return state(null, initialValue, DisposePolicy.KEEP_ALIVE);
    }

    public static <T> StateAtom<T> state(T initialValue, DisposePolicy disposePolicy) {
        return state(null, initialValue, disposePolicy);
    }

    public static <T> StateAtom<T> state(String name, T initialValue, DisposePolicy disposePolicy) {
        return state(name, initialValue, disposePolicy, Cutoffs.equality());
    }

    /**
     * Creates a state cell with a custom cutoff.
     *
     * @param name          Diagnostic name, or null for a generated one.
     * @param initialValue  Value of a freshly created node.
     * @param disposePolicy Lifecycle of the node once unused.
     * @param cutoff        Decides whether a write is a change worth notifying.
     */
    public static <T> StateAtom<T> state(String name, T initialValue, DisposePolicy disposePolicy,
            Cutoff<? super T> cutoff) {
        return new StateAtom<>(name, initialValue, check(disposePolicy), Objects.requireNonNull(cutoff, "cutoff"));
    }

    // ── Lazy derived ─────────────────────────────────────────────

    public static <T> ComputedAtom<T> computed(ComputeFn<T> fn) {
        return computed(null, fn, DisposePolicy.KEEP_ALIVE, Cutoffs.equality());
    }

    public static <T> ComputedAtom<T> computed(ComputeFn<T> fn, DisposePolicy disposePolicy) {
        return computed(null, fn, disposePolicy, Cutoffs.equality());
    }

    public static <T> ComputedAtom<T> computed(String name, ComputeFn<T> fn) {
        return computed(name, fn, DisposePolicy.KEEP_ALIVE, Cutoffs.equality());
    }

    public static <T> ComputedAtom<T> computed(String name, ComputeFn<T> fn, DisposePolicy disposePolicy) {
        return computed(name, fn, disposePolicy, Cutoffs.equality());
    }

    public static <T> ComputedAtom<T> computed(String name, ComputeFn<T> fn, DisposePolicy disposePolicy,
            Cutoff<? super T> cutoff) {
        return new ComputedAtom<>(name, Objects.requireNonNull(fn, "fn"), RecomputeStrategy.LAZY,
                check(disposePolicy), Objects.requireNonNull(cutoff, "cutoff"));
    }

    // ── Eager derived ────────────────────────────────────────────

    public static <T> ComputedAtom<T> eager(ComputeFn<T> fn) {
        return eager(null, fn, DisposePolicy.KEEP_ALIVE, Cutoffs.equality());
    }

    public static <T> ComputedAtom<T> eager(ComputeFn<T> fn, DisposePolicy disposePolicy) {
        return eager(null, fn, disposePolicy, Cutoffs.equality());
    }

    public static <T> ComputedAtom<T> eager(String name, ComputeFn<T> fn) {
        return eager(name, fn, DisposePolicy.KEEP_ALIVE, Cutoffs.equality());
    }

    public static <T> ComputedAtom<T> eager(String name, ComputeFn<T> fn, DisposePolicy disposePolicy) {
        return eager(name, fn, disposePolicy, Cutoffs.equality());
    }

    public static <T> ComputedAtom<T> eager(String name, ComputeFn<T> fn, DisposePolicy disposePolicy,
            Cutoff<? super T> cutoff) {
        return new ComputedAtom<>(name, Objects.requireNonNull(fn, "fn"), RecomputeStrategy.EAGER,
                check(disposePolicy), Objects.requireNonNull(cutoff, "cutoff"));
    }

    // ── Safe derived ─────────────────────────────────────────────

    public static <T> SafeAtom<T> safe(ComputeFn<T> fn) {
        return safe(null, fn, DisposePolicy.KEEP_ALIVE);
    }

    public static <T> SafeAtom<T> safe(ComputeFn<T> fn, DisposePolicy disposePolicy) {
        return safe(null, fn, disposePolicy);
    }

    public static <T> SafeAtom<T> safe(String name, ComputeFn<T> fn) {
        return safe(name, fn, DisposePolicy.KEEP_ALIVE);
    }

    public static <T> SafeAtom<T> safe(String name, ComputeFn<T> fn, DisposePolicy disposePolicy) {
        return new SafeAtom<>(name, Objects.requireNonNull(fn, "fn"), check(disposePolicy));
    }

    // ── Async derived ────────────────────────────────────────────

    public static <T> AsyncAtom<T> async(AsyncComputeFn<T> fn) {
        return async(null, fn, DisposePolicy.KEEP_ALIVE);
    }

    public static <T> AsyncAtom<T> async(AsyncComputeFn<T> fn, DisposePolicy disposePolicy) {
        return async(null, fn, disposePolicy);
    }

    public static <T> AsyncAtom<T> async(String name, AsyncComputeFn<T> fn) {
        return async(name, fn, DisposePolicy.KEEP_ALIVE);
    }

    public static <T> AsyncAtom<T> async(String name, AsyncComputeFn<T> fn, DisposePolicy disposePolicy) {
        return new AsyncAtom<>(name, Objects.requireNonNull(fn, "fn"), check(disposePolicy));
    }

    // ── Effect channels ──────────────────────────────────────────

    /** Creates a channel with the {@link EffectStrategy#DROP} strategy. */
    public static <T> EffectAtom<T> effect() {
        return effect(null);
    }

    public static <T> EffectAtom<T> effect(String name) {
        return effect(name, EffectStrategy.DROP, EffectAtom.DEFAULT_BUFFER_SIZE, EffectAtom.DEFAULT_TTL);
    }

    /** Creates a channel replaying its last {@code capacity} payloads to new listeners. */
    public static <T> EffectAtom<T> bufferedEffect(int capacity) {
        return bufferedEffect(null, capacity);
    }

    public static <T> EffectAtom<T> bufferedEffect(String name, int capacity) {
        return effect(name, EffectStrategy.BUFFER, capacity, EffectAtom.DEFAULT_TTL);
    }

    /** Creates a channel replaying payloads younger than {@code ttl} to new listeners. */
    public static <T> EffectAtom<T> ttlEffect(Duration ttl) {
        return ttlEffect(null, ttl);
    }

    public static <T> EffectAtom<T> ttlEffect(String name, Duration ttl) {
        return effect(name, EffectStrategy.TTL, EffectAtom.DEFAULT_BUFFER_SIZE, ttl);
    }

    /**
     * Creates a channel with explicit settings.
     *
     * @param name       Diagnostic name, or null.
     * @param strategy   Delivery strategy.
     * @param bufferSize Ring buffer capacity (BUFFER only).
     * @param ttl        Retention window (TTL only).
     */
    public static <T> EffectAtom<T> effect(String name, EffectStrategy strategy, int bufferSize, Duration ttl) {
        return new EffectAtom<>(name, Objects.requireNonNull(strategy, "strategy"), bufferSize,
                Objects.requireNonNull(ttl, "ttl"));
    }

    private static DisposePolicy check(DisposePolicy policy) {
        return Objects.requireNonNull(policy, "disposePolicy");
    }
}
