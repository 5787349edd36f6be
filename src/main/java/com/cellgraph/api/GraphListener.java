package com.cellgraph.api;

import java.util.Set;

/**
 * Observability interface for monitoring a container's graph.
 *
 * Implementations are registered through the container configuration and
 * receive callbacks while the container writes, recomputes, propagates and
 * disposes nodes. This is the primary mechanism for:
 *
 * - Debugging: tracing which nodes recompute after a write.
 * - Profiling: measuring how long each recomputation takes.
 * - Auditing: recording every state change.
 *
 * Performance Warning:
 * Callbacks run on the thread driving the graph, inside propagation. Keep them
 * lightweight and never call back into the container from here.
 *
 * Every method has an empty default so implementations only override what they
 * need.
 */
public interface GraphListener {

    /** Listener that ignores every callback. */
    GraphListener NONE = new GraphListener() {
    };

    /**
     * Called after a state cell accepted a write that passed its cutoff.
     */
    default void onStateChange(Atom<?> atom, Object oldValue, Object newValue) {
    }

    /**
     * Called after a derived node finished recomputing.
     *
     * @param atom          The recomputed atom.
     * @param dependencies  The atoms watched by this evaluation.
     * @param durationNanos Wall time spent in the compute function.
     * @param changed       true if the new value passed the node's cutoff.
     */
    default void onRecompute(Atom<?> atom, Set<Atom<?>> dependencies, long durationNanos, boolean changed) {
    }

    /**
     * Called when a change fans out to the dependents of {@code source}.
     *
     * @param source   The atom whose value changed or was invalidated.
     * @param affected The direct dependents marked stale.
     */
    default void onDirtyPropagation(Atom<?> source, Set<Atom<?>> affected) {
    }

    /** Called when a compute function raised an error. */
    default void onNodeError(Atom<?> atom, Throwable error) {
    }

    /**
     * Called when an async result arrives after a newer run already started.
     * The result is discarded.
     */
    default void onStaleResult(Atom<?> atom, long generation, long currentGeneration) {
    }

    /**
     * Called after an effect payload was dispatched.
     *
     * @param delivered Number of listeners that received the payload.
     */
    default void onEffectEmitted(Atom<?> effect, Object payload, int delivered) {
    }

    /** Called after a node was removed from its container. */
    default void onNodeDisposed(Atom<?> atom) {
    }
}
