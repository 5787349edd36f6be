package com.cellgraph.api;

/**
 * Dependency-tracking read handed to every derived compute function.
 *
 * Each call resolves the atom's node, records an edge from that node to the
 * node being evaluated, and returns the current value. Edges are rebuilt on
 * every evaluation, so conditional reads give conditional dependencies.
 *
 * Only calls made while the compute function runs synchronously are tracked.
 * For async derived atoms that means before the function returns its
 * {@link java.util.concurrent.CompletionStage}: a read from a continuation
 * still returns the current value but creates no edge.
 */
@FunctionalInterface
public interface Watch {

    <T> T get(Atom<T> atom);
}
