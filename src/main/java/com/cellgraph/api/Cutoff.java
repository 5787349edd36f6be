package com.cellgraph.api;

/**
 * Change-significance strategy for node values.
 *
 * A node only stores a new value and notifies its listeners and observers when
 * the cutoff reports a change. The default is value equality; see
 * {@link com.cellgraph.util.Cutoffs} for the standard implementations.
 *
 * Values are compared, never diffed: a collection mutated in place and written
 * back is the same reference and will not be seen as a change. Always write a
 * new value.
 *
 * @param <T> the value type.
 */
@FunctionalInterface
public interface Cutoff<T> {

    /**
     * Determines if the value has changed enough to warrant propagation.
     *
     * @param previous The value currently held by the node.
     * @param current  The newly written or computed value.
     * @return {@code true} if the change is significant; {@code false} otherwise.
     */
    boolean hasChanged(T previous, T current);
}
