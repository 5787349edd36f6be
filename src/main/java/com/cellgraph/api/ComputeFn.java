package com.cellgraph.api;

/**
 * Synchronous derivation used by computed, eager and safe atoms.
 *
 * @param <T> the derived value type.
 */
@FunctionalInterface
public interface ComputeFn<T> {

    T compute(Watch watch);
}
