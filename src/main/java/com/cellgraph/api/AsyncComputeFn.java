package com.cellgraph.api;

import java.util.concurrent.CompletionStage;

/**
 * Derivation for async atoms. The synchronous part of the function, up to the
 * point where it returns the stage, is where dependencies must be read.
 *
 * @param <T> the value the stage completes with.
 */
@FunctionalInterface
public interface AsyncComputeFn<T> {

    CompletionStage<T> compute(Watch watch) throws Exception;
}
