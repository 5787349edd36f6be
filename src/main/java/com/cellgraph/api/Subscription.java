package com.cellgraph.api;

/**
 * Handle returned by every listen/subscribe operation. Cancelling is idempotent.
 */
@FunctionalInterface
public interface Subscription extends AutoCloseable {

    void cancel();

    @Override
    default void close() {
        cancel();
    }
}
