package com.cellgraph.api;

import java.time.Duration;

/**
 * Execution seam of a container.
 *
 * Async completions are handed to {@link #execute(Runnable)} so they re-enter
 * the graph on the thread that owns it. Delayed disposal timers go through
 * {@link #schedule(Runnable, Duration)}.
 */
public interface GraphScheduler {

    /** Runs {@code task} on the graph thread. */
    void execute(Runnable task);

    /**
     * Runs {@code task} on the graph thread after {@code delay}.
     *
     * @return a handle cancelling the timer if it has not fired yet.
     */
    Subscription schedule(Runnable task, Duration delay);

    /**
     * Runs timers that are due but have no thread of their own. Called on the
     * graph thread whenever a container has finished propagating a change.
     * Schedulers that deliver timers through {@link #execute(Runnable)} have
     * nothing to do here.
     */
    default void runDueTimers() {
    }
}
