package com.cellgraph.disruptor;

/**
 * A mutable slot of the reactor's ring buffer holding one unit of graph work.
 *
 * <p>
 * <b>Flyweight Pattern:</b> Instances are pre-allocated when the ring buffer is
 * built and reused for its lifetime; only the task reference changes.
 */
public final class GraphTask {
    private Runnable task;
    private long sequenceId;

    public void set(Runnable task, long seqId) {
        this.task = task;
        this.sequenceId = seqId;
    }

    public Runnable task() {
        return task;
    }

    public long sequenceId() {
        return sequenceId;
    }

    public void clear() {
        task = null;
        sequenceId = 0;
    }
}
