package com.cellgraph.node;

import com.cellgraph.api.Atom;
import com.cellgraph.api.Cutoff;
import com.cellgraph.engine.GraphContext;

/**
 * A mutable source cell. Also backs scope overrides, which replace any atom
 * with a cell holding a fixed initial value.
 *
 * @param <T> The type of value held by this cell.
 */
public final class StateNode<T> extends Node<T> {
    private final Cutoff<? super T> cutoff;

    public StateNode(Atom<T> atom, T initialValue, Cutoff<? super T> cutoff, GraphContext context) {
        super(atom, context);
        this.cutoff = cutoff;
        store(initialValue);
    }

    @Override
    public T value() {
        return storedValue();
    }

    @Override
    protected Cutoff<? super T> cutoff() {
        return cutoff;
    }

    /**
     * Stores {@code next} and notifies consumers if it passes the cutoff.
     *
     * @return true if consumers were notified.
     */
    public boolean write(T next) {
        return publish(next);
    }

    /**
     * Stores {@code next} without notifying. Used inside a batch; the caller
     * is responsible for a later {@link #flush()}.
     *
     * @return true if the value passes the cutoff.
     */
    public boolean writeSilently(T next) {
        boolean changed = cutoff.hasChanged(peek(), next);
        store(next);
        return changed;
    }

    /** Delivers the notification deferred by {@link #writeSilently(Object)}. */
    public void flush() {
        flushObservers();
        flushListeners();
    }

    /**
     * First half of {@link #flush()}: queues the observers. A batch calls this
     * for every written cell before any listener runs.
     */
    public void flushObservers() {
        if (!isDisposed())
            propagate();
    }

    /** Second half of {@link #flush()}: calls the listeners. */
    public void flushListeners() {
        if (!isDisposed())
            runListeners();
    }
}
