package com.cellgraph.util;

import com.cellgraph.api.Atom;
import com.cellgraph.api.GraphListener;

import java.util.Arrays;
import java.util.Set;

/**
 * Aggregates multiple {@link GraphListener} instances. Dispatch iterates a
 * plain array that is replaced on every add.
 */
public class CompositeGraphListener implements GraphListener {
    private GraphListener[] listeners = new GraphListener[0];

    public CompositeGraphListener(GraphListener... listeners) {
        for (GraphListener l : listeners)
            add(l);
    }

    public CompositeGraphListener add(GraphListener listener) {
        GraphListener[] old = listeners;
        GraphListener[] next = Arrays.copyOf(old, old.length + 1);
        next[old.length] = listener;
        listeners = next;
        return this;
    }

    public int size() {
        return listeners.length;
    }

    @Override
    public void onStateChange(Atom<?> atom, Object oldValue, Object newValue) {
        for (GraphListener l : listeners)
            l.onStateChange(atom, oldValue, newValue);
    }

    @Override
    public void onRecompute(Atom<?> atom, Set<Atom<?>> dependencies, long durationNanos, boolean changed) {
        for (GraphListener l : listeners)
            l.onRecompute(atom, dependencies, durationNanos, changed);
    }

    @Override
    public void onDirtyPropagation(Atom<?> source, Set<Atom<?>> affected) {
        for (GraphListener l : listeners)
            l.onDirtyPropagation(source, affected);
    }

    @Override
    public void onNodeError(Atom<?> atom, Throwable error) {
        for (GraphListener l : listeners)
            l.onNodeError(atom, error);
    }

    @Override
    public void onStaleResult(Atom<?> atom, long generation, long currentGeneration) {
        for (GraphListener l : listeners)
            l.onStaleResult(atom, generation, currentGeneration);
    }

    @Override
    public void onEffectEmitted(Atom<?> effect, Object payload, int delivered) {
        for (GraphListener l : listeners)
            l.onEffectEmitted(effect, payload, delivered);
    }

    @Override
    public void onNodeDisposed(Atom<?> atom) {
        for (GraphListener l : listeners)
            l.onNodeDisposed(atom);
    }
}
