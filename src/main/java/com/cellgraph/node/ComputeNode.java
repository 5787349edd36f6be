package com.cellgraph.node;

import com.cellgraph.api.Atom;
import com.cellgraph.api.ComputedAtom;
import com.cellgraph.api.Cutoff;
import com.cellgraph.api.RecomputeStrategy;
import com.cellgraph.engine.GraphContext;

import java.util.Set;

/**
 * A synchronous derived node.
 *
 * LAZY nodes start dirty and compute on read. On an upstream change they
 * recompute right away only while someone consumes them; otherwise they stay
 * dirty until the next read.
 *
 * EAGER nodes compute on activation and on every upstream change, consumed or
 * not. A read in a settled graph returns the cached value; a read while the
 * node is still queued refreshes it first.
 *
 * A compute error propagates to the caller. The node stays dirty and keeps the
 * edges of its last successful evaluation.
 *
 * @param <T> The derived value type.
 */
public final class ComputeNode<T> extends Node<T> implements Dependent {
    private final ComputedAtom<T> computed;
    private final DependencyTracker tracker;
    private boolean dirty = true;
    private boolean maybeStale;

    public ComputeNode(ComputedAtom<T> atom, GraphContext context, NodeResolver resolver) {
        super(atom, context);
        this.computed = atom;
        this.tracker = new DependencyTracker(this, context, resolver);
    }

    @Override
    public void activate() {
        if (computed.strategy() == RecomputeStrategy.EAGER)
            recompute();
    }

    @Override
    public T value() {
        if (!dirty && maybeStale)
            refresh();
        if (dirty)
            recompute();
        return storedValue();
    }

    @Override
    public void markStale() {
        dirty = true;
    }

    @Override
    public boolean markMaybeStale() {
        if (dirty || maybeStale)
            return false;
        maybeStale = true;
        return true;
    }

    @Override
    public void onDependencyChanged() {
        if (!dirty || isDisposed())
            return;
        if (computed.strategy() == RecomputeStrategy.EAGER || isActive())
            recompute();
    }

    public boolean isDirty() {
        return dirty;
    }

    public RecomputeStrategy strategy() {
        return computed.strategy();
    }

    @Override
    protected Cutoff<? super T> cutoff() {
        return computed.cutoff();
    }

    @Override
    public Set<Atom<?>> dependencies() {
        return tracker.dependencies();
    }

    private void recompute() {
        T next;
        try {
            next = tracker.evaluate(watch -> computed.computeFn().compute(watch));
        } catch (RuntimeException e) {
            context.listener().onNodeError(atom, e);
            throw e;
        }
        dirty = false;
        maybeStale = false;
        boolean changed = publish(next);
        context.listener().onRecompute(atom, tracker.dependencies(), tracker.lastDurationNanos(), changed);
    }

    private void refresh() {
        maybeStale = false;
        try {
            tracker.refreshInputs(() -> dirty);
        } catch (RuntimeException e) {
            dirty = true;
            throw e;
        }
    }

    @Override
    public void dispose() {
        super.dispose();
        tracker.release();
    }
}
