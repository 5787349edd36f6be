package com.cellgraph.node;

import com.cellgraph.api.Atom;
import com.cellgraph.api.CircularDependencyException;
import com.cellgraph.api.Result;
import com.cellgraph.api.SafeAtom;
import com.cellgraph.api.Watch;
import com.cellgraph.engine.GraphContext;

import java.util.Set;

/**
 * A lazy derived node that captures compute errors as {@link Result.Failure}.
 *
 * Circular dependencies are structural and still propagate, as do
 * {@link VirtualMachineError}s. The edges read before an error are kept, so a
 * failed node recovers as soon as one of them changes.
 *
 * @param <T> The value type of a successful computation.
 */
public final class SafeComputeNode<T> extends Node<Result<T>> implements Dependent {
    private final SafeAtom<T> safe;
    private final DependencyTracker tracker;
    private boolean dirty = true;
    private boolean maybeStale;

    public SafeComputeNode(SafeAtom<T> atom, GraphContext context, NodeResolver resolver) {
        super(atom, context);
        this.safe = atom;
        this.tracker = new DependencyTracker(this, context, resolver);
    }

    @Override
    public Result<T> value() {
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
        if (dirty && !isDisposed() && isActive())
            recompute();
    }

    public boolean isDirty() {
        return dirty;
    }

    @Override
    public Set<Atom<?>> dependencies() {
        return tracker.dependencies();
    }

    private void recompute() {
        Result<T> next = tracker.evaluate(this::guarded);
        dirty = false;
        maybeStale = false;
        boolean changed = publish(next);
        context.listener().onRecompute(atom, tracker.dependencies(), tracker.lastDurationNanos(), changed);
    }

    private Result<T> guarded(Watch watch) {
        try {
            return Result.success(safe.computeFn().compute(watch));
        } catch (CircularDependencyException | VirtualMachineError e) {
            throw e;
        } catch (Throwable t) {
            context.listener().onNodeError(atom, t);
            return Result.failure(t);
        }
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
