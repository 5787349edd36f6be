package com.cellgraph.node;

import com.cellgraph.api.Atom;

import java.util.Set;

/**
 * A node that derives its value from other nodes and is told when they change.
 *
 * Change fan-out is two-phase: {@link #markStale()} runs as soon as an upstream
 * change is queued, {@link #onDependencyChanged()} runs when the queue reaches
 * this node. A dependent may be marked stale several times before it is
 * drained once.
 *
 * Nodes further downstream are only marked possibly stale: before their next
 * read they pull their inputs up to date and recompute only if one of them
 * actually changed.
 */
public interface Dependent {

    Atom<?> atom();

    /** Flags the cached value as out of date. Must not compute. */
    void markStale();

    /**
     * Flags the cached value as possibly out of date because something
     * upstream of an input changed. Must not compute.
     *
     * @return true if the flag was newly set and should spread downstream.
     */
    boolean markMaybeStale();

    /** Downstream dependents of this node. */
    Set<Dependent> observers();

    /** Reacts to a queued upstream change: recompute now or stay dirty. */
    void onDependencyChanged();
}
