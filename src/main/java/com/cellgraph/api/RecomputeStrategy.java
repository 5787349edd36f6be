package com.cellgraph.api;

/**
 * When a synchronous derived node re-evaluates after an upstream change.
 */
public enum RecomputeStrategy {
    /**
     * Pull-based. The node only marks itself dirty and recomputes on the next
     * read, unless it has listeners or observers, in which case it recomputes
     * right away so that its consumers see the change.
     */
    LAZY,

    /**
     * Push-based. The node computes when created and recomputes on every
     * upstream change, even with no consumers at all.
     */
    EAGER
}
