package com.cellgraph.api;

/**
 * Governs when a node that nobody uses any more is torn down.
 *
 * A node is "unused" once it has no external listeners and no downstream
 * observers. Disposing a node drops its value: the next resolution of the
 * same atom builds a fresh node from the atom's initial value.
 */
public enum DisposePolicy {
    /** Never disposed automatically. The default. */
    KEEP_ALIVE,

    /** Disposed as soon as the node becomes unused. */
    AUTO_DISPOSE,

    /**
     * Disposed if the node is still unused after the container's grace period.
     * Resubscribing within the period cancels the pending disposal.
     */
    DELAYED
}
