package com.cellgraph.api;

/**
 * Delivery strategy of an effect channel, fixed when the channel atom is created.
 */
public enum EffectStrategy {
    /** Deliver to active listeners only. Payloads emitted with no listener are lost. */
    DROP,

    /** Keep the last N payloads in a ring buffer and replay them to each new listener. */
    BUFFER,

    /** Keep payloads younger than a time-to-live and replay those to each new listener. */
    TTL
}
