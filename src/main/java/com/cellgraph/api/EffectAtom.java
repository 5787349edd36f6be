package com.cellgraph.api;

import java.time.Duration;

/**
 * Descriptor of a one-shot event channel. A channel holds no current value and
 * cannot be read; it only dispatches payloads to listeners.
 *
 * @param <T> the payload type.
 */
public final class EffectAtom<T> extends Atom<T> {
    public static final int DEFAULT_BUFFER_SIZE = 10;
    public static final Duration DEFAULT_TTL = Duration.ofSeconds(30);

    private final EffectStrategy strategy;
    private final int bufferSize;
    private final Duration ttl;

    EffectAtom(String name, EffectStrategy strategy, int bufferSize, Duration ttl) {
        super(name, "effect");
        if (bufferSize <= 0)
            throw new IllegalArgumentException("Buffer size must be positive: " + bufferSize);
        if (ttl.isNegative() || ttl.isZero())
            throw new IllegalArgumentException("TTL must be positive: " + ttl);
        this.strategy = strategy;
        this.bufferSize = bufferSize;
        this.ttl = ttl;
    }

    public EffectStrategy strategy() {
        return strategy;
    }

    /** Ring buffer capacity, used by {@link EffectStrategy#BUFFER}. */
    public int bufferSize() {
        return bufferSize;
    }

    /** Retention window, used by {@link EffectStrategy#TTL}. */
    public Duration ttl() {
        return ttl;
    }

    /** Channels live as long as the container that owns them. */
    @Override
    public DisposePolicy disposePolicy() {
        return DisposePolicy.KEEP_ALIVE;
    }

    @Override
    public <R> R accept(AtomVisitor<R> visitor) {
        return visitor.visitEffect(this);
    }
}
