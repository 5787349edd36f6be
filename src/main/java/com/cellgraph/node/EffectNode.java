package com.cellgraph.node;

import com.cellgraph.api.EffectAtom;
import com.cellgraph.api.EffectStrategy;
import com.cellgraph.api.Subscription;
import com.cellgraph.engine.GraphContext;
import com.cellgraph.util.ErrorRateLimiter;
import lombok.extern.log4j.Log4j2;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Consumer;

/**
 * The live instance of an effect channel.
 *
 * Payloads are dispatched to the listeners registered at emit time. What a
 * late listener sees depends on the strategy:
 * - DROP: nothing; a payload emitted with no listener is lost.
 * - BUFFER: the last {@code bufferSize} payloads, oldest first.
 * - TTL: the payloads emitted within the last {@code ttl}, oldest first.
 *
 * A listener that throws is logged and skipped; the others still receive the
 * payload.
 *
 * @param <T> The payload type.
 */
@Log4j2
public final class EffectNode<T> {
    private static final ErrorRateLimiter errLimiter = new ErrorRateLimiter(log, 1000);

    private final EffectAtom<T> atom;
    private final GraphContext context;
    private final Set<Consumer<? super T>> listeners = new LinkedHashSet<>();
    private final Deque<Entry<T>> buffer = new ArrayDeque<>();
    private boolean disposed;

    private record Entry<T>(T payload, Instant emittedAt) {
    }

    public EffectNode(EffectAtom<T> atom, GraphContext context) {
        this.atom = atom;
        this.context = context;
    }

    public EffectAtom<T> atom() {
        return atom;
    }

    /** Dispatches {@code payload}. A no-op once the channel is disposed. */
    public void emit(T payload) {
        if (disposed)
            return;
        switch (atom.strategy()) {
            case DROP -> {
            }
            case BUFFER -> {
                buffer.addLast(new Entry<>(payload, null));
                while (buffer.size() > atom.bufferSize())
                    buffer.removeFirst();
            }
            case TTL -> {
                Instant now = context.clock().instant();
                evictExpired(now);
                buffer.addLast(new Entry<>(payload, now));
            }
        }
        int delivered = 0;
        for (Consumer<? super T> l : new ArrayList<>(listeners)) {
            if (deliver(l, payload))
                delivered++;
        }
        context.listener().onEffectEmitted(atom, payload, delivered);
    }

    /**
     * Registers {@code listener}, first replaying the retained payloads.
     */
    public Subscription listen(Consumer<? super T> listener) {
        if (disposed)
            throw new IllegalStateException("Effect channel '" + atom.name() + "' is disposed");
        Consumer<T> registered = listener::accept;
        if (atom.strategy() == EffectStrategy.TTL)
            evictExpired(context.clock().instant());
        for (Entry<T> e : new ArrayList<>(buffer))
            deliver(registered, e.payload());
        listeners.add(registered);
        return () -> listeners.remove(registered);
    }

    /** Payloads a new listener would receive right now. */
    public List<T> retained() {
        if (atom.strategy() == EffectStrategy.TTL)
            evictExpired(context.clock().instant());
        List<T> out = new ArrayList<>(buffer.size());
        for (Entry<T> e : buffer)
            out.add(e.payload());
        return out;
    }

    public int listenerCount() {
        return listeners.size();
    }

    public boolean isDisposed() {
        return disposed;
    }

    public void dispose() {
        disposed = true;
        listeners.clear();
        buffer.clear();
    }

    private void evictExpired(Instant now) {
        Duration ttl = atom.ttl();
        while (!buffer.isEmpty() && Duration.between(buffer.peekFirst().emittedAt(), now).compareTo(ttl) > 0)
            buffer.removeFirst();
    }

    private boolean deliver(Consumer<? super T> listener, T payload) {
        try {
            listener.accept(payload);
            return true;
        } catch (RuntimeException e) {
            errLimiter.log(String.format("Listener of effect '%s' failed: %s", atom.name(), e.getMessage()), e);
            return false;
        }
    }
}
