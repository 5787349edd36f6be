package com.cellgraph.node;

import com.cellgraph.api.Atom;
import com.cellgraph.api.Cutoff;
import com.cellgraph.api.UninitializedNodeException;
import com.cellgraph.engine.GraphContext;
import com.cellgraph.util.Cutoffs;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Consumer;

/**
 * The live instance of an {@link Atom} inside one container.
 *
 * A node stores the current value and two consumer sets:
 * - listeners: external subscribers, called synchronously on change.
 * - observers: downstream derived nodes, queued on the shared
 * {@link GraphContext} so each one recomputes at most once per change.
 *
 * When both sets become empty the release hook fires; the owning container
 * uses it to apply the atom's dispose policy.
 *
 * Thread Safety:
 * Not thread-safe. All access happens on the thread driving the graph.
 *
 * @param <T> The type of value held by this node.
 */
public abstract class Node<T> {
    protected final Atom<T> atom;
    protected final GraphContext context;

    private final Set<Dependent> observers = new LinkedHashSet<>();
    private final Set<Runnable> listeners = new LinkedHashSet<>();
    private Consumer<Node<?>> releaseHook = node -> {
    };

    private T value;
    private boolean initialized;
    private boolean disposed;

    protected Node(Atom<T> atom, GraphContext context) {
        this.atom = atom;
        this.context = context;
    }

    public Atom<T> atom() {
        return atom;
    }

    /**
     * Returns the current value, computing it first if the node kind requires
     * it.
     */
    public abstract T value();

    /** Called once after the owning container cached this node. */
    public void activate() {
    }

    /** Returns the stored value without computing, or null if uninitialized. */
    public T peek() {
        return value;
    }

    public boolean isInitialized() {
        return initialized;
    }

    public boolean isDisposed() {
        return disposed;
    }

    /** Change-significance test applied by {@link #publish(Object)}. */
    protected Cutoff<? super T> cutoff() {
        return Cutoffs.equality();
    }

    protected T storedValue() {
        if (!initialized)
            throw new UninitializedNodeException(atom.name());
        return value;
    }

    /**
     * Stores {@code next}. Consumers are notified only if the cutoff reports a
     * change; the first value of a node initializes it without notification.
     *
     * @return true if the value counts as changed.
     */
    protected boolean publish(T next) {
        if (!initialized) {
            value = next;
            initialized = true;
            return true;
        }
        boolean changed = cutoff().hasChanged(value, next);
        value = next;
        if (changed)
            notifyChange();
        return changed;
    }

    /** Stores {@code next} without notifying anyone. */
    protected void store(T next) {
        value = next;
        initialized = true;
    }

    /**
     * Queues every observer, then calls every listener. Queuing marks direct
     * observers stale and everything further downstream possibly stale, so a
     * listener reading any downstream value gets it refreshed first.
     */
    protected void notifyChange() {
        propagate();
        runListeners();
    }

    /** Queues every observer without calling listeners. */
    protected void propagate() {
        if (observers.isEmpty())
            return;
        List<Dependent> targets = new ArrayList<>(observers);
        Set<Atom<?>> affected = new LinkedHashSet<>();
        for (Dependent d : targets) {
            affected.add(d.atom());
            context.enqueue(d);
        }
        context.listener().onDirtyPropagation(atom, affected);
    }

    protected void runListeners() {
        if (listeners.isEmpty())
            return;
        for (Runnable l : new ArrayList<>(listeners))
            l.run();
    }

    // ── Consumers ────────────────────────────────────────────────

    public boolean addObserver(Dependent observer) {
        return observers.add(observer);
    }

    public boolean removeObserver(Dependent observer) {
        boolean removed = observers.remove(observer);
        if (removed && isUnused())
            releaseHook.accept(this);
        return removed;
    }

    public boolean addListener(Runnable listener) {
        return listeners.add(listener);
    }

    public boolean removeListener(Runnable listener) {
        boolean removed = listeners.remove(listener);
        if (removed && isUnused())
            releaseHook.accept(this);
        return removed;
    }

    public Set<Dependent> observers() {
        return Collections.unmodifiableSet(observers);
    }

    public int observerCount() {
        return observers.size();
    }

    public int listenerCount() {
        return listeners.size();
    }

    /** A node with listeners or observers has someone depending on its value. */
    public boolean isActive() {
        return !listeners.isEmpty() || !observers.isEmpty();
    }

    public boolean isUnused() {
        return !isActive();
    }

    public void onRelease(Consumer<Node<?>> hook) {
        this.releaseHook = hook;
    }

    /** Atoms this node currently reads. Empty for source nodes. */
    public Set<Atom<?>> dependencies() {
        return Collections.emptySet();
    }

    /**
     * Detaches the node. Subclasses release their upstream edges, which may in
     * turn release upstream nodes.
     */
    public void dispose() {
        disposed = true;
        listeners.clear();
        observers.clear();
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + atom.name() + "]";
    }
}
