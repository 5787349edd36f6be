package com.cellgraph.engine;

import com.cellgraph.api.Atom;
import com.cellgraph.api.DisposePolicy;
import com.cellgraph.api.EffectAtom;
import com.cellgraph.api.ScopeOverride;
import com.cellgraph.api.StateAtom;
import com.cellgraph.api.Subscription;
import com.cellgraph.node.Dependent;
import com.cellgraph.node.EffectNode;
import com.cellgraph.node.Node;
import com.cellgraph.node.NodeResolver;
import com.cellgraph.node.StateNode;
import com.cellgraph.util.Cutoffs;
import lombok.extern.log4j.Log4j2;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;
import java.util.function.UnaryOperator;

/**
 * A scope of live nodes: the entry point for reading, writing and subscribing.
 *
 * Resolution:
 * An atom resolves to the nearest container in the parent chain (self first)
 * that already holds a node for it or declares an override for it. Otherwise
 * the node is created at the root, so unoverridden atoms are shared by the
 * whole tree. Derived nodes created at the root read their dependencies
 * through the root: a child override of X is not seen by a derived atom
 * shared with the parent. Override X and the derived atom together, or read
 * X directly, when a scope needs its own derived view.
 *
 * Lifecycle:
 * Each node is owned by the container that created it, and that container
 * applies the atom's {@link DisposePolicy} when the node loses its last
 * listener and observer. {@link #dispose()} releases this container's own
 * nodes, channels and timers; every later operation fails.
 *
 * Every public operation runs to completion: queued changes are fully
 * propagated before it returns.
 *
 * Thread Safety:
 * Not thread-safe. Drive a container tree from one thread, for instance
 * through {@link com.cellgraph.disruptor.GraphReactor}.
 */
@Log4j2
public final class GraphContainer implements NodeResolver, AutoCloseable {
    private final GraphContainer parent;
    private final GraphContext context;
    private final NodeFactory factory;

    private final Map<Atom<?>, Object> overrides = new LinkedHashMap<>();
    private final Map<Atom<?>, Node<?>> nodes = new LinkedHashMap<>();
    private final Map<Atom<?>, DisposePolicy> policies = new HashMap<>();
    private final Map<EffectAtom<?>, EffectNode<?>> effects = new LinkedHashMap<>();
    private final Map<Node<?>, Subscription> timers = new HashMap<>();
    private boolean disposed;

    private GraphContainer(GraphContainer parent, GraphContext context) {
        this.parent = parent;
        this.context = context;
        this.factory = new NodeFactory(context, this);
    }

    /** Creates a root container with the default configuration. */
    public static GraphContainer create() {
        return create(ContainerConfig.defaults());
    }

    public static GraphContainer create(ContainerConfig config) {
        return new GraphContainer(null, new GraphContext(Objects.requireNonNull(config, "config")));
    }

    /**
     * Creates a child scope of {@code parent}. Each override gives the child
     * its own node for that atom, starting from the override value.
     *
     * @throws IllegalArgumentException if an atom is overridden twice.
     */
    public static GraphContainer scoped(GraphContainer parent, ScopeOverride<?>... overrides) {
        Objects.requireNonNull(parent, "parent");
        parent.checkNotDisposed();
        GraphContainer child = new GraphContainer(parent, parent.context);
        for (ScopeOverride<?> o : overrides) {
            if (child.overrides.containsKey(o.atom()))
                throw new IllegalArgumentException("Atom '" + o.atom().name() + "' overridden twice");
            child.overrides.put(o.atom(), o.value());
        }
        return child;
    }

    // ── Reading and writing ──────────────────────────────────────

    /**
     * Returns the current value of {@code atom}, computing it if needed.
     *
     * @throws IllegalArgumentException if {@code atom} is an effect channel.
     */
    public <T> T read(Atom<T> atom) {
        checkNotDisposed();
        T value = resolve(atom).value();
        context.drain();
        return value;
    }

    /**
     * Writes a state cell. Consumers are notified if the cell's cutoff reports
     * a change; inside a {@link #batch(Runnable)} the notification is deferred.
     */
    public <T> void write(StateAtom<T> atom, T value) {
        writeCell(atom, value);
    }

    /**
     * Writes an overridden atom's scope-local cell. The override replaces the
     * atom with a state cell in this scope, so it is writable like one.
     *
     * @throws IllegalArgumentException if {@code atom} does not resolve to a
     *                                  state cell here.
     */
    public <T> void writeOverride(Atom<T> atom, T value) {
        writeCell(atom, value);
    }

    /** Replaces a cell's value with {@code fn} applied to the current one. */
    public <T> void update(StateAtom<T> atom, UnaryOperator<T> fn) {
        checkNotDisposed();
        T current = resolve(atom).value();
        write(atom, fn.apply(current));
    }

    private <T> void writeCell(Atom<T> atom, T value) {
        checkNotDisposed();
        Node<T> node = resolve(atom);
        if (!(node instanceof StateNode<T> cell))
            throw new IllegalArgumentException("Atom '" + atom.name() + "' is not writable: it resolves to "
                    + node.getClass().getSimpleName());
        T old = cell.peek();
        boolean changed;
        if (context.inBatch()) {
            changed = cell.writeSilently(value);
            if (changed)
                context.defer(cell);
        } else {
            changed = cell.write(value);
        }
        if (changed)
            context.listener().onStateChange(atom, old, value);
        context.drain();
    }

    /**
     * Runs {@code updates} with notifications deferred. Nested batches run
     * inline; when the outermost one ends, every written cell notifies once.
     */
    public void batch(Runnable updates) {
        checkNotDisposed();
        context.beginBatch();
        try {
            updates.run();
        } finally {
            if (context.endBatch())
                context.flushDeferred();
        }
    }

    // ── Effects ──────────────────────────────────────────────────

    /** Dispatches {@code payload} on an effect channel. */
    public <T> void emit(EffectAtom<T> atom, T payload) {
        checkNotDisposed();
        effectNode(atom).emit(payload);
        context.drain();
    }

    /**
     * Listens to an effect channel. Buffered payloads are replayed before this
     * returns.
     */
    public <T> Subscription on(EffectAtom<T> atom, Consumer<? super T> listener) {
        checkNotDisposed();
        return once(effectNode(atom).listen(listener)::cancel);
    }

    @SuppressWarnings("unchecked")
    private <T> EffectNode<T> effectNode(EffectAtom<T> atom) {
        for (GraphContainer c = this; c != null; c = c.parent) {
            EffectNode<?> node = c.effects.get(atom);
            if (node != null)
                return (EffectNode<T>) node;
        }
        GraphContainer root = root();
        root.checkNotDisposed();
        EffectNode<T> node = new EffectNode<>(atom, context);
        root.effects.put(atom, node);
        return node;
    }

    // ── Subscriptions ────────────────────────────────────────────

    /**
     * Calls {@code listener} after every change of {@code atom}.
     *
     * A derived atom is evaluated before the listener is registered, so its
     * dependency edges exist and a compute error surfaces here rather than at
     * the first change; if it fails, nothing is registered. Subscribing
     * cancels a pending delayed disposal of the node.
     *
     * @return a handle removing the listener; the node's dispose policy is
     *         re-evaluated on cancel.
     */
    public <T> Subscription subscribe(Atom<T> atom, Runnable listener) {
        checkNotDisposed();
        Objects.requireNonNull(listener, "listener");
        Node<T> node = resolve(atom);
        ownerOf(node).cancelTimer(node);
        node.value();
        Runnable registered = listener::run;
        node.addListener(registered);
        context.drain();
        return once(() -> node.removeListener(registered));
    }

    /**
     * Same as {@link #subscribe(Atom, Runnable)} but hands the new value to
     * {@code listener}.
     */
    public <T> Subscription listen(Atom<T> atom, Consumer<? super T> listener) {
        Objects.requireNonNull(listener, "listener");
        Node<T> node = resolve(atom);
        return subscribe(atom, () -> listener.accept(node.peek()));
    }

    // ── Invalidation and lifecycle ───────────────────────────────

    /**
     * Marks an existing derived node as changed. Lazy and safe nodes recompute
     * now if consumed, otherwise on next read; eager and async nodes recompute
     * now. Does nothing if the atom has no node yet or is a state cell.
     */
    public void invalidate(Atom<?> atom) {
        checkNotDisposed();
        Node<?> node = lookup(atom);
        if (node instanceof Dependent d) {
            context.enqueue(d);
            context.drain();
        }
    }

    /** Invalidates every derived node owned by this container. */
    public void invalidateAllComputed() {
        checkNotDisposed();
        for (Node<?> node : new ArrayList<>(nodes.values())) {
            if (node instanceof Dependent d)
                context.enqueue(d);
        }
        context.drain();
    }

    /**
     * Pins the node of {@code atom}, creating it if needed, so it is never
     * disposed for lack of consumers.
     */
    public void keepAlive(Atom<?> atom) {
        checkNotDisposed();
        Node<?> node = resolve(atom);
        GraphContainer owner = ownerOf(node);
        owner.policies.put(atom, DisposePolicy.KEEP_ALIVE);
        owner.cancelTimer(node);
        context.drain();
    }

    /**
     * Disposes this container's nodes, channels and timers. Parents and their
     * nodes are untouched. Idempotent.
     */
    public void dispose() {
        if (disposed)
            return;
        disposed = true;
        for (Subscription timer : timers.values())
            timer.cancel();
        timers.clear();
        List<Node<?>> local = new ArrayList<>(nodes.values());
        nodes.clear();
        policies.clear();
        List<EffectNode<?>> channels = new ArrayList<>(effects.values());
        effects.clear();
        for (Node<?> node : local) {
            node.dispose();
            context.listener().onNodeDisposed(node.atom());
        }
        for (EffectNode<?> channel : channels) {
            channel.dispose();
            context.listener().onNodeDisposed(channel.atom());
        }
        log.debug("Disposed container with {} nodes and {} channels", local.size(), channels.size());
    }

    @Override
    public void close() {
        dispose();
    }

    public boolean isDisposed() {
        return disposed;
    }

    // ── Introspection ────────────────────────────────────────────

    public GraphContainer parent() {
        return parent;
    }

    public GraphContext context() {
        return context;
    }

    /** Nodes owned by this container, in creation order. */
    public Collection<Node<?>> localNodes() {
        return Collections.unmodifiableCollection(nodes.values());
    }

    /** Effect channels owned by this container, in creation order. */
    public Collection<EffectNode<?>> localEffects() {
        return Collections.unmodifiableCollection(effects.values());
    }

    /** Returns true if this container owns a node for {@code atom}. */
    public boolean hasNode(Atom<?> atom) {
        return nodes.containsKey(atom);
    }

    /** Effective dispose policy of a node owned by this container, or null. */
    public DisposePolicy disposePolicyOf(Atom<?> atom) {
        return policies.get(atom);
    }

    /** Returns true if a delayed disposal of {@code atom}'s node is pending. */
    public boolean isDisposalScheduled(Atom<?> atom) {
        Node<?> node = nodes.get(atom);
        return node != null && timers.containsKey(node);
    }

    // ── Resolution ───────────────────────────────────────────────

    @Override
    public <T> Node<T> resolve(Atom<T> atom) {
        checkNotDisposed();
        Objects.requireNonNull(atom, "atom");
        if (atom instanceof EffectAtom)
            throw new IllegalArgumentException(
                    "Effect atom '" + atom.name() + "' has no value; use on() and emit() instead");
        Node<T> node = lookup(atom);
        return node != null ? node : root().create(atom);
    }

    /** Finds an existing or overridden node without creating shared ones. */
    @SuppressWarnings("unchecked")
    private <T> Node<T> lookup(Atom<T> atom) {
        for (GraphContainer c = this; c != null; c = c.parent) {
            Node<?> node = c.nodes.get(atom);
            if (node != null)
                return (Node<T>) node;
            if (c.overrides.containsKey(atom))
                return c.createOverride(atom);
        }
        return null;
    }

    @SuppressWarnings("unchecked")
    private <T> Node<T> createOverride(Atom<T> atom) {
        checkNotDisposed();
        StateNode<T> node = new StateNode<>(atom, (T) overrides.get(atom), Cutoffs.equality(), context);
        register(node, DisposePolicy.KEEP_ALIVE);
        return node;
    }

    @SuppressWarnings("unchecked")
    private <T> Node<T> create(Atom<T> atom) {
        checkNotDisposed();
        Node<T> node = (Node<T>) atom.accept(factory);
        register(node, atom.disposePolicy());
        try {
            node.activate();
        } catch (RuntimeException e) {
            nodes.remove(atom);
            policies.remove(atom);
            node.dispose();
            throw e;
        }
        return node;
    }

    private void register(Node<?> node, DisposePolicy policy) {
        nodes.put(node.atom(), node);
        policies.put(node.atom(), policy);
        node.onRelease(this::onNodeReleased);
    }

    private GraphContainer root() {
        GraphContainer c = this;
        while (c.parent != null)
            c = c.parent;
        return c;
    }

    private GraphContainer ownerOf(Node<?> node) {
        for (GraphContainer c = this; c != null; c = c.parent) {
            if (c.nodes.get(node.atom()) == node)
                return c;
        }
        throw new IllegalStateException("Node " + node + " is not owned by this container chain");
    }

    // ── Dispose policy ───────────────────────────────────────────

    private void onNodeReleased(Node<?> node) {
        if (disposed || nodes.get(node.atom()) != node)
            return;
        DisposePolicy policy = policies.getOrDefault(node.atom(), DisposePolicy.KEEP_ALIVE);
        switch (policy) {
            case KEEP_ALIVE -> {
            }
            case AUTO_DISPOSE -> disposeNode(node);
            case DELAYED -> scheduleDisposal(node);
        }
    }

    private void scheduleDisposal(Node<?> node) {
        cancelTimer(node);
        Subscription timer = context.scheduler().schedule(() -> {
            timers.remove(node);
            if (!disposed && nodes.get(node.atom()) == node && node.isUnused()
                    && policies.get(node.atom()) == DisposePolicy.DELAYED)
                disposeNode(node);
        }, context.delayedDisposeDelay());
        timers.put(node, timer);
    }

    private void cancelTimer(Node<?> node) {
        Subscription timer = timers.remove(node);
        if (timer != null)
            timer.cancel();
    }

    private void disposeNode(Node<?> node) {
        nodes.remove(node.atom());
        policies.remove(node.atom());
        cancelTimer(node);
        log.debug("Disposing node '{}'", node.atom().name());
        context.listener().onNodeDisposed(node.atom());
        node.dispose();
    }

    private void checkNotDisposed() {
        if (disposed)
            throw new IllegalStateException("Container is disposed");
    }

    private static Subscription once(Runnable action) {
        AtomicBoolean cancelled = new AtomicBoolean();
        return () -> {
            if (cancelled.compareAndSet(false, true))
                action.run();
        };
    }
}
