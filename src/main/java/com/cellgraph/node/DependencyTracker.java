package com.cellgraph.node;

import com.cellgraph.api.Atom;
import com.cellgraph.api.CircularDependencyException;
import com.cellgraph.api.Watch;
import com.cellgraph.engine.GraphContext;
import lombok.extern.log4j.Log4j2;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.function.BooleanSupplier;
import java.util.function.Function;

/**
 * Evaluation routine shared by every derived node.
 *
 * Runs a compute body with a tracking {@link Watch} and maintains the owner's
 * upstream edges:
 *
 * 1. Push the owner on the context's evaluation stack. A node already on the
 * stack is a cycle and fails before any state changes.
 * 2. Run the body. Each {@code watch.get} resolves the atom, registers the
 * owner as an observer of a newly seen node and returns its value.
 * 3. On success, drop the edges the body no longer used. On failure, drop the
 * edges this evaluation added, restoring the previous edge set.
 * 4. Pop the owner and close the watch. A closed watch still answers reads but
 * no longer records edges.
 */
@Log4j2
public final class DependencyTracker {
    private final Node<?> owner;
    private final Dependent dependent;
    private final GraphContext context;
    private final NodeResolver resolver;

    private Set<Node<?>> dependencies = new LinkedHashSet<>();
    private long lastDurationNanos;

    public <N extends Node<?> & Dependent> DependencyTracker(N owner, GraphContext context, NodeResolver resolver) {
        this.owner = owner;
        this.dependent = owner;
        this.context = context;
        this.resolver = resolver;
    }

    /**
     * Runs {@code body} as one tracked evaluation of the owner.
     *
     * @throws CircularDependencyException if the owner is already evaluating.
     */
    public <R> R evaluate(Function<Watch, R> body) {
        context.push(owner);
        TrackingWatch watch = new TrackingWatch();
        long start = System.nanoTime();
        boolean completed = false;
        try {
            R result = body.apply(watch);
            completed = true;
            return result;
        } finally {
            watch.closed = true;
            lastDurationNanos = System.nanoTime() - start;
            context.pop(owner);
            if (completed)
                commit(watch.collected);
            else
                rollback(watch.added);
        }
    }

    private void commit(Set<Node<?>> collected) {
        Set<Node<?>> previous = dependencies;
        dependencies = collected;
        for (Node<?> node : previous) {
            if (!collected.contains(node))
                node.removeObserver(dependent);
        }
    }

    private void rollback(List<Node<?>> added) {
        for (Node<?> node : added)
            node.removeObserver(dependent);
    }

    /** Removes every upstream edge. Called when the owner is disposed. */
    public void release() {
        Set<Node<?>> previous = dependencies;
        dependencies = new LinkedHashSet<>();
        for (Node<?> node : previous)
            node.removeObserver(dependent);
    }

    public Set<Atom<?>> dependencies() {
        Set<Atom<?>> atoms = new LinkedHashSet<>();
        for (Node<?> node : dependencies)
            atoms.add(node.atom());
        return Collections.unmodifiableSet(atoms);
    }

    /**
     * Reads every current input in evaluation order so that inputs which are
     * themselves out of date recompute first. An input that changes notifies
     * the owner, so the loop stops as soon as {@code ownerDirty} turns true.
     */
    public void refreshInputs(BooleanSupplier ownerDirty) {
        for (Node<?> node : new ArrayList<>(dependencies)) {
            node.value();
            if (ownerDirty.getAsBoolean())
                return;
        }
    }

    public long lastDurationNanos() {
        return lastDurationNanos;
    }

    private final class TrackingWatch implements Watch {
        final Set<Node<?>> collected = new LinkedHashSet<>();
        final List<Node<?>> added = new ArrayList<>();
        boolean closed;

        @Override
        public <T> T get(Atom<T> atom) {
            Node<T> node = resolver.resolve(atom);
            if (closed) {
                log.warn("Untracked read of '{}' by '{}' after its evaluation completed", atom.name(),
                        owner.atom().name());
                return node.value();
            }
            if (context.isEvaluating(node))
                throw new CircularDependencyException(context.cyclePath(node));
            if (collected.add(node) && !dependencies.contains(node) && node.addObserver(dependent))
                added.add(node);
            return node.value();
        }
    }
}
