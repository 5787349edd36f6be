package com.cellgraph.engine;

import com.cellgraph.api.AsyncAtom;
import com.cellgraph.api.AtomVisitor;
import com.cellgraph.api.ComputedAtom;
import com.cellgraph.api.EffectAtom;
import com.cellgraph.api.SafeAtom;
import com.cellgraph.api.StateAtom;
import com.cellgraph.node.AsyncComputeNode;
import com.cellgraph.node.ComputeNode;
import com.cellgraph.node.Node;
import com.cellgraph.node.NodeResolver;
import com.cellgraph.node.SafeComputeNode;
import com.cellgraph.node.StateNode;

/**
 * Builds the node matching an atom's kind. Derived nodes resolve their
 * dependencies through {@code resolver}, the container that owns them.
 */
final class NodeFactory implements AtomVisitor<Node<?>> {
    private final GraphContext context;
    private final NodeResolver resolver;

    NodeFactory(GraphContext context, NodeResolver resolver) {
        this.context = context;
        this.resolver = resolver;
    }

    @Override
    public <T> Node<?> visitState(StateAtom<T> atom) {
        return new StateNode<>(atom, atom.initialValue(), atom.cutoff(), context);
    }

    @Override
    public <T> Node<?> visitComputed(ComputedAtom<T> atom) {
        return new ComputeNode<>(atom, context, resolver);
    }

    @Override
    public <T> Node<?> visitSafe(SafeAtom<T> atom) {
        return new SafeComputeNode<>(atom, context, resolver);
    }

    @Override
    public <T> Node<?> visitAsync(AsyncAtom<T> atom) {
        return new AsyncComputeNode<>(atom, context, resolver);
    }

    @Override
    public <T> Node<?> visitEffect(EffectAtom<T> atom) {
        throw new IllegalArgumentException(
                "Effect atom '" + atom.name() + "' has no value; use on() and emit() instead");
    }
}
