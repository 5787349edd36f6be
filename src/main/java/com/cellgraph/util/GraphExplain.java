package com.cellgraph.util;

import com.cellgraph.api.Atom;
import com.cellgraph.api.RecomputeStrategy;
import com.cellgraph.engine.GraphContainer;
import com.cellgraph.node.ComputeNode;
import com.cellgraph.node.Dependent;
import com.cellgraph.node.EffectNode;
import com.cellgraph.node.Node;
import com.cellgraph.node.StateNode;

import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;

/**
 * Diagnostic utility for inspecting a container's nodes and edges.
 *
 * <p>
 * Generates human-readable representations of the live graph: one node in
 * detail, the whole topology as text, or a Mermaid diagram. Only nodes owned
 * by the given container are listed; pass the root to see shared nodes.
 *
 * <p>
 * <b>Usage:</b> Intended for debugging sessions and error logs. Does not
 * compute anything: values are shown as currently stored.
 */
public final class GraphExplain {
    private final GraphContainer container;

    public GraphExplain(GraphContainer container) {
        this.container = container;
    }

    /**
     * Dumps detailed state of the node owned for {@code atom}.
     *
     * @throws IllegalArgumentException if this container owns no such node.
     */
    public String explainNode(Atom<?> atom) {
        Node<?> node = find(atom);
        if (node == null)
            throw new IllegalArgumentException("No node for atom '" + atom.name() + "' in this container");
        StringBuilder sb = new StringBuilder(256);
        sb.append("Node: ").append(atom.name()).append('\n')
                .append("  Kind: ").append(kindOf(node)).append('\n')
                .append("  Policy: ").append(container.disposePolicyOf(atom)).append('\n')
                .append("  Value: ").append(describeValue(node)).append('\n')
                .append("  Listeners: ").append(node.listenerCount()).append('\n');
        if (node instanceof ComputeNode<?> cn)
            sb.append("  Dirty: ").append(cn.isDirty()).append('\n');
        sb.append("  Dependencies (").append(node.dependencies().size()).append("): ")
                .append(joinNames(node.dependencies())).append('\n');
        List<Atom<?>> observers = observerAtoms(node);
        sb.append("  Observers (").append(observers.size()).append("): ").append(joinNames(observers));
        return sb.append('\n').toString();
    }

    /**
     * Dumps every owned node with its observers in creation order.
     */
    public String dumpTopology() {
        StringBuilder sb = new StringBuilder(1024);
        sb.append("Graph (").append(container.localNodes().size()).append(" nodes, ")
                .append(container.localEffects().size()).append(" effects):\n");
        int i = 0;
        for (Node<?> node : container.localNodes()) {
            sb.append("  [").append(i++).append("] ").append(node.atom().name());
            if (node instanceof StateNode)
                sb.append(" (SRC)");
            List<Atom<?>> observers = observerAtoms(node);
            if (!observers.isEmpty())
                sb.append(" -> ").append(joinNames(observers));
            sb.append('\n');
        }
        for (EffectNode<?> effect : container.localEffects()) {
            sb.append("  (effect) ").append(effect.atom().name()).append(' ')
                    .append(effect.atom().strategy()).append(", listeners=").append(effect.listenerCount())
                    .append('\n');
        }
        return sb.toString();
    }

    /**
     * Generates a Mermaid JS graph diagram, edges pointing downstream.
     */
    public String toMermaid() {
        StringBuilder sb = new StringBuilder(2048);
        sb.append("graph TD;\n");

        // Atom names need not be unique, so ids are positional
        Map<Atom<?>, String> ids = new IdentityHashMap<>();
        for (Node<?> node : container.localNodes())
            ids.put(node.atom(), "n" + ids.size());

        // 1. Declare nodes
        for (Node<?> node : container.localNodes()) {
            String id = ids.get(node.atom());
            String label = escape(node.atom().name()) + "<br/>" + kindOf(node) + "<br/>"
                    + escape(describeValue(node));
            if (node instanceof StateNode)
                sb.append("  ").append(id).append("[(\"").append(label).append("\")];\n");
            else
                sb.append("  ").append(id).append("[\"").append(label).append("\"];\n");
        }

        // 2. Declare edges afterwards
        for (Node<?> node : container.localNodes()) {
            for (Atom<?> observer : observerAtoms(node)) {
                String target = ids.get(observer);
                if (target != null)
                    sb.append("  ").append(ids.get(node.atom())).append(" --> ").append(target).append(";\n");
            }
        }
        return sb.toString();
    }

    /**
     * Short upper-case kind of a node, e.g. {@code STATE}, {@code COMPUTE},
     * {@code EAGER_COMPUTE}, {@code SAFE_COMPUTE}, {@code ASYNC_COMPUTE}.
     */
    public static String kindOf(Node<?> node) {
        if (node instanceof ComputeNode<?> cn)
            return cn.strategy() == RecomputeStrategy.EAGER ? "EAGER_COMPUTE" : "COMPUTE";
        String className = node.getClass().getSimpleName();
        if (className.endsWith("Node"))
            className = className.substring(0, className.length() - 4);
        return className.replaceAll("([a-z])([A-Z]+)", "$1_$2").toUpperCase();
    }

    /** Stored value as text, or {@code <uninitialized>}. Never computes. */
    public static String describeValue(Node<?> node) {
        return node.isInitialized() ? String.valueOf(node.peek()) : "<uninitialized>";
    }

    private Node<?> find(Atom<?> atom) {
        for (Node<?> node : container.localNodes()) {
            if (node.atom() == atom)
                return node;
        }
        return null;
    }

    private static List<Atom<?>> observerAtoms(Node<?> node) {
        List<Atom<?>> out = new ArrayList<>(node.observerCount());
        for (Dependent d : node.observers())
            out.add(d.atom());
        return out;
    }

    private static String joinNames(Iterable<? extends Atom<?>> atoms) {
        StringBuilder sb = new StringBuilder();
        for (Atom<?> a : atoms) {
            if (sb.length() > 0)
                sb.append(", ");
            sb.append(a.name());
        }
        return sb.toString();
    }

    private static String escape(String text) {
        return text.replace("\"", "#quot;");
    }
}
