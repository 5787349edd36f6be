package com.cellgraph.io;

import com.cellgraph.api.Atom;
import com.cellgraph.engine.GraphContainer;
import com.cellgraph.node.Dependent;
import com.cellgraph.node.EffectNode;
import com.cellgraph.node.Node;
import com.cellgraph.util.GraphExplain;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import java.util.ArrayList;
import java.util.List;

/**
 * Renders a container's live graph as JSON for dashboards and bug reports.
 * Values are rendered with {@code toString()} and never computed.
 */
public final class SnapshotSerializer {
    private final ObjectMapper mapper;

    public SnapshotSerializer() {
        this(false);
    }

    public SnapshotSerializer(boolean pretty) {
        this.mapper = new ObjectMapper();
        if (pretty)
            mapper.enable(SerializationFeature.INDENT_OUTPUT);
    }

    /** Captures the nodes and channels owned by {@code container}. */
    public GraphSnapshot capture(GraphContainer container) {
        GraphSnapshot snapshot = new GraphSnapshot();
        int depth = 0;
        for (GraphContainer c = container.parent(); c != null; c = c.parent())
            depth++;
        snapshot.setDepth(depth);

        for (Node<?> node : container.localNodes()) {
            GraphSnapshot.NodeInfo info = new GraphSnapshot.NodeInfo();
            info.setName(node.atom().name());
            info.setKind(GraphExplain.kindOf(node));
            info.setPolicy(String.valueOf(container.disposePolicyOf(node.atom())));
            info.setInitialized(node.isInitialized());
            if (node.isInitialized())
                info.setValue(String.valueOf(node.peek()));
            info.setListeners(node.listenerCount());
            List<String> deps = new ArrayList<>();
            for (Atom<?> dep : node.dependencies())
                deps.add(dep.name());
            info.setDependencies(deps);
            List<String> observers = new ArrayList<>();
            for (Dependent d : node.observers())
                observers.add(d.atom().name());
            info.setObservers(observers);
            snapshot.getNodes().add(info);
        }

        for (EffectNode<?> effect : container.localEffects()) {
            GraphSnapshot.EffectInfo info = new GraphSnapshot.EffectInfo();
            info.setName(effect.atom().name());
            info.setStrategy(effect.atom().strategy().name());
            info.setListeners(effect.listenerCount());
            info.setRetained(effect.retained().size());
            snapshot.getEffects().add(info);
        }
        return snapshot;
    }

    public String toJson(GraphContainer container) {
        return toJson(capture(container));
    }

    public String toJson(GraphSnapshot snapshot) {
        try {
            return mapper.writeValueAsString(snapshot);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize graph snapshot", e);
        }
    }

    /**
     * Reads a snapshot back, e.g. one attached to a bug report.
     *
     * @throws IllegalArgumentException if the JSON is malformed.
     */
    public GraphSnapshot parse(String json) {
        try {
            return mapper.readValue(json, GraphSnapshot.class);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Invalid graph snapshot: " + e.getOriginalMessage(), e);
        }
    }
}
