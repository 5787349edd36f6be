package com.cellgraph.io;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.ArrayList;
import java.util.List;

import lombok.Data;

/**
 * POJO representation of a container's live graph at one moment: its nodes
 * with their stored values and edges, and its effect channels.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public final class GraphSnapshot {
    /** Distance from the root; 0 for a root container. */
    private int depth;
    private List<NodeInfo> nodes = new ArrayList<>();
    private List<EffectInfo> effects = new ArrayList<>();

    /** State of a single node. */
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public static final class NodeInfo {
        private String name, kind, policy, value;
        private boolean initialized;
        private int listeners;
        private List<String> dependencies;
        private List<String> observers;
    }

    /** State of a single effect channel. */
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class EffectInfo {
        private String name, strategy;
        private int listeners, retained;
    }
}
