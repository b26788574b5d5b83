package com.mycelium.resilience;

import com.mycelium.resilience.api.NodeRole;
import com.mycelium.resilience.engine.EngineConfig;
import com.mycelium.resilience.io.GraphDefinition;

import java.util.ArrayList;
import java.util.List;

/**
 * Fluent builder for programmatic topologies.
 *
 * <pre>{@code
 * MyceliumGraph g = MyceliumGraph.builder("chain")
 *         .node("A").node("B")
 *         .edge("A", "B", 1.0)
 *         .build();
 * }</pre>
 *
 * The builder produces the same {@link GraphDefinition} a JSON file would, so
 * both routes share validation. It is stateful and not thread-safe; once
 * {@link #build()} is called it cannot be reused.
 */
public final class GraphBuilder {
    private static final double DEFAULT_RESOURCES = 100.0;
    private static final double DEFAULT_NODE_CAPACITY = 1000.0;
    private static final double DEFAULT_EDGE_CAPACITY = 10.0;

    private final String graphName;
    private final List<GraphDefinition.NodeDef> nodes = new ArrayList<>();
    private final List<GraphDefinition.EdgeDef> edges = new ArrayList<>();
    private EngineConfig config = new EngineConfig();

    // Flag to prevent modification after building
    private boolean built;

    private GraphBuilder(String graphName) {
        this.graphName = graphName;
    }

    public static GraphBuilder create(String graphName) {
        return new GraphBuilder(graphName);
    }

    public GraphBuilder config(EngineConfig config) {
        checkNotBuilt();
        this.config = config;
        return this;
    }

    public GraphBuilder directed(boolean directed) {
        checkNotBuilt();
        config.setDirected(directed);
        return this;
    }

    // ── Nodes ────────────────────────────────────────────────────

    public GraphBuilder node(String id) {
        return node(id, DEFAULT_RESOURCES, DEFAULT_NODE_CAPACITY, NodeRole.HYPHAL_TIP);
    }

    public GraphBuilder node(String id, double resources, double capacity) {
        return node(id, resources, capacity, NodeRole.HYPHAL_TIP);
    }

    public GraphBuilder node(String id, double resources, double capacity, NodeRole role) {
        checkNotBuilt();
        GraphDefinition.NodeDef nd = new GraphDefinition.NodeDef();
        nd.setId(id);
        nd.setResources(resources);
        nd.setCapacity(capacity);
        nd.setRole(role.name());
        nodes.add(nd);
        return this;
    }

    // ── Edges ────────────────────────────────────────────────────

    public GraphBuilder edge(String from, String to, double cost) {
        return edge(from, to, cost, DEFAULT_EDGE_CAPACITY);
    }

    public GraphBuilder edge(String from, String to, double cost, double capacity) {
        checkNotBuilt();
        GraphDefinition.EdgeDef ed = new GraphDefinition.EdgeDef();
        ed.setFrom(from);
        ed.setTo(to);
        ed.setCost(cost);
        ed.setCapacity(capacity);
        edges.add(ed);
        return this;
    }

    /** The definition accumulated so far. */
    public GraphDefinition toDefinition() {
        GraphDefinition.GraphInfo info = new GraphDefinition.GraphInfo();
        info.setName(graphName);
        info.setConfig(config);
        info.setNodes(new ArrayList<>(nodes));
        info.setEdges(new ArrayList<>(edges));
        GraphDefinition def = new GraphDefinition();
        def.setGraph(info);
        return def;
    }

    public MyceliumGraph build() {
        checkNotBuilt();
        built = true;
        return MyceliumGraph.fromDefinition(toDefinition());
    }

    private void checkNotBuilt() {
        if (built)
            throw new IllegalStateException("Builder already used for graph " + graphName);
    }
}
