package com.mycelium.resilience.io;

import java.util.List;

import com.mycelium.resilience.api.NodeRole;
import com.mycelium.resilience.engine.EngineConfig;
import com.mycelium.resilience.model.GraphModel;

import lombok.extern.log4j.Log4j2;

/**
 * Compiles a {@link GraphDefinition} into a populated {@link GraphModel}.
 */
@Log4j2
public final class GraphCompiler {

    /** A compiled network with the configuration it was declared with. */
    public record CompiledGraph(String name, GraphModel model, EngineConfig config) {
    }

    /**
     * @throws IllegalArgumentException if the definition declares an invalid
     *                                  element or configuration.
     * @throws com.mycelium.resilience.model.MyceliumException for duplicate
     *                                                         identifiers or
     *                                                         dangling edges.
     */
    public CompiledGraph compile(GraphDefinition def) {
        GraphDefinition.GraphInfo info = def.getGraph();
        if (info == null)
            throw new IllegalArgumentException("Graph definition has no 'graph' block");
        EngineConfig config = info.getConfig() != null ? info.getConfig() : new EngineConfig();
        config.validate();

        GraphModel model = new GraphModel(config.isDirected());
        List<GraphDefinition.NodeDef> nodes = info.getNodes() != null ? info.getNodes() : List.of();
        List<GraphDefinition.EdgeDef> edges = info.getEdges() != null ? info.getEdges() : List.of();

        for (GraphDefinition.NodeDef nd : nodes)
            model.addNode(nd.getId(), nd.getResources(), nd.getCapacity(), NodeRole.fromString(nd.getRole()));
        for (GraphDefinition.EdgeDef ed : edges) {
            if (ed.getFrom() == null || ed.getTo() == null)
                throw new IllegalArgumentException("Edge definition missing endpoint: " + ed);
            model.addEdge(ed.getFrom(), ed.getTo(), ed.getCost(), ed.getCapacity());
        }

        String name = info.getName() != null ? info.getName() : "unnamed";
        log.info("Compiled graph '{}': {} nodes, {} edges ({})", name, model.nodeCount(), model.edgeCount(),
                config.isDirected() ? "directed" : "undirected");
        return new CompiledGraph(name, model, config);
    }
}
