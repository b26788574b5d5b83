package com.mycelium.resilience.util;

import com.mycelium.resilience.model.GraphModel;
import com.mycelium.resilience.model.MycelialEdge;
import com.mycelium.resilience.model.MycelialNode;

/**
 * Diagnostic utility for inspecting graph state and topology.
 *
 * Intended for debugging sessions and error logs. Not for repeated use inside
 * an algorithm: every call allocates strings and walks collections.
 */
public final class GraphExplain {
    private final GraphModel graph;

    public GraphExplain(GraphModel graph) {
        this.graph = graph;
    }

    /**
     * Dumps detailed state of a single node.
     */
    public String explainNode(String nodeId) {
        MycelialNode node = graph.node(nodeId);
        StringBuilder sb = new StringBuilder(256);
        sb.append("Node: ").append(nodeId).append('\n')
                .append("  Role: ").append(node.role()).append('\n')
                .append("  Health: ").append(node.health()).append('\n')
                .append(String.format("  Resources: %.2f / %.2f%n", node.resourceLevel(), node.capacity()));
        var incident = graph.incidentEdges(nodeId);
        sb.append("  Edges (").append(incident.size()).append("): ");
        for (int i = 0; i < incident.size(); i++) {
            MycelialEdge e = incident.get(i);
            sb.append(e.key().other(nodeId));
            if (!e.isHealthy())
                sb.append(" [damaged]");
            if (i < incident.size() - 1)
                sb.append(", ");
        }
        return sb.append('\n').toString();
    }

    /**
     * Dumps the entire topology, one node per line followed by one edge per line.
     */
    public String dumpTopology() {
        String arrow = graph.isDirected() ? " -> " : " -- ";
        StringBuilder sb = new StringBuilder(1024);
        sb.append("Graph (").append(graph.nodeCount()).append(" nodes, ")
                .append(graph.edgeCount()).append(" edges):\n");
        for (MycelialNode n : graph.nodes()) {
            sb.append("  ").append(n.id()).append(" (").append(n.role()).append(')');
            if (!n.isHealthy())
                sb.append(" DAMAGED");
            sb.append('\n');
        }
        for (MycelialEdge e : graph.edges()) {
            sb.append("  ").append(e.key().from()).append(arrow).append(e.key().to())
                    .append(String.format(" cost=%.3f/%.3f cap=%.1f used=%d", e.effectiveCost(), e.baseCost(),
                            e.capacity(), e.usageCount()));
            if (e.isGrown())
                sb.append(" (grown)");
            if (!e.isHealthy())
                sb.append(" DAMAGED");
            sb.append('\n');
        }
        return sb.toString();
    }
}
