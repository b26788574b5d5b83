package com.mycelium.resilience.engine;

import com.mycelium.resilience.model.GraphModel;
import com.mycelium.resilience.model.MycelialEdge;
import com.mycelium.resilience.model.MycelialNode;

import java.util.ArrayDeque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Read-only measurements over a {@link GraphModel}. Nothing here mutates the
 * graph.
 *
 * The average path length is an unweighted all-pairs BFS over the largest
 * healthy component, ignoring edge direction (the same view the component
 * computation uses). Cost is O(V * E) for that component.
 */
public final class GraphMetrics {

    private GraphMetrics() {
    }

    public static MetricsSnapshot snapshot(GraphModel graph, long lastRepairElapsedNanos) {
        ConnectedComponents components = ConnectedComponents.of(graph);
        int nodes = graph.nodeCount();

        int healthyNodes = 0;
        for (MycelialNode n : graph.nodes())
            if (n.isHealthy())
                healthyNodes++;
        int healthyEdges = 0;
        for (MycelialEdge e : graph.edges())
            if (e.isHealthy())
                healthyEdges++;

        int largest = components.largestIndex();
        double ratio = nodes == 0 ? 0.0 : (double) components.largestSize() / nodes;
        double avgPath = largest < 0 ? 0.0 : averageHops(graph, components.members(largest));

        return new MetricsSnapshot(components.count(), ratio, avgPath, nodes, healthyNodes,
                graph.edgeCount(), healthyEdges, lastRepairElapsedNanos);
    }

    static double averageHops(GraphModel graph, List<String> component) {
        if (component.size() < 2)
            return 0.0;
        long totalHops = 0;
        long pairs = 0;
        ArrayDeque<String> queue = new ArrayDeque<>();
        for (String origin : component) {
            Map<String, Integer> dist = new HashMap<>();
            dist.put(origin, 0);
            queue.add(origin);
            while (!queue.isEmpty()) {
                String current = queue.poll();
                int d = dist.get(current);
                for (MycelialEdge edge : graph.incidentEdges(current)) {
                    if (!graph.isTraversable(edge))
                        continue;
                    String next = edge.key().other(current);
                    if (dist.putIfAbsent(next, d + 1) == null) {
                        totalHops += d + 1;
                        pairs++;
                        queue.add(next);
                    }
                }
            }
        }
        return pairs == 0 ? 0.0 : (double) totalHops / pairs;
    }
}
