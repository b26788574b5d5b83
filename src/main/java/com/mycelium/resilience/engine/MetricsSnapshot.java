package com.mycelium.resilience.engine;

import java.time.Duration;

/**
 * Point-in-time measurements of a graph.
 *
 * @param componentCount          Connected components of the healthy subgraph.
 * @param largestComponentRatio   Largest healthy component size over total node
 *                                count (0 for an empty graph).
 * @param averagePathLength       Mean hop count between distinct nodes of the
 *                                largest component (0 when it has one node).
 * @param nodeCount               All nodes, damaged included.
 * @param healthyNodeCount        Healthy nodes.
 * @param edgeCount               All edges, damaged included.
 * @param healthyEdgeCount        Healthy edges.
 * @param lastRepairElapsedNanos  Wall time of the most recent repair, 0 if none
 *                                ran.
 */
public record MetricsSnapshot(
        int componentCount,
        double largestComponentRatio,
        double averagePathLength,
        int nodeCount,
        int healthyNodeCount,
        int edgeCount,
        int healthyEdgeCount,
        long lastRepairElapsedNanos) {

    public Duration lastRepairElapsed() {
        return Duration.ofNanos(lastRepairElapsedNanos);
    }
}
