package com.mycelium.resilience.engine;

import com.mycelium.resilience.api.EdgeKey;

import java.util.List;

/**
 * One route returned by path discovery.
 *
 * @param label "primary" for the cheapest route, "alternative_N" for the others
 * @param nodes node identifiers from source to target
 * @param edges edges in traversal order; empty for a zero-length path
 * @param cost  total effective cost at discovery time, without diversity penalties
 */
public record HyphalPath(String label, List<String> nodes, List<EdgeKey> edges, double cost) {

    public HyphalPath {
        nodes = List.copyOf(nodes);
        edges = List.copyOf(edges);
    }

    public String source() {
        return nodes.get(0);
    }

    public String target() {
        return nodes.get(nodes.size() - 1);
    }

    public int hops() {
        return edges.size();
    }

    public boolean isZeroLength() {
        return edges.isEmpty();
    }
}
