package com.mycelium.resilience.store;

import com.mycelium.resilience.api.EdgeAttributes;
import com.mycelium.resilience.api.EdgeKey;
import com.mycelium.resilience.api.GraphStore;
import com.mycelium.resilience.api.NodeAttributes;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Keeps the latest attributes of every mirrored element in memory. Safe to read
 * from any thread while the mirror's consumer writes to it.
 */
public final class InMemoryGraphStore implements GraphStore {
    private final Map<String, NodeAttributes> nodes = new ConcurrentHashMap<>();
    private final Map<EdgeKey, EdgeAttributes> edges = new ConcurrentHashMap<>();

    @Override
    public void upsertNode(String id, NodeAttributes attributes) {
        nodes.put(id, attributes);
    }

    @Override
    public void upsertEdge(EdgeKey key, EdgeAttributes attributes) {
        edges.put(key, attributes);
    }

    @Override
    public void deleteNode(String id) {
        nodes.remove(id);
    }

    @Override
    public void deleteEdge(EdgeKey key) {
        edges.remove(key);
    }

    /** @return The stored attributes, or null. */
    public NodeAttributes node(String id) {
        return nodes.get(id);
    }

    /** @return The stored attributes, or null. */
    public EdgeAttributes edge(EdgeKey key) {
        return edges.get(key);
    }

    public int nodeCount() {
        return nodes.size();
    }

    public int edgeCount() {
        return edges.size();
    }

    public Map<String, NodeAttributes> nodes() {
        return Map.copyOf(nodes);
    }

    public Map<EdgeKey, EdgeAttributes> edges() {
        return Map.copyOf(edges);
    }
}
