package com.mycelium.resilience.model;

import com.mycelium.resilience.api.EdgeKey;
import com.mycelium.resilience.api.GraphStore;
import com.mycelium.resilience.api.Health;
import com.mycelium.resilience.api.NodeRole;
import com.mycelium.resilience.util.ErrorRateLimiter;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import lombok.extern.log4j.Log4j2;

/**
 * The mutable, attributed graph every engine component operates on.
 *
 * Storage layout:
 * - nodes: insertion-ordered map from identifier to {@link MycelialNode}.
 * - edges: insertion-ordered map from {@link EdgeKey} to {@link MycelialEdge}.
 * - incidence: for every node, the keys of all edges touching it (both
 * directions). Neighbor lookup and node deletion are O(degree).
 *
 * Traversability:
 * An edge is traversable only when the edge itself and both endpoints are
 * healthy. In a directed deployment an edge is additionally only traversable
 * from its {@code from} endpoint.
 *
 * Mirroring:
 * Every structural mutation (insertion, deletion, health change, growth) is
 * forwarded to the attached {@link GraphStore}, if any. A store that throws is
 * logged through a rate limiter and otherwise ignored; the model never depends
 * on the store's outcome.
 *
 * Thread Safety:
 * Not thread-safe. The {@code MyceliumGraph} facade serializes all access.
 */
@Log4j2
public final class GraphModel {
    private final boolean directed;
    private final Map<String, MycelialNode> nodes = new LinkedHashMap<>();
    private final Map<EdgeKey, MycelialEdge> edges = new LinkedHashMap<>();
    private final Map<String, Set<EdgeKey>> incidence = new HashMap<>();

    private final ErrorRateLimiter storeErrors = new ErrorRateLimiter(log, 1000);
    private GraphStore store;

    public GraphModel(boolean directed) {
        this.directed = directed;
    }

    public boolean isDirected() {
        return directed;
    }

    /**
     * Attaches the storage collaborator. Pass null to run purely in memory.
     */
    public void attachStore(GraphStore store) {
        this.store = store;
    }

    /** Builds the key of the edge between {@code a} and {@code b} for this graph's direction mode. */
    public EdgeKey key(String a, String b) {
        return EdgeKey.of(a, b, directed);
    }

    // ── Nodes ───────────────────────────────────────────────────────────

    /**
     * Inserts a node.
     *
     * @throws DuplicateIdentifierException if the identifier is taken.
     * @throws IllegalArgumentException     if the capacity or resource level is
     *                                      negative (a level above capacity is
     *                                      clamped).
     */
    public MycelialNode addNode(String id, double resourceLevel, double capacity, NodeRole role) {
        if (id == null || id.isBlank())
            throw new IllegalArgumentException("Node id must not be blank");
        if (!(capacity >= 0))
            throw new IllegalArgumentException("Negative capacity for node " + id + ": " + capacity);
        if (!(resourceLevel >= 0))
            throw new IllegalArgumentException("Negative resource level for node " + id + ": " + resourceLevel);
        if (nodes.containsKey(id))
            throw new DuplicateIdentifierException(id);

        MycelialNode node = new MycelialNode(id, role == null ? NodeRole.HYPHAL_TIP : role,
                Math.min(resourceLevel, capacity), capacity);
        nodes.put(id, node);
        incidence.put(id, new LinkedHashSet<>());
        mirrorNode(node);
        return node;
    }

    /**
     * Deletes a node and every edge incident to it.
     *
     * @throws NotFoundException if the node does not exist.
     */
    public void removeNode(String id) {
        if (!nodes.containsKey(id))
            throw new NotFoundException(id);
        for (EdgeKey key : new ArrayList<>(incidence.get(id)))
            detachEdge(key);
        nodes.remove(id);
        incidence.remove(id);
        if (store != null) {
            try {
                store.deleteNode(id);
            } catch (RuntimeException e) {
                storeErrors.log("Store rejected deleteNode(" + id + ")", e);
            }
        }
    }

    public boolean containsNode(String id) {
        return nodes.containsKey(id);
    }

    /**
     * @throws UnknownNodeException if the node does not exist.
     */
    public MycelialNode node(String id) {
        MycelialNode node = nodes.get(id);
        if (node == null)
            throw new UnknownNodeException(id);
        return node;
    }

    public Collection<MycelialNode> nodes() {
        return Collections.unmodifiableCollection(nodes.values());
    }

    public int nodeCount() {
        return nodes.size();
    }

    public int degree(String id) {
        node(id);
        return incidence.get(id).size();
    }

    /**
     * Sets a node's resource level, clamped into {@code [0, capacity]}.
     *
     * @return The level actually stored.
     */
    public double setResourceLevel(String id, double level) {
        MycelialNode node = node(id);
        double clamped = Math.max(0.0, Math.min(node.capacity(), level));
        node.resourceLevel(clamped);
        return clamped;
    }

    /**
     * Adds {@code delta} (possibly negative) to a node's resource level, clamped
     * into {@code [0, capacity]}.
     *
     * @return The change actually applied.
     */
    public double adjustResourceLevel(String id, double delta) {
        MycelialNode node = node(id);
        double before = node.resourceLevel();
        return setResourceLevel(id, before + delta) - before;
    }

    public void setNodeHealth(String id, Health health) {
        MycelialNode node = node(id);
        if (node.health() == health)
            return;
        node.health(health);
        mirrorNode(node);
    }

    // ── Edges ───────────────────────────────────────────────────────────

    /**
     * Inserts an edge from the initial topology.
     *
     * @throws UnknownEndpointException     if an endpoint does not exist.
     * @throws DuplicateIdentifierException if the edge already exists.
     * @throws IllegalArgumentException     for a self-loop, a non-positive cost or a
     *                                      negative capacity.
     */
    public MycelialEdge addEdge(String a, String b, double baseCost, double capacity) {
        return insertEdge(a, b, baseCost, capacity, false);
    }

    /**
     * Inserts an edge created by a repair. Same contract as
     * {@link #addEdge(String, String, double, double)}.
     */
    public MycelialEdge growEdge(String a, String b, double baseCost, double capacity) {
        return insertEdge(a, b, baseCost, capacity, true);
    }

    private MycelialEdge insertEdge(String a, String b, double baseCost, double capacity, boolean grown) {
        if (!nodes.containsKey(a))
            throw new UnknownEndpointException(a, a, b);
        if (!nodes.containsKey(b))
            throw new UnknownEndpointException(b, a, b);
        if (a.equals(b))
            throw new IllegalArgumentException("Self-edge not allowed: " + a);
        if (!(baseCost > 0) || Double.isInfinite(baseCost))
            throw new IllegalArgumentException("Edge cost must be positive and finite: " + a + "-" + b + " = " + baseCost);
        if (!(capacity >= 0))
            throw new IllegalArgumentException("Negative capacity for edge " + a + "-" + b + ": " + capacity);

        EdgeKey key = key(a, b);
        if (edges.containsKey(key))
            throw new DuplicateIdentifierException(key.toString());

        MycelialEdge edge = new MycelialEdge(key, baseCost, capacity, grown);
        edges.put(key, edge);
        incidence.get(key.from()).add(key);
        incidence.get(key.to()).add(key);
        mirrorEdge(edge);
        return edge;
    }

    /**
     * @throws NotFoundException if the edge does not exist.
     */
    public void removeEdge(String a, String b) {
        EdgeKey key = key(a, b);
        if (!edges.containsKey(key))
            throw new NotFoundException(key.toString());
        detachEdge(key);
    }

    private void detachEdge(EdgeKey key) {
        edges.remove(key);
        incidence.get(key.from()).remove(key);
        incidence.get(key.to()).remove(key);
        if (store != null) {
            try {
                store.deleteEdge(key);
            } catch (RuntimeException e) {
                storeErrors.log("Store rejected deleteEdge(" + key + ")", e);
            }
        }
    }

    public boolean containsEdge(String a, String b) {
        return edges.containsKey(key(a, b));
    }

    /**
     * @throws NotFoundException if the edge does not exist.
     */
    public MycelialEdge edge(String a, String b) {
        return edge(key(a, b));
    }

    /**
     * @throws NotFoundException if the edge does not exist.
     */
    public MycelialEdge edge(EdgeKey key) {
        MycelialEdge edge = edges.get(key);
        if (edge == null)
            throw new NotFoundException(key.toString());
        return edge;
    }

    public Collection<MycelialEdge> edges() {
        return Collections.unmodifiableCollection(edges.values());
    }

    public int edgeCount() {
        return edges.size();
    }

    public void setEdgeHealth(EdgeKey key, Health health) {
        MycelialEdge edge = edge(key);
        if (edge.health() == health)
            return;
        edge.health(health);
        mirrorEdge(edge);
    }

    /**
     * Sets the reinforcement factor of an edge.
     *
     * @throws IllegalArgumentException unless {@code 0 < factor <= 1}.
     */
    public void setReinforcement(EdgeKey key, double factor) {
        if (!(factor > 0) || factor > 1.0)
            throw new IllegalArgumentException("Reinforcement factor out of (0, 1]: " + factor);
        edge(key).reinforcement(factor);
    }

    /** Increments the usage counter of an edge. Negative counts are rejected. */
    public void recordUsage(EdgeKey key, long times) {
        if (times < 0)
            throw new IllegalArgumentException("Usage can only grow: " + times);
        edge(key).addUsage(times);
    }

    // ── Traversal ───────────────────────────────────────────────────────

    /** All edges touching a node, regardless of health or direction. */
    public List<MycelialEdge> incidentEdges(String id) {
        node(id);
        List<MycelialEdge> out = new ArrayList<>(incidence.get(id).size());
        for (EdgeKey key : incidence.get(id))
            out.add(edges.get(key));
        return out;
    }

    /** True when the edge and both of its endpoints are healthy. */
    public boolean isTraversable(MycelialEdge edge) {
        return edge.isHealthy()
                && nodes.get(edge.key().from()).isHealthy()
                && nodes.get(edge.key().to()).isHealthy();
    }

    /**
     * Edges that can be followed out of {@code id}: traversable, and leaving
     * {@code id} when the graph is directed. Empty for a damaged node.
     */
    public List<MycelialEdge> traversableEdgesFrom(String id) {
        MycelialNode node = node(id);
        if (!node.isHealthy())
            return List.of();
        List<MycelialEdge> out = new ArrayList<>();
        for (EdgeKey key : incidence.get(id)) {
            MycelialEdge edge = edges.get(key);
            if (directed && !key.from().equals(id))
                continue;
            if (isTraversable(edge))
                out.add(edge);
        }
        return out;
    }

    private void mirrorNode(MycelialNode node) {
        if (store == null)
            return;
        try {
            store.upsertNode(node.id(), node.attributes());
        } catch (RuntimeException e) {
            storeErrors.log("Store rejected upsertNode(" + node.id() + ")", e);
        }
    }

    private void mirrorEdge(MycelialEdge edge) {
        if (store == null)
            return;
        try {
            store.upsertEdge(edge.key(), edge.attributes());
        } catch (RuntimeException e) {
            storeErrors.log("Store rejected upsertEdge(" + edge.key() + ")", e);
        }
    }
}
