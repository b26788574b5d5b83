package com.mycelium.resilience.api;

import java.util.Objects;

/**
 * Identity of an edge: its pair of endpoints.
 *
 * Undirected keys are normalized so that the lexicographically smaller
 * identifier is always {@code from}; directed keys keep the given order.
 */
public record EdgeKey(String from, String to) {

    public EdgeKey {
        Objects.requireNonNull(from, "from");
        Objects.requireNonNull(to, "to");
    }

    public static EdgeKey of(String a, String b, boolean directed) {
        return directed ? directed(a, b) : undirected(a, b);
    }

    public static EdgeKey directed(String from, String to) {
        return new EdgeKey(from, to);
    }

    public static EdgeKey undirected(String a, String b) {
        return a.compareTo(b) <= 0 ? new EdgeKey(a, b) : new EdgeKey(b, a);
    }

    public boolean touches(String nodeId) {
        return from.equals(nodeId) || to.equals(nodeId);
    }

    /**
     * Returns the endpoint opposite to {@code nodeId}.
     *
     * @throws IllegalArgumentException if {@code nodeId} is not an endpoint
     */
    public String other(String nodeId) {
        if (from.equals(nodeId))
            return to;
        if (to.equals(nodeId))
            return from;
        throw new IllegalArgumentException(nodeId + " is not an endpoint of " + this);
    }

    @Override
    public String toString() {
        return from + "-" + to;
    }
}
