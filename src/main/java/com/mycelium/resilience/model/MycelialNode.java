package com.mycelium.resilience.model;

import com.mycelium.resilience.api.Health;
import com.mycelium.resilience.api.NodeAttributes;
import com.mycelium.resilience.api.NodeRole;

/**
 * A node of the mycelial network.
 *
 * Instances are owned by a {@link GraphModel}; all mutation goes through the
 * model so that invariants (clamped resource level, storage mirroring) hold.
 * Readers outside the model only see the accessors.
 */
public final class MycelialNode {
    private final String id;
    private final NodeRole role;
    private final double capacity;
    private double resourceLevel;
    private Health health = Health.HEALTHY;

    MycelialNode(String id, NodeRole role, double resourceLevel, double capacity) {
        this.id = id;
        this.role = role;
        this.capacity = capacity;
        this.resourceLevel = resourceLevel;
    }

    public String id() {
        return id;
    }

    public NodeRole role() {
        return role;
    }

    public double capacity() {
        return capacity;
    }

    public double resourceLevel() {
        return resourceLevel;
    }

    /** Free room left before the node reaches its capacity. */
    public double headroom() {
        return capacity - resourceLevel;
    }

    public Health health() {
        return health;
    }

    public boolean isHealthy() {
        return health == Health.HEALTHY;
    }

    public NodeAttributes attributes() {
        return new NodeAttributes(resourceLevel, capacity, health, role);
    }

    void resourceLevel(double level) {
        this.resourceLevel = level;
    }

    void health(Health health) {
        this.health = health;
    }

    @Override
    public String toString() {
        return "MycelialNode{" + id + ", " + health + ", resources=" + resourceLevel + "/" + capacity + "}";
    }
}
