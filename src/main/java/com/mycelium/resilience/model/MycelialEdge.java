package com.mycelium.resilience.model;

import com.mycelium.resilience.api.EdgeAttributes;
import com.mycelium.resilience.api.EdgeKey;
import com.mycelium.resilience.api.Health;

/**
 * A hyphal connection between two nodes.
 *
 * The effective cost is the static base cost scaled by a reinforcement factor in
 * (0, 1]. Flow lowers the factor (a used pathway gets cheaper), disuse lets it
 * drift back to 1. The usage counter is a historical signal and never goes down.
 */
public final class MycelialEdge {
    private final EdgeKey key;
    private final double baseCost;
    private final double capacity;
    private final boolean grown;
    private double reinforcement = 1.0;
    private long usageCount;
    private Health health = Health.HEALTHY;

    MycelialEdge(EdgeKey key, double baseCost, double capacity, boolean grown) {
        this.key = key;
        this.baseCost = baseCost;
        this.capacity = capacity;
        this.grown = grown;
    }

    public EdgeKey key() {
        return key;
    }

    public double baseCost() {
        return baseCost;
    }

    public double reinforcement() {
        return reinforcement;
    }

    public double effectiveCost() {
        return baseCost * reinforcement;
    }

    public double capacity() {
        return capacity;
    }

    public long usageCount() {
        return usageCount;
    }

    public Health health() {
        return health;
    }

    public boolean isHealthy() {
        return health == Health.HEALTHY;
    }

    /** True when this edge was created by a repair. */
    public boolean isGrown() {
        return grown;
    }

    public EdgeAttributes attributes() {
        return new EdgeAttributes(baseCost, effectiveCost(), capacity, usageCount, health, grown);
    }

    void reinforcement(double factor) {
        this.reinforcement = factor;
    }

    void addUsage(long times) {
        this.usageCount += times;
    }

    void health(Health health) {
        this.health = health;
    }

    @Override
    public String toString() {
        return "MycelialEdge{" + key + ", " + health + ", cost=" + effectiveCost() + "/" + baseCost
                + ", capacity=" + capacity + ", usage=" + usageCount + (grown ? ", grown" : "") + "}";
    }
}
