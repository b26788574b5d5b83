package com.mycelium.resilience.api;

/**
 * Immutable snapshot of an edge's attributes, as handed to a {@link GraphStore}.
 *
 * @param grown true when the edge was created by a repair rather than by the
 *              initial topology
 */
public record EdgeAttributes(double baseCost, double effectiveCost, double capacity, long usageCount,
        Health health, boolean grown) {
}
