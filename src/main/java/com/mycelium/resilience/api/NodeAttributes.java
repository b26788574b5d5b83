package com.mycelium.resilience.api;

/**
 * Immutable snapshot of a node's attributes, as handed to a {@link GraphStore}.
 */
public record NodeAttributes(double resourceLevel, double capacity, Health health, NodeRole role) {
}
