package com.mycelium.resilience.api;

/**
 * Health state of a node or an edge.
 *
 * Damaged elements are excluded from path discovery and flow distribution
 * outright; they are never merely deprioritized.
 */
public enum Health {
    HEALTHY,
    DAMAGED
}
