package com.mycelium.resilience.api;

/** Functional role of a node inside the network. */
public enum NodeRole {
    SOURCE,
    INTERMEDIATE,
    SINK,
    HYPHAL_TIP;

    /**
     * Lenient parse used by topology definitions ("hyphal_tip", "Sink", ...).
     * A null or blank value maps to {@link #HYPHAL_TIP}.
     */
    public static NodeRole fromString(String value) {
        if (value == null || value.isBlank())
            return HYPHAL_TIP;
        try {
            return valueOf(value.trim().toUpperCase().replace('-', '_'));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown node role: " + value, e);
        }
    }
}
