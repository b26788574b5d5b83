package com.mycelium.resilience.model;

/** Thrown when an operation references a node that is not in the graph. */
public class UnknownNodeException extends MyceliumException {
    private final String nodeId;

    public UnknownNodeException(String nodeId) {
        this(nodeId, "Unknown node: " + nodeId);
    }

    protected UnknownNodeException(String nodeId, String message) {
        super(message);
        this.nodeId = nodeId;
    }

    public String nodeId() {
        return nodeId;
    }
}
