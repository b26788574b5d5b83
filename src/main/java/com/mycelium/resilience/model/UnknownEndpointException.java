package com.mycelium.resilience.model;

/** Thrown when an edge insertion names an endpoint that is not in the graph. */
public class UnknownEndpointException extends UnknownNodeException {

    public UnknownEndpointException(String nodeId, String from, String to) {
        super(nodeId, "Unknown endpoint " + nodeId + " for edge " + from + "-" + to);
    }
}
