package com.mycelium.resilience.api;

/**
 * Storage collaborator that mirrors the engine's graph.
 *
 * The engine calls these methods after every structural mutation (node or edge
 * insertion, deletion, health change, edge growth). Calls are fire-and-forget:
 * the engine never waits for a confirmation and never makes a decision based on
 * the outcome. Failures surface only in the logs.
 *
 * Implementations are invoked from the mirror's consumer thread, never from the
 * engine thread, when wrapped in a
 * {@link com.mycelium.resilience.wiring.DisruptorStorageMirror}.
 */
public interface GraphStore {

    void upsertNode(String nodeId, NodeAttributes attributes);

    void upsertEdge(EdgeKey endpoints, EdgeAttributes attributes);

    void deleteNode(String nodeId);

    void deleteEdge(EdgeKey endpoints);
}
