package com.mycelium.resilience.store;

import com.mycelium.resilience.api.EdgeAttributes;
import com.mycelium.resilience.api.EdgeKey;
import com.mycelium.resilience.api.GraphStore;
import com.mycelium.resilience.api.NodeAttributes;

import lombok.extern.log4j.Log4j2;

/**
 * Writes every storage call to the log. Useful as a stand-in collaborator when
 * tracing what a run would persist.
 */
@Log4j2
public final class LoggingGraphStore implements GraphStore {

    @Override
    public void upsertNode(String id, NodeAttributes attributes) {
        log.info("upsert node {} {}", id, attributes);
    }

    @Override
    public void upsertEdge(EdgeKey key, EdgeAttributes attributes) {
        log.info("upsert edge {} {}", key, attributes);
    }

    @Override
    public void deleteNode(String id) {
        log.info("delete node {}", id);
    }

    @Override
    public void deleteEdge(EdgeKey key) {
        log.info("delete edge {}", key);
    }
}
