package com.mycelium.resilience.wiring;

import com.mycelium.resilience.api.EdgeAttributes;
import com.mycelium.resilience.api.EdgeKey;
import com.mycelium.resilience.api.NodeAttributes;

/**
 * A mutable holder for one storage mutation, pre-allocated in the mirror's ring
 * buffer and reused for the lifetime of the mirror.
 *
 * Only the fields relevant to {@link #kind()} are set; {@link #clear()} drops
 * references once the event is consumed so the slot does not pin snapshots.
 */
public final class StorageEvent {

    public enum Kind {
        UPSERT_NODE, UPSERT_EDGE, DELETE_NODE, DELETE_EDGE
    }

    private Kind kind;
    private String nodeId;
    private EdgeKey edgeKey;
    private NodeAttributes nodeAttributes;
    private EdgeAttributes edgeAttributes;
    private long sequenceId;

    public void setNodeUpsert(String nodeId, NodeAttributes attributes, long seqId) {
        set(Kind.UPSERT_NODE, nodeId, null, attributes, null, seqId);
    }

    public void setEdgeUpsert(EdgeKey key, EdgeAttributes attributes, long seqId) {
        set(Kind.UPSERT_EDGE, null, key, null, attributes, seqId);
    }

    public void setNodeDelete(String nodeId, long seqId) {
        set(Kind.DELETE_NODE, nodeId, null, null, null, seqId);
    }

    public void setEdgeDelete(EdgeKey key, long seqId) {
        set(Kind.DELETE_EDGE, null, key, null, null, seqId);
    }

    private void set(Kind kind, String nodeId, EdgeKey edgeKey, NodeAttributes nodeAttributes,
            EdgeAttributes edgeAttributes, long seqId) {
        this.kind = kind;
        this.nodeId = nodeId;
        this.edgeKey = edgeKey;
        this.nodeAttributes = nodeAttributes;
        this.edgeAttributes = edgeAttributes;
        this.sequenceId = seqId;
    }

    public Kind kind() {
        return kind;
    }

    public String nodeId() {
        return nodeId;
    }

    public EdgeKey edgeKey() {
        return edgeKey;
    }

    public NodeAttributes nodeAttributes() {
        return nodeAttributes;
    }

    public EdgeAttributes edgeAttributes() {
        return edgeAttributes;
    }

    public long sequenceId() {
        return sequenceId;
    }

    public void clear() {
        kind = null;
        nodeId = null;
        edgeKey = null;
        nodeAttributes = null;
        edgeAttributes = null;
        sequenceId = 0;
    }
}
