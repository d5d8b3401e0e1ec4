package com.threatflow.assembler.model;

import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * An edge held back until both of its endpoints have been emitted.
 */
public final class PendingEdge {
    public final String edgeId;
    public final ObjectNode edge;
    public final String sourceId;
    public final String targetId;
    public final long createdAtMs;

    public PendingEdge(String edgeId, ObjectNode edge, String sourceId, String targetId, long createdAtMs) {
        this.edgeId = edgeId;
        this.edge = edge;
        this.sourceId = sourceId;
        this.targetId = targetId;
        this.createdAtMs = createdAtMs;
    }

    public boolean touches(String originalNodeId) {
        return sourceId.equals(originalNodeId) || targetId.equals(originalNodeId);
    }

    @Override
    public String toString() {
        return "PendingEdge{" + edgeId + ": " + sourceId + " -> " + targetId + "}";
    }
}
