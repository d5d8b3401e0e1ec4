package com.threatflow.assembler.model;

import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * An edge handed to the caller, with both endpoints rewritten into display ids.
 */
public final class GraphEdge {
    public final String id;
    public final String sourceDisplayId;
    public final String targetDisplayId;
    public final String originalSourceId;
    public final String originalTargetId;
    public final ObjectNode payload;

    public GraphEdge(
            String id,
            String sourceDisplayId,
            String targetDisplayId,
            String originalSourceId,
            String originalTargetId,
            ObjectNode payload) {
        this.id = id;
        this.sourceDisplayId = sourceDisplayId;
        this.targetDisplayId = targetDisplayId;
        this.originalSourceId = originalSourceId;
        this.originalTargetId = originalTargetId;
        this.payload = payload;
    }

    @Override
    public String toString() {
        return "GraphEdge{" + id + "}";
    }
}
