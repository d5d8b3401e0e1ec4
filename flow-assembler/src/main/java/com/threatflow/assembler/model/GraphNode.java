package com.threatflow.assembler.model;

import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * A node handed to the caller. {@code payload.id} already holds the display id.
 */
public final class GraphNode {
    public final String displayId;
    public final String originalId;
    public final ObjectNode payload;

    public GraphNode(String displayId, String originalId, ObjectNode payload) {
        this.displayId = displayId;
        this.originalId = originalId;
        this.payload = payload;
    }

    @Override
    public String toString() {
        return "GraphNode{" + originalId + " -> " + displayId + "}";
    }
}
