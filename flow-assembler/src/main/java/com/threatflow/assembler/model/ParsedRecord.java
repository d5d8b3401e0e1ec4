package com.threatflow.assembler.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.Collections;
import java.util.List;

/**
 * One decoded line of model output. Transient: routed once and dropped.
 *
 * <p>Node and edge descriptors are kept exactly as the model produced them; the only
 * field the assembler interprets is {@code id} (and {@code source}/{@code target} on edges).
 */
public final class ParsedRecord {
    public final List<ObjectNode> nodes;
    public final List<ObjectNode> edges;
    public final RecordError error;
    public final JsonNode iocAnalysis;
    public final String progressStage;
    public final String progressMessage;
    public final String rawLine;

    public ParsedRecord(
            List<ObjectNode> nodes,
            List<ObjectNode> edges,
            RecordError error,
            JsonNode iocAnalysis,
            String progressStage,
            String progressMessage,
            String rawLine) {
        this.nodes = nodes == null ? Collections.emptyList() : Collections.unmodifiableList(nodes);
        this.edges = edges == null ? Collections.emptyList() : Collections.unmodifiableList(edges);
        this.error = error;
        this.iocAnalysis = iocAnalysis;
        this.progressStage = progressStage;
        this.progressMessage = progressMessage;
        this.rawLine = rawLine;
    }

    public boolean hasGraphElements() {
        return !nodes.isEmpty() || !edges.isEmpty();
    }

    public boolean hasProgress() {
        return progressStage != null || progressMessage != null;
    }

    @Override
    public String toString() {
        return "ParsedRecord{nodes=" + nodes.size()
                + ", edges=" + edges.size()
                + ", error=" + (error != null)
                + ", iocAnalysis=" + (iocAnalysis != null)
                + ", progress=" + hasProgress() + "}";
    }
}
