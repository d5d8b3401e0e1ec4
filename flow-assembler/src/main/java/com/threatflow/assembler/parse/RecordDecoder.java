package com.threatflow.assembler.parse;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.threatflow.assembler.model.ParsedRecord;
import com.threatflow.assembler.model.RecordError;
import com.threatflow.assembler.util.JsonSupport;
import com.threatflow.assembler.util.StringSemantics;

import java.util.List;

/**
 * Decodes a single line of model output into a {@link ParsedRecord}.
 *
 * <p>Lines that are not JSON objects (prose, markdown fences, stray arrays) and objects
 * carrying nothing routable return {@code null}. Nothing here throws for bad input.
 */
final class RecordDecoder {
    private static final Logger LOG = LoggerFactory.getLogger(RecordDecoder.class);

    private RecordDecoder() {}

    static ParsedRecord decode(String line) {
        String trimmed = line == null ? "" : line.trim();
        if (trimmed.isEmpty()) {
            return null;
        }
        if (trimmed.charAt(0) != '{') {
            LOG.trace("Skipping non-JSON line: {}", StringSemantics.preview(trimmed));
            return null;
        }

        JsonNode root;
        try {
            root = JsonSupport.readTree(trimmed);
        } catch (JsonProcessingException ex) {
            LOG.trace("Skipping malformed JSON line ({}): {}",
                    ex.getOriginalMessage(), StringSemantics.preview(trimmed));
            return null;
        }
        if (root == null || !root.isObject()) {
            return null;
        }

        List<ObjectNode> nodes = JsonNodeUtils.objectElements(root.get("nodes"));
        List<ObjectNode> edges = JsonNodeUtils.objectElements(root.get("edges"));
        boolean hasGraphArrays = JsonNodeUtils.isArray(root.get("nodes")) || JsonNodeUtils.isArray(root.get("edges"));
        RecordError error = readError(root.get("error"));
        JsonNode iocAnalysis = JsonNodeUtils.isAbsent(root.get("ioc_analysis")) ? null : root.get("ioc_analysis");

        String progressStage = null;
        String progressMessage = null;
        JsonNode progress = root.get("progress");
        if (!JsonNodeUtils.isAbsent(progress) && progress.isObject()) {
            progressStage = JsonNodeUtils.asNullableText(progress.get("stage"));
            progressMessage = JsonNodeUtils.asNullableText(progress.get("message"));
        } else if ("progress".equals(JsonNodeUtils.asNullableText(root.get("type")))) {
            progressStage = JsonNodeUtils.asNullableText(root.get("stage"));
            progressMessage = JsonNodeUtils.asNullableText(root.get("message"));
        }
        boolean hasProgress = progressStage != null || progressMessage != null;

        if (!hasGraphArrays && error == null && iocAnalysis == null && !hasProgress) {
            LOG.trace("Skipping JSON line without routable content: {}", StringSemantics.preview(trimmed));
            return null;
        }
        return new ParsedRecord(nodes, edges, error, iocAnalysis, progressStage, progressMessage, trimmed);
    }

    private static RecordError readError(JsonNode node) {
        if (JsonNodeUtils.isAbsent(node)) {
            return null;
        }
        if (node.isTextual()) {
            return new RecordError(null, node.asText(), null);
        }
        if (node.isObject()) {
            return new RecordError(
                    JsonNodeUtils.asNullableText(node.get("code")),
                    StringSemantics.firstNonBlank(JsonNodeUtils.asNullableText(node.get("message")), "Unknown model error"),
                    JsonNodeUtils.asNullableText(node.get("details")));
        }
        return new RecordError(null, node.toString(), null);
    }
}
