package com.threatflow.assembler.parse;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Shared JSON helper methods for reading optional fields of model output with safe defaults.
 */
public final class JsonNodeUtils {
    private JsonNodeUtils() {}

    public static boolean isAbsent(JsonNode node) {
        return node == null || node.isMissingNode() || node.isNull();
    }

    public static String asNullableText(JsonNode node) {
        if (isAbsent(node) || node.isContainerNode()) {
            return null;
        }
        String value = node.asText();
        return value == null || value.isEmpty() ? null : value;
    }

    /**
     * Reads an identifier field. Models sometimes emit numeric ids; those are accepted as text.
     */
    public static String asIdentifier(JsonNode node) {
        if (isAbsent(node)) {
            return null;
        }
        if (node.isTextual() || node.isIntegralNumber()) {
            return node.asText();
        }
        return null;
    }

    public static boolean isArray(JsonNode node) {
        return !isAbsent(node) && node.isArray();
    }

    /**
     * Returns the object elements of {@code node} in order; non-object elements are dropped.
     */
    public static List<ObjectNode> objectElements(JsonNode node) {
        if (!isArray(node) || node.size() == 0) {
            return Collections.emptyList();
        }
        List<ObjectNode> results = new ArrayList<>(node.size());
        for (JsonNode element : node) {
            if (element.isObject()) {
                results.add((ObjectNode) element);
            }
        }
        return results;
    }
}
