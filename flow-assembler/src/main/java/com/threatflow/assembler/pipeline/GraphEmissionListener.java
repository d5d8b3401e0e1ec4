package com.threatflow.assembler.pipeline;

import com.fasterxml.jackson.databind.JsonNode;

import com.threatflow.assembler.model.GraphEdge;
import com.threatflow.assembler.model.GraphNode;
import com.threatflow.assembler.model.RecordError;

/**
 * Receives graph elements as soon as they are safe to render. Callbacks run synchronously
 * on the thread feeding the session; an exception thrown here propagates to that caller.
 */
public interface GraphEmissionListener {

    void onNode(GraphNode node);

    /** Both endpoints of {@code edge} have already been passed to {@link #onNode}. */
    void onEdge(GraphEdge edge);

    default void onProgress(String stage, String message) {}

    default void onIocAnalysis(JsonNode iocAnalysis) {}

    default void onRecordError(RecordError error) {}
}
