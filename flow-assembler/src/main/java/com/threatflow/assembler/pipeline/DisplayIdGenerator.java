package com.threatflow.assembler.pipeline;

import com.fasterxml.jackson.databind.node.ObjectNode;

import com.threatflow.assembler.util.DisplayIds;

import java.time.Clock;
import java.util.Random;

/**
 * Chooses the display id a newly seen node is surfaced under.
 */
@FunctionalInterface
public interface DisplayIdGenerator {

    String displayIdFor(String originalId, ObjectNode node);

    static DisplayIdGenerator timestamped(Clock clock, Random random) {
        return (originalId, node) -> DisplayIds.timestamped(node.path("type").asText(""), clock.millis(), random);
    }

    static DisplayIdGenerator hashed(String sessionId) {
        return (originalId, node) -> DisplayIds.hashed(node.path("type").asText(""), sessionId, originalId);
    }
}
