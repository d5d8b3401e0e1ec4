package com.threatflow.assembler.util;

import java.util.Random;

/**
 * Display identifier formats for nodes surfaced to the rendering layer.
 */
public final class DisplayIds {
    private static final char[] BASE36 = "0123456789abcdefghijklmnopqrstuvwxyz".toCharArray();
    private static final int RANDOM_SUFFIX_CHARS = 9;
    private static final int HASH_CHARS = 16;

    private DisplayIds() {}

    /**
     * {@code <type>-<epochMillis>-<9 random base36 chars>}; unique within a session for practical purposes.
     */
    public static String timestamped(String nodeType, long epochMillis, Random random) {
        StringBuilder sb = new StringBuilder();
        sb.append(typePrefix(nodeType)).append('-').append(epochMillis).append('-');
        for (int i = 0; i < RANDOM_SUFFIX_CHARS; i++) {
            sb.append(BASE36[random.nextInt(BASE36.length)]);
        }
        return sb.toString();
    }

    /**
     * {@code <type>-<16 hex chars>} derived from the session and original id; replays of the
     * same session produce the same ids.
     */
    public static String hashed(String nodeType, String sessionId, String originalId) {
        String s = sessionId == null ? "" : sessionId;
        String o = originalId == null ? "" : originalId;
        return typePrefix(nodeType) + "-" + Hashing.sha256Hex(s + "|" + o).substring(0, HASH_CHARS);
    }

    /**
     * Display id of an edge between two display-space endpoints.
     */
    public static String edge(String sourceDisplayId, String targetDisplayId) {
        return sourceDisplayId + "-to-" + targetDisplayId;
    }

    private static String typePrefix(String nodeType) {
        return StringSemantics.isBlank(nodeType) ? "node" : nodeType.trim();
    }
}
