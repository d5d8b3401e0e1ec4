package com.threatflow.assembler.util;

/**
 * Shared string semantics for blank handling and log-safe previews.
 */
public final class StringSemantics {
    private static final int DEFAULT_PREVIEW_CHARS = 80;

    private StringSemantics() {}

    public static boolean isBlank(String value) {
        return value == null || value.trim().isEmpty();
    }

    public static String firstNonBlank(String... values) {
        for (String value : values) {
            if (!isBlank(value)) {
                return value;
            }
        }
        return "";
    }

    /**
     * Shortens model output for log lines; a runaway line must not flood the log.
     */
    public static String preview(String value) {
        return preview(value, DEFAULT_PREVIEW_CHARS);
    }

    public static String preview(String value, int maxChars) {
        if (value == null) {
            return "null";
        }
        if (value.length() <= maxChars) {
            return value;
        }
        return value.substring(0, maxChars) + "...(" + value.length() + " chars)";
    }
}
