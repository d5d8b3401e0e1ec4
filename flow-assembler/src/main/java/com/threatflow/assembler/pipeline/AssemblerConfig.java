package com.threatflow.assembler.pipeline;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.threatflow.assembler.parse.IncrementalStreamParser;
import com.threatflow.assembler.state.GraphStateManager;

import java.time.Clock;
import java.time.Duration;
import java.util.Map;

/**
 * Memory bounds for one assembly session. Defaults match the limits the tool ships with;
 * {@link #fromEnv()} lets a deployment override them without a rebuild.
 */
public final class AssemblerConfig {
    public static final String ENV_MAX_BUFFER_CHARS = "THREATFLOW_STREAM_MAX_BUFFER_CHARS";
    public static final String ENV_MAX_CACHE_SIZE = "THREATFLOW_GRAPH_MAX_CACHE_SIZE";
    public static final String ENV_MAX_PENDING_EDGES = "THREATFLOW_GRAPH_MAX_PENDING_EDGES";
    public static final String ENV_PENDING_EDGE_MAX_AGE_SEC = "THREATFLOW_GRAPH_PENDING_EDGE_MAX_AGE_SEC";
    public static final String ENV_RETENTION_FRACTION = "THREATFLOW_GRAPH_RETENTION_FRACTION";

    private static final Logger LOG = LoggerFactory.getLogger(AssemblerConfig.class);

    public final int maxBufferChars;
    public final int maxCacheSize;
    public final int maxPendingEdges;
    public final Duration pendingEdgeMaxAge;
    public final double retentionFraction;

    public AssemblerConfig(
            int maxBufferChars,
            int maxCacheSize,
            int maxPendingEdges,
            Duration pendingEdgeMaxAge,
            double retentionFraction) {
        if (maxBufferChars <= 0) {
            throw new IllegalArgumentException("maxBufferChars must be positive: " + maxBufferChars);
        }
        if (maxCacheSize <= 0) {
            throw new IllegalArgumentException("maxCacheSize must be positive: " + maxCacheSize);
        }
        if (maxPendingEdges <= 0) {
            throw new IllegalArgumentException("maxPendingEdges must be positive: " + maxPendingEdges);
        }
        if (pendingEdgeMaxAge == null || pendingEdgeMaxAge.isNegative() || pendingEdgeMaxAge.isZero()) {
            throw new IllegalArgumentException("pendingEdgeMaxAge must be positive: " + pendingEdgeMaxAge);
        }
        if (!(retentionFraction > 0.0 && retentionFraction < 1.0)) {
            throw new IllegalArgumentException("retentionFraction must be in (0, 1): " + retentionFraction);
        }
        this.maxBufferChars = maxBufferChars;
        this.maxCacheSize = maxCacheSize;
        this.maxPendingEdges = maxPendingEdges;
        this.pendingEdgeMaxAge = pendingEdgeMaxAge;
        this.retentionFraction = retentionFraction;
    }

    public static AssemblerConfig defaults() {
        return new AssemblerConfig(
                IncrementalStreamParser.DEFAULT_MAX_BUFFER_CHARS,
                GraphStateManager.DEFAULT_MAX_CACHE_SIZE,
                GraphStateManager.DEFAULT_MAX_PENDING_EDGES,
                GraphStateManager.DEFAULT_PENDING_EDGE_MAX_AGE,
                GraphStateManager.DEFAULT_RETENTION_FRACTION);
    }

    public static AssemblerConfig fromEnv() {
        return fromEnv(System.getenv());
    }

    /**
     * Reads overrides from {@code env}. Missing or unparseable values fall back to defaults.
     */
    static AssemblerConfig fromEnv(Map<String, String> env) {
        AssemblerConfig d = defaults();
        int maxBufferChars = envInt(env, ENV_MAX_BUFFER_CHARS, d.maxBufferChars);
        int maxCacheSize = envInt(env, ENV_MAX_CACHE_SIZE, d.maxCacheSize);
        int maxPendingEdges = envInt(env, ENV_MAX_PENDING_EDGES, d.maxPendingEdges);
        long maxAgeSec = envLong(env, ENV_PENDING_EDGE_MAX_AGE_SEC, d.pendingEdgeMaxAge.getSeconds());
        double retention = envDouble(env, ENV_RETENTION_FRACTION, d.retentionFraction);

        try {
            return new AssemblerConfig(maxBufferChars, maxCacheSize, maxPendingEdges,
                    Duration.ofSeconds(maxAgeSec), retention);
        } catch (IllegalArgumentException ex) {
            LOG.warn("Ignoring invalid assembler overrides, using defaults: {}", ex.getMessage());
            return d;
        }
    }

    public IncrementalStreamParser newParser() {
        return new IncrementalStreamParser(maxBufferChars);
    }

    public GraphStateManager newStateManager(Clock clock) {
        return new GraphStateManager(maxCacheSize, maxPendingEdges, pendingEdgeMaxAge, retentionFraction, clock);
    }

    @Override
    public String toString() {
        return "AssemblerConfig{maxBufferChars=" + maxBufferChars
                + ", maxCacheSize=" + maxCacheSize
                + ", maxPendingEdges=" + maxPendingEdges
                + ", pendingEdgeMaxAge=" + pendingEdgeMaxAge
                + ", retentionFraction=" + retentionFraction + "}";
    }

    private static int envInt(Map<String, String> env, String key, int defaultValue) {
        String value = env.get(key);
        if (value == null || value.isEmpty()) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException ex) {
            return defaultValue;
        }
    }

    private static long envLong(Map<String, String> env, String key, long defaultValue) {
        String value = env.get(key);
        if (value == null || value.isEmpty()) {
            return defaultValue;
        }
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException ex) {
            return defaultValue;
        }
    }

    private static double envDouble(Map<String, String> env, String key, double defaultValue) {
        String value = env.get(key);
        if (value == null || value.isEmpty()) {
            return defaultValue;
        }
        try {
            return Double.parseDouble(value.trim());
        } catch (NumberFormatException ex) {
            return defaultValue;
        }
    }
}
