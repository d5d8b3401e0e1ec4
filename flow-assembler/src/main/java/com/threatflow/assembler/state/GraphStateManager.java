package com.threatflow.assembler.state;

import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.threatflow.assembler.model.GraphStats;
import com.threatflow.assembler.model.NodeState;
import com.threatflow.assembler.model.PendingEdge;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Consumer;

/**
 * Bounded bookkeeping of which graph elements a streaming session has seen, mapped,
 * emitted or is still holding back.
 *
 * <p>Invariants:
 * <ul>
 *   <li>An edge leaves {@link #processPendingEdges} only once both endpoint display ids are
 *   in the emitted set, so the caller never receives an edge naming an unknown node.</li>
 *   <li>No collection stays above its cap after the operation that overflowed it returns.
 *   Trimming drops the oldest entries by insertion order, never by access order.</li>
 *   <li>Pending edges older than the configured max age are dropped on every cleanup pass.</li>
 * </ul>
 *
 * <p>Nothing here throws for bad input: overflow degrades by eviction, misuse leaves edges
 * pending until {@link #reset()}. Not thread-safe; one instance per session.
 */
public class GraphStateManager {
    public static final int DEFAULT_MAX_CACHE_SIZE = 500;
    public static final int DEFAULT_MAX_PENDING_EDGES = 1000;
    public static final Duration DEFAULT_PENDING_EDGE_MAX_AGE = Duration.ofMinutes(5);
    public static final double DEFAULT_RETENTION_FRACTION = 0.75;

    private static final Logger LOG = LoggerFactory.getLogger(GraphStateManager.class);

    private final int maxCacheSize;
    private final int maxPendingEdges;
    private final long pendingEdgeMaxAgeMs;
    private final double retentionFraction;
    private final Clock clock;

    private final Map<String, String> nodeIdMap = new LinkedHashMap<>();
    private final Map<String, NodeState> nodeStates = new LinkedHashMap<>();
    private final Set<String> emittedDisplayIds = new LinkedHashSet<>();
    private final Set<String> processedEdgeIds = new LinkedHashSet<>();
    private final Map<String, PendingEdge> pendingEdges = new LinkedHashMap<>();
    private long evictedPendingEdgeCount;

    public GraphStateManager() {
        this(DEFAULT_MAX_CACHE_SIZE, DEFAULT_MAX_PENDING_EDGES, DEFAULT_PENDING_EDGE_MAX_AGE,
                DEFAULT_RETENTION_FRACTION, Clock.systemUTC());
    }

    public GraphStateManager(
            int maxCacheSize,
            int maxPendingEdges,
            Duration pendingEdgeMaxAge,
            double retentionFraction,
            Clock clock) {
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
        if (clock == null) {
            throw new IllegalArgumentException("clock must not be null");
        }
        this.maxCacheSize = maxCacheSize;
        this.maxPendingEdges = maxPendingEdges;
        this.pendingEdgeMaxAgeMs = pendingEdgeMaxAge.toMillis();
        this.retentionFraction = retentionFraction;
        this.clock = clock;
    }

    // ==================== Nodes ====================

    /**
     * Maps {@code originalId} to {@code displayId} and marks the node emitted in one step.
     * Re-registering an original id overwrites its mapping.
     */
    public void registerNode(String originalId, String displayId) {
        nodeIdMap.put(originalId, displayId);
        nodeStates.put(originalId, NodeState.EMITTED);
        emittedDisplayIds.add(displayId);
        if (nodeCachesOverCap()) {
            cleanupOldEntries();
        }
    }

    /**
     * Records that the stream mentioned {@code originalId}, without assigning a display id.
     * No effect on a node already mapped or emitted.
     */
    public void markNodeKnown(String originalId) {
        nodeStates.putIfAbsent(originalId, NodeState.KNOWN);
        if (nodeCachesOverCap()) {
            cleanupOldEntries();
        }
    }

    /**
     * Assigns a display id without surfacing the node. Edges touching it keep waiting
     * until {@link #markNodeEmitted} is called.
     */
    public void mapNode(String originalId, String displayId) {
        nodeIdMap.put(originalId, displayId);
        nodeStates.put(originalId, NodeState.MAPPED);
        if (nodeCachesOverCap()) {
            cleanupOldEntries();
        }
    }

    /**
     * Marks a mapped node as delivered to the caller.
     *
     * @return false when {@code originalId} has no display id (nothing changes)
     */
    public boolean markNodeEmitted(String originalId) {
        String displayId = nodeIdMap.get(originalId);
        if (displayId == null) {
            return false;
        }
        nodeStates.put(originalId, NodeState.EMITTED);
        emittedDisplayIds.add(displayId);
        if (nodeCachesOverCap()) {
            cleanupOldEntries();
        }
        return true;
    }

    /** Returns the node's lifecycle state, or {@code null} if the id is unknown or evicted. */
    public NodeState nodeState(String originalId) {
        return nodeStates.get(originalId);
    }

    public boolean hasProcessedNode(String originalId) {
        NodeState state = nodeStates.get(originalId);
        return state != null && state.isAtLeast(NodeState.MAPPED);
    }

    public boolean hasEmittedNode(String displayId) {
        return emittedDisplayIds.contains(displayId);
    }

    /** Returns the display id for {@code originalId}, or {@code null} if none is mapped. */
    public String getDisplayId(String originalId) {
        return nodeIdMap.get(originalId);
    }

    // ==================== Pending edges ====================

    /**
     * Holds an edge until both endpoints are emitted. A second edge with the same id is ignored.
     * At capacity the oldest share of pending edges is dropped first.
     */
    public void addPendingEdge(String edgeId, ObjectNode edge, String sourceOriginalId, String targetOriginalId) {
        if (pendingEdges.containsKey(edgeId)) {
            LOG.debug("Ignoring duplicate pending edge (id={})", edgeId);
            return;
        }
        if (pendingEdges.size() >= maxPendingEdges) {
            int removeCount = Math.max(1, (int) Math.floor(maxPendingEdges * (1.0 - retentionFraction)));
            LOG.warn("Pending edges limit reached ({}). Dropping {} oldest edges.", maxPendingEdges, removeCount);
            evictedPendingEdgeCount += trimOldest(pendingEdges.keySet(), pendingEdges.size() - removeCount);
            cleanupOldEntries();
        }
        pendingEdges.put(edgeId, new PendingEdge(edgeId, edge, sourceOriginalId, targetOriginalId, clock.millis()));
    }

    /**
     * Emits every pending edge whose endpoints both resolve to emitted nodes and drops it
     * from the pending set. Unresolved edges stay for a later call. If {@code emit} throws,
     * the failing edge and every edge not yet visited stay pending.
     *
     * @return number of edges handed to {@code emit}
     */
    public int processPendingEdges(Consumer<PendingEdge> emit) {
        if (pendingEdges.isEmpty()) {
            return 0;
        }
        int emitted = 0;
        for (PendingEdge pending : new ArrayList<>(pendingEdges.values())) {
            if (!isResolvable(pending) || !pendingEdges.containsKey(pending.edgeId)) {
                continue;
            }
            // Dropped only once the callback returns; a failed emit stays pending for the next pass.
            emit.accept(pending);
            pendingEdges.remove(pending.edgeId);
            emitted++;
        }
        return emitted;
    }

    /** Immutable snapshot in insertion order. */
    public List<PendingEdge> getPendingEdges() {
        return List.copyOf(pendingEdges.values());
    }

    public List<PendingEdge> getPendingEdgesForNode(String originalId) {
        List<PendingEdge> results = new ArrayList<>();
        for (PendingEdge pending : pendingEdges.values()) {
            if (pending.touches(originalId)) {
                results.add(pending);
            }
        }
        return Collections.unmodifiableList(results);
    }

    public boolean removePendingEdge(String edgeId) {
        return pendingEdges.remove(edgeId) != null;
    }

    public void clearPendingEdges() {
        pendingEdges.clear();
    }

    // ==================== Processed edges ====================

    public void markEdgeProcessed(String edgeId) {
        processedEdgeIds.add(edgeId);
        if (processedEdgeIds.size() > maxCacheSize) {
            cleanupOldEntries();
        }
    }

    public boolean hasProcessedEdge(String edgeId) {
        return processedEdgeIds.contains(edgeId);
    }

    // ==================== Session ====================

    public void reset() {
        nodeIdMap.clear();
        nodeStates.clear();
        emittedDisplayIds.clear();
        processedEdgeIds.clear();
        pendingEdges.clear();
        evictedPendingEdgeCount = 0;
    }

    public GraphStats getStats() {
        int processedNodes = 0;
        for (NodeState state : nodeStates.values()) {
            if (state.isAtLeast(NodeState.MAPPED)) {
                processedNodes++;
            }
        }
        return new GraphStats(
                nodeIdMap.size(),
                processedNodes,
                emittedDisplayIds.size(),
                pendingEdges.size(),
                processedEdgeIds.size(),
                evictedPendingEdgeCount);
    }

    /** Never below one, so the entry that crossed the cap survives its own cleanup. */
    int retentionSize() {
        return Math.max(1, (int) Math.floor(maxCacheSize * retentionFraction));
    }

    // ==================== Internals ====================

    private boolean isResolvable(PendingEdge pending) {
        String sourceDisplayId = nodeIdMap.get(pending.sourceId);
        String targetDisplayId = nodeIdMap.get(pending.targetId);
        return sourceDisplayId != null
                && targetDisplayId != null
                && emittedDisplayIds.contains(sourceDisplayId)
                && emittedDisplayIds.contains(targetDisplayId);
    }

    private boolean nodeCachesOverCap() {
        return nodeIdMap.size() > maxCacheSize
                || nodeStates.size() > maxCacheSize
                || emittedDisplayIds.size() > maxCacheSize;
    }

    /**
     * Trims every over-cap collection to the newest retention share and drops expired
     * pending edges. Runs whenever a bounded collection crosses its cap.
     */
    private void cleanupOldEntries() {
        int retain = retentionSize();
        int trimmed = 0;
        if (nodeCachesOverCap()) {
            trimmed += trimOldest(nodeIdMap.keySet(), retain);
            trimmed += trimOldest(nodeStates.keySet(), retain);
            trimmed += trimOldest(emittedDisplayIds, retain);
        }
        if (processedEdgeIds.size() > maxCacheSize) {
            trimmed += trimOldest(processedEdgeIds, retain);
        }

        long cutoff = clock.millis() - pendingEdgeMaxAgeMs;
        int expired = 0;
        Iterator<PendingEdge> it = pendingEdges.values().iterator();
        while (it.hasNext()) {
            if (it.next().createdAtMs <= cutoff) {
                it.remove();
                expired++;
            }
        }
        evictedPendingEdgeCount += expired;

        LOG.debug("Cleaned up old graph state (trimmed={}, expiredPendingEdges={}, retain={})",
                trimmed, expired, retain);
    }

    private static int trimOldest(Collection<String> keys, int retain) {
        int excess = keys.size() - retain;
        if (excess <= 0) {
            return 0;
        }
        Iterator<String> it = keys.iterator();
        for (int i = 0; i < excess && it.hasNext(); i++) {
            it.next();
            it.remove();
        }
        return excess;
    }
}
