package com.threatflow.assembler.model;

/**
 * Point-in-time counts of graph state. Read-only.
 */
public final class GraphStats {
    public final int nodeCount;
    public final int processedNodeCount;
    public final int emittedNodeCount;
    public final int pendingEdgeCount;
    public final int processedEdgeCount;
    public final long evictedPendingEdgeCount;

    public GraphStats(
            int nodeCount,
            int processedNodeCount,
            int emittedNodeCount,
            int pendingEdgeCount,
            int processedEdgeCount,
            long evictedPendingEdgeCount) {
        this.nodeCount = nodeCount;
        this.processedNodeCount = processedNodeCount;
        this.emittedNodeCount = emittedNodeCount;
        this.pendingEdgeCount = pendingEdgeCount;
        this.processedEdgeCount = processedEdgeCount;
        this.evictedPendingEdgeCount = evictedPendingEdgeCount;
    }

    @Override
    public String toString() {
        return "GraphStats{nodes=" + nodeCount
                + ", processedNodes=" + processedNodeCount
                + ", emittedNodes=" + emittedNodeCount
                + ", pendingEdges=" + pendingEdgeCount
                + ", processedEdges=" + processedEdgeCount
                + ", evictedPendingEdges=" + evictedPendingEdgeCount + "}";
    }
}
