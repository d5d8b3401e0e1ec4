package com.threatflow.assembler.pipeline;

import com.threatflow.assembler.model.GraphStats;

/**
 * Totals for one assembly session, taken when it completes.
 */
public final class AssemblySummary {
    public final String sessionId;
    public final long recordsRouted;
    public final long nodesEmitted;
    public final long edgesEmitted;
    public final long duplicateNodes;
    public final long duplicateEdges;
    public final long rejectedElements;
    public final long recordErrors;
    public final int unresolvedEdges;
    public final GraphStats stats;

    AssemblySummary(
            String sessionId,
            long recordsRouted,
            long nodesEmitted,
            long edgesEmitted,
            long duplicateNodes,
            long duplicateEdges,
            long rejectedElements,
            long recordErrors,
            int unresolvedEdges,
            GraphStats stats) {
        this.sessionId = sessionId;
        this.recordsRouted = recordsRouted;
        this.nodesEmitted = nodesEmitted;
        this.edgesEmitted = edgesEmitted;
        this.duplicateNodes = duplicateNodes;
        this.duplicateEdges = duplicateEdges;
        this.rejectedElements = rejectedElements;
        this.recordErrors = recordErrors;
        this.unresolvedEdges = unresolvedEdges;
        this.stats = stats;
    }

    @Override
    public String toString() {
        return "AssemblySummary{session=" + sessionId
                + ", records=" + recordsRouted
                + ", nodes=" + nodesEmitted
                + ", edges=" + edgesEmitted
                + ", duplicateNodes=" + duplicateNodes
                + ", duplicateEdges=" + duplicateEdges
                + ", rejected=" + rejectedElements
                + ", recordErrors=" + recordErrors
                + ", unresolvedEdges=" + unresolvedEdges
                + ", " + stats + "}";
    }
}
