package com.threatflow.assembler.pipeline;

import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.threatflow.assembler.model.GraphEdge;
import com.threatflow.assembler.model.GraphNode;
import com.threatflow.assembler.model.GraphStats;
import com.threatflow.assembler.model.NodeState;
import com.threatflow.assembler.model.ParsedRecord;
import com.threatflow.assembler.model.PendingEdge;
import com.threatflow.assembler.parse.IncrementalStreamParser;
import com.threatflow.assembler.parse.JsonNodeUtils;
import com.threatflow.assembler.parse.ParseResult;
import com.threatflow.assembler.parse.StreamBufferOverflowException;
import com.threatflow.assembler.state.GraphStateManager;
import com.threatflow.assembler.util.DisplayIds;

import java.security.SecureRandom;
import java.time.Clock;
import java.util.List;

/**
 * One attack-flow extraction session: feeds model output through the stream parser and
 * routes each decoded record through the graph state, emitting nodes and edges to the
 * listener in an order the renderer can always accept.
 *
 * <p>Routing rules:
 * <ul>
 *   <li>A node is mapped to a display id, handed to the listener, then marked emitted.
 *   An original id already emitted is dropped as a duplicate; one whose listener call failed
 *   is handed over again under the display id it was first given.</li>
 *   <li>An edge whose endpoints are both emitted goes out at once under the id
 *   {@code <sourceDisplayId>-to-<targetDisplayId>}; otherwise it waits in the pending set.</li>
 *   <li>Pending edges are retried after every record that brought new nodes, and once
 *   more when the session completes.</li>
 * </ul>
 *
 * <p>Sessions are synchronous and single-threaded; create one per analysis request.
 * Cancelling is simply calling {@link #cancel()} and no longer feeding chunks.
 */
public class FlowGraphAssembler {
    private static final Logger LOG = LoggerFactory.getLogger(FlowGraphAssembler.class);

    private final String sessionId;
    private final IncrementalStreamParser parser;
    private final GraphStateManager state;
    private final DisplayIdGenerator displayIds;
    private final GraphEmissionListener listener;

    private SessionState sessionState = SessionState.OPEN;
    private long recordsRouted;
    private long nodesEmitted;
    private long edgesEmitted;
    private long duplicateNodes;
    private long duplicateEdges;
    private long rejectedElements;
    private long recordErrors;

    public FlowGraphAssembler(String sessionId, AssemblerConfig config, GraphEmissionListener listener) {
        this(sessionId, config, listener, Clock.systemUTC(), null);
    }

    /**
     * @param displayIds display id strategy; {@code null} selects the timestamped default
     */
    public FlowGraphAssembler(
            String sessionId,
            AssemblerConfig config,
            GraphEmissionListener listener,
            Clock clock,
            DisplayIdGenerator displayIds) {
        if (listener == null) {
            throw new IllegalArgumentException("listener must not be null");
        }
        this.sessionId = sessionId;
        this.parser = config.newParser();
        this.state = config.newStateManager(clock);
        this.displayIds = displayIds == null ? DisplayIdGenerator.timestamped(clock, new SecureRandom()) : displayIds;
        this.listener = listener;
        LOG.info("Assembly session opened (session={}, config={})", sessionId, config);
    }

    /**
     * Feeds one chunk of model output.
     *
     * @throws StreamBufferOverflowException if the chunk overflows the stream buffer; the
     *         session is failed and its state released
     * @throws IllegalStateException if the session is no longer open
     */
    public void accept(String chunk) {
        requireOpen();
        ParseResult result;
        try {
            result = parser.feed(chunk);
        } catch (StreamBufferOverflowException ex) {
            LOG.warn("Assembly session failed (session={}): {}", sessionId, ex.getMessage());
            sessionState = SessionState.FAILED;
            release();
            throw ex;
        }
        routeAll(result.records);
    }

    /**
     * Ends the stream: decodes the unterminated tail, retries pending edges one last time and
     * reports totals. Edges that still lack an endpoint are counted as unresolved, not emitted.
     */
    public AssemblySummary complete() {
        requireOpen();
        routeAll(parser.finish().records);
        processPending();
        sessionState = SessionState.COMPLETED;

        AssemblySummary summary = summary();
        if (summary.unresolvedEdges > 0) {
            LOG.info("Assembly session completed with {} unresolved edges (session={})",
                    summary.unresolvedEdges, sessionId);
        }
        LOG.info("Assembly session completed (linesConsumed={}, recordsDecoded={}): {}",
                parser.linesConsumed(), parser.recordsDecoded(), summary);
        return summary;
    }

    /**
     * Abandons in-flight state. The session cannot be fed afterwards.
     */
    public void cancel() {
        if (sessionState != SessionState.OPEN) {
            return;
        }
        LOG.info("Assembly session cancelled (session={}, stats={})", sessionId, state.getStats());
        sessionState = SessionState.CANCELLED;
        release();
    }

    public AssemblySummary summary() {
        GraphStats stats = state.getStats();
        return new AssemblySummary(sessionId, recordsRouted, nodesEmitted, edgesEmitted,
                duplicateNodes, duplicateEdges, rejectedElements, recordErrors,
                stats.pendingEdgeCount, stats);
    }

    public List<PendingEdge> pendingEdges() {
        return state.getPendingEdges();
    }

    public SessionState sessionState() {
        return sessionState;
    }

    public String sessionId() {
        return sessionId;
    }

    public int bufferedChars() {
        return parser.bufferSize();
    }

    // ==================== Routing ====================

    private void routeAll(List<ParsedRecord> records) {
        for (ParsedRecord record : records) {
            route(record);
        }
    }

    private void route(ParsedRecord record) {
        recordsRouted++;
        if (record.error != null) {
            recordErrors++;
            LOG.warn("Model reported an error (session={}, code={}, message={})",
                    sessionId, record.error.code, record.error.message);
            listener.onRecordError(record.error);
        }
        if (record.hasProgress()) {
            listener.onProgress(record.progressStage, record.progressMessage);
        }

        if (record.hasGraphElements()) {
            int newNodes = 0;
            for (ObjectNode node : record.nodes) {
                if (routeNode(node)) {
                    newNodes++;
                }
            }
            for (ObjectNode edge : record.edges) {
                routeEdge(edge);
            }
            if (newNodes > 0) {
                processPending();
            }
        }

        if (record.iocAnalysis != null) {
            listener.onIocAnalysis(record.iocAnalysis);
        }
    }

    private boolean routeNode(ObjectNode node) {
        String originalId = JsonNodeUtils.asIdentifier(node.get("id"));
        if (originalId == null) {
            rejectedElements++;
            LOG.debug("Dropping node without id (session={})", sessionId);
            return false;
        }
        NodeState known = state.nodeState(originalId);
        if (known == NodeState.EMITTED) {
            duplicateNodes++;
            LOG.debug("Duplicate node (session={}, id={})", sessionId, originalId);
            return false;
        }

        // A MAPPED node never reached the listener; retry it under the display id it already has.
        String displayId = known == NodeState.MAPPED ? state.getDisplayId(originalId) : null;
        if (displayId == null) {
            displayId = displayIds.displayIdFor(originalId, node);
            state.mapNode(originalId, displayId);
        } else {
            LOG.debug("Retrying node that was never emitted (session={}, id={})", sessionId, originalId);
        }
        ObjectNode payload = node.deepCopy();
        payload.put("id", displayId);
        listener.onNode(new GraphNode(displayId, originalId, payload));
        state.markNodeEmitted(originalId);
        nodesEmitted++;
        return true;
    }

    private void routeEdge(ObjectNode edge) {
        String sourceId = JsonNodeUtils.asIdentifier(edge.get("source"));
        String targetId = JsonNodeUtils.asIdentifier(edge.get("target"));
        if (sourceId == null || targetId == null) {
            rejectedElements++;
            LOG.debug("Dropping edge without source/target (session={}, id={})",
                    sessionId, edge.path("id").asText(""));
            return;
        }

        String sourceDisplayId = state.getDisplayId(sourceId);
        String targetDisplayId = state.getDisplayId(targetId);
        if (sourceDisplayId != null && targetDisplayId != null
                && state.hasEmittedNode(sourceDisplayId) && state.hasEmittedNode(targetDisplayId)) {
            emitEdge(edge, sourceId, targetId);
            return;
        }

        String edgeId = JsonNodeUtils.asIdentifier(edge.get("id"));
        if (edgeId == null) {
            edgeId = DisplayIds.edge(sourceId, targetId);
        }
        state.addPendingEdge(edgeId, edge, sourceId, targetId);
    }

    private void processPending() {
        int released = state.processPendingEdges(
                (PendingEdge pending) -> emitEdge(pending.edge, pending.sourceId, pending.targetId));
        if (released > 0) {
            LOG.debug("Released {} pending edges (session={})", released, sessionId);
        }
    }

    private void emitEdge(ObjectNode edge, String sourceId, String targetId) {
        String sourceDisplayId = state.getDisplayId(sourceId);
        String targetDisplayId = state.getDisplayId(targetId);
        String edgeId = DisplayIds.edge(sourceDisplayId, targetDisplayId);
        if (state.hasProcessedEdge(edgeId)) {
            duplicateEdges++;
            LOG.debug("Duplicate edge (session={}, id={})", sessionId, edgeId);
            return;
        }

        ObjectNode payload = edge.deepCopy();
        payload.put("id", edgeId);
        payload.put("source", sourceDisplayId);
        payload.put("target", targetDisplayId);
        listener.onEdge(new GraphEdge(edgeId, sourceDisplayId, targetDisplayId, sourceId, targetId, payload));
        state.markEdgeProcessed(edgeId);
        edgesEmitted++;
    }

    private void requireOpen() {
        if (sessionState != SessionState.OPEN) {
            throw new IllegalStateException("Assembly session " + sessionId + " is " + sessionState);
        }
    }

    private void release() {
        parser.reset();
        state.reset();
    }
}
