package com.threatflow.assembler.pipeline;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.threatflow.assembler.model.GraphEdge;
import com.threatflow.assembler.model.GraphNode;
import com.threatflow.assembler.parse.StreamBufferOverflowException;
import com.threatflow.assembler.util.DisplayIds;
import com.threatflow.assembler.util.MutableClock;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class FlowGraphAssemblerTest {

    private MutableClock clock;
    private RecordingListener listener;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt(1710000000000L);
        listener = new RecordingListener();
    }

    @Test
    void assemblesFixtureStreamInRenderableOrder() throws Exception {
        FlowGraphAssembler assembler = newAssembler(AssemblerConfig.defaults());

        assembler.accept(readResource("fixtures/attack_flow_stream.ndjson"));
        AssemblySummary summary = assembler.complete();

        assertEquals(Arrays.asList("node:n1", "node:n2", "node:n3", "edge:n2->n3", "edge:n1->n2"), listener.events);
        assertEquals(3, summary.nodesEmitted);
        assertEquals(2, summary.edgesEmitted);
        assertEquals(1, summary.duplicateNodes);
        assertEquals(1, summary.unresolvedEdges);
        assertEquals(7, summary.recordsRouted);
        assertEquals(SessionState.COMPLETED, assembler.sessionState());

        assertEquals(List.of("extraction: Identified initial access"), listener.progress);
        assertEquals(1, listener.iocAnalyses.size());
        assertEquals("n3", assembler.pendingEdges().get(0).sourceId);
    }

    @Test
    void nodePayloadIsRewrittenIntoDisplaySpace() {
        FlowGraphAssembler assembler = newAssembler(AssemblerConfig.defaults());

        assembler.accept("{\"nodes\":[{\"id\":\"n1\",\"type\":\"action\",\"data\":{\"technique_id\":\"T1566\"}}]}\n");

        GraphNode node = listener.node("n1");
        assertEquals(DisplayIds.hashed("action", "session-1", "n1"), node.displayId);
        assertEquals(node.displayId, node.payload.path("id").asText());
        assertEquals("T1566", node.payload.path("data").path("technique_id").asText());
        assertEquals("action", node.payload.path("type").asText());
    }

    @Test
    void edgeArrivingFirstIsEmittedOnceWithDisplayEndpoints() {
        FlowGraphAssembler assembler = newAssembler(AssemblerConfig.defaults());

        assembler.accept("{\"edges\":[{\"id\":\"e1\",\"source\":\"a\",\"target\":\"b\",\"label\":\"uses\"}]}\n");
        assertTrue(listener.edges.isEmpty());
        assertEquals(1, assembler.pendingEdges().size());

        assembler.accept("{\"nodes\":[{\"id\":\"a\",\"type\":\"tool\"}]}\n");
        assertTrue(listener.edges.isEmpty());

        assembler.accept("{\"nodes\":[{\"id\":\"b\",\"type\":\"asset\"}]}\n");
        assembler.accept("{\"nodes\":[{\"id\":\"c\",\"type\":\"asset\"}]}\n");

        assertEquals(1, listener.edges.size());
        GraphEdge edge = listener.edges.get(0);
        String sourceDisplay = listener.node("a").displayId;
        String targetDisplay = listener.node("b").displayId;
        assertEquals(sourceDisplay + "-to-" + targetDisplay, edge.id);
        assertEquals(sourceDisplay, edge.payload.path("source").asText());
        assertEquals(targetDisplay, edge.payload.path("target").asText());
        assertEquals("uses", edge.payload.path("label").asText());
        assertTrue(assembler.pendingEdges().isEmpty());
    }

    @Test
    void repeatedEdgeBetweenSameNodesIsEmittedOnce() {
        FlowGraphAssembler assembler = newAssembler(AssemblerConfig.defaults());

        assembler.accept("{\"nodes\":[{\"id\":\"a\"},{\"id\":\"b\"}],"
                + "\"edges\":[{\"id\":\"e1\",\"source\":\"a\",\"target\":\"b\"}]}\n");
        assembler.accept("{\"edges\":[{\"id\":\"e1\",\"source\":\"a\",\"target\":\"b\"},"
                + "{\"source\":\"a\",\"target\":\"b\"}]}\n");

        assertEquals(1, listener.edges.size());
        assertEquals(2, assembler.summary().duplicateEdges);
    }

    @Test
    void byteAtATimeProducesSameGraphAsWholeStream() throws Exception {
        String stream = readResource("fixtures/attack_flow_stream.ndjson");
        FlowGraphAssembler whole = newAssembler(AssemblerConfig.defaults());
        whole.accept(stream);
        whole.complete();
        List<String> expected = List.copyOf(listener.events);

        listener = new RecordingListener();
        FlowGraphAssembler chunked = newAssembler(AssemblerConfig.defaults());
        for (int i = 0; i < stream.length(); i++) {
            chunked.accept(stream.substring(i, i + 1));
        }
        chunked.complete();

        assertEquals(expected, listener.events);
    }

    @Test
    void completeFlushesUnterminatedLastRecord() {
        FlowGraphAssembler assembler = newAssembler(AssemblerConfig.defaults());

        assembler.accept("{\"nodes\":[{\"id\":\"a\"},{\"id\":\"b\"}]}\n{\"edges\":[{\"source\":\"a\",\"target\":\"b\"}]}");
        assertTrue(listener.edges.isEmpty());

        AssemblySummary summary = assembler.complete();

        assertEquals(1, listener.edges.size());
        assertEquals(0, summary.unresolvedEdges);
    }

    @Test
    void elementsWithoutIdentifiersAreRejected() {
        FlowGraphAssembler assembler = newAssembler(AssemblerConfig.defaults());

        assembler.accept("{\"nodes\":[{\"type\":\"action\"},{\"id\":7}],\"edges\":[{\"id\":\"e1\",\"source\":\"7\"}]}\n");

        assertEquals(1, listener.nodes.size());
        assertEquals("7", listener.nodes.get(0).originalId);
        assertEquals(2, assembler.summary().rejectedElements);
    }

    @Test
    void modelErrorsAreForwardedWithoutStoppingTheStream() {
        FlowGraphAssembler assembler = newAssembler(AssemblerConfig.defaults());

        assembler.accept("{\"error\":{\"code\":\"overloaded\",\"message\":\"Model overloaded\"}}\n"
                + "{\"nodes\":[{\"id\":\"a\"}]}\n");

        assertEquals(1, listener.errors.size());
        assertEquals("overloaded", listener.errors.get(0).code);
        assertEquals(1, listener.nodes.size());
        assertEquals(1, assembler.summary().recordErrors);
    }

    @Test
    void bufferOverflowFailsTheSession() {
        AssemblerConfig config = new AssemblerConfig(32, 500, 1000, Duration.ofMinutes(5), 0.75);
        FlowGraphAssembler assembler = newAssembler(config);
        assembler.accept("{\"nodes\":[{\"id\":\"a\"}]}\n");

        assertThrows(StreamBufferOverflowException.class,
                () -> assembler.accept("{\"nodes\":[{\"id\":\"b\",\"data\":\"" + "x".repeat(40) + "\"}]}"));

        assertEquals(SessionState.FAILED, assembler.sessionState());
        assertEquals(0, assembler.bufferedChars());
        assertThrows(IllegalStateException.class, () -> assembler.accept("{}\n"));
        assertThrows(IllegalStateException.class, assembler::complete);
    }

    @Test
    void cancelReleasesStateAndClosesSession() {
        FlowGraphAssembler assembler = newAssembler(AssemblerConfig.defaults());
        assembler.accept("{\"edges\":[{\"id\":\"e1\",\"source\":\"a\",\"target\":\"b\"}]}\n{\"nodes\":");

        assembler.cancel();

        assertEquals(SessionState.CANCELLED, assembler.sessionState());
        assertTrue(assembler.pendingEdges().isEmpty());
        assertEquals(0, assembler.bufferedChars());
        assertThrows(IllegalStateException.class, () -> assembler.accept("{}\n"));
    }

    @Test
    void listenerFailureLeavesNodeUnemittedSoItsEdgesWait() {
        FlowGraphAssembler assembler = assemblerRejectingFirstDeliveryOf("b");

        assembler.accept("{\"edges\":[{\"id\":\"e1\",\"source\":\"a\",\"target\":\"b\"}]}\n");
        assertThrows(IllegalStateException.class,
                () -> assembler.accept("{\"nodes\":[{\"id\":\"a\"},{\"id\":\"b\"}]}\n"));

        assertTrue(listener.edges.isEmpty());
        assertEquals(1, assembler.pendingEdges().size());
    }

    @Test
    void nodeRejectedByListenerIsDeliveredWhenItArrivesAgain() {
        FlowGraphAssembler assembler = assemblerRejectingFirstDeliveryOf("b");
        assembler.accept("{\"edges\":[{\"id\":\"e1\",\"source\":\"a\",\"target\":\"b\"}]}\n");
        assertThrows(IllegalStateException.class,
                () -> assembler.accept("{\"nodes\":[{\"id\":\"a\"},{\"id\":\"b\"}]}\n"));

        assembler.accept("{\"nodes\":[{\"id\":\"b\"},{\"id\":\"c\"}]}\n");
        AssemblySummary summary = assembler.complete();

        assertEquals(Arrays.asList("node:a", "node:b", "node:c", "edge:a->b"), listener.events);
        assertEquals(DisplayIds.hashed("", "session-1", "b"), listener.node("b").displayId);
        assertEquals(0, summary.duplicateNodes);
        assertEquals(0, summary.unresolvedEdges);
        assertEquals(1, summary.edgesEmitted);
    }

    @Test
    void timestampedDisplayIdsAreUsedByDefault() {
        FlowGraphAssembler assembler = new FlowGraphAssembler(
                "session-2", AssemblerConfig.defaults(), listener, clock, null);

        assembler.accept("{\"nodes\":[{\"id\":\"n1\",\"type\":\"malware\"}]}\n");

        assertTrue(listener.nodes.get(0).displayId.matches("malware-1710000000000-[0-9a-z]{9}"));
    }

    private FlowGraphAssembler assemblerRejectingFirstDeliveryOf(String originalId) {
        GraphEmissionListener flaky = new GraphEmissionListener() {
            private boolean rejected;

            @Override
            public void onNode(GraphNode node) {
                if (!rejected && originalId.equals(node.originalId)) {
                    rejected = true;
                    throw new IllegalStateException("renderer rejected node");
                }
                listener.onNode(node);
            }

            @Override
            public void onEdge(GraphEdge edge) {
                listener.onEdge(edge);
            }
        };
        return new FlowGraphAssembler(
                "session-1", AssemblerConfig.defaults(), flaky, clock, DisplayIdGenerator.hashed("session-1"));
    }

    private FlowGraphAssembler newAssembler(AssemblerConfig config) {
        return new FlowGraphAssembler("session-1", config, listener, clock, DisplayIdGenerator.hashed("session-1"));
    }

    private static String readResource(String resourceName) throws Exception {
        return new String(
                FlowGraphAssemblerTest.class.getClassLoader().getResourceAsStream(resourceName).readAllBytes(),
                StandardCharsets.UTF_8
        );
    }
}
