package co.fanki.threatscore.scoring.domain;

import co.fanki.threatscore.suspect.domain.EdgeType;
import co.fanki.threatscore.suspect.domain.EntityType;
import co.fanki.threatscore.suspect.domain.RelationshipEdge;
import co.fanki.threatscore.suspect.domain.Suspect;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Unit tests for SuspectGraph.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class SuspectGraphTest {

    @Test
    void whenBuilding_givenSuspectEdge_shouldLinkBothWays() {
        final SuspectGraph graph = SuspectGraph.build(
                List.of(suspect("a"), suspect("b")),
                List.of(RelationshipEdge.betweenSuspects("a", "b",
                        EdgeType.CALL)));

        assertEquals(List.of("b"), graph.neighbors("a"));
        assertEquals(List.of("a"), graph.neighbors("b"));
        assertEquals(1, graph.connectionCount("a"));
        assertEquals(1, graph.connectionCount("b"));
    }

    @Test
    void whenBuilding_givenEdgeToUnknownId_shouldSkipEdge() {
        final SuspectGraph graph = SuspectGraph.build(
                List.of(suspect("a"), suspect("b")),
                List.of(
                        RelationshipEdge.betweenSuspects("a", "ghost",
                                EdgeType.TRANSACTION),
                        RelationshipEdge.betweenSuspects("a", "b",
                                EdgeType.CALL)));

        assertEquals(List.of("b"), graph.neighbors("a"));
        assertFalse(graph.contains("ghost"));
        assertTrue(graph.neighbors("ghost").isEmpty());
        assertEquals(0, graph.connectionCount("ghost"));
        assertEquals(1, graph.skippedEdges());
    }

    @Test
    void whenBuilding_givenEdgeWithoutSuspectEndpoint_shouldSkipEdge() {
        final RelationshipEdge simToDevice = new RelationshipEdge("e-1",
                "a", EntityType.SIM, "b", EntityType.DEVICE,
                EdgeType.SHARED_DEVICE, null);

        final SuspectGraph graph = SuspectGraph.build(
                List.of(suspect("a"), suspect("b")), List.of(simToDevice));

        assertTrue(graph.neighbors("a").isEmpty());
        assertEquals(1, graph.skippedEdges());
    }

    @Test
    void whenBuilding_givenMixedEndpointBetweenKnownIds_shouldKeepEdge() {
        final RelationshipEdge suspectToIp = new RelationshipEdge("e-1",
                "a", EntityType.SUSPECT, "b", EntityType.IP,
                EdgeType.SHARED_IP, BigDecimal.ONE);

        final SuspectGraph graph = SuspectGraph.build(
                List.of(suspect("a"), suspect("b")), List.of(suspectToIp));

        assertEquals(List.of("b"), graph.neighbors("a"));
        assertEquals(0, graph.skippedEdges());
    }

    @Test
    void whenBuilding_givenDuplicateEdges_shouldKeepMultiplicity() {
        final SuspectGraph graph = SuspectGraph.build(
                List.of(suspect("a"), suspect("b")),
                List.of(
                        RelationshipEdge.betweenSuspects("a", "b",
                                EdgeType.CALL),
                        RelationshipEdge.betweenSuspects("b", "a",
                                EdgeType.TRANSACTION)));

        assertEquals(List.of("b", "b"), graph.neighbors("a"));
        assertEquals(2, graph.connectionCount("a"));
        assertEquals(1, graph.distinctNeighbors(0).length);
        assertEquals(2, graph.outDegree(0));
    }

    @Test
    void whenBuilding_givenIsolatedSuspect_shouldKeepEntry() {
        final SuspectGraph graph = SuspectGraph.build(
                List.of(suspect("a"), suspect("b"), suspect("loner")),
                List.of(RelationshipEdge.betweenSuspects("a", "b",
                        EdgeType.CALL)));

        assertEquals(3, graph.size());
        assertTrue(graph.contains("loner"));
        assertTrue(graph.neighbors("loner").isEmpty());
        assertEquals(List.of("a", "b", "loner"), graph.suspectIds());
    }

    @Test
    void whenBuilding_givenRepeatedSuspect_shouldKeepOneEntry() {
        final SuspectGraph graph = SuspectGraph.build(
                List.of(suspect("a"), suspect("a")), List.of());

        assertEquals(1, graph.size());
    }

    @Test
    void whenBuilding_givenNoSuspects_shouldBeEmpty() {
        final SuspectGraph graph = SuspectGraph.build(List.of(),
                List.of(RelationshipEdge.betweenSuspects("a", "b",
                        EdgeType.CALL)));

        assertTrue(graph.isEmpty());
        assertEquals(1, graph.skippedEdges());
    }

    private static Suspect suspect(final String id) {
        return Suspect.reconstitute(id, "Suspect " + id, null, null,
                BigDecimal.ZERO, null, null, null, null, null, null);
    }

}
