package co.fanki.threatscore.suspect.domain;

import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Unit tests for Suspect and RelationshipEdge.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class SuspectTest {

    @Test
    void whenCreatingSuspect_givenValidData_shouldCreateUnscored() {
        final Suspect suspect = Suspect.create("Ravi Kumar", "RK",
                "Jamtara", new BigDecimal("250000"));

        assertNotNull(suspect.id());
        assertEquals("Ravi Kumar", suspect.name());
        assertEquals("RK", suspect.alias());
        assertEquals(new BigDecimal("250000"), suspect.fraudAmount());
        assertNull(suspect.threatScore());
        assertNull(suspect.threatLevel());
        assertFalse(suspect.isHighThreat());
        assertNotNull(suspect.createdAt());
    }

    @Test
    void whenCreatingSuspect_givenNullFraudAmount_shouldDefaultToZero() {
        final Suspect suspect = Suspect.create("Anon", null, null, null);

        assertEquals(BigDecimal.ZERO, suspect.fraudAmount());
    }

    @Test
    void whenCreatingSuspect_givenBlankName_shouldThrowException() {
        assertThrows(IllegalArgumentException.class,
                () -> Suspect.create(" ", null, null, BigDecimal.ONE));
    }

    @Test
    void whenReconstituting_givenEmptyStoredName_shouldKeepIt() {
        final Suspect suspect = Suspect.reconstitute("s-2", "", null, null,
                BigDecimal.ZERO, null, null, null, null, null, null);

        assertEquals("", suspect.name());
        assertEquals("s-2", suspect.id());
    }

    @Test
    void whenReconstituting_givenHighLevel_shouldBeHighThreat() {
        final Instant now = Instant.now();

        final Suspect suspect = Suspect.reconstitute("s-1", "Name", null,
                null, BigDecimal.TEN, 85, ThreatLevel.HIGH, now, "notes",
                now, now);

        assertTrue(suspect.isHighThreat());
        assertEquals(85, suspect.threatScore());
        assertEquals(now, suspect.lastActive());
    }

    @Test
    void whenCreatingEdge_givenSuspectEndpoints_shouldTouchSuspect() {
        final RelationshipEdge edge = RelationshipEdge.betweenSuspects(
                "s-1", "s-2", EdgeType.CALL);

        assertTrue(edge.touchesSuspect());
        assertEquals(EntityType.SUSPECT, edge.sourceType());
        assertNull(edge.weight());
    }

    @Test
    void whenCreatingEdge_givenOnlyIntermediateEntities_shouldNotTouchSuspect() {
        final RelationshipEdge edge = new RelationshipEdge("e-1", "sim-1",
                EntityType.SIM, "dev-1", EntityType.DEVICE,
                EdgeType.SHARED_DEVICE, null);

        assertFalse(edge.touchesSuspect());
    }

    @Test
    void whenCreatingEdge_givenMissingType_shouldThrowException() {
        assertThrows(IllegalArgumentException.class,
                () -> new RelationshipEdge("e-1", "s-1", null, "s-2",
                        EntityType.SUSPECT, EdgeType.CALL, null));
    }

    @Test
    void whenParsingEdgeType_givenStoredValue_shouldResolve() {
        assertEquals(EdgeType.SHARED_IP, EdgeType.fromValue("shared_ip"));
        assertEquals("shared_device", EdgeType.SHARED_DEVICE.value());
        assertEquals(EntityType.ACCOUNT, EntityType.fromValue("account"));
    }

}
