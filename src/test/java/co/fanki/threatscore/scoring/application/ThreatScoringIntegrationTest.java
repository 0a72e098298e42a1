package co.fanki.threatscore.scoring.application;

import co.fanki.threatscore.scoring.application.ThreatScoringService.ThreatScoringResult;
import co.fanki.threatscore.suspect.domain.EdgeType;
import co.fanki.threatscore.suspect.domain.RelationshipEdge;
import co.fanki.threatscore.suspect.domain.RelationshipEdgeRepository;
import co.fanki.threatscore.suspect.domain.Suspect;
import co.fanki.threatscore.suspect.domain.SuspectRepository;
import co.fanki.threatscore.suspect.domain.ThreatLevel;
import org.jdbi.v3.core.Jdbi;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.math.BigDecimal;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * End to end scoring run against PostgreSQL.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@SpringBootTest
@Testcontainers(disabledWithoutDocker = true)
@ActiveProfiles("test")
class ThreatScoringIntegrationTest {

    @Container
    static PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:14")
            .withDatabaseName("testdb")
            .withUsername("test")
            .withPassword("test");

    @DynamicPropertySource
    static void configureProperties(final DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", postgres::getJdbcUrl);
        registry.add("spring.datasource.username", postgres::getUsername);
        registry.add("spring.datasource.password", postgres::getPassword);
    }

    @Autowired
    private Jdbi jdbi;

    @Autowired
    private SuspectRepository suspectRepository;

    @Autowired
    private RelationshipEdgeRepository edgeRepository;

    @Autowired
    private ThreatScoringService threatScoringService;

    @BeforeEach
    void setUp() {
        jdbi.useHandle(handle -> {
            handle.execute("DELETE FROM network_edges");
            handle.execute("DELETE FROM suspects");
        });
    }

    @Test
    void whenRecalculating_givenStoredNetwork_shouldPersistScores() {
        final Suspect hub = Suspect.create("Abhishek", "Boss", "Jamtara",
                new BigDecimal("10000000"));
        final Suspect courier = Suspect.create("Bunty", null, null,
                BigDecimal.ZERO);
        final Suspect mule = Suspect.create("Chintu", null, null,
                BigDecimal.ZERO);
        suspectRepository.save(hub);
        suspectRepository.save(courier);
        suspectRepository.save(mule);
        edgeRepository.save(RelationshipEdge.betweenSuspects(hub.id(),
                courier.id(), EdgeType.CALL));
        edgeRepository.save(RelationshipEdge.betweenSuspects(hub.id(),
                mule.id(), EdgeType.TRANSACTION));
        edgeRepository.save(RelationshipEdge.betweenSuspects(hub.id(),
                "not-a-suspect", EdgeType.CALL));

        final ThreatScoringResult result = threatScoringService.recalculate();

        assertTrue(result.success());
        assertEquals(3, result.updated());
        assertEquals(hub.id(), result.topKingpins().get(0).id());

        // 40 + 4 + 25, no prior high level anywhere
        final Suspect storedHub = suspectRepository.findById(hub.id())
                .orElseThrow();
        assertEquals(69, storedHub.threatScore());
        assertEquals(ThreatLevel.MEDIUM, storedHub.threatLevel());
        assertEquals(42, suspectRepository.findById(courier.id())
                .orElseThrow().threatScore());
    }

    @Test
    void whenRecalculating_givenEdgeRowWithBlankEndpoint_shouldStillScore() {
        final Suspect hub = Suspect.create("Abhishek", null, null,
                BigDecimal.ZERO);
        final Suspect courier = Suspect.create("Bunty", null, null,
                BigDecimal.ZERO);
        suspectRepository.save(hub);
        suspectRepository.save(courier);
        edgeRepository.save(RelationshipEdge.betweenSuspects(hub.id(),
                courier.id(), EdgeType.CALL));
        jdbi.useHandle(handle -> handle.createUpdate(
                "INSERT INTO network_edges (id, source_id, source_type,"
                        + " target_id, target_type, edge_type)"
                        + " VALUES ('e-blank', :source, 'suspect', ' ',"
                        + " 'suspect', 'call')")
                .bind("source", hub.id())
                .execute());

        final ThreatScoringResult result = threatScoringService.recalculate();

        assertTrue(result.success());
        assertEquals(2, result.updated());
        assertEquals(0, result.failed());
    }

    @Test
    void whenRecalculating_givenEmptyStore_shouldReportNoSuspects() {
        final ThreatScoringResult result = threatScoringService.recalculate();

        assertTrue(result.success());
        assertEquals("No suspects to process", result.message());
    }

}
