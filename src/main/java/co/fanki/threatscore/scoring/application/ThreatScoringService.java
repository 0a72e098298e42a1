package co.fanki.threatscore.scoring.application;

import co.fanki.threatscore.scoring.application.ScoreWriter.WriteFailure;
import co.fanki.threatscore.scoring.application.ScoreWriter.WriteReport;
import co.fanki.threatscore.scoring.domain.ScoreUpdate;
import co.fanki.threatscore.scoring.domain.ScoringParameters;
import co.fanki.threatscore.scoring.domain.SuspectGraph;
import co.fanki.threatscore.scoring.domain.ThreatScorer;
import co.fanki.threatscore.suspect.domain.RelationshipEdge;
import co.fanki.threatscore.suspect.domain.RelationshipEdgeRepository;
import co.fanki.threatscore.suspect.domain.Suspect;
import co.fanki.threatscore.suspect.domain.SuspectRepository;
import co.fanki.threatscore.suspect.domain.ThreatScore;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Application service running the threat scoring pipeline.
 *
 * <p>One run reads every suspect and edge, builds the suspect graph,
 * computes centrality, scores each suspect and writes the new scores
 * back. The neighbor bonus is looked up in the levels read at the start
 * of the run, so a level computed during the run never affects another
 * suspect of the same run.</p>
 *
 * <p>A failed read aborts the run. A suspect that cannot be scored or
 * written is reported and does not stop the others.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@Service
public class ThreatScoringService {

    private static final Logger LOG = LoggerFactory.getLogger(
            ThreatScoringService.class);

    private final SuspectRepository suspectRepository;
    private final RelationshipEdgeRepository edgeRepository;
    private final ScoreWriter scoreWriter;
    private final ThreatScorer threatScorer;
    private final ScoringParameters defaultParameters;

    /**
     * Creates a new ThreatScoringService.
     *
     * @param theSuspectRepository the suspect repository
     * @param theEdgeRepository the relationship edge repository
     * @param theScoreWriter the score writer
     * @param theIterations the default centrality iteration count
     * @param theDampingFactor the default centrality damping factor
     * @param theTopKingpins the default size of the kingpin summary
     */
    public ThreatScoringService(
            final SuspectRepository theSuspectRepository,
            final RelationshipEdgeRepository theEdgeRepository,
            final ScoreWriter theScoreWriter,
            @Value("${threat-scoring.iterations:20}") final int theIterations,
            @Value("${threat-scoring.damping-factor:0.85}")
            final double theDampingFactor,
            @Value("${threat-scoring.top-kingpins:5}")
            final int theTopKingpins) {
        this.suspectRepository = theSuspectRepository;
        this.edgeRepository = theEdgeRepository;
        this.scoreWriter = theScoreWriter;
        this.threatScorer = new ThreatScorer();
        this.defaultParameters = new ScoringParameters(theIterations,
                theDampingFactor, theTopKingpins);
    }

    /**
     * Runs the pipeline with the configured parameters.
     *
     * @return the run result
     */
    public ThreatScoringResult recalculate() {
        return recalculate(defaultParameters);
    }

    /**
     * Runs the pipeline overriding some configured parameters.
     *
     * @param iterations the iteration override, may be null
     * @param dampingFactor the damping override, may be null
     * @param topKingpins the summary size override, may be null
     * @return the run result
     * @throws IllegalArgumentException if an override is out of range
     */
    public ThreatScoringResult recalculate(final Integer iterations,
            final Double dampingFactor, final Integer topKingpins) {
        return recalculate(defaultParameters.withOverrides(
                iterations, dampingFactor, topKingpins));
    }

    /**
     * Runs the pipeline.
     *
     * @param parameters the run parameters
     * @return the run result
     */
    public ThreatScoringResult recalculate(final ScoringParameters parameters) {
        LOG.info("Starting threat score calculation (iterations={},"
                + " damping={})", parameters.iterations(),
                parameters.dampingFactor());

        final List<Suspect> suspects;
        try {
            suspects = suspectRepository.findAll();
        } catch (final RuntimeException e) {
            LOG.error("Failed to read suspects", e);
            return ThreatScoringResult.failure(
                    "Failed to read suspects: " + e.getMessage());
        }

        if (suspects.isEmpty()) {
            LOG.info("No suspects to process");
            return ThreatScoringResult.noSuspects();
        }

        final List<RelationshipEdge> edges;
        try {
            edges = edgeRepository.findAll();
        } catch (final RuntimeException e) {
            LOG.error("Failed to read relationship edges", e);
            return ThreatScoringResult.failure(
                    "Failed to read relationship edges: " + e.getMessage());
        }

        LOG.info("Processing {} suspects and {} edges", suspects.size(),
                edges.size());

        final SuspectGraph graph = SuspectGraph.build(suspects, edges);
        final Map<String, Double> centrality = parameters.centralityEngine()
                .compute(graph);
        LOG.info("Centrality calculation complete");

        final Map<String, Suspect> suspectsById = new LinkedHashMap<>();
        for (final Suspect suspect : suspects) {
            suspectsById.putIfAbsent(suspect.id(), suspect);
        }
        final Set<String> priorHighThreat = suspectsById.values().stream()
                .filter(Suspect::isHighThreat)
                .map(Suspect::id)
                .collect(Collectors.toUnmodifiableSet());

        final List<ScoreUpdate> updates = new ArrayList<>(graph.size());
        final List<WriteFailure> failures = new ArrayList<>();

        for (final String suspectId : graph.suspectIds()) {
            try {
                updates.add(new ScoreUpdate(suspectId, scoreSuspect(
                        suspectsById.get(suspectId), graph, centrality,
                        priorHighThreat)));
            } catch (final RuntimeException e) {
                LOG.warn("Could not score suspect {}: {}", suspectId,
                        e.getMessage());
                failures.add(new WriteFailure(suspectId, e.getMessage()));
            }
        }

        final WriteReport report = scoreWriter.write(updates);
        failures.addAll(report.failures());

        final List<Kingpin> topKingpins = scoreWriter
                .rank(updates, parameters.topKingpins()).stream()
                .map(update -> Kingpin.of(
                        suspectsById.get(update.suspectId()), update))
                .toList();

        final String message = failures.isEmpty()
                ? "Recalculated threat scores for " + report.updated()
                        + " suspects"
                : "Recalculated threat scores for " + report.updated()
                        + " of " + graph.size() + " suspects, "
                        + failures.size() + " failed";
        LOG.info(message);

        return new ThreatScoringResult(true, graph.size(), report.updated(),
                failures.size(), List.copyOf(failures), topKingpins, message);
    }

    private ThreatScore scoreSuspect(final Suspect suspect,
            final SuspectGraph graph,
            final Map<String, Double> centrality,
            final Set<String> priorHighThreat) {

        final boolean hasHighThreatNeighbor = graph.neighbors(suspect.id())
                .stream()
                .anyMatch(priorHighThreat::contains);

        return threatScorer.score(
                centrality.getOrDefault(suspect.id(), 0.0),
                graph.connectionCount(suspect.id()),
                suspect.fraudAmount().doubleValue(),
                hasHighThreatNeighbor);
    }

    /**
     * Result of a scoring run.
     *
     * @param success false only when the input could not be read
     * @param processed the number of suspects scored or attempted
     * @param updated the number of suspects whose new score was written
     * @param failed the number of suspects not updated
     * @param failures the reason for each suspect not updated
     * @param topKingpins the highest new scores, best first
     * @param message a human readable summary
     */
    public record ThreatScoringResult(
            boolean success,
            int processed,
            int updated,
            int failed,
            List<WriteFailure> failures,
            List<Kingpin> topKingpins,
            String message
    ) {

        /** Creates the result of a run that could not read its input. */
        public static ThreatScoringResult failure(final String message) {
            return new ThreatScoringResult(false, 0, 0, 0, List.of(),
                    List.of(), message);
        }

        /** Creates the result of a run over an empty suspect store. */
        public static ThreatScoringResult noSuspects() {
            return new ThreatScoringResult(true, 0, 0, 0, List.of(),
                    List.of(), "No suspects to process");
        }
    }

    /**
     * One entry of the kingpin summary.
     *
     * @param id the suspect ID
     * @param name the suspect name
     * @param alias the suspect alias, may be null
     * @param threatScore the new score
     * @param threatLevel the new level, lowercase
     */
    public record Kingpin(
            String id,
            String name,
            String alias,
            @JsonProperty("threat_score") int threatScore,
            @JsonProperty("threat_level") String threatLevel
    ) {

        static Kingpin of(final Suspect suspect, final ScoreUpdate update) {
            return new Kingpin(suspect.id(), suspect.name(), suspect.alias(),
                    update.threatScore(), update.threatLevel().value());
        }
    }

}
