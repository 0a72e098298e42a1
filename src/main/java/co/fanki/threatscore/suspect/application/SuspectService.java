package co.fanki.threatscore.suspect.application;

import co.fanki.threatscore.shared.DomainException;
import co.fanki.threatscore.shared.Preconditions;
import co.fanki.threatscore.suspect.domain.Suspect;
import co.fanki.threatscore.suspect.domain.SuspectRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

/**
 * Application service for reading stored suspect rankings.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@Service
public class SuspectService {

    private static final Logger LOG = LoggerFactory.getLogger(
            SuspectService.class);

    /** Largest ranking a caller may request. */
    public static final int MAX_KINGPINS = 100;

    private final SuspectRepository suspectRepository;

    /**
     * Creates a new SuspectService.
     *
     * @param theSuspectRepository the suspect repository
     */
    public SuspectService(final SuspectRepository theSuspectRepository) {
        this.suspectRepository = theSuspectRepository;
    }

    /**
     * Lists the suspects with the highest stored threat score.
     *
     * @param limit how many suspects to return, 1 to {@value #MAX_KINGPINS}
     * @return the ranking, highest score first
     * @throws IllegalArgumentException if limit is out of range
     */
    public List<SuspectSummary> listKingpins(final int limit) {
        Preconditions.requireBetween(limit, 1, MAX_KINGPINS,
                "Limit must be between 1 and " + MAX_KINGPINS);
        LOG.debug("Listing top {} kingpins", limit);
        return suspectRepository.findTopByThreatScore(limit).stream()
                .map(SuspectSummary::from)
                .toList();
    }

    /**
     * Finds a suspect by ID, throwing if not found.
     *
     * @param suspectId the suspect ID
     * @return the suspect summary
     * @throws DomainException if the suspect is not found
     */
    public SuspectSummary getById(final String suspectId) {
        return suspectRepository.findById(suspectId)
                .map(SuspectSummary::from)
                .orElseThrow(() -> new DomainException(
                        "Suspect not found: " + suspectId,
                        "SUSPECT_NOT_FOUND"));
    }

    /**
     * Read model of a suspect and its stored score.
     *
     * @param id the suspect ID
     * @param name the name
     * @param alias the alias, may be null
     * @param location the last known location, may be null
     * @param fraudAmount the attributed fraud amount
     * @param threatScore the stored score, null if never scored
     * @param threatLevel the stored level, lowercase, null if never scored
     * @param lastActive when last seen active, may be null
     */
    public record SuspectSummary(
            String id,
            String name,
            String alias,
            String location,
            BigDecimal fraudAmount,
            Integer threatScore,
            String threatLevel,
            Instant lastActive
    ) {

        static SuspectSummary from(final Suspect suspect) {
            return new SuspectSummary(
                    suspect.id(),
                    suspect.name(),
                    suspect.alias(),
                    suspect.location(),
                    suspect.fraudAmount(),
                    suspect.threatScore(),
                    suspect.threatLevel() != null
                            ? suspect.threatLevel().value() : null,
                    suspect.lastActive());
        }
    }

}
