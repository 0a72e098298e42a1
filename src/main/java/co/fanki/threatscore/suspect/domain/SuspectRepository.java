package co.fanki.threatscore.suspect.domain;

import org.jdbi.v3.core.Jdbi;
import org.jdbi.v3.core.mapper.RowMapper;
import org.jdbi.v3.core.statement.StatementContext;
import org.springframework.stereotype.Repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Repository for reading suspects and writing back their threat scores.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@Repository
public class SuspectRepository {

    /** Find suspect by ID. Uses: PK index. */
    public static final String FIND_BY_ID =
            "SELECT * FROM suspects WHERE id = :id";

    /** Find all suspects in a stable order. Uses: PK index. */
    public static final String FIND_ALL =
            "SELECT * FROM suspects ORDER BY id";

    /** Ranking by stored score. Uses: idx_suspects_threat_score. */
    public static final String FIND_TOP_BY_THREAT_SCORE = """
            SELECT * FROM suspects
            ORDER BY threat_score DESC NULLS LAST, id
            LIMIT :limit
            """;

    private final Jdbi jdbi;

    /**
     * Creates a new SuspectRepository.
     *
     * @param theJdbi the JDBI instance
     */
    public SuspectRepository(final Jdbi theJdbi) {
        this.jdbi = theJdbi;
        this.jdbi.registerRowMapper(new SuspectRowMapper());
    }

    /**
     * Saves a new suspect.
     *
     * @param suspect the suspect to save
     */
    public void save(final Suspect suspect) {
        jdbi.useHandle(handle -> handle.createUpdate("""
                INSERT INTO suspects (
                    id, name, alias, location, fraud_amount, threat_score,
                    threat_level, last_active, notes, created_at, updated_at
                ) VALUES (
                    :id, :name, :alias, :location, :fraudAmount, :threatScore,
                    :threatLevel, :lastActive, :notes, :createdAt, :updatedAt
                )
                """)
                .bind("id", suspect.id())
                .bind("name", suspect.name())
                .bind("alias", suspect.alias())
                .bind("location", suspect.location())
                .bind("fraudAmount", suspect.fraudAmount())
                .bind("threatScore", suspect.threatScore())
                .bind("threatLevel", suspect.threatLevel() != null
                        ? suspect.threatLevel().value() : null)
                .bind("lastActive", toTimestamp(suspect.lastActive()))
                .bind("notes", suspect.notes())
                .bind("createdAt", toTimestamp(suspect.createdAt()))
                .bind("updatedAt", toTimestamp(suspect.updatedAt()))
                .execute());
    }

    /**
     * Writes a new threat score and level for one suspect.
     *
     * <p>Touches only the score, level and update timestamp columns of
     * the row.</p>
     *
     * @param id the suspect ID
     * @param score the new threat score
     * @return true if a row was updated, false if no suspect has the ID
     */
    public boolean updateThreatScore(final String id, final ThreatScore score) {
        final int rows = jdbi.withHandle(handle -> handle.createUpdate("""
                UPDATE suspects SET
                    threat_score = :threatScore,
                    threat_level = :threatLevel,
                    updated_at = :updatedAt
                WHERE id = :id
                """)
                .bind("id", id)
                .bind("threatScore", score.value())
                .bind("threatLevel", score.level().value())
                .bind("updatedAt", toTimestamp(Instant.now()))
                .execute());
        return rows > 0;
    }

    /**
     * Finds a suspect by its ID.
     *
     * @param id the suspect ID
     * @return the suspect if found
     */
    public Optional<Suspect> findById(final String id) {
        return jdbi.withHandle(handle -> handle
                .createQuery(FIND_BY_ID)
                .bind("id", id)
                .map(new SuspectRowMapper())
                .findOne());
    }

    /**
     * Finds all suspects.
     *
     * @return every suspect, ordered by ID
     */
    public List<Suspect> findAll() {
        return jdbi.withHandle(handle -> handle
                .createQuery(FIND_ALL)
                .map(new SuspectRowMapper())
                .list());
    }

    /**
     * Finds the suspects with the highest stored threat score.
     *
     * <p>Suspects never scored come last.</p>
     *
     * @param limit the maximum number of suspects to return
     * @return the ranking, highest score first
     */
    public List<Suspect> findTopByThreatScore(final int limit) {
        return jdbi.withHandle(handle -> handle
                .createQuery(FIND_TOP_BY_THREAT_SCORE)
                .bind("limit", limit)
                .map(new SuspectRowMapper())
                .list());
    }

    private Timestamp toTimestamp(final Instant instant) {
        return instant != null ? Timestamp.from(instant) : null;
    }

    private static Instant toInstant(final Timestamp timestamp) {
        return timestamp != null ? timestamp.toInstant() : null;
    }

    private static final class SuspectRowMapper implements RowMapper<Suspect> {

        @Override
        public Suspect map(final ResultSet rs, final StatementContext ctx)
                throws SQLException {
            final int storedScore = rs.getInt("threat_score");
            final Integer threatScore = rs.wasNull() ? null : storedScore;

            final String storedLevel = rs.getString("threat_level");
            final ThreatLevel threatLevel = storedLevel != null
                    ? ThreatLevel.fromValue(storedLevel) : null;

            return Suspect.reconstitute(
                    rs.getString("id"),
                    rs.getString("name"),
                    rs.getString("alias"),
                    rs.getString("location"),
                    rs.getBigDecimal("fraud_amount"),
                    threatScore,
                    threatLevel,
                    toInstant(rs.getTimestamp("last_active")),
                    rs.getString("notes"),
                    toInstant(rs.getTimestamp("created_at")),
                    toInstant(rs.getTimestamp("updated_at")));
        }
    }

}
