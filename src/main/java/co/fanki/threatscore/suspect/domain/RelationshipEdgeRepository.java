package co.fanki.threatscore.suspect.domain;

import org.jdbi.v3.core.Jdbi;
import org.jdbi.v3.core.mapper.RowMapper;
import org.jdbi.v3.core.statement.StatementContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.List;
import java.util.Objects;

/**
 * Repository for the {@code network_edges} table.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@Repository
public class RelationshipEdgeRepository {

    private static final Logger LOG = LoggerFactory.getLogger(
            RelationshipEdgeRepository.class);

    /** Find all edges in insertion order. Uses: seq scan. */
    public static final String FIND_ALL =
            "SELECT * FROM network_edges ORDER BY created_at, id";

    private final Jdbi jdbi;

    /**
     * Creates a new RelationshipEdgeRepository.
     *
     * @param theJdbi the JDBI instance
     */
    public RelationshipEdgeRepository(final Jdbi theJdbi) {
        this.jdbi = theJdbi;
        this.jdbi.registerRowMapper(new RelationshipEdgeRowMapper());
    }

    /**
     * Saves a new edge.
     *
     * @param edge the edge to save
     */
    public void save(final RelationshipEdge edge) {
        jdbi.useHandle(handle -> handle.createUpdate("""
                INSERT INTO network_edges (
                    id, source_id, source_type, target_id, target_type,
                    edge_type, weight
                ) VALUES (
                    :id, :sourceId, :sourceType, :targetId, :targetType,
                    :edgeType, :weight
                )
                """)
                .bind("id", edge.id())
                .bind("sourceId", edge.sourceId())
                .bind("sourceType", edge.sourceType().value())
                .bind("targetId", edge.targetId())
                .bind("targetType", edge.targetType().value())
                .bind("edgeType", edge.edgeType().value())
                .bind("weight", edge.weight())
                .execute());
    }

    /**
     * Finds all edges.
     *
     * <p>Rows that do not form a valid edge, such as an empty endpoint ID,
     * are logged and left out.</p>
     *
     * @return every well-formed edge of the store
     */
    public List<RelationshipEdge> findAll() {
        final List<RelationshipEdge> rows = jdbi.withHandle(handle -> handle
                .createQuery(FIND_ALL)
                .map(new RelationshipEdgeRowMapper())
                .list());
        return rows.stream()
                .filter(Objects::nonNull)
                .toList();
    }

    private static final class RelationshipEdgeRowMapper
            implements RowMapper<RelationshipEdge> {

        /** Returns null for a malformed row. */
        @Override
        public RelationshipEdge map(final ResultSet rs,
                final StatementContext ctx) throws SQLException {
            try {
                return new RelationshipEdge(
                        rs.getString("id"),
                        rs.getString("source_id"),
                        EntityType.fromValue(rs.getString("source_type")),
                        rs.getString("target_id"),
                        EntityType.fromValue(rs.getString("target_type")),
                        EdgeType.fromValue(rs.getString("edge_type")),
                        rs.getBigDecimal("weight"));
            } catch (final IllegalArgumentException e) {
                LOG.warn("Skipping malformed edge {}: {}", rs.getString("id"),
                        e.getMessage());
                return null;
            }
        }
    }

}
