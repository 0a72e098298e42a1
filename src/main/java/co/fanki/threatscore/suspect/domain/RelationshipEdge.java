package co.fanki.threatscore.suspect.domain;

import co.fanki.threatscore.shared.Preconditions;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * A recorded link between two entities of the case store.
 *
 * <p>Links through intermediate entities (SIMs, devices, accounts, IPs)
 * are collapsed into suspect-to-suspect edges by the importer before they
 * reach the scoring engine.</p>
 *
 * @param id the edge ID
 * @param sourceId the source entity ID
 * @param sourceType the source entity type
 * @param targetId the target entity ID
 * @param targetType the target entity type
 * @param edgeType the relationship kind
 * @param weight the optional edge weight, may be null
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record RelationshipEdge(
        String id,
        String sourceId,
        EntityType sourceType,
        String targetId,
        EntityType targetType,
        EdgeType edgeType,
        BigDecimal weight) {

    /**
     * Validates the required components.
     */
    public RelationshipEdge {
        Preconditions.requireNonBlank(id, "Edge ID is required");
        Preconditions.requireNonBlank(sourceId, "Source ID is required");
        Preconditions.requireNonNull(sourceType, "Source type is required");
        Preconditions.requireNonBlank(targetId, "Target ID is required");
        Preconditions.requireNonNull(targetType, "Target type is required");
        Preconditions.requireNonNull(edgeType, "Edge type is required");
    }

    /**
     * Creates a new unweighted edge between two suspects.
     *
     * @param sourceId the source suspect ID
     * @param targetId the target suspect ID
     * @param edgeType the relationship kind
     * @return the new edge
     */
    public static RelationshipEdge betweenSuspects(final String sourceId,
            final String targetId, final EdgeType edgeType) {
        return new RelationshipEdge(UUID.randomUUID().toString(),
                sourceId, EntityType.SUSPECT, targetId, EntityType.SUSPECT,
                edgeType, null);
    }

    /**
     * Checks if either endpoint is declared as a suspect.
     *
     * @return true if the source or the target type is SUSPECT
     */
    public boolean touchesSuspect() {
        return sourceType == EntityType.SUSPECT
                || targetType == EntityType.SUSPECT;
    }

}
