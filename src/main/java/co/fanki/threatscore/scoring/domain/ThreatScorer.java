package co.fanki.threatscore.scoring.domain;

import co.fanki.threatscore.shared.DomainException;
import co.fanki.threatscore.suspect.domain.ThreatScore;

/**
 * Combines centrality, connections, fraud amount and neighbor threat into
 * one bounded threat score.
 *
 * <p>Each term is capped on its own before the sum, so no single factor
 * can reach the top of the scale alone:</p>
 * <ul>
 *   <li>centrality: {@code min(centrality * 4000, 40)}</li>
 *   <li>connections: {@code min(connections * 2, 25)}</li>
 *   <li>fraud: {@code min(log10(fraud + 1) * 5, 25)}; every tenfold
 *       increase adds 5 points</li>
 *   <li>high threat neighbor: {@code 10} or {@code 0}</li>
 * </ul>
 *
 * <p>The sum is rounded half up and clamped to [0, 100].</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class ThreatScorer {

    static final double CENTRALITY_WEIGHT = 4000.0;
    static final double CENTRALITY_CAP = 40.0;
    static final double CONNECTION_WEIGHT = 2.0;
    static final double CONNECTION_CAP = 25.0;
    static final double FRAUD_WEIGHT = 5.0;
    static final double FRAUD_CAP = 25.0;
    static final double HIGH_THREAT_NEIGHBOR_BONUS = 10.0;

    /**
     * Scores one suspect.
     *
     * @param centrality the suspect centrality, finite
     * @param connectionCount the number of edges touching the suspect
     * @param fraudAmount the attributed fraud amount; negatives count as 0
     * @param hasHighThreatNeighbor whether a directly connected suspect is
     *     currently labelled high
     * @return the threat score and its level
     * @throws DomainException with code {@code NON_FINITE_SCORE} if an
     *     input or the resulting sum is not finite
     */
    public ThreatScore score(final double centrality,
            final int connectionCount,
            final double fraudAmount,
            final boolean hasHighThreatNeighbor) {

        final double raw = rawScore(centrality, connectionCount, fraudAmount,
                hasHighThreatNeighbor);
        return ThreatScore.clamped(Math.round(raw));
    }

    /**
     * Returns the unrounded sum of the four terms.
     *
     * @param centrality the suspect centrality, finite
     * @param connectionCount the number of edges touching the suspect
     * @param fraudAmount the attributed fraud amount
     * @param hasHighThreatNeighbor the neighbor bonus flag
     * @return the raw score
     * @throws DomainException if an input or the sum is not finite
     */
    public double rawScore(final double centrality,
            final int connectionCount,
            final double fraudAmount,
            final boolean hasHighThreatNeighbor) {

        if (!Double.isFinite(centrality) || !Double.isFinite(fraudAmount)) {
            throw new DomainException("Non-finite scoring input: centrality="
                    + centrality + ", fraudAmount=" + fraudAmount,
                    "NON_FINITE_SCORE");
        }

        final double sum = centralityTerm(centrality)
                + connectionTerm(connectionCount)
                + fraudTerm(fraudAmount)
                + (hasHighThreatNeighbor ? HIGH_THREAT_NEIGHBOR_BONUS : 0.0);

        if (!Double.isFinite(sum)) {
            throw new DomainException("Non-finite threat score: " + sum,
                    "NON_FINITE_SCORE");
        }
        return sum;
    }

    static double centralityTerm(final double centrality) {
        return Math.min(centrality * CENTRALITY_WEIGHT, CENTRALITY_CAP);
    }

    static double connectionTerm(final int connectionCount) {
        return Math.min(connectionCount * CONNECTION_WEIGHT, CONNECTION_CAP);
    }

    static double fraudTerm(final double fraudAmount) {
        final double amount = Math.max(fraudAmount, 0.0);
        return Math.min(Math.log10(amount + 1.0) * FRAUD_WEIGHT, FRAUD_CAP);
    }

}
