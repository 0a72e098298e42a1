package co.fanki.threatscore.scoring.domain;

import co.fanki.threatscore.shared.Preconditions;

/**
 * Tunables of a scoring run.
 *
 * @param iterations the number of centrality iterations, 0 or more
 * @param dampingFactor the centrality damping factor, within [0, 1]
 * @param topKingpins the size of the ranked summary, 1 or more
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record ScoringParameters(
        int iterations,
        double dampingFactor,
        int topKingpins) {

    /** Default size of the ranked summary. */
    public static final int DEFAULT_TOP_KINGPINS = 5;

    /**
     * Validates the components.
     */
    public ScoringParameters {
        Preconditions.requireNonNegative(iterations,
                "Iterations must not be negative");
        Preconditions.requireBetween(dampingFactor, 0.0, 1.0,
                "Damping factor must be between 0 and 1");
        Preconditions.requirePositive(topKingpins,
                "Top kingpins must be positive");
    }

    /**
     * Returns the built-in defaults: 20 iterations, damping 0.85, top 5.
     *
     * @return the default parameters
     */
    public static ScoringParameters defaults() {
        return new ScoringParameters(CentralityEngine.DEFAULT_ITERATIONS,
                CentralityEngine.DEFAULT_DAMPING_FACTOR, DEFAULT_TOP_KINGPINS);
    }

    /**
     * Returns a copy with the non-null overrides applied.
     *
     * @param theIterations the iteration override, may be null
     * @param theDampingFactor the damping override, may be null
     * @param theTopKingpins the summary size override, may be null
     * @return the resulting parameters
     * @throws IllegalArgumentException if an override is out of range
     */
    public ScoringParameters withOverrides(final Integer theIterations,
            final Double theDampingFactor, final Integer theTopKingpins) {
        return new ScoringParameters(
                theIterations != null ? theIterations : iterations,
                theDampingFactor != null ? theDampingFactor : dampingFactor,
                theTopKingpins != null ? theTopKingpins : topKingpins);
    }

    /**
     * Creates the centrality engine for these parameters.
     *
     * @return a new engine
     */
    public CentralityEngine centralityEngine() {
        return new CentralityEngine(iterations, dampingFactor);
    }

}
