package co.fanki.threatscore.scoring.domain;

import co.fanki.threatscore.shared.Preconditions;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * PageRank-style centrality over a {@link SuspectGraph}.
 *
 * <p>Every suspect starts at {@code 1/N}. Each iteration computes, from
 * the previous iteration's values only:</p>
 *
 * <pre>
 * next(v) = (1 - d) / N + d * sum(prev(u) / outDegree(u)) for u linked to v
 * </pre>
 *
 * <p>Out-degree is the length of the neighbor list, repeated edges
 * included, while each distinct neighbor {@code v} receives a single
 * {@code prev(u) / outDegree(u)} term. A suspect linked twice to the same
 * neighbor therefore passes on only part of its value. A suspect without
 * neighbors passes nothing on and its share is not spread over the other
 * suspects. The total stays at 1 only when no suspect is isolated and no
 * pair is linked more than once.</p>
 *
 * <p>Runs a fixed number of iterations, never a convergence test, so the
 * cost and the result of a run are reproducible. Each iteration scatters
 * along the edges: O(iterations x E).</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class CentralityEngine {

    /** Default number of power iterations. */
    public static final int DEFAULT_ITERATIONS = 20;

    /** Default probability of following an edge instead of restarting. */
    public static final double DEFAULT_DAMPING_FACTOR = 0.85;

    private final int iterations;

    private final double dampingFactor;

    /**
     * Creates an engine with the default iteration count and damping.
     */
    public CentralityEngine() {
        this(DEFAULT_ITERATIONS, DEFAULT_DAMPING_FACTOR);
    }

    /**
     * Creates an engine.
     *
     * @param theIterations the number of iterations, 0 or more
     * @param theDampingFactor the damping factor, within [0, 1]
     */
    public CentralityEngine(final int theIterations,
            final double theDampingFactor) {
        this.iterations = Preconditions.requireNonNegative(theIterations,
                "Iterations must not be negative");
        this.dampingFactor = Preconditions.requireBetween(theDampingFactor,
                0.0, 1.0, "Damping factor must be between 0 and 1");
    }

    /**
     * Computes the centrality of every suspect in the graph.
     *
     * @param graph the suspect graph
     * @return an unmodifiable map from suspect ID to centrality, in graph
     *     order; empty when the graph is empty
     */
    public Map<String, Double> compute(final SuspectGraph graph) {
        Preconditions.requireNonNull(graph, "Graph is required");

        final int n = graph.size();
        if (n == 0) {
            return Map.of();
        }

        final double restart = (1.0 - dampingFactor) / n;

        double[] current = new double[n];
        double[] next = new double[n];
        Arrays.fill(current, 1.0 / n);

        for (int iteration = 0; iteration < iterations; iteration++) {
            Arrays.fill(next, 0.0);

            for (int u = 0; u < n; u++) {
                final int outDegree = graph.outDegree(u);
                if (outDegree == 0) {
                    continue;
                }
                final double share = current[u] / outDegree;
                final int[] out = graph.distinctNeighbors(u);
                for (final int v : out) {
                    next[v] += share;
                }
            }

            for (int v = 0; v < n; v++) {
                next[v] = restart + dampingFactor * next[v];
            }

            final double[] swap = current;
            current = next;
            next = swap;
        }

        final Map<String, Double> scores = new LinkedHashMap<>(n * 2);
        for (int i = 0; i < n; i++) {
            scores.put(graph.idAt(i), current[i]);
        }
        return Collections.unmodifiableMap(scores);
    }

    public int iterations() {
        return iterations;
    }

    public double dampingFactor() {
        return dampingFactor;
    }

}
