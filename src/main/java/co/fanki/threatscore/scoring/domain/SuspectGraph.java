package co.fanki.threatscore.scoring.domain;

import co.fanki.threatscore.shared.Preconditions;
import co.fanki.threatscore.suspect.domain.RelationshipEdge;
import co.fanki.threatscore.suspect.domain.Suspect;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Undirected adjacency between suspects, built fresh for one scoring run.
 *
 * <p>Every suspect is assigned a dense index in input order; neighbor
 * lists are kept as index arrays so the centrality iteration never scans
 * collections by ID. An edge is kept only when at least one endpoint is
 * declared a suspect and both endpoint IDs belong to the input suspects.
 * A kept edge links both endpoints to each other. Repeated edges between
 * the same pair keep their multiplicity in {@link #neighbors(String)}
 * and {@link #connectionCount(String)}, and in {@link #outDegree(int)};
 * {@link #distinctNeighbors(int)} collapses them.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class SuspectGraph {

    private static final Logger LOG = LoggerFactory.getLogger(
            SuspectGraph.class);

    private static final int[] NO_NEIGHBORS = new int[0];

    /** Suspect IDs by dense index. */
    private final List<String> ids;

    /** Dense index by suspect ID. */
    private final Map<String, Integer> indexById;

    /** Neighbor indices per suspect, with edge multiplicity. */
    private final int[][] neighbors;

    /** Neighbor indices per suspect, sorted and deduplicated. */
    private final int[][] distinctNeighbors;

    private final int skippedEdges;

    private SuspectGraph(final List<String> theIds,
            final Map<String, Integer> theIndexById,
            final int[][] theNeighbors,
            final int theSkippedEdges) {
        this.ids = Collections.unmodifiableList(theIds);
        this.indexById = Collections.unmodifiableMap(theIndexById);
        this.neighbors = theNeighbors;
        this.distinctNeighbors = new int[theNeighbors.length][];
        for (int i = 0; i < theNeighbors.length; i++) {
            distinctNeighbors[i] = Arrays.stream(theNeighbors[i])
                    .distinct()
                    .sorted()
                    .toArray();
        }
        this.skippedEdges = theSkippedEdges;
    }

    /**
     * Builds the graph from the full suspect and edge lists.
     *
     * <p>Pure function of its inputs. Edges whose endpoints are not both
     * known suspects are skipped without error.</p>
     *
     * @param suspects all suspects, duplicates by ID are ignored
     * @param edges all relationship edges
     * @return the graph
     */
    public static SuspectGraph build(final List<Suspect> suspects,
            final List<RelationshipEdge> edges) {
        Preconditions.requireNonNull(suspects, "Suspects are required");
        Preconditions.requireNonNull(edges, "Edges are required");

        final List<String> ids = new ArrayList<>(suspects.size());
        final Map<String, Integer> indexById = new HashMap<>();
        for (final Suspect suspect : suspects) {
            if (!indexById.containsKey(suspect.id())) {
                indexById.put(suspect.id(), ids.size());
                ids.add(suspect.id());
            }
        }

        final List<List<Integer>> adjacency = new ArrayList<>(ids.size());
        for (int i = 0; i < ids.size(); i++) {
            adjacency.add(new ArrayList<>());
        }

        int skipped = 0;
        for (final RelationshipEdge edge : edges) {
            final Integer source = indexById.get(edge.sourceId());
            final Integer target = indexById.get(edge.targetId());

            if (!edge.touchesSuspect() || source == null || target == null) {
                LOG.debug("Skipping edge {} ({} -> {}): endpoints are not"
                        + " both known suspects", edge.id(), edge.sourceId(),
                        edge.targetId());
                skipped++;
                continue;
            }
            adjacency.get(source).add(target);
            adjacency.get(target).add(source);
        }

        final int[][] neighbors = new int[ids.size()][];
        for (int i = 0; i < ids.size(); i++) {
            final List<Integer> list = adjacency.get(i);
            neighbors[i] = list.isEmpty()
                    ? NO_NEIGHBORS
                    : list.stream().mapToInt(Integer::intValue).toArray();
        }

        if (skipped > 0) {
            LOG.info("Skipped {} edges not linking two known suspects",
                    skipped);
        }

        return new SuspectGraph(ids, indexById, neighbors, skipped);
    }

    /**
     * Returns the number of suspects in the graph.
     *
     * @return the suspect count
     */
    public int size() {
        return ids.size();
    }

    /**
     * Checks if the graph has no suspects.
     *
     * @return true if empty
     */
    public boolean isEmpty() {
        return ids.isEmpty();
    }

    /**
     * Returns the suspect IDs in index order.
     *
     * @return the unmodifiable ID list
     */
    public List<String> suspectIds() {
        return ids;
    }

    /**
     * Returns the suspect ID at a dense index.
     *
     * @param index the dense index
     * @return the suspect ID
     */
    public String idAt(final int index) {
        return ids.get(index);
    }

    /**
     * Checks if a suspect belongs to the graph.
     *
     * @param suspectId the suspect ID
     * @return true if known
     */
    public boolean contains(final String suspectId) {
        return indexById.containsKey(suspectId);
    }

    /**
     * Returns the neighbor IDs of a suspect, one entry per kept edge.
     *
     * @param suspectId the suspect ID
     * @return the neighbor IDs, empty for unknown or isolated suspects
     */
    public List<String> neighbors(final String suspectId) {
        final Integer index = indexById.get(suspectId);
        if (index == null) {
            return List.of();
        }
        final List<String> result = new ArrayList<>(neighbors[index].length);
        for (final int neighbor : neighbors[index]) {
            result.add(ids.get(neighbor));
        }
        return Collections.unmodifiableList(result);
    }

    /**
     * Returns the number of kept edges touching a suspect.
     *
     * @param suspectId the suspect ID
     * @return the neighbor list length, 0 for unknown suspects
     */
    public int connectionCount(final String suspectId) {
        final Integer index = indexById.get(suspectId);
        return index == null ? 0 : neighbors[index].length;
    }

    /**
     * Returns the distinct neighbor indices of the suspect at an index.
     *
     * <p>The returned array is shared; callers must not modify it.</p>
     *
     * @param index the dense index
     * @return the sorted distinct neighbor indices
     */
    int[] distinctNeighbors(final int index) {
        return distinctNeighbors[index];
    }

    /**
     * Returns the length of the neighbor list at an index, repeated edges
     * included.
     *
     * @param index the dense index
     * @return the out-degree used by the centrality iteration
     */
    int outDegree(final int index) {
        return neighbors[index].length;
    }

    /**
     * Returns how many input edges were skipped while building.
     *
     * @return the skipped edge count
     */
    public int skippedEdges() {
        return skippedEdges;
    }

}
