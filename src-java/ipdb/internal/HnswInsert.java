package ipdb.internal;

import ipdb.VectorStorage;

import java.util.Arrays;
import java.util.Random;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Sequential HNSW insert.
 *
 * <p>Neighbors are picked with the diversity heuristic (hnswlib style): a
 * candidate is kept only if it is not closer to an already selected neighbor
 * than to the new node. Reverse edges are added with the same pruning.
 *
 * <p>Callers serialize inserts on the same {@link EdgeStore}.
 *
 * <p><b>Internal API</b> - subject to change without notice.
 */
public final class HnswInsert {

    private static final Logger logger = LoggerFactory.getLogger(HnswInsert.class);

    private HnswInsert() {}

    /**
     * Draw a node level from the exponential distribution with scale {@code ml}.
     *
     * @param random   Level generator
     * @param ml       Level multiplier, usually {@code 1 / ln(M)}
     * @param maxLevel Upper bound for the returned level
     */
    public static int randomLevel(Random random, double ml, int maxLevel) {
        double r = random.nextDouble();
        if (r <= 0.0) r = Double.MIN_VALUE;
        int level = (int) Math.floor(-Math.log(r) * ml);
        return Math.min(level, maxLevel);
    }

    /**
     * Link an already stored node into the graph.
     *
     * @param vectors        Storage holding the node's normalized vector at {@code nodeId}
     * @param edges          Graph edges
     * @param nodeId         Slot of the new node
     * @param nodeLevel      Level drawn for the node
     * @param efConstruction Beam width during construction
     */
    public static void insert(
            VectorStorage vectors,
            EdgeStore edges,
            int nodeId,
            int nodeLevel,
            int efConstruction) {

        int M = edges.getM();
        int M0 = edges.getM0();
        float[] vector = vectors.view(nodeId);

        if (edges.getEntrypoint() < 0) {
            edges.setEntrypoint(nodeId);
            edges.setCurrentMaxLevel(nodeLevel);
            logger.debug("Insert nodeId={} became entry point (graph was empty)", nodeId);
            return;
        }

        int ep = edges.getEntrypoint();
        int currentMaxLevel = edges.getCurrentMaxLevel();

        for (int level = currentMaxLevel; level > nodeLevel; level--) {
            ep = HnswSearch.searchLayerGreedy(vectors, edges, vector, ep, level);
        }

        int insertLevel = Math.min(nodeLevel, currentMaxLevel);
        for (int level = insertLevel; level >= 0; level--) {
            int maxNeighbors = (level == 0) ? M0 : M;

            // Tombstoned nodes are valid link targets; they keep the graph connected
            double[] found = HnswSearch.searchLayer(vectors, edges, vector, ep, level, efConstruction, true);
            int[] selected = selectNeighborsHeuristic(vectors, nodeId, found, maxNeighbors);

            if (selected.length == 0) {
                logger.warn("Insert nodeId={} level={} - no neighbors selected", nodeId, level);
                continue;
            }

            edges.setNeighbors(level, nodeId, selected);
            for (int neighborId : selected) {
                addReverseEdge(vectors, edges, level, neighborId, nodeId, maxNeighbors);
            }
            ep = selected[0];
        }

        if (nodeLevel > currentMaxLevel) {
            edges.setCurrentMaxLevel(nodeLevel);
            edges.setEntrypoint(nodeId);
            logger.debug("Insert nodeId={} became new entry point, maxLevel={}", nodeId, nodeLevel);
        }
    }

    // =========================================================================
    // Neighbor selection
    // =========================================================================

    /**
     * Select neighbors from [id, dist, ...] candidates sorted by distance.
     */
    private static int[] selectNeighborsHeuristic(
            VectorStorage vectors,
            int nodeId,
            double[] candidates,
            int maxNeighbors) {

        int count = candidates.length / 2;
        if (count == 0) return new int[0];

        int[] selected = new int[Math.min(count, maxNeighbors)];
        int selectedCount = 0;

        for (int i = 0; i < count && selectedCount < selected.length; i++) {
            int candidateId = (int) candidates[i * 2];
            if (candidateId == nodeId) continue;
            double candidateDist = candidates[i * 2 + 1];

            boolean tooClose = false;
            for (int j = 0; j < selectedCount; j++) {
                double interDist = Distance.cosine(vectors.view(candidateId), vectors.view(selected[j]));
                if (interDist < candidateDist) {
                    tooClose = true;
                    break;
                }
            }
            if (!tooClose) {
                selected[selectedCount++] = candidateId;
            }
        }

        return selectedCount < selected.length ? Arrays.copyOf(selected, selectedCount) : selected;
    }

    private static void addReverseEdge(
            VectorStorage vectors,
            EdgeStore edges,
            int layer,
            int neighborId,
            int newNodeId,
            int maxNeighbors) {

        if (neighborId == newNodeId) return;

        int[] current = edges.getNeighbors(layer, neighborId);
        int currentCount = (current == null) ? 0 : current.length;

        for (int i = 0; i < currentCount; i++) {
            if (current[i] == newNodeId) return;
        }

        if (currentCount < maxNeighbors) {
            int[] newNeighbors = new int[currentCount + 1];
            if (current != null) {
                System.arraycopy(current, 0, newNeighbors, 0, currentCount);
            }
            newNeighbors[currentCount] = newNodeId;
            edges.setNeighbors(layer, neighborId, newNeighbors);
        } else {
            edges.setNeighbors(layer, neighborId,
                    pruneWithHeuristic(vectors, neighborId, current, newNodeId, maxNeighbors));
        }
    }

    private static int[] pruneWithHeuristic(
            VectorStorage vectors,
            int refNodeId,
            int[] currentNeighbors,
            int newNodeId,
            int maxNeighbors) {

        float[] ref = vectors.view(refNodeId);
        int n = currentNeighbors.length + 1;
        int[] candidates = new int[n];
        double[] distances = new double[n];

        for (int i = 0; i < currentNeighbors.length; i++) {
            candidates[i] = currentNeighbors[i];
            distances[i] = Distance.cosine(ref, vectors.view(currentNeighbors[i]));
        }
        candidates[n - 1] = newNodeId;
        distances[n - 1] = Distance.cosine(ref, vectors.view(newNodeId));

        HnswSearch.sortByDistance(candidates, distances, n);

        int[] selected = new int[maxNeighbors];
        int selectedCount = 0;

        for (int i = 0; i < n && selectedCount < maxNeighbors; i++) {
            int candidateId = candidates[i];
            if (candidateId == refNodeId) continue;

            boolean tooClose = false;
            for (int j = 0; j < selectedCount; j++) {
                double interDist = Distance.cosine(vectors.view(candidateId), vectors.view(selected[j]));
                if (interDist < distances[i]) {
                    tooClose = true;
                    break;
                }
            }
            if (!tooClose) {
                selected[selectedCount++] = candidateId;
            }
        }

        return selectedCount < maxNeighbors ? Arrays.copyOf(selected, selectedCount) : selected;
    }
}
