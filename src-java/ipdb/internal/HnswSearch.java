package ipdb.internal;

import ipdb.VectorStorage;

/**
 * HNSW search over an {@link EdgeStore}.
 *
 * <p>Distances are cosine distances between normalized vectors; the query must
 * already be normalized.
 *
 * <p><b>Internal API</b> - subject to change without notice.
 */
public final class HnswSearch {

    private HnswSearch() {}

    /**
     * Search for k nearest live neighbors.
     *
     * @param vectors Vector storage
     * @param edges   Graph edges
     * @param query   Normalized query vector
     * @param k       Number of neighbors to return
     * @param ef      Beam width (exploration factor)
     * @return Array of [id, distance, id, distance, ...] sorted by distance
     */
    public static double[] search(
            VectorStorage vectors,
            EdgeStore edges,
            float[] query,
            int k,
            int ef) {

        int entrypoint = edges.getEntrypoint();
        if (entrypoint < 0 || k <= 0) {
            return new double[0];
        }

        int ep = entrypoint;

        // Greedy descent from top level to level 1
        for (int level = edges.getCurrentMaxLevel(); level > 0; level--) {
            ep = searchLayerGreedy(vectors, edges, query, ep, level);
        }

        double[] found = searchLayer(vectors, edges, query, ep, 0, Math.max(ef, k), false);
        int resultCount = Math.min(k, found.length / 2);
        double[] result = new double[resultCount * 2];
        System.arraycopy(found, 0, result, 0, resultCount * 2);
        return result;
    }

    /**
     * Greedy search at a layer - find single nearest node.
     */
    static int searchLayerGreedy(
            VectorStorage vectors,
            EdgeStore edges,
            float[] query,
            int entryPoint,
            int layer) {

        int current = entryPoint;
        double currentDist = Distance.cosine(vectors.view(current), query);

        boolean improved = true;
        while (improved) {
            improved = false;
            int[] neighbors = edges.getNeighbors(layer, current);
            if (neighbors == null) break;

            for (int neighborId : neighbors) {
                double neighborDist = Distance.cosine(vectors.view(neighborId), query);
                if (neighborDist < currentDist) {
                    current = neighborId;
                    currentDist = neighborDist;
                    improved = true;
                }
            }
        }
        return current;
    }

    /**
     * Beam search at a layer - find up to ef nearest nodes.
     *
     * <p>Deleted nodes are always expanded so the graph stays navigable, but
     * they only enter the result set when {@code includeDeleted} is set
     * (insertion links to them, queries never return them).
     *
     * @return Array of [id, distance, ...] sorted by distance
     */
    static double[] searchLayer(
            VectorStorage vectors,
            EdgeStore edges,
            float[] query,
            int entryPoint,
            int layer,
            int ef,
            boolean includeDeleted) {

        int maxSize = vectors.getCount() + 1;
        ArrayBitSet visited = new ArrayBitSet(edges.getMaxNodes());

        // Candidates: min-heap by distance (closest first)
        int[] candIds = new int[maxSize];
        double[] candDists = new double[maxSize];
        int candCount = 0;

        // Results: max-heap by distance (furthest first for pruning)
        int[] resIds = new int[ef + 1];
        double[] resDists = new double[ef + 1];
        int resCount = 0;

        double epDist = Distance.cosine(vectors.view(entryPoint), query);
        heapPush(candIds, candDists, candCount++, entryPoint, epDist);
        visited.add(entryPoint);

        double furthestResult = Double.MAX_VALUE;
        if (includeDeleted || !edges.isDeleted(entryPoint)) {
            maxHeapPush(resIds, resDists, resCount++, entryPoint, epDist);
            furthestResult = epDist;
        }

        while (candCount > 0) {
            int current = candIds[0];
            double currentDist = candDists[0];
            heapPop(candIds, candDists, candCount--);

            if (currentDist > furthestResult && resCount >= ef) {
                break;
            }

            int[] neighbors = edges.getNeighbors(layer, current);
            if (neighbors == null) continue;

            for (int neighborId : neighbors) {
                if (!visited.add(neighborId)) continue;

                double neighborDist = Distance.cosine(vectors.view(neighborId), query);

                if ((neighborDist < furthestResult || resCount < ef) && candCount < maxSize) {
                    heapPush(candIds, candDists, candCount++, neighborId, neighborDist);
                }

                if (!includeDeleted && edges.isDeleted(neighborId)) {
                    continue;
                }
                if (resCount < ef) {
                    maxHeapPush(resIds, resDists, resCount++, neighborId, neighborDist);
                    furthestResult = resDists[0];
                } else if (neighborDist < furthestResult) {
                    maxHeapReplace(resIds, resDists, resCount, neighborId, neighborDist);
                    furthestResult = resDists[0];
                }
            }
        }

        sortByDistance(resIds, resDists, resCount);

        double[] result = new double[resCount * 2];
        for (int i = 0; i < resCount; i++) {
            result[i * 2] = resIds[i];
            result[i * 2 + 1] = resDists[i];
        }
        return result;
    }

    // =========================================================================
    // Binary heaps (O(log n) operations)
    // =========================================================================

    private static void heapPush(int[] ids, double[] dists, int count, int id, double dist) {
        ids[count] = id;
        dists[count] = dist;
        int i = count;
        while (i > 0) {
            int parent = (i - 1) / 2;
            if (dists[parent] <= dists[i]) break;
            swap(ids, dists, parent, i);
            i = parent;
        }
    }

    private static void heapPop(int[] ids, double[] dists, int count) {
        ids[0] = ids[count - 1];
        dists[0] = dists[count - 1];
        int i = 0;
        int n = count - 1;
        while (true) {
            int left = 2 * i + 1;
            int right = 2 * i + 2;
            int smallest = i;
            if (left < n && dists[left] < dists[smallest]) smallest = left;
            if (right < n && dists[right] < dists[smallest]) smallest = right;
            if (smallest == i) break;
            swap(ids, dists, smallest, i);
            i = smallest;
        }
    }

    private static void maxHeapPush(int[] ids, double[] dists, int count, int id, double dist) {
        ids[count] = id;
        dists[count] = dist;
        int i = count;
        while (i > 0) {
            int parent = (i - 1) / 2;
            if (dists[parent] >= dists[i]) break;
            swap(ids, dists, parent, i);
            i = parent;
        }
    }

    private static void maxHeapReplace(int[] ids, double[] dists, int count, int id, double dist) {
        ids[0] = id;
        dists[0] = dist;
        int i = 0;
        while (true) {
            int left = 2 * i + 1;
            int right = 2 * i + 2;
            int largest = i;
            if (left < count && dists[left] > dists[largest]) largest = left;
            if (right < count && dists[right] > dists[largest]) largest = right;
            if (largest == i) break;
            swap(ids, dists, largest, i);
            i = largest;
        }
    }

    private static void swap(int[] ids, double[] dists, int a, int b) {
        int tmpId = ids[a];
        double tmpDist = dists[a];
        ids[a] = ids[b];
        dists[a] = dists[b];
        ids[b] = tmpId;
        dists[b] = tmpDist;
    }

    /**
     * Insertion sort by distance, ties by id. Result sets are small (ef).
     */
    static void sortByDistance(int[] ids, double[] distances, int count) {
        for (int i = 1; i < count; i++) {
            int id = ids[i];
            double dist = distances[i];
            int j = i - 1;
            while (j >= 0 && (distances[j] > dist || (distances[j] == dist && ids[j] > id))) {
                ids[j + 1] = ids[j];
                distances[j + 1] = distances[j];
                j--;
            }
            ids[j + 1] = id;
            distances[j + 1] = dist;
        }
    }
}
