package ipdb;

import java.util.Arrays;
import java.util.Random;

import ipdb.internal.Distance;
import ipdb.internal.EdgeStore;
import ipdb.internal.HnswInsert;
import ipdb.internal.HnswSearch;

/**
 * HNSW index for approximate nearest neighbor search by cosine distance.
 *
 * This is the low-level entry point. Node IDs are dense slots assigned in
 * insertion order; mapping them to application keys is the caller's job.
 *
 * Example usage:
 * <pre>
 *   HnswIndex index = HnswIndex.create(384, 10000, 16, 200);
 *
 *   int id = index.insert(vector);
 *   SearchResult[] results = index.search(query, 10, 50);
 *
 *   index.delete(id);   // tombstone, never returned again
 *   index.close();
 * </pre>
 *
 * Vectors are L2-normalized on insert and queries are normalized before
 * searching, so magnitudes never influence ranking.
 *
 * Thread safety:
 * - insert() and delete() are synchronized on the index
 * - search() may run concurrently with other searches, but callers that mix
 *   searches with writes must serialize them externally
 */
public final class HnswIndex {

    /** Default upper bound for node levels. */
    public static final int DEFAULT_MAX_LEVEL = 16;

    private final VectorStorage vectors;
    private final EdgeStore edges;
    private final int dim;
    private final int M;
    private final int M0;
    private final int efConstruction;
    private final int maxLevel;
    private final double ml;  // 1/ln(M)
    private final Random random;
    private volatile boolean closed = false;

    /**
     * Create a new in-memory HNSW index.
     *
     * @param dim vector dimensionality
     * @param capacity maximum number of slots (live plus deleted)
     * @param M max neighbors per node (upper layers)
     * @param efConstruction beam width during construction
     */
    public static HnswIndex create(int dim, int capacity, int M, int efConstruction) {
        return create(dim, capacity, M, efConstruction, 42L);
    }

    /**
     * Create a new in-memory HNSW index with a fixed level seed, so the same
     * insertion sequence always produces the same graph.
     */
    public static HnswIndex create(int dim, int capacity, int M, int efConstruction, long seed) {
        if (M < 2) {
            throw new IllegalArgumentException("M must be at least 2, got " + M);
        }
        if (efConstruction < 1) {
            throw new IllegalArgumentException("efConstruction must be positive, got " + efConstruction);
        }
        VectorStorage vectors = new HeapVectorStorage(dim, capacity);
        EdgeStore edges = new EdgeStore(capacity, DEFAULT_MAX_LEVEL, M, 2 * M);
        return new HnswIndex(vectors, edges, M, efConstruction, DEFAULT_MAX_LEVEL, new Random(seed));
    }

    private HnswIndex(VectorStorage vectors, EdgeStore edges,
                      int M, int efConstruction, int maxLevel, Random random) {
        this.vectors = vectors;
        this.edges = edges;
        this.dim = vectors.getDim();
        this.M = M;
        this.M0 = 2 * M;
        this.efConstruction = efConstruction;
        this.maxLevel = maxLevel;
        this.ml = 1.0 / Math.log(M);
        this.random = random;
    }

    // =========================================================================
    // Write Operations
    // =========================================================================

    /**
     * Insert a single vector.
     *
     * @param vector float array of length dim
     * @return node ID of the inserted vector
     * @throws IllegalArgumentException on dimension mismatch
     * @throws IllegalStateException if every slot is used
     */
    public synchronized int insert(float[] vector) {
        checkNotClosed();
        if (vector.length != dim) {
            throw new IllegalArgumentException(
                "Vector dimension mismatch: expected " + dim + ", got " + vector.length);
        }

        int nodeId = vectors.append(Distance.normalized(vector));
        int nodeLevel = HnswInsert.randomLevel(random, ml, maxLevel);
        HnswInsert.insert(vectors, edges, nodeId, nodeLevel, efConstruction);
        return nodeId;
    }

    /**
     * Tombstone a node. Its slot stays allocated and keeps routing searches,
     * but it is never returned as a result.
     *
     * @return true if the node was live
     */
    public synchronized boolean delete(int nodeId) {
        checkNotClosed();
        if (nodeId < 0 || nodeId >= vectors.getCount()) {
            throw new IndexOutOfBoundsException("No node " + nodeId);
        }
        return edges.markDeleted(nodeId);
    }

    // =========================================================================
    // Search Operations
    // =========================================================================

    /**
     * Search result containing node ID and cosine distance.
     */
    public static final class SearchResult {
        public final int id;
        public final double distance;

        public SearchResult(int id, double distance) {
            this.id = id;
            this.distance = distance;
        }

        @Override
        public String toString() {
            return "SearchResult{id=" + id + ", distance=" + distance + "}";
        }
    }

    /**
     * Search for k nearest live neighbors.
     *
     * @param query query vector
     * @param k number of neighbors to return
     * @param ef beam width (raised to k when smaller)
     * @return array of SearchResult sorted by distance, then node ID
     */
    public SearchResult[] search(float[] query, int k, int ef) {
        checkNotClosed();
        if (query.length != dim) {
            throw new IllegalArgumentException(
                "Query dimension mismatch: expected " + dim + ", got " + query.length);
        }
        if (k <= 0) {
            return new SearchResult[0];
        }

        double[] raw = HnswSearch.search(vectors, edges, Distance.normalized(query), k, ef);

        int count = raw.length / 2;
        SearchResult[] results = new SearchResult[count];
        for (int i = 0; i < count; i++) {
            results[i] = new SearchResult((int) raw[i * 2], raw[i * 2 + 1]);
        }
        return results;
    }

    /**
     * Exhaustive search over every live node. Exact, O(n * dim).
     *
     * @param query query vector
     * @param k number of neighbors to return
     * @return array of SearchResult sorted by distance, then node ID
     */
    public SearchResult[] searchExact(float[] query, int k) {
        checkNotClosed();
        if (query.length != dim) {
            throw new IllegalArgumentException(
                "Query dimension mismatch: expected " + dim + ", got " + query.length);
        }
        if (k <= 0) {
            return new SearchResult[0];
        }

        float[] normalized = Distance.normalized(query);
        int count = vectors.getCount();
        int[] ids = new int[count];
        double[] dists = new double[count];
        int live = 0;
        for (int node = 0; node < count; node++) {
            if (edges.isDeleted(node)) continue;
            ids[live] = node;
            dists[live] = Distance.cosine(vectors.view(node), normalized);
            live++;
        }

        Integer[] order = new Integer[live];
        for (int i = 0; i < live; i++) order[i] = i;
        Arrays.sort(order, (a, b) -> {
            int c = Double.compare(dists[a], dists[b]);
            return c != 0 ? c : Integer.compare(ids[a], ids[b]);
        });

        int n = Math.min(k, live);
        SearchResult[] results = new SearchResult[n];
        for (int i = 0; i < n; i++) {
            results[i] = new SearchResult(ids[order[i]], dists[order[i]]);
        }
        return results;
    }

    /**
     * Search for k nearest neighbors with default ef = max(k * 10, 100).
     */
    public SearchResult[] search(float[] query, int k) {
        return search(query, k, Math.max(k * 10, 100));
    }

    // =========================================================================
    // Vector Access
    // =========================================================================

    /**
     * Get the normalized vector stored at a node.
     */
    public float[] getVector(int nodeId) {
        checkNotClosed();
        return vectors.get(nodeId);
    }

    // =========================================================================
    // Index Information
    // =========================================================================

    public int getDim() {
        return dim;
    }

    /**
     * Number of used slots, deleted ones included.
     */
    public int size() {
        return vectors.getCount();
    }

    /**
     * Number of nodes that are not deleted.
     */
    public int liveCount() {
        return vectors.getCount() - edges.getDeletedCount();
    }

    /**
     * Number of deleted nodes.
     */
    public int deletedCount() {
        return edges.getDeletedCount();
    }

    /**
     * Maximum number of slots.
     */
    public int capacity() {
        return vectors.getCapacity();
    }

    public boolean isDeleted(int nodeId) {
        return edges.isDeleted(nodeId);
    }

    public int getM() {
        return M;
    }

    public int getM0() {
        return M0;
    }

    public int getEfConstruction() {
        return efConstruction;
    }

    /**
     * Count total directed edges in the graph.
     */
    public long countEdges() {
        return edges.countEdges();
    }

    public int getEntrypoint() {
        return edges.getEntrypoint();
    }

    public boolean isEmpty() {
        return edges.getEntrypoint() < 0;
    }

    // =========================================================================
    // Lifecycle
    // =========================================================================

    /**
     * Close the index and release resources.
     */
    public synchronized void close() {
        if (closed) return;
        closed = true;
        vectors.close();
    }

    public boolean isClosed() {
        return closed;
    }

    private void checkNotClosed() {
        if (closed) {
            throw new IllegalStateException("Index is closed");
        }
    }
}
