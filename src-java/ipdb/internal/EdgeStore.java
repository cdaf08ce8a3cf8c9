package ipdb.internal;

/**
 * Layered adjacency lists for the HNSW graph.
 *
 * <p>Layer 0 holds up to {@code M0} neighbors per node, upper layers up to
 * {@code M}. Upper layer tables are allocated on first use since most nodes
 * only live on layer 0.
 *
 * <p>Deleted nodes are tombstoned: they keep their edges so searches can still
 * route through them, but they are never returned as results.
 *
 * <p>Not thread-safe for writers. Callers serialize inserts and deletes.
 *
 * <p><b>Internal API</b> - subject to change without notice.
 */
public final class EdgeStore {

    private final int maxNodes;
    private final int maxLevel;
    private final int M;
    private final int M0;
    private final int[][][] layers;
    private final ArrayBitSet deleted;
    private volatile int entrypoint = -1;
    private volatile int currentMaxLevel = 0;
    private int deletedCount = 0;

    public EdgeStore(int maxNodes, int maxLevel, int M, int M0) {
        this.maxNodes = maxNodes;
        this.maxLevel = maxLevel;
        this.M = M;
        this.M0 = M0;
        this.layers = new int[maxLevel + 1][][];
        this.layers[0] = new int[maxNodes][];
        this.deleted = new ArrayBitSet(maxNodes);
    }

    // =========================================================================
    // Neighbors
    // =========================================================================

    /**
     * Get neighbors for a node at a specific layer.
     *
     * @return neighbor IDs, or null if the node has none on this layer
     */
    public int[] getNeighbors(int layer, int nodeId) {
        int[][] table = layers[layer];
        return table == null ? null : table[nodeId];
    }

    /**
     * Replace the neighbor list of a node at a layer.
     */
    public void setNeighbors(int layer, int nodeId, int[] neighbors) {
        int[][] table = layers[layer];
        if (table == null) {
            table = new int[maxNodes][];
            layers[layer] = table;
        }
        table[nodeId] = neighbors;
    }

    // =========================================================================
    // Tombstones
    // =========================================================================

    /**
     * Mark a node deleted.
     *
     * @return true if the node was live before
     */
    public boolean markDeleted(int nodeId) {
        if (deleted.add(nodeId)) {
            deletedCount++;
            return true;
        }
        return false;
    }

    public boolean isDeleted(int nodeId) {
        return deleted.contains(nodeId);
    }

    public int getDeletedCount() {
        return deletedCount;
    }

    // =========================================================================
    // Entry point
    // =========================================================================

    public int getEntrypoint() {
        return entrypoint;
    }

    public void setEntrypoint(int nodeId) {
        this.entrypoint = nodeId;
    }

    public int getCurrentMaxLevel() {
        return currentMaxLevel;
    }

    public void setCurrentMaxLevel(int level) {
        this.currentMaxLevel = level;
    }

    // =========================================================================
    // Parameters
    // =========================================================================

    public int getMaxNodes() {
        return maxNodes;
    }

    public int getMaxLevel() {
        return maxLevel;
    }

    public int getM() {
        return M;
    }

    public int getM0() {
        return M0;
    }

    /**
     * Count total directed edges across all layers.
     */
    public long countEdges() {
        long total = 0;
        for (int[][] table : layers) {
            if (table == null) continue;
            for (int[] neighbors : table) {
                if (neighbors != null) total += neighbors.length;
            }
        }
        return total;
    }
}
