package org.socionics.ipdb;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ipdb.HnswIndex;

/**
 * Vector index keyed by entity id.
 *
 * <p>Wraps an {@link HnswIndex} and owns the entity id to slot mapping.
 * Replacing an entity's vector tombstones the old slot and inserts into a new
 * one, so a replaced vector is never returned again. Capacity bounds the
 * number of live entities; the graph gets extra slots for replacements and is
 * compacted (rebuilt from live vectors) when they run out.</p>
 *
 * <p>Small indexes are searched exhaustively, larger ones through the graph.
 * Both paths rank by cosine distance, then entity id.</p>
 *
 * <p>Not thread-safe. The facade guards it with a read-write lock.</p>
 */
public final class EntityVectorIndex implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(EntityVectorIndex.class);

    private static final Comparator<SimilarityResult> RANKING =
            Comparator.comparingDouble(SimilarityResult::getDistance)
                    .thenComparing(SimilarityResult::getEntityId);

    private final int dimensions;
    private final int capacity;
    private final int slotCapacity;
    private final int m;
    private final int efConstruction;
    private final int efSearch;
    private final int exactSearchThreshold;
    private final int skippedAtLoad;

    private HnswIndex index;
    private final Map<String, Integer> slotByEntity = new HashMap<>();
    private final List<String> entityBySlot = new ArrayList<>();

    /**
     * Create an empty index.
     *
     * @param dimensions vector dimensionality
     * @param capacity maximum number of live entities
     * @param m HNSW max neighbors per node
     * @param efConstruction HNSW beam width during construction
     * @param efSearch HNSW beam width during search
     * @param exactSearchThreshold live count up to which searches scan exhaustively
     */
    public EntityVectorIndex(int dimensions, int capacity, int m, int efConstruction,
                             int efSearch, int exactSearchThreshold) {
        this(dimensions, capacity, m, efConstruction, efSearch, exactSearchThreshold, 0);
    }

    private EntityVectorIndex(int dimensions, int capacity, int m, int efConstruction,
                              int efSearch, int exactSearchThreshold, int skippedAtLoad) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive, got " + capacity);
        }
        this.dimensions = dimensions;
        this.capacity = capacity;
        this.slotCapacity = capacity + Math.max(16, capacity / 4);
        this.m = m;
        this.efConstruction = efConstruction;
        this.efSearch = efSearch;
        this.exactSearchThreshold = exactSearchThreshold;
        this.skippedAtLoad = skippedAtLoad;
        this.index = newGraph();
    }

    /**
     * Build an index from persisted vectors.
     *
     * <p>Vectors with the wrong dimension or non-finite values are skipped and
     * counted as stale.</p>
     *
     * @param persisted vectors keyed by entity id
     * @param growToFit if more vectors are valid than {@code capacity}, grow
     *                  instead of failing
     * @throws CapacityExceededException if the vectors don't fit and
     *                                   {@code growToFit} is false
     */
    public static EntityVectorIndex build(StoreConfig config, int capacity,
                                          Map<String, float[]> persisted, boolean growToFit) {
        Map<String, float[]> valid = new LinkedHashMap<>();
        int skipped = 0;
        for (Map.Entry<String, float[]> entry : persisted.entrySet()) {
            float[] vector = entry.getValue();
            if (vector == null || vector.length != config.getDimensions() || !isUsable(vector)) {
                skipped++;
                logger.debug("Skipping persisted embedding of {}: {} dimensions",
                        entry.getKey(), vector == null ? 0 : vector.length);
                continue;
            }
            valid.put(entry.getKey(), vector);
        }
        if (skipped > 0) {
            logger.warn("Skipped {} persisted embeddings that do not match {} dimensions",
                    skipped, config.getDimensions());
        }

        int effectiveCapacity = capacity;
        if (valid.size() > capacity) {
            if (!growToFit) {
                throw new CapacityExceededException(capacity);
            }
            effectiveCapacity = valid.size();
            logger.warn("{} persisted embeddings exceed configured capacity {}; growing index to {}",
                    valid.size(), capacity, effectiveCapacity);
        }

        EntityVectorIndex result = new EntityVectorIndex(config.getDimensions(), effectiveCapacity,
                config.getM(), config.getEfConstruction(), config.getEfSearch(),
                config.getExactSearchThreshold(), skipped);
        valid.forEach(result::put);
        return result;
    }

    // =========================================================================
    // Writes
    // =========================================================================

    /**
     * Fail if adding a vector for this entity would exceed capacity.
     *
     * @throws CapacityExceededException if the entity is new and the index is full
     */
    public void checkCapacity(String entityId) {
        if (!slotByEntity.containsKey(entityId) && slotByEntity.size() >= capacity) {
            throw new CapacityExceededException(capacity);
        }
    }

    /**
     * Add or replace the vector of an entity.
     *
     * @throws DimensionMismatchException on a vector of the wrong length
     * @throws CapacityExceededException if the entity is new and the index is full
     */
    public void put(String entityId, float[] vector) {
        if (vector.length != dimensions) {
            throw new DimensionMismatchException(dimensions, vector.length);
        }
        checkCapacity(entityId);
        if (index.size() >= index.capacity()) {
            compact();
        }
        Integer previous = slotByEntity.get(entityId);
        if (previous != null) {
            index.delete(previous);
        }
        int slot = index.insert(vector);
        slotByEntity.put(entityId, slot);
        while (entityBySlot.size() <= slot) {
            entityBySlot.add(null);
        }
        entityBySlot.set(slot, entityId);
    }

    public boolean contains(String entityId) {
        return slotByEntity.containsKey(entityId);
    }

    /**
     * Rebuild the graph from live vectors only, releasing tombstoned slots.
     */
    void compact() {
        HnswIndex old = index;
        List<String> live = new ArrayList<>(slotByEntity.keySet());
        live.sort(Comparator.naturalOrder());

        HnswIndex fresh = newGraph();
        Map<String, Integer> slots = new HashMap<>();
        List<String> bySlot = new ArrayList<>();
        for (String entityId : live) {
            int slot = fresh.insert(old.getVector(slotByEntity.get(entityId)));
            slots.put(entityId, slot);
            bySlot.add(entityId);
        }

        logger.info("Compacted vector index: {} live, {} tombstones released", live.size(), old.deletedCount());
        index = fresh;
        slotByEntity.clear();
        slotByEntity.putAll(slots);
        entityBySlot.clear();
        entityBySlot.addAll(bySlot);
        old.close();
    }

    // =========================================================================
    // Search
    // =========================================================================

    /**
     * Find the k nearest entities by cosine distance.
     *
     * @param query query vector
     * @param k number of results; 0 or less yields an empty list
     * @param excludeEntityId entity to leave out of the results, or null
     * @return results by descending similarity, ties by entity id
     * @throws DimensionMismatchException on a query of the wrong length
     */
    public List<SimilarityResult> search(float[] query, int k, String excludeEntityId) {
        if (query.length != dimensions) {
            throw new DimensionMismatchException(dimensions, query.length);
        }
        int live = index.liveCount();
        if (k <= 0 || live == 0) {
            return List.of();
        }

        HnswIndex.SearchResult[] hits;
        if (live <= exactSearchThreshold) {
            // All live nodes, so ties at the cut-off are resolved by entity id
            hits = index.searchExact(query, live);
        } else {
            int want = excludeEntityId == null ? k : k + 1;
            hits = index.search(query, want, Math.max(efSearch, want));
        }

        List<SimilarityResult> results = new ArrayList<>(hits.length);
        for (HnswIndex.SearchResult hit : hits) {
            String entityId = entityBySlot.get(hit.id);
            if (entityId == null || entityId.equals(excludeEntityId)) continue;
            results.add(new SimilarityResult(entityId, hit.distance));
        }
        results.sort(RANKING);
        return results.size() > k ? new ArrayList<>(results.subList(0, k)) : results;
    }

    // =========================================================================
    // Information
    // =========================================================================

    public VectorIndexStats stats() {
        return new VectorIndexStats(dimensions, capacity, index.liveCount(), index.size(),
                index.deletedCount() + skippedAtLoad);
    }

    public int getDimensions() {
        return dimensions;
    }

    public int getCapacity() {
        return capacity;
    }

    public int size() {
        return slotByEntity.size();
    }

    @Override
    public void close() {
        index.close();
    }

    private HnswIndex newGraph() {
        return HnswIndex.create(dimensions, slotCapacity, m, efConstruction);
    }

    /**
     * Finite and not all zero.
     */
    static boolean isUsable(float[] vector) {
        boolean nonZero = false;
        for (float v : vector) {
            if (!Float.isFinite(v)) return false;
            if (v != 0.0f) nonZero = true;
        }
        return nonZero;
    }
}
