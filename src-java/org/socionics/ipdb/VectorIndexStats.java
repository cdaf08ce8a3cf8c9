package org.socionics.ipdb;

/**
 * Size figures of the vector index.
 */
public final class VectorIndexStats {

    private final int dimensions;
    private final int capacity;
    private final int liveCount;
    private final int slotCount;
    private final int staleCount;

    public VectorIndexStats(int dimensions, int capacity, int liveCount, int slotCount, int staleCount) {
        this.dimensions = dimensions;
        this.capacity = capacity;
        this.liveCount = liveCount;
        this.slotCount = slotCount;
        this.staleCount = staleCount;
    }

    public int getDimensions() { return dimensions; }

    /**
     * @return maximum number of live embeddings
     */
    public int getCapacity() { return capacity; }

    /**
     * @return embeddings searchable right now
     */
    public int getLiveCount() { return liveCount; }

    /**
     * @return index slots in use, replaced ones included
     */
    public int getSlotCount() { return slotCount; }

    /**
     * @return replaced slots plus persisted embeddings that could not be loaded
     */
    public int getStaleCount() { return staleCount; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        VectorIndexStats that = (VectorIndexStats) o;
        return dimensions == that.dimensions && capacity == that.capacity
                && liveCount == that.liveCount && slotCount == that.slotCount
                && staleCount == that.staleCount;
    }

    @Override
    public int hashCode() {
        return ((dimensions * 31 + capacity) * 31 + liveCount) * 31 + slotCount;
    }

    @Override
    public String toString() {
        return "VectorIndexStats{dimensions=" + dimensions + ", capacity=" + capacity +
               ", live=" + liveCount + ", slots=" + slotCount + ", stale=" + staleCount + "}";
    }
}
