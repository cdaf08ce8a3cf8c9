package org.socionics.ipdb;

/**
 * Thrown when adding an embedding would exceed the vector index capacity.
 *
 * <p>Rebuild the index with a larger capacity via
 * {@link PersonalityStore#rebuildVectorIndex(int)}.</p>
 */
public class CapacityExceededException extends IpdbException {

    private final int capacity;

    /**
     * Create a new capacity exceeded exception.
     *
     * @param capacity the index capacity that was reached
     */
    public CapacityExceededException(int capacity) {
        super("Vector index capacity exceeded: " + capacity + " live embeddings");
        this.capacity = capacity;
    }

    /**
     * Get the capacity that was reached.
     *
     * @return index capacity
     */
    public int getCapacity() {
        return capacity;
    }
}
