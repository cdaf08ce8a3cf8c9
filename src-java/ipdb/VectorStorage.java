package ipdb;

/**
 * Slot-addressed store of fixed-length vectors backing an {@link HnswIndex}.
 *
 * <p>Slots are dense: the n-th appended vector lives in slot n-1. Vectors
 * are never removed from storage; deletion is a tombstone in the graph.</p>
 */
public interface VectorStorage {

    /**
     * Store a vector in the next free slot.
     *
     * @param vector values, length {@link #getDim()}
     * @return slot of the stored vector
     * @throws IllegalStateException if every slot is used
     */
    int append(float[] vector);

    /**
     * Copy of the vector in a slot.
     */
    float[] get(int nodeId);

    /**
     * Shared array of the vector in a slot, for distance loops.
     * Read-only for callers.
     */
    float[] view(int nodeId);

    int getDim();

    /** Slots in use. */
    int getCount();

    /** Total slots. */
    int getCapacity();

    void close();
}
