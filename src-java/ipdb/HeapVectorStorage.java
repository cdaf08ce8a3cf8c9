package ipdb;

import java.util.Arrays;

/**
 * On-heap vector storage for the HNSW index.
 *
 * Vectors live in a preallocated slot table sized to the capacity. The index
 * is rebuilt from the relational record set on startup, so nothing here is
 * written to disk.
 */
public final class HeapVectorStorage implements VectorStorage {

    private final int dim;
    private final int capacity;
    private final float[][] slots;
    private volatile int count;
    private volatile boolean closed = false;

    /**
     * Create an empty storage.
     *
     * @param dim vector dimensionality
     * @param capacity maximum number of vectors
     */
    public HeapVectorStorage(int dim, int capacity) {
        if (dim <= 0) {
            throw new IllegalArgumentException("dim must be positive, got " + dim);
        }
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive, got " + capacity);
        }
        this.dim = dim;
        this.capacity = capacity;
        this.slots = new float[capacity][];
    }

    @Override
    public synchronized int append(float[] vector) {
        checkNotClosed();
        if (vector.length != dim) {
            throw new IllegalArgumentException(
                "Vector dimension mismatch: expected " + dim + ", got " + vector.length);
        }
        if (count >= capacity) {
            throw new IllegalStateException("Vector storage full: capacity " + capacity);
        }
        int nodeId = count;
        slots[nodeId] = Arrays.copyOf(vector, dim);
        count = nodeId + 1;
        return nodeId;
    }

    @Override
    public float[] get(int nodeId) {
        return Arrays.copyOf(view(nodeId), dim);
    }

    @Override
    public float[] view(int nodeId) {
        if (nodeId < 0 || nodeId >= count) {
            throw new IndexOutOfBoundsException("No vector at node " + nodeId + " (count " + count + ")");
        }
        return slots[nodeId];
    }

    @Override
    public int getDim() {
        return dim;
    }

    @Override
    public int getCount() {
        return count;
    }

    @Override
    public int getCapacity() {
        return capacity;
    }

    @Override
    public synchronized void close() {
        if (closed) return;
        closed = true;
        Arrays.fill(slots, null);
    }

    private void checkNotClosed() {
        if (closed) {
            throw new IllegalStateException("Storage is closed");
        }
    }
}
