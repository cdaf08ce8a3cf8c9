package ipdb.internal;

/**
 * Word-aligned bitset for O(1) visited and tombstone tracking.
 *
 * Uses 32-bit words for efficient bit manipulation.
 *
 * <p><b>Internal API</b> - subject to change without notice.
 */
public final class ArrayBitSet {
    private final int[] buffer;

    public ArrayBitSet(int count) {
        // Over-allocate by 1 word to avoid bounds checks
        this.buffer = new int[(count >> 5) + 1];
    }

    /**
     * Check if bit at index is set.
     */
    public boolean contains(int bitIndex) {
        int wordIndex = bitIndex >> 5;
        if (wordIndex >= buffer.length) return false;
        return ((1 << (bitIndex & 31)) & buffer[wordIndex]) != 0;
    }

    /**
     * Set bit at index.
     *
     * @return true if the bit was not set before
     */
    public boolean add(int id) {
        int wordIndex = id >> 5;
        if (wordIndex >= buffer.length) return false;
        int mask = 1 << (id & 31);
        boolean fresh = (buffer[wordIndex] & mask) == 0;
        buffer[wordIndex] |= mask;
        return fresh;
    }

    /**
     * Count the number of set bits.
     */
    public int cardinality() {
        int count = 0;
        for (int word : buffer) {
            count += Integer.bitCount(word);
        }
        return count;
    }
}
