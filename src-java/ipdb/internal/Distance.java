package ipdb.internal;

/**
 * Cosine distance computations for HNSW.
 *
 * <p>Stored vectors are L2-normalized on insert, so the distance between two
 * stored vectors reduces to {@code 1 - dot(a, b)}. Queries are normalized once
 * before a search starts.
 *
 * <p><b>Internal API</b> - subject to change without notice.
 */
public final class Distance {

    private Distance() {}

    /**
     * Return an L2-normalized copy of a vector.
     * Zero vectors are returned unchanged (as a copy).
     */
    public static float[] normalized(float[] vector) {
        float[] copy = vector.clone();
        normalizeVector(copy);
        return copy;
    }

    /**
     * Normalize a vector in place (L2 normalization).
     * After normalization, ||vector|| = 1.
     *
     * @param vector The vector to normalize (modified in place)
     */
    public static void normalizeVector(float[] vector) {
        double normSq = 0.0;
        for (float v : vector) {
            normSq += (double) v * v;
        }
        if (normSq > 1e-12) {
            float invNorm = (float) (1.0 / Math.sqrt(normSq));
            for (int i = 0; i < vector.length; i++) {
                vector[i] *= invNorm;
            }
        }
    }

    /**
     * Dot product of two vectors of equal length.
     */
    public static double dot(float[] a, float[] b) {
        double sum = 0.0;
        for (int i = 0; i < a.length; i++) {
            sum += (double) a[i] * b[i];
        }
        return sum;
    }

    /**
     * Cosine distance between two normalized vectors, in [0, 2].
     */
    public static double cosine(float[] a, float[] b) {
        double d = 1.0 - dot(a, b);
        // Rounding can push identical vectors slightly below zero
        return d < 0.0 ? 0.0 : d;
    }
}
