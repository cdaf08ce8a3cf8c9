package org.socionics.ipdb;

import java.util.Objects;

/**
 * One hit of a vector search.
 *
 * <p>Results are ordered by descending similarity, ties by entity id.
 * {@code similarity = 1 - distance}, where distance is the cosine distance.</p>
 */
public final class SimilarityResult {

    private final String entityId;
    private final double distance;

    public SimilarityResult(String entityId, double distance) {
        this.entityId = entityId;
        this.distance = distance;
    }

    public String getEntityId() {
        return entityId;
    }

    /**
     * Get the similarity score.
     *
     * @return 1 for identical direction, 0 for orthogonal, -1 for opposite
     */
    public double getSimilarity() {
        return 1.0 - distance;
    }

    /**
     * Get the cosine distance from the query vector, in [0, 2].
     *
     * @return the distance
     */
    public double getDistance() {
        return distance;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        SimilarityResult that = (SimilarityResult) o;
        return entityId.equals(that.entityId) && Double.compare(distance, that.distance) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(entityId, distance);
    }

    @Override
    public String toString() {
        return "SimilarityResult{entityId='" + entityId + "', similarity=" + getSimilarity() + "}";
    }
}
