package org.socionics.ipdb;

/**
 * Raw aggregate counts read from the live backend.
 */
public final class StoreStats {

    private final long entityCount;
    private final long userCount;
    private final long typeCount;
    private final long ratingCount;
    private final long commentCount;

    public StoreStats(long entityCount, long userCount, long typeCount, long ratingCount, long commentCount) {
        this.entityCount = entityCount;
        this.userCount = userCount;
        this.typeCount = typeCount;
        this.ratingCount = ratingCount;
        this.commentCount = commentCount;
    }

    public long getEntityCount() { return entityCount; }
    public long getUserCount() { return userCount; }

    /**
     * @return number of type codes across all typing systems
     */
    public long getTypeCount() { return typeCount; }

    public long getRatingCount() { return ratingCount; }
    public long getCommentCount() { return commentCount; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        StoreStats that = (StoreStats) o;
        return entityCount == that.entityCount && userCount == that.userCount
                && typeCount == that.typeCount && ratingCount == that.ratingCount
                && commentCount == that.commentCount;
    }

    @Override
    public int hashCode() {
        return Long.hashCode(entityCount * 31 + ratingCount);
    }

    @Override
    public String toString() {
        return "StoreStats{entities=" + entityCount + ", users=" + userCount + ", types=" + typeCount +
               ", ratings=" + ratingCount + ", comments=" + commentCount + "}";
    }
}
