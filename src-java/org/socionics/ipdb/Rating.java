package org.socionics.ipdb;

import java.time.Instant;
import java.util.Objects;

/**
 * A stored typing judgment. Immutable; corrections are new ratings.
 */
public final class Rating {

    private final String id;
    private final String entityId;
    private final String userId;
    private final String system;
    private final String typeCode;
    private final double confidence;
    private final String reasoning;
    private final Instant createdAt;

    public Rating(String id, String entityId, String userId, String system, String typeCode,
                  double confidence, String reasoning, Instant createdAt) {
        this.id = id;
        this.entityId = entityId;
        this.userId = userId;
        this.system = system;
        this.typeCode = typeCode;
        this.confidence = confidence;
        this.reasoning = reasoning;
        this.createdAt = createdAt;
    }

    public String getId() { return id; }
    public String getEntityId() { return entityId; }
    public String getUserId() { return userId; }
    public String getSystem() { return system; }
    public String getTypeCode() { return typeCode; }
    public double getConfidence() { return confidence; }
    public String getReasoning() { return reasoning; }
    public Instant getCreatedAt() { return createdAt; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Rating that = (Rating) o;
        return Double.compare(confidence, that.confidence) == 0
                && id.equals(that.id)
                && entityId.equals(that.entityId)
                && Objects.equals(userId, that.userId)
                && system.equals(that.system)
                && typeCode.equals(that.typeCode)
                && Objects.equals(reasoning, that.reasoning)
                && Objects.equals(createdAt, that.createdAt);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, entityId, system, typeCode, confidence);
    }

    @Override
    public String toString() {
        return "Rating{entity='" + entityId + "', " + system + "=" + typeCode +
               ", confidence=" + confidence + ", by='" + userId + "'}";
    }
}
