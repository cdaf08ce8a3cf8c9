package org.socionics.ipdb;

import java.time.Instant;
import java.util.Objects;

/**
 * A user's free-text comment on an entity. Immutable once created.
 */
public final class Comment {

    private final String id;
    private final String entityId;
    private final String userId;
    private final String userDisplayName;
    private final String content;
    private final Instant createdAt;

    public Comment(String id, String entityId, String userId, String userDisplayName,
                   String content, Instant createdAt) {
        this.id = id;
        this.entityId = entityId;
        this.userId = userId;
        this.userDisplayName = userDisplayName;
        this.content = content;
        this.createdAt = createdAt;
    }

    public String getId() { return id; }
    public String getEntityId() { return entityId; }
    public String getUserId() { return userId; }

    /**
     * @return the commenting user's display name, or null if the user is unknown
     */
    public String getUserDisplayName() { return userDisplayName; }

    public String getContent() { return content; }
    public Instant getCreatedAt() { return createdAt; }

    /**
     * Copy with the display name resolved.
     */
    public Comment withUserDisplayName(String displayName) {
        return new Comment(id, entityId, userId, displayName, content, createdAt);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Comment that = (Comment) o;
        return id.equals(that.id)
                && entityId.equals(that.entityId)
                && Objects.equals(userId, that.userId)
                && Objects.equals(userDisplayName, that.userDisplayName)
                && content.equals(that.content)
                && Objects.equals(createdAt, that.createdAt);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, entityId, content);
    }

    @Override
    public String toString() {
        return "Comment{entity='" + entityId + "', by='" + userId + "', content='" + content + "'}";
    }
}
