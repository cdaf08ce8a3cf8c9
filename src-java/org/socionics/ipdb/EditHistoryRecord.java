package org.socionics.ipdb;

import java.time.Instant;
import java.util.Objects;

/**
 * One changed field of one entity update. Append-only.
 */
public final class EditHistoryRecord {

    /** Change type written by {@link PersonalityStore#updateEntity}. */
    public static final String UPDATE = "update";

    private final String id;
    private final String entityId;
    private final String userId;
    private final String userDisplayName;
    private final String fieldName;
    private final String oldValue;
    private final String newValue;
    private final String changeType;
    private final Instant createdAt;

    public EditHistoryRecord(String id, String entityId, String userId, String userDisplayName,
                             String fieldName, String oldValue, String newValue,
                             String changeType, Instant createdAt) {
        this.id = id;
        this.entityId = entityId;
        this.userId = userId;
        this.userDisplayName = userDisplayName;
        this.fieldName = fieldName;
        this.oldValue = oldValue;
        this.newValue = newValue;
        this.changeType = changeType;
        this.createdAt = createdAt;
    }

    public String getId() { return id; }
    public String getEntityId() { return entityId; }

    /**
     * @return acting user, or null for anonymous edits
     */
    public String getUserId() { return userId; }

    /**
     * @return the acting user's display name, or null if unknown
     */
    public String getUserDisplayName() { return userDisplayName; }

    public String getFieldName() { return fieldName; }
    public String getOldValue() { return oldValue; }
    public String getNewValue() { return newValue; }
    public String getChangeType() { return changeType; }
    public Instant getCreatedAt() { return createdAt; }

    /**
     * Copy with the display name resolved.
     */
    public EditHistoryRecord withUserDisplayName(String displayName) {
        return new EditHistoryRecord(id, entityId, userId, displayName, fieldName,
                oldValue, newValue, changeType, createdAt);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        EditHistoryRecord that = (EditHistoryRecord) o;
        return id.equals(that.id)
                && entityId.equals(that.entityId)
                && Objects.equals(userId, that.userId)
                && Objects.equals(userDisplayName, that.userDisplayName)
                && fieldName.equals(that.fieldName)
                && Objects.equals(oldValue, that.oldValue)
                && Objects.equals(newValue, that.newValue)
                && changeType.equals(that.changeType)
                && Objects.equals(createdAt, that.createdAt);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, entityId, fieldName);
    }

    @Override
    public String toString() {
        return "EditHistoryRecord{entity='" + entityId + "', field=" + fieldName +
               ", '" + oldValue + "' -> '" + newValue + "'}";
    }
}
