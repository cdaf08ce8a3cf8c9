package org.socionics.ipdb;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A typeable subject: a person, a fictional character or a public figure.
 *
 * <p>Entities are immutable snapshots. The identifier is assigned once at
 * creation and never reused. Mutations go through
 * {@link PersonalityStore#updateEntity(String, Map, String)}, which records an
 * {@link EditHistoryRecord} per changed field.</p>
 *
 * <p>{@link #getRatingCount()} and {@link #getAssignments()} are derived from
 * the entity's ratings when the entity is read; they are not stored.</p>
 */
public final class Entity {

    private final String id;
    private final String name;
    private final String description;
    private final EntityKind kind;
    private final String category;
    private final String source;
    private final String notes;
    private final String externalId;
    private final String externalSource;
    private final Map<String, Object> metadata;
    private final Instant createdAt;
    private final Instant updatedAt;
    private final String lastEditedBy;
    private final int ratingCount;
    private final List<TypeAssignment> assignments;

    private Entity(Builder b) {
        this.id = Objects.requireNonNull(b.id, "id");
        this.name = Objects.requireNonNull(b.name, "name");
        this.description = b.description;
        this.kind = b.kind == null ? EntityKind.FICTIONAL_CHARACTER : b.kind;
        this.category = b.category;
        this.source = b.source;
        this.notes = b.notes;
        this.externalId = b.externalId;
        this.externalSource = b.externalSource;
        this.metadata = b.metadata == null
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(b.metadata));
        this.createdAt = b.createdAt;
        this.updatedAt = b.updatedAt;
        this.lastEditedBy = b.lastEditedBy;
        this.ratingCount = b.ratingCount;
        this.assignments = b.assignments == null ? List.of() : List.copyOf(b.assignments);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Start a builder pre-filled with this entity's values.
     */
    public Builder toBuilder() {
        return new Builder()
                .id(id)
                .name(name)
                .description(description)
                .kind(kind)
                .category(category)
                .source(source)
                .notes(notes)
                .externalId(externalId)
                .externalSource(externalSource)
                .metadata(metadata)
                .createdAt(createdAt)
                .updatedAt(updatedAt)
                .lastEditedBy(lastEditedBy)
                .ratingCount(ratingCount)
                .assignments(assignments);
    }

    /**
     * Copy of this entity with derived rating data attached.
     */
    public Entity withRatings(int ratingCount, List<TypeAssignment> assignments) {
        return toBuilder().ratingCount(ratingCount).assignments(assignments).build();
    }

    public String getId() { return id; }
    public String getName() { return name; }
    public String getDescription() { return description; }
    public EntityKind getKind() { return kind; }
    public String getCategory() { return category; }
    public String getSource() { return source; }
    public String getNotes() { return notes; }
    public String getExternalId() { return externalId; }
    public String getExternalSource() { return externalSource; }

    /**
     * Open key-value metadata. Never interpreted by the store.
     *
     * @return unmodifiable map, empty if none
     */
    public Map<String, Object> getMetadata() { return metadata; }

    public Instant getCreatedAt() { return createdAt; }
    public Instant getUpdatedAt() { return updatedAt; }

    /**
     * @return id of the user who last changed this entity, or null
     */
    public String getLastEditedBy() { return lastEditedBy; }

    /**
     * @return number of ratings for this entity
     */
    public int getRatingCount() { return ratingCount; }

    /**
     * Ratings grouped by system and type code.
     *
     * @return assignments ordered by system, then votes descending
     */
    public List<TypeAssignment> getAssignments() { return assignments; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Entity that = (Entity) o;
        return ratingCount == that.ratingCount
                && id.equals(that.id)
                && name.equals(that.name)
                && Objects.equals(description, that.description)
                && kind == that.kind
                && Objects.equals(category, that.category)
                && Objects.equals(source, that.source)
                && Objects.equals(notes, that.notes)
                && Objects.equals(externalId, that.externalId)
                && Objects.equals(externalSource, that.externalSource)
                && metadata.equals(that.metadata)
                && Objects.equals(createdAt, that.createdAt)
                && Objects.equals(updatedAt, that.updatedAt)
                && Objects.equals(lastEditedBy, that.lastEditedBy)
                && assignments.equals(that.assignments);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, name, description, kind, category, updatedAt);
    }

    @Override
    public String toString() {
        return "Entity{id='" + id + "', name='" + name + "', kind=" + kind.getCode() +
               (category != null ? ", category='" + category + "'" : "") +
               ", ratingCount=" + ratingCount + "}";
    }

    /**
     * Builder used by record stores to materialize rows.
     */
    public static final class Builder {
        private String id;
        private String name;
        private String description;
        private EntityKind kind;
        private String category;
        private String source;
        private String notes;
        private String externalId;
        private String externalSource;
        private Map<String, Object> metadata;
        private Instant createdAt;
        private Instant updatedAt;
        private String lastEditedBy;
        private int ratingCount;
        private List<TypeAssignment> assignments;

        private Builder() {}

        public Builder id(String id) { this.id = id; return this; }
        public Builder name(String name) { this.name = name; return this; }
        public Builder description(String description) { this.description = description; return this; }
        public Builder kind(EntityKind kind) { this.kind = kind; return this; }
        public Builder category(String category) { this.category = category; return this; }
        public Builder source(String source) { this.source = source; return this; }
        public Builder notes(String notes) { this.notes = notes; return this; }
        public Builder externalId(String externalId) { this.externalId = externalId; return this; }
        public Builder externalSource(String externalSource) { this.externalSource = externalSource; return this; }
        public Builder metadata(Map<String, Object> metadata) { this.metadata = metadata; return this; }
        public Builder createdAt(Instant createdAt) { this.createdAt = createdAt; return this; }
        public Builder updatedAt(Instant updatedAt) { this.updatedAt = updatedAt; return this; }
        public Builder lastEditedBy(String lastEditedBy) { this.lastEditedBy = lastEditedBy; return this; }
        public Builder ratingCount(int ratingCount) { this.ratingCount = ratingCount; return this; }
        public Builder assignments(List<TypeAssignment> assignments) { this.assignments = assignments; return this; }

        public Entity build() {
            return new Entity(this);
        }
    }
}
