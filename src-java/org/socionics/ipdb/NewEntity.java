package org.socionics.ipdb;

import java.util.Map;

/**
 * Payload for {@link PersonalityStore#createEntity(NewEntity)}.
 *
 * <pre>{@code
 * NewEntity ada = NewEntity.builder("Ada Lovelace")
 *     .kind(EntityKind.PERSON)
 *     .category("Science")
 *     .build();
 * }</pre>
 *
 * <p>The identifier is optional; the store assigns a fresh one when absent.
 * Kind defaults to {@link EntityKind#FICTIONAL_CHARACTER}.</p>
 */
public final class NewEntity {

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

    private NewEntity(Builder b) {
        this.id = b.id;
        this.name = b.name;
        this.description = b.description;
        this.kind = b.kind;
        this.category = b.category;
        this.source = b.source;
        this.notes = b.notes;
        this.externalId = b.externalId;
        this.externalSource = b.externalSource;
        this.metadata = b.metadata;
    }

    public static Builder builder(String name) {
        return new Builder().name(name);
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
    public Map<String, Object> getMetadata() { return metadata; }

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

        private Builder() {}

        /** Explicit identifier. Must not collide with an existing entity. */
        public Builder id(String id) { this.id = id; return this; }
        public Builder name(String name) { this.name = name; return this; }
        public Builder description(String description) { this.description = description; return this; }
        public Builder kind(EntityKind kind) { this.kind = kind; return this; }
        public Builder category(String category) { this.category = category; return this; }
        public Builder source(String source) { this.source = source; return this; }
        public Builder notes(String notes) { this.notes = notes; return this; }

        /** Link to the record this entity was imported from. */
        public Builder external(String externalSource, String externalId) {
            this.externalSource = externalSource;
            this.externalId = externalId;
            return this;
        }

        public Builder metadata(Map<String, Object> metadata) { this.metadata = metadata; return this; }

        public NewEntity build() {
            return new NewEntity(this);
        }
    }
}
