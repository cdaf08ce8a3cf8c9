package org.socionics.ipdb.fallback;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.socionics.ipdb.Comment;
import org.socionics.ipdb.EditHistoryRecord;
import org.socionics.ipdb.Entity;
import org.socionics.ipdb.EntityKind;
import org.socionics.ipdb.ExperienceLevel;
import org.socionics.ipdb.Rating;
import org.socionics.ipdb.TypeCode;
import org.socionics.ipdb.TypingSystem;
import org.socionics.ipdb.User;
import org.socionics.ipdb.UserRole;

/**
 * On-disk form of the fallback store: the whole dataset as one JSON document.
 *
 * <p>Plain fields so Jackson maps them without annotations. Timestamps are
 * epoch milliseconds, enums their persisted codes, so the file reads the same
 * as the relational rows.</p>
 */
public final class Snapshot {

    public static final int FORMAT_VERSION = 1;

    public int version = FORMAT_VERSION;
    public List<EntityRow> entities = new ArrayList<>();
    public List<UserRow> users = new ArrayList<>();
    public List<RatingRow> ratings = new ArrayList<>();
    public List<CommentRow> comments = new ArrayList<>();
    public List<TypingSystemRow> typingSystems = new ArrayList<>();
    public List<HistoryRow> editHistory = new ArrayList<>();
    public List<EmbeddingRow> embeddings = new ArrayList<>();

    public static Snapshot empty() {
        return new Snapshot();
    }

    // =========================================================================
    // Rows
    // =========================================================================

    public static final class EntityRow {
        public String id;
        public String name;
        public String description;
        public String entityType;
        public String category;
        public String source;
        public String personalityNotes;
        public String externalId;
        public String externalSource;
        public Map<String, Object> metadata;
        public long createdAt;
        public long updatedAt;
        public String lastEditedBy;

        static EntityRow of(Entity e) {
            EntityRow row = new EntityRow();
            row.id = e.getId();
            row.name = e.getName();
            row.description = e.getDescription();
            row.entityType = e.getKind().getCode();
            row.category = e.getCategory();
            row.source = e.getSource();
            row.personalityNotes = e.getNotes();
            row.externalId = e.getExternalId();
            row.externalSource = e.getExternalSource();
            row.metadata = e.getMetadata().isEmpty() ? null : new LinkedHashMap<>(e.getMetadata());
            row.createdAt = e.getCreatedAt().toEpochMilli();
            row.updatedAt = e.getUpdatedAt().toEpochMilli();
            row.lastEditedBy = e.getLastEditedBy();
            return row;
        }

        Entity toEntity() {
            return Entity.builder()
                    .id(id)
                    .name(name)
                    .description(description)
                    .kind(EntityKind.fromCode(entityType))
                    .category(category)
                    .source(source)
                    .notes(personalityNotes)
                    .externalId(externalId)
                    .externalSource(externalSource)
                    .metadata(metadata)
                    .createdAt(Instant.ofEpochMilli(createdAt))
                    .updatedAt(Instant.ofEpochMilli(updatedAt))
                    .lastEditedBy(lastEditedBy)
                    .build();
        }
    }

    public static final class UserRow {
        public String id;
        public String username;
        public String displayName;
        public String role;
        public String experienceLevel;
        public long createdAt;

        static UserRow of(User u) {
            UserRow row = new UserRow();
            row.id = u.getId();
            row.username = u.getUsername();
            row.displayName = u.getDisplayName();
            row.role = u.getRole().getCode();
            row.experienceLevel = u.getExperienceLevel().getCode();
            row.createdAt = u.getCreatedAt().toEpochMilli();
            return row;
        }

        User toUser() {
            return new User(id, username, displayName, UserRole.fromCode(role),
                    ExperienceLevel.fromCode(experienceLevel), Instant.ofEpochMilli(createdAt));
        }
    }

    public static final class RatingRow {
        public String id;
        public String entityId;
        public String userId;
        public String personalitySystem;
        public String personalityType;
        public double confidence;
        public String reasoning;
        public long createdAt;

        static RatingRow of(Rating r) {
            RatingRow row = new RatingRow();
            row.id = r.getId();
            row.entityId = r.getEntityId();
            row.userId = r.getUserId();
            row.personalitySystem = r.getSystem();
            row.personalityType = r.getTypeCode();
            row.confidence = r.getConfidence();
            row.reasoning = r.getReasoning();
            row.createdAt = r.getCreatedAt().toEpochMilli();
            return row;
        }

        Rating toRating() {
            return new Rating(id, entityId, userId, personalitySystem, personalityType,
                    confidence, reasoning, Instant.ofEpochMilli(createdAt));
        }
    }

    public static final class CommentRow {
        public String id;
        public String entityId;
        public String userId;
        public String content;
        public long createdAt;

        static CommentRow of(Comment c) {
            CommentRow row = new CommentRow();
            row.id = c.getId();
            row.entityId = c.getEntityId();
            row.userId = c.getUserId();
            row.content = c.getContent();
            row.createdAt = c.getCreatedAt().toEpochMilli();
            return row;
        }

        Comment toComment() {
            return new Comment(id, entityId, userId, null, content, Instant.ofEpochMilli(createdAt));
        }
    }

    public static final class HistoryRow {
        public String id;
        public String entityId;
        public String userId;
        public String fieldName;
        public String oldValue;
        public String newValue;
        public String changeType;
        public long createdAt;

        static HistoryRow of(EditHistoryRecord h) {
            HistoryRow row = new HistoryRow();
            row.id = h.getId();
            row.entityId = h.getEntityId();
            row.userId = h.getUserId();
            row.fieldName = h.getFieldName();
            row.oldValue = h.getOldValue();
            row.newValue = h.getNewValue();
            row.changeType = h.getChangeType();
            row.createdAt = h.getCreatedAt().toEpochMilli();
            return row;
        }

        EditHistoryRecord toRecord() {
            return new EditHistoryRecord(id, entityId, userId, null, fieldName, oldValue, newValue,
                    changeType == null ? EditHistoryRecord.UPDATE : changeType, Instant.ofEpochMilli(createdAt));
        }
    }

    public static final class TypingSystemRow {
        public String name;
        public String displayName;
        public String description;
        public List<TypeCodeRow> types = new ArrayList<>();

        static TypingSystemRow of(TypingSystem s) {
            TypingSystemRow row = new TypingSystemRow();
            row.name = s.getName();
            row.displayName = s.getDisplayName();
            row.description = s.getDescription();
            for (TypeCode t : s.getTypes()) {
                TypeCodeRow tr = new TypeCodeRow();
                tr.code = t.getCode();
                tr.name = t.getName();
                row.types.add(tr);
            }
            return row;
        }

        TypingSystem toSystem() {
            List<TypeCode> codes = new ArrayList<>();
            if (types != null) {
                for (TypeCodeRow t : types) {
                    codes.add(new TypeCode(t.code, t.name));
                }
            }
            return new TypingSystem(name, displayName, description, codes);
        }
    }

    public static final class TypeCodeRow {
        public String code;
        public String name;
    }

    public static final class EmbeddingRow {
        public String entityId;
        public float[] vector;
        public long updatedAt;
    }
}
