package org.socionics.ipdb.backend;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import org.socionics.ipdb.Entity;
import org.socionics.ipdb.ValidationException;

/**
 * Diffs an update payload against the stored entity.
 *
 * <p>Only {@link #MUTABLE_FIELDS} are considered; other keys are ignored so
 * newer clients can send fields this store does not know yet.</p>
 */
public final class EntityChanges {

    /** Fields an update may change, in the order history records are written. */
    public static final List<String> MUTABLE_FIELDS =
            List.of("name", "description", "category", "source", "notes");

    private EntityChanges() {}

    /**
     * Reject payloads that would leave the entity invalid.
     *
     * @throws ValidationException if {@code name} is present but blank
     */
    public static void validate(Map<String, ?> fields) {
        if (fields.containsKey("name")) {
            Object name = fields.get("name");
            if (name == null || name.toString().isBlank()) {
                throw new ValidationException("Entity name must not be empty");
            }
        }
    }

    /**
     * Compute the changed fields.
     *
     * @param current stored entity
     * @param fields update payload; values are compared by their string form
     * @return changes in {@link #MUTABLE_FIELDS} order, empty if nothing differs
     */
    public static List<FieldChange> diff(Entity current, Map<String, ?> fields) {
        List<FieldChange> changes = new ArrayList<>();
        for (String field : MUTABLE_FIELDS) {
            if (!fields.containsKey(field)) continue;
            Object raw = fields.get(field);
            String newValue = raw == null ? null : raw.toString();
            String oldValue = valueOf(current, field);
            if (!Objects.equals(oldValue, newValue)) {
                changes.add(new FieldChange(field, oldValue, newValue));
            }
        }
        return changes;
    }

    /**
     * Apply changes to an entity snapshot.
     */
    public static Entity apply(Entity current, List<FieldChange> changes, String userId, Instant at) {
        Entity.Builder b = current.toBuilder();
        for (FieldChange change : changes) {
            String v = change.getNewValue();
            switch (change.getField()) {
                case "name": b.name(v); break;
                case "description": b.description(v); break;
                case "category": b.category(v); break;
                case "source": b.source(v); break;
                case "notes": b.notes(v); break;
                default: throw new IllegalArgumentException("Not a mutable field: " + change.getField());
            }
        }
        return b.updatedAt(at).lastEditedBy(userId).build();
    }

    /**
     * Column holding a mutable field in the relational schema.
     */
    public static String column(String field) {
        switch (field) {
            case "name":
            case "description":
            case "category":
            case "source":
                return field;
            case "notes":
                return "personality_notes";
            default:
                throw new IllegalArgumentException("Not a mutable field: " + field);
        }
    }

    static String valueOf(Entity entity, String field) {
        switch (field) {
            case "name": return entity.getName();
            case "description": return entity.getDescription();
            case "category": return entity.getCategory();
            case "source": return entity.getSource();
            case "notes": return entity.getNotes();
            default: throw new IllegalArgumentException("Not a mutable field: " + field);
        }
    }
}
