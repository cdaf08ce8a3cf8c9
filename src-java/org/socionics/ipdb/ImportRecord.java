package org.socionics.ipdb;

import java.util.List;
import java.util.Objects;

/**
 * One record of a bulk import: an entity from an external source plus the
 * typings that source gave it.
 */
public final class ImportRecord {

    private final NewEntity entity;
    private final List<Assignment> assignments;

    /**
     * @param entity entity fields; its external source and id identify the record
     * @param assignments typings to add as ratings, may be empty
     */
    public ImportRecord(NewEntity entity, List<Assignment> assignments) {
        this.entity = Objects.requireNonNull(entity, "entity");
        this.assignments = assignments == null ? List.of() : List.copyOf(assignments);
    }

    public NewEntity getEntity() { return entity; }
    public List<Assignment> getAssignments() { return assignments; }

    public String getExternalSource() { return entity.getExternalSource(); }
    public String getExternalId() { return entity.getExternalId(); }

    /**
     * A typing carried by an import record.
     */
    public static final class Assignment {
        private final String system;
        private final String typeCode;
        private final double confidence;

        public Assignment(String system, String typeCode, double confidence) {
            this.system = system;
            this.typeCode = typeCode;
            this.confidence = confidence;
        }

        public String getSystem() { return system; }
        public String getTypeCode() { return typeCode; }
        public double getConfidence() { return confidence; }
    }
}
