package org.socionics.ipdb;

/**
 * Payload for {@link PersonalityStore#addRating(NewRating)}: one rater's
 * judgment that an entity has a given type in a typing system.
 */
public final class NewRating {

    private final String entityId;
    private final String userId;
    private final String system;
    private final String typeCode;
    private final double confidence;
    private final String reasoning;

    /**
     * @param entityId rated entity
     * @param userId rater, possibly a synthetic user such as {@code "system"}
     * @param system typing system name, e.g. {@code "mbti"}
     * @param typeCode type code within the system, e.g. {@code "INTJ"}
     * @param confidence confidence in [0, 1]
     * @param reasoning optional rationale, may be null
     */
    public NewRating(String entityId, String userId, String system, String typeCode,
                     double confidence, String reasoning) {
        this.entityId = entityId;
        this.userId = userId;
        this.system = system;
        this.typeCode = typeCode;
        this.confidence = confidence;
        this.reasoning = reasoning;
    }

    public NewRating(String entityId, String userId, String system, String typeCode, double confidence) {
        this(entityId, userId, system, typeCode, confidence, null);
    }

    public String getEntityId() { return entityId; }
    public String getUserId() { return userId; }
    public String getSystem() { return system; }
    public String getTypeCode() { return typeCode; }
    public double getConfidence() { return confidence; }
    public String getReasoning() { return reasoning; }
}
