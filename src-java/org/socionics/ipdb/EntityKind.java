package org.socionics.ipdb;

import java.util.Locale;

/**
 * What kind of subject an entity is.
 */
public enum EntityKind {
    PERSON("person"),
    FICTIONAL_CHARACTER("fictional_character"),
    PUBLIC_FIGURE("public_figure");

    private final String code;

    EntityKind(String code) {
        this.code = code;
    }

    /**
     * Get the persisted code, e.g. {@code "fictional_character"}.
     *
     * @return lower-case code
     */
    public String getCode() {
        return code;
    }

    /**
     * Parse a persisted code or enum name, case-insensitively.
     *
     * @param code the code
     * @return the kind
     * @throws ValidationException if the code is unknown
     */
    public static EntityKind fromCode(String code) {
        if (code != null) {
            String normalized = code.trim().toLowerCase(Locale.ROOT);
            for (EntityKind kind : values()) {
                if (kind.code.equals(normalized)) {
                    return kind;
                }
            }
        }
        throw new ValidationException("Unknown entity kind: " + code);
    }
}
