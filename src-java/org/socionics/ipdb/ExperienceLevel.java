package org.socionics.ipdb;

import java.util.Locale;

/**
 * Self-reported typing experience of a user.
 */
public enum ExperienceLevel {
    NOVICE("novice"),
    INTERMEDIATE("intermediate"),
    EXPERT("expert");

    private final String code;

    ExperienceLevel(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }

    /**
     * @throws ValidationException if the code is unknown
     */
    public static ExperienceLevel fromCode(String code) {
        if (code != null) {
            String normalized = code.trim().toLowerCase(Locale.ROOT);
            for (ExperienceLevel level : values()) {
                if (level.code.equals(normalized)) {
                    return level;
                }
            }
        }
        throw new ValidationException("Unknown experience level: " + code);
    }
}
