package org.socionics.ipdb;

import java.util.Locale;

/**
 * Role of a user in the rating workflow.
 */
public enum UserRole {
    ANNOTATOR("annotator"),
    PANEL_RATER("panel_rater"),
    ADJUDICATOR("adjudicator"),
    ADMIN("admin");

    private final String code;

    UserRole(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }

    /**
     * @throws ValidationException if the code is unknown
     */
    public static UserRole fromCode(String code) {
        if (code != null) {
            String normalized = code.trim().toLowerCase(Locale.ROOT);
            for (UserRole role : values()) {
                if (role.code.equals(normalized)) {
                    return role;
                }
            }
        }
        throw new ValidationException("Unknown user role: " + code);
    }
}
