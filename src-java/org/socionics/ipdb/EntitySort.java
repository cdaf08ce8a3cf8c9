package org.socionics.ipdb;

import java.util.Locale;

/**
 * Sort orders for {@link EntityQuery}. Every order ends with the entity id
 * ascending so pages are stable.
 */
public enum EntitySort {
    /** Name ascending. */
    NAME("name"),
    /** Name descending. */
    NAME_DESC("name-desc"),
    /** Category ascending with uncategorized entities last, then name. */
    CATEGORY("category"),
    /** Most rated first, then name. */
    RATINGS("ratings"),
    /** Most recently updated first, then name. */
    RECENT("recent");

    private final String code;

    EntitySort(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }

    /**
     * Parse a sort code such as {@code "name-desc"}. Null or blank means {@link #NAME}.
     *
     * @throws ValidationException if the code is unknown
     */
    public static EntitySort fromCode(String code) {
        if (code == null || code.isBlank()) {
            return NAME;
        }
        String normalized = code.trim().toLowerCase(Locale.ROOT);
        for (EntitySort sort : values()) {
            if (sort.code.equals(normalized)) {
                return sort;
            }
        }
        throw new ValidationException("Unknown sort order: " + code);
    }
}
