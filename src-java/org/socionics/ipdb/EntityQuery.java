package org.socionics.ipdb;

import java.util.Objects;

/**
 * Backend-neutral filter, sort and page for {@link PersonalityStore#listEntities(EntityQuery)}.
 *
 * <pre>{@code
 * EntityQuery query = EntityQuery.builder()
 *     .search("lovelace")      // substring of name, description or notes
 *     .category("Science")     // exact category
 *     .sort(EntitySort.RATINGS)
 *     .limit(20)
 *     .build();
 * }</pre>
 */
public final class EntityQuery {

    public static final int DEFAULT_LIMIT = 50;

    private final String search;
    private final String category;
    private final EntitySort sort;
    private final int limit;
    private final int offset;

    private EntityQuery(String search, String category, EntitySort sort, int limit, int offset) {
        this.search = search;
        this.category = category;
        this.sort = sort;
        this.limit = limit;
        this.offset = offset;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * First page of all entities by name.
     */
    public static EntityQuery all() {
        return builder().build();
    }

    /**
     * @return case-insensitive substring, or null for no text filter
     */
    public String getSearch() { return search; }

    /**
     * @return exact category, or null for any category
     */
    public String getCategory() { return category; }

    public EntitySort getSort() { return sort; }
    public int getLimit() { return limit; }
    public int getOffset() { return offset; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        EntityQuery that = (EntityQuery) o;
        return limit == that.limit && offset == that.offset
                && Objects.equals(search, that.search)
                && Objects.equals(category, that.category)
                && sort == that.sort;
    }

    @Override
    public int hashCode() {
        return Objects.hash(search, category, sort, limit, offset);
    }

    @Override
    public String toString() {
        return "EntityQuery{search='" + search + "', category='" + category + "', sort=" + sort +
               ", limit=" + limit + ", offset=" + offset + "}";
    }

    public static final class Builder {
        private String search;
        private String category;
        private EntitySort sort = EntitySort.NAME;
        private int limit = DEFAULT_LIMIT;
        private int offset = 0;

        private Builder() {}

        /** Substring matched against name, description and notes. Blank means none. */
        public Builder search(String search) {
            this.search = search;
            return this;
        }

        /** Exact category match. Blank means none. */
        public Builder category(String category) {
            this.category = category;
            return this;
        }

        public Builder sort(EntitySort sort) {
            this.sort = sort;
            return this;
        }

        /** Page size, at least 0. */
        public Builder limit(int limit) {
            this.limit = limit;
            return this;
        }

        /** Rows to skip, at least 0. */
        public Builder offset(int offset) {
            this.offset = offset;
            return this;
        }

        /**
         * @throws ValidationException on a negative limit or offset
         */
        public EntityQuery build() {
            if (limit < 0) {
                throw new ValidationException("limit must not be negative, got " + limit);
            }
            if (offset < 0) {
                throw new ValidationException("offset must not be negative, got " + offset);
            }
            return new EntityQuery(blankToNull(search),
                    category == null || category.isBlank() ? null : category,
                    sort == null ? EntitySort.NAME : sort, limit, offset);
        }

        private static String blankToNull(String s) {
            return s == null || s.isBlank() ? null : s.trim();
        }
    }
}
