package org.socionics.ipdb.backend;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;

import org.socionics.ipdb.EntityQuery;
import org.socionics.ipdb.EntitySort;

/**
 * Compiles an {@link EntityQuery} to parameterized SQL understood by both
 * native dialects.
 *
 * <p>User text only ever reaches the database as a bound parameter. Substring
 * search lower-cases both sides and escapes LIKE wildcards, so {@code "50%"}
 * matches the literal text.</p>
 */
public final class EntityQueryCompiler {

    static final String ENTITY_COLUMNS =
            "e.id, e.name, e.description, e.entity_type, e.category, e.source, e.personality_notes, " +
            "e.external_id, e.external_source, e.metadata, e.created_at, e.updated_at, e.last_edited_by, " +
            "COALESCE(rc.rating_count, 0) AS rating_count";

    /** Entity rows joined with their rating count. */
    static final String ENTITY_SELECT =
            "SELECT " + ENTITY_COLUMNS + " FROM entities e " +
            "LEFT JOIN (SELECT entity_id, COUNT(*) AS rating_count FROM ratings GROUP BY entity_id) rc " +
            "ON rc.entity_id = e.id";

    private EntityQueryCompiler() {}

    /**
     * A SQL statement and its positional parameters.
     */
    public static final class CompiledQuery {
        private final String sql;
        private final List<Object> params;

        CompiledQuery(String sql, List<Object> params) {
            this.sql = sql;
            this.params = Collections.unmodifiableList(params);
        }

        public String getSql() {
            return sql;
        }

        public List<Object> getParams() {
            return params;
        }

        @Override
        public String toString() {
            return sql + " " + params;
        }
    }

    public static CompiledQuery compile(EntityQuery query) {
        StringBuilder sql = new StringBuilder(ENTITY_SELECT);
        List<Object> params = new ArrayList<>();
        List<String> conditions = new ArrayList<>();

        if (query.getSearch() != null) {
            String pattern = "%" + escapeLike(foldCase(query.getSearch())) + "%";
            conditions.add("(LOWER(e.name) LIKE ? ESCAPE '\\' " +
                           "OR LOWER(e.description) LIKE ? ESCAPE '\\' " +
                           "OR LOWER(e.personality_notes) LIKE ? ESCAPE '\\')");
            params.add(pattern);
            params.add(pattern);
            params.add(pattern);
        }
        if (query.getCategory() != null) {
            conditions.add("e.category = ?");
            params.add(query.getCategory());
        }
        if (!conditions.isEmpty()) {
            sql.append(" WHERE ").append(String.join(" AND ", conditions));
        }

        sql.append(" ORDER BY ").append(orderBy(query.getSort()));
        sql.append(" LIMIT ? OFFSET ?");
        params.add(query.getLimit());
        params.add(query.getOffset());

        return new CompiledQuery(sql.toString(), params);
    }

    static String orderBy(EntitySort sort) {
        switch (sort) {
            case NAME_DESC:
                return "e.name DESC, e.id ASC";
            case CATEGORY:
                // Explicit: DuckDB sorts NULLs last, SQLite first
                return "(e.category IS NULL) ASC, e.category ASC, e.name ASC, e.id ASC";
            case RATINGS:
                return "rating_count DESC, e.name ASC, e.id ASC";
            case RECENT:
                return "e.updated_at DESC, e.name ASC, e.id ASC";
            case NAME:
            default:
                return "e.name ASC, e.id ASC";
        }
    }

    /**
     * Case folding shared by every backend's substring search.
     */
    public static String foldCase(String text) {
        return text.toLowerCase(Locale.ROOT);
    }

    /**
     * Escape LIKE wildcards with backslash.
     */
    static String escapeLike(String text) {
        StringBuilder out = new StringBuilder(text.length() + 8);
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '\\' || c == '%' || c == '_') {
                out.append('\\');
            }
            out.append(c);
        }
        return out.toString();
    }
}
