package org.socionics.ipdb.backend;

import java.nio.file.Path;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.List;

/**
 * Differences between the two native backends.
 *
 * <p>Both accept the same DDL types (VARCHAR, BIGINT, DOUBLE, INTEGER) and
 * the same parameterized DML. They differ in driver, URL, session setup and
 * in how the entity table is keyed: DuckDB rewrites updates of indexed
 * columns as delete plus insert, which trips its primary-key check, so the
 * entity id is only declared NOT NULL there. Ids are assigned by the facade
 * and never collide.</p>
 */
public enum SqlDialect {

    DUCKDB(BackendKind.ANALYTICAL, "org.duckdb.DuckDBDriver", "jdbc:duckdb:",
            "id VARCHAR NOT NULL",
            List.of()),

    SQLITE(BackendKind.LIGHTWEIGHT, "org.sqlite.JDBC", "jdbc:sqlite:",
            "id VARCHAR PRIMARY KEY",
            List.of("PRAGMA journal_mode=WAL", "PRAGMA busy_timeout=5000"));

    private final BackendKind kind;
    private final String driverClass;
    private final String urlPrefix;
    private final String entityIdColumn;
    private final List<String> sessionStatements;

    SqlDialect(BackendKind kind, String driverClass, String urlPrefix,
               String entityIdColumn, List<String> sessionStatements) {
        this.kind = kind;
        this.driverClass = driverClass;
        this.urlPrefix = urlPrefix;
        this.entityIdColumn = entityIdColumn;
        this.sessionStatements = sessionStatements;
    }

    public BackendKind kind() {
        return kind;
    }

    public String driverClass() {
        return driverClass;
    }

    /**
     * JDBC URL for a database file.
     */
    public String url(Path file) {
        return urlPrefix + file.toAbsolutePath();
    }

    /**
     * Column definition of {@code entities.id}.
     */
    public String entityIdColumn() {
        return entityIdColumn;
    }

    /**
     * Statements run once on a fresh connection.
     */
    public List<String> sessionStatements() {
        return sessionStatements;
    }

    /**
     * Install application functions on a fresh connection.
     */
    void registerFunctions(Connection connection) throws SQLException {
        if (this == SQLITE) {
            SqliteFunctions.register(connection);
        }
    }

    /**
     * Dialect serving a backend kind.
     *
     * @throws IllegalArgumentException for {@link BackendKind#FALLBACK}
     */
    public static SqlDialect forKind(BackendKind kind) {
        for (SqlDialect dialect : values()) {
            if (dialect.kind == kind) {
                return dialect;
            }
        }
        throw new IllegalArgumentException("No SQL dialect for " + kind);
    }
}
