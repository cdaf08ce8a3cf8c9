package org.socionics.ipdb.backend;

import java.nio.file.Path;

/**
 * A native backend reached through one JDBC connection.
 */
public final class JdbcBackendHandle implements BackendHandle {

    private final SqlDialect dialect;
    private final Path file;
    private final JdbcRecordStore recordStore;

    JdbcBackendHandle(SqlDialect dialect, Path file, JdbcRecordStore recordStore) {
        this.dialect = dialect;
        this.file = file;
        this.recordStore = recordStore;
    }

    @Override
    public BackendKind kind() {
        return dialect.kind();
    }

    public SqlDialect dialect() {
        return dialect;
    }

    @Override
    public JdbcRecordStore recordStore() {
        return recordStore;
    }

    @Override
    public String describe() {
        return dialect.name().toLowerCase() + ":" + file;
    }

    @Override
    public void close() {
        recordStore.close();
    }

    @Override
    public String toString() {
        return "JdbcBackendHandle{" + describe() + "}";
    }
}
