package org.socionics.ipdb.backend;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import org.socionics.ipdb.BackendUnavailableException;

/**
 * Acquires a native backend: loads the driver reflectively, opens the
 * database file and checks the connection with {@code SELECT 1}.
 *
 * <p>Native driver libraries fail with linkage errors rather than exceptions
 * when the platform is unsupported; both count as "unavailable".</p>
 */
public final class JdbcBackendCandidate implements BackendCandidate {

    private static final Logger logger = LoggerFactory.getLogger(JdbcBackendCandidate.class);

    private final SqlDialect dialect;
    private final Path file;

    public JdbcBackendCandidate(SqlDialect dialect, Path file) {
        this.dialect = dialect;
        this.file = file;
    }

    @Override
    public BackendKind kind() {
        return dialect.kind();
    }

    @Override
    public BackendHandle acquire() {
        Connection connection = null;
        try {
            Class.forName(dialect.driverClass());
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            connection = DriverManager.getConnection(dialect.url(file));
            dialect.registerFunctions(connection);
            try (Statement st = connection.createStatement()) {
                for (String statement : dialect.sessionStatements()) {
                    st.execute(statement);
                }
                try (ResultSet rs = st.executeQuery("SELECT 1")) {
                    if (!rs.next() || rs.getInt(1) != 1) {
                        throw new SQLException("Probe query returned no row");
                    }
                }
            }
            logger.debug("Acquired {} backend at {}", dialect, file);
            return new JdbcBackendHandle(dialect, file, new JdbcRecordStore(connection, dialect));
        } catch (ClassNotFoundException | SQLException | IOException | RuntimeException | LinkageError e) {
            closeQuietly(connection);
            throw new BackendUnavailableException(kind(), e.toString(), e);
        }
    }

    private void closeQuietly(Connection connection) {
        if (connection == null) return;
        try {
            connection.close();
        } catch (SQLException e) {
            logger.debug("Closing failed {} connection: {}", dialect, e.getMessage());
        }
    }

    @Override
    public String toString() {
        return dialect + ":" + file;
    }
}
