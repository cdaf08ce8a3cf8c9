package org.socionics.ipdb.backend;

import java.sql.Connection;
import java.sql.SQLException;

import org.sqlite.Function;

/**
 * Application functions installed on every SQLite connection.
 *
 * <p>SQLite's built-in {@code LOWER} folds ASCII only. It is replaced with
 * {@link EntityQueryCompiler#foldCase(String)} so substring search matches
 * the same rows as DuckDB and the fallback store.</p>
 */
final class SqliteFunctions {

    private SqliteFunctions() {}

    static void register(Connection connection) throws SQLException {
        Function.create(connection, "LOWER", new Lower(), 1, Function.FLAG_DETERMINISTIC);
    }

    static final class Lower extends Function {
        @Override
        protected void xFunc() throws SQLException {
            String text = value_text(0);
            if (text == null) {
                result();
            } else {
                result(EntityQueryCompiler.foldCase(text));
            }
        }
    }
}
