package org.socionics.ipdb.backend;

/**
 * The storage backends a store can run on, in default preference order.
 */
public enum BackendKind {
    /** Embedded analytical database (DuckDB). */
    ANALYTICAL,
    /** Embedded lightweight relational database (SQLite). */
    LIGHTWEIGHT,
    /** In-process store persisted as a single JSON snapshot. Always available. */
    FALLBACK
}
