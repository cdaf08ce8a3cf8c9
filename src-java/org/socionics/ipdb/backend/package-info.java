/**
 * Storage backends: capability probing, schema creation, the record-store
 * contract and its JDBC implementation for DuckDB and SQLite.
 */
package org.socionics.ipdb.backend;
