package org.socionics.ipdb.backend;

/**
 * An acquired storage backend, live for the lifetime of a store.
 *
 * <p>Handles are produced by {@link BackendProber} and owned by the
 * persistence facade. Exactly one handle is live per store; there is no
 * switching between backends at runtime.</p>
 */
public interface BackendHandle extends AutoCloseable {

    /**
     * Which backend this handle talks to.
     */
    BackendKind kind();

    /**
     * The record store bound to this backend.
     */
    RecordStore recordStore();

    /**
     * Human readable location, e.g. the database file.
     */
    String describe();

    /**
     * Release the backend. Idempotent.
     */
    @Override
    void close();
}
