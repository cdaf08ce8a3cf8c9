package org.socionics.ipdb;

/**
 * Lifecycle of a {@link PersonalityStore}.
 */
public enum StoreState {
    UNINITIALIZED,
    /** Selecting a backend. */
    PROBING,
    /** Schema created and catalog seeded; vector index not loaded yet. */
    SCHEMA_READY,
    OPERATIONAL,
    /** Terminal. A closed store cannot be initialized again. */
    CLOSED
}
