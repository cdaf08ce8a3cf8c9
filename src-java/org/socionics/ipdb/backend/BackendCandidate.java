package org.socionics.ipdb.backend;

import org.socionics.ipdb.BackendUnavailableException;

/**
 * A native backend the prober may try to acquire.
 */
public interface BackendCandidate {

    BackendKind kind();

    /**
     * Acquire the backend, ready for schema creation.
     *
     * <p>On failure an implementation must release whatever it opened before
     * throwing, so the next candidate starts from a clean state.</p>
     *
     * @throws BackendUnavailableException if the backend cannot be used
     */
    BackendHandle acquire();
}
