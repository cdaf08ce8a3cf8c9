package org.socionics.ipdb;

import org.socionics.ipdb.backend.BackendKind;

/**
 * Thrown when a native backend cannot be acquired.
 *
 * <p>The backend prober catches this, logs a warning and moves on to the next
 * candidate, so callers of the store never see it.</p>
 */
public class BackendUnavailableException extends IpdbException {

    private final BackendKind backend;

    public BackendUnavailableException(BackendKind backend, String message, Throwable cause) {
        super(backend + " backend unavailable: " + message, cause);
        this.backend = backend;
    }

    public BackendKind getBackend() {
        return backend;
    }
}
