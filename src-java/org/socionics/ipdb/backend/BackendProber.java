package org.socionics.ipdb.backend;

import java.util.List;
import java.util.function.Supplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import org.socionics.ipdb.BackendUnavailableException;

/**
 * Picks the storage backend for a store, once, at initialization.
 *
 * <p>Native candidates are tried in preference order; the first one that
 * acquires wins. Each failure is logged as a warning and leaves nothing open
 * behind. When every native candidate fails, the fallback store is selected
 * unconditionally.</p>
 */
public final class BackendProber {

    private static final Logger logger = LoggerFactory.getLogger(BackendProber.class);

    private final List<BackendCandidate> candidates;
    private final Supplier<BackendHandle> fallback;

    /**
     * @param candidates native backends in preference order
     * @param fallback opens the fallback store; must not fail
     */
    public BackendProber(List<BackendCandidate> candidates, Supplier<BackendHandle> fallback) {
        this.candidates = List.copyOf(candidates);
        this.fallback = fallback;
    }

    public BackendHandle selectBackend() {
        for (BackendCandidate candidate : candidates) {
            try {
                BackendHandle handle = candidate.acquire();
                logger.info("Selected {} backend ({})", handle.kind(), handle.describe());
                return handle;
            } catch (BackendUnavailableException e) {
                logger.warn("{} backend unavailable, trying next: {}", candidate.kind(), e.getMessage());
            }
        }
        BackendHandle handle = fallback.get();
        if (!candidates.isEmpty()) {
            logger.warn("No native backend available, using {} store ({})", handle.kind(), handle.describe());
        } else {
            logger.info("Selected {} backend ({})", handle.kind(), handle.describe());
        }
        return handle;
    }
}
