package org.socionics.ipdb.fallback;

import java.nio.file.Path;

import org.socionics.ipdb.backend.BackendHandle;
import org.socionics.ipdb.backend.BackendKind;

/**
 * Handle for the fallback store. Opening it cannot fail: a missing or
 * corrupt snapshot yields an empty dataset.
 */
public final class FallbackBackend implements BackendHandle {

    private final FallbackRecordStore recordStore;

    private FallbackBackend(FallbackRecordStore recordStore) {
        this.recordStore = recordStore;
    }

    /**
     * Load the snapshot at {@code file} (created on the first write).
     */
    public static FallbackBackend open(Path file) {
        return new FallbackBackend(new FallbackRecordStore(new SnapshotFile(file)));
    }

    @Override
    public BackendKind kind() {
        return BackendKind.FALLBACK;
    }

    @Override
    public FallbackRecordStore recordStore() {
        return recordStore;
    }

    @Override
    public String describe() {
        return "snapshot:" + recordStore.file().path();
    }

    /**
     * Nothing to release: every mutation is already on disk.
     */
    @Override
    public void close() {
    }

    @Override
    public String toString() {
        return "FallbackBackend{" + describe() + "}";
    }
}
