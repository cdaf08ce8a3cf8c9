package org.socionics.ipdb;

import java.util.List;
import java.util.concurrent.locks.ReentrantReadWriteLock;

import org.socionics.ipdb.backend.BackendHandle;
import org.socionics.ipdb.backend.RecordStore;

/**
 * Everything an operational store works with, created by
 * {@link PersonalityStore#initialize()} and handed to each operation.
 */
final class StoreContext {

    final BackendHandle handle;
    final RecordStore records;
    final ReentrantReadWriteLock vectorLock = new ReentrantReadWriteLock();

    /** Guarded by {@link #vectorLock}. Replaced wholesale on rebuild. */
    EntityVectorIndex vectors;

    /** Snapshot of the typing-system catalog, replaced on registration. */
    volatile List<TypingSystem> catalog;

    StoreContext(BackendHandle handle, EntityVectorIndex vectors, List<TypingSystem> catalog) {
        this.handle = handle;
        this.records = handle.recordStore();
        this.vectors = vectors;
        this.catalog = List.copyOf(catalog);
    }

    void close() {
        vectorLock.writeLock().lock();
        try {
            vectors.close();
        } finally {
            vectorLock.writeLock().unlock();
            handle.close();
        }
    }
}
