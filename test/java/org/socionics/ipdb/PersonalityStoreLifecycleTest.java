package org.socionics.ipdb;

import org.junit.jupiter.api.*;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import org.socionics.ipdb.backend.BackendCandidate;
import org.socionics.ipdb.backend.BackendHandle;
import org.socionics.ipdb.backend.BackendKind;
import org.socionics.ipdb.backend.BackendProber;
import org.socionics.ipdb.fallback.FallbackBackend;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("PersonalityStore lifecycle")
class PersonalityStoreLifecycleTest {

    @TempDir
    Path tempDir;

    private PersonalityStore.Builder builder() {
        return PersonalityStore.builder()
                .dataDir(tempDir)
                .backends(List.of())
                .dimensions(4);
    }

    @Nested
    @DisplayName("Builder")
    class BuilderTest {

        @Test
        @DisplayName("build() requires a data directory")
        void testRequiresDataDir() {
            assertThrows(IllegalArgumentException.class, () -> PersonalityStore.builder().build());
        }

        @Test
        @DisplayName("build() rejects out-of-range settings")
        void testRejectsBadSettings() {
            assertThrows(IllegalArgumentException.class, () -> builder().dimensions(0).build());
            assertThrows(IllegalArgumentException.class, () -> builder().capacity(-1).build());
            assertThrows(IllegalArgumentException.class, () -> builder().m(1).build());
            assertThrows(IllegalArgumentException.class, () -> builder().efSearch(0).build());
            assertThrows(IllegalArgumentException.class, () -> builder().fallbackFile(" ").build());
        }

        @Test
        @DisplayName("defaults match the documented configuration")
        void testDefaults() {
            StoreConfig config = PersonalityStore.builder().dataDir(tempDir).build().getConfig();
            assertEquals(384, config.getDimensions());
            assertEquals(100_000, config.getCapacity());
            assertEquals(16, config.getM());
            assertEquals(200, config.getEfConstruction());
            assertEquals(50, config.getEfSearch());
            assertEquals(2_000, config.getExactSearchThreshold());
            assertEquals(List.of(BackendKind.ANALYTICAL, BackendKind.LIGHTWEIGHT), config.getBackends());
            assertEquals(tempDir.resolve("ipdb_fallback.json"), config.fileFor(BackendKind.FALLBACK));
        }
    }

    @Nested
    @DisplayName("State machine")
    class StateTest {

        @Test
        @DisplayName("operations before initialize() fail with NotInitialized")
        void testNotInitialized() {
            PersonalityStore store = builder().build();
            assertEquals(StoreState.UNINITIALIZED, store.getState());
            assertThrows(NotInitializedException.class, () -> store.getEntity("x"));
            assertThrows(NotInitializedException.class, () -> store.vectorSearch(new float[4], 1));
            assertThrows(NotInitializedException.class, store::stats);
        }

        @Test
        @DisplayName("initialize() reaches OPERATIONAL and is idempotent")
        void testInitialize() {
            PersonalityStore store = builder().build();
            store.initialize();
            assertEquals(StoreState.OPERATIONAL, store.getState());
            assertEquals(BackendKind.FALLBACK, store.getBackendKind());
            store.initialize();
            assertEquals(StoreState.OPERATIONAL, store.getState());
            store.close();
        }

        @Test
        @DisplayName("a closed store rejects operations and re-initialization")
        void testClosed() {
            PersonalityStore store = builder().build();
            store.initialize();
            store.close();
            store.close();
            assertEquals(StoreState.CLOSED, store.getState());
            assertThrows(NotInitializedException.class, () -> store.listEntities(EntityQuery.all()));
            assertThrows(NotInitializedException.class, store::initialize);
        }

        @Test
        @DisplayName("independent stores do not share state")
        void testIndependentInstances(@TempDir Path otherDir) {
            try (PersonalityStore a = builder().build();
                 PersonalityStore b = PersonalityStore.builder().dataDir(otherDir).backends(List.of())
                         .dimensions(4).build()) {
                a.initialize();
                b.initialize();
                a.createEntity(NewEntity.builder("Only in A").build());
                assertEquals(1, a.stats().getEntityCount());
                assertEquals(0, b.stats().getEntityCount());
            }
        }
    }

    @Nested
    @DisplayName("Backend selection")
    class SelectionTest {

        @Test
        @DisplayName("failing native candidates fall through to the fallback store")
        void testFallsBack() {
            BackendCandidate broken = new BackendCandidate() {
                @Override
                public BackendKind kind() {
                    return BackendKind.ANALYTICAL;
                }

                @Override
                public BackendHandle acquire() {
                    throw new BackendUnavailableException(BackendKind.ANALYTICAL, "no native library", null);
                }
            };
            Path snapshot = tempDir.resolve("fallback.json");
            BackendProber prober = new BackendProber(List.of(broken), () -> FallbackBackend.open(snapshot));

            try (PersonalityStore store = new PersonalityStore(builder().buildConfig(), prober)) {
                store.initialize();
                assertEquals(BackendKind.FALLBACK, store.getBackendKind());
                store.createEntity(NewEntity.builder("Saved").build());
                assertTrue(Files.exists(snapshot));
            }
        }

        @Test
        @DisplayName("a corrupt snapshot yields an empty operational store")
        void testCorruptSnapshot() throws Exception {
            Files.writeString(tempDir.resolve("ipdb_fallback.json"), "{ not json");
            try (PersonalityStore store = builder().build()) {
                store.initialize();
                assertEquals(StoreState.OPERATIONAL, store.getState());
                assertEquals(0, store.stats().getEntityCount());
                assertEquals(3, store.listTypingSystems().size());
            }
        }

        @Test
        @DisplayName("a snapshot with an unreadable row yields an empty operational store")
        void testSnapshotWithBadRow() throws Exception {
            Files.writeString(tempDir.resolve("ipdb_fallback.json"),
                    "{\"entities\":[{\"id\":\"a\",\"name\":\"A\",\"entityType\":\"robot\"}]}");
            try (PersonalityStore store = builder().build()) {
                store.initialize();
                assertEquals(StoreState.OPERATIONAL, store.getState());
                assertEquals(0, store.stats().getEntityCount());
                assertEquals(3, store.listTypingSystems().size());
            }
        }
    }

    @Test
    @DisplayName("timestamps are strictly increasing under a frozen clock")
    void testMonotonicTimestamps() {
        Clock frozen = Clock.fixed(Instant.parse("2024-01-01T00:00:00Z"), ZoneOffset.UTC);
        try (PersonalityStore store = builder().clock(frozen).build()) {
            store.initialize();
            Entity a = store.createEntity(NewEntity.builder("A").build());
            Entity b = store.createEntity(NewEntity.builder("B").build());
            assertTrue(b.getCreatedAt().isAfter(a.getCreatedAt()));
            assertTrue(a.getCreatedAt().isAfter(Instant.parse("2023-12-31T23:59:59Z")));
        }
    }
}
