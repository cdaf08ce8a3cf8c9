package org.socionics.ipdb.backend;

import org.junit.jupiter.api.*;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;

import org.socionics.ipdb.BackendUnavailableException;
import org.socionics.ipdb.TypingSystem;
import org.socionics.ipdb.fallback.FallbackBackend;

import static org.junit.jupiter.api.Assertions.*;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

@DisplayName("SchemaManager")
class SchemaManagerTest {

    @TempDir
    Path tempDir;

    @Test
    @DisplayName("DDL creates tables before indexes and declares no foreign keys")
    void testDdl() {
        for (SqlDialect dialect : SqlDialect.values()) {
            List<String> ddl = SchemaManager.ddl(dialect);
            assertEquals(14, ddl.size());
            boolean seenIndex = false;
            for (String statement : ddl) {
                assertTrue(statement.contains("IF NOT EXISTS"), statement);
                assertFalse(statement.toUpperCase().contains("REFERENCES"), statement);
                if (statement.startsWith("CREATE INDEX")) {
                    seenIndex = true;
                } else {
                    assertFalse(seenIndex, "table after index: " + statement);
                }
            }
        }
    }

    @Test
    @DisplayName("seed catalog has socionics, mbti and enneagram")
    void testSeedCatalog() {
        List<TypingSystem> seed = SchemaManager.loadSeedCatalog();
        assertEquals(3, seed.size());
        assertEquals("socionics", seed.get(0).getName());
        assertTrue(seed.get(0).findType("ili").isPresent());
        assertTrue(seed.get(1).findType("ENTP").isPresent());
        assertEquals("1", seed.get(2).getTypes().get(0).getCode());
    }

    @Test
    @DisplayName("ensureSchema() is idempotent on SQLite")
    void testIdempotentOnSqlite() {
        JdbcBackendCandidate candidate = new JdbcBackendCandidate(SqlDialect.SQLITE, tempDir.resolve("s.sqlite"));
        BackendHandle handle;
        try {
            handle = candidate.acquire();
        } catch (BackendUnavailableException e) {
            assumeTrue(false, "SQLite driver unavailable: " + e.getMessage());
            return;
        }
        try {
            SchemaManager.ensureSchema(handle);
            SchemaManager.ensureSchema(handle);
            assertEquals(3, handle.recordStore().listTypingSystems().size());
            assertEquals(0, SchemaManager.seedCatalog(handle.recordStore()));
        } finally {
            handle.close();
        }
    }

    @Test
    @DisplayName("the fallback store only gets the catalog")
    void testFallbackSeeding() {
        FallbackBackend handle = FallbackBackend.open(tempDir.resolve("f.json"));
        SchemaManager.ensureSchema(handle);
        SchemaManager.ensureSchema(handle);
        assertEquals(3, handle.recordStore().listTypingSystems().size());

        FallbackBackend reopened = FallbackBackend.open(tempDir.resolve("f.json"));
        assertEquals(0, SchemaManager.seedCatalog(reopened.recordStore()));
    }

    @Test
    @DisplayName("a partly seeded catalog gets the missing systems")
    void testPartialSeedCompleted() {
        FallbackBackend handle = FallbackBackend.open(tempDir.resolve("partial.json"));
        handle.recordStore().insertTypingSystem(SchemaManager.loadSeedCatalog().get(0));

        assertEquals(2, SchemaManager.seedCatalog(handle.recordStore()));
        List<TypingSystem> systems = handle.recordStore().listTypingSystems();
        assertEquals(3, systems.size());
        assertEquals(1, systems.stream().filter(s -> s.getName().equals("socionics")).count());
        assertEquals(0, SchemaManager.seedCatalog(handle.recordStore()));
    }
}
