package org.socionics.ipdb.backend;

import org.junit.jupiter.api.*;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;

import org.socionics.ipdb.BackendUnavailableException;
import org.socionics.ipdb.fallback.FallbackBackend;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("BackendProber")
class BackendProberTest {

    @TempDir
    Path tempDir;

    private final List<BackendKind> attempts = new ArrayList<>();

    private BackendCandidate failing(BackendKind kind) {
        return new BackendCandidate() {
            @Override
            public BackendKind kind() {
                return kind;
            }

            @Override
            public BackendHandle acquire() {
                attempts.add(kind);
                throw new BackendUnavailableException(kind, "unavailable in test", null);
            }
        };
    }

    private BackendCandidate working(BackendKind kind, BackendHandle handle) {
        return new BackendCandidate() {
            @Override
            public BackendKind kind() {
                return kind;
            }

            @Override
            public BackendHandle acquire() {
                attempts.add(kind);
                return handle;
            }
        };
    }

    @Test
    @DisplayName("first available candidate wins and later ones are not tried")
    void testFirstSuccessWins() {
        FallbackBackend standIn = FallbackBackend.open(tempDir.resolve("a.json"));
        BackendProber prober = new BackendProber(
                List.of(failing(BackendKind.ANALYTICAL), working(BackendKind.LIGHTWEIGHT, standIn),
                        failing(BackendKind.ANALYTICAL)),
                () -> fail("fallback must not be opened"));

        assertSame(standIn, prober.selectBackend());
        assertEquals(List.of(BackendKind.ANALYTICAL, BackendKind.LIGHTWEIGHT), attempts);
    }

    @Test
    @DisplayName("all candidates failing selects the fallback")
    void testFallback() {
        BackendProber prober = new BackendProber(
                List.of(failing(BackendKind.ANALYTICAL), failing(BackendKind.LIGHTWEIGHT)),
                () -> FallbackBackend.open(tempDir.resolve("fallback.json")));

        BackendHandle handle = prober.selectBackend();
        assertEquals(BackendKind.FALLBACK, handle.kind());
        assertEquals(List.of(BackendKind.ANALYTICAL, BackendKind.LIGHTWEIGHT), attempts);
    }

    @Test
    @DisplayName("a native candidate that cannot open its file is unavailable")
    void testUnopenableFile() throws Exception {
        Path blocker = tempDir.resolve("not-a-dir");
        Files.writeString(blocker, "x");
        JdbcBackendCandidate candidate = new JdbcBackendCandidate(SqlDialect.SQLITE, blocker.resolve("db.sqlite"));

        BackendUnavailableException e = assertThrows(BackendUnavailableException.class, candidate::acquire);
        assertEquals(BackendKind.LIGHTWEIGHT, e.getBackend());

        BackendProber prober = new BackendProber(List.of(candidate),
                () -> FallbackBackend.open(tempDir.resolve("fallback.json")));
        assertEquals(BackendKind.FALLBACK, prober.selectBackend().kind());
    }
}
