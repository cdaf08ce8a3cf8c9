package org.socionics.ipdb;

import org.junit.jupiter.api.*;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.*;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("AsyncPersonalityStore")
class AsyncPersonalityStoreTest {

    @TempDir
    Path tempDir;

    private ExecutorService executor;
    private AsyncPersonalityStore async;

    @BeforeEach
    void setUp() {
        executor = Executors.newFixedThreadPool(4);
        PersonalityStore store = PersonalityStore.builder()
                .dataDir(tempDir)
                .backends(List.of())
                .dimensions(3)
                .build();
        async = new AsyncPersonalityStore(store, executor);
        async.initialize().join();
    }

    @AfterEach
    void tearDown() {
        async.close().join();
        executor.shutdownNow();
    }

    @Test
    @DisplayName("operations complete on the executor")
    void testRoundTrip() throws Exception {
        Entity e = async.createEntity(NewEntity.builder("Async").build()).get(5, TimeUnit.SECONDS);
        async.addEmbedding(e.getId(), new float[]{1, 0, 0}).get(5, TimeUnit.SECONDS);
        async.addRating(new NewRating(e.getId(), "u", "mbti", "ISFJ", 0.7)).get(5, TimeUnit.SECONDS);

        assertEquals("Async", async.getEntity(e.getId()).get().getName());
        assertEquals(1, async.listRatings(e.getId()).get().size());
        List<SimilarityResult> results = async.vectorSearch(new float[]{1, 0, 0}, 1).get();
        assertEquals(e.getId(), results.get(0).getEntityId());
    }

    @Test
    @DisplayName("failures complete the future exceptionally with the store's exception")
    void testFailure() {
        CompletableFuture<Entity> missing = async.getEntity("missing");
        ExecutionException e = assertThrows(ExecutionException.class, () -> missing.get(5, TimeUnit.SECONDS));
        assertInstanceOf(NotFoundException.class, e.getCause());

        CompletionException c = assertThrows(CompletionException.class,
                () -> async.vectorSearch(new float[2], 1).join());
        assertInstanceOf(DimensionMismatchException.class, c.getCause());
    }

    @Test
    @DisplayName("concurrent writers all land")
    void testConcurrentWrites() {
        Entity e = async.createEntity(NewEntity.builder("Target").build()).join();
        CompletableFuture<?>[] futures = new CompletableFuture<?>[50];
        for (int i = 0; i < futures.length; i++) {
            futures[i] = async.addComment(e.getId(), "u" + i, "comment " + i);
        }
        CompletableFuture.allOf(futures).join();
        assertEquals(50, async.listComments(e.getId()).join().size());
        assertEquals(50, async.stats().join().getCommentCount());
    }
}
