package org.socionics.ipdb.fallback;

import org.junit.jupiter.api.*;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import org.socionics.ipdb.Comment;
import org.socionics.ipdb.Entity;
import org.socionics.ipdb.EntityKind;
import org.socionics.ipdb.EntityQuery;
import org.socionics.ipdb.EntitySort;
import org.socionics.ipdb.ExperienceLevel;
import org.socionics.ipdb.NotFoundException;
import org.socionics.ipdb.Rating;
import org.socionics.ipdb.StorageException;
import org.socionics.ipdb.User;
import org.socionics.ipdb.UserRole;
import org.socionics.ipdb.backend.FieldChange;
import org.socionics.ipdb.backend.SchemaManager;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("FallbackRecordStore")
class FallbackRecordStoreTest {

    @TempDir
    Path tempDir;

    private static Entity entity(String id, String name, String category, long at) {
        return Entity.builder()
                .id(id)
                .name(name)
                .kind(EntityKind.PUBLIC_FIGURE)
                .category(category)
                .metadata(Map.of("n", 1))
                .createdAt(Instant.ofEpochMilli(at))
                .updatedAt(Instant.ofEpochMilli(at))
                .build();
    }

    private FallbackRecordStore open() {
        return new FallbackRecordStore(new SnapshotFile(tempDir.resolve("store.json")));
    }

    @Test
    @DisplayName("reloading the snapshot yields a deep-equal dataset")
    void testRoundTrip() {
        FallbackRecordStore store = open();
        SchemaManager.loadSeedCatalog().forEach(store::insertTypingSystem);
        store.insertEntity(entity("e1", "One", "Cat", 1000));
        store.insertEntity(entity("e2", "Two", null, 2000));
        store.insertUser(new User("u1", "alice", "Alice", UserRole.PANEL_RATER, ExperienceLevel.EXPERT,
                Instant.ofEpochMilli(500)));
        store.insertRating(new Rating("r1", "e1", "u1", "mbti", "INTJ", 0.25, "why", Instant.ofEpochMilli(3000)));
        store.insertComment(new Comment("c1", "e1", "u1", null, "hi", Instant.ofEpochMilli(3100)));
        store.updateEntity("e2", Map.of("name", "Deux"), "u1", Instant.ofEpochMilli(4000));
        store.saveEmbedding("e1", new float[]{0.5f, -1.25f}, Instant.ofEpochMilli(5000));

        FallbackRecordStore reloaded = open();
        assertEquals(store.listEntities(EntityQuery.all()), reloaded.listEntities(EntityQuery.all()));
        assertEquals(store.listRatings("e1"), reloaded.listRatings("e1"));
        assertEquals(store.listComments("e1"), reloaded.listComments("e1"));
        assertEquals(store.listEditHistory("e2"), reloaded.listEditHistory("e2"));
        assertEquals(store.listTypingSystems(), reloaded.listTypingSystems());
        assertEquals(store.findUser("u1"), reloaded.findUser("u1"));
        assertEquals(store.stats(), reloaded.stats());
        assertArrayEquals(new float[]{0.5f, -1.25f}, reloaded.findEmbedding("e1").orElseThrow());
        assertEquals("Alice", reloaded.listComments("e1").get(0).getUserDisplayName());
    }

    @Test
    @DisplayName("updateEntity() returns the changes and fails for unknown ids")
    void testUpdate() {
        FallbackRecordStore store = open();
        store.insertEntity(entity("e1", "One", "Cat", 1000));

        List<FieldChange> changes = store.updateEntity("e1",
                Map.of("name", "Uno", "category", "Cat"), null, Instant.ofEpochMilli(2000));
        assertEquals(1, changes.size());
        assertEquals(Instant.ofEpochMilli(2000), store.findEntity("e1").orElseThrow().getUpdatedAt());

        assertTrue(store.updateEntity("e1", Map.of("name", "Uno"), null, Instant.ofEpochMilli(3000)).isEmpty());
        assertEquals(Instant.ofEpochMilli(2000), store.findEntity("e1").orElseThrow().getUpdatedAt());

        assertThrows(NotFoundException.class,
                () -> store.updateEntity("nope", Map.of("name", "X"), null, Instant.now()));
    }

    @Test
    @DisplayName("category sort puts missing categories last")
    void testCategorySort() {
        FallbackRecordStore store = open();
        store.insertEntity(entity("e1", "A", null, 1));
        store.insertEntity(entity("e2", "B", "Z", 2));
        store.insertEntity(entity("e3", "C", "M", 3));

        List<Entity> sorted = store.listEntities(EntityQuery.builder().sort(EntitySort.CATEGORY).build());
        assertEquals("e3", sorted.get(0).getId());
        assertEquals("e2", sorted.get(1).getId());
        assertEquals("e1", sorted.get(2).getId());
    }

    @Test
    @DisplayName("a failed snapshot write undoes the in-memory change")
    void testWriteFailureUndo() throws Exception {
        Path dir = tempDir.resolve("blocked");
        Files.createDirectories(dir);
        Path path = dir.resolve("store.json");
        FallbackRecordStore store = new FallbackRecordStore(new SnapshotFile(path));
        store.insertEntity(entity("e1", "One", null, 1));

        // A directory where the temp file should go makes the next write fail
        Files.createDirectories(dir.resolve("store.json.tmp"));
        StorageException e = assertThrows(StorageException.class,
                () -> store.insertEntity(entity("e2", "Two", null, 2)));
        assertEquals("e2", e.getEntityId());
        assertFalse(store.entityExists("e2"));
        assertTrue(store.entityExists("e1"));
    }

    @Test
    @DisplayName("ratings are counted per entity and a failed rating write is undone")
    void testRatingsPerEntity() throws Exception {
        Path dir = tempDir.resolve("ratings");
        Files.createDirectories(dir);
        FallbackRecordStore store = new FallbackRecordStore(new SnapshotFile(dir.resolve("store.json")));
        store.insertEntity(entity("e1", "One", null, 1));
        store.insertEntity(entity("e2", "Two", null, 2));
        store.insertRating(new Rating("r1", "e1", "u", "mbti", "INTJ", 0.5, null, Instant.ofEpochMilli(10)));
        store.insertRating(new Rating("r2", "e2", "u", "mbti", "ENFP", 0.5, null, Instant.ofEpochMilli(11)));
        store.insertRating(new Rating("r3", "e1", "u", "mbti", "INTJ", 1.0, null, Instant.ofEpochMilli(12)));

        Entity one = store.findEntity("e1").orElseThrow();
        assertEquals(2, one.getRatingCount());
        assertEquals(1, one.getAssignments().size());
        assertEquals(0.75, one.getAssignments().get(0).getMeanConfidence(), 1e-9);
        assertEquals(1, store.findEntity("e2").orElseThrow().getRatingCount());

        Files.createDirectories(dir.resolve("store.json.tmp"));
        assertThrows(StorageException.class, () -> store.insertRating(
                new Rating("r4", "e1", "u", "mbti", "INTP", 0.5, null, Instant.ofEpochMilli(13))));
        assertEquals(2, store.findEntity("e1").orElseThrow().getRatingCount());
        assertEquals(List.of("r3", "r1"), store.listRatings("e1").stream().map(Rating::getId)
                .collect(Collectors.toList()));
        assertEquals(List.of(2, 1), store.listEntities(EntityQuery.builder().sort(EntitySort.RATINGS).build())
                .stream().map(Entity::getRatingCount).collect(Collectors.toList()));
    }

    @Nested
    @DisplayName("Unconvertible snapshot rows")
    class BadRowsTest {

        private void assertResetToEmpty(String json) throws Exception {
            Path path = tempDir.resolve("store.json");
            Files.writeString(path, json);

            FallbackRecordStore store = open();
            assertTrue(store.listEntities(EntityQuery.all()).isEmpty());
            assertEquals(0, store.stats().getRatingCount());
            assertFalse(Files.exists(path));
            try (Stream<Path> files = Files.list(tempDir)) {
                assertTrue(files.anyMatch(p -> p.getFileName().toString().startsWith("store.json.corrupt-")));
            }

            store.insertEntity(entity("e1", "Fresh", null, 1));
            assertTrue(open().entityExists("e1"));
        }

        @Test
        @DisplayName("an unknown entity kind resets the store to empty")
        void testUnknownKind() throws Exception {
            assertResetToEmpty("{\"entities\":[{\"id\":\"a\",\"name\":\"A\",\"entityType\":\"robot\"}]}");
        }

        @Test
        @DisplayName("a row without an id resets the store to empty")
        void testMissingId() throws Exception {
            assertResetToEmpty("{\"users\":[{\"username\":\"x\",\"role\":\"annotator\"," +
                    "\"experienceLevel\":\"novice\",\"createdAt\":1}]}");
        }

        @Test
        @DisplayName("a rating without an entity resets the store to empty")
        void testRatingWithoutEntity() throws Exception {
            assertResetToEmpty("{\"ratings\":[{\"id\":\"r\",\"personalitySystem\":\"mbti\"," +
                    "\"personalityType\":\"INTJ\",\"confidence\":0.5,\"createdAt\":1}]}");
        }
    }
}
