package org.socionics.ipdb;

import org.junit.jupiter.api.*;

import java.nio.file.Path;
import java.util.*;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("EntityVectorIndex")
class EntityVectorIndexTest {

    private static final int DIM = 8;

    private static float[] randomVector(Random rand) {
        float[] vec = new float[DIM];
        for (int i = 0; i < DIM; i++) {
            vec[i] = rand.nextFloat() * 2 - 1;
        }
        return vec;
    }

    private static float[] unit(int axis) {
        float[] vec = new float[DIM];
        vec[axis] = 1.0f;
        return vec;
    }

    private static EntityVectorIndex index(int capacity, int exactThreshold) {
        return new EntityVectorIndex(DIM, capacity, 8, 64, 32, exactThreshold);
    }

    private static StoreConfig config(int capacity) {
        return PersonalityStore.builder()
                .dataDir(Path.of("unused"))
                .dimensions(DIM)
                .capacity(capacity)
                .m(8)
                .efConstruction(64)
                .buildConfig();
    }

    private static List<String> ids(List<SimilarityResult> results) {
        List<String> ids = new ArrayList<>();
        for (SimilarityResult r : results) ids.add(r.getEntityId());
        return ids;
    }

    @Nested
    @DisplayName("Replacing vectors")
    class ReplaceTest {

        @Test
        @DisplayName("a replaced vector is never returned again")
        void testReplaceTombstonesOldSlot() {
            EntityVectorIndex index = index(10, 2000);
            index.put("e1", unit(0));
            index.put("e2", unit(2));
            index.put("e1", unit(1));

            List<SimilarityResult> byNew = index.search(unit(1), 1, null);
            assertEquals("e1", byNew.get(0).getEntityId());
            assertEquals(1.0, byNew.get(0).getSimilarity(), 1e-6);

            List<SimilarityResult> byOld = index.search(unit(0), 5, null);
            assertEquals(2, byOld.size(), "e1 appears once, not as a stale duplicate");
            for (SimilarityResult r : byOld) {
                assertTrue(r.getSimilarity() < 0.5, "no result at the old vector: " + r);
            }

            VectorIndexStats stats = index.stats();
            assertEquals(2, stats.getLiveCount());
            assertEquals(3, stats.getSlotCount());
            assertEquals(1, stats.getStaleCount());
        }

        @Test
        @DisplayName("replacing does not count against capacity")
        void testReplaceAtCapacity() {
            EntityVectorIndex index = index(2, 2000);
            index.put("a", unit(0));
            index.put("b", unit(1));
            index.put("a", unit(2));
            assertEquals(2, index.size());
        }

        @Test
        @DisplayName("running out of slots compacts the graph")
        void testCompaction() {
            EntityVectorIndex index = index(4, 2000);
            Random rand = new Random(3);
            for (int round = 0; round < 30; round++) {
                index.put("e" + (round % 4), randomVector(rand));
            }
            float[] last = randomVector(rand);
            index.put("e1", last);

            assertEquals(4, index.size());
            assertEquals("e1", index.search(last, 1, null).get(0).getEntityId());
            assertTrue(index.stats().getSlotCount() <= 4 + 16);
        }
    }

    @Nested
    @DisplayName("Capacity")
    class CapacityTest {

        @Test
        @DisplayName("adding past capacity fails fast")
        void testCapacityExceeded() {
            EntityVectorIndex index = index(2, 2000);
            index.put("a", unit(0));
            index.put("b", unit(1));
            CapacityExceededException e = assertThrows(CapacityExceededException.class,
                    () -> index.put("c", unit(2)));
            assertEquals(2, e.getCapacity());
            assertFalse(index.contains("c"));
        }

        @Test
        @DisplayName("build() grows to fit persisted vectors when asked to")
        void testBuildGrows() {
            Map<String, float[]> persisted = new LinkedHashMap<>();
            for (int i = 0; i < 5; i++) persisted.put("e" + i, unit(i));

            EntityVectorIndex grown = EntityVectorIndex.build(config(3), 3, persisted, true);
            assertEquals(5, grown.getCapacity());
            assertEquals(5, grown.size());

            assertThrows(CapacityExceededException.class,
                    () -> EntityVectorIndex.build(config(3), 3, persisted, false));
        }

        @Test
        @DisplayName("build() skips vectors of the wrong dimension and counts them as stale")
        void testBuildSkipsWrongDimension() {
            Map<String, float[]> persisted = new LinkedHashMap<>();
            persisted.put("good", unit(0));
            persisted.put("short", new float[]{1, 2});
            persisted.put("zero", new float[DIM]);

            EntityVectorIndex index = EntityVectorIndex.build(config(10), 10, persisted, true);
            assertEquals(1, index.size());
            assertEquals(2, index.stats().getStaleCount());
        }
    }

    @Nested
    @DisplayName("Search")
    class SearchTest {

        @Test
        @DisplayName("empty index or k <= 0 returns nothing")
        void testEmpty() {
            EntityVectorIndex index = index(10, 2000);
            assertTrue(index.search(unit(0), 5, null).isEmpty());
            index.put("a", unit(0));
            assertTrue(index.search(unit(0), 0, null).isEmpty());
            assertTrue(index.search(unit(0), -1, null).isEmpty());
        }

        @Test
        @DisplayName("wrong query dimension fails")
        void testDimensionMismatch() {
            EntityVectorIndex index = index(10, 2000);
            DimensionMismatchException e = assertThrows(DimensionMismatchException.class,
                    () -> index.search(new float[3], 1, null));
            assertEquals(DIM, e.getExpected());
            assertEquals(3, e.getActual());
        }

        @Test
        @DisplayName("ties are broken by entity id")
        void testTies() {
            EntityVectorIndex index = index(10, 2000);
            index.put("zeta", unit(1));
            index.put("alpha", unit(2));
            index.put("mid", unit(3));

            List<SimilarityResult> results = index.search(unit(0), 2, null);
            assertEquals(List.of("alpha", "mid"), ids(results));
        }

        @Test
        @DisplayName("excluded entity is left out")
        void testExclude() {
            EntityVectorIndex index = index(10, 2000);
            index.put("self", unit(0));
            index.put("other", unit(1));
            assertEquals(List.of("other"), ids(index.search(unit(0), 5, "self")));
        }

        @Test
        @DisplayName("graph search agrees with exact search on the best match")
        void testGraphPath() {
            Random rand = new Random(99);
            EntityVectorIndex graph = index(500, 0);
            EntityVectorIndex exact = index(500, 2000);
            for (int i = 0; i < 300; i++) {
                float[] v = randomVector(rand);
                String id = String.format("e%03d", i);
                graph.put(id, v);
                exact.put(id, v);
            }
            int agree = 0;
            for (int q = 0; q < 20; q++) {
                float[] query = randomVector(rand);
                String g = graph.search(query, 1, null).get(0).getEntityId();
                String x = exact.search(query, 1, null).get(0).getEntityId();
                if (g.equals(x)) agree++;
            }
            assertTrue(agree >= 18, "graph search found the true nearest in " + agree + "/20 queries");
        }
    }
}
