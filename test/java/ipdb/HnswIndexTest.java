package ipdb;

import org.junit.jupiter.api.*;

import java.util.*;

import ipdb.internal.Distance;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the low-level HNSW graph: insertion, tombstones, search
 * ordering and recall against the exhaustive scan.
 */
@DisplayName("HnswIndex")
class HnswIndexTest {

    private static float[] randomVector(Random rand, int dim) {
        float[] vec = new float[dim];
        for (int i = 0; i < dim; i++) {
            vec[i] = rand.nextFloat() * 2 - 1;
        }
        return vec;
    }

    @Nested
    @DisplayName("Construction")
    class ConstructionTest {

        @Test
        @DisplayName("create() rejects M below 2")
        void testRejectsSmallM() {
            assertThrows(IllegalArgumentException.class, () -> HnswIndex.create(8, 10, 1, 10));
        }

        @Test
        @DisplayName("new index is empty")
        void testEmpty() {
            HnswIndex index = HnswIndex.create(8, 10, 4, 20);
            assertTrue(index.isEmpty());
            assertEquals(0, index.size());
            assertEquals(0, index.search(new float[8], 5, 10).length);
            assertEquals(8, index.getM0());
        }
    }

    @Nested
    @DisplayName("Writes")
    class WriteTest {

        @Test
        @DisplayName("insert() assigns dense node ids and stores normalized vectors")
        void testInsert() {
            HnswIndex index = HnswIndex.create(3, 10, 4, 20);
            assertEquals(0, index.insert(new float[]{3, 0, 0}));
            assertEquals(1, index.insert(new float[]{0, 4, 0}));
            assertArrayEquals(new float[]{1, 0, 0}, index.getVector(0), 1e-6f);
            assertEquals(2, index.liveCount());
            assertTrue(index.countEdges() > 0);
        }

        @Test
        @DisplayName("insert() rejects wrong dimension")
        void testInsertDimensionMismatch() {
            HnswIndex index = HnswIndex.create(3, 10, 4, 20);
            assertThrows(IllegalArgumentException.class, () -> index.insert(new float[]{1, 2}));
        }

        @Test
        @DisplayName("insert() fails when every slot is used")
        void testInsertFull() {
            HnswIndex index = HnswIndex.create(2, 2, 4, 20);
            index.insert(new float[]{1, 0});
            index.insert(new float[]{0, 1});
            assertThrows(IllegalStateException.class, () -> index.insert(new float[]{1, 1}));
        }

        @Test
        @DisplayName("delete() tombstones a node so it is never returned")
        void testDelete() {
            Random rand = new Random(7);
            HnswIndex index = HnswIndex.create(16, 200, 8, 50);
            List<float[]> vectors = new ArrayList<>();
            for (int i = 0; i < 100; i++) {
                float[] v = randomVector(rand, 16);
                vectors.add(v);
                index.insert(v);
            }

            assertTrue(index.delete(42));
            assertFalse(index.delete(42), "second delete reports the node was already deleted");
            assertEquals(99, index.liveCount());
            assertEquals(1, index.deletedCount());

            for (HnswIndex.SearchResult r : index.search(vectors.get(42), 10, 50)) {
                assertNotEquals(42, r.id);
            }
            for (HnswIndex.SearchResult r : index.searchExact(vectors.get(42), 100)) {
                assertNotEquals(42, r.id);
            }
        }

        @Test
        @DisplayName("delete() of the entrypoint keeps the graph searchable")
        void testDeleteEntrypoint() {
            Random rand = new Random(11);
            HnswIndex index = HnswIndex.create(8, 100, 4, 40);
            for (int i = 0; i < 50; i++) {
                index.insert(randomVector(rand, 8));
            }
            index.delete(index.getEntrypoint());
            HnswIndex.SearchResult[] results = index.search(randomVector(rand, 8), 5, 40);
            assertEquals(5, results.length);
        }
    }

    @Nested
    @DisplayName("Search")
    class SearchTest {

        @Test
        @DisplayName("results are sorted by distance and ignore magnitude")
        void testOrdering() {
            HnswIndex index = HnswIndex.create(2, 10, 4, 20);
            index.insert(new float[]{1, 0});
            index.insert(new float[]{1, 1});
            index.insert(new float[]{0, 1});

            HnswIndex.SearchResult[] results = index.search(new float[]{10, 0}, 3, 10);
            assertEquals(3, results.length);
            assertEquals(0, results[0].id);
            assertEquals(0.0, results[0].distance, 1e-6);
            assertEquals(1, results[1].id);
            assertEquals(2, results[2].id);
            assertEquals(1.0, results[2].distance, 1e-6);
        }

        @Test
        @DisplayName("equal distances are ordered by node id")
        void testTies() {
            HnswIndex index = HnswIndex.create(2, 10, 4, 20);
            index.insert(new float[]{0, 1});
            index.insert(new float[]{0, -1});
            index.insert(new float[]{0, 2});

            HnswIndex.SearchResult[] exact = index.searchExact(new float[]{1, 0}, 3);
            assertEquals(0, exact[0].id);
            assertEquals(1, exact[1].id);
            assertEquals(2, exact[2].id);
        }

        @Test
        @DisplayName("k larger than the index returns every live node")
        void testKLargerThanIndex() {
            HnswIndex index = HnswIndex.create(2, 10, 4, 20);
            index.insert(new float[]{1, 0});
            index.insert(new float[]{0, 1});
            assertEquals(2, index.search(new float[]{1, 1}, 10).length);
            assertEquals(2, index.searchExact(new float[]{1, 1}, 10).length);
        }

        @Test
        @DisplayName("graph search recall against exhaustive search is high")
        void testRecall() {
            int dim = 24;
            Random rand = new Random(42);
            HnswIndex index = HnswIndex.create(dim, 1000, 16, 200);
            for (int i = 0; i < 1000; i++) {
                index.insert(randomVector(rand, dim));
            }

            int k = 10;
            int hits = 0;
            int queries = 50;
            for (int q = 0; q < queries; q++) {
                float[] query = randomVector(rand, dim);
                Set<Integer> truth = new HashSet<>();
                for (HnswIndex.SearchResult r : index.searchExact(query, k)) {
                    truth.add(r.id);
                }
                for (HnswIndex.SearchResult r : index.search(query, k, 100)) {
                    if (truth.contains(r.id)) hits++;
                }
            }
            double recall = hits / (double) (queries * k);
            assertTrue(recall >= 0.9, "recall@10 should be at least 0.9, was " + recall);
        }
    }

    @Nested
    @DisplayName("Distance")
    class DistanceTest {

        @Test
        @DisplayName("cosine distance of normalized vectors")
        void testCosine() {
            float[] a = Distance.normalized(new float[]{1, 0});
            float[] b = Distance.normalized(new float[]{0, 5});
            assertEquals(0.0, Distance.cosine(a, a), 1e-9);
            assertEquals(1.0, Distance.cosine(a, b), 1e-9);
        }
    }

    @Test
    @DisplayName("close() makes the index unusable")
    void testClose() {
        HnswIndex index = HnswIndex.create(2, 10, 4, 20);
        index.close();
        index.close();
        assertTrue(index.isClosed());
        assertThrows(IllegalStateException.class, () -> index.insert(new float[]{1, 0}));
    }
}
