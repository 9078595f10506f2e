package io.research.vectors.index;

import io.research.vectors.CollectionConfig;
import io.research.vectors.SearchMode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.Set;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for HnswSimilarityIndex - approximate search re-ranked by exact cosine.
 */
class HnswSimilarityIndexTest {

    private static final int DIMENSIONS = 32;

    private CollectionConfig config;
    private HnswSimilarityIndex index;
    private Random random;

    @BeforeEach
    void setUp() {
        config = CollectionConfig.forDimensions(DIMENSIONS).withSearchMode(SearchMode.HNSW);
        index = new HnswSimilarityIndex(config);
        random = new Random(42); // Fixed seed for reproducibility
    }

    // ==================== Search Tests ====================

    @Test
    void testSelfMatchRanksFirst() {
        List<float[]> vectors = addRandom(300);

        for (int i = 0; i < 300; i += 37) {
            List<ScoredId> results = index.search(vectors.get(i), 5, id -> true);
            assertEquals("v" + i, results.get(0).id());
            assertEquals(1.0, results.get(0).score(), 1e-5);
        }
    }

    @Test
    void testResultsSortedAndBounded() {
        addRandom(50);

        List<ScoredId> results = index.search(randomVector(), 10, id -> true);
        assertEquals(10, results.size());
        for (int i = 1; i < results.size(); i++) {
            assertTrue(SimilarityIndex.RANKING.compare(results.get(i - 1), results.get(i)) < 0);
        }
    }

    @Test
    void testTopKLargerThanSize() {
        addRandom(3);
        assertEquals(3, index.search(randomVector(), 10, id -> true).size());
    }

    @Test
    void testEmptyIndex() {
        assertTrue(index.search(randomVector(), 5, id -> true).isEmpty());
    }

    @Test
    void testFilterWidensSearch() {
        addRandom(200);
        Set<String> allowed = Set.of("v3", "v150", "v199");

        List<ScoredId> results = index.search(randomVector(), 5, allowed::contains);
        assertEquals(allowed, results.stream().map(ScoredId::id).collect(Collectors.toSet()));
    }

    @Test
    void testZeroVectorsAreSearchable() {
        index.put("zero", new float[DIMENSIONS]);
        float[] x = randomVector();
        index.put("x", x);

        List<ScoredId> results = index.search(x, 5, id -> true);
        assertEquals(List.of("x", "zero"), results.stream().map(ScoredId::id).collect(Collectors.toList()));
        assertEquals(0.0, results.get(1).score());

        List<ScoredId> zeroQuery = index.search(new float[DIMENSIONS], 5, id -> true);
        assertEquals(2, zeroQuery.size());
    }

    // ==================== Modification Tests ====================

    @Test
    void testUpsertAndRemove() {
        float[] first = randomVector();
        float[] second = randomVector();
        index.put("a", first);
        index.put("b", randomVector());
        index.put("a", second);

        assertEquals(2, index.size());
        assertEquals("a", index.search(second, 1, id -> true).get(0).id());

        index.remove("a");
        index.remove("a");
        assertEquals(1, index.size());
        assertTrue(index.search(second, 5, id -> true).stream().noneMatch(hit -> hit.id().equals("a")));
    }

    @Test
    void testGrowsBeyondInitialCapacity() {
        index = new HnswSimilarityIndex(config.withHnswMaxItems(8));
        List<float[]> vectors = addRandom(50);
        // churn forces rebuilds as well
        for (int i = 0; i < 20; i++) {
            index.put("v" + i, vectors.get(i));
        }

        assertEquals(50, index.size());
        assertEquals("v42", index.search(vectors.get(42), 1, id -> true).get(0).id());
    }

    @Test
    void testClear() {
        addRandom(10);
        index.clear();
        assertEquals(0, index.size());
        assertTrue(index.search(randomVector(), 5, id -> true).isEmpty());
    }

    // ==================== Persistence Tests ====================

    @Test
    void testSaveAndLoad(@TempDir Path tempDir) throws Exception {
        List<float[]> vectors = addRandom(40);
        index.put("zero", new float[DIMENSIONS]);
        Path file = tempDir.resolve(HnswSimilarityIndex.FILE_NAME);

        index.save(file, 1234L);
        assertTrue(Files.exists(file));

        List<String> liveIds = new ArrayList<>();
        for (int i = 0; i < 40; i++) liveIds.add("v" + i);
        liveIds.add("zero");

        HnswSimilarityIndex loaded = HnswSimilarityIndex.load(file, 1234L, config, liveIds).orElseThrow();
        assertEquals(41, loaded.size());
        assertEquals("v7", loaded.search(vectors.get(7), 1, id -> true).get(0).id());
    }

    @Test
    void testStaleOrMismatchedSnapshotIsIgnored(@TempDir Path tempDir) throws Exception {
        addRandom(5);
        Path file = tempDir.resolve(HnswSimilarityIndex.FILE_NAME);
        index.save(file, 100L);
        List<String> liveIds = List.of("v0", "v1", "v2", "v3", "v4");

        assertTrue(HnswSimilarityIndex.load(file, 101L, config, liveIds).isEmpty());
        assertTrue(HnswSimilarityIndex.load(file, 100L, config, List.of("v0", "v1")).isEmpty());
        assertTrue(HnswSimilarityIndex.load(file, 100L, config.withDimensions(8), liveIds).isEmpty());
        assertTrue(HnswSimilarityIndex.load(tempDir.resolve("missing"), 100L, config, liveIds).isEmpty());

        Files.write(file, new byte[]{1, 2, 3});
        assertTrue(HnswSimilarityIndex.load(file, 100L, config, liveIds).isEmpty());
    }

    @Test
    void testFailedSaveKeepsPreviousSnapshot(@TempDir Path tempDir) throws Exception {
        addRandom(5);
        Path file = tempDir.resolve(HnswSimilarityIndex.FILE_NAME);
        Path tmp = tempDir.resolve(HnswSimilarityIndex.FILE_NAME + ".tmp");
        index.save(file, 100L);
        List<String> liveIds = List.of("v0", "v1", "v2", "v3", "v4");

        Files.createDirectories(tmp.resolve("occupied"));
        assertThrows(IOException.class, () -> index.save(file, 200L));
        assertTrue(HnswSimilarityIndex.load(file, 100L, config, liveIds).isPresent());

        Files.delete(tmp.resolve("occupied"));
        Files.delete(tmp);
        index.save(file, 200L);
        assertFalse(Files.exists(tmp));
        assertTrue(HnswSimilarityIndex.load(file, 200L, config, liveIds).isPresent());
    }

    // ==================== Helper Methods ====================

    private List<float[]> addRandom(int count) {
        List<float[]> vectors = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            float[] v = randomVector();
            vectors.add(v);
            index.put("v" + i, v);
        }
        return vectors;
    }

    private float[] randomVector() {
        float[] v = new float[DIMENSIONS];
        for (int i = 0; i < DIMENSIONS; i++) {
            v[i] = (float) random.nextGaussian();
        }
        return v;
    }
}
