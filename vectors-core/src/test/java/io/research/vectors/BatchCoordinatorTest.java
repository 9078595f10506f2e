package io.research.vectors;

import io.research.vectors.index.ExactSimilarityIndex;
import io.research.vectors.index.SimilarityIndex;
import io.research.vectors.storage.PersistentCollection;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class BatchCoordinatorTest {

    private static final int DIMENSIONS = 4;

    @TempDir
    Path root;

    private PersistentCollection collection;
    private SimilarityIndex index;
    private SteppingClock clock;

    @BeforeEach
    void setUp() {
        collection = PersistentCollection.open(root, CollectionConfig.forDimensions(DIMENSIONS));
        index = new ExactSimilarityIndex(ScoreMapping.CLAMPED_COSINE);
        clock = new SteppingClock(Instant.parse("2024-03-01T12:00:00Z"));
    }

    @AfterEach
    void tearDown() {
        collection.close();
    }

    @Test
    void testBatchWithOneInvalidRecordInsertsTheRest() {
        BatchCoordinator coordinator = coordinator(CollectionConfig.forDimensions(DIMENSIONS));
        List<EmbeddedChunk> batch = List.of(
            chunk("r1", new float[]{1, 0, 0, 0}),
            chunk("r2", new float[]{0, 1, 0, 0}),
            chunk("r3", new float[]{0, 1, 0}),
            chunk("r4", new float[]{0, 0, 1, 0}),
            chunk("r5", new float[]{0, 0, 0, 1}));

        BatchResult result = coordinator.insertAll(batch);

        assertEquals(4, result.inserted());
        assertEquals(1, result.rejected().size());
        assertEquals("r3", result.rejected().get(0).id());
        assertInstanceOf(DimensionMismatchException.class, result.rejected().get(0).error());
        assertEquals(4, collection.size());
        assertEquals(4, index.size());
        assertFalse(collection.contains("r3"));
    }

    @Test
    void testRejectionsKeepInputOrder() {
        BatchCoordinator coordinator = coordinator(CollectionConfig.forDimensions(DIMENSIONS));
        BatchResult result = coordinator.insertAll(List.of(
            chunk("", new float[]{1, 0, 0, 0}),
            chunk("ok", new float[]{1, 0, 0, 0}),
            chunk("nan", new float[]{Float.NaN, 0, 0, 0})));

        assertEquals(1, result.inserted());
        assertTrue(result.hasRejections());
        assertInstanceOf(InvalidIdentifierException.class, result.rejected().get(0).error());
        assertInstanceOf(InvalidEmbeddingValueException.class, result.rejected().get(1).error());
    }

    @Test
    void testEmptyBatch() {
        BatchResult result = coordinator(CollectionConfig.forDimensions(DIMENSIONS)).insertAll(List.of());
        assertEquals(BatchResult.empty(), result);
    }

    @Test
    void testSingleInsertThrows() {
        BatchCoordinator coordinator = coordinator(CollectionConfig.forDimensions(DIMENSIONS));
        assertThrows(DimensionMismatchException.class, () -> coordinator.insert(chunk("x", new float[3])));
        assertEquals(0, collection.size());
    }

    @Test
    void testFlushGroupsCoverWholeBatch() {
        BatchCoordinator coordinator = coordinator(CollectionConfig.forDimensions(DIMENSIONS).withBatchFlushSize(3));
        List<EmbeddedChunk> batch = new ArrayList<>();
        for (int i = 0; i < 10; i++) {
            batch.add(chunk("c" + i, new float[]{i, 1, 0, 0}));
        }

        BatchResult result = coordinator.insertAll(batch);

        assertEquals(10, result.inserted());
        assertEquals(10, collection.size());
        assertEquals(batch.stream().map(EmbeddedChunk::id).collect(Collectors.toList()),
            collection.all().map(ChunkRecord::id).collect(Collectors.toList()));
    }

    // ==================== Duplicate Policy Tests ====================

    @Test
    void testUpsertLaterDuplicateInBatchWins() {
        BatchCoordinator coordinator = coordinator(CollectionConfig.forDimensions(DIMENSIONS));
        BatchResult result = coordinator.insertAll(List.of(
            EmbeddedChunk.of("dup", "first", "s", new float[]{1, 0, 0, 0}),
            EmbeddedChunk.of("dup", "second", "s", new float[]{0, 1, 0, 0})));

        assertEquals(1, result.inserted());
        assertFalse(result.hasRejections());
        assertEquals("second", collection.get("dup").orElseThrow().text());
    }

    @Test
    void testRejectPolicyRefusesStoredAndRepeatedIds() {
        BatchCoordinator coordinator = coordinator(
            CollectionConfig.forDimensions(DIMENSIONS).withDuplicatePolicy(DuplicatePolicy.REJECT));
        coordinator.insert(EmbeddedChunk.of("stored", "original", "s", new float[]{1, 0, 0, 0}));

        BatchResult result = coordinator.insertAll(List.of(
            EmbeddedChunk.of("stored", "again", "s", new float[]{1, 0, 0, 0}),
            EmbeddedChunk.of("new", "first", "s", new float[]{0, 1, 0, 0}),
            EmbeddedChunk.of("new", "second", "s", new float[]{0, 0, 1, 0})));

        assertEquals(1, result.inserted());
        assertEquals(List.of("stored", "new"),
            result.rejected().stream().map(BatchResult.Rejection::id).collect(Collectors.toList()));
        assertTrue(result.rejected().stream().allMatch(r -> r.error() instanceof DuplicateIdentifierException));
        assertEquals("original", collection.get("stored").orElseThrow().text());
        assertEquals("first", collection.get("new").orElseThrow().text());

        assertThrows(DuplicateIdentifierException.class,
            () -> coordinator.insert(EmbeddedChunk.of("stored", "x", "s", new float[]{1, 0, 0, 0})));
    }

    // ==================== Timestamp Tests ====================

    @Test
    void testCreatedAtNeverGoesBackwards() {
        BatchCoordinator coordinator = coordinator(CollectionConfig.forDimensions(DIMENSIONS));

        ChunkRecord first = coordinator.insert(chunk("a", new float[]{1, 0, 0, 0}));
        clock.advance(Duration.ofMinutes(-5));
        ChunkRecord second = coordinator.insert(chunk("b", new float[]{1, 0, 0, 0}));
        clock.advance(Duration.ofMinutes(10));
        ChunkRecord third = coordinator.insert(chunk("c", new float[]{1, 0, 0, 0}));

        assertEquals(first.createdAt(), second.createdAt());
        assertTrue(third.createdAt().isAfter(second.createdAt()));
    }

    @Test
    void testCreatedAtFlooredAtStoredMaximum() {
        Instant stored = clock.instant().plus(Duration.ofHours(1));
        BatchCoordinator coordinator = new BatchCoordinator(collection, index,
            CollectionConfig.forDimensions(DIMENSIONS), clock, stored);

        assertEquals(stored, coordinator.insert(chunk("a", new float[]{1, 0, 0, 0})).createdAt());
    }

    // ==================== Helpers ====================

    private BatchCoordinator coordinator(CollectionConfig config) {
        return new BatchCoordinator(collection, index, config, clock, null);
    }

    private static EmbeddedChunk chunk(String id, float[] embedding) {
        return EmbeddedChunk.of(id, "text " + id, "https://example.org/" + id, embedding);
    }

    /**
     * Clock that only moves when told to, in either direction.
     */
    static final class SteppingClock extends Clock {
        private Instant now;

        SteppingClock(Instant start) {
            this.now = start;
        }

        void advance(Duration duration) {
            now = now.plus(duration);
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return now;
        }
    }
}
