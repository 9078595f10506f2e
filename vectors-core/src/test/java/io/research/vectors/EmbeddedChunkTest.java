package io.research.vectors;

import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class EmbeddedChunkTest {

    @Test
    void testNullFieldsBecomeEmpty() {
        EmbeddedChunk chunk = new EmbeddedChunk("id", null, null, null, new float[]{1}, null);

        assertEquals("", chunk.text());
        assertEquals("", chunk.sourceReference());
        assertEquals("", chunk.embeddingModelId());
        assertTrue(chunk.metadata().isEmpty());
    }

    @Test
    void testEmbeddingIsCopiedInAndOut() {
        float[] source = {1, 2, 3};
        EmbeddedChunk chunk = EmbeddedChunk.of("id", "t", "s", source);

        source[0] = 99;
        assertEquals(1f, chunk.embeddingAt(0));

        chunk.embedding()[1] = 99;
        assertEquals(2f, chunk.embeddingAt(1));
    }

    @Test
    void testMetadataNormalization() {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("title", "Attention");
        metadata.put("page", 3);
        metadata.put("short", (short) 2);
        metadata.put("ratio", 0.25f);
        metadata.put("open", Boolean.TRUE);
        metadata.put("amount", new BigDecimal("1.10"));
        metadata.put("tags", List.of("a", "b"));
        metadata.put("nan", Double.NaN);

        EmbeddedChunk chunk = EmbeddedChunk.of("id", "t", "s", metadata, new float[]{1}, "m");
        Map<String, Object> stored = chunk.metadata();

        assertEquals(List.of("title", "page", "short", "ratio", "open", "amount", "tags", "nan"),
            List.copyOf(stored.keySet()));
        assertEquals(3L, stored.get("page"));
        assertEquals(2L, stored.get("short"));
        assertEquals(0.25, stored.get("ratio"));
        assertEquals(Boolean.TRUE, stored.get("open"));
        assertEquals("1.10", stored.get("amount"));
        assertEquals("[a, b]", stored.get("tags"));
        assertEquals("NaN", stored.get("nan"));
        assertThrows(UnsupportedOperationException.class, () -> stored.put("x", "y"));
    }

    @Test
    void testNullMetadataValueRejected() {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("author", null);

        assertThrows(NullPointerException.class,
            () -> EmbeddedChunk.of("id", "t", "s", metadata, new float[]{1}, "m"));
    }

    @Test
    void testValueEquality() {
        EmbeddedChunk a = EmbeddedChunk.of("id", "t", "s", new float[]{1, 2});
        EmbeddedChunk b = EmbeddedChunk.of("id", "t", "s", new float[]{1, 2});
        EmbeddedChunk c = EmbeddedChunk.of("id", "t", "s", new float[]{1, 3});

        assertEquals(a, b);
        assertEquals(a.hashCode(), b.hashCode());
        assertNotEquals(a, c);
    }

    @Test
    void testChunkRecordRoundTripsToEmbeddedChunk() {
        EmbeddedChunk chunk = EmbeddedChunk.of("id", "text", "src", Map.of("k", 1), new float[]{0.5f, -0.5f}, "model");
        ChunkRecord record = ChunkRecord.from(chunk, Instant.EPOCH);

        assertEquals(chunk, record.toEmbeddedChunk());
        assertEquals(Instant.EPOCH, record.createdAt());
        assertEquals(2, record.dimensions());
        assertEquals(1L, record.metadataValue("k"));
        assertNull(record.metadataValue("missing"));
    }

    @Test
    void testTruncatedText() {
        ChunkRecord record = ChunkRecord.from(EmbeddedChunk.of("id", "abcdefghij", "s", new float[]{1}), Instant.EPOCH);

        assertEquals("abcdefghij", record.truncatedText(10));
        assertEquals("abcd...", record.truncatedText(7));
    }

    @Test
    void testSearchResultScoreBounds() {
        ChunkRecord record = ChunkRecord.from(EmbeddedChunk.of("id", "t", "s", new float[]{1}), Instant.EPOCH);

        assertEquals("75.0%", SearchResult.of(record, 0.75, 1).scorePercent());
        assertThrows(IllegalArgumentException.class, () -> SearchResult.of(record, 1.01, 1));
        assertThrows(IllegalArgumentException.class, () -> SearchResult.of(record, -0.01, 1));
        assertThrows(IllegalArgumentException.class, () -> SearchResult.of(record, 0.5, 0));
    }

    @Test
    void testScoreMappings() {
        assertEquals(1.0, ScoreMapping.CLAMPED_COSINE.toScore(1.0));
        assertEquals(0.0, ScoreMapping.CLAMPED_COSINE.toScore(-0.5));
        assertEquals(0.0, ScoreMapping.CLAMPED_COSINE.toScore(Double.NaN));
        assertEquals(0.25, ScoreMapping.SHIFTED_COSINE.toScore(-0.5), 1e-12);
        assertEquals(0.5, ScoreMapping.SHIFTED_COSINE.toScore(0.0), 1e-12);
    }
}
