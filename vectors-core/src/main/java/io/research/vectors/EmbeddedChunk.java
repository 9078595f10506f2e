package io.research.vectors;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A text chunk paired with its embedding, as handed over by an embedding producer.
 *
 * <p>Structural checks (id, dimension, finiteness) are left to {@link RecordValidator}
 * so that a batch can report them per record.</p>
 */
public record EmbeddedChunk(
    /** Caller-assigned primary key */
    String id,

    /** Chunk content, never null */
    String text,

    /** Opaque origin locator, never null */
    String sourceReference,

    /** Ordered scalar metadata */
    Map<String, Object> metadata,

    /** The vector embedding */
    float[] embedding,

    /** Identifier of the model that produced the embedding */
    String embeddingModelId
) {
    public EmbeddedChunk {
        if (embedding == null) throw new IllegalArgumentException("embedding cannot be null");
        text = text != null ? text : "";
        sourceReference = sourceReference != null ? sourceReference : "";
        embeddingModelId = embeddingModelId != null ? embeddingModelId : "";
        metadata = copyMetadata(metadata);
        embedding = embedding.clone();
    }

    public static EmbeddedChunk of(String id, String text, String sourceReference, float[] embedding) {
        return new EmbeddedChunk(id, text, sourceReference, Map.of(), embedding, "");
    }

    public static EmbeddedChunk of(String id, String text, String sourceReference,
                                   Map<String, ?> metadata, float[] embedding, String embeddingModelId) {
        return new EmbeddedChunk(id, text, sourceReference, copyMetadata(metadata), embedding, embeddingModelId);
    }

    @Override
    public float[] embedding() {
        return embedding.clone();
    }

    /**
     * Returns the embedding length without copying it.
     */
    public int dimensions() {
        return embedding.length;
    }

    /**
     * Returns the element at {@code position} without copying the embedding.
     */
    public float embeddingAt(int position) {
        return embedding[position];
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof EmbeddedChunk other)) return false;
        return Objects.equals(id, other.id)
            && text.equals(other.text)
            && sourceReference.equals(other.sourceReference)
            && metadata.equals(other.metadata)
            && Arrays.equals(embedding, other.embedding)
            && embeddingModelId.equals(other.embeddingModelId);
    }

    @Override
    public int hashCode() {
        int result = Objects.hash(id, text, sourceReference, metadata, embeddingModelId);
        return 31 * result + Arrays.hashCode(embedding);
    }

    @Override
    public String toString() {
        return String.format("EmbeddedChunk[id=%s, source=%s, dims=%d]", id, sourceReference, embedding.length);
    }

    /**
     * Copies metadata into an unmodifiable insertion-ordered map of scalars.
     *
     * <p>Integral numbers become {@code Long}, floating point numbers become {@code Double},
     * anything that is not a string, boolean or number is stored as its string form.</p>
     */
    static Map<String, Object> copyMetadata(Map<String, ?> metadata) {
        if (metadata == null || metadata.isEmpty()) {
            return Map.of();
        }
        Map<String, Object> copy = new LinkedHashMap<>();
        for (Map.Entry<String, ?> entry : metadata.entrySet()) {
            String key = Objects.requireNonNull(entry.getKey(), "metadata key cannot be null");
            Object value = Objects.requireNonNull(entry.getValue(), "metadata value cannot be null for key " + key);
            copy.put(key, normalizeScalar(value));
        }
        return Collections.unmodifiableMap(copy);
    }

    private static Object normalizeScalar(Object value) {
        if (value instanceof String || value instanceof Boolean || value instanceof Long) {
            return value;
        }
        if (value instanceof Double d) {
            return Double.isFinite(d) ? d : d.toString();
        }
        if (value instanceof Integer || value instanceof Short || value instanceof Byte) {
            return ((Number) value).longValue();
        }
        if (value instanceof Float f) {
            return Float.isFinite(f) ? (Object) f.doubleValue() : f.toString();
        }
        if (value instanceof BigInteger || value instanceof BigDecimal) {
            return value.toString();
        }
        return String.valueOf(value);
    }
}
