package io.research.vectors;

import java.time.Instant;
import java.util.Arrays;
import java.util.Map;
import java.util.Objects;

/**
 * The stored unit of a collection: a chunk, its embedding and provenance.
 *
 * <p>Records are immutable. A stored record is only ever replaced as a whole.</p>
 */
public record ChunkRecord(
    /** Primary key */
    String id,

    /** Chunk content, possibly empty */
    String text,

    /** Opaque origin locator */
    String sourceReference,

    /** Ordered scalar metadata */
    Map<String, Object> metadata,

    /** Embedding of exactly the collection's dimension */
    float[] embedding,

    /** Identifier of the model that produced the embedding */
    String embeddingModelId,

    /** Insertion time assigned by the store */
    Instant createdAt
) {
    public ChunkRecord {
        Objects.requireNonNull(id, "id cannot be null");
        Objects.requireNonNull(embedding, "embedding cannot be null");
        Objects.requireNonNull(createdAt, "createdAt cannot be null");
        text = text != null ? text : "";
        sourceReference = sourceReference != null ? sourceReference : "";
        embeddingModelId = embeddingModelId != null ? embeddingModelId : "";
        metadata = EmbeddedChunk.copyMetadata(metadata);
        embedding = embedding.clone();
    }

    /**
     * Stamps an inbound chunk with its insertion time.
     */
    public static ChunkRecord from(EmbeddedChunk chunk, Instant createdAt) {
        return new ChunkRecord(
            chunk.id(),
            chunk.text(),
            chunk.sourceReference(),
            chunk.metadata(),
            chunk.embedding(),
            chunk.embeddingModelId(),
            createdAt
        );
    }

    @Override
    public float[] embedding() {
        return embedding.clone();
    }

    public int dimensions() {
        return embedding.length;
    }

    /**
     * Returns a metadata value, or {@code null} when the key is absent.
     */
    public Object metadataValue(String key) {
        return metadata.get(key);
    }

    /**
     * Strips the insertion time, e.g. for re-ingestion into another collection.
     */
    public EmbeddedChunk toEmbeddedChunk() {
        return new EmbeddedChunk(id, text, sourceReference, metadata, embedding, embeddingModelId);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ChunkRecord other)) return false;
        return id.equals(other.id)
            && text.equals(other.text)
            && sourceReference.equals(other.sourceReference)
            && metadata.equals(other.metadata)
            && Arrays.equals(embedding, other.embedding)
            && embeddingModelId.equals(other.embeddingModelId)
            && createdAt.equals(other.createdAt);
    }

    @Override
    public int hashCode() {
        int result = Objects.hash(id, text, sourceReference, metadata, embeddingModelId, createdAt);
        return 31 * result + Arrays.hashCode(embedding);
    }

    @Override
    public String toString() {
        return String.format("ChunkRecord[id=%s, source=%s, dims=%d, createdAt=%s]",
            id, sourceReference, embedding.length, createdAt);
    }

    /**
     * Returns a truncated version of the text for display purposes.
     */
    public String truncatedText(int maxLength) {
        if (text.length() <= maxLength) {
            return text;
        }
        return text.substring(0, Math.max(0, maxLength - 3)) + "...";
    }
}
