package io.research.vectors;

import java.util.Map;
import java.util.Objects;

/**
 * One ranked hit of a similarity query. Created per query, never persisted.
 */
public record SearchResult(
    /** Id of the matching record */
    String id,

    /** Text of the matching record */
    String text,

    /** Source reference of the matching record */
    String sourceReference,

    /** Metadata of the matching record */
    Map<String, Object> metadata,

    /** Similarity score (0.0 to 1.0, higher is more similar) */
    double score,

    /** 1-based position in the result list */
    int rank
) {
    public SearchResult {
        Objects.requireNonNull(id, "id cannot be null");
        if (score < 0.0 || score > 1.0 || Double.isNaN(score)) {
            throw new IllegalArgumentException("score must be within [0, 1]: " + score);
        }
        if (rank < 1) throw new IllegalArgumentException("rank must be >= 1");
        text = text != null ? text : "";
        sourceReference = sourceReference != null ? sourceReference : "";
        metadata = metadata != null ? metadata : Map.of();
    }

    public static SearchResult of(ChunkRecord record, double score, int rank) {
        return new SearchResult(record.id(), record.text(), record.sourceReference(), record.metadata(), score, rank);
    }

    /**
     * Returns the score as a percentage string.
     */
    public String scorePercent() {
        return String.format("%.1f%%", score * 100);
    }

    @Override
    public String toString() {
        return String.format("#%d [%.4f] %s (%s)", rank, score, id, sourceReference);
    }
}
