package io.research.vectors.embeddings;

/**
 * Configuration for embedding models.
 */
public record EmbeddingConfig(
    /** Output dimensions */
    int dimensions,

    /** Whether to normalize output vectors to unit length */
    boolean normalizeOutput,

    /** Whether tokens are lower-cased before hashing */
    boolean lowercase
) {
    public static final int DEFAULT_DIMENSIONS = 384;

    public EmbeddingConfig {
        if (dimensions <= 0) throw new IllegalArgumentException("dimensions must be positive");
    }

    public static EmbeddingConfig defaults() {
        return new EmbeddingConfig(DEFAULT_DIMENSIONS, true, true);
    }

    public EmbeddingConfig withDimensions(int dimensions) {
        return new EmbeddingConfig(dimensions, normalizeOutput, lowercase);
    }

    public EmbeddingConfig withNormalizeOutput(boolean normalizeOutput) {
        return new EmbeddingConfig(dimensions, normalizeOutput, lowercase);
    }

    public EmbeddingConfig withLowercase(boolean lowercase) {
        return new EmbeddingConfig(dimensions, normalizeOutput, lowercase);
    }
}
