package io.research.vectors.embeddings;

import java.io.Closeable;
import java.util.List;

/**
 * Turns text into embedding vectors.
 *
 * <p>The store itself never embeds documents: producers hand it finished embeddings.
 * A model is only needed to embed query text for text search, where it must be the
 * same model that produced the stored embeddings.</p>
 */
public interface EmbeddingModel extends Closeable {

    /**
     * Generates an embedding for a single text.
     *
     * @param text The text to embed
     * @return Vector embedding as float array
     */
    float[] embed(String text);

    /**
     * Generates embeddings for multiple texts.
     *
     * @param texts List of texts
     * @return List of embeddings in the same order
     */
    List<float[]> embedBatch(List<String> texts);

    /**
     * Returns the model identifier recorded with every embedding it produces.
     */
    String getModelId();

    /**
     * Returns the embedding dimensions.
     */
    int getDimensions();

    /**
     * Loads an embedding model by ID with default configuration.
     */
    static EmbeddingModel load(String modelId) {
        return load(modelId, EmbeddingConfig.defaults());
    }

    /**
     * Loads an embedding model with custom configuration.
     *
     * @throws IllegalArgumentException if no model is known under {@code modelId}
     */
    static EmbeddingModel load(String modelId, EmbeddingConfig config) {
        if (modelId != null && modelId.startsWith(HashingEmbeddingModel.MODEL_PREFIX)) {
            return new HashingEmbeddingModel(modelId, config);
        }
        throw new IllegalArgumentException("Unknown embedding model: " + modelId);
    }
}
