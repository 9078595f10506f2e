package io.research.vectors;

/**
 * Converts a natural-language query into a vector for text-proxy search.
 *
 * <p>The store never embeds text itself; callers plug in their embedding model here.</p>
 */
@FunctionalInterface
public interface QueryEmbedder {
    float[] embed(String text);
}
