package io.research.vectors;

import java.nio.file.Path;
import java.time.Instant;

/**
 * Outcome of {@link VectorStore#healthCheck()}.
 *
 * @param healthy                 true when the store is open and its collection answered
 * @param size                    live records, 0 when unhealthy
 * @param queryEmbedderConfigured whether text search has an embedder
 * @param root                    storage root directory
 * @param name                    collection name
 * @param dimensions              fixed embedding dimension
 * @param checkedAt               when the check ran
 * @param error                   why the store is unhealthy, null when healthy
 */
public record HealthStatus(
    boolean healthy,
    int size,
    boolean queryEmbedderConfigured,
    Path root,
    String name,
    int dimensions,
    Instant checkedAt,
    String error
) {

    static HealthStatus healthy(VectorStore store, int size, boolean queryEmbedderConfigured, Instant checkedAt) {
        return new HealthStatus(true, size, queryEmbedderConfigured, store.getRoot(), store.getName(),
            store.getDimensions(), checkedAt, null);
    }

    static HealthStatus unhealthy(VectorStore store, boolean queryEmbedderConfigured, Instant checkedAt, String error) {
        return new HealthStatus(false, 0, queryEmbedderConfigured, store.getRoot(), store.getName(),
            store.getDimensions(), checkedAt, error);
    }
}
