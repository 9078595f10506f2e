package io.research.vectors;

import java.util.List;

/**
 * Statistics about a collection.
 */
public record CollectionStats(
    /** Collection name */
    String name,

    /** Fixed embedding dimension */
    int dimensions,

    /** Number of live records */
    int totalRecords,

    /** Number of distinct non-empty source references */
    int uniqueSources,

    /** Distinct embedding model ids, sorted */
    List<String> embeddingModels,

    /** Sum of text lengths */
    long totalCharacters,

    /** Mean text length, rounded to two decimals */
    double averageTextLength,

    /** Bytes used by the record log on disk */
    long storageBytes
) {}
