package io.research.vectors;

/**
 * Nearest-neighbour strategy used by a store.
 */
public enum SearchMode {
    /** Exhaustive scan; the reference ranking. */
    EXACT,

    /** Approximate HNSW graph, for large collections where recall may be traded for speed. */
    HNSW
}
