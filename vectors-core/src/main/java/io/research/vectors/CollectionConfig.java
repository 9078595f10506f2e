package io.research.vectors;

/**
 * Configuration for opening a {@link VectorStore}.
 */
public record CollectionConfig(
    /** Collection name, recorded in the descriptor */
    String name,

    /** Fixed embedding dimension */
    int dimensions,

    /** Whether records with empty text are refused */
    boolean rejectEmptyText,

    /** Behaviour for an id that is already stored */
    DuplicatePolicy duplicatePolicy,

    /** Cosine to score mapping */
    ScoreMapping scoreMapping,

    /** Exact scan or approximate HNSW */
    SearchMode searchMode,

    /** HNSW M parameter (max connections) */
    int hnswM,

    /** HNSW efConstruction parameter */
    int hnswEfConstruction,

    /** HNSW efSearch parameter */
    int hnswEfSearch,

    /** Initial HNSW capacity; the graph is rebuilt larger when full */
    int hnswMaxItems,

    /** Records written per append and flush in batch mode */
    int batchFlushSize,

    /** Minimum number of dead log frames before automatic compaction */
    int compactionThreshold,

    /** Whether an exclusive process lock is taken on the storage root */
    boolean lockStorage
) {
    public static final String DEFAULT_NAME = "research_documents";
    public static final int DEFAULT_DIMENSIONS = 384;

    public CollectionConfig {
        if (name == null || name.isBlank()) throw new IllegalArgumentException("name cannot be blank");
        if (dimensions <= 0) throw new IllegalArgumentException("dimensions must be positive");
        if (duplicatePolicy == null) throw new IllegalArgumentException("duplicatePolicy cannot be null");
        if (scoreMapping == null) throw new IllegalArgumentException("scoreMapping cannot be null");
        if (searchMode == null) throw new IllegalArgumentException("searchMode cannot be null");
        if (hnswM < 2) throw new IllegalArgumentException("hnswM must be >= 2");
        if (hnswEfConstruction < 1) throw new IllegalArgumentException("hnswEfConstruction must be >= 1");
        if (hnswEfSearch < 1) throw new IllegalArgumentException("hnswEfSearch must be >= 1");
        if (hnswMaxItems < 1) throw new IllegalArgumentException("hnswMaxItems must be >= 1");
        if (batchFlushSize < 1) throw new IllegalArgumentException("batchFlushSize must be >= 1");
        if (compactionThreshold < 0) throw new IllegalArgumentException("compactionThreshold must be >= 0");
    }

    public static CollectionConfig defaultConfig() {
        return new CollectionConfig(
            DEFAULT_NAME,
            DEFAULT_DIMENSIONS,
            false,
            DuplicatePolicy.UPSERT,
            ScoreMapping.CLAMPED_COSINE,
            SearchMode.EXACT,
            16,
            200,
            50,
            10_000,
            1_000,
            1_000,
            true
        );
    }

    public static CollectionConfig forDimensions(int dimensions) {
        return defaultConfig().withDimensions(dimensions);
    }

    public CollectionConfig withName(String name) {
        return new CollectionConfig(name, dimensions, rejectEmptyText, duplicatePolicy, scoreMapping, searchMode,
            hnswM, hnswEfConstruction, hnswEfSearch, hnswMaxItems, batchFlushSize, compactionThreshold, lockStorage);
    }

    public CollectionConfig withDimensions(int dimensions) {
        return new CollectionConfig(name, dimensions, rejectEmptyText, duplicatePolicy, scoreMapping, searchMode,
            hnswM, hnswEfConstruction, hnswEfSearch, hnswMaxItems, batchFlushSize, compactionThreshold, lockStorage);
    }

    public CollectionConfig withRejectEmptyText(boolean rejectEmptyText) {
        return new CollectionConfig(name, dimensions, rejectEmptyText, duplicatePolicy, scoreMapping, searchMode,
            hnswM, hnswEfConstruction, hnswEfSearch, hnswMaxItems, batchFlushSize, compactionThreshold, lockStorage);
    }

    public CollectionConfig withDuplicatePolicy(DuplicatePolicy duplicatePolicy) {
        return new CollectionConfig(name, dimensions, rejectEmptyText, duplicatePolicy, scoreMapping, searchMode,
            hnswM, hnswEfConstruction, hnswEfSearch, hnswMaxItems, batchFlushSize, compactionThreshold, lockStorage);
    }

    public CollectionConfig withScoreMapping(ScoreMapping scoreMapping) {
        return new CollectionConfig(name, dimensions, rejectEmptyText, duplicatePolicy, scoreMapping, searchMode,
            hnswM, hnswEfConstruction, hnswEfSearch, hnswMaxItems, batchFlushSize, compactionThreshold, lockStorage);
    }

    public CollectionConfig withSearchMode(SearchMode searchMode) {
        return new CollectionConfig(name, dimensions, rejectEmptyText, duplicatePolicy, scoreMapping, searchMode,
            hnswM, hnswEfConstruction, hnswEfSearch, hnswMaxItems, batchFlushSize, compactionThreshold, lockStorage);
    }

    public CollectionConfig withHnswMaxItems(int hnswMaxItems) {
        return new CollectionConfig(name, dimensions, rejectEmptyText, duplicatePolicy, scoreMapping, searchMode,
            hnswM, hnswEfConstruction, hnswEfSearch, hnswMaxItems, batchFlushSize, compactionThreshold, lockStorage);
    }

    public CollectionConfig withBatchFlushSize(int batchFlushSize) {
        return new CollectionConfig(name, dimensions, rejectEmptyText, duplicatePolicy, scoreMapping, searchMode,
            hnswM, hnswEfConstruction, hnswEfSearch, hnswMaxItems, batchFlushSize, compactionThreshold, lockStorage);
    }

    public CollectionConfig withCompactionThreshold(int compactionThreshold) {
        return new CollectionConfig(name, dimensions, rejectEmptyText, duplicatePolicy, scoreMapping, searchMode,
            hnswM, hnswEfConstruction, hnswEfSearch, hnswMaxItems, batchFlushSize, compactionThreshold, lockStorage);
    }

    public CollectionConfig withLockStorage(boolean lockStorage) {
        return new CollectionConfig(name, dimensions, rejectEmptyText, duplicatePolicy, scoreMapping, searchMode,
            hnswM, hnswEfConstruction, hnswEfSearch, hnswMaxItems, batchFlushSize, compactionThreshold, lockStorage);
    }
}
