package io.research.vectors;

import io.research.vectors.storage.CollectionDescriptor;
import io.research.vectors.storage.PersistentCollection;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Persistent store of text chunks and their embeddings with similarity search.
 *
 * <p>A store is bound to a storage root directory. Every mutation is on disk when the
 * call returns, and a store reopened on the same root sees exactly the records that
 * were live when it was closed.</p>
 *
 * <h2>Usage Example</h2>
 * <pre>{@code
 * try (VectorStore store = VectorStore.open(Path.of("data/vectors"), 384)) {
 *     store.add(EmbeddedChunk.of("doc-1#0", text, "https://example.org/doc-1", embedding));
 *
 *     List<SearchResult> results = store.searchByVector(queryEmbedding, 5);
 *
 *     store.deleteWhere(RecordFilter.sourceContains("blocked.example"));
 * }
 * }</pre>
 *
 * <p>Implementations are thread-safe. Once closed, every operation other than
 * {@link #open()}, {@link #close()}, {@link #isOpen()} and the fixed accessors throws
 * {@link NotOpenException}.</p>
 */
public interface VectorStore extends AutoCloseable {

    // ==================== Factory Methods ====================

    /**
     * Opens the store at {@code root}, creating an empty collection when none exists.
     *
     * @throws DimensionMismatchException if the stored collection has another dimension
     * @throws StorageException if the root cannot be read or is locked
     */
    static VectorStore open(Path root, CollectionConfig config) {
        PersistentVectorStore store = new PersistentVectorStore(root, config);
        store.open();
        return store;
    }

    /**
     * Opens the store at {@code root} with default settings and the given dimension.
     */
    static VectorStore open(Path root, int dimensions) {
        return open(root, CollectionConfig.forDimensions(dimensions));
    }

    /**
     * Opens an existing collection, taking its name and dimension from the storage root.
     *
     * @throws StorageException if {@code root} holds no collection
     */
    static VectorStore openExisting(Path root) {
        CollectionDescriptor descriptor = PersistentCollection.readDescriptor(root);
        return open(root, CollectionConfig.forDimensions(descriptor.dimensions()).withName(descriptor.name()));
    }

    // ==================== Lifecycle ====================

    /**
     * Opens the store. A no-op when it is already open.
     */
    void open();

    /**
     * Flushes, releases the storage root and closes the store. Idempotent.
     */
    @Override
    void close();

    /**
     * Closes and opens the store again, re-reading everything from disk.
     */
    default void reopen() {
        close();
        open();
    }

    boolean isOpen();

    // ==================== Modification ====================

    /**
     * Validates and stores one record. An existing id is replaced under
     * {@link DuplicatePolicy#UPSERT} and refused under {@link DuplicatePolicy#REJECT}.
     *
     * @return the stored record with its insertion time
     * @throws ValidationException if the record is refused
     */
    ChunkRecord add(EmbeddedChunk chunk);

    /**
     * Stores every valid record of the batch; invalid ones are reported, not thrown.
     */
    BatchResult addBatch(List<EmbeddedChunk> chunks);

    /**
     * Removes a record by id.
     *
     * @return true if the record existed
     */
    boolean delete(String id);

    /**
     * Removes every record matching {@code filter}.
     *
     * @return number of records removed
     */
    int deleteWhere(RecordFilter filter);

    /**
     * Removes every record whose source reference equals {@code sourceReference}.
     */
    int deleteBySource(String sourceReference);

    /**
     * Removes every record.
     *
     * @return number of records removed
     */
    int clear();

    /**
     * Rewrites the storage so it holds only live records.
     */
    void compact();

    // ==================== Search ====================

    /**
     * Returns up to {@code topK} records most similar to {@code queryVector}, best first.
     *
     * @throws InvalidArgumentException if {@code topK} is not positive
     * @throws DimensionMismatchException if the query has the wrong length
     */
    default List<SearchResult> searchByVector(float[] queryVector, int topK) {
        return searchByVector(queryVector, topK, RecordFilter.all());
    }

    /**
     * Like {@link #searchByVector(float[], int)}, ranking only records matching {@code filter}.
     */
    List<SearchResult> searchByVector(float[] queryVector, int topK, RecordFilter filter);

    /**
     * Embeds {@code queryText} with the configured {@link QueryEmbedder} and searches by vector.
     *
     * @throws IllegalStateException if no query embedder is set
     * @throws InvalidArgumentException if {@code queryText} is blank
     */
    default List<SearchResult> searchByText(String queryText, int topK) {
        return searchByText(queryText, topK, RecordFilter.all());
    }

    List<SearchResult> searchByText(String queryText, int topK, RecordFilter filter);

    /**
     * Sets the embedder used by text search. Pass {@code null} to remove it.
     */
    void setQueryEmbedder(QueryEmbedder embedder);

    // ==================== Access ====================

    Optional<ChunkRecord> get(String id);

    /**
     * Number of live records.
     */
    int size();

    default boolean isEmpty() {
        return size() == 0;
    }

    /**
     * Returns the records live at call time, in insertion order.
     */
    Stream<ChunkRecord> all();

    /**
     * Sorted, distinct non-empty source references.
     */
    List<String> listSources();

    CollectionStats getStats();

    /**
     * Reports whether the store can serve requests. Never throws; a closed or failing
     * store yields an unhealthy status carrying the reason.
     */
    HealthStatus healthCheck();

    // ==================== Metadata ====================

    int getDimensions();

    String getName();

    Path getRoot();
}
