package io.research.vectors;

import io.research.vectors.index.HnswSimilarityIndex;
import io.research.vectors.index.ScoredId;
import io.research.vectors.index.SimilarityIndex;
import io.research.vectors.storage.PersistentCollection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeSet;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Predicate;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * {@link VectorStore} over a {@link PersistentCollection} and an in-memory
 * {@link SimilarityIndex} rebuilt from it on open.
 *
 * <p>Reads share a read lock, mutations and lifecycle transitions take the write lock,
 * so a search never observes a half-applied batch.</p>
 */
public class PersistentVectorStore implements VectorStore {

    private static final Logger log = LoggerFactory.getLogger(PersistentVectorStore.class);

    private final Path root;
    private final CollectionConfig config;
    private final Clock clock;
    private final RecordValidator validator;
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    private volatile QueryEmbedder queryEmbedder;

    // non-null only while open
    private PersistentCollection collection;
    private SimilarityIndex index;
    private BatchCoordinator batchCoordinator;
    private DeletionManager deletionManager;

    public PersistentVectorStore(Path root, CollectionConfig config) {
        this(root, config, Clock.systemUTC());
    }

    PersistentVectorStore(Path root, CollectionConfig config, Clock clock) {
        this.root = Objects.requireNonNull(root, "root cannot be null");
        this.config = Objects.requireNonNull(config, "config cannot be null");
        this.clock = Objects.requireNonNull(clock, "clock cannot be null");
        this.validator = RecordValidator.forConfig(config);
    }

    // ==================== Lifecycle ====================

    @Override
    public void open() {
        lock.writeLock().lock();
        try {
            if (collection != null) {
                return;
            }
            PersistentCollection opened = PersistentCollection.open(root, config);
            try {
                Instant lastCreatedAt = opened.all()
                    .map(ChunkRecord::createdAt)
                    .max(Comparator.naturalOrder())
                    .orElse(null);
                SimilarityIndex loaded = loadIndex(opened);

                collection = opened;
                index = loaded;
                batchCoordinator = new BatchCoordinator(opened, loaded, config, clock, lastCreatedAt);
                deletionManager = new DeletionManager(opened, loaded);
            } catch (RuntimeException e) {
                opened.close();
                throw e;
            }
            log.info("Vector store '{}' open at {} ({} records, {} search)",
                opened.name(), root, opened.size(), config.searchMode());
        } finally {
            lock.writeLock().unlock();
        }
    }

    private SimilarityIndex loadIndex(PersistentCollection opened) {
        if (config.searchMode() == SearchMode.HNSW) {
            Path snapshot = root.resolve(HnswSimilarityIndex.FILE_NAME);
            List<String> liveIds = opened.all().map(ChunkRecord::id).collect(Collectors.toList());
            Optional<HnswSimilarityIndex> restored =
                HnswSimilarityIndex.load(snapshot, opened.sizeBytes(), config, liveIds);
            // the snapshot is rewritten on close; a crash in between must not leave a stale one
            deleteSnapshot(snapshot);
            if (restored.isPresent()) {
                return restored.get();
            }
        }
        SimilarityIndex built = SimilarityIndex.create(config);
        opened.all().forEach(record -> built.put(record.id(), record.embedding()));
        log.debug("Built {} index over {} records", config.searchMode(), built.size());
        return built;
    }

    private static void deleteSnapshot(Path snapshot) {
        try {
            Files.deleteIfExists(snapshot);
        } catch (IOException e) {
            throw new StorageException("Failed to remove index snapshot " + snapshot, e);
        }
    }

    @Override
    public void close() {
        lock.writeLock().lock();
        try {
            if (collection == null) {
                return;
            }
            try {
                if (index instanceof HnswSimilarityIndex hnsw && !collection.isClosed()) {
                    saveSnapshot(hnsw);
                }
                collection.close();
            } finally {
                collection = null;
                index = null;
                batchCoordinator = null;
                deletionManager = null;
            }
            log.info("Vector store closed at {}", root);
        } finally {
            lock.writeLock().unlock();
        }
    }

    private void saveSnapshot(HnswSimilarityIndex hnsw) {
        try {
            hnsw.save(root.resolve(HnswSimilarityIndex.FILE_NAME), collection.sizeBytes());
        } catch (IOException e) {
            // the index is rebuilt from the record log on the next open
            log.warn("Failed to save HNSW snapshot for {}: {}", root, e.toString());
        }
    }

    @Override
    public boolean isOpen() {
        lock.readLock().lock();
        try {
            return collection != null;
        } finally {
            lock.readLock().unlock();
        }
    }

    private void ensureOpen() {
        if (collection == null) {
            throw new NotOpenException(root);
        }
    }

    // ==================== Modification ====================

    @Override
    public ChunkRecord add(EmbeddedChunk chunk) {
        Objects.requireNonNull(chunk, "chunk cannot be null");
        lock.writeLock().lock();
        try {
            ensureOpen();
            return batchCoordinator.insert(chunk);
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public BatchResult addBatch(List<EmbeddedChunk> chunks) {
        Objects.requireNonNull(chunks, "chunks cannot be null");
        lock.writeLock().lock();
        try {
            ensureOpen();
            return batchCoordinator.insertAll(chunks);
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public boolean delete(String id) {
        lock.writeLock().lock();
        try {
            ensureOpen();
            return deletionManager.delete(id);
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public int deleteWhere(RecordFilter filter) {
        lock.writeLock().lock();
        try {
            ensureOpen();
            return deletionManager.deleteWhere(filter);
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public int deleteBySource(String sourceReference) {
        lock.writeLock().lock();
        try {
            ensureOpen();
            return deletionManager.deleteBySource(sourceReference);
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public int clear() {
        lock.writeLock().lock();
        try {
            ensureOpen();
            return deletionManager.clear();
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public void compact() {
        lock.writeLock().lock();
        try {
            ensureOpen();
            collection.compact();
        } finally {
            lock.writeLock().unlock();
        }
    }

    // ==================== Search ====================

    @Override
    public List<SearchResult> searchByVector(float[] queryVector, int topK, RecordFilter filter) {
        Objects.requireNonNull(filter, "filter cannot be null");
        lock.readLock().lock();
        try {
            ensureOpen();
            validator.validateQuery(queryVector, topK);

            Predicate<String> candidates = filter == RecordFilter.all()
                ? id -> true
                : id -> collection.get(id).map(filter::matches).orElse(false);
            List<ScoredId> hits = index.search(queryVector, topK, candidates);

            List<SearchResult> results = new ArrayList<>(hits.size());
            for (ScoredId hit : hits) {
                ChunkRecord record = collection.get(hit.id()).orElseThrow();
                results.add(SearchResult.of(record, hit.score(), results.size() + 1));
            }
            log.debug("Vector search returned {} of {} requested results", results.size(), topK);
            return results;
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public List<SearchResult> searchByText(String queryText, int topK, RecordFilter filter) {
        lock.readLock().lock();
        try {
            ensureOpen();
        } finally {
            lock.readLock().unlock();
        }
        validator.validateTopK(topK);
        if (queryText == null || queryText.isBlank()) {
            throw new InvalidArgumentException("query text cannot be blank");
        }
        QueryEmbedder embedder = queryEmbedder;
        if (embedder == null) {
            throw new IllegalStateException("No query embedder configured for text search");
        }
        // embedding may be slow, so it runs outside the lock
        float[] queryVector = embedder.embed(queryText);
        return searchByVector(queryVector, topK, filter);
    }

    @Override
    public void setQueryEmbedder(QueryEmbedder embedder) {
        this.queryEmbedder = embedder;
    }

    // ==================== Access ====================

    @Override
    public Optional<ChunkRecord> get(String id) {
        lock.readLock().lock();
        try {
            ensureOpen();
            return id == null ? Optional.empty() : collection.get(id);
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public int size() {
        lock.readLock().lock();
        try {
            ensureOpen();
            return collection.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public Stream<ChunkRecord> all() {
        lock.readLock().lock();
        try {
            ensureOpen();
            return collection.all();
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public List<String> listSources() {
        lock.readLock().lock();
        try {
            ensureOpen();
            return collection.all()
                .map(ChunkRecord::sourceReference)
                .filter(source -> !source.isEmpty())
                .collect(Collectors.toCollection(TreeSet::new))
                .stream()
                .toList();
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public CollectionStats getStats() {
        lock.readLock().lock();
        try {
            ensureOpen();
            List<ChunkRecord> records = collection.all().collect(Collectors.toList());
            long totalCharacters = 0;
            TreeSet<String> sources = new TreeSet<>();
            TreeSet<String> models = new TreeSet<>();
            for (ChunkRecord record : records) {
                totalCharacters += record.text().length();
                if (!record.sourceReference().isEmpty()) {
                    sources.add(record.sourceReference());
                }
                if (!record.embeddingModelId().isEmpty()) {
                    models.add(record.embeddingModelId());
                }
            }
            double average = records.isEmpty()
                ? 0.0
                : Math.round(totalCharacters * 100.0 / records.size()) / 100.0;
            return new CollectionStats(
                collection.name(),
                collection.dimensions(),
                records.size(),
                sources.size(),
                List.copyOf(models),
                totalCharacters,
                average,
                collection.sizeBytes()
            );
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public HealthStatus healthCheck() {
        boolean embedderConfigured = queryEmbedder != null;
        Instant now = clock.instant();
        lock.readLock().lock();
        try {
            if (collection == null) {
                return HealthStatus.unhealthy(this, embedderConfigured, now, "store is not open");
            }
            return HealthStatus.healthy(this, collection.size(), embedderConfigured, now);
        } catch (VectorStoreException e) {
            log.error("Health check of {} failed", root, e);
            return HealthStatus.unhealthy(this, embedderConfigured, now, e.getMessage());
        } finally {
            lock.readLock().unlock();
        }
    }

    // ==================== Metadata ====================

    @Override
    public int getDimensions() {
        return config.dimensions();
    }

    @Override
    public String getName() {
        lock.readLock().lock();
        try {
            return collection != null ? collection.name() : config.name();
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public Path getRoot() {
        return root;
    }

    /**
     * Returns the configuration this store was created with.
     */
    public CollectionConfig getConfig() {
        return config;
    }
}
