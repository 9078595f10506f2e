package io.research.vectors;

import io.research.vectors.index.SimilarityIndex;
import io.research.vectors.storage.PersistentCollection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Validates inbound chunks and writes them to the collection and the similarity index.
 *
 * <p>A batch is judged record by record: invalid records are reported in the
 * {@link BatchResult} and never stop the valid ones. Accepted records are written in
 * groups of {@link CollectionConfig#batchFlushSize()}, one append and flush per group.</p>
 *
 * <p>Not thread-safe; {@link PersistentVectorStore} holds its write lock while calling in.</p>
 */
final class BatchCoordinator {

    private static final Logger log = LoggerFactory.getLogger(BatchCoordinator.class);

    private final PersistentCollection collection;
    private final SimilarityIndex index;
    private final RecordValidator validator;
    private final DuplicatePolicy duplicatePolicy;
    private final int flushSize;
    private final Clock clock;
    private Instant lastCreatedAt;

    BatchCoordinator(PersistentCollection collection, SimilarityIndex index, CollectionConfig config,
                     Clock clock, Instant lastCreatedAt) {
        this.collection = collection;
        this.index = index;
        this.validator = RecordValidator.forConfig(config);
        this.duplicatePolicy = config.duplicatePolicy();
        this.flushSize = config.batchFlushSize();
        this.clock = clock;
        this.lastCreatedAt = lastCreatedAt;
    }

    /**
     * Validates and stores a single chunk.
     *
     * @return the stored record
     * @throws ValidationException if the chunk is refused
     */
    ChunkRecord insert(EmbeddedChunk chunk) {
        validator.validate(chunk);
        if (duplicatePolicy == DuplicatePolicy.REJECT && collection.contains(chunk.id())) {
            throw new DuplicateIdentifierException(chunk.id());
        }
        ChunkRecord record = ChunkRecord.from(chunk, nextCreatedAt());
        collection.put(record);
        index.put(record.id(), chunk.embedding());
        log.debug("Stored record '{}' from {}", record.id(), record.sourceReference());
        return record;
    }

    /**
     * Validates every chunk independently and stores the accepted ones.
     */
    BatchResult insertAll(List<EmbeddedChunk> chunks) {
        if (chunks.isEmpty()) {
            return BatchResult.empty();
        }

        List<BatchResult.Rejection> rejected = new ArrayList<>();
        // keyed by id so that a later duplicate in the batch replaces an earlier one
        Map<String, EmbeddedChunk> accepted = new LinkedHashMap<>();
        Set<String> seen = new HashSet<>();

        for (EmbeddedChunk chunk : chunks) {
            try {
                validator.validate(chunk);
                if (duplicatePolicy == DuplicatePolicy.REJECT
                    && (collection.contains(chunk.id()) || !seen.add(chunk.id()))) {
                    throw new DuplicateIdentifierException(chunk.id());
                }
                accepted.remove(chunk.id());
                accepted.put(chunk.id(), chunk);
            } catch (ValidationException e) {
                log.warn("Rejected record '{}': {}", chunk.id(), e.getMessage());
                rejected.add(new BatchResult.Rejection(chunk.id(), e));
            }
        }

        List<ChunkRecord> group = new ArrayList<>(Math.min(flushSize, accepted.size()));
        int inserted = 0;
        for (EmbeddedChunk chunk : accepted.values()) {
            group.add(ChunkRecord.from(chunk, nextCreatedAt()));
            if (group.size() == flushSize) {
                inserted += flush(group);
            }
        }
        inserted += flush(group);

        log.info("Batch stored {} of {} records ({} rejected)", inserted, chunks.size(), rejected.size());
        return new BatchResult(inserted, rejected);
    }

    private int flush(List<ChunkRecord> group) {
        if (group.isEmpty()) {
            return 0;
        }
        collection.putAll(group);
        for (ChunkRecord record : group) {
            index.put(record.id(), record.embedding());
        }
        int written = group.size();
        group.clear();
        return written;
    }

    /**
     * Insertion times never go backwards, even when the wall clock does.
     */
    private Instant nextCreatedAt() {
        Instant now = clock.instant();
        if (lastCreatedAt != null && now.isBefore(lastCreatedAt)) {
            now = lastCreatedAt;
        }
        lastCreatedAt = now;
        return now;
    }
}
