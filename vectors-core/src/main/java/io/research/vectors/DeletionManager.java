package io.research.vectors;

import io.research.vectors.index.SimilarityIndex;
import io.research.vectors.storage.PersistentCollection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;

/**
 * Removes records from the collection and the similarity index together.
 *
 * <p>Deleting an absent id is not an error. Every multi-record deletion is a single
 * append and flush.</p>
 */
final class DeletionManager {

    private static final Logger log = LoggerFactory.getLogger(DeletionManager.class);

    private final PersistentCollection collection;
    private final SimilarityIndex index;

    DeletionManager(PersistentCollection collection, SimilarityIndex index) {
        this.collection = collection;
        this.index = index;
    }

    boolean delete(String id) {
        if (id == null) {
            return false;
        }
        boolean removed = collection.remove(id);
        if (removed) {
            index.remove(id);
            log.debug("Deleted record '{}'", id);
        }
        return removed;
    }

    /**
     * @return exact number of records removed, 0 when nothing matches
     */
    int deleteWhere(RecordFilter filter) {
        Objects.requireNonNull(filter, "filter cannot be null");
        List<String> matching = collection.all()
            .filter(filter::matches)
            .map(ChunkRecord::id)
            .toList();
        int removed = collection.removeAll(matching);
        matching.forEach(index::remove);
        log.info("Deleted {} records matching {}", removed, filter);
        return removed;
    }

    int deleteBySource(String sourceReference) {
        return deleteWhere(RecordFilter.sourceEquals(sourceReference));
    }

    int clear() {
        int removed = collection.clear();
        index.clear();
        return removed;
    }
}
