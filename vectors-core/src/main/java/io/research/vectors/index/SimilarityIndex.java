package io.research.vectors.index;

import io.research.vectors.CollectionConfig;

import java.util.Comparator;
import java.util.List;
import java.util.function.Predicate;

/**
 * Nearest-neighbour structure over the live vectors of a collection.
 *
 * <p>Implementations score with the collection's {@link io.research.vectors.ScoreMapping}
 * and order results by {@link #RANKING}: score descending, ties by ascending id.</p>
 */
public interface SimilarityIndex {

    Comparator<ScoredId> RANKING = Comparator.comparingDouble(ScoredId::score).reversed()
        .thenComparing(ScoredId::id);

    static SimilarityIndex create(CollectionConfig config) {
        return switch (config.searchMode()) {
            case EXACT -> new ExactSimilarityIndex(config.scoreMapping());
            case HNSW -> new HnswSimilarityIndex(config);
        };
    }

    /**
     * Inserts a vector, replacing any vector stored under the same id.
     */
    void put(String id, float[] vector);

    void remove(String id);

    void clear();

    int size();

    /**
     * Returns at most {@code topK} ids accepted by {@code candidateFilter}, best first.
     */
    List<ScoredId> search(float[] query, int topK, Predicate<String> candidateFilter);
}
