package io.research.vectors.index;

import io.research.vectors.ScoreMapping;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.PriorityQueue;
import java.util.function.Predicate;

/**
 * Exhaustive-scan index: scores every stored vector against the query.
 *
 * <p>Keeps a bounded heap of the {@code topK} best candidates, so a query costs
 * O(n log k). This is the reference ranking for every other index.</p>
 */
public class ExactSimilarityIndex implements SimilarityIndex {

    private final ScoreMapping scoreMapping;
    private final Map<String, Entry> entries = new HashMap<>();

    public ExactSimilarityIndex(ScoreMapping scoreMapping) {
        this.scoreMapping = scoreMapping;
    }

    @Override
    public void put(String id, float[] vector) {
        float[] copy = vector.clone();
        entries.put(id, new Entry(copy, VectorMath.norm(copy)));
    }

    @Override
    public void remove(String id) {
        entries.remove(id);
    }

    @Override
    public void clear() {
        entries.clear();
    }

    @Override
    public int size() {
        return entries.size();
    }

    @Override
    public List<ScoredId> search(float[] query, int topK, Predicate<String> candidateFilter) {
        if (entries.isEmpty()) {
            return List.of();
        }
        double queryNorm = VectorMath.norm(query);

        // worst candidate at the head
        PriorityQueue<ScoredId> best = new PriorityQueue<>(Math.min(topK, entries.size()) + 1, RANKING.reversed());
        for (Map.Entry<String, Entry> e : entries.entrySet()) {
            if (!candidateFilter.test(e.getKey())) {
                continue;
            }
            Entry entry = e.getValue();
            double cosine = VectorMath.cosine(query, queryNorm, entry.vector(), entry.norm());
            ScoredId candidate = new ScoredId(e.getKey(), scoreMapping.toScore(cosine));
            if (best.size() < topK) {
                best.add(candidate);
            } else if (RANKING.compare(candidate, best.peek()) < 0) {
                best.poll();
                best.add(candidate);
            }
        }

        List<ScoredId> results = new ArrayList<>(best);
        results.sort(RANKING);
        return results;
    }

    private record Entry(float[] vector, double norm) {}
}
