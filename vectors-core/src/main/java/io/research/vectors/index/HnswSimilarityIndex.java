package io.research.vectors.index;

import com.github.jelmerk.hnswlib.core.DistanceFunctions;
import com.github.jelmerk.hnswlib.core.Item;
import com.github.jelmerk.hnswlib.core.SearchResult;
import com.github.jelmerk.hnswlib.core.hnsw.HnswIndex;
import io.research.vectors.CollectionConfig;
import io.research.vectors.ScoreMapping;
import io.research.vectors.storage.FileReplacement;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedInputStream;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.Serializable;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.function.Predicate;

/**
 * Approximate index on a Hierarchical Navigable Small World graph (hnswlib).
 *
 * <p>Candidates come from the graph, are re-scored with exact cosine similarity and
 * ordered by {@link SimilarityIndex#RANKING}. Recall is high but not guaranteed, so
 * this index is opt-in through {@link io.research.vectors.SearchMode#HNSW}.</p>
 *
 * <p>Zero-length vectors have no direction and are kept outside the graph; they take
 * part in every query with cosine 0.</p>
 */
public class HnswSimilarityIndex implements SimilarityIndex {

    private static final Logger log = LoggerFactory.getLogger(HnswSimilarityIndex.class);

    public static final String FILE_NAME = "similarity.hnsw";

    // Format constants
    private static final byte[] MAGIC = "RHNS".getBytes(StandardCharsets.US_ASCII);
    private static final short FORMAT_VERSION = 1;

    private final int dimensions;
    private final int m;
    private final int efConstruction;
    private final int ef;
    private final ScoreMapping scoreMapping;

    private HnswIndex<String, float[], ChunkVectorItem, Float> graph;
    private final Set<String> graphIds = new HashSet<>();
    private final Set<String> zeroVectorIds = new LinkedHashSet<>();
    private int capacity;
    private int slotsUsed;

    public HnswSimilarityIndex(CollectionConfig config) {
        this.dimensions = config.dimensions();
        this.m = config.hnswM();
        this.efConstruction = config.hnswEfConstruction();
        this.ef = config.hnswEfSearch();
        this.scoreMapping = config.scoreMapping();
        this.capacity = config.hnswMaxItems();
        this.graph = newGraph(capacity);

        log.info("Created HNSW index: dims={}, maxItems={}", dimensions, capacity);
    }

    private HnswIndex<String, float[], ChunkVectorItem, Float> newGraph(int maxItems) {
        return HnswIndex.newBuilder(dimensions, DistanceFunctions.FLOAT_COSINE_DISTANCE, maxItems)
            .withM(m)
            .withEfConstruction(efConstruction)
            .withEf(ef)
            .withRemoveEnabled()
            .build();
    }

    // ==================== Modification ====================

    @Override
    public void put(String id, float[] vector) {
        remove(id);
        if (VectorMath.norm(vector) == 0) {
            zeroVectorIds.add(id);
            return;
        }
        // removed nodes may keep their slot, so count every insertion against capacity
        if (slotsUsed >= capacity) {
            rebuild(Math.max(capacity * 2, graphIds.size() * 2 + 1));
        }
        graph.add(new ChunkVectorItem(id, vector.clone()));
        graphIds.add(id);
        slotsUsed++;
    }

    @Override
    public void remove(String id) {
        if (zeroVectorIds.remove(id)) {
            return;
        }
        if (graphIds.remove(id)) {
            graph.remove(id, 0);
        }
    }

    @Override
    public void clear() {
        graph = newGraph(capacity);
        graphIds.clear();
        zeroVectorIds.clear();
        slotsUsed = 0;
    }

    @Override
    public int size() {
        return graphIds.size() + zeroVectorIds.size();
    }

    private void rebuild(int newCapacity) {
        HnswIndex<String, float[], ChunkVectorItem, Float> rebuilt = newGraph(newCapacity);
        List<ChunkVectorItem> items = new ArrayList<>(graphIds.size());
        for (String id : graphIds) {
            graph.get(id).ifPresent(items::add);
        }
        try {
            rebuilt.addAll(items);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while rebuilding HNSW index", e);
        }
        log.info("Rebuilt HNSW index: {} items, capacity {} -> {}", graphIds.size(), capacity, newCapacity);
        graph = rebuilt;
        capacity = newCapacity;
        slotsUsed = graphIds.size();
    }

    // ==================== Search ====================

    @Override
    public List<ScoredId> search(float[] query, int topK, Predicate<String> candidateFilter) {
        if (size() == 0) {
            return List.of();
        }
        double queryNorm = VectorMath.norm(query);
        List<ScoredId> candidates = new ArrayList<>();

        if (!graphIds.isEmpty() && queryNorm > 0) {
            // widen the search until enough candidates survive the filter
            int k = Math.min(graphIds.size(), Math.max(topK, ef));
            while (true) {
                candidates.clear();
                List<SearchResult<ChunkVectorItem, Float>> nearest = graph.findNearest(query, k);
                for (SearchResult<ChunkVectorItem, Float> result : nearest) {
                    ChunkVectorItem item = result.item();
                    if (candidateFilter.test(item.id())) {
                        double cosine = VectorMath.cosine(query, queryNorm, item.vector(), VectorMath.norm(item.vector()));
                        candidates.add(new ScoredId(item.id(), scoreMapping.toScore(cosine)));
                    }
                }
                if (candidates.size() >= topK || k >= graphIds.size()) {
                    break;
                }
                k = Math.min(graphIds.size(), k * 4);
            }
        } else {
            // a zero query has cosine 0 with everything
            for (String id : graphIds) {
                if (candidateFilter.test(id)) {
                    candidates.add(new ScoredId(id, scoreMapping.toScore(0)));
                }
            }
        }

        for (String id : zeroVectorIds) {
            if (candidateFilter.test(id)) {
                candidates.add(new ScoredId(id, scoreMapping.toScore(0)));
            }
        }

        candidates.sort(RANKING);
        return candidates.size() > topK ? new ArrayList<>(candidates.subList(0, topK)) : candidates;
    }

    // ==================== Persistence ====================

    /**
     * Writes the graph to {@code file}, stamped with the record log length it reflects.
     */
    public void save(Path file, long logStamp) throws IOException {
        FileReplacement.replace(file, os -> {
            DataOutputStream dos = new DataOutputStream(os);

            // Write header
            dos.write(MAGIC);
            dos.writeShort(FORMAT_VERSION);
            dos.writeLong(logStamp);
            dos.writeInt(dimensions);
            dos.writeInt(capacity);
            dos.writeInt(slotsUsed);

            dos.writeInt(zeroVectorIds.size());
            for (String id : zeroVectorIds) {
                dos.writeUTF(id);
            }

            // Write HNSW graph
            ByteArrayOutputStream graphBytes = new ByteArrayOutputStream();
            graph.save(graphBytes);
            byte[] graphData = graphBytes.toByteArray();
            dos.writeInt(graphData.length);
            dos.write(graphData);
            dos.flush();
        });
        log.info("Saved HNSW index: {} items, {} bytes graph data", size(), Files.size(file));
    }

    /**
     * Loads a snapshot written by {@link #save}, provided it reflects exactly the given
     * log length and live ids. Returns empty for a missing, stale or unreadable snapshot.
     */
    public static Optional<HnswSimilarityIndex> load(Path file, long logStamp, CollectionConfig config,
                                                     Collection<String> liveIds) {
        if (!Files.exists(file)) {
            return Optional.empty();
        }
        try (InputStream is = new BufferedInputStream(Files.newInputStream(file))) {
            DataInputStream dis = new DataInputStream(is);

            byte[] magic = new byte[MAGIC.length];
            dis.readFully(magic);
            if (!Arrays.equals(magic, MAGIC) || dis.readShort() != FORMAT_VERSION) {
                log.warn("Ignoring HNSW snapshot {}: unknown format", file);
                return Optional.empty();
            }
            long stamp = dis.readLong();
            int storedDimensions = dis.readInt();
            if (stamp != logStamp || storedDimensions != config.dimensions()) {
                log.info("HNSW snapshot {} is stale (stamp {} vs log {}), rebuilding", file, stamp, logStamp);
                return Optional.empty();
            }
            int capacity = dis.readInt();
            int slotsUsed = dis.readInt();

            int zeroCount = dis.readInt();
            Set<String> zeroIds = new LinkedHashSet<>();
            for (int i = 0; i < zeroCount; i++) {
                zeroIds.add(dis.readUTF());
            }

            int graphLength = dis.readInt();
            byte[] graphData = new byte[graphLength];
            dis.readFully(graphData);
            HnswIndex<String, float[], ChunkVectorItem, Float> graph = HnswIndex.load(new ByteArrayInputStream(graphData));

            HnswSimilarityIndex index = new HnswSimilarityIndex(config);
            index.graph = graph;
            index.capacity = capacity;
            index.slotsUsed = slotsUsed;
            index.zeroVectorIds.addAll(zeroIds);
            for (String id : liveIds) {
                if (!zeroIds.contains(id)) {
                    index.graphIds.add(id);
                }
            }
            if (graph.size() != index.graphIds.size()
                || index.graphIds.stream().anyMatch(id -> graph.get(id).isEmpty())) {
                log.warn("HNSW snapshot {} does not match the stored records, rebuilding", file);
                return Optional.empty();
            }

            log.info("Loaded HNSW index: {} items", index.size());
            return Optional.of(index);
        } catch (IOException | RuntimeException e) {
            log.warn("Ignoring unreadable HNSW snapshot {}: {}", file, e.toString());
            return Optional.empty();
        }
    }

    // ==================== HNSW Item Implementation ====================

    /**
     * Item wrapper for HNSW index.
     */
    static final class ChunkVectorItem implements Item<String, float[]>, Serializable {
        private static final long serialVersionUID = 1L;

        private final String id;
        private final float[] vector;

        ChunkVectorItem(String id, float[] vector) {
            this.id = id;
            this.vector = vector;
        }

        @Override
        public String id() {
            return id;
        }

        @Override
        public float[] vector() {
            return vector;
        }

        @Override
        public int dimensions() {
            return vector.length;
        }
    }
}
