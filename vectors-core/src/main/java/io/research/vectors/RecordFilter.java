package io.research.vectors;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Predicate over stored records, used by filtered search and predicate deletion.
 *
 * <p>Filters are a fixed set of value types so they can be logged, compared and
 * composed. Build them through the static factories.</p>
 *
 * <pre>{@code
 * store.deleteWhere(RecordFilter.sourceContains("blocked.example"));
 * store.searchByVector(query, 5, RecordFilter.and(
 *     RecordFilter.metadataEquals("topic", "AI"),
 *     RecordFilter.not(RecordFilter.sourceContains("archive"))));
 * }</pre>
 */
public interface RecordFilter {

    boolean matches(ChunkRecord record);

    static RecordFilter all() {
        return All.INSTANCE;
    }

    static RecordFilter idEquals(String id) {
        return new IdEquals(id);
    }

    static RecordFilter sourceEquals(String sourceReference) {
        return new SourceEquals(sourceReference);
    }

    static RecordFilter sourceContains(String fragment) {
        return new SourceContains(fragment);
    }

    static RecordFilter sourceMatches(String regex) {
        return new SourceMatches(Pattern.compile(regex));
    }

    static RecordFilter metadataEquals(String key, Object value) {
        Object normalized = EmbeddedChunk.copyMetadata(Map.of(key, value)).get(key);
        return new MetadataEquals(key, normalized);
    }

    static RecordFilter metadataContains(String key, String fragment) {
        return new MetadataContains(key, fragment);
    }

    static RecordFilter hasMetadata(String key) {
        return new HasMetadata(key);
    }

    static RecordFilter modelEquals(String embeddingModelId) {
        return new ModelEquals(embeddingModelId);
    }

    static RecordFilter and(RecordFilter... filters) {
        return new And(List.of(filters));
    }

    static RecordFilter or(RecordFilter... filters) {
        return new Or(List.of(filters));
    }

    static RecordFilter not(RecordFilter filter) {
        return new Not(filter);
    }

    // ==================== Variants ====================

    enum All implements RecordFilter {
        INSTANCE;

        @Override
        public boolean matches(ChunkRecord record) {
            return true;
        }
    }

    record IdEquals(String id) implements RecordFilter {
        public IdEquals {
            Objects.requireNonNull(id, "id cannot be null");
        }

        @Override
        public boolean matches(ChunkRecord record) {
            return record.id().equals(id);
        }
    }

    record SourceEquals(String sourceReference) implements RecordFilter {
        public SourceEquals {
            Objects.requireNonNull(sourceReference, "sourceReference cannot be null");
        }

        @Override
        public boolean matches(ChunkRecord record) {
            return record.sourceReference().equals(sourceReference);
        }
    }

    record SourceContains(String fragment) implements RecordFilter {
        public SourceContains {
            Objects.requireNonNull(fragment, "fragment cannot be null");
        }

        @Override
        public boolean matches(ChunkRecord record) {
            return record.sourceReference().contains(fragment);
        }
    }

    record SourceMatches(Pattern pattern) implements RecordFilter {
        public SourceMatches {
            Objects.requireNonNull(pattern, "pattern cannot be null");
        }

        @Override
        public boolean matches(ChunkRecord record) {
            return pattern.matcher(record.sourceReference()).find();
        }

        // Pattern has identity equality
        @Override
        public boolean equals(Object o) {
            return o instanceof SourceMatches other && pattern.pattern().equals(other.pattern.pattern());
        }

        @Override
        public int hashCode() {
            return pattern.pattern().hashCode();
        }
    }

    record MetadataEquals(String key, Object value) implements RecordFilter {
        public MetadataEquals {
            Objects.requireNonNull(key, "key cannot be null");
            Objects.requireNonNull(value, "value cannot be null");
        }

        @Override
        public boolean matches(ChunkRecord record) {
            return value.equals(record.metadataValue(key));
        }
    }

    record MetadataContains(String key, String fragment) implements RecordFilter {
        public MetadataContains {
            Objects.requireNonNull(key, "key cannot be null");
            Objects.requireNonNull(fragment, "fragment cannot be null");
        }

        @Override
        public boolean matches(ChunkRecord record) {
            Object value = record.metadataValue(key);
            return value != null && String.valueOf(value).contains(fragment);
        }
    }

    record HasMetadata(String key) implements RecordFilter {
        public HasMetadata {
            Objects.requireNonNull(key, "key cannot be null");
        }

        @Override
        public boolean matches(ChunkRecord record) {
            return record.metadata().containsKey(key);
        }
    }

    record ModelEquals(String embeddingModelId) implements RecordFilter {
        public ModelEquals {
            Objects.requireNonNull(embeddingModelId, "embeddingModelId cannot be null");
        }

        @Override
        public boolean matches(ChunkRecord record) {
            return record.embeddingModelId().equals(embeddingModelId);
        }
    }

    record And(List<RecordFilter> filters) implements RecordFilter {
        public And {
            filters = List.copyOf(filters);
        }

        @Override
        public boolean matches(ChunkRecord record) {
            for (RecordFilter filter : filters) {
                if (!filter.matches(record)) return false;
            }
            return true;
        }
    }

    record Or(List<RecordFilter> filters) implements RecordFilter {
        public Or {
            filters = List.copyOf(filters);
        }

        @Override
        public boolean matches(ChunkRecord record) {
            for (RecordFilter filter : filters) {
                if (filter.matches(record)) return true;
            }
            return false;
        }
    }

    record Not(RecordFilter filter) implements RecordFilter {
        public Not {
            Objects.requireNonNull(filter, "filter cannot be null");
        }

        @Override
        public boolean matches(ChunkRecord record) {
            return !filter.matches(record);
        }
    }
}
