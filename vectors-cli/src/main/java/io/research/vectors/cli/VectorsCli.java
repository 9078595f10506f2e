package io.research.vectors.cli;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.research.vectors.BatchResult;
import io.research.vectors.ChunkRecord;
import io.research.vectors.CollectionConfig;
import io.research.vectors.CollectionStats;
import io.research.vectors.DuplicatePolicy;
import io.research.vectors.EmbeddedChunk;
import io.research.vectors.HealthStatus;
import io.research.vectors.RecordFilter;
import io.research.vectors.SearchMode;
import io.research.vectors.SearchResult;
import io.research.vectors.VectorStore;
import io.research.vectors.VectorStoreException;
import io.research.vectors.embeddings.EmbeddingConfig;
import io.research.vectors.embeddings.EmbeddingModel;
import io.research.vectors.storage.CollectionDescriptor;
import io.research.vectors.storage.PersistentCollection;
import picocli.CommandLine;
import picocli.CommandLine.ArgGroup;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.BufferedReader;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Callable;

/**
 * Command-line interface for administering a vector store root.
 */
@Command(
    name = "vectors",
    mixinStandardHelpOptions = true,
    version = "research-vectors 1.0.0",
    description = "Store, search and maintain text chunk embeddings",
    subcommands = {
        VectorsCli.ImportCommand.class,
        VectorsCli.SearchCommand.class,
        VectorsCli.GetCommand.class,
        VectorsCli.ListCommand.class,
        VectorsCli.SourcesCommand.class,
        VectorsCli.StatsCommand.class,
        VectorsCli.HealthCommand.class,
        VectorsCli.DeleteCommand.class,
        VectorsCli.PurgeCommand.class,
        VectorsCli.CompactCommand.class
    }
)
public class VectorsCli implements Callable<Integer> {

    @Spec
    CommandSpec spec;

    public static void main(String[] args) {
        int exitCode = commandLine().execute(args);
        System.exit(exitCode);
    }

    /**
     * Builds the command line with store errors reported as one-line messages.
     */
    static CommandLine commandLine() {
        CommandLine commandLine = new CommandLine(new VectorsCli());
        commandLine.setExecutionExceptionHandler((e, cmd, parseResult) -> {
            if (e instanceof VectorStoreException || e instanceof IllegalArgumentException) {
                cmd.getErr().println("Error: " + e.getMessage());
                return 1;
            }
            throw e;
        });
        return commandLine;
    }

    @Override
    public Integer call() {
        spec.commandLine().usage(spec.commandLine().getOut());
        return 0;
    }

    /**
     * Import embedded chunks from a JSON Lines file.
     */
    @Command(
        name = "import",
        description = "Add embedded chunks from a JSON Lines file (one object per line)"
    )
    static class ImportCommand implements Callable<Integer> {

        @Spec
        CommandSpec spec;

        @Parameters(index = "0", description = "Storage root directory")
        private Path root;

        @Parameters(index = "1", description = "JSON Lines file with id, text, source, metadata, embedding, model")
        private Path input;

        @Option(names = {"-d", "--dimensions"}, description = "Dimension of a new collection (default: first record)")
        private Integer dimensions;

        @Option(names = {"--name"}, description = "Name of a new collection", defaultValue = CollectionConfig.DEFAULT_NAME)
        private String name;

        @Option(names = {"--reject-duplicates"}, description = "Refuse ids that are already stored instead of replacing them")
        private boolean rejectDuplicates;

        @Option(names = {"--batch-size"}, description = "Records per batch", defaultValue = "1000")
        private int batchSize;

        @Override
        public Integer call() throws Exception {
            PrintWriter out = spec.commandLine().getOut();
            List<EmbeddedChunk> chunks = new ArrayList<>();
            int unreadable = 0;

            try (BufferedReader reader = Files.newBufferedReader(input, StandardCharsets.UTF_8)) {
                String line;
                int lineNumber = 0;
                while ((line = reader.readLine()) != null) {
                    lineNumber++;
                    if (line.isBlank()) {
                        continue;
                    }
                    try {
                        chunks.add(JSON.readValue(line, ImportedChunk.class).toEmbeddedChunk());
                    } catch (JsonProcessingException | IllegalArgumentException e) {
                        spec.commandLine().getErr().printf("Line %d: unreadable record: %s%n", lineNumber,
                            e instanceof JsonProcessingException jpe ? jpe.getOriginalMessage() : e.getMessage());
                        unreadable++;
                    }
                }
            }

            if (chunks.isEmpty()) {
                out.println("No records to import");
                return unreadable > 0 ? 1 : 0;
            }

            int dims;
            if (dimensions != null) {
                dims = dimensions;
            } else if (Files.exists(root.resolve(CollectionDescriptor.FILE_NAME))) {
                dims = PersistentCollection.readDescriptor(root).dimensions();
            } else {
                dims = chunks.get(0).dimensions();
            }
            CollectionConfig config = CollectionConfig.forDimensions(dims)
                .withName(name)
                .withDuplicatePolicy(rejectDuplicates ? DuplicatePolicy.REJECT : DuplicatePolicy.UPSERT);

            int inserted = 0;
            int rejected = 0;
            try (VectorStore store = VectorStore.open(root, config)) {
                for (int start = 0; start < chunks.size(); start += batchSize) {
                    List<EmbeddedChunk> batch = chunks.subList(start, Math.min(chunks.size(), start + batchSize));
                    BatchResult result = store.addBatch(batch);
                    inserted += result.inserted();
                    rejected += result.rejected().size();
                    for (BatchResult.Rejection rejection : result.rejected()) {
                        spec.commandLine().getErr().printf("Rejected %s: %s%n", rejection.id(), rejection.error().getMessage());
                    }
                }
                out.printf("Imported %d records (%d rejected, %d unreadable); collection now holds %d%n",
                    inserted, rejected, unreadable, store.size());
            }
            return rejected + unreadable > 0 ? 2 : 0;
        }
    }

    /**
     * Search the store by vector or by text.
     */
    @Command(
        name = "search",
        description = "Rank stored chunks by similarity to a query"
    )
    static class SearchCommand implements Callable<Integer> {

        @Spec
        CommandSpec spec;

        @Parameters(index = "0", description = "Storage root directory")
        private Path root;

        @ArgGroup(exclusive = true, multiplicity = "1")
        private Query query;

        static class Query {
            @Option(names = {"--vector"}, split = ",", description = "Query embedding, comma separated")
            private float[] vector;

            @Option(names = {"--text"}, description = "Query text, embedded with --model")
            private String text;
        }

        @Option(names = {"-n", "--top"}, description = "Number of results", defaultValue = "5")
        private int topK;

        @Option(names = {"-m", "--model"}, description = "Query embedding model for --text", defaultValue = "hashing-384")
        private String model;

        @Option(names = {"--source-contains"}, description = "Only rank chunks whose source contains this text")
        private String sourceContains;

        @Option(names = {"--show-text"}, description = "Show chunk text", defaultValue = "true")
        private boolean showText;

        @Override
        public Integer call() throws Exception {
            PrintWriter out = spec.commandLine().getOut();
            RecordFilter filter = sourceContains != null ? RecordFilter.sourceContains(sourceContains) : RecordFilter.all();

            try (VectorStore store = VectorStore.openExisting(root)) {
                List<SearchResult> results;
                if (query.vector != null) {
                    results = store.searchByVector(query.vector, topK, filter);
                } else {
                    EmbeddingConfig config = EmbeddingConfig.defaults().withDimensions(store.getDimensions());
                    try (EmbeddingModel embeddingModel = EmbeddingModel.load(model, config)) {
                        store.setQueryEmbedder(embeddingModel::embed);
                        out.println("Searching for: " + query.text);
                        results = store.searchByText(query.text, topK, filter);
                    }
                }

                out.println("Found " + results.size() + " results:");
                out.println("=".repeat(60));
                for (SearchResult result : results) {
                    printResult(out, result);
                }
            }
            return 0;
        }

        private void printResult(PrintWriter out, SearchResult result) {
            out.printf("#%d [%s] %s%n", result.rank(), result.scorePercent(), result.id());
            out.println("    Source: " + result.sourceReference());
            if (showText) {
                String text = result.text();
                out.println("    " + (text.length() > 200 ? text.substring(0, 197) + "..." : text));
            }
        }
    }

    /**
     * Show one stored record.
     */
    @Command(name = "get", description = "Show a stored chunk by id")
    static class GetCommand implements Callable<Integer> {

        @Spec
        CommandSpec spec;

        @Parameters(index = "0", description = "Storage root directory")
        private Path root;

        @Parameters(index = "1", description = "Chunk id")
        private String id;

        @Override
        public Integer call() throws Exception {
            PrintWriter out = spec.commandLine().getOut();
            try (VectorStore store = VectorStore.openExisting(root)) {
                Optional<ChunkRecord> found = store.get(id);
                if (found.isEmpty()) {
                    spec.commandLine().getErr().println("No chunk with id " + id);
                    return 1;
                }
                ChunkRecord record = found.get();
                out.println("Id: " + record.id());
                out.println("Source: " + record.sourceReference());
                out.println("Model: " + record.embeddingModelId());
                out.println("Created: " + record.createdAt());
                for (Map.Entry<String, Object> entry : record.metadata().entrySet()) {
                    out.println("  " + entry.getKey() + ": " + entry.getValue());
                }
                out.println(record.text());
            }
            return 0;
        }
    }

    @Command(name = "list", description = "List stored chunk ids in insertion order")
    static class ListCommand implements Callable<Integer> {

        @Spec
        CommandSpec spec;

        @Parameters(index = "0", description = "Storage root directory")
        private Path root;

        @Option(names = {"-l", "--limit"}, description = "Maximum number of chunks", defaultValue = "100")
        private int limit;

        @Override
        public Integer call() throws Exception {
            PrintWriter out = spec.commandLine().getOut();
            try (VectorStore store = VectorStore.openExisting(root)) {
                store.all().limit(limit).forEach(record ->
                    out.printf("%s\t%s\t%s%n", record.id(), record.sourceReference(), record.truncatedText(60)));
            }
            return 0;
        }
    }

    @Command(name = "sources", description = "List distinct source references")
    static class SourcesCommand implements Callable<Integer> {

        @Spec
        CommandSpec spec;

        @Parameters(index = "0", description = "Storage root directory")
        private Path root;

        @Override
        public Integer call() throws Exception {
            PrintWriter out = spec.commandLine().getOut();
            try (VectorStore store = VectorStore.openExisting(root)) {
                store.listSources().forEach(out::println);
            }
            return 0;
        }
    }

    /**
     * Show collection statistics.
     */
    @Command(name = "stats", description = "Display collection statistics")
    static class StatsCommand implements Callable<Integer> {

        @Spec
        CommandSpec spec;

        @Parameters(index = "0", description = "Storage root directory")
        private Path root;

        @Override
        public Integer call() throws Exception {
            PrintWriter out = spec.commandLine().getOut();
            try (VectorStore store = VectorStore.openExisting(root)) {
                CollectionStats stats = store.getStats();

                out.println("Vector Store Statistics");
                out.println("=".repeat(40));
                out.println("Collection: " + stats.name());
                out.println("Dimensions: " + stats.dimensions());
                out.println("Total chunks: " + stats.totalRecords());
                out.println("Unique sources: " + stats.uniqueSources());
                out.println("Embedding models: " + String.join(", ", stats.embeddingModels()));
                out.println("Total characters: " + stats.totalCharacters());
                out.printf("Average chunk length: %.2f%n", stats.averageTextLength());
                out.printf("Storage size: %.1f KB%n", stats.storageBytes() / 1024.0);
            }
            return 0;
        }
    }

    @Command(name = "health", description = "Check that a store opens and answers; exits 1 when unhealthy")
    static class HealthCommand implements Callable<Integer> {

        @Spec
        CommandSpec spec;

        @Parameters(index = "0", description = "Storage root directory")
        private Path root;

        @Override
        public Integer call() throws Exception {
            PrintWriter out = spec.commandLine().getOut();
            try (VectorStore store = VectorStore.openExisting(root)) {
                HealthStatus status = store.healthCheck();
                out.println("Status: " + (status.healthy() ? "healthy" : "unhealthy"));
                out.println("Collection: " + status.name());
                out.println("Root: " + status.root());
                out.println("Dimensions: " + status.dimensions());
                out.println("Chunks: " + status.size());
                out.println("Checked at: " + status.checkedAt());
                if (status.error() != null) {
                    out.println("Error: " + status.error());
                }
                return status.healthy() ? 0 : 1;
            }
        }
    }

    @Command(name = "delete", description = "Delete chunks by id")
    static class DeleteCommand implements Callable<Integer> {

        @Spec
        CommandSpec spec;

        @Parameters(index = "0", description = "Storage root directory")
        private Path root;

        @Parameters(index = "1..*", description = "Chunk ids")
        private List<String> ids;

        @Override
        public Integer call() throws Exception {
            int deleted = 0;
            try (VectorStore store = VectorStore.openExisting(root)) {
                for (String id : ids) {
                    if (store.delete(id)) {
                        deleted++;
                    }
                }
            }
            spec.commandLine().getOut().printf("Deleted %d of %d chunks%n", deleted, ids.size());
            return 0;
        }
    }

    /**
     * Delete every chunk from matching sources.
     */
    @Command(name = "purge", description = "Delete all chunks from matching sources")
    static class PurgeCommand implements Callable<Integer> {

        @Spec
        CommandSpec spec;

        @Parameters(index = "0", description = "Storage root directory")
        private Path root;

        @ArgGroup(exclusive = true, multiplicity = "1")
        private SourceSelector selector;

        static class SourceSelector {
            @Option(names = {"--source"}, description = "Exact source reference")
            private String source;

            @Option(names = {"--source-contains"}, description = "Text contained in the source reference")
            private String sourceContains;

            @Option(names = {"--all"}, description = "Delete every chunk")
            private boolean all;
        }

        @Override
        public Integer call() throws Exception {
            int deleted;
            try (VectorStore store = VectorStore.openExisting(root)) {
                if (selector.all) {
                    deleted = store.clear();
                } else if (selector.source != null) {
                    deleted = store.deleteBySource(selector.source);
                } else {
                    deleted = store.deleteWhere(RecordFilter.sourceContains(selector.sourceContains));
                }
            }
            spec.commandLine().getOut().printf("Deleted %d chunks%n", deleted);
            return 0;
        }
    }

    @Command(name = "compact", description = "Rewrite the record log without deleted or replaced records")
    static class CompactCommand implements Callable<Integer> {

        @Spec
        CommandSpec spec;

        @Parameters(index = "0", description = "Storage root directory")
        private Path root;

        @Option(names = {"--hnsw"}, description = "Also rebuild the HNSW snapshot")
        private boolean hnsw;

        @Override
        public Integer call() throws Exception {
            CollectionDescriptor descriptor = PersistentCollection.readDescriptor(root);
            CollectionConfig config = CollectionConfig.forDimensions(descriptor.dimensions()).withName(descriptor.name());
            if (hnsw) {
                config = config.withSearchMode(SearchMode.HNSW);
            }
            try (VectorStore store = VectorStore.open(root, config)) {
                long before = store.getStats().storageBytes();
                store.compact();
                long after = store.getStats().storageBytes();
                spec.commandLine().getOut().printf("Compacted %s: %d -> %d bytes%n", root, before, after);
            }
            return 0;
        }
    }

    // ==================== JSON Lines ====================

    private static final ObjectMapper JSON = new ObjectMapper()
        .enable(DeserializationFeature.USE_LONG_FOR_INTS);

    /**
     * One line of an import file, as written by an embedding producer.
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    record ImportedChunk(
        String id,
        String text,
        @JsonAlias({"source", "source_reference"}) String sourceReference,
        Map<String, Object> metadata,
        float[] embedding,
        @JsonAlias({"model", "embedding_model", "embedding_model_id"}) String embeddingModelId
    ) {
        EmbeddedChunk toEmbeddedChunk() {
            if (embedding == null) {
                throw new IllegalArgumentException("record " + id + " has no embedding");
            }
            Map<String, Object> scalars = new LinkedHashMap<>();
            if (metadata != null) {
                // JSON null carries no value
                metadata.forEach((key, value) -> {
                    if (value != null) {
                        scalars.put(key, value);
                    }
                });
            }
            return EmbeddedChunk.of(id, text, sourceReference, scalars, embedding, embeddingModelId);
        }
    }
}
