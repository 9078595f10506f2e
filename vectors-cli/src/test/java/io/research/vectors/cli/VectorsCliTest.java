package io.research.vectors.cli;

import io.research.vectors.ChunkRecord;
import io.research.vectors.VectorStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class VectorsCliTest {

    @TempDir
    Path tempDir;

    private Path root;
    private StringWriter out;
    private StringWriter err;

    @BeforeEach
    void setUp() throws IOException {
        root = tempDir.resolve("store");
        Path input = tempDir.resolve("chunks.jsonl");
        Files.write(input, List.of(
            "{\"id\":\"a\",\"text\":\"alpha chunk\",\"source\":\"https://ok.example/a\",\"metadata\":{\"page\":1},\"embedding\":[1,0,0,0],\"model\":\"m1\"}",
            "{\"id\":\"b\",\"text\":\"beta chunk\",\"source\":\"https://blocked.example/b\",\"embedding\":[0,1,0,0],\"model\":\"m1\"}",
            "",
            "{\"id\":\"c\",\"text\":\"gamma chunk\",\"sourceReference\":\"https://blocked.example/c\",\"embedding\":[0,0,1,0]}"
        ));
        assertEquals(0, run("import", root.toString(), input.toString()));
        assertTrue(out.toString().contains("Imported 3 records"));
    }

    @Test
    void testImportReportsRejectedAndUnreadableLines() throws IOException {
        Path input = tempDir.resolve("bad.jsonl");
        Files.write(input, List.of(
            "{\"id\":\"d\",\"text\":\"delta\",\"embedding\":[0,0,0,1]}",
            "{\"id\":\"e\",\"text\":\"wrong size\",\"embedding\":[0,0,1]}",
            "{not json",
            "{\"id\":\"f\",\"text\":\"no embedding\"}"
        ));

        assertEquals(2, run("import", root.toString(), input.toString()));
        assertTrue(out.toString().contains("Imported 1 records (1 rejected, 2 unreadable)"));
        assertTrue(err.toString().contains("Rejected e"));

        try (VectorStore store = VectorStore.openExisting(root)) {
            assertEquals(4, store.size());
        }
    }

    @Test
    void testImportAcceptsSnakeCaseFieldNames() throws IOException {
        Path input = tempDir.resolve("producer.jsonl");
        Files.write(input, List.of(
            "{\"id\":\"p\",\"text\":\"producer chunk\",\"source_reference\":\"https://producer.example/p\","
                + "\"embedding\":[0,0,0,1],\"embedding_model_id\":\"all-MiniLM-L6-v2\"}"
        ));

        assertEquals(0, run("import", root.toString(), input.toString()));

        try (VectorStore store = VectorStore.openExisting(root)) {
            ChunkRecord record = store.get("p").orElseThrow();
            assertEquals("all-MiniLM-L6-v2", record.embeddingModelId());
            assertEquals("https://producer.example/p", record.sourceReference());
        }
    }

    @Test
    void testSearchByVector() {
        assertEquals(0, run("search", root.toString(), "--vector", "1,0,0,0", "-n", "2"));

        String output = out.toString();
        assertTrue(output.contains("Found 2 results"));
        assertTrue(output.contains("#1 [100.0%] a"));
    }

    @Test
    void testSearchByVectorWithSourceFilter() {
        assertEquals(0, run("search", root.toString(), "--vector", "1,0,0,0", "--source-contains", "blocked"));

        String output = out.toString();
        assertTrue(output.contains("Found 2 results"));
        assertFalse(output.contains("] a"));
    }

    @Test
    void testSearchByTextWithHashingModel() {
        assertEquals(0, run("search", root.toString(), "--text", "alpha", "--model", "hashing-4"));
        assertTrue(out.toString().contains("Found 3 results"));
    }

    @Test
    void testSearchRequiresQuery() {
        assertNotEquals(0, run("search", root.toString()));
    }

    @Test
    void testGetListSourcesStats() {
        assertEquals(0, run("get", root.toString(), "a"));
        assertTrue(out.toString().contains("Source: https://ok.example/a"));
        assertTrue(out.toString().contains("page: 1"));

        assertEquals(1, run("get", root.toString(), "missing"));

        assertEquals(0, run("list", root.toString()));
        assertEquals(3, out.toString().lines().count());

        assertEquals(0, run("sources", root.toString()));
        assertEquals(List.of("https://blocked.example/b", "https://blocked.example/c", "https://ok.example/a"),
            out.toString().lines().toList());

        assertEquals(0, run("stats", root.toString()));
        assertTrue(out.toString().contains("Total chunks: 3"));
        assertTrue(out.toString().contains("Dimensions: 4"));
    }

    @Test
    void testHealth() {
        assertEquals(0, run("health", root.toString()));
        assertTrue(out.toString().contains("Status: healthy"));
        assertTrue(out.toString().contains("Chunks: 3"));

        assertEquals(1, run("health", tempDir.resolve("nowhere").toString()));
        assertTrue(err.toString().startsWith("Error:"));
    }

    @Test
    void testPurgeAndDelete() {
        assertEquals(0, run("purge", root.toString(), "--source-contains", "blocked.example"));
        assertTrue(out.toString().contains("Deleted 2 chunks"));

        assertEquals(0, run("delete", root.toString(), "a", "zzz"));
        assertTrue(out.toString().contains("Deleted 1 of 2 chunks"));

        try (VectorStore store = VectorStore.openExisting(root)) {
            assertTrue(store.isEmpty());
        }
    }

    @Test
    void testCompact() {
        assertEquals(0, run("delete", root.toString(), "b"));
        assertEquals(0, run("compact", root.toString()));
        assertTrue(out.toString().startsWith("Compacted"));
    }

    @Test
    void testMissingStoreIsReportedAsError() {
        assertEquals(1, run("stats", tempDir.resolve("nowhere").toString()));
        assertTrue(err.toString().startsWith("Error:"));
    }

    private int run(String... args) {
        out = new StringWriter();
        err = new StringWriter();
        CommandLine commandLine = VectorsCli.commandLine();
        commandLine.setOut(new PrintWriter(out, true));
        commandLine.setErr(new PrintWriter(err, true));
        return commandLine.execute(args);
    }
}
