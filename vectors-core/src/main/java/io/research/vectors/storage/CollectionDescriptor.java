package io.research.vectors.storage;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import io.research.vectors.CorruptCollectionException;
import io.research.vectors.UnsupportedFormatException;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;

/**
 * Fixed properties of a collection, written once to {@code collection.json} at creation.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record CollectionDescriptor(
    /** Layout version of the storage root */
    int formatVersion,

    /** Collection name */
    String name,

    /** Embedding dimension, fixed for the collection's lifetime */
    int dimensions,

    /** Creation time, ISO-8601 */
    String createdAt
) {
    public static final String FILE_NAME = "collection.json";
    static final int FORMAT_VERSION = 1;

    private static final ObjectMapper MAPPER = new ObjectMapper()
        .enable(SerializationFeature.INDENT_OUTPUT);

    public static CollectionDescriptor create(String name, int dimensions) {
        return new CollectionDescriptor(FORMAT_VERSION, name, dimensions, Instant.now().toString());
    }

    static CollectionDescriptor read(Path file) throws IOException {
        CollectionDescriptor descriptor;
        try {
            descriptor = MAPPER.readValue(file.toFile(), CollectionDescriptor.class);
        } catch (JsonProcessingException e) {
            throw new CorruptCollectionException(file, "unreadable descriptor: " + e.getOriginalMessage());
        }
        if (descriptor.formatVersion() != FORMAT_VERSION) {
            throw new UnsupportedFormatException(file, descriptor.formatVersion());
        }
        if (descriptor.dimensions() <= 0) {
            throw new CorruptCollectionException(file, "invalid dimensions " + descriptor.dimensions());
        }
        return descriptor;
    }

    void write(Path file) throws IOException {
        Path tmp = file.resolveSibling(file.getFileName() + ".tmp");
        Files.write(tmp, MAPPER.writeValueAsBytes(this));
        FileReplacement.moveAtomically(tmp, file);
    }
}
