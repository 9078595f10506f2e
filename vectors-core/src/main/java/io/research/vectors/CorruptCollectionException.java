package io.research.vectors;

import java.nio.file.Path;

/**
 * Thrown when a storage root contains data that cannot be read back faithfully.
 */
public class CorruptCollectionException extends StorageException {

    private final Path file;

    public CorruptCollectionException(Path file, String detail) {
        super(String.format("Corrupt collection file %s: %s", file, detail));
        this.file = file;
    }

    public Path getFile() {
        return file;
    }
}
