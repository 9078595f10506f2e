package io.research.vectors;

import java.nio.file.Path;

/**
 * Exception thrown when a storage file was written with an unknown format version.
 */
public class UnsupportedFormatException extends CorruptCollectionException {

    private final int version;

    public UnsupportedFormatException(Path file, int version) {
        super(file, String.format("unsupported format version: %d", version));
        this.version = version;
    }

    public int getVersion() {
        return version;
    }
}
