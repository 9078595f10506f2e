package io.research.vectors;

import java.nio.file.Path;

/**
 * Thrown when an operation is attempted on a closed store.
 */
public class NotOpenException extends VectorStoreException {

    private final Path root;

    public NotOpenException(Path root) {
        super(String.format("Vector store at %s is not open", root));
        this.root = root;
    }

    public Path getRoot() {
        return root;
    }
}
