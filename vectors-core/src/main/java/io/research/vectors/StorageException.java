package io.research.vectors;

import java.io.IOException;

/**
 * Underlying I/O failure of the storage root. Never retried by the store.
 */
public class StorageException extends VectorStoreException {

    public StorageException(String message) {
        super(message);
    }

    public StorageException(String message, IOException cause) {
        super(message, cause);
    }
}
