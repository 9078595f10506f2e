package io.research.vectors;

/**
 * Thrown for malformed call arguments such as a non-positive {@code topK}.
 */
public class InvalidArgumentException extends VectorStoreException {

    public InvalidArgumentException(String message) {
        super(message);
    }
}
