package io.research.vectors;

/**
 * Thrown when an embedding contains NaN or an infinite value.
 */
public class InvalidEmbeddingValueException extends ValidationException {

    private final int position;
    private final float value;

    public InvalidEmbeddingValueException(String recordId, int position, float value) {
        super(recordId, String.format(
            "Embedding contains non-finite value %s at position %d", value, position
        ));
        this.position = position;
        this.value = value;
    }

    public int getPosition() {
        return position;
    }

    public float getValue() {
        return value;
    }
}
