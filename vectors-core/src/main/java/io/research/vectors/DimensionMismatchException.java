package io.research.vectors;

/**
 * Thrown when a vector's length differs from the collection's fixed dimension.
 */
public class DimensionMismatchException extends ValidationException {

    private final int expected;
    private final int actual;

    public DimensionMismatchException(int expected, int actual) {
        this(null, expected, actual);
    }

    public DimensionMismatchException(String recordId, int expected, int actual) {
        super(recordId, String.format(
            "Embedding dimension mismatch: expected %d, got %d", expected, actual
        ));
        this.expected = expected;
        this.actual = actual;
    }

    public int getExpected() {
        return expected;
    }

    public int getActual() {
        return actual;
    }
}
