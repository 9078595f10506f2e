package io.research.vectors;

/**
 * Structural checks applied to every record before it reaches storage, and to query vectors.
 *
 * <p>Validation is pure: it neither mutates its input nor consults stored state, so a
 * record is judged the same way whether it arrives alone or inside a batch. Duplicate
 * detection, which does depend on stored state, lives in {@link BatchCoordinator}.</p>
 */
public final class RecordValidator {

    private final int dimensions;
    private final boolean rejectEmptyText;

    public RecordValidator(int dimensions, boolean rejectEmptyText) {
        if (dimensions <= 0) throw new IllegalArgumentException("dimensions must be positive");
        this.dimensions = dimensions;
        this.rejectEmptyText = rejectEmptyText;
    }

    public static RecordValidator forConfig(CollectionConfig config) {
        return new RecordValidator(config.dimensions(), config.rejectEmptyText());
    }

    /**
     * Checks an inbound chunk.
     *
     * @throws InvalidIdentifierException if the id is null, empty, blank or holds control characters
     * @throws DimensionMismatchException if the embedding length is not the collection dimension
     * @throws InvalidEmbeddingValueException if an element is NaN or infinite
     * @throws EmptyTextException if the text is empty and empty text is refused
     */
    public void validate(EmbeddedChunk chunk) {
        String id = chunk.id();
        validateIdentifier(id);

        if (chunk.dimensions() != dimensions) {
            throw new DimensionMismatchException(id, dimensions, chunk.dimensions());
        }
        for (int i = 0; i < dimensions; i++) {
            float value = chunk.embeddingAt(i);
            if (!Float.isFinite(value)) {
                throw new InvalidEmbeddingValueException(id, i, value);
            }
        }

        if (rejectEmptyText && chunk.text().isEmpty()) {
            throw new EmptyTextException(id);
        }
    }

    /**
     * Checks a query vector and result count.
     */
    public void validateQuery(float[] queryVector, int topK) {
        validateTopK(topK);
        if (queryVector == null) {
            throw new InvalidArgumentException("query vector cannot be null");
        }
        if (queryVector.length != dimensions) {
            throw new DimensionMismatchException(dimensions, queryVector.length);
        }
        for (int i = 0; i < queryVector.length; i++) {
            if (!Float.isFinite(queryVector[i])) {
                throw new InvalidEmbeddingValueException(null, i, queryVector[i]);
            }
        }
    }

    public void validateTopK(int topK) {
        if (topK <= 0) {
            throw new InvalidArgumentException("topK must be a positive integer, got " + topK);
        }
    }

    public void validateIdentifier(String id) {
        if (id == null || id.isEmpty()) {
            throw new InvalidIdentifierException(id, "id cannot be empty");
        }
        if (id.isBlank()) {
            throw new InvalidIdentifierException(id, "id cannot be blank");
        }
        for (int i = 0; i < id.length(); i++) {
            if (Character.isISOControl(id.charAt(i))) {
                throw new InvalidIdentifierException(id, "id contains a control character at position " + i);
            }
        }
    }

    public int dimensions() {
        return dimensions;
    }

    public boolean rejectsEmptyText() {
        return rejectEmptyText;
    }
}
