package io.research.vectors;

/**
 * Thrown for records without text when the collection is configured with
 * {@link CollectionConfig#rejectEmptyText()}.
 */
public class EmptyTextException extends ValidationException {

    public EmptyTextException(String recordId) {
        super(recordId, String.format("Record '%s' has empty text", recordId));
    }
}
