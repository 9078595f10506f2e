package io.research.vectors;

/**
 * Thrown under {@link DuplicatePolicy#REJECT} when an id is already stored.
 */
public class DuplicateIdentifierException extends ValidationException {

    public DuplicateIdentifierException(String recordId) {
        super(recordId, String.format("Record '%s' already exists", recordId));
    }
}
