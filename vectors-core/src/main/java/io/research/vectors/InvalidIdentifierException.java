package io.research.vectors;

/**
 * Thrown when a record id is empty, blank or contains control characters.
 */
public class InvalidIdentifierException extends ValidationException {

    public InvalidIdentifierException(String recordId, String reason) {
        super(recordId, String.format("Invalid record id '%s': %s", recordId, reason));
    }
}
