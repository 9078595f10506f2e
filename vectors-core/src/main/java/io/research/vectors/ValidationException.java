package io.research.vectors;

/**
 * A record or query failed a structural check before reaching storage.
 *
 * <p>In batch mode these are collected per record instead of being thrown.</p>
 */
public abstract class ValidationException extends VectorStoreException {

    private final String recordId;

    protected ValidationException(String recordId, String message) {
        super(message);
        this.recordId = recordId;
    }

    /**
     * Returns the id of the offending record, or {@code null} for query vectors.
     */
    public String getRecordId() {
        return recordId;
    }
}
