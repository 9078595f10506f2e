package io.research.vectors;

/**
 * What happens when a record is inserted under an id that is already stored.
 */
public enum DuplicatePolicy {
    /** Replace the stored record entirely (default). */
    UPSERT,

    /** Refuse the insertion with {@link DuplicateIdentifierException}. */
    REJECT
}
