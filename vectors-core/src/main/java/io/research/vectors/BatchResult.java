package io.research.vectors;

import java.util.List;

/**
 * Outcome of a batch insertion: how many records were stored and which were refused.
 */
public record BatchResult(
    /** Number of records written */
    int inserted,

    /** Records refused by validation, in input order */
    List<Rejection> rejected
) {
    public BatchResult {
        if (inserted < 0) throw new IllegalArgumentException("inserted must be >= 0");
        rejected = rejected != null ? List.copyOf(rejected) : List.of();
    }

    public static BatchResult empty() {
        return new BatchResult(0, List.of());
    }

    public boolean hasRejections() {
        return !rejected.isEmpty();
    }

    /**
     * A record that failed validation and the reason.
     */
    public record Rejection(String id, ValidationException error) {}
}
