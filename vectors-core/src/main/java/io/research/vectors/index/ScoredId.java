package io.research.vectors.index;

/**
 * A record id with its similarity score for one query.
 */
public record ScoredId(String id, double score) {}
