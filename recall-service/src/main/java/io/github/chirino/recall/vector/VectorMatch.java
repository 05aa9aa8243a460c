package io.github.chirino.recall.vector;

/** An indexed anchor message and its cosine distance to the query. */
public record VectorMatch(long messageId, double distance) {}
