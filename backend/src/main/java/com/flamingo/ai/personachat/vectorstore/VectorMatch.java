package com.flamingo.ai.personachat.vectorstore;

/** A query hit; {@code score} is the cosine similarity to the query vector. */
public record VectorMatch(String id, double score, VectorMetadata metadata) {}
