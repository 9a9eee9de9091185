package com.flamingo.ai.personachat.job.payload;

public record EmbeddingResult(int embeddingsProcessed, int totalCandidates) implements JobResult {}
