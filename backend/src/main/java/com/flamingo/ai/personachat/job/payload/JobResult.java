package com.flamingo.ai.personachat.job.payload;

/** Outcome recorded on a completed job. */
public sealed interface JobResult permits DiscoveryResult, ExtractionResult, EmbeddingResult {}
