package com.flamingo.ai.personachat.job.payload;

/** Input of a job. Each {@link com.flamingo.ai.personachat.domain.enums.JobType} has one shape. */
public sealed interface JobPayload permits DiscoveryPayload, ExtractionPayload, EmbeddingPayload {}
