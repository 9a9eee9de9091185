package com.flamingo.ai.personachat.job.payload;

import java.util.UUID;

/** Extracts captions for one video, identified by its catalog id. */
public record ExtractionPayload(String videoId, UUID personaId) implements JobPayload {}
