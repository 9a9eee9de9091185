package com.flamingo.ai.personachat.job.payload;

import java.util.UUID;

/** Embeds unembedded caption chunks of a persona, optionally scoped to one video. */
public record EmbeddingPayload(UUID personaId, String videoId) implements JobPayload {}
