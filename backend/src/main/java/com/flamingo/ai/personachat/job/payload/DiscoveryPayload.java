package com.flamingo.ai.personachat.job.payload;

import java.util.UUID;

/** Discovers the next catalog page of a persona's channel. */
public record DiscoveryPayload(UUID personaId, String channelId) implements JobPayload {}
