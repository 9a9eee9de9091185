package com.flamingo.ai.personachat.vectorstore;

/** Payload stored next to a caption vector. {@code videoId} is the catalog id of the video. */
public record VectorMetadata(String text, String videoId, String personaId, double startTime) {}
