package com.flamingo.ai.personachat.agent.dto;

import java.util.List;

/**
 * Structured JSON output from CitationExtractionAgent. Lists the excerpts an answer drew on, each
 * identified by video id and the timestamp (seconds) the model claims.
 */
public record CitationSelection(List<CitedChunk> citations) {

  /** One cited excerpt; confidence is expected in [0, 1] but not trusted. */
  public record CitedChunk(String videoId, double timestamp, double confidence) {}
}
