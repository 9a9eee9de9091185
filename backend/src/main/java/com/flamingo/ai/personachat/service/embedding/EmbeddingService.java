package com.flamingo.ai.personachat.service.embedding;

import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.output.Response;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.github.resilience4j.retry.annotation.Retry;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Generates text embeddings with the configured embedding model. A failed call yields an empty
 * vector, which callers must treat as a failure.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class EmbeddingService {

  // text-embedding-3-small accepts 8192 tokens; stay well below it for dense transcripts
  private static final int MAX_CHARS_PER_EMBEDDING = 8000;

  private static final float[] EMPTY = new float[0];

  private final EmbeddingModel embeddingModel;
  private final MeterRegistry meterRegistry;

  /**
   * Embeds a user question.
   *
   * @param query the query text
   * @return embedding vector, empty on failure
   */
  @Timed(value = "embedding.embedQuery", description = "Time to embed query")
  @CircuitBreaker(name = "openai", fallbackMethod = "embedFallback")
  @Retry(name = "openai")
  public float[] embedQuery(String query) {
    float[] vector = embed(query);
    meterRegistry.counter("embedding.requests.success", "type", "query").increment();
    return vector;
  }

  /**
   * Embeds a caption chunk.
   *
   * @param passage the transcript text
   * @return embedding vector, empty on failure
   */
  @Timed(value = "embedding.embedPassage", description = "Time to embed passage")
  @CircuitBreaker(name = "openai", fallbackMethod = "embedFallback")
  @Retry(name = "openai")
  public float[] embedPassage(String passage) {
    float[] vector = embed(passage);
    meterRegistry.counter("embedding.requests.success", "type", "passage").increment();
    return vector;
  }

  private float[] embed(String text) {
    if (text == null || text.isBlank()) {
      throw new IllegalArgumentException("Cannot embed empty text");
    }
    String input = text;
    if (input.length() > MAX_CHARS_PER_EMBEDDING) {
      log.warn(
          "Text too long for embedding, truncating from {} chars to {} chars",
          input.length(),
          MAX_CHARS_PER_EMBEDDING);
      input = input.substring(0, MAX_CHARS_PER_EMBEDDING);
    }
    Response<Embedding> response = embeddingModel.embed(input);
    return response.content().vector();
  }

  @SuppressWarnings("unused")
  private float[] embedFallback(String text, Throwable t) {
    log.error("Embedding failed: {}", t.getMessage());
    meterRegistry.counter("embedding.requests.failure").increment();
    return EMPTY;
  }
}
