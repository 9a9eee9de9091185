package com.flamingo.ai.personachat.config;

import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.StreamingChatModel;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.openai.OpenAiChatModel;
import dev.langchain4j.model.openai.OpenAiEmbeddingModel;
import dev.langchain4j.model.openai.OpenAiStreamingChatModel;
import java.time.Duration;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * OpenAI models behind the persona chat: a streaming model that speaks as the creator, a JSON mode
 * model that picks citations, and the embedding model shared by captions and questions. The
 * embedding dimensions must match {@code app.elasticsearch.vector-dimensions}.
 */
@Configuration
@Slf4j
public class LangChain4jConfig {

  @Value("${langchain4j.openai.api-key:}")
  private String apiKey;

  /** Optional OpenAI-compatible endpoint; blank uses the public API. */
  @Value("${langchain4j.openai.base-url:}")
  private String baseUrl;

  @Value("${langchain4j.openai.persona-model.model-name:gpt-4o-mini}")
  private String personaModelName;

  @Value("${langchain4j.openai.persona-model.temperature:0.7}")
  private double personaTemperature;

  @Value("${langchain4j.openai.persona-model.max-completion-tokens:1000}")
  private int personaMaxTokens;

  @Value("${langchain4j.openai.citation-model.model-name:gpt-4o-mini}")
  private String citationModelName;

  @Value("${langchain4j.openai.citation-model.max-completion-tokens:500}")
  private int citationMaxTokens;

  @Value("${langchain4j.openai.embedding-model.model-name:text-embedding-3-small}")
  private String embeddingModelName;

  @Value("${langchain4j.openai.embedding-model.dimensions:1536}")
  private int embeddingDimensions;

  /** Citation selection; deterministic and constrained to a JSON object. */
  @Bean
  public ChatModel chatModel() {
    requireApiKey();
    OpenAiChatModel.OpenAiChatModelBuilder builder =
        OpenAiChatModel.builder()
            .apiKey(apiKey)
            .modelName(citationModelName)
            .temperature(0.0)
            .maxCompletionTokens(citationMaxTokens)
            .responseFormat("json_object")
            .timeout(Duration.ofSeconds(30));
    if (!baseUrl.isBlank()) {
      builder.baseUrl(baseUrl);
    }
    return builder.build();
  }

  /** Persona answers, streamed token by token. */
  @Bean
  public StreamingChatModel streamingChatModel() {
    requireApiKey();
    OpenAiStreamingChatModel.OpenAiStreamingChatModelBuilder builder =
        OpenAiStreamingChatModel.builder()
            .apiKey(apiKey)
            .modelName(personaModelName)
            .temperature(personaTemperature)
            .maxCompletionTokens(personaMaxTokens)
            .timeout(Duration.ofSeconds(120));
    if (!baseUrl.isBlank()) {
      builder.baseUrl(baseUrl);
    }
    log.info("Persona model: {} (temperature {})", personaModelName, personaTemperature);
    return builder.build();
  }

  @Bean
  public EmbeddingModel embeddingModel() {
    requireApiKey();
    OpenAiEmbeddingModel.OpenAiEmbeddingModelBuilder builder =
        OpenAiEmbeddingModel.builder()
            .apiKey(apiKey)
            .modelName(embeddingModelName)
            .dimensions(embeddingDimensions)
            .timeout(Duration.ofSeconds(30));
    if (!baseUrl.isBlank()) {
      builder.baseUrl(baseUrl);
    }
    log.info("Embedding model: {} ({} dimensions)", embeddingModelName, embeddingDimensions);
    return builder.build();
  }

  private void requireApiKey() {
    if (apiKey == null || apiKey.isBlank()) {
      throw new IllegalStateException(
          "OpenAI API key is required for captions embedding and persona chat. "
              + "Set OPENAI_API_KEY.");
    }
  }
}
