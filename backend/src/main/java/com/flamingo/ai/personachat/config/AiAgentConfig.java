package com.flamingo.ai.personachat.config;

import com.flamingo.ai.personachat.agent.ChatStreamingAgent;
import com.flamingo.ai.personachat.agent.CitationExtractionAgent;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.StreamingChatModel;
import dev.langchain4j.service.AiServices;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for the AI agents built with LangChain4j AI Services.
 *
 * <p>Agent interfaces declare their prompts; AiServices.builder() creates the implementations.
 */
@Configuration
public class AiAgentConfig {

  /** Streams persona answers token by token. */
  @Bean
  public ChatStreamingAgent chatStreamingAgent(StreamingChatModel streamingChatModel) {
    return AiServices.builder(ChatStreamingAgent.class)
        .streamingChatModel(streamingChatModel)
        .build();
  }

  /** Picks the excerpts an answer actually relied on. Uses the JSON-mode ChatModel. */
  @Bean
  public CitationExtractionAgent citationExtractionAgent(ChatModel chatModel) {
    return AiServices.builder(CitationExtractionAgent.class).chatModel(chatModel).build();
  }
}
