package com.flamingo.ai.personachat.agent;

import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.service.TokenStream;
import java.util.List;

/**
 * AI agent that streams persona answers.
 *
 * <p>Takes no prompt annotations: the persona system prompt depends on the retrieved excerpts, so
 * the chat service assembles the full message list itself.
 */
public interface ChatStreamingAgent {

  /**
   * Streams an answer for the given messages.
   *
   * @param messages system prompt followed by the user question
   * @return TokenStream emitting the answer
   */
  TokenStream chat(List<ChatMessage> messages);
}
