package com.flamingo.ai.personachat.service.chat;

import com.flamingo.ai.personachat.api.dto.request.ChatRequest;
import com.flamingo.ai.personachat.api.dto.response.ChatStreamEvent;
import java.util.UUID;
import reactor.core.publisher.Flux;

/** Service interface for answering questions in a persona's voice. */
public interface ChatService {

  /**
   * Streams an answer grounded in the persona's embedded captions.
   *
   * <p>The user message is persisted before retrieval starts. Retrieval failures end the stream
   * with a single {@code error} event; a successful answer ends with {@code complete}.
   *
   * @param personaId the persona to ask
   * @param request the question and retrieval overrides
   * @return a Flux of stream events
   * @throws com.flamingo.ai.personachat.exception.PersonaNotFoundException if the persona does not
   *     exist
   */
  Flux<ChatStreamEvent> streamChat(UUID personaId, ChatRequest request);
}
