package com.flamingo.ai.personachat.api.sse;

import com.flamingo.ai.personachat.api.dto.request.ChatRequest;
import com.flamingo.ai.personachat.api.dto.response.ChatStreamEvent;
import com.flamingo.ai.personachat.service.chat.ChatService;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.validation.Valid;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicInteger;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Flux;

/** Controller for persona chat with SSE streaming. */
@RestController
@RequestMapping("/api/personas/{personaId}")
@Slf4j
public class ChatController {

  private final ChatService chatService;
  private final MeterRegistry meterRegistry;

  private final AtomicInteger activeConnections = new AtomicInteger(0);

  public ChatController(ChatService chatService, MeterRegistry meterRegistry) {
    this.chatService = chatService;
    this.meterRegistry = meterRegistry;
    meterRegistry.gauge("sse.connections.active", activeConnections);
  }

  /**
   * Streams an answer using Server-Sent Events.
   *
   * @param personaId the persona to ask
   * @param request the question, optional session and retrieval overrides
   * @return a Flux of SSE events
   */
  @PostMapping(value = "/chat/stream", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
  public Flux<ChatStreamEvent> streamChat(
      @PathVariable UUID personaId, @Valid @RequestBody ChatRequest request) {

    log.info("Starting chat stream for persona {}", personaId);
    Flux<ChatStreamEvent> events = chatService.streamChat(personaId, request);
    activeConnections.incrementAndGet();

    return events
        .doOnComplete(
            () -> {
              activeConnections.decrementAndGet();
              log.debug("Chat stream completed for persona {}", personaId);
            })
        .doOnError(
            e -> {
              activeConnections.decrementAndGet();
              log.error("Chat stream error for persona {}: {}", personaId, e.getMessage());
              meterRegistry.counter("sse.errors").increment();
            })
        .doOnCancel(
            () -> {
              activeConnections.decrementAndGet();
              log.debug("Chat stream cancelled for persona {}", personaId);
            });
  }
}
