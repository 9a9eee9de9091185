package com.flamingo.ai.personachat.api.rest;

import com.flamingo.ai.personachat.api.dto.request.RenameChatSessionRequest;
import com.flamingo.ai.personachat.api.dto.response.ChatMessageResponse;
import com.flamingo.ai.personachat.api.dto.response.ChatSessionResponse;
import com.flamingo.ai.personachat.domain.entity.ChatSession;
import com.flamingo.ai.personachat.service.chat.ChatSessionService;
import jakarta.validation.Valid;
import java.util.List;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/** REST controller for chat sessions. */
@RestController
@RequestMapping("/api/chat-sessions")
@RequiredArgsConstructor
public class ChatSessionController {

  private final ChatSessionService chatSessionService;

  /** Lists a persona's chat sessions, most recently active first. */
  @GetMapping
  public ResponseEntity<List<ChatSessionResponse>> listSessions(@RequestParam UUID personaId) {
    List<ChatSessionResponse> responses =
        chatSessionService.listSessions(personaId).stream()
            .map(
                session ->
                    ChatSessionResponse.fromEntity(
                        session, chatSessionService.countMessages(session.getId())))
            .toList();
    return ResponseEntity.ok(responses);
  }

  @GetMapping("/{chatSessionId}")
  public ResponseEntity<ChatSessionResponse> getSession(@PathVariable UUID chatSessionId) {
    ChatSession session = chatSessionService.getSession(chatSessionId);
    return ResponseEntity.ok(
        ChatSessionResponse.fromEntity(session, chatSessionService.countMessages(chatSessionId)));
  }

  /** Gets the messages of a session, oldest first. */
  @GetMapping("/{chatSessionId}/messages")
  public ResponseEntity<List<ChatMessageResponse>> getMessages(@PathVariable UUID chatSessionId) {
    List<ChatMessageResponse> responses =
        chatSessionService.getMessages(chatSessionId).stream()
            .map(ChatMessageResponse::fromEntity)
            .toList();
    return ResponseEntity.ok(responses);
  }

  /** Renames a session. */
  @PutMapping("/{chatSessionId}")
  public ResponseEntity<ChatSessionResponse> renameSession(
      @PathVariable UUID chatSessionId, @Valid @RequestBody RenameChatSessionRequest request) {
    ChatSession session = chatSessionService.renameSession(chatSessionId, request.getTitle());
    return ResponseEntity.ok(
        ChatSessionResponse.fromEntity(session, chatSessionService.countMessages(chatSessionId)));
  }
}
