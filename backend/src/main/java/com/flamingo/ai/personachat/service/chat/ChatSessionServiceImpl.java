package com.flamingo.ai.personachat.service.chat;

import com.flamingo.ai.personachat.domain.entity.ChatMessage;
import com.flamingo.ai.personachat.domain.entity.ChatSession;
import com.flamingo.ai.personachat.domain.entity.Persona;
import com.flamingo.ai.personachat.domain.enums.MessageRole;
import com.flamingo.ai.personachat.domain.model.VideoReference;
import com.flamingo.ai.personachat.domain.repository.ChatMessageRepository;
import com.flamingo.ai.personachat.domain.repository.ChatSessionRepository;
import com.flamingo.ai.personachat.exception.ChatSessionNotFoundException;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.List;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/** Implementation of the ChatSessionService. */
@Service
@RequiredArgsConstructor
@Slf4j
public class ChatSessionServiceImpl implements ChatSessionService {

  static final int MAX_TITLE_LENGTH = 60;

  private final ChatSessionRepository chatSessionRepository;
  private final ChatMessageRepository chatMessageRepository;
  private final MeterRegistry meterRegistry;

  @Override
  @Transactional
  public ChatSession resolveSession(
      Persona persona, UUID chatSessionId, UUID userId, String firstMessage) {
    if (chatSessionId != null) {
      ChatSession session = getSession(chatSessionId);
      if (!session.getPersona().getId().equals(persona.getId())) {
        log.warn(
            "Chat session {} does not belong to persona {}", chatSessionId, persona.getId());
        throw new ChatSessionNotFoundException(chatSessionId);
      }
      return session;
    }

    ChatSession session =
        chatSessionRepository.save(
            ChatSession.builder()
                .persona(persona)
                .userId(userId)
                .title(deriveTitle(firstMessage))
                .build());
    meterRegistry.counter("chat.sessions.created").increment();
    log.info("Created chat session {} for persona {}", session.getId(), persona.getId());
    return session;
  }

  @Override
  @Transactional
  public ChatMessage appendMessage(
      ChatSession session,
      UUID userId,
      MessageRole role,
      String content,
      List<VideoReference> references) {
    ChatMessage saved =
        chatMessageRepository.save(
            ChatMessage.builder()
                .session(session)
                .persona(session.getPersona())
                .userId(userId)
                .role(role)
                .content(content)
                .references(references)
                .build());
    session.touch();
    chatSessionRepository.save(session);
    log.debug("Saved {} message {} in chat session {}", role, saved.getId(), session.getId());
    return saved;
  }

  @Override
  @Transactional(readOnly = true)
  public ChatSession getSession(UUID chatSessionId) {
    return chatSessionRepository
        .findById(chatSessionId)
        .orElseThrow(() -> new ChatSessionNotFoundException(chatSessionId));
  }

  @Override
  @Transactional(readOnly = true)
  public List<ChatSession> listSessions(UUID personaId) {
    return chatSessionRepository.findByPersonaIdOrderByUpdatedAtDesc(personaId);
  }

  @Override
  @Transactional(readOnly = true)
  @Timed(value = "chat.history", description = "Time to load chat history")
  public List<ChatMessage> getMessages(UUID chatSessionId) {
    getSession(chatSessionId);
    return chatMessageRepository.findBySessionIdOrderByCreatedAtAsc(chatSessionId);
  }

  @Override
  @Transactional
  public ChatSession renameSession(UUID chatSessionId, String title) {
    ChatSession session = getSession(chatSessionId);
    session.setTitle(title.trim());
    log.info("Renamed chat session {}", chatSessionId);
    return chatSessionRepository.save(session);
  }

  @Override
  @Transactional(readOnly = true)
  public long countMessages(UUID chatSessionId) {
    return chatMessageRepository.countBySessionId(chatSessionId);
  }

  static String deriveTitle(String firstMessage) {
    String title = firstMessage == null ? "" : firstMessage.strip().replaceAll("\\s+", " ");
    if (title.isEmpty()) {
      return "New chat";
    }
    return title.length() <= MAX_TITLE_LENGTH
        ? title
        : title.substring(0, MAX_TITLE_LENGTH - 3) + "...";
  }
}
