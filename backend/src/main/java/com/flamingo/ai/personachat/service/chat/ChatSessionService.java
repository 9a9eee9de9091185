package com.flamingo.ai.personachat.service.chat;

import com.flamingo.ai.personachat.domain.entity.ChatMessage;
import com.flamingo.ai.personachat.domain.entity.ChatSession;
import com.flamingo.ai.personachat.domain.entity.Persona;
import com.flamingo.ai.personachat.domain.enums.MessageRole;
import com.flamingo.ai.personachat.domain.model.VideoReference;
import java.util.List;
import java.util.UUID;

/** Service interface for chat sessions and their message history. */
public interface ChatSessionService {

  /**
   * Resolves the session a message belongs to, creating one when none is given.
   *
   * @param persona the persona being chatted with
   * @param chatSessionId existing session id, or null to start a new session
   * @param userId the asking user, may be null
   * @param firstMessage used to derive the title of a new session
   * @return the session
   * @throws com.flamingo.ai.personachat.exception.ChatSessionNotFoundException if the given id does
   *     not name a session of this persona
   */
  ChatSession resolveSession(Persona persona, UUID chatSessionId, UUID userId, String firstMessage);

  /**
   * Appends a message to a session and bumps its activity time.
   *
   * @param references validated references, null for user messages
   * @return the saved message
   */
  ChatMessage appendMessage(
      ChatSession session,
      UUID userId,
      MessageRole role,
      String content,
      List<VideoReference> references);

  /** Gets a session by ID. */
  ChatSession getSession(UUID chatSessionId);

  /** Lists a persona's sessions, most recently active first. */
  List<ChatSession> listSessions(UUID personaId);

  /** Gets the messages of a session in chronological order. */
  List<ChatMessage> getMessages(UUID chatSessionId);

  /** Renames a session. */
  ChatSession renameSession(UUID chatSessionId, String title);

  /** Counts the messages of a session. */
  long countMessages(UUID chatSessionId);
}
