package com.flamingo.ai.personachat.exception;

import java.util.UUID;

/** Exception thrown when a chat session is not found. */
public class ChatSessionNotFoundException extends RuntimeException {

  private final UUID chatSessionId;

  public ChatSessionNotFoundException(UUID chatSessionId) {
    super("Chat session not found: " + chatSessionId);
    this.chatSessionId = chatSessionId;
  }

  public UUID getChatSessionId() {
    return chatSessionId;
  }
}
