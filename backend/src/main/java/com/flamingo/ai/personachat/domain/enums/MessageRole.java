package com.flamingo.ai.personachat.domain.enums;

/** Defines the role of a message sender in a chat. */
public enum MessageRole {
  /** Message from the user. */
  USER,

  /** Message from the persona. */
  ASSISTANT
}
