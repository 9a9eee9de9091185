package com.flamingo.ai.personachat.exception;

/** Exception thrown when a channel is already bound to a persona of the same owner. */
public class DuplicatePersonaException extends RuntimeException {

  private final String channelId;

  public DuplicatePersonaException(String channelId, String message) {
    super(message);
    this.channelId = channelId;
  }

  public String getChannelId() {
    return channelId;
  }
}
