package com.flamingo.ai.personachat.exception;

/** Exception thrown when the embedding or completion model fails. */
public class LlmServiceException extends RuntimeException {

  private final boolean rateLimited;

  public LlmServiceException(String message) {
    this(message, null, false);
  }

  public LlmServiceException(String message, Throwable cause) {
    this(message, cause, isRateLimit(cause));
  }

  private LlmServiceException(String message, Throwable cause, boolean rateLimited) {
    super(message, cause);
    this.rateLimited = rateLimited;
  }

  public boolean isRateLimited() {
    return rateLimited;
  }

  public String getUserMessage() {
    return rateLimited
        ? "Service is temporarily busy. Please try again in a moment."
        : "AI service is temporarily unavailable. Please try again later.";
  }

  private static boolean isRateLimit(Throwable cause) {
    return cause != null
        && cause.getMessage() != null
        && (cause.getMessage().contains("429") || cause.getMessage().contains("rate limit"));
  }
}
