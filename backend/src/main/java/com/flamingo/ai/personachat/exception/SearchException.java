package com.flamingo.ai.personachat.exception;

/** Exception thrown when a vector store operation fails. */
public class SearchException extends RuntimeException {

  private final String namespace;

  public SearchException(String namespace, String message) {
    super(message);
    this.namespace = namespace;
  }

  public SearchException(String namespace, String message, Throwable cause) {
    super(message, cause);
    this.namespace = namespace;
  }

  public String getNamespace() {
    return namespace;
  }

  public String getUserMessage() {
    return "Transcript search is temporarily unavailable. Please try again.";
  }
}
