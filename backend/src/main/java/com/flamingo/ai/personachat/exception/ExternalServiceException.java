package com.flamingo.ai.personachat.exception;

/** Exception thrown when the catalog or scraping service cannot be reached or rejects a call. */
public class ExternalServiceException extends RuntimeException {

  private final String service;
  private final String userMessage;

  public ExternalServiceException(String service, String message) {
    super(message);
    this.service = service;
    this.userMessage = service + " is temporarily unavailable. Please try again later.";
  }

  public ExternalServiceException(String service, String message, Throwable cause) {
    super(message, cause);
    this.service = service;
    this.userMessage = service + " is temporarily unavailable. Please try again later.";
  }

  public String getService() {
    return service;
  }

  public String getUserMessage() {
    return userMessage;
  }
}
