package com.flamingo.ai.personachat.exception;

/** A job failure that retrying cannot fix, such as a malformed payload or a missing entity. */
public class NonRetryableJobException extends RuntimeException {

  public NonRetryableJobException(String message) {
    super(message);
  }

  public NonRetryableJobException(String message, Throwable cause) {
    super(message, cause);
  }
}
