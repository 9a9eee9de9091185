package com.flamingo.ai.personachat.exception;

/**
 * Thrown by the job store when a job with the same idempotency key exists. Producers treat it as
 * "already scheduled".
 */
public class DuplicateJobException extends RuntimeException {

  private final String idempotencyKey;

  public DuplicateJobException(String idempotencyKey) {
    super("Job already scheduled: " + idempotencyKey);
    this.idempotencyKey = idempotencyKey;
  }

  public DuplicateJobException(String idempotencyKey, Throwable cause) {
    super("Job already scheduled: " + idempotencyKey, cause);
    this.idempotencyKey = idempotencyKey;
  }

  public String getIdempotencyKey() {
    return idempotencyKey;
  }
}
