package com.flamingo.ai.personachat.exception;

/** Exception thrown when caption chunks could not be embedded and stored. */
public class EmbeddingException extends RuntimeException {

  private final int failed;

  public EmbeddingException(String message, int failed) {
    super(message);
    this.failed = failed;
  }

  /** Number of chunks left unembedded. */
  public int getFailed() {
    return failed;
  }
}
