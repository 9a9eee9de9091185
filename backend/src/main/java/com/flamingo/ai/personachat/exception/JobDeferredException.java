package com.flamingo.ai.personachat.exception;

import java.time.Duration;

/**
 * Thrown by a job handler that must wait for something outside the process, such as a pending
 * scrape run. The worker puts the job back in the queue without counting an attempt.
 */
public class JobDeferredException extends RuntimeException {

  private final Duration delay;
  private final Integer progress;

  public JobDeferredException(String reason, Duration delay) {
    this(reason, delay, null);
  }

  public JobDeferredException(String reason, Duration delay, Integer progress) {
    super(reason);
    this.delay = delay;
    this.progress = progress;
  }

  public Duration getDelay() {
    return delay;
  }

  public Integer getProgress() {
    return progress;
  }
}
