package com.flamingo.ai.personachat.domain.enums;

/** Lifecycle status of a queued job. */
public enum JobStatus {
  /** Waiting for its scheduled time and a worker to claim it. */
  PENDING,

  /** Claimed by a worker. */
  RUNNING,

  /** Finished successfully. */
  COMPLETED,

  /** Gave up after exhausting retries or on a non-retryable error. */
  FAILED
}
