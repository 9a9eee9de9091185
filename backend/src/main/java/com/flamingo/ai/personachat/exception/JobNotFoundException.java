package com.flamingo.ai.personachat.exception;

import java.util.UUID;

/** Exception thrown when a job is not found. */
public class JobNotFoundException extends RuntimeException {

  private final UUID jobId;

  public JobNotFoundException(UUID jobId) {
    super("Job not found: " + jobId);
    this.jobId = jobId;
  }

  public UUID getJobId() {
    return jobId;
  }
}
