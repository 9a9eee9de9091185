package com.flamingo.ai.personachat.service.job;

import com.flamingo.ai.personachat.domain.enums.JobType;
import java.util.UUID;

/** What one scheduler tick did with the job it claimed. */
public record JobRunOutcome(UUID jobId, JobType type, Status status, String message) {

  public enum Status {
    COMPLETED,
    DEFERRED,
    RETRY_SCHEDULED,
    FAILED
  }
}
