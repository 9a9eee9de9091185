package com.flamingo.ai.personachat.service.job;

import com.flamingo.ai.personachat.domain.entity.Job;
import com.flamingo.ai.personachat.domain.enums.JobType;
import com.flamingo.ai.personachat.job.payload.JobPayload;
import com.flamingo.ai.personachat.job.payload.JobResult;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.Optional;
import java.util.UUID;

/** Durable queue of background jobs. */
public interface JobStore {

  /**
   * Adds a job to the queue.
   *
   * @param type job type; must match the payload shape
   * @param payload typed payload
   * @param idempotencyKey unique key of the unit of work
   * @param maxRetries number of attempts before the job fails for good
   * @param notBefore earliest time the job may run; null for now
   * @return the new job ID
   * @throws com.flamingo.ai.personachat.exception.DuplicateJobException if the key already exists
   */
  UUID enqueue(
      JobType type,
      JobPayload payload,
      String idempotencyKey,
      int maxRetries,
      LocalDateTime notBefore);

  /** Enqueues with the configured retry budget, runnable immediately. */
  UUID enqueue(JobType type, JobPayload payload, String idempotencyKey);

  /**
   * Claims the oldest due pending job. The claim is a conditional update, so two callers never
   * receive the same job.
   *
   * @return the claimed job in RUNNING state, or empty if nothing is due
   */
  Optional<Job> dequeueNext();

  void complete(UUID jobId, JobResult result);

  /**
   * Records a failed attempt with exponential backoff.
   *
   * @return true if the job was put back in the queue, false if it failed for good
   */
  boolean fail(UUID jobId, String error);

  /** Fails a job without retrying. */
  void failPermanently(UUID jobId, String error);

  /** Returns a running job to the queue without counting an attempt. */
  void defer(UUID jobId, Duration delay, Integer progress);

  /**
   * Gets a job by ID.
   *
   * @throws com.flamingo.ai.personachat.exception.JobNotFoundException if not found
   */
  Job getJob(UUID jobId);
}
