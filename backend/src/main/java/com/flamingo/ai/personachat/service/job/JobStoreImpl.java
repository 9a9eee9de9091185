package com.flamingo.ai.personachat.service.job;

import com.flamingo.ai.personachat.config.PipelineConfig;
import com.flamingo.ai.personachat.domain.entity.Job;
import com.flamingo.ai.personachat.domain.enums.JobStatus;
import com.flamingo.ai.personachat.domain.enums.JobType;
import com.flamingo.ai.personachat.domain.repository.JobRepository;
import com.flamingo.ai.personachat.exception.DuplicateJobException;
import com.flamingo.ai.personachat.exception.JobNotFoundException;
import com.flamingo.ai.personachat.job.payload.JobPayload;
import com.flamingo.ai.personachat.job.payload.JobPayloadCodec;
import com.flamingo.ai.personachat.job.payload.JobResult;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/** JPA-backed job queue. */
@Service
@RequiredArgsConstructor
@Slf4j
public class JobStoreImpl implements JobStore {

  private final JobRepository jobRepository;
  private final PipelineConfig pipelineConfig;
  private final MeterRegistry meterRegistry;
  private final Clock clock;

  @Override
  @Transactional
  public UUID enqueue(
      JobType type,
      JobPayload payload,
      String idempotencyKey,
      int maxRetries,
      LocalDateTime notBefore) {
    JobPayloadCodec.requireMatching(type, payload);
    if (idempotencyKey == null || idempotencyKey.isBlank()) {
      throw new IllegalArgumentException("Idempotency key is required");
    }
    if (maxRetries < 1) {
      throw new IllegalArgumentException("maxRetries must be at least 1");
    }
    if (jobRepository.existsByIdempotencyKey(idempotencyKey)) {
      throw new DuplicateJobException(idempotencyKey);
    }

    Job job =
        Job.builder()
            .type(type)
            .payloadJson(JobPayloadCodec.write(payload))
            .idempotencyKey(idempotencyKey)
            .maxRetries(maxRetries)
            .scheduledAt(notBefore != null ? notBefore : now())
            .build();
    try {
      Job saved = jobRepository.saveAndFlush(job);
      meterRegistry.counter("jobs.enqueued", "type", type.name()).increment();
      log.debug("Enqueued {} job {} with key {}", type, saved.getId(), idempotencyKey);
      return saved.getId();
    } catch (DataIntegrityViolationException e) {
      // Lost an insert race on the unique key
      throw new DuplicateJobException(idempotencyKey, e);
    }
  }

  @Override
  public UUID enqueue(JobType type, JobPayload payload, String idempotencyKey) {
    return enqueue(type, payload, idempotencyKey, pipelineConfig.getJobs().getMaxRetries(), null);
  }

  @Override
  @Transactional
  public Optional<Job> dequeueNext() {
    LocalDateTime now = now();
    List<Job> candidates =
        jobRepository.findDue(
            JobStatus.PENDING,
            now,
            PageRequest.of(0, Math.max(1, pipelineConfig.getJobs().getClaimCandidates())));

    for (Job candidate : candidates) {
      if (jobRepository.claim(candidate.getId(), now) == 1) {
        log.debug("Claimed {} job {}", candidate.getType(), candidate.getId());
        return jobRepository.findById(candidate.getId());
      }
      log.debug("Job {} was claimed by another worker", candidate.getId());
    }
    return Optional.empty();
  }

  @Override
  @Transactional
  public void complete(UUID jobId, JobResult result) {
    Job job = getJob(jobId);
    job.markCompleted(result, now());
    jobRepository.save(job);
  }

  @Override
  @Transactional
  public boolean fail(UUID jobId, String error) {
    Job job = getJob(jobId);
    boolean willRetry = job.recordFailure(error, now());
    jobRepository.save(job);
    if (willRetry) {
      log.warn(
          "Job {} ({}) failed attempt {}/{}, retrying at {}: {}",
          jobId,
          job.getType(),
          job.getRetryCount(),
          job.getMaxRetries(),
          job.getScheduledAt(),
          error);
    } else {
      log.error(
          "Job {} ({}) failed after {} attempts: {}",
          jobId,
          job.getType(),
          job.getRetryCount(),
          error);
    }
    return willRetry;
  }

  @Override
  @Transactional
  public void failPermanently(UUID jobId, String error) {
    Job job = getJob(jobId);
    job.markFailed(error, now());
    jobRepository.save(job);
    log.error("Job {} ({}) failed without retry: {}", jobId, job.getType(), error);
  }

  @Override
  @Transactional
  public void defer(UUID jobId, Duration delay, Integer progress) {
    Job job = getJob(jobId);
    job.defer(now().plus(delay), progress);
    jobRepository.save(job);
    log.debug("Deferred job {} until {}", jobId, job.getScheduledAt());
  }

  @Override
  @Transactional(readOnly = true)
  public Job getJob(UUID jobId) {
    return jobRepository.findById(jobId).orElseThrow(() -> new JobNotFoundException(jobId));
  }

  private LocalDateTime now() {
    return LocalDateTime.now(clock);
  }
}
