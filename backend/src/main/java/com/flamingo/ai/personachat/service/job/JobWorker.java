package com.flamingo.ai.personachat.service.job;

import com.flamingo.ai.personachat.domain.entity.Job;
import com.flamingo.ai.personachat.domain.enums.JobType;
import com.flamingo.ai.personachat.exception.JobDeferredException;
import com.flamingo.ai.personachat.exception.NonRetryableJobException;
import com.flamingo.ai.personachat.job.payload.JobPayload;
import com.flamingo.ai.personachat.job.payload.JobResult;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Claims one due job and runs it to completion, deferral or failure. Each call handles at most one
 * job; concurrent calls are safe because claiming is atomic.
 */
@Service
@Slf4j
public class JobWorker {

  private final JobStore jobStore;
  private final MeterRegistry meterRegistry;
  private final Map<JobType, JobHandler<?>> handlers = new EnumMap<>(JobType.class);

  public JobWorker(JobStore jobStore, List<JobHandler<?>> handlers, MeterRegistry meterRegistry) {
    this.jobStore = jobStore;
    this.meterRegistry = meterRegistry;
    for (JobHandler<?> handler : handlers) {
      if (this.handlers.put(handler.getType(), handler) != null) {
        throw new IllegalStateException("Duplicate handler for " + handler.getType());
      }
    }
  }

  /**
   * Runs one scheduler tick.
   *
   * @return the outcome, or empty when no job was due
   */
  @Timed(value = "jobs.tick", description = "Time to run one queued job")
  public Optional<JobRunOutcome> runOnce() {
    Optional<Job> claimed = jobStore.dequeueNext();
    if (claimed.isEmpty()) {
      log.trace("No due jobs");
      return Optional.empty();
    }
    Job job = claimed.get();
    JobRunOutcome outcome = execute(job);
    meterRegistry
        .counter("jobs.processed", "type", job.getType().name(), "outcome", outcome.status().name())
        .increment();
    return Optional.of(outcome);
  }

  private JobRunOutcome execute(Job job) {
    log.info(
        "Running {} job {} (attempt {}/{})",
        job.getType(),
        job.getId(),
        job.getRetryCount() + 1,
        job.getMaxRetries());
    try {
      JobResult result = dispatch(job);
      jobStore.complete(job.getId(), result);
      log.info("Completed {} job {}", job.getType(), job.getId());
      return outcome(job, JobRunOutcome.Status.COMPLETED, null);

    } catch (JobDeferredException e) {
      jobStore.defer(job.getId(), e.getDelay(), e.getProgress());
      log.info("Deferred {} job {}: {}", job.getType(), job.getId(), e.getMessage());
      return outcome(job, JobRunOutcome.Status.DEFERRED, e.getMessage());

    } catch (NonRetryableJobException | IllegalArgumentException e) {
      jobStore.failPermanently(job.getId(), describe(e));
      return outcome(job, JobRunOutcome.Status.FAILED, describe(e));

    } catch (RuntimeException e) {
      log.debug("{} job {} threw", job.getType(), job.getId(), e);
      boolean willRetry = jobStore.fail(job.getId(), describe(e));
      return outcome(
          job,
          willRetry ? JobRunOutcome.Status.RETRY_SCHEDULED : JobRunOutcome.Status.FAILED,
          describe(e));
    }
  }

  @SuppressWarnings("unchecked")
  private JobResult dispatch(Job job) {
    JobHandler<JobPayload> handler = (JobHandler<JobPayload>) handlers.get(job.getType());
    if (handler == null) {
      throw new NonRetryableJobException("No handler registered for " + job.getType());
    }
    return handler.handle(job.getPayload());
  }

  private static JobRunOutcome outcome(Job job, JobRunOutcome.Status status, String message) {
    return new JobRunOutcome(job.getId(), job.getType(), status, message);
  }

  private static String describe(Throwable e) {
    return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
  }
}
