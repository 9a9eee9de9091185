package com.flamingo.ai.personachat.domain.entity;

import com.flamingo.ai.personachat.domain.enums.JobStatus;
import com.flamingo.ai.personachat.domain.enums.JobType;
import com.flamingo.ai.personachat.job.payload.JobPayload;
import com.flamingo.ai.personachat.job.payload.JobPayloadCodec;
import com.flamingo.ai.personachat.job.payload.JobResult;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import java.time.LocalDateTime;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/** A durable unit of background work. */
@Entity
@Table(
    name = "jobs",
    indexes = {@Index(name = "idx_jobs_status_scheduled_at", columnList = "status, scheduledAt")})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Job {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Enumerated(EnumType.STRING)
  @Column(nullable = false)
  private JobType type;

  /** JSON payload, shape decided by {@link #type}. */
  @Column(columnDefinition = "TEXT", nullable = false)
  private String payloadJson;

  @Enumerated(EnumType.STRING)
  @Column(nullable = false)
  @Builder.Default
  private JobStatus status = JobStatus.PENDING;

  @Builder.Default private Integer progress = 0;

  @Builder.Default private Integer retryCount = 0;

  @Builder.Default private Integer maxRetries = 3;

  @Column(nullable = false, unique = true)
  private String idempotencyKey;

  @Column(nullable = false)
  private LocalDateTime scheduledAt;

  private LocalDateTime startedAt;

  private LocalDateTime completedAt;

  @Column(columnDefinition = "TEXT")
  private String errorMessage;

  /** JSON result, shape decided by {@link #type}. */
  @Column(columnDefinition = "TEXT")
  private String resultJson;

  @Column(nullable = false, updatable = false)
  private LocalDateTime createdAt;

  private LocalDateTime updatedAt;

  @PrePersist
  protected void onCreate() {
    createdAt = LocalDateTime.now();
    updatedAt = createdAt;
    if (scheduledAt == null) {
      scheduledAt = createdAt;
    }
  }

  @PreUpdate
  protected void onUpdate() {
    updatedAt = LocalDateTime.now();
  }

  public JobPayload getPayload() {
    return JobPayloadCodec.readPayload(type, payloadJson);
  }

  public JobResult getResult() {
    return JobPayloadCodec.readResult(type, resultJson);
  }

  /** Marks the job as finished. */
  public void markCompleted(JobResult result, LocalDateTime now) {
    this.status = JobStatus.COMPLETED;
    this.progress = 100;
    this.resultJson = JobPayloadCodec.write(result);
    this.completedAt = now;
  }

  /**
   * Records a failed attempt. The job goes back to the queue with exponential backoff while
   * attempts remain, otherwise it fails for good.
   *
   * @return true if the job will be retried
   */
  public boolean recordFailure(String error, LocalDateTime now) {
    this.retryCount = retryCount + 1;
    this.errorMessage = error;
    if (retryCount < maxRetries) {
      this.status = JobStatus.PENDING;
      this.scheduledAt = now.plusMinutes(1L << retryCount);
      this.startedAt = null;
      return true;
    }
    markFailed(error, now);
    return false;
  }

  /** Fails the job without consuming the remaining retries. */
  public void markFailed(String error, LocalDateTime now) {
    this.status = JobStatus.FAILED;
    this.errorMessage = error;
    this.completedAt = now;
  }

  /** Puts a running job back in the queue without counting an attempt. */
  public void defer(LocalDateTime notBefore, Integer progress) {
    this.status = JobStatus.PENDING;
    this.scheduledAt = notBefore;
    this.startedAt = null;
    if (progress != null) {
      this.progress = Math.max(0, Math.min(100, progress));
    }
  }
}
