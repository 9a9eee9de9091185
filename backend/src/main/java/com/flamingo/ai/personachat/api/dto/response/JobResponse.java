package com.flamingo.ai.personachat.api.dto.response;

import com.flamingo.ai.personachat.domain.entity.Job;
import com.flamingo.ai.personachat.domain.enums.JobStatus;
import com.flamingo.ai.personachat.domain.enums.JobType;
import com.flamingo.ai.personachat.job.payload.JobPayload;
import com.flamingo.ai.personachat.job.payload.JobResult;
import java.time.LocalDateTime;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for a background job. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class JobResponse {

  private UUID id;
  private JobType type;
  private JobStatus status;
  private int progress;
  private int retryCount;
  private int maxRetries;
  private String idempotencyKey;
  private JobPayload payload;
  private JobResult result;
  private String errorMessage;
  private LocalDateTime scheduledAt;
  private LocalDateTime startedAt;
  private LocalDateTime completedAt;
  private LocalDateTime createdAt;

  /** Creates a JobResponse from a Job entity. */
  public static JobResponse fromEntity(Job job) {
    return JobResponse.builder()
        .id(job.getId())
        .type(job.getType())
        .status(job.getStatus())
        .progress(job.getProgress() != null ? job.getProgress() : 0)
        .retryCount(job.getRetryCount() != null ? job.getRetryCount() : 0)
        .maxRetries(job.getMaxRetries() != null ? job.getMaxRetries() : 0)
        .idempotencyKey(job.getIdempotencyKey())
        .payload(job.getPayload())
        .result(job.getResult())
        .errorMessage(job.getErrorMessage())
        .scheduledAt(job.getScheduledAt())
        .startedAt(job.getStartedAt())
        .completedAt(job.getCompletedAt())
        .createdAt(job.getCreatedAt())
        .build();
  }
}
