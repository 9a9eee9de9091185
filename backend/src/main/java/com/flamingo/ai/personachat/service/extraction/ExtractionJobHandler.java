package com.flamingo.ai.personachat.service.extraction;

import com.flamingo.ai.personachat.domain.enums.JobType;
import com.flamingo.ai.personachat.exception.NonRetryableJobException;
import com.flamingo.ai.personachat.exception.VideoNotFoundException;
import com.flamingo.ai.personachat.job.payload.ExtractionPayload;
import com.flamingo.ai.personachat.job.payload.JobResult;
import com.flamingo.ai.personachat.service.job.JobHandler;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/** Runs queued caption extraction jobs. */
@Component
@RequiredArgsConstructor
public class ExtractionJobHandler implements JobHandler<ExtractionPayload> {

  private final ExtractionStage extractionStage;

  @Override
  public JobType getType() {
    return JobType.EXTRACTION;
  }

  @Override
  public JobResult handle(ExtractionPayload payload) {
    if (payload.videoId() == null || payload.videoId().isBlank()) {
      throw new NonRetryableJobException("Extraction payload has no video id");
    }
    try {
      return extractionStage.extract(payload.videoId());
    } catch (VideoNotFoundException e) {
      throw new NonRetryableJobException(e.getMessage(), e);
    }
  }
}
