package com.flamingo.ai.personachat.domain.enums;

import com.flamingo.ai.personachat.job.payload.DiscoveryPayload;
import com.flamingo.ai.personachat.job.payload.DiscoveryResult;
import com.flamingo.ai.personachat.job.payload.EmbeddingPayload;
import com.flamingo.ai.personachat.job.payload.EmbeddingResult;
import com.flamingo.ai.personachat.job.payload.ExtractionPayload;
import com.flamingo.ai.personachat.job.payload.ExtractionResult;
import com.flamingo.ai.personachat.job.payload.JobPayload;
import com.flamingo.ai.personachat.job.payload.JobResult;

/**
 * Kind of background work. The type is the discriminant that resolves the shape of a job's payload
 * and result.
 */
public enum JobType {
  /** Fetches one page of a channel's catalog. */
  DISCOVERY(DiscoveryPayload.class, DiscoveryResult.class),

  /** Scrapes and stores the captions of one video. */
  EXTRACTION(ExtractionPayload.class, ExtractionResult.class),

  /** Embeds pending caption chunks of one video. */
  EMBEDDING(EmbeddingPayload.class, EmbeddingResult.class);

  private final Class<? extends JobPayload> payloadType;
  private final Class<? extends JobResult> resultType;

  JobType(Class<? extends JobPayload> payloadType, Class<? extends JobResult> resultType) {
    this.payloadType = payloadType;
    this.resultType = resultType;
  }

  public Class<? extends JobPayload> getPayloadType() {
    return payloadType;
  }

  public Class<? extends JobResult> getResultType() {
    return resultType;
  }
}
