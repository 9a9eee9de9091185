package com.flamingo.ai.personachat.service.embedding;

import com.flamingo.ai.personachat.config.PipelineConfig;
import com.flamingo.ai.personachat.domain.enums.JobType;
import com.flamingo.ai.personachat.exception.EmbeddingException;
import com.flamingo.ai.personachat.exception.JobDeferredException;
import com.flamingo.ai.personachat.exception.NonRetryableJobException;
import com.flamingo.ai.personachat.exception.PersonaNotFoundException;
import com.flamingo.ai.personachat.job.payload.EmbeddingPayload;
import com.flamingo.ai.personachat.job.payload.EmbeddingResult;
import com.flamingo.ai.personachat.job.payload.JobResult;
import com.flamingo.ai.personachat.service.job.JobHandler;
import java.time.Duration;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Runs queued embedding jobs. A job drains its backlog one page per run: while a full page was
 * embedded it defers itself and comes back for the next one.
 */
@Component
@RequiredArgsConstructor
public class EmbeddingJobHandler implements JobHandler<EmbeddingPayload> {

  private final EmbeddingStage embeddingStage;
  private final PipelineConfig pipelineConfig;

  @Override
  public JobType getType() {
    return JobType.EMBEDDING;
  }

  @Override
  public JobResult handle(EmbeddingPayload payload) {
    if (payload.personaId() == null) {
      throw new NonRetryableJobException("Embedding payload has no persona");
    }
    EmbeddingResult result;
    try {
      result = embeddingStage.embedBatch(payload.personaId(), payload.videoId());
    } catch (PersonaNotFoundException e) {
      throw new NonRetryableJobException(e.getMessage(), e);
    }

    int failed = result.totalCandidates() - result.embeddingsProcessed();
    if (failed > 0) {
      throw new EmbeddingException(
          failed + " of " + result.totalCandidates() + " caption chunks failed to embed", failed);
    }
    if (result.totalCandidates() >= pipelineConfig.getEmbedding().getPageSize()) {
      throw new JobDeferredException(
          "Embedded a full page, more chunks pending",
          Duration.ofSeconds(pipelineConfig.getEmbedding().getDrainDelaySeconds()));
    }
    return result;
  }
}
