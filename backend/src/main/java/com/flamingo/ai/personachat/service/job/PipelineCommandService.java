package com.flamingo.ai.personachat.service.job;

import com.flamingo.ai.personachat.api.dto.response.JobEnqueuedResponse;
import com.flamingo.ai.personachat.domain.entity.Job;
import com.flamingo.ai.personachat.domain.entity.Video;
import com.flamingo.ai.personachat.domain.enums.JobType;
import com.flamingo.ai.personachat.domain.repository.VideoRepository;
import com.flamingo.ai.personachat.exception.DuplicateJobException;
import com.flamingo.ai.personachat.exception.VideoNotFoundException;
import com.flamingo.ai.personachat.job.payload.DiscoveryResult;
import com.flamingo.ai.personachat.job.payload.EmbeddingResult;
import com.flamingo.ai.personachat.job.payload.ExtractionPayload;
import com.flamingo.ai.personachat.service.discovery.DiscoveryStage;
import com.flamingo.ai.personachat.service.embedding.EmbeddingStage;
import java.time.Clock;
import java.util.Optional;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * User-triggered pipeline operations. Discovery and embedding passes run inline; extraction
 * retries go through the queue because they wait on an external scrape run.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PipelineCommandService {

  private final DiscoveryStage discoveryStage;
  private final EmbeddingStage embeddingStage;
  private final VideoRepository videoRepository;
  private final JobStore jobStore;
  private final JobWorker jobWorker;
  private final Clock clock;

  /** Discovers one catalog page now. */
  public DiscoveryResult runDiscovery(UUID personaId) {
    log.info("Manual discovery requested for persona {}", personaId);
    return discoveryStage.discover(personaId);
  }

  /**
   * Queues a fresh extraction job for a video, bypassing the key of its original job.
   *
   * @throws VideoNotFoundException if the video is unknown
   */
  public JobEnqueuedResponse retryExtraction(String externalVideoId) {
    Video video =
        videoRepository
            .findWithPersonaByExternalVideoId(externalVideoId)
            .orElseThrow(() -> new VideoNotFoundException(externalVideoId));
    String key = DiscoveryStage.extractionKey(externalVideoId) + ":" + clock.millis();
    try {
      UUID jobId =
          jobStore.enqueue(
              JobType.EXTRACTION,
              new ExtractionPayload(externalVideoId, video.getPersona().getId()),
              key);
      log.info("Queued extraction retry {} for video {}", jobId, externalVideoId);
      return new JobEnqueuedResponse(jobId, key, "Caption extraction queued");
    } catch (DuplicateJobException e) {
      log.info("Extraction retry for video {} already queued", externalVideoId);
      return new JobEnqueuedResponse(null, key, "Caption extraction already queued");
    }
  }

  /** Embeds one page of pending caption chunks now. */
  public EmbeddingResult runEmbeddingBatch(UUID personaId, String videoId) {
    log.info("Manual embedding pass requested for persona {} video {}", personaId, videoId);
    return embeddingStage.embedBatch(personaId, videoId);
  }

  public Job getJob(UUID jobId) {
    return jobStore.getJob(jobId);
  }

  /** Runs one scheduler tick on the calling thread. */
  public Optional<JobRunOutcome> tick() {
    return jobWorker.runOnce();
  }
}
