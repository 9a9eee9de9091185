package com.flamingo.ai.personachat.service.extraction;

import com.flamingo.ai.personachat.config.PipelineConfig;
import com.flamingo.ai.personachat.domain.entity.Video;
import com.flamingo.ai.personachat.domain.enums.CaptionsStatus;
import com.flamingo.ai.personachat.domain.enums.JobType;
import com.flamingo.ai.personachat.domain.repository.CaptionChunkRepository;
import com.flamingo.ai.personachat.domain.repository.VideoRepository;
import com.flamingo.ai.personachat.exception.CaptionExtractionException;
import com.flamingo.ai.personachat.exception.DuplicateJobException;
import com.flamingo.ai.personachat.exception.JobDeferredException;
import com.flamingo.ai.personachat.exception.VideoNotFoundException;
import com.flamingo.ai.personachat.job.payload.EmbeddingPayload;
import com.flamingo.ai.personachat.job.payload.ExtractionResult;
import com.flamingo.ai.personachat.service.job.JobStore;
import com.flamingo.ai.personachat.vectorstore.VectorStore;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Duration;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Drives the caption extraction of one video.
 *
 * <p>The first call starts a scrape run and binds its id to the video; later calls resume that run
 * instead of starting another. While the run is in flight the call ends with {@link
 * JobDeferredException}. Once captions arrive they replace the stored chunks, unless the stored
 * chunk count already matches, and the video moves to {@code EXTRACTED} with an embedding job
 * queued.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ExtractionStage {

  static final String NO_CAPTIONS = "No captions available";

  private final VideoRepository videoRepository;
  private final CaptionChunkRepository captionChunkRepository;
  private final CaptionChunkWriter captionChunkWriter;
  private final CaptionScraper captionScraper;
  private final VectorStore vectorStore;
  private final JobStore jobStore;
  private final PipelineConfig pipelineConfig;
  private final MeterRegistry meterRegistry;

  /** Idempotency key of the embedding job following a run. */
  public static String embeddingKey(String externalVideoId, String runId) {
    return "embedding:" + externalVideoId + ":" + runId;
  }

  /**
   * Advances the extraction of a video.
   *
   * @param externalVideoId catalog id of the video
   * @throws VideoNotFoundException if the video is unknown
   * @throws JobDeferredException while the scrape run is still working
   * @throws CaptionExtractionException if the run produced no usable captions
   */
  @Timed(value = "extraction.run", description = "Time to advance a caption extraction")
  public ExtractionResult extract(String externalVideoId) {
    Video video =
        videoRepository
            .findWithPersonaByExternalVideoId(externalVideoId)
            .orElseThrow(() -> new VideoNotFoundException(externalVideoId));

    try {
      return collect(video, bindRun(video));
    } catch (JobDeferredException | CaptionExtractionException e) {
      throw e;
    } catch (RuntimeException e) {
      fail(video, e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName(), false);
      throw e;
    }
  }

  private String bindRun(Video video) {
    String runId = video.getExternalRunId();
    if (runId == null) {
      runId = captionScraper.startRun(video.getExternalVideoId());
      video.startProcessing(runId);
      videoRepository.save(video);
    } else if (video.getCaptionsStatus() == CaptionsStatus.FAILED
        || video.getCaptionsStatus() == CaptionsStatus.PENDING) {
      log.info("Resuming scrape run {} for video {}", runId, video.getExternalVideoId());
      video.resumeProcessing();
      videoRepository.save(video);
    }
    return runId;
  }

  private ExtractionResult collect(Video video, String runId) {
    String externalVideoId = video.getExternalVideoId();
    ScrapeResult result = captionScraper.fetchResults(runId);

    switch (result.state()) {
      case PENDING -> throw new JobDeferredException(
          "Scrape run " + runId + " still running",
          Duration.ofSeconds(pipelineConfig.getExtraction().getPendingRunRecheckSeconds()),
          50);
      case FAILED -> {
        fail(video, result.failureReason(), true);
        throw new CaptionExtractionException(externalVideoId, result.failureReason());
      }
      default -> {
        // SUCCEEDED
      }
    }

    List<CaptionSegment> segments = result.segments();
    if (segments.isEmpty()) {
      fail(video, NO_CAPTIONS, true);
      throw new CaptionExtractionException(externalVideoId, NO_CAPTIONS);
    }

    long existing = captionChunkRepository.countByVideoId(video.getId());
    if (existing == segments.size()) {
      log.info(
          "Video {} already has {} caption chunks, skipping rewrite", externalVideoId, existing);
      if (video.getCaptionsStatus() != CaptionsStatus.COMPLETED) {
        video.markExtracted();
        videoRepository.save(video);
        scheduleEmbedding(video, runId);
      }
      return new ExtractionResult(segments.size(), true);
    }

    if (existing > 0) {
      vectorStore.deleteByVideo(video.getPersona().getVectorNamespace(), externalVideoId);
    }
    int stored = captionChunkWriter.replace(video, segments);

    video.markExtracted();
    videoRepository.save(video);
    scheduleEmbedding(video, runId);

    meterRegistry.counter("extraction.chunks.stored").increment(stored);
    log.info("Extracted {} caption chunks for video {}", stored, externalVideoId);
    return new ExtractionResult(stored, false);
  }

  private void fail(Video video, String reason, boolean discardRun) {
    video.markFailed(reason, discardRun);
    videoRepository.save(video);
    meterRegistry.counter("extraction.failed").increment();
    log.warn("Caption extraction failed for video {}: {}", video.getExternalVideoId(), reason);
  }

  private void scheduleEmbedding(Video video, String runId) {
    try {
      jobStore.enqueue(
          JobType.EMBEDDING,
          new EmbeddingPayload(video.getPersona().getId(), video.getExternalVideoId()),
          embeddingKey(video.getExternalVideoId(), runId));
    } catch (DuplicateJobException e) {
      log.debug("Embedding of video {} already scheduled", video.getExternalVideoId());
    }
  }
}
