package com.flamingo.ai.personachat.service.embedding;

import com.flamingo.ai.personachat.config.PipelineConfig;
import com.flamingo.ai.personachat.domain.entity.CaptionChunk;
import com.flamingo.ai.personachat.domain.entity.Persona;
import com.flamingo.ai.personachat.domain.entity.Video;
import com.flamingo.ai.personachat.domain.enums.CaptionsStatus;
import com.flamingo.ai.personachat.domain.repository.CaptionChunkRepository;
import com.flamingo.ai.personachat.domain.repository.PersonaRepository;
import com.flamingo.ai.personachat.domain.repository.VideoRepository;
import com.flamingo.ai.personachat.exception.EmbeddingException;
import com.flamingo.ai.personachat.exception.PersonaNotFoundException;
import com.flamingo.ai.personachat.job.payload.EmbeddingResult;
import com.flamingo.ai.personachat.vectorstore.VectorMetadata;
import com.flamingo.ai.personachat.vectorstore.VectorStore;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;

/**
 * Embeds pending caption chunks into the persona's vector namespace.
 *
 * <p>Each call handles one bounded page of chunks in fixed-size concurrent batches and waits for
 * every batch before starting the next. A chunk is flagged as embedded only after its vector
 * upsert succeeded; upserts are keyed by chunk id, so repeating a chunk is harmless.
 */
@Service
@Slf4j
public class EmbeddingStage {

  private final CaptionChunkRepository captionChunkRepository;
  private final VideoRepository videoRepository;
  private final PersonaRepository personaRepository;
  private final EmbeddingService embeddingService;
  private final VectorStore vectorStore;
  private final PipelineConfig pipelineConfig;
  private final MeterRegistry meterRegistry;
  private final Executor embeddingExecutor;

  public EmbeddingStage(
      CaptionChunkRepository captionChunkRepository,
      VideoRepository videoRepository,
      PersonaRepository personaRepository,
      EmbeddingService embeddingService,
      VectorStore vectorStore,
      PipelineConfig pipelineConfig,
      MeterRegistry meterRegistry,
      @Qualifier("embeddingExecutor") Executor embeddingExecutor) {
    this.captionChunkRepository = captionChunkRepository;
    this.videoRepository = videoRepository;
    this.personaRepository = personaRepository;
    this.embeddingService = embeddingService;
    this.vectorStore = vectorStore;
    this.pipelineConfig = pipelineConfig;
    this.meterRegistry = meterRegistry;
    this.embeddingExecutor = embeddingExecutor;
  }

  /**
   * Embeds up to one page of unembedded chunks.
   *
   * @param personaId persona owning the chunks
   * @param videoId catalog id of a single video to restrict to, or null for all videos
   * @return chunks embedded and chunks selected; a full page means more may remain
   * @throws PersonaNotFoundException if the persona does not exist
   * @throws EmbeddingException if chunks were selected but none could be embedded
   */
  @Timed(value = "embedding.batch", description = "Time to embed one page of caption chunks")
  public EmbeddingResult embedBatch(UUID personaId, String videoId) {
    Persona persona =
        personaRepository
            .findById(personaId)
            .orElseThrow(() -> new PersonaNotFoundException(personaId));

    int pageSize = pipelineConfig.getEmbedding().getPageSize();
    int batchSize = Math.max(1, pipelineConfig.getEmbedding().getBatchSize());
    List<CaptionChunk> candidates =
        videoId == null
            ? captionChunkRepository.findUnembeddedByPersona(personaId, PageRequest.of(0, pageSize))
            : captionChunkRepository.findUnembeddedByVideo(
                personaId, videoId, PageRequest.of(0, pageSize));

    String namespace = persona.getVectorNamespace();
    int processed = 0;
    for (int from = 0; from < candidates.size(); from += batchSize) {
      List<CaptionChunk> batch =
          candidates.subList(from, Math.min(from + batchSize, candidates.size()));
      List<CompletableFuture<Boolean>> futures =
          batch.stream()
              .map(
                  chunk ->
                      CompletableFuture.supplyAsync(
                          () -> embedChunk(namespace, personaId, chunk), embeddingExecutor))
              .toList();
      CompletableFuture.allOf(futures.toArray(CompletableFuture[]::new)).join();
      for (CompletableFuture<Boolean> future : futures) {
        if (future.join()) {
          processed++;
        }
      }
    }

    Set<String> touchedVideos = new LinkedHashSet<>();
    if (videoId != null) {
      touchedVideos.add(videoId);
    }
    candidates.forEach(chunk -> touchedVideos.add(chunk.getVideo().getExternalVideoId()));
    touchedVideos.forEach(this::completeIfFullyEmbedded);

    log.info(
        "Embedded {}/{} chunks for persona {}{}",
        processed,
        candidates.size(),
        personaId,
        videoId != null ? " (video " + videoId + ")" : "");

    if (!candidates.isEmpty() && processed == 0) {
      throw new EmbeddingException(
          "No embeddings produced for " + candidates.size() + " caption chunks",
          candidates.size());
    }
    return new EmbeddingResult(processed, candidates.size());
  }

  private boolean embedChunk(String namespace, UUID personaId, CaptionChunk chunk) {
    try {
      float[] vector = embeddingService.embedPassage(chunk.getText());
      if (vector.length == 0) {
        log.warn("Empty embedding for chunk {}", chunk.getId());
        meterRegistry.counter("embedding.chunks.failed").increment();
        return false;
      }
      vectorStore.upsert(
          namespace,
          chunk.getId().toString(),
          vector,
          new VectorMetadata(
              chunk.getText(),
              chunk.getVideo().getExternalVideoId(),
              personaId.toString(),
              chunk.getStartTime()));
      captionChunkRepository.markEmbedded(chunk.getId());
      meterRegistry.counter("embedding.chunks.embedded").increment();
      return true;
    } catch (RuntimeException e) {
      // Left unembedded; the next call picks the chunk up again
      log.warn("Failed to embed chunk {}: {}", chunk.getId(), e.getMessage());
      meterRegistry.counter("embedding.chunks.failed").increment();
      return false;
    }
  }

  private void completeIfFullyEmbedded(String externalVideoId) {
    videoRepository
        .findByExternalVideoId(externalVideoId)
        .filter(video -> video.getCaptionsStatus() == CaptionsStatus.EXTRACTED)
        .filter(video -> captionChunkRepository.countByVideoIdAndEmbeddedFalse(video.getId()) == 0)
        .ifPresent(this::markCompleted);
  }

  private void markCompleted(Video video) {
    video.markCompleted();
    videoRepository.save(video);
    meterRegistry.counter("videos.completed").increment();
    log.info("Video {} is fully embedded", video.getExternalVideoId());
  }
}
