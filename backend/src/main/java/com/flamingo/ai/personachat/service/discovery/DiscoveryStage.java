package com.flamingo.ai.personachat.service.discovery;

import com.flamingo.ai.personachat.domain.entity.Persona;
import com.flamingo.ai.personachat.domain.entity.Video;
import com.flamingo.ai.personachat.domain.enums.DiscoveryStatus;
import com.flamingo.ai.personachat.domain.enums.JobType;
import com.flamingo.ai.personachat.domain.repository.PersonaRepository;
import com.flamingo.ai.personachat.domain.repository.VideoRepository;
import com.flamingo.ai.personachat.exception.DuplicateJobException;
import com.flamingo.ai.personachat.exception.PersonaNotFoundException;
import com.flamingo.ai.personachat.job.payload.DiscoveryPayload;
import com.flamingo.ai.personachat.job.payload.DiscoveryResult;
import com.flamingo.ai.personachat.job.payload.ExtractionPayload;
import com.flamingo.ai.personachat.service.job.JobStore;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

/**
 * Walks a persona's channel catalog one page per call.
 *
 * <p>New videos are stored as pending and get an extraction job each. The persona's cursor and
 * discovery status are written last, so a failed page leaves the stored cursor untouched and the
 * page is fetched again on retry. Once a catalog has been walked completely, later calls refresh
 * from the newest upload and stop at the newest publish time seen before the refresh began, on
 * every page of that walk.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DiscoveryStage {

  private final PersonaRepository personaRepository;
  private final VideoRepository videoRepository;
  private final CatalogClient catalogClient;
  private final JobStore jobStore;
  private final MeterRegistry meterRegistry;

  /** Idempotency key of the extraction job of a video. */
  public static String extractionKey(String externalVideoId) {
    return "extraction:" + externalVideoId;
  }

  /** Idempotency key of the first discovery job of a persona. */
  public static String initialKey(UUID personaId) {
    return continuationKey(personaId, "initial");
  }

  /** Idempotency key of a user-requested discovery job; unique per request time. */
  public static String priorityKey(UUID personaId, long epochMillis) {
    return "priority-discovery:" + personaId + ":" + epochMillis;
  }

  /** Idempotency key of the discovery job continuing at the given cursor. */
  public static String continuationKey(UUID personaId, String nextToken) {
    return "discovery:" + personaId + ":" + nextToken;
  }

  /**
   * Fetches and stores the next catalog page of a persona.
   *
   * @throws PersonaNotFoundException if the persona does not exist
   */
  @Timed(value = "discovery.page", description = "Time to discover one catalog page")
  public DiscoveryResult discover(UUID personaId) {
    Persona persona =
        personaRepository
            .findById(personaId)
            .orElseThrow(() -> new PersonaNotFoundException(personaId));

    LocalDateTime boundary = persona.getRefreshBoundary();
    String cursor = persona.getContinuationToken();
    if (boundary == null
        && persona.getDiscoveryStatus() == DiscoveryStatus.COMPLETED
        && persona.getLatestPublishedAt() != null) {
      // New refresh walk from the newest upload
      boundary = persona.getLatestPublishedAt();
      cursor = null;
    }

    log.info(
        "Discovering videos for persona {} (channel {}, cursor {}, refresh boundary {})",
        personaId,
        persona.getChannelId(),
        cursor,
        boundary);

    CatalogPage page = catalogClient.listVideos(persona.getChannelId(), cursor);

    List<CatalogVideo> candidates = new ArrayList<>();
    boolean reachedKnown = false;
    for (CatalogVideo video : page.items()) {
      if (boundary != null
          && video.publishedAt() != null
          && !video.publishedAt().isAfter(boundary)) {
        reachedKnown = true;
        break;
      }
      candidates.add(video);
    }

    List<Video> inserted = insertUnseen(persona, candidates);
    for (Video video : inserted) {
      scheduleExtraction(persona.getId(), video.getExternalVideoId());
    }

    boolean hasMore = !reachedKnown && page.hasMore() && page.nextCursor() != null;
    String nextToken = hasMore ? page.nextCursor() : null;
    LocalDateTime newest =
        candidates.stream()
            .map(CatalogVideo::publishedAt)
            .filter(Objects::nonNull)
            .max(LocalDateTime::compareTo)
            .orElse(null);

    // Commit-last: the cursor only moves after the page is fully stored
    persona.advanceDiscovery(nextToken, hasMore, inserted.size(), newest, boundary);
    personaRepository.save(persona);

    if (hasMore) {
      scheduleContinuation(persona, nextToken);
    }

    meterRegistry.counter("discovery.videos.inserted").increment(inserted.size());
    log.info(
        "Discovery for persona {}: {} listed, {} new, more: {}",
        personaId,
        candidates.size(),
        inserted.size(),
        hasMore);
    return new DiscoveryResult(candidates.size(), inserted.size(), hasMore, nextToken);
  }

  private List<Video> insertUnseen(Persona persona, List<CatalogVideo> candidates) {
    if (candidates.isEmpty()) {
      return List.of();
    }
    Set<String> seen =
        new HashSet<>(
            videoRepository.findExistingExternalIds(
                candidates.stream().map(CatalogVideo::videoId).toList()));

    List<Video> inserted = new ArrayList<>();
    for (CatalogVideo candidate : candidates) {
      if (!seen.add(candidate.videoId())) {
        continue;
      }
      Video video =
          Video.builder()
              .persona(persona)
              .externalVideoId(candidate.videoId())
              .title(candidate.title())
              .description(candidate.description())
              .thumbnailUrl(candidate.thumbnailUrl())
              .duration(candidate.duration())
              .publishedAt(candidate.publishedAt())
              .viewCount(candidate.viewCount())
              .build();
      try {
        inserted.add(videoRepository.save(video));
      } catch (DataIntegrityViolationException e) {
        log.debug("Video {} was inserted concurrently, skipping", candidate.videoId());
      }
    }
    return inserted;
  }

  private void scheduleExtraction(UUID personaId, String externalVideoId) {
    try {
      jobStore.enqueue(
          JobType.EXTRACTION,
          new ExtractionPayload(externalVideoId, personaId),
          extractionKey(externalVideoId));
    } catch (DuplicateJobException e) {
      log.debug("Extraction of {} already scheduled", externalVideoId);
    }
  }

  private void scheduleContinuation(Persona persona, String nextToken) {
    try {
      jobStore.enqueue(
          JobType.DISCOVERY,
          new DiscoveryPayload(persona.getId(), persona.getChannelId()),
          continuationKey(persona.getId(), nextToken));
    } catch (DuplicateJobException e) {
      log.debug("Discovery of persona {} at {} already scheduled", persona.getId(), nextToken);
    }
  }
}
