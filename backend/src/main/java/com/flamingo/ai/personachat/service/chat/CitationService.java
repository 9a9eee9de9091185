package com.flamingo.ai.personachat.service.chat;

import com.flamingo.ai.personachat.agent.CitationExtractionAgent;
import com.flamingo.ai.personachat.agent.dto.CitationSelection;
import com.flamingo.ai.personachat.agent.dto.CitationSelection.CitedChunk;
import com.flamingo.ai.personachat.config.PipelineConfig;
import com.flamingo.ai.personachat.domain.model.VideoReference;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Turns a finished answer into validated video references.
 *
 * <p>The model proposes citations; only those naming a video from the retrieval context survive.
 * Each surviving citation is pinned to the retrieved chunk of that video whose start time is
 * closest to the claimed timestamp, so references always point at real excerpts.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CitationService {

  private final CitationExtractionAgent citationExtractionAgent;
  private final PipelineConfig pipelineConfig;
  private final MeterRegistry meterRegistry;

  /**
   * Selects references for an answer.
   *
   * @param answer the full streamed answer
   * @param excerpts the retrieval context the answer was generated from
   * @return at most {@code maxReferences} references, empty when the model call fails
   */
  @Timed(value = "chat.citations", description = "Time to extract citations")
  public List<VideoReference> extractReferences(String answer, List<RetrievedExcerpt> excerpts) {
    if (excerpts.isEmpty() || answer == null || answer.isBlank()) {
      return List.of();
    }

    CitationSelection selection;
    try {
      selection = citationExtractionAgent.selectCitations(answer, formatExcerpts(excerpts));
    } catch (Exception e) {
      log.warn("Citation extraction failed: {}, answering without references", e.getMessage());
      meterRegistry.counter("chat.citations.failures").increment();
      return List.of();
    }
    if (selection == null || selection.citations() == null) {
      return List.of();
    }
    return validate(selection.citations(), excerpts);
  }

  List<VideoReference> validate(List<CitedChunk> cited, List<RetrievedExcerpt> excerpts) {
    int limit = pipelineConfig.getRetrieval().getMaxReferences();
    List<VideoReference> references = new ArrayList<>();
    Set<String> seen = new HashSet<>();

    for (CitedChunk citation : cited) {
      if (references.size() >= limit) {
        break;
      }
      if (citation == null || citation.videoId() == null) {
        continue;
      }
      RetrievedExcerpt match = closestExcerpt(citation, excerpts);
      if (match == null) {
        log.warn(
            "Dropping citation of video {} not present in retrieval context", citation.videoId());
        meterRegistry.counter("chat.citations.dropped").increment();
        continue;
      }
      if (!seen.add(match.videoId() + "@" + match.startTime())) {
        continue;
      }
      double confidence = clampConfidence(citation.confidence());
      references.add(
          new VideoReference(match.videoId(), match.startTime(), confidence, match.title()));
    }
    log.debug("Kept {} of {} proposed citations", references.size(), cited.size());
    return references;
  }

  /** Bounds a model-reported confidence to [0, 1]; NaN counts as no confidence. */
  static double clampConfidence(double confidence) {
    if (Double.isNaN(confidence)) {
      return 0.0;
    }
    return Math.max(0.0, Math.min(1.0, confidence));
  }

  private RetrievedExcerpt closestExcerpt(CitedChunk citation, List<RetrievedExcerpt> excerpts) {
    return excerpts.stream()
        .filter(e -> e.videoId().equals(citation.videoId()))
        .min(Comparator.comparingDouble(e -> Math.abs(e.startTime() - citation.timestamp())))
        .orElse(null);
  }

  private String formatExcerpts(List<RetrievedExcerpt> excerpts) {
    StringBuilder sb = new StringBuilder();
    for (RetrievedExcerpt excerpt : excerpts) {
      sb.append("videoId: ")
          .append(excerpt.videoId())
          .append(" | timestamp: ")
          .append(excerpt.startTime())
          .append(" | title: ")
          .append(excerpt.title())
          .append('\n')
          .append(excerpt.text())
          .append("\n\n");
    }
    return sb.toString();
  }
}
