package com.flamingo.ai.personachat.service.extraction;

import com.flamingo.ai.personachat.domain.entity.CaptionChunk;
import com.flamingo.ai.personachat.domain.entity.Video;
import com.flamingo.ai.personachat.domain.repository.CaptionChunkRepository;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

/** Swaps the stored caption chunks of a video in one transaction. */
@Component
@RequiredArgsConstructor
@Slf4j
public class CaptionChunkWriter {

  private final CaptionChunkRepository captionChunkRepository;

  /**
   * Deletes the video's chunks and stores the given segments as unembedded chunks.
   *
   * @return number of chunks stored
   */
  @Transactional
  public int replace(Video video, List<CaptionSegment> segments) {
    int deleted = captionChunkRepository.deleteByVideoId(video.getId());
    List<CaptionChunk> chunks =
        segments.stream()
            .map(
                segment ->
                    CaptionChunk.builder()
                        .video(video)
                        .persona(video.getPersona())
                        .startTime(segment.start())
                        .duration(segment.duration())
                        .text(segment.text())
                        .embedded(false)
                        .build())
            .toList();
    captionChunkRepository.saveAll(chunks);
    log.debug(
        "Replaced {} chunks of video {} with {}",
        deleted,
        video.getExternalVideoId(),
        chunks.size());
    return chunks.size();
  }
}
