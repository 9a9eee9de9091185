package com.flamingo.ai.personachat.api.dto.response;

import com.flamingo.ai.personachat.domain.entity.Video;
import com.flamingo.ai.personachat.domain.enums.CaptionsStatus;
import java.time.LocalDateTime;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for a catalog video and its caption processing state. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class VideoResponse {

  private UUID id;
  private String videoId;
  private String title;
  private String thumbnailUrl;
  private String duration;
  private LocalDateTime publishedAt;
  private long viewCount;
  private CaptionsStatus captionsStatus;
  private String captionsError;
  private LocalDateTime processingCompletedAt;

  /** Creates a VideoResponse from a Video entity. */
  public static VideoResponse fromEntity(Video video) {
    return VideoResponse.builder()
        .id(video.getId())
        .videoId(video.getExternalVideoId())
        .title(video.getTitle())
        .thumbnailUrl(video.getThumbnailUrl())
        .duration(video.getDuration())
        .publishedAt(video.getPublishedAt())
        .viewCount(video.getViewCount() != null ? video.getViewCount() : 0L)
        .captionsStatus(video.getCaptionsStatus())
        .captionsError(video.getCaptionsError())
        .processingCompletedAt(video.getProcessingCompletedAt())
        .build();
  }
}
