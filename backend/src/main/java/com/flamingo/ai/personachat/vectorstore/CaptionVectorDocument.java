package com.flamingo.ai.personachat.vectorstore;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Source document of a caption vector. Search requests leave {@code embedding} out of the returned
 * source.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class CaptionVectorDocument {

  private String text;
  private String videoId;
  private String personaId;
  private Double startTime;
  private List<Float> embedding;

  static CaptionVectorDocument of(VectorMetadata metadata, List<Float> embedding) {
    return CaptionVectorDocument.builder()
        .text(metadata.text())
        .videoId(metadata.videoId())
        .personaId(metadata.personaId())
        .startTime(metadata.startTime())
        .embedding(embedding)
        .build();
  }

  VectorMetadata toMetadata() {
    return new VectorMetadata(text, videoId, personaId, startTime != null ? startTime : 0.0);
  }
}
