package com.flamingo.ai.personachat.api.dto.request;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Request DTO for re-running caption extraction of a video. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ExtractionJobRequest {

  @NotBlank(message = "Video ID is required")
  private String videoId;
}
