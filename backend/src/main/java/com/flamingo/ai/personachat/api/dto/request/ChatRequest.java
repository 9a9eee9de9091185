package com.flamingo.ai.personachat.api.dto.request;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Request DTO for asking a persona a question. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ChatRequest {

  @NotBlank(message = "Message is required")
  @Size(max = 10000, message = "Message must not exceed 10000 characters")
  private String message;

  /** Existing session to continue. If null, a session is created with the first message. */
  private UUID chatSessionId;

  private UUID userId;

  /** Overrides the configured number of excerpts to retrieve. */
  @Min(value = 1, message = "topK must be at least 1")
  @Max(value = 50, message = "topK must not exceed 50")
  private Integer topK;

  /** Overrides the configured minimum cosine similarity. */
  @DecimalMin(value = "0.0", message = "similarityThreshold must be at least 0")
  @DecimalMax(value = "1.0", message = "similarityThreshold must not exceed 1")
  private Double similarityThreshold;
}
