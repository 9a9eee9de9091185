package com.flamingo.ai.personachat.api.dto.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Request DTO for registering a creator persona. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CreatePersonaRequest {

  @NotBlank(message = "Channel ID is required")
  @Pattern(regexp = "[A-Za-z0-9_-]+", message = "Channel ID contains invalid characters")
  private String channelId;

  @NotBlank(message = "Username is required")
  @Size(max = 100, message = "Username must not exceed 100 characters")
  private String username;

  @NotBlank(message = "Title is required")
  @Size(max = 255, message = "Title must not exceed 255 characters")
  private String title;

  @Size(max = 5000, message = "Description must not exceed 5000 characters")
  private String description;

  private String thumbnailUrl;

  /** Owner of the persona; null registers a system persona. */
  private UUID userId;

  private Boolean isPublic;
}
