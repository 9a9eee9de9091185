package com.flamingo.ai.personachat.api.dto.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Request DTO for renaming a chat session. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RenameChatSessionRequest {

  @NotBlank(message = "Title is required")
  @Size(min = 1, max = 200, message = "Title must be between 1 and 200 characters")
  private String title;
}
