package com.flamingo.ai.personachat.api.dto.request;

import jakarta.validation.constraints.NotNull;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Request DTO for running a discovery or embedding pass for a persona. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PersonaJobRequest {

  @NotNull(message = "Persona ID is required")
  private UUID personaId;

  /** Limits an embedding pass to one video; ignored by discovery. */
  private String videoId;
}
