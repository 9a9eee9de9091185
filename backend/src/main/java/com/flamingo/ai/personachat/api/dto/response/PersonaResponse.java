package com.flamingo.ai.personachat.api.dto.response;

import com.flamingo.ai.personachat.domain.entity.Persona;
import com.flamingo.ai.personachat.domain.enums.DiscoveryStatus;
import java.time.LocalDateTime;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for persona data. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PersonaResponse {

  private UUID id;
  private String username;
  private String channelId;
  private String title;
  private String description;
  private String thumbnailUrl;
  private UUID userId;
  private Boolean isPublic;
  private int videoCount;
  private DiscoveryStatus discoveryStatus;
  private LocalDateTime lastVideoDiscovered;
  private LocalDateTime createdAt;

  /** Creates a PersonaResponse from a Persona entity. */
  public static PersonaResponse fromEntity(Persona persona) {
    return PersonaResponse.builder()
        .id(persona.getId())
        .username(persona.getUsername())
        .channelId(persona.getChannelId())
        .title(persona.getTitle())
        .description(persona.getDescription())
        .thumbnailUrl(persona.getThumbnailUrl())
        .userId(persona.getUserId())
        .isPublic(Boolean.TRUE.equals(persona.getIsPublic()))
        .videoCount(persona.getVideoCount() != null ? persona.getVideoCount() : 0)
        .discoveryStatus(persona.getDiscoveryStatus())
        .lastVideoDiscovered(persona.getLastVideoDiscovered())
        .createdAt(persona.getCreatedAt())
        .build();
  }
}
