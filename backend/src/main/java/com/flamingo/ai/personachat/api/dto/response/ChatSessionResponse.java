package com.flamingo.ai.personachat.api.dto.response;

import com.flamingo.ai.personachat.domain.entity.ChatSession;
import java.time.LocalDateTime;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for chat session data. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ChatSessionResponse {

  private UUID id;
  private UUID personaId;
  private UUID userId;
  private String title;
  private int messageCount;
  private LocalDateTime createdAt;
  private LocalDateTime updatedAt;

  /** Creates a ChatSessionResponse from a ChatSession entity with its message count. */
  public static ChatSessionResponse fromEntity(ChatSession session, long messageCount) {
    return ChatSessionResponse.builder()
        .id(session.getId())
        .personaId(session.getPersona().getId())
        .userId(session.getUserId())
        .title(session.getTitle())
        .messageCount((int) messageCount)
        .createdAt(session.getCreatedAt())
        .updatedAt(session.getUpdatedAt())
        .build();
  }
}
