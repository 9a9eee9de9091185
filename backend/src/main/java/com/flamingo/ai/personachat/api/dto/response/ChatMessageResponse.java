package com.flamingo.ai.personachat.api.dto.response;

import com.flamingo.ai.personachat.domain.entity.ChatMessage;
import com.flamingo.ai.personachat.domain.enums.MessageRole;
import com.flamingo.ai.personachat.domain.model.VideoReference;
import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for chat message data. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ChatMessageResponse {

  private UUID id;
  private MessageRole role;
  private String content;
  private List<VideoReference> references;
  private LocalDateTime createdAt;

  /** Creates a ChatMessageResponse from a ChatMessage entity. */
  public static ChatMessageResponse fromEntity(ChatMessage message) {
    return ChatMessageResponse.builder()
        .id(message.getId())
        .role(message.getRole())
        .content(message.getContent())
        .references(message.getReferences())
        .createdAt(message.getCreatedAt())
        .build();
  }
}
