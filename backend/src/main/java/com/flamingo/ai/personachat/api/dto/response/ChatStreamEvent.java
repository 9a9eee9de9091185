package com.flamingo.ai.personachat.api.dto.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.flamingo.ai.personachat.domain.model.VideoReference;
import java.util.List;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One server-sent event of a chat answer. A stream carries any number of {@code content} events,
 * at most one {@code references} event, and ends with exactly one {@code complete} or {@code
 * error} event.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ChatStreamEvent {

  public static final String CONTENT = "content";
  public static final String REFERENCES = "references";
  public static final String COMPLETE = "complete";
  public static final String ERROR = "error";

  private String type;
  private String content;
  private List<VideoReference> references;
  private UUID messageId;
  private UUID chatSessionId;
  private String error;

  /** Creates a content event carrying one streamed token. */
  public static ChatStreamEvent content(String token) {
    return ChatStreamEvent.builder().type(CONTENT).content(token).build();
  }

  /** Creates a references event. */
  public static ChatStreamEvent references(List<VideoReference> references) {
    return ChatStreamEvent.builder().type(REFERENCES).references(references).build();
  }

  /** Creates the terminal success event. */
  public static ChatStreamEvent complete(UUID messageId, UUID chatSessionId) {
    return ChatStreamEvent.builder()
        .type(COMPLETE)
        .messageId(messageId)
        .chatSessionId(chatSessionId)
        .build();
  }

  /** Creates the terminal failure event. */
  public static ChatStreamEvent error(String message) {
    return ChatStreamEvent.builder().type(ERROR).error(message).build();
  }
}
