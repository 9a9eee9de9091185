package com.flamingo.ai.personachat.domain.repository;

import com.flamingo.ai.personachat.domain.entity.ChatMessage;
import java.util.List;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

/** Repository for ChatMessage entities. */
@Repository
public interface ChatMessageRepository extends JpaRepository<ChatMessage, UUID> {

  /** Finds all messages for a session ordered by creation time ascending. */
  List<ChatMessage> findBySessionIdOrderByCreatedAtAsc(UUID sessionId);

  /** Counts messages by session. */
  long countBySessionId(UUID sessionId);
}
