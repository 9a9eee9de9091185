package com.flamingo.ai.personachat.domain.repository;

import com.flamingo.ai.personachat.domain.entity.ChatSession;
import java.util.List;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

/** Repository for ChatSession entities. */
@Repository
public interface ChatSessionRepository extends JpaRepository<ChatSession, UUID> {

  /** Finds sessions with a persona ordered by last activity. */
  List<ChatSession> findByPersonaIdOrderByUpdatedAtDesc(UUID personaId);
}
