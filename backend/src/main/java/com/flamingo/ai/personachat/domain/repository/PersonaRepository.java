package com.flamingo.ai.personachat.domain.repository;

import com.flamingo.ai.personachat.domain.entity.Persona;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

/** Repository for Persona entities. */
@Repository
public interface PersonaRepository extends JpaRepository<Persona, UUID> {

  Optional<Persona> findByUsername(String username);

  boolean existsByChannelIdAndUserId(String channelId, UUID userId);

  boolean existsByChannelIdAndUserIdIsNull(String channelId);

  boolean existsByUsername(String username);

  /** Lists public personas, most recently created first. */
  List<Persona> findByIsPublicTrueOrderByCreatedAtDesc();

  /** Lists public personas together with the private ones owned by a user. */
  @Query(
      "SELECT p FROM Persona p WHERE p.isPublic = true OR p.userId = :userId "
          + "ORDER BY p.createdAt DESC")
  List<Persona> findVisibleTo(@Param("userId") UUID userId);
}
