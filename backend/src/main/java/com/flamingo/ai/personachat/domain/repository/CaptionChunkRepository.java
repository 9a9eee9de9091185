package com.flamingo.ai.personachat.domain.repository;

import com.flamingo.ai.personachat.domain.entity.CaptionChunk;
import java.util.List;
import java.util.UUID;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

/** Repository for CaptionChunk entities. */
@Repository
public interface CaptionChunkRepository extends JpaRepository<CaptionChunk, UUID> {

  /** Finds chunks of a persona that are not yet in the vector store. */
  @Query(
      "SELECT c FROM CaptionChunk c JOIN FETCH c.video "
          + "WHERE c.persona.id = :personaId AND c.embedded = false "
          + "ORDER BY c.createdAt ASC")
  List<CaptionChunk> findUnembeddedByPersona(
      @Param("personaId") UUID personaId, Pageable pageable);

  /** Finds unembedded chunks of a single video. */
  @Query(
      "SELECT c FROM CaptionChunk c JOIN FETCH c.video "
          + "WHERE c.persona.id = :personaId AND c.video.externalVideoId = :videoId "
          + "AND c.embedded = false ORDER BY c.startTime ASC")
  List<CaptionChunk> findUnembeddedByVideo(
      @Param("personaId") UUID personaId,
      @Param("videoId") String externalVideoId,
      Pageable pageable);

  /** Finds all chunks of a video in playback order. */
  List<CaptionChunk> findByVideoIdOrderByStartTimeAsc(UUID videoId);

  long countByVideoId(UUID videoId);

  long countByVideoIdAndEmbeddedFalse(UUID videoId);

  @Transactional
  @Modifying(clearAutomatically = true, flushAutomatically = true)
  @Query("DELETE FROM CaptionChunk c WHERE c.video.id = :videoId")
  int deleteByVideoId(@Param("videoId") UUID videoId);

  /** Flags a chunk as present in the vector store. */
  @Transactional
  @Modifying
  @Query("UPDATE CaptionChunk c SET c.embedded = true WHERE c.id = :id")
  int markEmbedded(@Param("id") UUID id);
}
