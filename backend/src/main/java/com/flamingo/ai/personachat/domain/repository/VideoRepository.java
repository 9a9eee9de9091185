package com.flamingo.ai.personachat.domain.repository;

import com.flamingo.ai.personachat.domain.entity.Video;
import com.flamingo.ai.personachat.domain.enums.CaptionsStatus;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

/** Repository for Video entities. */
@Repository
public interface VideoRepository extends JpaRepository<Video, UUID> {

  Optional<Video> findByExternalVideoId(String externalVideoId);

  /** Loads a video together with its persona. */
  @Query("SELECT v FROM Video v JOIN FETCH v.persona WHERE v.externalVideoId = :videoId")
  Optional<Video> findWithPersonaByExternalVideoId(@Param("videoId") String externalVideoId);

  /** Returns which of the given catalog ids are already stored. */
  @Query("SELECT v.externalVideoId FROM Video v WHERE v.externalVideoId IN :ids")
  List<String> findExistingExternalIds(@Param("ids") Collection<String> ids);

  /** Finds the videos of a persona among the given catalog ids. */
  List<Video> findByPersonaIdAndExternalVideoIdIn(UUID personaId, Collection<String> ids);

  Page<Video> findByPersonaIdOrderByPublishedAtDesc(UUID personaId, Pageable pageable);

  long countByPersonaIdAndCaptionsStatus(UUID personaId, CaptionsStatus status);
}
