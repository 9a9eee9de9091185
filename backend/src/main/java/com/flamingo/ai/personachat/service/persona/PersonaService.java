package com.flamingo.ai.personachat.service.persona;

import com.flamingo.ai.personachat.api.dto.request.CreatePersonaRequest;
import com.flamingo.ai.personachat.api.dto.response.JobEnqueuedResponse;
import com.flamingo.ai.personachat.domain.entity.Persona;
import com.flamingo.ai.personachat.domain.entity.Video;
import java.util.List;
import java.util.UUID;
import org.springframework.data.domain.Page;

/** Service interface for persona registration and lookup. */
public interface PersonaService {

  /**
   * Registers a persona and schedules the first discovery of its catalog.
   *
   * @param request the create persona request
   * @return the created persona
   * @throws com.flamingo.ai.personachat.exception.DuplicatePersonaException if the owner already
   *     has a persona for the channel, or the username is taken
   */
  Persona createPersona(CreatePersonaRequest request);

  /**
   * Gets a persona by ID.
   *
   * @throws com.flamingo.ai.personachat.exception.PersonaNotFoundException if not found
   */
  Persona getPersona(UUID personaId);

  /**
   * Gets a persona by its channel handle.
   *
   * @throws com.flamingo.ai.personachat.exception.PersonaNotFoundException if not found
   */
  Persona getPersonaByUsername(String username);

  /**
   * Lists personas visible to a user.
   *
   * @param userId the viewer, or null for anonymous viewers (public personas only)
   */
  List<Persona> listPersonas(UUID userId);

  /** Lists a persona's videos, newest first. */
  Page<Video> listVideos(UUID personaId, int page, int size);

  /**
   * Schedules a discovery job that runs ahead of every other due job.
   *
   * @return the scheduled job
   */
  JobEnqueuedResponse boostDiscovery(UUID personaId);
}
