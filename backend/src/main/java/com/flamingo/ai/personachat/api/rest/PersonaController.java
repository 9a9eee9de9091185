package com.flamingo.ai.personachat.api.rest;

import com.flamingo.ai.personachat.api.dto.request.CreatePersonaRequest;
import com.flamingo.ai.personachat.api.dto.response.JobEnqueuedResponse;
import com.flamingo.ai.personachat.api.dto.response.PersonaResponse;
import com.flamingo.ai.personachat.api.dto.response.VideoResponse;
import com.flamingo.ai.personachat.domain.entity.Persona;
import com.flamingo.ai.personachat.service.persona.PersonaService;
import jakarta.validation.Valid;
import java.util.List;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.Page;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/** REST controller for creator personas. */
@RestController
@RequestMapping("/api/personas")
@RequiredArgsConstructor
public class PersonaController {

  private final PersonaService personaService;

  /** Registers a persona and starts discovering its videos. */
  @PostMapping
  public ResponseEntity<PersonaResponse> createPersona(
      @Valid @RequestBody CreatePersonaRequest request) {
    Persona persona = personaService.createPersona(request);
    return ResponseEntity.status(HttpStatus.CREATED).body(PersonaResponse.fromEntity(persona));
  }

  /** Lists public personas plus the caller's own. */
  @GetMapping
  public ResponseEntity<List<PersonaResponse>> listPersonas(
      @RequestParam(required = false) UUID userId) {
    List<PersonaResponse> responses =
        personaService.listPersonas(userId).stream().map(PersonaResponse::fromEntity).toList();
    return ResponseEntity.ok(responses);
  }

  @GetMapping("/{personaId}")
  public ResponseEntity<PersonaResponse> getPersona(@PathVariable UUID personaId) {
    return ResponseEntity.ok(PersonaResponse.fromEntity(personaService.getPersona(personaId)));
  }

  @GetMapping("/by-username/{username}")
  public ResponseEntity<PersonaResponse> getPersonaByUsername(@PathVariable String username) {
    return ResponseEntity.ok(
        PersonaResponse.fromEntity(personaService.getPersonaByUsername(username)));
  }

  /** Lists a persona's videos with their caption status. */
  @GetMapping("/{personaId}/videos")
  public ResponseEntity<Page<VideoResponse>> listVideos(
      @PathVariable UUID personaId,
      @RequestParam(defaultValue = "0") int page,
      @RequestParam(defaultValue = "20") int size) {
    return ResponseEntity.ok(
        personaService.listVideos(personaId, page, size).map(VideoResponse::fromEntity));
  }

  /** Schedules discovery of this persona ahead of all other queued work. */
  @PostMapping("/{personaId}/priority-boost")
  public ResponseEntity<JobEnqueuedResponse> boostDiscovery(@PathVariable UUID personaId) {
    return ResponseEntity.status(HttpStatus.ACCEPTED)
        .body(personaService.boostDiscovery(personaId));
  }
}
