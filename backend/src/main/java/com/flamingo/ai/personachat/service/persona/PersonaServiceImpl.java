package com.flamingo.ai.personachat.service.persona;

import com.flamingo.ai.personachat.api.dto.request.CreatePersonaRequest;
import com.flamingo.ai.personachat.api.dto.response.JobEnqueuedResponse;
import com.flamingo.ai.personachat.config.PipelineConfig;
import com.flamingo.ai.personachat.domain.entity.Persona;
import com.flamingo.ai.personachat.domain.entity.Video;
import com.flamingo.ai.personachat.domain.enums.JobType;
import com.flamingo.ai.personachat.domain.repository.PersonaRepository;
import com.flamingo.ai.personachat.domain.repository.VideoRepository;
import com.flamingo.ai.personachat.exception.DuplicatePersonaException;
import com.flamingo.ai.personachat.exception.PersonaNotFoundException;
import com.flamingo.ai.personachat.job.payload.DiscoveryPayload;
import com.flamingo.ai.personachat.service.discovery.DiscoveryStage;
import com.flamingo.ai.personachat.service.job.JobStore;
import com.flamingo.ai.personachat.vectorstore.VectorStore;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

/** Implementation of the PersonaService. */
@Service
@RequiredArgsConstructor
@Slf4j
public class PersonaServiceImpl implements PersonaService {

  /** Scheduled time of boosted jobs; earlier than any regular job. */
  static final LocalDateTime EPOCH = LocalDateTime.ofEpochSecond(0, 0, ZoneOffset.UTC);

  private static final int MAX_VIDEO_PAGE_SIZE = 100;

  private final PersonaRepository personaRepository;
  private final VideoRepository videoRepository;
  private final VectorStore vectorStore;
  private final JobStore jobStore;
  private final PipelineConfig pipelineConfig;
  private final MeterRegistry meterRegistry;
  private final Clock clock;
  private final TransactionTemplate transactionTemplate;

  /**
   * Registers the persona and its initial discovery job in one transaction, then creates the
   * vector namespace once the connection is released. A namespace that cannot be created now is
   * created by the first caption upsert.
   */
  @Override
  @Timed(value = "persona.create", description = "Time to register a persona")
  public Persona createPersona(CreatePersonaRequest request) {
    Persona persona = transactionTemplate.execute(status -> register(request));
    try {
      vectorStore.ensureNamespace(persona.getVectorNamespace());
    } catch (RuntimeException e) {
      log.warn(
          "Vector namespace {} not created yet for persona {}: {}",
          persona.getVectorNamespace(),
          persona.getId(),
          e.getMessage());
      meterRegistry.counter("personas.namespace_deferred").increment();
    }
    meterRegistry.counter("personas.created").increment();
    return persona;
  }

  private Persona register(CreatePersonaRequest request) {
    String channelId = request.getChannelId().trim();
    boolean duplicate =
        request.getUserId() != null
            ? personaRepository.existsByChannelIdAndUserId(channelId, request.getUserId())
            : personaRepository.existsByChannelIdAndUserIdIsNull(channelId);
    if (duplicate) {
      throw new DuplicatePersonaException(channelId, "Persona already exists for this channel");
    }
    String username = request.getUsername().trim().replaceFirst("^@", "");
    if (personaRepository.existsByUsername(username)) {
      throw new DuplicatePersonaException(channelId, "Username is already taken: " + username);
    }

    Persona persona =
        personaRepository.save(
            Persona.builder()
                .channelId(channelId)
                .username(username)
                .title(request.getTitle().trim())
                .description(request.getDescription() != null ? request.getDescription() : "")
                .thumbnailUrl(request.getThumbnailUrl())
                .userId(request.getUserId())
                .isPublic(request.getIsPublic() == null || request.getIsPublic())
                .topK(pipelineConfig.getRetrieval().getTopK())
                .build());
    log.info("Created persona {} for channel {}", persona.getId(), channelId);

    String key = DiscoveryStage.initialKey(persona.getId());
    UUID jobId =
        jobStore.enqueue(JobType.DISCOVERY, new DiscoveryPayload(persona.getId(), channelId), key);
    log.info("Scheduled initial discovery job {} for persona {}", jobId, persona.getId());
    return persona;
  }

  @Override
  @Transactional(readOnly = true)
  public Persona getPersona(UUID personaId) {
    return personaRepository
        .findById(personaId)
        .orElseThrow(() -> new PersonaNotFoundException(personaId));
  }

  @Override
  @Transactional(readOnly = true)
  public Persona getPersonaByUsername(String username) {
    String handle = username.replaceFirst("^@", "");
    return personaRepository
        .findByUsername(handle)
        .orElseThrow(() -> new PersonaNotFoundException(handle));
  }

  @Override
  @Transactional(readOnly = true)
  public List<Persona> listPersonas(UUID userId) {
    return userId != null
        ? personaRepository.findVisibleTo(userId)
        : personaRepository.findByIsPublicTrueOrderByCreatedAtDesc();
  }

  @Override
  @Transactional(readOnly = true)
  public Page<Video> listVideos(UUID personaId, int page, int size) {
    getPersona(personaId);
    int pageSize = Math.max(1, Math.min(size, MAX_VIDEO_PAGE_SIZE));
    return videoRepository.findByPersonaIdOrderByPublishedAtDesc(
        personaId, PageRequest.of(Math.max(0, page), pageSize));
  }

  @Override
  @Transactional
  public JobEnqueuedResponse boostDiscovery(UUID personaId) {
    Persona persona = getPersona(personaId);
    String key = DiscoveryStage.priorityKey(personaId, clock.millis());
    UUID jobId =
        jobStore.enqueue(
            JobType.DISCOVERY,
            new DiscoveryPayload(personaId, persona.getChannelId()),
            key,
            pipelineConfig.getJobs().getMaxRetries(),
            EPOCH);
    log.info("Priority discovery job {} scheduled for persona {}", jobId, personaId);
    meterRegistry.counter("personas.priority_boosts").increment();
    return new JobEnqueuedResponse(
        jobId,
        key,
        "Priority boost activated for " + persona.getTitle() + ". Videos will be processed first.");
  }
}
