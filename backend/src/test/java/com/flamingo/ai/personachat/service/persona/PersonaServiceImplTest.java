package com.flamingo.ai.personachat.service.persona;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.flamingo.ai.personachat.api.dto.request.CreatePersonaRequest;
import com.flamingo.ai.personachat.api.dto.response.JobEnqueuedResponse;
import com.flamingo.ai.personachat.config.PipelineConfig;
import com.flamingo.ai.personachat.domain.entity.Persona;
import com.flamingo.ai.personachat.domain.enums.JobType;
import com.flamingo.ai.personachat.domain.repository.PersonaRepository;
import com.flamingo.ai.personachat.domain.repository.VideoRepository;
import com.flamingo.ai.personachat.exception.DuplicatePersonaException;
import com.flamingo.ai.personachat.exception.SearchException;
import com.flamingo.ai.personachat.job.payload.DiscoveryPayload;
import com.flamingo.ai.personachat.service.discovery.DiscoveryStage;
import com.flamingo.ai.personachat.service.job.JobStore;
import com.flamingo.ai.personachat.vectorstore.VectorStore;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Optional;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

@ExtendWith(MockitoExtension.class)
class PersonaServiceImplTest {

  private static final Clock CLOCK =
      Clock.fixed(Instant.parse("2025-03-01T12:00:00Z"), ZoneOffset.UTC);

  @Mock private PersonaRepository personaRepository;
  @Mock private VideoRepository videoRepository;
  @Mock private VectorStore vectorStore;
  @Mock private JobStore jobStore;
  @Mock private PlatformTransactionManager transactionManager;

  private PersonaServiceImpl personaService;
  private PipelineConfig pipelineConfig;

  @BeforeEach
  void setUp() {
    pipelineConfig = new PipelineConfig();
    personaService =
        new PersonaServiceImpl(
            personaRepository,
            videoRepository,
            vectorStore,
            jobStore,
            pipelineConfig,
            new SimpleMeterRegistry(),
            CLOCK,
            new TransactionTemplate(transactionManager));
  }

  private CreatePersonaRequest request() {
    return CreatePersonaRequest.builder()
        .channelId("UCBake")
        .username("@bakewithme")
        .title("Bake With Me")
        .build();
  }

  private UUID stubNewPersona() {
    UUID id = UUID.randomUUID();
    when(personaRepository.existsByChannelIdAndUserIdIsNull("UCBake")).thenReturn(false);
    when(personaRepository.existsByUsername("bakewithme")).thenReturn(false);
    when(personaRepository.save(any(Persona.class)))
        .thenAnswer(
            invocation -> {
              Persona persona = invocation.getArgument(0);
              persona.setId(id);
              return persona;
            });
    return id;
  }

  @Test
  @DisplayName("Should register a persona and schedule its first discovery")
  void shouldCreatePersona() {
    UUID id = stubNewPersona();

    Persona persona = personaService.createPersona(request());

    assertThat(persona.getUsername()).isEqualTo("bakewithme");
    assertThat(persona.getIsPublic()).isTrue();
    verify(vectorStore).ensureNamespace("ucbake");
    verify(jobStore)
        .enqueue(
            JobType.DISCOVERY,
            new DiscoveryPayload(id, "UCBake"),
            DiscoveryStage.initialKey(id));
  }

  @Test
  @DisplayName("Should create the vector namespace only after the transaction commits")
  void shouldEnsureNamespaceAfterCommit() {
    UUID id = stubNewPersona();

    personaService.createPersona(request());

    InOrder inOrder = inOrder(jobStore, transactionManager, vectorStore);
    inOrder
        .verify(jobStore)
        .enqueue(
            JobType.DISCOVERY,
            new DiscoveryPayload(id, "UCBake"),
            DiscoveryStage.initialKey(id));
    inOrder.verify(transactionManager).commit(any());
    inOrder.verify(vectorStore).ensureNamespace("ucbake");
  }

  @Test
  @DisplayName("Should keep the persona when the vector namespace cannot be created yet")
  void shouldKeepPersonaWhenNamespaceFails() {
    stubNewPersona();
    doThrow(new SearchException("ucbake", "cluster unavailable"))
        .when(vectorStore)
        .ensureNamespace("ucbake");

    Persona persona = personaService.createPersona(request());

    assertThat(persona.getId()).isNotNull();
    verify(transactionManager).commit(any());
    verify(transactionManager, never()).rollback(any());
  }

  @Test
  @DisplayName("Should refuse a second persona for the same channel and owner")
  void shouldRejectDuplicateChannel() {
    when(personaRepository.existsByChannelIdAndUserIdIsNull("UCBake")).thenReturn(true);

    assertThatThrownBy(() -> personaService.createPersona(request()))
        .isInstanceOf(DuplicatePersonaException.class);
    verify(personaRepository, never()).save(any());
    verify(jobStore, never()).enqueue(any(), any(), anyString());
  }

  @Test
  @DisplayName("Should schedule a boosted discovery ahead of every regular job")
  void shouldBoostDiscovery() {
    Persona persona =
        Persona.builder().id(UUID.randomUUID()).channelId("UCBake").title("Bake With Me").build();
    when(personaRepository.findById(persona.getId())).thenReturn(Optional.of(persona));
    String key = DiscoveryStage.priorityKey(persona.getId(), CLOCK.millis());
    UUID jobId = UUID.randomUUID();
    when(jobStore.enqueue(
            JobType.DISCOVERY,
            new DiscoveryPayload(persona.getId(), "UCBake"),
            key,
            pipelineConfig.getJobs().getMaxRetries(),
            PersonaServiceImpl.EPOCH))
        .thenReturn(jobId);

    JobEnqueuedResponse response = personaService.boostDiscovery(persona.getId());

    assertThat(response.jobId()).isEqualTo(jobId);
    assertThat(response.idempotencyKey()).isEqualTo(key);
    assertThat(response.message()).contains("Bake With Me");
  }
}
