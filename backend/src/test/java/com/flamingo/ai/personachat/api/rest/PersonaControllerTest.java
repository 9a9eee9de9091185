package com.flamingo.ai.personachat.api.rest;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.flamingo.ai.personachat.api.dto.request.CreatePersonaRequest;
import com.flamingo.ai.personachat.api.dto.response.JobEnqueuedResponse;
import com.flamingo.ai.personachat.domain.entity.Persona;
import com.flamingo.ai.personachat.exception.DuplicatePersonaException;
import com.flamingo.ai.personachat.exception.GlobalExceptionHandler;
import com.flamingo.ai.personachat.exception.PersonaNotFoundException;
import com.flamingo.ai.personachat.service.persona.PersonaService;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

@ExtendWith(MockitoExtension.class)
@DisplayName("PersonaController Tests")
class PersonaControllerTest {

  private static final String VALID_BODY =
      "{\"channelId\":\"UCBake\",\"username\":\"bakewithme\",\"title\":\"Bake With Me\"}";

  private MockMvc mockMvc;

  @Mock private PersonaService personaService;

  @BeforeEach
  void setUp() {
    mockMvc =
        MockMvcBuilders.standaloneSetup(new PersonaController(personaService))
            .setControllerAdvice(new GlobalExceptionHandler(new SimpleMeterRegistry()))
            .build();
  }

  private Persona persona() {
    return Persona.builder()
        .id(UUID.randomUUID())
        .channelId("UCBake")
        .username("bakewithme")
        .title("Bake With Me")
        .build();
  }

  @Test
  @DisplayName("Should create a persona and return 201")
  void shouldCreatePersona() throws Exception {
    when(personaService.createPersona(any(CreatePersonaRequest.class))).thenReturn(persona());

    mockMvc
        .perform(post("/api/personas").contentType(MediaType.APPLICATION_JSON).content(VALID_BODY))
        .andExpect(status().isCreated())
        .andExpect(jsonPath("$.username").value("bakewithme"))
        .andExpect(jsonPath("$.isPublic").value(true));
  }

  @Test
  @DisplayName("Should reject an invalid channel id")
  void shouldRejectInvalidChannelId() throws Exception {
    mockMvc
        .perform(
            post("/api/personas")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"channelId\":\"UC Bake!\",\"username\":\"b\",\"title\":\"t\"}"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.code").value("VALIDATION_001"));

    verify(personaService, never()).createPersona(any());
  }

  @Test
  @DisplayName("Should return 409 for a duplicate persona")
  void shouldReturnConflictForDuplicate() throws Exception {
    when(personaService.createPersona(any(CreatePersonaRequest.class)))
        .thenThrow(new DuplicatePersonaException("UCBake", "Persona already exists"));

    mockMvc
        .perform(post("/api/personas").contentType(MediaType.APPLICATION_JSON).content(VALID_BODY))
        .andExpect(status().isConflict())
        .andExpect(jsonPath("$.code").value("PERSONA_002"));
  }

  @Test
  @DisplayName("Should return 404 for an unknown persona")
  void shouldReturnNotFound() throws Exception {
    UUID id = UUID.randomUUID();
    when(personaService.getPersona(id)).thenThrow(new PersonaNotFoundException(id));

    mockMvc
        .perform(get("/api/personas/{personaId}", id))
        .andExpect(status().isNotFound())
        .andExpect(jsonPath("$.code").value("PERSONA_001"))
        .andExpect(jsonPath("$.path").value("/api/personas/" + id));
  }

  @Test
  @DisplayName("Should list personas visible to a user")
  void shouldListPersonas() throws Exception {
    UUID userId = UUID.randomUUID();
    when(personaService.listPersonas(userId)).thenReturn(List.of(persona()));

    mockMvc
        .perform(get("/api/personas").param("userId", userId.toString()))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$[0].channelId").value("UCBake"));
  }

  @Test
  @DisplayName("Should accept a priority boost")
  void shouldAcceptPriorityBoost() throws Exception {
    UUID id = UUID.randomUUID();
    UUID jobId = UUID.randomUUID();
    when(personaService.boostDiscovery(id))
        .thenReturn(new JobEnqueuedResponse(jobId, "priority-discovery:" + id + ":1", "boosted"));

    mockMvc
        .perform(post("/api/personas/{personaId}/priority-boost", id))
        .andExpect(status().isAccepted())
        .andExpect(jsonPath("$.jobId").value(jobId.toString()));
  }
}
