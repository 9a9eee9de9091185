package com.flamingo.ai.personachat.api.rest;

import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.flamingo.ai.personachat.domain.enums.JobType;
import com.flamingo.ai.personachat.exception.GlobalExceptionHandler;
import com.flamingo.ai.personachat.exception.JobNotFoundException;
import com.flamingo.ai.personachat.job.payload.EmbeddingResult;
import com.flamingo.ai.personachat.service.job.JobRunOutcome;
import com.flamingo.ai.personachat.service.job.PipelineCommandService;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.Optional;
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
@DisplayName("JobController Tests")
class JobControllerTest {

  private MockMvc mockMvc;

  @Mock private PipelineCommandService pipelineCommandService;

  @BeforeEach
  void setUp() {
    mockMvc =
        MockMvcBuilders.standaloneSetup(new JobController(pipelineCommandService))
            .setControllerAdvice(new GlobalExceptionHandler(new SimpleMeterRegistry()))
            .build();
  }

  @Test
  @DisplayName("Should run one embedding page for a persona")
  void shouldRunEmbedding() throws Exception {
    UUID personaId = UUID.randomUUID();
    when(pipelineCommandService.runEmbeddingBatch(personaId, null))
        .thenReturn(new EmbeddingResult(7, 10));

    mockMvc
        .perform(
            post("/api/jobs/embedding")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"personaId\":\"" + personaId + "\"}"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.embeddingsProcessed").value(7))
        .andExpect(jsonPath("$.totalCandidates").value(10));
  }

  @Test
  @DisplayName("Should require a persona id")
  void shouldRequirePersonaId() throws Exception {
    mockMvc
        .perform(post("/api/jobs/discovery").contentType(MediaType.APPLICATION_JSON).content("{}"))
        .andExpect(status().isBadRequest());
  }

  @Test
  @DisplayName("Should return 204 when no job is due")
  void shouldReturnNoContentWhenIdle() throws Exception {
    when(pipelineCommandService.tick()).thenReturn(Optional.empty());

    mockMvc.perform(post("/api/jobs/tick")).andExpect(status().isNoContent());
  }

  @Test
  @DisplayName("Should report the outcome of a ticked job")
  void shouldReturnTickOutcome() throws Exception {
    UUID jobId = UUID.randomUUID();
    when(pipelineCommandService.tick())
        .thenReturn(
            Optional.of(
                new JobRunOutcome(
                    jobId, JobType.EXTRACTION, JobRunOutcome.Status.DEFERRED, "run pending")));

    mockMvc
        .perform(post("/api/jobs/tick"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.status").value("DEFERRED"));
  }

  @Test
  @DisplayName("Should return 404 for an unknown job")
  void shouldReturnNotFoundForUnknownJob() throws Exception {
    UUID jobId = UUID.randomUUID();
    when(pipelineCommandService.getJob(jobId)).thenThrow(new JobNotFoundException(jobId));

    mockMvc
        .perform(get("/api/jobs/{jobId}", jobId))
        .andExpect(status().isNotFound())
        .andExpect(jsonPath("$.code").value("JOB_001"));
  }
}
