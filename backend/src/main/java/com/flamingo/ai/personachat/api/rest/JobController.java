package com.flamingo.ai.personachat.api.rest;

import com.flamingo.ai.personachat.api.dto.request.ExtractionJobRequest;
import com.flamingo.ai.personachat.api.dto.request.PersonaJobRequest;
import com.flamingo.ai.personachat.api.dto.response.JobEnqueuedResponse;
import com.flamingo.ai.personachat.api.dto.response.JobResponse;
import com.flamingo.ai.personachat.job.payload.DiscoveryResult;
import com.flamingo.ai.personachat.job.payload.EmbeddingResult;
import com.flamingo.ai.personachat.service.job.JobRunOutcome;
import com.flamingo.ai.personachat.service.job.PipelineCommandService;
import jakarta.validation.Valid;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** REST controller for pipeline jobs. */
@RestController
@RequestMapping("/api/jobs")
@RequiredArgsConstructor
public class JobController {

  private final PipelineCommandService pipelineCommandService;

  /** Discovers the next catalog page of a persona. */
  @PostMapping("/discovery")
  public ResponseEntity<DiscoveryResult> runDiscovery(
      @Valid @RequestBody PersonaJobRequest request) {
    return ResponseEntity.ok(pipelineCommandService.runDiscovery(request.getPersonaId()));
  }

  /** Queues caption extraction of a video again. */
  @PostMapping("/extraction")
  public ResponseEntity<JobEnqueuedResponse> retryExtraction(
      @Valid @RequestBody ExtractionJobRequest request) {
    return ResponseEntity.status(HttpStatus.ACCEPTED)
        .body(pipelineCommandService.retryExtraction(request.getVideoId()));
  }

  /** Embeds one page of pending caption chunks; callers loop until totalCandidates is 0. */
  @PostMapping("/embedding")
  public ResponseEntity<EmbeddingResult> runEmbedding(
      @Valid @RequestBody PersonaJobRequest request) {
    return ResponseEntity.ok(
        pipelineCommandService.runEmbeddingBatch(request.getPersonaId(), request.getVideoId()));
  }

  /** Gets a job by ID. */
  @GetMapping("/{jobId}")
  public ResponseEntity<JobResponse> getJob(@PathVariable UUID jobId) {
    return ResponseEntity.ok(JobResponse.fromEntity(pipelineCommandService.getJob(jobId)));
  }

  /** Runs one queued job now. Returns 204 when nothing was due. */
  @PostMapping("/tick")
  public ResponseEntity<JobRunOutcome> tick() {
    return pipelineCommandService
        .tick()
        .map(ResponseEntity::ok)
        .orElseGet(() -> ResponseEntity.noContent().build());
  }
}
