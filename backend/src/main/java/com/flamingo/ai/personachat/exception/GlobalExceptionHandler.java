package com.flamingo.ai.personachat.exception;

import io.micrometer.core.instrument.MeterRegistry;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.ConstraintViolationException;
import java.time.Instant;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/** Global exception handler for REST controllers. */
@RestControllerAdvice
@RequiredArgsConstructor
@Slf4j
public class GlobalExceptionHandler {

  private final MeterRegistry meterRegistry;

  @ExceptionHandler(PersonaNotFoundException.class)
  public ResponseEntity<ApiError> handlePersonaNotFound(
      PersonaNotFoundException ex, HttpServletRequest request) {
    String errorId = record("persona_not_found");
    log.warn("Persona not found [{}]: {}", errorId, ex.getReference());
    return respond(
        HttpStatus.NOT_FOUND, errorId, ApiError.PERSONA_NOT_FOUND, "Persona not found", request);
  }

  @ExceptionHandler(VideoNotFoundException.class)
  public ResponseEntity<ApiError> handleVideoNotFound(
      VideoNotFoundException ex, HttpServletRequest request) {
    String errorId = record("video_not_found");
    log.warn("Video not found [{}]: {}", errorId, ex.getVideoId());
    return respond(
        HttpStatus.NOT_FOUND, errorId, ApiError.VIDEO_NOT_FOUND, "Video not found", request);
  }

  @ExceptionHandler(JobNotFoundException.class)
  public ResponseEntity<ApiError> handleJobNotFound(
      JobNotFoundException ex, HttpServletRequest request) {
    String errorId = record("job_not_found");
    log.warn("Job not found [{}]: {}", errorId, ex.getJobId());
    return respond(HttpStatus.NOT_FOUND, errorId, ApiError.JOB_NOT_FOUND, "Job not found", request);
  }

  @ExceptionHandler(ChatSessionNotFoundException.class)
  public ResponseEntity<ApiError> handleChatSessionNotFound(
      ChatSessionNotFoundException ex, HttpServletRequest request) {
    String errorId = record("chat_session_not_found");
    log.warn("Chat session not found [{}]: {}", errorId, ex.getChatSessionId());
    return respond(
        HttpStatus.NOT_FOUND,
        errorId,
        ApiError.CHAT_SESSION_NOT_FOUND,
        "Chat session not found",
        request);
  }

  @ExceptionHandler(DuplicatePersonaException.class)
  public ResponseEntity<ApiError> handleDuplicatePersona(
      DuplicatePersonaException ex, HttpServletRequest request) {
    String errorId = record("persona_duplicate");
    log.warn("Duplicate persona [{}]: channel={}", errorId, ex.getChannelId());
    return respond(
        HttpStatus.CONFLICT, errorId, ApiError.PERSONA_DUPLICATE, ex.getMessage(), request);
  }

  @ExceptionHandler(LlmServiceException.class)
  public ResponseEntity<ApiError> handleLlmService(
      LlmServiceException ex, HttpServletRequest request) {
    String errorId = record(ex.isRateLimited() ? "llm_rate_limited" : "llm_error");
    log.error("LLM service error [{}]: {}", errorId, ex.getMessage(), ex);
    String code = ex.isRateLimited() ? ApiError.LLM_RATE_LIMITED : ApiError.LLM_UNAVAILABLE;
    return respond(HttpStatus.SERVICE_UNAVAILABLE, errorId, code, ex.getUserMessage(), request);
  }

  @ExceptionHandler(SearchException.class)
  public ResponseEntity<ApiError> handleSearch(SearchException ex, HttpServletRequest request) {
    String errorId = record("search_error");
    log.error("Search error [{}] in {}: {}", errorId, ex.getNamespace(), ex.getMessage(), ex);
    return respond(
        HttpStatus.SERVICE_UNAVAILABLE,
        errorId,
        ApiError.SEARCH_FAILED,
        ex.getUserMessage(),
        request);
  }

  @ExceptionHandler(ExternalServiceException.class)
  public ResponseEntity<ApiError> handleExternalService(
      ExternalServiceException ex, HttpServletRequest request) {
    String errorId = record("external_service_error");
    log.error("{} error [{}]: {}", ex.getService(), errorId, ex.getMessage(), ex);
    return respond(
        HttpStatus.BAD_GATEWAY,
        errorId,
        ApiError.EXTERNAL_SERVICE_ERROR,
        ex.getUserMessage(),
        request);
  }

  @ExceptionHandler(MethodArgumentNotValidException.class)
  public ResponseEntity<ApiError> handleValidation(
      MethodArgumentNotValidException ex, HttpServletRequest request) {
    String errorId = record("validation_error");
    String message =
        ex.getBindingResult().getFieldErrors().stream()
            .findFirst()
            .map(error -> error.getField() + ": " + error.getDefaultMessage())
            .orElse("Validation failed");
    log.warn("Validation error [{}]: {}", errorId, message);
    return respond(HttpStatus.BAD_REQUEST, errorId, ApiError.VALIDATION_ERROR, message, request);
  }

  @ExceptionHandler({
    IllegalArgumentException.class,
    ConstraintViolationException.class,
    HttpMessageNotReadableException.class
  })
  public ResponseEntity<ApiError> handleBadRequest(Exception ex, HttpServletRequest request) {
    String errorId = record("validation_error");
    log.warn("Rejected request [{}]: {}", errorId, ex.getMessage());
    String message =
        ex instanceof HttpMessageNotReadableException ? "Malformed request body" : ex.getMessage();
    return respond(HttpStatus.BAD_REQUEST, errorId, ApiError.VALIDATION_ERROR, message, request);
  }

  @ExceptionHandler(Exception.class)
  public ResponseEntity<ApiError> handleGeneric(Exception ex, HttpServletRequest request) {
    String errorId = record("internal_error");
    log.error("Unexpected error [{}]: {}", errorId, ex.getMessage(), ex);
    return respond(
        HttpStatus.INTERNAL_SERVER_ERROR,
        errorId,
        ApiError.INTERNAL_ERROR,
        "An unexpected error occurred. Please try again later.",
        request);
  }

  private ResponseEntity<ApiError> respond(
      HttpStatus status, String errorId, String code, String message, HttpServletRequest request) {
    return ResponseEntity.status(status)
        .body(
            ApiError.builder()
                .errorId(errorId)
                .code(code)
                .message(message)
                .path(request.getRequestURI())
                .timestamp(Instant.now())
                .build());
  }

  private String record(String errorType) {
    meterRegistry.counter("api_errors_total", "error_type", errorType).increment();
    return UUID.randomUUID().toString().substring(0, 8);
  }
}
