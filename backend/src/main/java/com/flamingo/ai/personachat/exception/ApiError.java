package com.flamingo.ai.personachat.exception;

import java.time.Instant;
import lombok.Builder;
import lombok.Getter;

/** Structured API error response. */
@Getter
@Builder
public class ApiError {

  // Error codes
  public static final String PERSONA_NOT_FOUND = "PERSONA_001";
  public static final String PERSONA_DUPLICATE = "PERSONA_002";
  public static final String VIDEO_NOT_FOUND = "VIDEO_001";
  public static final String JOB_NOT_FOUND = "JOB_001";
  public static final String CHAT_SESSION_NOT_FOUND = "CHAT_001";
  public static final String LLM_UNAVAILABLE = "LLM_001";
  public static final String LLM_RATE_LIMITED = "LLM_002";
  public static final String SEARCH_FAILED = "SEARCH_001";
  public static final String EXTERNAL_SERVICE_ERROR = "EXTERNAL_001";
  public static final String VALIDATION_ERROR = "VALIDATION_001";
  public static final String INTERNAL_ERROR = "INTERNAL_001";

  /** Unique error ID for log correlation. */
  private final String errorId;

  /** Machine-readable error code. */
  private final String code;

  /** User-friendly error message. */
  private final String message;

  private final Instant timestamp;

  /** Request path that caused the error. */
  private final String path;
}
