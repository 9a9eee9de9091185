package com.flamingo.ai.personachat.job.payload;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.personachat.domain.enums.JobType;

/**
 * Serializes job payloads and results to JSON text and back. The job type decides which record a
 * stored JSON document is read into.
 */
public final class JobPayloadCodec {

  private static final ObjectMapper MAPPER = new ObjectMapper();

  private JobPayloadCodec() {}

  public static String write(Object value) {
    if (value == null) {
      return null;
    }
    try {
      return MAPPER.writeValueAsString(value);
    } catch (JsonProcessingException e) {
      throw new IllegalArgumentException(
          "Cannot serialize " + value.getClass().getSimpleName(), e);
    }
  }

  public static JobPayload readPayload(JobType type, String json) {
    if (json == null || json.isBlank()) {
      throw new IllegalArgumentException("Missing payload for " + type + " job");
    }
    try {
      return MAPPER.readValue(json, type.getPayloadType());
    } catch (JsonProcessingException e) {
      throw new IllegalArgumentException("Malformed payload for " + type + " job", e);
    }
  }

  public static JobResult readResult(JobType type, String json) {
    if (json == null || json.isBlank()) {
      return null;
    }
    try {
      return MAPPER.readValue(json, type.getResultType());
    } catch (JsonProcessingException e) {
      throw new IllegalArgumentException("Malformed result for " + type + " job", e);
    }
  }

  /** Checks that the payload has the shape declared by the job type. */
  public static void requireMatching(JobType type, JobPayload payload) {
    if (!type.getPayloadType().isInstance(payload)) {
      throw new IllegalArgumentException(
          type + " job requires " + type.getPayloadType().getSimpleName() + " payload");
    }
  }
}
