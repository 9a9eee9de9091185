package com.flamingo.ai.personachat.api.dto.response;

import java.util.UUID;

/**
 * Reply to a request that schedules a background job.
 *
 * @param jobId the new job, null if an equivalent job was already scheduled
 * @param idempotencyKey key of the scheduled unit of work
 * @param message human-readable summary
 */
public record JobEnqueuedResponse(UUID jobId, String idempotencyKey, String message) {}
