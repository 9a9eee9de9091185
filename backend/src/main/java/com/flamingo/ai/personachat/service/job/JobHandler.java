package com.flamingo.ai.personachat.service.job;

import com.flamingo.ai.personachat.domain.enums.JobType;
import com.flamingo.ai.personachat.job.payload.JobPayload;
import com.flamingo.ai.personachat.job.payload.JobResult;

/**
 * Executes jobs of one type.
 *
 * <p>Handlers signal how a failed run should be treated through the exception they throw: {@link
 * com.flamingo.ai.personachat.exception.JobDeferredException} to wait without spending an attempt,
 * {@link com.flamingo.ai.personachat.exception.NonRetryableJobException} to fail for good, anything
 * else to retry with backoff.
 *
 * @param <P> payload type accepted by the handler
 */
public interface JobHandler<P extends JobPayload> {

  JobType getType();

  JobResult handle(P payload);
}
