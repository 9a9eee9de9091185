package com.flamingo.ai.personachat.service.discovery;

import com.flamingo.ai.personachat.domain.enums.JobType;
import com.flamingo.ai.personachat.exception.NonRetryableJobException;
import com.flamingo.ai.personachat.exception.PersonaNotFoundException;
import com.flamingo.ai.personachat.job.payload.DiscoveryPayload;
import com.flamingo.ai.personachat.job.payload.JobResult;
import com.flamingo.ai.personachat.service.job.JobHandler;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/** Runs queued discovery jobs. */
@Component
@RequiredArgsConstructor
public class DiscoveryJobHandler implements JobHandler<DiscoveryPayload> {

  private final DiscoveryStage discoveryStage;

  @Override
  public JobType getType() {
    return JobType.DISCOVERY;
  }

  @Override
  public JobResult handle(DiscoveryPayload payload) {
    if (payload.personaId() == null) {
      throw new NonRetryableJobException("Discovery payload has no persona");
    }
    try {
      return discoveryStage.discover(payload.personaId());
    } catch (PersonaNotFoundException e) {
      throw new NonRetryableJobException(e.getMessage(), e);
    }
  }
}
