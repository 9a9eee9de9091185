package com.flamingo.ai.personachat.config;

import com.flamingo.ai.personachat.domain.enums.JobStatus;
import com.flamingo.ai.personachat.domain.repository.JobRepository;
import io.micrometer.core.aop.TimedAspect;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.binder.MeterBinder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Configuration for application metrics. */
@Configuration
public class MetricsConfig {

  /** Enables the @Timed annotation for method-level timing metrics. */
  @Bean
  public TimedAspect timedAspect(MeterRegistry registry) {
    return new TimedAspect(registry);
  }

  /** Queue depth per job status. */
  @Bean
  public MeterBinder jobQueueGauges(JobRepository jobRepository) {
    return registry -> {
      for (JobStatus status : JobStatus.values()) {
        Gauge.builder("jobs_by_status", jobRepository, repo -> repo.countByStatus(status))
            .tag("status", status.name().toLowerCase())
            .register(registry);
      }
    };
  }
}
