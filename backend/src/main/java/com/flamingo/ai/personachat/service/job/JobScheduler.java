package com.flamingo.ai.personachat.service.job;

import com.flamingo.ai.personachat.config.PipelineConfig;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/** Timer that drives the job worker. */
@Component
@RequiredArgsConstructor
@Slf4j
public class JobScheduler {

  private final JobWorker jobWorker;
  private final PipelineConfig pipelineConfig;

  @PostConstruct
  void logState() {
    if (pipelineConfig.getJobs().isSchedulerEnabled()) {
      log.info(
          "Job scheduler started with poll interval: {} ms",
          pipelineConfig.getJobs().getPollIntervalMs());
    } else {
      log.info("Job scheduler is disabled; jobs run only through the tick endpoint");
    }
  }

  @Scheduled(
      fixedDelayString = "${pipeline.jobs.poll-interval-ms:10000}",
      initialDelayString = "${pipeline.jobs.poll-interval-ms:10000}")
  public void poll() {
    if (!pipelineConfig.getJobs().isSchedulerEnabled()) {
      return;
    }
    try {
      jobWorker.runOnce();
    } catch (RuntimeException e) {
      // The job row keeps its state; the next tick picks up from there
      log.error("Error running scheduled job tick", e);
    }
  }
}
