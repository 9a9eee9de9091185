package com.flamingo.ai.personachat.service.extraction;

/** Long-running external scrape-and-transcribe service. */
public interface CaptionScraper {

  /**
   * Starts a scrape run for a video.
   *
   * @param videoId catalog id of the video
   * @return id of the started run
   */
  String startRun(String videoId);

  /** Checks a run and returns its captions once available. Never blocks until completion. */
  ScrapeResult fetchResults(String runId);
}
