package com.flamingo.ai.personachat.service.extraction;

import java.util.List;

/** State of a scrape run and, once it succeeded, its caption segments. */
public record ScrapeResult(State state, List<CaptionSegment> segments, String failureReason) {

  public enum State {
    /** The run is still working. */
    PENDING,
    SUCCEEDED,
    /** The run ended without results; a new run is needed. */
    FAILED
  }

  public ScrapeResult {
    segments = segments == null ? List.of() : List.copyOf(segments);
  }

  public static ScrapeResult pending() {
    return new ScrapeResult(State.PENDING, List.of(), null);
  }

  public static ScrapeResult succeeded(List<CaptionSegment> segments) {
    return new ScrapeResult(State.SUCCEEDED, segments, null);
  }

  public static ScrapeResult failed(String reason) {
    return new ScrapeResult(State.FAILED, List.of(), reason);
  }
}
