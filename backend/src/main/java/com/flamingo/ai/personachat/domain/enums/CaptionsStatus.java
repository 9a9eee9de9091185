package com.flamingo.ai.personachat.domain.enums;

/** Caption pipeline state of a single video. */
public enum CaptionsStatus {
  /** Discovered, no scrape run started yet. */
  PENDING,

  /** A scrape run was started and its results are awaited. */
  PROCESSING,

  /** Caption chunks are stored but not all of them are embedded. */
  EXTRACTED,

  /** Every caption chunk is embedded and searchable. */
  COMPLETED,

  /** Extraction failed; see the captions error. */
  FAILED
}
