package com.flamingo.ai.personachat.domain.enums;

/** Progress of walking a channel's video catalog. */
public enum DiscoveryStatus {
  PENDING,
  IN_PROGRESS,
  COMPLETED
}
