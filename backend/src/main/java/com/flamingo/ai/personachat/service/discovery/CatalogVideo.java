package com.flamingo.ai.personachat.service.discovery;

import java.time.LocalDateTime;

/** Catalog metadata of a single video. */
public record CatalogVideo(
    String videoId,
    String title,
    String description,
    String thumbnailUrl,
    String duration,
    LocalDateTime publishedAt,
    long viewCount) {}
