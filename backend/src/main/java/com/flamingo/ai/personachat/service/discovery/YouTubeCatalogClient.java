package com.flamingo.ai.personachat.service.discovery;

import com.fasterxml.jackson.databind.JsonNode;
import com.flamingo.ai.personachat.config.PipelineConfig;
import com.flamingo.ai.personachat.exception.ExternalServiceException;
import com.google.common.annotations.VisibleForTesting;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.github.resilience4j.retry.annotation.Retry;
import io.micrometer.core.annotation.Timed;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;

/**
 * Catalog client for the YouTube Data API v3. A channel's uploads are listed through its uploads
 * playlist; full metadata comes from a follow-up videos lookup.
 */
@Component
@Slf4j
public class YouTubeCatalogClient implements CatalogClient {

  private static final Duration TIMEOUT = Duration.ofSeconds(30);
  private static final String SERVICE = "YouTube";

  private final WebClient webClient;
  private final String apiKey;
  private final int pageSize;

  public YouTubeCatalogClient(PipelineConfig pipelineConfig) {
    PipelineConfig.YouTube youtube = pipelineConfig.getYoutube();
    this.apiKey = youtube.getApiKey();
    this.pageSize = Math.min(50, Math.max(1, pipelineConfig.getDiscovery().getPageSize()));
    this.webClient =
        WebClient.builder()
            .baseUrl(youtube.getBaseUrl())
            .codecs(configurer -> configurer.defaultCodecs().maxInMemorySize(4 * 1024 * 1024))
            .build();
    log.info("YouTube catalog client initialized: baseUrl={}", youtube.getBaseUrl());
  }

  @Override
  @Timed(value = "catalog.list", description = "Time to fetch one catalog page")
  @CircuitBreaker(name = "youtube")
  @Retry(name = "youtube")
  public CatalogPage listVideos(String channelId, String cursor) {
    String playlistId = uploadsPlaylistId(channelId);

    JsonNode page =
        get(
            "/playlistItems",
            Map.of(
                "part", "contentDetails",
                "playlistId", playlistId,
                "maxResults", String.valueOf(pageSize)),
            cursor);

    List<String> videoIds = new ArrayList<>();
    for (JsonNode item : page.path("items")) {
      String videoId = item.path("contentDetails").path("videoId").asText(null);
      if (videoId != null && !videoId.isBlank()) {
        videoIds.add(videoId);
      }
    }

    String nextCursor = page.path("nextPageToken").asText(null);
    List<CatalogVideo> videos = videoIds.isEmpty() ? List.of() : videoDetails(videoIds);
    log.debug(
        "Fetched {} videos of channel {} (more: {})", videos.size(), channelId, nextCursor != null);
    return new CatalogPage(videos, nextCursor, nextCursor != null);
  }

  private String uploadsPlaylistId(String channelId) {
    JsonNode channels =
        get("/channels", Map.of("part", "contentDetails", "id", channelId), null);
    JsonNode items = channels.path("items");
    String uploads =
        items.isArray() && !items.isEmpty()
            ? items
                .get(0)
                .path("contentDetails")
                .path("relatedPlaylists")
                .path("uploads")
                .asText(null)
            : null;
    if (uploads == null || uploads.isBlank()) {
      throw new ExternalServiceException(
          SERVICE, "Channel not found or no uploads playlist: " + channelId);
    }
    return uploads;
  }

  /** Looks up full metadata and keeps the playlist order. */
  private List<CatalogVideo> videoDetails(List<String> videoIds) {
    JsonNode response =
        get(
            "/videos",
            Map.of("part", "snippet,contentDetails,statistics", "id", String.join(",", videoIds)),
            null);

    Map<String, CatalogVideo> byId = new HashMap<>();
    for (JsonNode item : response.path("items")) {
      CatalogVideo video = toVideo(item);
      byId.put(video.videoId(), video);
    }
    List<CatalogVideo> ordered = new ArrayList<>();
    for (String id : videoIds) {
      CatalogVideo video = byId.get(id);
      if (video != null) {
        ordered.add(video);
      } else {
        // Private or deleted uploads are listed in the playlist but have no details
        log.debug("No details for video {}, skipping", id);
      }
    }
    return ordered;
  }

  private CatalogVideo toVideo(JsonNode item) {
    JsonNode snippet = item.path("snippet");
    JsonNode thumbnails = snippet.path("thumbnails");
    String thumbnail = thumbnails.path("high").path("url").asText(null);
    if (thumbnail == null) {
      thumbnail = thumbnails.path("default").path("url").asText("");
    }
    return new CatalogVideo(
        item.path("id").asText(),
        snippet.path("title").asText(""),
        snippet.path("description").asText(""),
        thumbnail,
        formatDuration(item.path("contentDetails").path("duration").asText("PT0S")),
        parsePublishedAt(snippet.path("publishedAt").asText(null)),
        item.path("statistics").path("viewCount").asLong(0));
  }

  private JsonNode get(String path, Map<String, String> params, String pageToken) {
    try {
      JsonNode body =
          webClient
              .get()
              .uri(
                  builder -> {
                    builder.path(path);
                    params.forEach(builder::queryParam);
                    if (pageToken != null) {
                      builder.queryParam("pageToken", pageToken);
                    }
                    return builder.queryParam("key", apiKey).build();
                  })
              .retrieve()
              .bodyToMono(JsonNode.class)
              .timeout(TIMEOUT)
              .block();
      if (body == null) {
        throw new ExternalServiceException(SERVICE, "Empty response from " + path);
      }
      return body;
    } catch (WebClientResponseException e) {
      throw new ExternalServiceException(
          SERVICE, "YouTube " + path + " returned " + e.getStatusCode().value(), e);
    }
  }

  /** Formats an ISO-8601 duration ({@code PT1H2M3S}) as {@code 1:02:03}, or {@code m:ss}. */
  @VisibleForTesting
  static String formatDuration(String isoDuration) {
    if (isoDuration == null) {
      return "0:00";
    }
    long totalSeconds;
    try {
      totalSeconds = Duration.parse(isoDuration).getSeconds();
    } catch (DateTimeParseException e) {
      log.debug("Unparseable duration '{}'", isoDuration);
      return "0:00";
    }
    long hours = totalSeconds / 3600;
    long minutes = (totalSeconds % 3600) / 60;
    long seconds = totalSeconds % 60;
    return hours > 0
        ? String.format("%d:%02d:%02d", hours, minutes, seconds)
        : String.format("%d:%02d", minutes, seconds);
  }

  private static LocalDateTime parsePublishedAt(String value) {
    if (value == null) {
      return null;
    }
    try {
      return LocalDateTime.ofInstant(Instant.parse(value), ZoneOffset.UTC);
    } catch (DateTimeParseException e) {
      log.debug("Unparseable publish time '{}'", value);
      return null;
    }
  }
}
