package com.flamingo.ai.personachat.service.extraction;

import com.fasterxml.jackson.databind.JsonNode;
import com.flamingo.ai.personachat.config.PipelineConfig;
import com.flamingo.ai.personachat.exception.ExternalServiceException;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.github.resilience4j.retry.annotation.Retry;
import io.micrometer.core.annotation.Timed;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;

/**
 * Caption scraper running an Apify actor. A run is started per video; its dataset holds the
 * video's subtitles once the run succeeded.
 */
@Component
@Slf4j
public class ApifyCaptionScraper implements CaptionScraper {

  private static final Duration TIMEOUT = Duration.ofSeconds(30);
  private static final String SERVICE = "Apify";
  private static final Set<String> RUNNING_STATES = Set.of("READY", "RUNNING");
  private static final List<String> SUBTITLE_FIELDS = List.of("vtt", "srt");

  private final WebClient webClient;
  private final PipelineConfig.Apify apify;
  private final WebVttCaptionParser captionParser;

  public ApifyCaptionScraper(PipelineConfig pipelineConfig, WebVttCaptionParser captionParser) {
    this.apify = pipelineConfig.getApify();
    this.captionParser = captionParser;
    this.webClient =
        WebClient.builder()
            .baseUrl(apify.getBaseUrl())
            .codecs(configurer -> configurer.defaultCodecs().maxInMemorySize(16 * 1024 * 1024))
            .build();
    log.info("Apify scraper initialized: actor={}", apify.getActorId());
  }

  @Override
  @Timed(value = "scraper.start", description = "Time to start a scrape run")
  @CircuitBreaker(name = "apify")
  @Retry(name = "apify")
  public String startRun(String videoId) {
    Map<String, Object> input =
        Map.of(
            "startUrls", List.of(Map.of("url", "https://www.youtube.com/watch?v=" + videoId)),
            "maxResults", 1,
            "downloadSubtitles", true,
            "subtitlesLanguage", apify.getSubtitlesLanguage(),
            "subtitlesFormat", "vtt");
    try {
      JsonNode response =
          webClient
              .post()
              .uri(
                  b ->
                      b.path("/acts/{actor}/runs")
                          .queryParam("token", apify.getToken())
                          .build(apify.getActorId()))
              .contentType(MediaType.APPLICATION_JSON)
              .bodyValue(input)
              .retrieve()
              .bodyToMono(JsonNode.class)
              .timeout(TIMEOUT)
              .block();
      String runId = response == null ? null : response.path("data").path("id").asText(null);
      if (runId == null) {
        throw new ExternalServiceException(SERVICE, "Run start returned no run id for " + videoId);
      }
      log.info("Started scrape run {} for video {}", runId, videoId);
      return runId;
    } catch (WebClientResponseException e) {
      throw new ExternalServiceException(
          SERVICE, "Starting run for " + videoId + " returned " + e.getStatusCode().value(), e);
    }
  }

  @Override
  @Timed(value = "scraper.fetch", description = "Time to check a scrape run")
  @CircuitBreaker(name = "apify")
  @Retry(name = "apify")
  public ScrapeResult fetchResults(String runId) {
    JsonNode run = get("/actor-runs/" + runId).path("data");
    String status = run.path("status").asText("");
    if (RUNNING_STATES.contains(status)) {
      log.debug("Scrape run {} is {}", runId, status);
      return ScrapeResult.pending();
    }
    if (!"SUCCEEDED".equals(status)) {
      return ScrapeResult.failed("Scrape run " + runId + " ended with status " + status);
    }

    String datasetId = run.path("defaultDatasetId").asText(null);
    if (datasetId == null) {
      return ScrapeResult.failed("Scrape run " + runId + " has no dataset");
    }
    JsonNode items = get("/datasets/" + datasetId + "/items");
    String subtitles = firstSubtitles(items);
    if (subtitles == null) {
      log.info("Scrape run {} found no subtitles", runId);
      return ScrapeResult.succeeded(List.of());
    }
    return ScrapeResult.succeeded(captionParser.parse(subtitles));
  }

  private static String firstSubtitles(JsonNode items) {
    for (JsonNode item : items) {
      for (JsonNode track : item.path("subtitles")) {
        for (String field : SUBTITLE_FIELDS) {
          String text = track.path(field).asText(null);
          if (text != null && !text.isBlank()) {
            return text;
          }
        }
      }
    }
    return null;
  }

  private JsonNode get(String path) {
    try {
      JsonNode body =
          webClient
              .get()
              .uri(b -> b.path(path).queryParam("token", apify.getToken()).build())
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
          SERVICE, path + " returned " + e.getStatusCode().value(), e);
    }
  }
}
