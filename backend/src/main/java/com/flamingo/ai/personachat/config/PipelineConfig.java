package com.flamingo.ai.personachat.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/** Configuration properties for the ingestion pipeline and chat retrieval. */
@Configuration
@ConfigurationProperties(prefix = "pipeline")
@Getter
@Setter
public class PipelineConfig {

  private Jobs jobs = new Jobs();
  private Discovery discovery = new Discovery();
  private Extraction extraction = new Extraction();
  private Embedding embedding = new Embedding();
  private Retrieval retrieval = new Retrieval();
  private YouTube youtube = new YouTube();
  private Apify apify = new Apify();

  @Getter
  @Setter
  public static class Jobs {
    /** Whether the in-process timer polls the queue. The tick endpoint works either way. */
    private boolean schedulerEnabled = true;

    private long pollIntervalMs = 10_000;
    private int maxRetries = 3;

    /** Due jobs fetched per claim attempt. */
    private int claimCandidates = 5;
  }

  @Getter
  @Setter
  public static class Discovery {
    private int pageSize = 50;
  }

  @Getter
  @Setter
  public static class Extraction {
    /** Re-check interval while a scrape run is still in flight. */
    private long pendingRunRecheckSeconds = 30;

    /** Transcript window length in seconds. */
    private double chunkSeconds = 40;

    /** Share of a window repeated at the start of the next one. */
    private double chunkOverlap = 0.15;
  }

  @Getter
  @Setter
  public static class Embedding {
    private int pageSize = 100;
    private int batchSize = 10;

    /** Delay before an embedding job picks up the next page of a backlog. */
    private long drainDelaySeconds = 5;
  }

  @Getter
  @Setter
  public static class Retrieval {
    private int topK = 10;
    private double similarityThreshold = 0.5;
    private int maxReferences = 5;
    private String missingTitlePlaceholder = "Untitled video";
  }

  @Getter
  @Setter
  public static class YouTube {
    private String baseUrl = "https://www.googleapis.com/youtube/v3";
    private String apiKey = "";
  }

  @Getter
  @Setter
  public static class Apify {
    private String baseUrl = "https://api.apify.com/v2";
    private String token = "";
    private String actorId = "streamers~youtube-scraper";
    private String subtitlesLanguage = "en";
  }
}
