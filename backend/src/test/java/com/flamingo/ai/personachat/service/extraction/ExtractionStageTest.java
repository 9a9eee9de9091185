package com.flamingo.ai.personachat.service.extraction;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.flamingo.ai.personachat.config.PipelineConfig;
import com.flamingo.ai.personachat.domain.entity.Persona;
import com.flamingo.ai.personachat.domain.entity.Video;
import com.flamingo.ai.personachat.domain.enums.CaptionsStatus;
import com.flamingo.ai.personachat.domain.enums.JobType;
import com.flamingo.ai.personachat.domain.repository.CaptionChunkRepository;
import com.flamingo.ai.personachat.domain.repository.VideoRepository;
import com.flamingo.ai.personachat.exception.CaptionExtractionException;
import com.flamingo.ai.personachat.exception.ExternalServiceException;
import com.flamingo.ai.personachat.exception.JobDeferredException;
import com.flamingo.ai.personachat.exception.VideoNotFoundException;
import com.flamingo.ai.personachat.job.payload.EmbeddingPayload;
import com.flamingo.ai.personachat.job.payload.ExtractionResult;
import com.flamingo.ai.personachat.service.job.JobStore;
import com.flamingo.ai.personachat.vectorstore.VectorStore;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class ExtractionStageTest {

  private static final String VIDEO_ID = "dQw4w9WgXcQ";

  @Mock private VideoRepository videoRepository;
  @Mock private CaptionChunkRepository captionChunkRepository;
  @Mock private CaptionChunkWriter captionChunkWriter;
  @Mock private CaptionScraper captionScraper;
  @Mock private VectorStore vectorStore;
  @Mock private JobStore jobStore;

  private ExtractionStage extractionStage;
  private Persona persona;
  private Video video;

  private final List<CaptionSegment> segments =
      List.of(
          new CaptionSegment(0, 40, "never gonna give you up"),
          new CaptionSegment(34, 40, "never gonna let you down"),
          new CaptionSegment(68, 40, "never gonna run around"));

  @BeforeEach
  void setUp() {
    extractionStage =
        new ExtractionStage(
            videoRepository,
            captionChunkRepository,
            captionChunkWriter,
            captionScraper,
            vectorStore,
            jobStore,
            new PipelineConfig(),
            new SimpleMeterRegistry());
    persona =
        Persona.builder()
            .id(UUID.randomUUID())
            .username("rick")
            .channelId("UCuAXFkgsw1L7xaCfnd5JJOw")
            .title("Rick Astley")
            .build();
    video =
        Video.builder()
            .id(UUID.randomUUID())
            .persona(persona)
            .externalVideoId(VIDEO_ID)
            .title("Never Gonna Give You Up")
            .build();
    lenient()
        .when(videoRepository.findWithPersonaByExternalVideoId(VIDEO_ID))
        .thenReturn(Optional.of(video));
  }

  @Nested
  @DisplayName("scrape run lifecycle")
  class RunLifecycleTests {

    @Test
    @DisplayName("should start a run and defer while it is pending")
    void shouldStartRunAndDefer() {
      when(captionScraper.startRun(VIDEO_ID)).thenReturn("run-1");
      when(captionScraper.fetchResults("run-1")).thenReturn(ScrapeResult.pending());

      assertThatThrownBy(() -> extractionStage.extract(VIDEO_ID))
          .isInstanceOfSatisfying(
              JobDeferredException.class,
              e -> {
                assertThat(e.getDelay()).isEqualTo(Duration.ofSeconds(30));
                assertThat(e.getProgress()).isEqualTo(50);
              });

      assertThat(video.getCaptionsStatus()).isEqualTo(CaptionsStatus.PROCESSING);
      assertThat(video.getExternalRunId()).isEqualTo("run-1");
    }

    @Test
    @DisplayName("should resume the bound run instead of starting a new one")
    void shouldResumeBoundRun() {
      video.startProcessing("run-1");
      when(captionScraper.fetchResults("run-1")).thenReturn(ScrapeResult.succeeded(segments));
      when(captionChunkRepository.countByVideoId(video.getId())).thenReturn(0L);
      when(captionChunkWriter.replace(video, segments)).thenReturn(3);

      ExtractionResult result = extractionStage.extract(VIDEO_ID);

      assertThat(result).isEqualTo(new ExtractionResult(3, false));
      assertThat(video.getCaptionsStatus()).isEqualTo(CaptionsStatus.EXTRACTED);
      verify(captionScraper, never()).startRun(anyString());
      verify(vectorStore, never()).deleteByVideo(anyString(), anyString());
      verify(jobStore)
          .enqueue(
              JobType.EMBEDDING,
              new EmbeddingPayload(persona.getId(), VIDEO_ID),
              ExtractionStage.embeddingKey(VIDEO_ID, "run-1"));
    }
  }

  @Nested
  @DisplayName("failures")
  class FailureTests {

    @Test
    @DisplayName("should fail with a readable reason when no captions exist")
    void shouldFailWhenNoCaptions() {
      video.startProcessing("run-1");
      when(captionScraper.fetchResults("run-1")).thenReturn(ScrapeResult.succeeded(List.of()));

      assertThatThrownBy(() -> extractionStage.extract(VIDEO_ID))
          .isInstanceOf(CaptionExtractionException.class)
          .hasMessageContaining(ExtractionStage.NO_CAPTIONS);

      assertThat(video.getCaptionsStatus()).isEqualTo(CaptionsStatus.FAILED);
      assertThat(video.getCaptionsError()).isEqualTo(ExtractionStage.NO_CAPTIONS);
      assertThat(video.getExternalRunId()).isNull();
      verify(jobStore, never()).enqueue(any(), any(), anyString());
    }

    @Test
    @DisplayName("should keep the run when the scraper is unreachable")
    void shouldKeepRunOnTransientFailure() {
      video.startProcessing("run-1");
      when(captionScraper.fetchResults("run-1"))
          .thenThrow(new ExternalServiceException("Apify", "connection refused"));

      assertThatThrownBy(() -> extractionStage.extract(VIDEO_ID))
          .isInstanceOf(ExternalServiceException.class);

      assertThat(video.getCaptionsStatus()).isEqualTo(CaptionsStatus.FAILED);
      assertThat(video.getExternalRunId()).isEqualTo("run-1");
    }

    @Test
    @DisplayName("should record the failure when a run cannot be started")
    void shouldFailWhenRunCannotStart() {
      when(captionScraper.startRun(VIDEO_ID))
          .thenThrow(new ExternalServiceException("Apify", "connection refused"));

      assertThatThrownBy(() -> extractionStage.extract(VIDEO_ID))
          .isInstanceOf(ExternalServiceException.class);

      assertThat(video.getCaptionsStatus()).isEqualTo(CaptionsStatus.FAILED);
      assertThat(video.getCaptionsError()).contains("connection refused");
      assertThat(video.getExternalRunId()).isNull();
      verify(videoRepository).save(video);
      verify(captionScraper, never()).fetchResults(anyString());
    }

    @Test
    @DisplayName("should throw for an unknown video")
    void shouldThrowForUnknownVideo() {
      when(videoRepository.findWithPersonaByExternalVideoId("missing"))
          .thenReturn(Optional.empty());

      assertThatThrownBy(() -> extractionStage.extract("missing"))
          .isInstanceOf(VideoNotFoundException.class);
    }
  }

  @Nested
  @DisplayName("re-extraction")
  class ReExtractionTests {

    @Test
    @DisplayName("should not rewrite chunks when the stored count matches")
    void shouldSkipRewriteWhenCountMatches() {
      video.startProcessing("run-1");
      video.markExtracted();
      video.markCompleted();
      when(captionScraper.fetchResults("run-1")).thenReturn(ScrapeResult.succeeded(segments));
      when(captionChunkRepository.countByVideoId(video.getId())).thenReturn(3L);

      ExtractionResult result = extractionStage.extract(VIDEO_ID);

      assertThat(result).isEqualTo(new ExtractionResult(3, true));
      assertThat(video.getCaptionsStatus()).isEqualTo(CaptionsStatus.COMPLETED);
      verify(captionChunkWriter, never()).replace(any(), any());
      verify(jobStore, never()).enqueue(any(), any(), anyString());
    }

    @Test
    @DisplayName("should drop old vectors before replacing a different chunk set")
    void shouldDropVectorsBeforeReplacing() {
      video.startProcessing("run-2");
      when(captionScraper.fetchResults("run-2")).thenReturn(ScrapeResult.succeeded(segments));
      when(captionChunkRepository.countByVideoId(video.getId())).thenReturn(5L);
      when(captionChunkWriter.replace(video, segments)).thenReturn(3);

      extractionStage.extract(VIDEO_ID);

      verify(vectorStore).deleteByVideo("ucuaxfkgsw1l7xacfnd5jjow", VIDEO_ID);
      assertThat(video.getCaptionsStatus()).isEqualTo(CaptionsStatus.EXTRACTED);
    }
  }
}
