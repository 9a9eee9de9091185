package com.flamingo.ai.personachat.domain.entity;

import com.flamingo.ai.personachat.domain.enums.CaptionsStatus;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.FetchType;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import java.time.LocalDateTime;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * A video of a persona's channel and its caption pipeline state.
 *
 * <p>Transitions: {@code PENDING -> PROCESSING -> EXTRACTED -> COMPLETED}; {@code PROCESSING} and
 * {@code EXTRACTED} may fall to {@code FAILED}, and a retry moves {@code FAILED} back to {@code
 * PROCESSING}.
 */
@Entity
@Table(name = "videos")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Video {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @ManyToOne(fetch = FetchType.LAZY)
  @JoinColumn(name = "persona_id", nullable = false)
  private Persona persona;

  /** Id of the video in the catalog; unique across all personas. */
  @Column(nullable = false, unique = true)
  private String externalVideoId;

  @Column(nullable = false)
  private String title;

  @Column(columnDefinition = "TEXT")
  @Builder.Default
  private String description = "";

  private String thumbnailUrl;

  @Builder.Default private String duration = "0:00";

  private LocalDateTime publishedAt;

  @Builder.Default private Long viewCount = 0L;

  @Enumerated(EnumType.STRING)
  @Column(nullable = false)
  @Builder.Default
  private CaptionsStatus captionsStatus = CaptionsStatus.PENDING;

  @Column(columnDefinition = "TEXT")
  private String captionsError;

  /** Scrape run in flight for this video; kept so that re-entrant extraction resumes it. */
  private String externalRunId;

  private LocalDateTime processingStartedAt;

  private LocalDateTime processingCompletedAt;

  @Column(nullable = false, updatable = false)
  private LocalDateTime createdAt;

  private LocalDateTime updatedAt;

  @PrePersist
  protected void onCreate() {
    createdAt = LocalDateTime.now();
    updatedAt = createdAt;
  }

  @PreUpdate
  protected void onUpdate() {
    updatedAt = LocalDateTime.now();
  }

  /** Binds a freshly started scrape run and moves the video to processing. */
  public void startProcessing(String runId) {
    this.externalRunId = runId;
    this.captionsStatus = CaptionsStatus.PROCESSING;
    this.captionsError = null;
    this.processingStartedAt = LocalDateTime.now();
    this.processingCompletedAt = null;
  }

  /** Resumes an existing run after a failure. */
  public void resumeProcessing() {
    this.captionsStatus = CaptionsStatus.PROCESSING;
    this.captionsError = null;
  }

  /** Caption chunks are stored and wait for embedding. */
  public void markExtracted() {
    this.captionsStatus = CaptionsStatus.EXTRACTED;
    this.captionsError = null;
    this.processingCompletedAt = LocalDateTime.now();
  }

  /** All caption chunks are embedded. */
  public void markCompleted() {
    this.captionsStatus = CaptionsStatus.COMPLETED;
  }

  /**
   * Marks extraction as failed.
   *
   * @param reason human readable reason
   * @param discardRun whether the bound run is unusable and a retry must start a new one
   */
  public void markFailed(String reason, boolean discardRun) {
    this.captionsStatus = CaptionsStatus.FAILED;
    this.captionsError = reason;
    this.processingCompletedAt = LocalDateTime.now();
    if (discardRun) {
      this.externalRunId = null;
    }
  }
}
