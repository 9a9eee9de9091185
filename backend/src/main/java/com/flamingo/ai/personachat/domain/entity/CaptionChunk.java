package com.flamingo.ai.personachat.domain.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.FetchType;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import java.time.LocalDateTime;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/** A timestamped transcript window of a video; the unit of embedding and retrieval. */
@Entity
@Table(
    name = "caption_chunks",
    indexes = {
      @Index(name = "idx_caption_chunks_video", columnList = "video_id"),
      @Index(name = "idx_caption_chunks_persona_embedded", columnList = "persona_id, embedded")
    })
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class CaptionChunk {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @ManyToOne(fetch = FetchType.LAZY)
  @JoinColumn(name = "video_id", nullable = false)
  private Video video;

  @ManyToOne(fetch = FetchType.LAZY)
  @JoinColumn(name = "persona_id", nullable = false)
  private Persona persona;

  /** Offset into the video, in seconds. */
  @Column(nullable = false)
  private Double startTime;

  /** Window length, in seconds. */
  @Column(nullable = false)
  private Double duration;

  @Column(columnDefinition = "TEXT", nullable = false)
  private String text;

  /** Set only after the vector store confirmed the upsert. */
  @Builder.Default private Boolean embedded = false;

  @Column(nullable = false, updatable = false)
  private LocalDateTime createdAt;

  @PrePersist
  protected void onCreate() {
    createdAt = LocalDateTime.now();
  }
}
