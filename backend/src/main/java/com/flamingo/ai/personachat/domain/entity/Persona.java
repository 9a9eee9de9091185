package com.flamingo.ai.personachat.domain.entity;

import com.flamingo.ai.personachat.domain.enums.DiscoveryStatus;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import java.time.LocalDateTime;
import java.util.Locale;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/** A chat persona bound to one creator channel. */
@Entity
@Table(
    name = "personas",
    uniqueConstraints = @UniqueConstraint(columnNames = {"channelId", "userId"}))
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Persona {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(nullable = false, unique = true)
  private String username;

  @Column(nullable = false)
  private String channelId;

  @Column(nullable = false)
  private String title;

  @Column(columnDefinition = "TEXT")
  @Builder.Default
  private String description = "";

  private String thumbnailUrl;

  /** Owner; null for personas created by the system. */
  private UUID userId;

  @Builder.Default private Boolean isPublic = true;

  /** Default number of excerpts retrieved per chat message. */
  @Builder.Default private Integer topK = 10;

  @Builder.Default private Integer videoCount = 0;

  /** Resumption point into the channel catalog; null before the first page and after the last. */
  @Column(columnDefinition = "TEXT")
  private String continuationToken;

  @Enumerated(EnumType.STRING)
  @Column(nullable = false)
  @Builder.Default
  private DiscoveryStatus discoveryStatus = DiscoveryStatus.PENDING;

  /** Newest publish time seen; bounds refresh walks once the catalog is complete. */
  private LocalDateTime latestPublishedAt;

  /**
   * Publish time a refresh walk stops at; fixed when the walk starts and cleared when it ends, so
   * continuation pages keep the same bound while {@link #latestPublishedAt} moves forward.
   */
  private LocalDateTime refreshBoundary;

  private LocalDateTime lastVideoDiscovered;

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

  /** Vector store namespace holding this persona's caption embeddings. */
  public String getVectorNamespace() {
    return channelId.toLowerCase(Locale.ROOT);
  }

  /** Records a successfully fetched catalog page. */
  public void advanceDiscovery(
      String nextToken,
      boolean hasMore,
      int insertedVideos,
      LocalDateTime newestPublishedAt,
      LocalDateTime boundary) {
    this.continuationToken = nextToken;
    this.refreshBoundary = hasMore ? boundary : null;
    this.discoveryStatus = hasMore ? DiscoveryStatus.IN_PROGRESS : DiscoveryStatus.COMPLETED;
    this.videoCount = (videoCount == null ? 0 : videoCount) + insertedVideos;
    if (newestPublishedAt != null
        && (latestPublishedAt == null || newestPublishedAt.isAfter(latestPublishedAt))) {
      this.latestPublishedAt = newestPublishedAt;
    }
    this.lastVideoDiscovered = LocalDateTime.now();
  }
}
