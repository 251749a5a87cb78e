package com.flamingo.ai.deepresearch.domain.entity;

import com.flamingo.ai.deepresearch.domain.converter.EmbeddingVectorConverter;
import com.flamingo.ai.deepresearch.domain.converter.StringListConverter;
import jakarta.persistence.Column;
import jakarta.persistence.Convert;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * A completed research session in the append-only history store. Rows are written once and never
 * updated, so there are no setters and every column is non-updatable.
 */
@Entity
@Table(name = "research_history")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
@Builder
public class HistoryRecord {

  /** Id of the research session; one record per session. */
  @Id
  @Column(nullable = false, updatable = false)
  private UUID sessionId;

  @Column(columnDefinition = "TEXT", nullable = false, updatable = false)
  private String topic;

  @Column(columnDefinition = "TEXT", updatable = false)
  private String summary;

  @Column(columnDefinition = "TEXT", updatable = false)
  private String finalReport;

  /** Cited URLs in citation order. */
  @Convert(converter = StringListConverter.class)
  @Column(columnDefinition = "TEXT", updatable = false)
  @Builder.Default
  private List<String> sourceUrls = new ArrayList<>();

  @Convert(converter = EmbeddingVectorConverter.class)
  @Column(columnDefinition = "BLOB", nullable = false, updatable = false)
  private float[] embedding;

  @Column(nullable = false, updatable = false)
  private int embeddingDimension;

  @Column(nullable = false, updatable = false)
  private String embeddingModel;

  @Column(nullable = false, updatable = false)
  private int loopCount;

  @Column(nullable = false, updatable = false)
  private boolean degraded;

  @Column(nullable = false, updatable = false)
  private LocalDateTime storedAt;

  @PrePersist
  protected void onCreate() {
    if (storedAt == null) {
      storedAt = LocalDateTime.now();
    }
  }
}
