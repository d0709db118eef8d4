package com.flamingo.ai.talkpdf.domain.entity;

import com.flamingo.ai.talkpdf.domain.converter.MetadataMapConverter;
import com.flamingo.ai.talkpdf.domain.enums.UsageActionType;
import jakarta.persistence.Column;
import jakarta.persistence.Convert;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/** One billable action. At most one per (user, action, document). */
@Entity
@Table(
    name = "usage_events",
    uniqueConstraints =
        @UniqueConstraint(
            name = "uk_usage_event_document",
            columnNames = {"user_id", "action_type", "document_id"}),
    indexes = @Index(name = "idx_usage_events_user_created", columnList = "user_id, created_at"))
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class UsageEvent {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "user_id", nullable = false)
  private String userId;

  @Enumerated(EnumType.STRING)
  @Column(name = "action_type", nullable = false)
  private UsageActionType actionType;

  @Column(name = "document_id")
  private UUID documentId;

  private Double audioMinutesUsed;

  @Convert(converter = MetadataMapConverter.class)
  @Column(columnDefinition = "TEXT")
  @Builder.Default
  private Map<String, Object> metadata = new HashMap<>();

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @PrePersist
  protected void onCreate() {
    if (createdAt == null) {
      createdAt = Instant.now();
    }
  }
}
