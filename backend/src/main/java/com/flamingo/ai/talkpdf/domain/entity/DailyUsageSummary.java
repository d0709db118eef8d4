package com.flamingo.ai.talkpdf.domain.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/** Per-user, per-UTC-day aggregate of usage events. Always recomputed, never incremented. */
@Entity
@Table(
    name = "daily_usage_summary",
    uniqueConstraints =
        @UniqueConstraint(
            name = "uk_daily_usage_user_date",
            columnNames = {"user_id", "usage_date"}))
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class DailyUsageSummary {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "user_id", nullable = false)
  private String userId;

  @Column(name = "usage_date", nullable = false)
  private LocalDate usageDate;

  @Builder.Default private int pdfsUploaded = 0;

  @Builder.Default private double audioMinutesUsed = 0.0;

  @Builder.Default private int explainBackCount = 0;

  @Builder.Default private int aiQuestionsAsked = 0;

  private LocalDateTime updatedAt;

  @PrePersist
  @PreUpdate
  protected void touch() {
    updatedAt = LocalDateTime.now();
  }
}
