package com.flamingo.ai.talkpdf.api.dto.response;

import com.flamingo.ai.talkpdf.domain.entity.DailyUsageSummary;
import java.time.LocalDate;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for a user's usage on one UTC day. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DailyUsageResponse {

  private LocalDate date;
  private int pdfsUploaded;
  private double audioMinutesUsed;
  private int explainBackCount;
  private int aiQuestionsAsked;

  public static DailyUsageResponse fromEntity(DailyUsageSummary summary) {
    return DailyUsageResponse.builder()
        .date(summary.getUsageDate())
        .pdfsUploaded(summary.getPdfsUploaded())
        .audioMinutesUsed(summary.getAudioMinutesUsed())
        .explainBackCount(summary.getExplainBackCount())
        .aiQuestionsAsked(summary.getAiQuestionsAsked())
        .build();
  }
}
