package com.flamingo.ai.talkpdf.service.usage;

import com.flamingo.ai.talkpdf.domain.entity.DailyUsageSummary;
import com.flamingo.ai.talkpdf.domain.entity.UsageEvent;
import com.flamingo.ai.talkpdf.domain.enums.UsageActionType;
import com.flamingo.ai.talkpdf.domain.repository.DailyUsageSummaryRepository;
import com.flamingo.ai.talkpdf.domain.repository.UsageEventRepository;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

/**
 * Records billable usage idempotently and keeps the per-day summary in step with the events.
 *
 * <p>Events are unique per (user, action, document). The daily summary is rebuilt from the day's
 * events on every change, so repeated runs cannot inflate it.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class UsageAccountingService {

  private final UsageEventRepository usageEventRepository;
  private final DailyUsageSummaryRepository dailyUsageSummaryRepository;
  private final MeterRegistry meterRegistry;
  private final Clock clock;

  /**
   * Accounts for a completed pipeline run.
   *
   * @param userId document owner
   * @param documentId processed document
   * @param fileType pdf or word
   * @param audioDurationSeconds duration of stored audio, null when no audio was stored
   * @param ttsProvider provider that produced the audio
   */
  public void recordProcessing(
      String userId,
      UUID documentId,
      String fileType,
      Integer audioDurationSeconds,
      String ttsProvider) {
    Map<String, Object> uploadMetadata = new HashMap<>();
    uploadMetadata.put("document_id", documentId.toString());
    uploadMetadata.put("file_type", fileType);
    recordIfAbsent(userId, UsageActionType.PDF_UPLOAD, documentId, null, uploadMetadata);

    if (audioDurationSeconds != null) {
      Map<String, Object> audioMetadata = new HashMap<>();
      audioMetadata.put("document_id", documentId.toString());
      audioMetadata.put("tts_provider", ttsProvider);
      recordIfAbsent(
          userId,
          UsageActionType.AUDIO_CONVERSION,
          documentId,
          audioDurationSeconds / 60.0,
          audioMetadata);
    }

    refreshDailySummary(userId, LocalDate.now(clock.withZone(ZoneOffset.UTC)));
  }

  /**
   * Inserts an event unless one already exists for (user, action, document).
   *
   * @return true when a new event was stored
   */
  public boolean recordIfAbsent(
      String userId,
      UsageActionType actionType,
      UUID documentId,
      Double audioMinutesUsed,
      Map<String, Object> metadata) {
    if (documentId != null
        && usageEventRepository.existsByUserIdAndActionTypeAndDocumentId(
            userId, actionType, documentId)) {
      log.debug("Usage {} already recorded for document {}", actionType.getValue(), documentId);
      return false;
    }

    try {
      usageEventRepository.saveAndFlush(
          UsageEvent.builder()
              .userId(userId)
              .actionType(actionType)
              .documentId(documentId)
              .audioMinutesUsed(audioMinutesUsed)
              .metadata(metadata)
              .createdAt(clock.instant())
              .build());
    } catch (DataIntegrityViolationException e) {
      // A concurrent run inserted the same event first
      log.debug("Usage {} for document {} raced, keeping existing", actionType, documentId);
      return false;
    }

    meterRegistry.counter("usage.event.recorded", "action", actionType.getValue()).increment();
    log.info("Recorded usage {} for user {} (document {})", actionType.getValue(), userId, documentId);
    return true;
  }

  /** Recomputes and stores the summary of the given UTC day from its events. */
  public DailyUsageSummary refreshDailySummary(String userId, LocalDate day) {
    Instant from = day.atStartOfDay(ZoneOffset.UTC).toInstant();
    Instant to = day.plusDays(1).atStartOfDay(ZoneOffset.UTC).toInstant();
    List<UsageEvent> events =
        usageEventRepository.findByUserIdAndCreatedAtGreaterThanEqualAndCreatedAtLessThan(
            userId, from, to);

    DailyUsageSummary summary =
        dailyUsageSummaryRepository
            .findByUserIdAndUsageDate(userId, day)
            .orElseGet(() -> DailyUsageSummary.builder().userId(userId).usageDate(day).build());
    applyAggregate(summary, events);

    try {
      return dailyUsageSummaryRepository.saveAndFlush(summary);
    } catch (DataIntegrityViolationException e) {
      // Another writer created the row; recompute onto it
      DailyUsageSummary existing =
          dailyUsageSummaryRepository.findByUserIdAndUsageDate(userId, day).orElseThrow(() -> e);
      applyAggregate(existing, events);
      return dailyUsageSummaryRepository.saveAndFlush(existing);
    }
  }

  /** Stored summary of a day, or an unsaved zero summary when the user had no activity. */
  public DailyUsageSummary getDailySummary(String userId, LocalDate day) {
    return dailyUsageSummaryRepository
        .findByUserIdAndUsageDate(userId, day)
        .orElseGet(() -> DailyUsageSummary.builder().userId(userId).usageDate(day).build());
  }

  static void applyAggregate(DailyUsageSummary summary, List<UsageEvent> events) {
    int pdfs = 0;
    int explainBacks = 0;
    int questions = 0;
    double audioMinutes = 0.0;
    for (UsageEvent event : events) {
      switch (event.getActionType()) {
        case PDF_UPLOAD -> pdfs++;
        case AUDIO_CONVERSION ->
            audioMinutes += event.getAudioMinutesUsed() != null ? event.getAudioMinutesUsed() : 0.0;
        case EXPLAIN_BACK -> explainBacks++;
        case AI_QUESTION -> questions++;
      }
    }
    summary.setPdfsUploaded(pdfs);
    summary.setAudioMinutesUsed(audioMinutes);
    summary.setExplainBackCount(explainBacks);
    summary.setAiQuestionsAsked(questions);
  }
}
