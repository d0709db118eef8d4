package com.flamingo.ai.talkpdf.service.usage;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.flamingo.ai.talkpdf.domain.entity.DailyUsageSummary;
import com.flamingo.ai.talkpdf.domain.entity.UsageEvent;
import com.flamingo.ai.talkpdf.domain.enums.UsageActionType;
import com.flamingo.ai.talkpdf.domain.repository.DailyUsageSummaryRepository;
import com.flamingo.ai.talkpdf.domain.repository.UsageEventRepository;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import org.springframework.dao.DataIntegrityViolationException;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class UsageAccountingServiceTest {

  private static final Instant NOW = Instant.parse("2026-03-14T10:15:30Z");
  private static final LocalDate TODAY = LocalDate.of(2026, 3, 14);

  @Mock private UsageEventRepository usageEventRepository;
  @Mock private DailyUsageSummaryRepository dailyUsageSummaryRepository;

  private UsageAccountingService service;
  private SimpleMeterRegistry meterRegistry;
  private final UUID documentId = UUID.randomUUID();

  @BeforeEach
  void setUp() {
    meterRegistry = new SimpleMeterRegistry();
    service =
        new UsageAccountingService(
            usageEventRepository,
            dailyUsageSummaryRepository,
            meterRegistry,
            Clock.fixed(NOW, ZoneOffset.UTC));
    when(usageEventRepository.saveAndFlush(any(UsageEvent.class)))
        .thenAnswer(inv -> inv.getArgument(0));
    when(dailyUsageSummaryRepository.saveAndFlush(any(DailyUsageSummary.class)))
        .thenAnswer(inv -> inv.getArgument(0));
    when(dailyUsageSummaryRepository.findByUserIdAndUsageDate(anyString(), any()))
        .thenReturn(Optional.empty());
  }

  @Test
  void shouldRecordUploadAndAudioEvents() {
    service.recordProcessing("user-1", documentId, "pdf", 90, "yarngpt");

    ArgumentCaptor<UsageEvent> events = ArgumentCaptor.forClass(UsageEvent.class);
    verify(usageEventRepository, times(2)).saveAndFlush(events.capture());
    UsageEvent upload = events.getAllValues().get(0);
    UsageEvent audio = events.getAllValues().get(1);

    assertThat(upload.getActionType()).isEqualTo(UsageActionType.PDF_UPLOAD);
    assertThat(upload.getMetadata())
        .containsEntry("document_id", documentId.toString())
        .containsEntry("file_type", "pdf");
    assertThat(upload.getCreatedAt()).isEqualTo(NOW);
    assertThat(audio.getActionType()).isEqualTo(UsageActionType.AUDIO_CONVERSION);
    assertThat(audio.getAudioMinutesUsed()).isEqualTo(1.5);
    assertThat(audio.getMetadata()).containsEntry("tts_provider", "yarngpt");
  }

  @Test
  @DisplayName("No audio means no audio_conversion event")
  void shouldSkipAudioEvent_whenNoAudioStored() {
    service.recordProcessing("user-1", documentId, "word", null, "none");

    ArgumentCaptor<UsageEvent> events = ArgumentCaptor.forClass(UsageEvent.class);
    verify(usageEventRepository).saveAndFlush(events.capture());
    assertThat(events.getValue().getActionType()).isEqualTo(UsageActionType.PDF_UPLOAD);
    assertThat(events.getValue().getMetadata()).containsEntry("file_type", "word");
  }

  @Test
  void shouldNotInsertDuplicateEvents() {
    when(usageEventRepository.existsByUserIdAndActionTypeAndDocumentId(
            "user-1", UsageActionType.PDF_UPLOAD, documentId))
        .thenReturn(true);

    boolean recorded =
        service.recordIfAbsent("user-1", UsageActionType.PDF_UPLOAD, documentId, null, Map.of());

    assertThat(recorded).isFalse();
    verify(usageEventRepository, never()).saveAndFlush(any(UsageEvent.class));
  }

  @Test
  void shouldTreatUniqueViolationAsAlreadyRecorded() {
    when(usageEventRepository.saveAndFlush(any(UsageEvent.class)))
        .thenThrow(new DataIntegrityViolationException("uk_usage_event_document"));

    boolean recorded =
        service.recordIfAbsent("user-1", UsageActionType.PDF_UPLOAD, documentId, null, Map.of());

    assertThat(recorded).isFalse();
    assertThat(meterRegistry.find("usage.event.recorded").counter()).isNull();
  }

  @Test
  @DisplayName("Daily summary equals the aggregate of the day's events")
  void shouldRecomputeSummaryFromEvents() {
    when(usageEventRepository.findByUserIdAndCreatedAtGreaterThanEqualAndCreatedAtLessThan(
            eq("user-1"),
            eq(Instant.parse("2026-03-14T00:00:00Z")),
            eq(Instant.parse("2026-03-15T00:00:00Z"))))
        .thenReturn(
            List.of(
                event(UsageActionType.PDF_UPLOAD, null),
                event(UsageActionType.PDF_UPLOAD, null),
                event(UsageActionType.AUDIO_CONVERSION, 1.5),
                event(UsageActionType.AUDIO_CONVERSION, 0.5),
                event(UsageActionType.EXPLAIN_BACK, null),
                event(UsageActionType.AI_QUESTION, null)));

    DailyUsageSummary summary = service.refreshDailySummary("user-1", TODAY);

    assertThat(summary.getPdfsUploaded()).isEqualTo(2);
    assertThat(summary.getAudioMinutesUsed()).isEqualTo(2.0);
    assertThat(summary.getExplainBackCount()).isEqualTo(1);
    assertThat(summary.getAiQuestionsAsked()).isEqualTo(1);
    assertThat(summary.getUsageDate()).isEqualTo(TODAY);
  }

  @Test
  void shouldOverwriteExistingSummary() {
    DailyUsageSummary existing =
        DailyUsageSummary.builder().userId("user-1").usageDate(TODAY).pdfsUploaded(9).build();
    when(dailyUsageSummaryRepository.findByUserIdAndUsageDate("user-1", TODAY))
        .thenReturn(Optional.of(existing));
    when(usageEventRepository.findByUserIdAndCreatedAtGreaterThanEqualAndCreatedAtLessThan(
            anyString(), any(), any()))
        .thenReturn(List.of(event(UsageActionType.PDF_UPLOAD, null)));

    DailyUsageSummary summary = service.refreshDailySummary("user-1", TODAY);

    assertThat(summary).isSameAs(existing);
    assertThat(summary.getPdfsUploaded()).isEqualTo(1);
  }

  @Test
  void shouldReturnZeroSummary_whenNoActivity() {
    DailyUsageSummary summary = service.getDailySummary("user-1", TODAY);

    assertThat(summary.getPdfsUploaded()).isZero();
    assertThat(summary.getAudioMinutesUsed()).isZero();
  }

  private static UsageEvent event(UsageActionType type, Double minutes) {
    return UsageEvent.builder()
        .userId("user-1")
        .actionType(type)
        .audioMinutesUsed(minutes)
        .createdAt(NOW)
        .build();
  }
}
