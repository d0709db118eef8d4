package com.flamingo.ai.talkpdf.service.pipeline;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.flamingo.ai.talkpdf.config.PipelineConfig;
import com.flamingo.ai.talkpdf.domain.entity.Document;
import com.flamingo.ai.talkpdf.domain.enums.DocumentStatus;
import com.flamingo.ai.talkpdf.exception.DocumentNotFoundException;
import com.flamingo.ai.talkpdf.exception.RateLimitExceededException;
import com.flamingo.ai.talkpdf.exception.ServiceUnavailableException;
import com.flamingo.ai.talkpdf.service.document.DocumentStateService;
import com.flamingo.ai.talkpdf.service.ratelimit.SlidingWindowRateLimiter;
import com.flamingo.ai.talkpdf.support.MutableClock;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Instant;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import org.springframework.core.task.TaskRejectedException;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class DocumentIntakeServiceTest {

  @Mock private DocumentStateService documentStateService;
  @Mock private DocumentPipelineService documentPipelineService;

  private DocumentIntakeService service;
  private UUID documentId;
  private Document document;

  @BeforeEach
  void setUp() {
    SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();
    SlidingWindowRateLimiter rateLimiter =
        new SlidingWindowRateLimiter(
            new MutableClock(Instant.parse("2026-01-01T00:00:00Z")), meterRegistry);
    service =
        new DocumentIntakeService(
            rateLimiter,
            documentStateService,
            documentPipelineService,
            new PipelineConfig(),
            meterRegistry);

    documentId = UUID.randomUUID();
    document =
        Document.builder()
            .id(documentId)
            .ownerId("user-1")
            .fileName("notes.pdf")
            .fileRef("user-1/notes.pdf")
            .status(DocumentStatus.PROCESSING)
            .build();
    when(documentStateService.markProcessing(eq(documentId), eq("user-1"), anyString()))
        .thenReturn(document);
  }

  @Test
  void shouldAdmitAndHandOff() {
    Document result = service.submit("user-1", documentId, "YO ");

    assertThat(result.getStatus()).isEqualTo(DocumentStatus.PROCESSING);
    verify(documentStateService).markProcessing(documentId, "user-1", "yo");
    verify(documentPipelineService).processDocumentAsync(documentId, "user-1", "yo");
  }

  @Test
  void shouldDefaultToEnglish_whenLanguageMissing() {
    service.submit("user-1", documentId, null);

    verify(documentPipelineService).processDocumentAsync(documentId, "user-1", "en");
  }

  @Test
  void shouldRejectUnsupportedLanguage() {
    assertThatThrownBy(() -> service.submit("user-1", documentId, "fr"))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("fr");
    verifyNoInteractions(documentStateService, documentPipelineService);
  }

  @Test
  @DisplayName("Sixth request within a minute is rate limited")
  void shouldRateLimitSixthRequest() {
    for (int i = 0; i < 5; i++) {
      service.submit("user-1", documentId, "en");
    }

    assertThatThrownBy(() -> service.submit("user-1", documentId, "en"))
        .isInstanceOf(RateLimitExceededException.class)
        .satisfies(
            e ->
                assertThat(((RateLimitExceededException) e).getRetryAfterSeconds())
                    .isEqualTo(60));
    verify(documentPipelineService, times(5)).processDocumentAsync(any(), any(), any());
  }

  @Test
  void shouldPropagateNotFound_withoutStartingRun() {
    when(documentStateService.markProcessing(eq(documentId), eq("intruder"), anyString()))
        .thenThrow(new DocumentNotFoundException(documentId));

    assertThatThrownBy(() -> service.submit("intruder", documentId, "en"))
        .isInstanceOf(DocumentNotFoundException.class);
    verify(documentPipelineService, never()).processDocumentAsync(any(), any(), any());
  }

  @Test
  void shouldMarkErrorAndReport_whenPoolRejects() {
    doThrow(new TaskRejectedException("queue full"))
        .when(documentPipelineService)
        .processDocumentAsync(documentId, "user-1", "en");

    assertThatThrownBy(() -> service.submit("user-1", documentId, "en"))
        .isInstanceOf(ServiceUnavailableException.class);
    verify(documentStateService).markErrorIfOwned(eq(documentId), eq("user-1"), anyString());
  }
}
