package com.flamingo.ai.talkpdf.service.pipeline;

import com.flamingo.ai.talkpdf.config.PipelineConfig;
import com.flamingo.ai.talkpdf.domain.entity.Document;
import com.flamingo.ai.talkpdf.exception.RateLimitExceededException;
import com.flamingo.ai.talkpdf.exception.ServiceUnavailableException;
import com.flamingo.ai.talkpdf.service.document.DocumentStateService;
import com.flamingo.ai.talkpdf.service.ratelimit.RateLimitDecision;
import com.flamingo.ai.talkpdf.service.ratelimit.SlidingWindowRateLimiter;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.Locale;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.stereotype.Service;

/**
 * Synchronous admission of a processing request: rate limit, ownership, status flip, then hand-off
 * to the worker pool. The caller never waits for the pipeline itself.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DocumentIntakeService {

  public static final String DEFAULT_LANGUAGE = "en";

  private final SlidingWindowRateLimiter rateLimiter;
  private final DocumentStateService documentStateService;
  private final DocumentPipelineService documentPipelineService;
  private final PipelineConfig pipelineConfig;
  private final MeterRegistry meterRegistry;

  /**
   * Admits a document for background processing.
   *
   * @param userId authenticated caller
   * @param documentId document to process
   * @param requestedLanguage audio language, defaults to English when blank
   * @return the document, now in processing
   * @throws IllegalArgumentException for an unsupported language
   * @throws RateLimitExceededException when the caller is over budget
   * @throws com.flamingo.ai.talkpdf.exception.DocumentNotFoundException when missing or not owned
   * @throws ServiceUnavailableException when the worker pool rejects the run
   */
  @Timed(value = "document.intake", description = "Time to admit a processing request")
  public Document submit(String userId, UUID documentId, String requestedLanguage) {
    String language = normalizeLanguage(requestedLanguage);

    PipelineConfig.RateLimit rateLimit = pipelineConfig.getRateLimit();
    RateLimitDecision decision =
        rateLimiter.allow(
            userId, rateLimit.getActionKey(), rateLimit.getWindowMs(), rateLimit.getMaxRequests());
    if (!decision.allowed()) {
      throw new RateLimitExceededException(rateLimit.getActionKey(), decision.resetInMs());
    }

    Document document = documentStateService.markProcessing(documentId, userId, language);

    try {
      documentPipelineService.processDocumentAsync(documentId, userId, language);
    } catch (TaskRejectedException e) {
      log.error("Worker pool rejected document {}: {}", documentId, e.getMessage());
      meterRegistry.counter("document.processing.rejected").increment();
      documentStateService.markErrorIfOwned(
          documentId, userId, "Server is busy. Please try processing the document again.");
      throw new ServiceUnavailableException("Document processing queue is full", e);
    }

    meterRegistry.counter("document.processing.submitted").increment();
    log.info("Document {} admitted for processing (language={})", documentId, language);
    return document;
  }

  private String normalizeLanguage(String requestedLanguage) {
    if (requestedLanguage == null || requestedLanguage.isBlank()) {
      return DEFAULT_LANGUAGE;
    }
    String language = requestedLanguage.trim().toLowerCase(Locale.ROOT);
    if (!pipelineConfig.getLanguages().containsKey(language)) {
      throw new IllegalArgumentException("Unsupported language: " + requestedLanguage);
    }
    return language;
  }
}
