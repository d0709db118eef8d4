package com.flamingo.ai.talkpdf.service.pipeline;

import com.flamingo.ai.talkpdf.config.PipelineConfig;
import com.flamingo.ai.talkpdf.config.PipelineConfig.PlanLimits;
import com.flamingo.ai.talkpdf.domain.entity.Document;
import com.flamingo.ai.talkpdf.domain.enums.PipelineStage;
import com.flamingo.ai.talkpdf.domain.enums.PlanTier;
import com.flamingo.ai.talkpdf.exception.DocumentNotFoundException;
import com.flamingo.ai.talkpdf.exception.DocumentProcessingException;
import com.flamingo.ai.talkpdf.service.document.DocumentResultWriter;
import com.flamingo.ai.talkpdf.service.document.DocumentStateService;
import com.flamingo.ai.talkpdf.service.extraction.DocumentTextExtractor;
import com.flamingo.ai.talkpdf.service.extraction.ExtractionResult;
import com.flamingo.ai.talkpdf.service.plan.PlanProvider;
import com.flamingo.ai.talkpdf.service.storage.BlobStorageException;
import com.flamingo.ai.talkpdf.service.storage.BlobStore;
import com.flamingo.ai.talkpdf.service.summary.DocumentAnalysis;
import com.flamingo.ai.talkpdf.service.summary.DocumentAnalysisService;
import com.flamingo.ai.talkpdf.service.tts.SpeechScript;
import com.flamingo.ai.talkpdf.service.tts.SpeechScriptPreparer;
import com.flamingo.ai.talkpdf.service.tts.SynthesisResult;
import com.flamingo.ai.talkpdf.service.tts.TtsFallbackEngine;
import com.flamingo.ai.talkpdf.service.usage.UsageAccountingService;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.util.Locale;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

/**
 * Runs one document through extraction, summarization, optional translation, speech synthesis and
 * persistence.
 *
 * <p>Only extraction can fail a run on its own; summarization, translation and synthesis degrade.
 * Whatever escapes leaves the document in {@code error}, provided it still belongs to the owner
 * the run was admitted for.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DocumentPipelineService {

  private final DocumentStateService documentStateService;
  private final PlanProvider planProvider;
  private final PipelineConfig pipelineConfig;
  private final BlobStore blobStore;
  private final DocumentTextExtractor textExtractor;
  private final DocumentAnalysisService analysisService;
  private final SpeechScriptPreparer scriptPreparer;
  private final TtsFallbackEngine ttsFallbackEngine;
  private final DocumentResultWriter resultWriter;
  private final UsageAccountingService usageAccountingService;
  private final MeterRegistry meterRegistry;

  /**
   * Processes a document asynchronously on the document processing pool.
   *
   * @param documentId the document to process
   * @param ownerId the caller the run was admitted for
   * @param language requested audio language
   */
  @Async("documentProcessingExecutor")
  public void processDocumentAsync(UUID documentId, String ownerId, String language) {
    process(documentId, ownerId, language);
  }

  /**
   * Runs the pipeline on the calling thread. Returns the final stage reached. Each run is recorded
   * on the {@code document.process} timer, tagged with its outcome.
   */
  public PipelineStage process(UUID documentId, String ownerId, String language) {
    Timer.Sample sample = Timer.start(meterRegistry);
    PipelineStage stage = PipelineStage.ADMITTED;
    boolean completed = false;
    String failure = null;

    try {
      Document document = documentStateService.markProcessing(documentId, ownerId, language);
      PlanTier plan = planProvider.currentPlan(ownerId);
      PlanLimits limits = pipelineConfig.limitsFor(plan);
      log.info(
          "Processing document {} for user {} (plan={}, language={})",
          documentId,
          ownerId,
          plan,
          language);

      stage = PipelineStage.EXTRACTING;
      byte[] content = download(documentId, document.getFileRef());
      ExtractionResult extraction =
          textExtractor.extract(documentId, document.getFileName(), content, limits);

      stage = PipelineStage.SUMMARIZING;
      DocumentAnalysis analysis =
          analysisService.analyze(document.getFileName(), extraction.text(), limits);

      stage = PipelineStage.TRANSLATING;
      SpeechScript script = scriptPreparer.prepare(analysis.summary(), language, limits);

      stage = PipelineStage.SYNTHESIZING;
      SynthesisResult synthesis = ttsFallbackEngine.synthesize(script.text(), language, limits);

      stage = PipelineStage.PERSISTING;
      Document saved =
          resultWriter.write(
              documentId,
              ownerId,
              document.getFileType(),
              language,
              extraction,
              analysis,
              script,
              synthesis);
      completed = true;
      stage = PipelineStage.READY;
      meterRegistry.counter("document.processing.success").increment();

      account(saved, ownerId, synthesis);
      log.info("Successfully processed document: {}", documentId);
      return stage;

    } catch (DocumentNotFoundException e) {
      log.warn("Document {} no longer accessible to {}, abandoning run", documentId, ownerId);
      failure = "Document is no longer accessible";
    } catch (DocumentProcessingException e) {
      log.error("Failed to process document {} at {}: {}", documentId, stage, e.getMessage());
      failure = e.getUserMessage();
    } catch (Exception e) {
      log.error("Failed to process document {} at {}: {}", documentId, stage, e.getMessage(), e);
      failure = "Unexpected failure";
    } finally {
      if (!completed) {
        meterRegistry.counter("document.processing.failure", "stage", stageTag(stage)).increment();
        forceError(documentId, ownerId, stage, failure);
      }
      String outcome = completed ? "ready" : "error";
      sample.stop(meterRegistry.timer("document.process", "outcome", outcome));
    }
    return PipelineStage.ERROR;
  }

  private byte[] download(UUID documentId, String fileRef) {
    try {
      return blobStore.download(fileRef);
    } catch (BlobStorageException e) {
      throw new DocumentProcessingException(
          documentId, "Failed to download document: " + e.getMessage(), e);
    }
  }

  private void account(Document document, String ownerId, SynthesisResult synthesis) {
    try {
      usageAccountingService.recordProcessing(
          ownerId,
          document.getId(),
          document.getFileType(),
          document.getAudioDurationSeconds(),
          synthesis.provider());
    } catch (Exception e) {
      log.error("Usage accounting failed for document {}: {}", document.getId(), e.getMessage());
    }
  }

  private void forceError(UUID documentId, String ownerId, PipelineStage stage, String failure) {
    String message =
        String.format(
            "Processing failed at %s stage: %s. Please try processing the document again.",
            stageTag(stage), failure != null ? failure : "run interrupted");
    try {
      if (!documentStateService.markErrorIfOwned(documentId, ownerId, message)) {
        log.warn("Did not mark document {} as error: not owned by {}", documentId, ownerId);
      }
    } catch (Exception e) {
      log.error("Failed to update document status after failure: {}", e.getMessage());
    }
  }

  private static String stageTag(PipelineStage stage) {
    return stage.name().toLowerCase(Locale.ROOT);
  }
}
