package com.flamingo.ai.talkpdf.service.document;

import com.flamingo.ai.talkpdf.config.PipelineConfig;
import com.flamingo.ai.talkpdf.domain.entity.Document;
import com.flamingo.ai.talkpdf.domain.model.TtsMetadata;
import com.flamingo.ai.talkpdf.exception.DocumentNotFoundException;
import com.flamingo.ai.talkpdf.service.extraction.ExtractionResult;
import com.flamingo.ai.talkpdf.service.storage.BlobStore;
import com.flamingo.ai.talkpdf.service.summary.DocumentAnalysis;
import com.flamingo.ai.talkpdf.service.tts.SpeechScript;
import com.flamingo.ai.talkpdf.service.tts.SynthesisResult;
import io.micrometer.core.annotation.Timed;
import java.time.Clock;
import java.util.ArrayList;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/** Stores the audio and writes all pipeline results back onto the document. */
@Service
@RequiredArgsConstructor
@Slf4j
public class DocumentResultWriter {

  private final BlobStore blobStore;
  private final DocumentStateService documentStateService;
  private final PipelineConfig pipelineConfig;
  private final Clock clock;

  /**
   * Persists a completed run and marks the document ready.
   *
   * @throws DocumentNotFoundException when the document is no longer owned by {@code ownerId}
   */
  @Timed(value = "pipeline.persist", description = "Time to persist pipeline results")
  public Document write(
      UUID documentId,
      String ownerId,
      String fileType,
      String language,
      ExtractionResult extraction,
      DocumentAnalysis analysis,
      SpeechScript script,
      SynthesisResult synthesis) {

    String audioRef = synthesis.hasAudio() ? storeAudio(documentId, ownerId, synthesis) : null;
    Integer durationSeconds = audioRef != null ? estimateDurationSeconds(script) : null;
    TtsMetadata metadata = buildMetadata(fileType, language, script, synthesis);

    Document saved =
        documentStateService
            .update(
                documentId,
                ownerId,
                document -> {
                  document.setSummary(analysis.summary());
                  document.setStudyPrompts(new ArrayList<>(analysis.studyPrompts()));
                  document.setPageContents(new ArrayList<>(extraction.pages()));
                  document.setPageCount(extraction.pageCount());
                  document.setAudioRef(audioRef);
                  document.setAudioDurationSeconds(durationSeconds);
                  document.setAudioLanguage(language);
                  document.setTtsMetadata(metadata);
                  document.markReady();
                })
            .orElseThrow(() -> new DocumentNotFoundException(documentId));

    log.info(
        "Document {} ready: summary {} chars, {} prompts, audio={}",
        documentId,
        analysis.summary().length(),
        analysis.studyPrompts().size(),
        audioRef != null ? audioRef : "none");
    return saved;
  }

  /** Duration estimate from the script's word count at the configured speaking rate. */
  public int estimateDurationSeconds(SpeechScript script) {
    return (int) Math.round(script.wordCount() / pipelineConfig.getTts().getWordsPerSecond());
  }

  private String storeAudio(UUID documentId, String ownerId, SynthesisResult synthesis) {
    String ref =
        ownerId + "/" + documentId + "/audio." + synthesis.container().getExtension();
    try {
      return blobStore.upload(ref, synthesis.audio(), synthesis.container().getContentType());
    } catch (RuntimeException e) {
      log.error("Audio upload failed for document {}: {}", documentId, e.getMessage());
      return null;
    }
  }

  private TtsMetadata buildMetadata(
      String fileType, String language, SpeechScript script, SynthesisResult synthesis) {
    String text = script.text();
    int previewChars = pipelineConfig.getTts().getPreviewChars();
    return TtsMetadata.builder()
        .ttsProvider(synthesis.provider())
        .requestedLanguage(language)
        .translationApplied(script.translationApplied())
        .failedProviders(synthesis.failedProviders())
        .ttsTextLength(text.length())
        .ttsTextPreview(text.length() > previewChars ? text.substring(0, previewChars) : text)
        .audioSizeBytes(synthesis.audioSizeBytes())
        .chunksGenerated(synthesis.chunksGenerated())
        .processedAt(clock.instant())
        .voiceUsed(synthesis.voice())
        .fileType(fileType)
        .build();
  }
}
