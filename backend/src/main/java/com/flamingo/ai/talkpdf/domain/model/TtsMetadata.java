package com.flamingo.ai.talkpdf.domain.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.time.Instant;
import java.util.List;
import lombok.Builder;

/** Diagnostics of the speech synthesis step, stored alongside the document. */
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record TtsMetadata(
    String ttsProvider,
    String requestedLanguage,
    boolean translationApplied,
    List<String> failedProviders,
    int ttsTextLength,
    String ttsTextPreview,
    long audioSizeBytes,
    int chunksGenerated,
    Instant processedAt,
    String voiceUsed,
    String fileType) {}
