package com.flamingo.ai.talkpdf.service.translation;

import com.flamingo.ai.talkpdf.agent.TranslationAgent;
import com.flamingo.ai.talkpdf.config.PipelineConfig;
import io.micrometer.core.annotation.Timed;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/** Translates the summary for non-English audio. Failures never abort the run. */
@Service
@RequiredArgsConstructor
@Slf4j
public class TranslationService {

  public static final String SOURCE_LANGUAGE = "en";

  private final TranslationAgent translationAgent;
  private final PipelineConfig pipelineConfig;

  /**
   * Translates {@code text} into {@code language}.
   *
   * @return the translation, or the original text with {@code applied = false} when the language
   *     is English, the call fails, or the output is implausibly short
   */
  @Timed(value = "pipeline.translation", description = "Time to translate summary")
  public TranslationResult translate(String text, String language) {
    if (text == null || text.isBlank() || SOURCE_LANGUAGE.equals(language)) {
      return TranslationResult.original(text);
    }

    String label = pipelineConfig.languageLabel(language);
    try {
      String translated = translationAgent.translate(label, text);
      if (translated == null
          || translated.trim().length() <= pipelineConfig.getTranslation().getMinChars()) {
        log.warn(
            "Discarding {} translation: {} chars",
            label,
            translated == null ? 0 : translated.trim().length());
        return TranslationResult.original(text);
      }
      log.debug("Translated {} chars into {} ({} chars)", text.length(), label, translated.length());
      return new TranslationResult(translated.trim(), true);
    } catch (Exception e) {
      log.warn("Translation into {} failed: {}", label, e.getMessage());
      return TranslationResult.original(text);
    }
  }
}
