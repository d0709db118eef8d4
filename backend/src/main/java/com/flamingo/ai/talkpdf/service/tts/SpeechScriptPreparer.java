package com.flamingo.ai.talkpdf.service.tts;

import com.flamingo.ai.talkpdf.config.PipelineConfig.PlanLimits;
import com.flamingo.ai.talkpdf.service.translation.TranslationResult;
import com.flamingo.ai.talkpdf.service.translation.TranslationService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/** Turns a summary into the script to speak: translate, normalize whitespace, cap length. */
@Component
@RequiredArgsConstructor
@Slf4j
public class SpeechScriptPreparer {

  private final TranslationService translationService;

  public SpeechScript prepare(String summary, String language, PlanLimits limits) {
    int maxChars = limits.getTtsChars();
    String source = cap(summary == null ? "" : summary, maxChars);

    TranslationResult translation = translationService.translate(source, language);
    String normalized = cap(translation.text().replaceAll("\\s+", " ").trim(), maxChars);

    log.debug(
        "Prepared {} char script for language {} (translated={})",
        normalized.length(),
        language,
        translation.applied());
    return new SpeechScript(normalized, translation.applied());
  }

  private static String cap(String text, int maxChars) {
    return text.length() > maxChars ? text.substring(0, maxChars) : text;
  }
}
