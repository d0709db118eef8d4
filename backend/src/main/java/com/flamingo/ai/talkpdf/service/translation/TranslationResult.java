package com.flamingo.ai.talkpdf.service.translation;

/**
 * Text to be spoken and whether it is a translation.
 *
 * @param text translated text, or the original when translation was skipped or discarded
 * @param applied true only when {@code text} is a translation
 */
public record TranslationResult(String text, boolean applied) {

  public static TranslationResult original(String text) {
    return new TranslationResult(text, false);
  }
}
