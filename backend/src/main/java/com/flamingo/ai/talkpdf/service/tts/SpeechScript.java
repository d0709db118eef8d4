package com.flamingo.ai.talkpdf.service.tts;

/**
 * Text handed to speech synthesis.
 *
 * @param text whitespace-normalized, capped to the plan's character budget
 * @param translationApplied whether {@code text} is a translation of the summary
 */
public record SpeechScript(String text, boolean translationApplied) {

  /** Word count of the script, the basis of the audio duration estimate. */
  public int wordCount() {
    String trimmed = text == null ? "" : text.trim();
    return trimmed.isEmpty() ? 0 : trimmed.split("\\s+").length;
  }
}
