package com.flamingo.ai.talkpdf.service.tts;

import com.flamingo.ai.talkpdf.domain.enums.AudioContainer;

/** An external text-to-speech service. */
public interface TtsProvider {

  /** Stable identifier, used in ordering config and failure records. */
  String name();

  /** Whether credentials and endpoint are present. Unconfigured providers are skipped. */
  boolean isConfigured();

  /** Whether the provider may be used for the language. Unsupported providers are skipped. */
  boolean supportsLanguage(String language);

  String voiceFor(String language);

  /** Longest text accepted by a single request. */
  int maxRequestChars();

  /** True when the script is split into several requests whose audio is concatenated. */
  boolean chunked();

  AudioContainer container();

  /**
   * Synthesizes one request.
   *
   * @return encoded audio in {@link #container()} format
   * @throws TtsProviderException on any provider failure
   */
  byte[] synthesize(String text, String language, String voice);
}
