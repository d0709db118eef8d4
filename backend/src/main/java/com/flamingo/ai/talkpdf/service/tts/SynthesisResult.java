package com.flamingo.ai.talkpdf.service.tts;

import com.flamingo.ai.talkpdf.domain.enums.AudioContainer;
import java.util.List;

/**
 * Outcome of the provider fallback chain.
 *
 * @param audio encoded audio, null when every provider failed
 * @param container format of {@code audio}
 * @param provider name of the provider that produced the audio, {@code none} otherwise
 * @param voice voice used, null when no audio
 * @param chunksGenerated number of requests whose audio was kept
 * @param failedProviders {@code "<name> (<reason>)"} for each attempted provider that failed
 */
public record SynthesisResult(
    byte[] audio,
    AudioContainer container,
    String provider,
    String voice,
    int chunksGenerated,
    List<String> failedProviders) {

  public static final String NO_PROVIDER = "none";

  public static SynthesisResult none(List<String> failedProviders) {
    return new SynthesisResult(null, null, NO_PROVIDER, null, 0, List.copyOf(failedProviders));
  }

  public boolean hasAudio() {
    return audio != null && audio.length > 0;
  }

  public long audioSizeBytes() {
    return audio == null ? 0 : audio.length;
  }
}
