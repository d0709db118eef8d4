package com.flamingo.ai.talkpdf.service.tts;

import com.flamingo.ai.talkpdf.config.PipelineConfig;
import com.flamingo.ai.talkpdf.config.PipelineConfig.PlanLimits;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Tries speech providers one at a time in configured order and keeps the first plausible audio.
 *
 * <p>Providers that are not configured or do not support the language are skipped silently. Every
 * provider that is attempted and fails is reported as {@code "<name> (<reason>)"}. Running out of
 * providers is not an error: the result simply carries no audio.
 */
@Service
@Slf4j
public class TtsFallbackEngine {

  static final String CIRCUIT_OPEN = "circuit open";

  private final List<TtsProvider> orderedProviders;
  private final PipelineConfig pipelineConfig;
  private final MeterRegistry meterRegistry;

  public TtsFallbackEngine(
      List<TtsProvider> providers, PipelineConfig pipelineConfig, MeterRegistry meterRegistry) {
    this.pipelineConfig = pipelineConfig;
    this.meterRegistry = meterRegistry;
    this.orderedProviders = order(providers, pipelineConfig.getTts().getProviderOrder());
    log.info(
        "TTS provider order: {}",
        orderedProviders.stream().map(TtsProvider::name).collect(Collectors.toList()));
  }

  /**
   * Synthesizes the prepared script.
   *
   * @param script whitespace-normalized text already capped to the plan's character budget
   * @param language requested audio language
   * @param limits plan limits, for the chunk budget
   */
  @Timed(value = "pipeline.synthesis", description = "Time to synthesize speech")
  public SynthesisResult synthesize(String script, String language, PlanLimits limits) {
    List<String> failedProviders = new ArrayList<>();
    if (script == null || script.isBlank()) {
      log.warn("Nothing to synthesize");
      return SynthesisResult.none(failedProviders);
    }

    for (TtsProvider provider : orderedProviders) {
      if (!provider.isConfigured()) {
        log.debug("Skipping unconfigured provider {}", provider.name());
        continue;
      }
      if (!provider.supportsLanguage(language)) {
        log.debug("Skipping provider {}: language {} unsupported", provider.name(), language);
        continue;
      }

      String voice = provider.voiceFor(language);
      String reason;
      try {
        List<byte[]> buffers = attempt(provider, script, language, voice, limits);
        byte[] audio = buffers.size() == 1 ? buffers.get(0) : AudioBuffers.concatenate(buffers);
        meterRegistry.counter("tts.provider.success", "provider", provider.name()).increment();
        log.info(
            "{} produced {} bytes in {} chunk(s) with voice {}",
            provider.name(),
            audio.length,
            buffers.size(),
            voice);
        return new SynthesisResult(
            audio,
            provider.container(),
            provider.name(),
            voice,
            buffers.size(),
            List.copyOf(failedProviders));
      } catch (TtsProviderException e) {
        reason = e.getReason();
      } catch (CallNotPermittedException e) {
        reason = CIRCUIT_OPEN;
      } catch (RuntimeException e) {
        log.warn("{} failed unexpectedly: {}", provider.name(), e.getMessage());
        reason = TtsProviderException.ERROR;
      }

      failedProviders.add(provider.name() + " (" + reason + ")");
      meterRegistry
          .counter("tts.provider.failure", "provider", provider.name(), "reason", reason)
          .increment();
      log.warn("TTS provider {} failed: {}", provider.name(), reason);
    }

    log.warn("All TTS providers exhausted: {}", failedProviders);
    return SynthesisResult.none(failedProviders);
  }

  private List<byte[]> attempt(
      TtsProvider provider, String script, String language, String voice, PlanLimits limits) {
    List<String> requests;
    if (provider.chunked()) {
      List<String> chunks = TextChunker.chunk(script, provider.maxRequestChars());
      requests = chunks.subList(0, Math.min(chunks.size(), Math.max(1, limits.getMaxTtsChunks())));
      log.debug(
          "{}: synthesizing {} of {} chunks", provider.name(), requests.size(), chunks.size());
    } else {
      requests = List.of(truncate(script, provider.maxRequestChars()));
    }

    int minAudioBytes = pipelineConfig.getTts().getMinAudioBytes();
    List<byte[]> buffers = new ArrayList<>(requests.size());
    for (String request : requests) {
      byte[] audio = provider.synthesize(request, language, voice);
      if (audio == null || audio.length <= minAudioBytes) {
        throw new TtsProviderException(
            TtsProviderException.TOO_SMALL,
            provider.name() + " returned " + (audio == null ? 0 : audio.length) + " bytes");
      }
      buffers.add(audio);
    }
    return buffers;
  }

  private static String truncate(String text, int maxChars) {
    return text.length() > maxChars ? text.substring(0, maxChars) : text;
  }

  private static List<TtsProvider> order(List<TtsProvider> providers, List<String> providerOrder) {
    Map<String, TtsProvider> byName =
        providers.stream().collect(Collectors.toMap(TtsProvider::name, Function.identity()));
    List<TtsProvider> ordered = new ArrayList<>();
    for (String name : providerOrder) {
      TtsProvider provider = byName.get(name);
      if (provider == null) {
        log.warn("Unknown TTS provider in order: {}", name);
        continue;
      }
      ordered.add(provider);
    }
    return List.copyOf(ordered);
  }
}
