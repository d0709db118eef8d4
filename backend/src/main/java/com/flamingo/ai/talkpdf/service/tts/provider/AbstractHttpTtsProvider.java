package com.flamingo.ai.talkpdf.service.tts.provider;

import com.flamingo.ai.talkpdf.config.PipelineConfig;
import com.flamingo.ai.talkpdf.domain.enums.AudioContainer;
import com.flamingo.ai.talkpdf.service.tts.TtsProvider;
import com.flamingo.ai.talkpdf.service.tts.TtsProviderException;
import java.time.Duration;
import java.util.function.Supplier;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;

/**
 * Base for providers reached over HTTP with {@link WebClient}.
 *
 * <p>Maps transport outcomes to {@link TtsProviderException} reasons: the HTTP status code for error
 * responses and {@code error} for everything else.
 */
@Slf4j
public abstract class AbstractHttpTtsProvider implements TtsProvider {

  private final String name;
  private final AudioContainer container;
  private final boolean chunked;
  protected final PipelineConfig.Provider settings;
  protected final WebClient webClient;
  protected final Duration timeout;

  protected AbstractHttpTtsProvider(
      String name,
      AudioContainer container,
      boolean chunked,
      PipelineConfig.Provider settings,
      WebClient.Builder webClientBuilder) {
    this.name = name;
    this.container = container;
    this.chunked = chunked;
    this.settings = settings;
    this.timeout = Duration.ofSeconds(settings.getTimeoutSeconds());

    WebClient.Builder builder =
        webClientBuilder
            .clone()
            .codecs(configurer -> configurer.defaultCodecs().maxInMemorySize(32 * 1024 * 1024));
    if (hasText(settings.getBaseUrl())) {
      builder.baseUrl(settings.getBaseUrl());
    }
    this.webClient = builder.build();
    log.info("TTS provider {} initialized: configured={}", name, isConfigured());
  }

  @Override
  public String name() {
    return name;
  }

  @Override
  public boolean isConfigured() {
    return settings.isEnabled() && hasText(settings.getBaseUrl()) && hasText(settings.getApiKey());
  }

  @Override
  public boolean supportsLanguage(String language) {
    return settings.getLanguages().isEmpty() || settings.getLanguages().contains(language);
  }

  @Override
  public String voiceFor(String language) {
    return settings.getVoices().getOrDefault(language, settings.getDefaultVoice());
  }

  @Override
  public int maxRequestChars() {
    return settings.getMaxRequestChars();
  }

  @Override
  public boolean chunked() {
    return chunked;
  }

  @Override
  public AudioContainer container() {
    return container;
  }

  /** Runs one HTTP call and normalizes its failures. */
  protected byte[] execute(Supplier<byte[]> call) {
    try {
      byte[] audio = call.get();
      if (audio == null) {
        throw new TtsProviderException(TtsProviderException.ERROR, name + " returned no body");
      }
      return audio;
    } catch (TtsProviderException e) {
      throw e;
    } catch (WebClientResponseException e) {
      String status = String.valueOf(e.getStatusCode().value());
      log.warn("{} responded {}: {}", name, status, abbreviate(e.getResponseBodyAsString()));
      throw new TtsProviderException(status, name + " responded " + status, e);
    } catch (RuntimeException e) {
      log.warn("{} request failed: {}", name, e.getMessage());
      throw new TtsProviderException(TtsProviderException.ERROR, name + " request failed", e);
    }
  }

  private static String abbreviate(String body) {
    if (body == null) {
      return "";
    }
    return body.length() > 200 ? body.substring(0, 200) : body;
  }

  private static boolean hasText(String value) {
    return value != null && !value.isBlank();
  }
}
