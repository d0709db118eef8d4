package com.flamingo.ai.talkpdf.service.tts.provider;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.flamingo.ai.talkpdf.config.PipelineConfig;
import com.flamingo.ai.talkpdf.service.tts.TtsProviderException;
import com.flamingo.ai.talkpdf.service.tts.WavEncoder;
import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

class GeminiTtsProviderTest {

  private PipelineConfig pipelineConfig;
  private final AtomicReference<ClientRequest> lastRequest = new AtomicReference<>();

  @BeforeEach
  void setUp() {
    pipelineConfig = new PipelineConfig();
    PipelineConfig.Provider settings = pipelineConfig.getTts().getGemini();
    settings.setBaseUrl("http://gemini.test");
    settings.setApiKey("g-key");
    settings.setModel("tts-model");
  }

  @Test
  @DisplayName("Inline PCM is wrapped in a WAV header")
  void shouldWrapPcmAsWav() {
    byte[] pcm = new byte[3000];
    String json =
        "{\"candidates\":[{\"content\":{\"parts\":[{\"inlineData\":{\"mimeType\":\"audio/L16\","
            + "\"data\":\""
            + Base64.getEncoder().encodeToString(pcm)
            + "\"}}]}}]}";
    GeminiTtsProvider provider = provider(HttpStatus.OK, json);

    byte[] wav = provider.synthesize("Hello there", "en", "Kore");

    assertThat(wav).hasSize(WavEncoder.HEADER_SIZE + pcm.length);
    assertThat(new String(wav, 0, 4, StandardCharsets.US_ASCII)).isEqualTo("RIFF");
    assertThat(lastRequest.get().url().toString())
        .isEqualTo("http://gemini.test/v1beta/models/tts-model:generateContent");
    assertThat(lastRequest.get().headers().getFirst("x-goog-api-key")).isEqualTo("g-key");
  }

  @Test
  void shouldFail_whenResponseHasNoAudio() {
    GeminiTtsProvider provider = provider(HttpStatus.OK, "{\"candidates\":[]}");

    assertThatThrownBy(() -> provider.synthesize("Hello", "en", "Kore"))
        .isInstanceOf(TtsProviderException.class)
        .extracting(e -> ((TtsProviderException) e).getReason())
        .isEqualTo("no audio");
  }

  @Test
  void shouldReportStatusCode_whenRateLimited() {
    GeminiTtsProvider provider = provider(HttpStatus.TOO_MANY_REQUESTS, "{}");

    assertThatThrownBy(() -> provider.synthesize("Hello", "en", "Kore"))
        .isInstanceOf(TtsProviderException.class)
        .extracting(e -> ((TtsProviderException) e).getReason())
        .isEqualTo("429");
  }

  private GeminiTtsProvider provider(HttpStatus status, String json) {
    WebClient.Builder builder =
        WebClient.builder()
            .exchangeFunction(
                request -> {
                  lastRequest.set(request);
                  return Mono.just(
                      ClientResponse.create(status)
                          .header("Content-Type", "application/json")
                          .body(json)
                          .build());
                });
    return new GeminiTtsProvider(pipelineConfig, builder);
  }
}
