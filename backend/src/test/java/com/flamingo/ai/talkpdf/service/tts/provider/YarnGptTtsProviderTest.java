package com.flamingo.ai.talkpdf.service.tts.provider;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.flamingo.ai.talkpdf.config.PipelineConfig;
import com.flamingo.ai.talkpdf.service.tts.TtsProviderException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.buffer.DefaultDataBufferFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

class YarnGptTtsProviderTest {

  private PipelineConfig pipelineConfig;
  private final List<ClientRequest> requests = new ArrayList<>();

  @BeforeEach
  void setUp() {
    pipelineConfig = new PipelineConfig();
    PipelineConfig.Provider settings = pipelineConfig.getTts().getYarngpt();
    settings.setBaseUrl("http://yarngpt.test");
    settings.setApiKey("secret");
    settings.setVoices(Map.of("yo", "Wura"));
    settings.setDefaultVoice("Idera");
  }

  @Test
  void shouldReturnAudioBytes_whenResponseIsAudio() {
    byte[] audio = new byte[4096];
    YarnGptTtsProvider provider = provider(respond(HttpStatus.OK, "audio/mpeg", audio));

    byte[] result = provider.synthesize("Bawo ni", "yo", "Wura");

    assertThat(result).hasSize(4096);
    ClientRequest request = requests.get(0);
    assertThat(request.url().toString()).isEqualTo("http://yarngpt.test/api/v1/tts");
    assertThat(request.headers().getFirst(HttpHeaders.AUTHORIZATION)).isEqualTo("Bearer secret");
  }

  @Test
  void shouldReportStatusCode_whenServerErrors() {
    YarnGptTtsProvider provider =
        provider(respond(HttpStatus.SERVICE_UNAVAILABLE, "text/plain", "busy".getBytes()));

    assertThatThrownBy(() -> provider.synthesize("text", "yo", "Wura"))
        .isInstanceOf(TtsProviderException.class)
        .extracting(e -> ((TtsProviderException) e).getReason())
        .isEqualTo("503");
  }

  @Test
  void shouldRejectNonAudioResponses() {
    YarnGptTtsProvider provider =
        provider(respond(HttpStatus.OK, "application/json", "{\"error\":1}".getBytes()));

    assertThatThrownBy(() -> provider.synthesize("text", "yo", "Wura"))
        .isInstanceOf(TtsProviderException.class)
        .extracting(e -> ((TtsProviderException) e).getReason())
        .isEqualTo("unexpected content");
  }

  @Test
  void shouldResolveVoicesAndConfiguration() {
    YarnGptTtsProvider provider = provider(respond(HttpStatus.OK, "audio/mpeg", new byte[0]));

    assertThat(provider.isConfigured()).isTrue();
    assertThat(provider.chunked()).isTrue();
    assertThat(provider.voiceFor("yo")).isEqualTo("Wura");
    assertThat(provider.voiceFor("ha")).isEqualTo("Idera");

    pipelineConfig.getTts().getYarngpt().setApiKey("");
    assertThat(provider.isConfigured()).isFalse();
  }

  private YarnGptTtsProvider provider(ClientResponse response) {
    WebClient.Builder builder =
        WebClient.builder()
            .exchangeFunction(
                request -> {
                  requests.add(request);
                  return Mono.just(response);
                });
    return new YarnGptTtsProvider(pipelineConfig, builder);
  }

  static ClientResponse respond(HttpStatus status, String contentType, byte[] body) {
    return ClientResponse.create(status)
        .header(HttpHeaders.CONTENT_TYPE, contentType)
        .body(Flux.just(DefaultDataBufferFactory.sharedInstance.wrap(body)))
        .build();
  }
}
