package com.flamingo.ai.talkpdf.service.tts.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.flamingo.ai.talkpdf.config.PipelineConfig;
import com.flamingo.ai.talkpdf.domain.enums.AudioContainer;
import com.flamingo.ai.talkpdf.service.tts.TtsProviderException;
import com.flamingo.ai.talkpdf.service.tts.WavEncoder;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import java.util.Base64;
import java.util.List;
import java.util.Map;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

/**
 * Gemini speech generation. The API returns base64 PCM (16-bit mono, 24 kHz) without a header, so
 * the payload is wrapped as WAV.
 */
@Component
public class GeminiTtsProvider extends AbstractHttpTtsProvider {

  public static final String NAME = "gemini";
  static final int SAMPLE_RATE = 24_000;

  public GeminiTtsProvider(PipelineConfig pipelineConfig, WebClient.Builder webClientBuilder) {
    super(NAME, AudioContainer.WAV, false, pipelineConfig.getTts().getGemini(), webClientBuilder);
  }

  @Override
  @CircuitBreaker(name = NAME)
  public byte[] synthesize(String text, String language, String voice) {
    Map<String, Object> body =
        Map.of(
            "contents", List.of(Map.of("parts", List.of(Map.of("text", text)))),
            "generationConfig",
                Map.of(
                    "responseModalities", List.of("AUDIO"),
                    "speechConfig",
                        Map.of(
                            "voiceConfig",
                            Map.of("prebuiltVoiceConfig", Map.of("voiceName", voice)))));

    return execute(
        () -> {
          JsonNode response =
              webClient
                  .post()
                  .uri("/v1beta/models/{model}:generateContent", settings.getModel())
                  .header("x-goog-api-key", settings.getApiKey())
                  .contentType(MediaType.APPLICATION_JSON)
                  .bodyValue(body)
                  .retrieve()
                  .bodyToMono(JsonNode.class)
                  .timeout(timeout)
                  .block();

          String data =
              response == null
                  ? ""
                  : response
                      .path("candidates")
                      .path(0)
                      .path("content")
                      .path("parts")
                      .path(0)
                      .path("inlineData")
                      .path("data")
                      .asText("");
          if (data.isEmpty()) {
            throw new TtsProviderException("no audio", "gemini response carried no audio data");
          }
          byte[] pcm = Base64.getDecoder().decode(data);
          return WavEncoder.wrapPcm16(pcm, SAMPLE_RATE, 1);
        });
  }
}
