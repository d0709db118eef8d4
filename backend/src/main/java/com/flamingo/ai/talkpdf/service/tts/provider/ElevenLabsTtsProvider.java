package com.flamingo.ai.talkpdf.service.tts.provider;

import com.flamingo.ai.talkpdf.config.PipelineConfig;
import com.flamingo.ai.talkpdf.domain.enums.AudioContainer;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import java.util.Map;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

/** ElevenLabs multilingual speech, used for languages outside the local set. */
@Component
public class ElevenLabsTtsProvider extends AbstractHttpTtsProvider {

  public static final String NAME = "elevenlabs";

  public ElevenLabsTtsProvider(PipelineConfig pipelineConfig, WebClient.Builder webClientBuilder) {
    super(
        NAME, AudioContainer.MP3, false, pipelineConfig.getTts().getElevenlabs(), webClientBuilder);
  }

  @Override
  @CircuitBreaker(name = NAME)
  public byte[] synthesize(String text, String language, String voice) {
    Map<String, Object> body =
        Map.of(
            "text", text,
            "model_id", settings.getModel(),
            "voice_settings", Map.of("stability", 0.5, "similarity_boost", 0.75));

    return execute(
        () ->
            webClient
                .post()
                .uri(
                    uriBuilder ->
                        uriBuilder
                            .path("/v1/text-to-speech/{voice}")
                            .queryParam("output_format", settings.getOutputFormat())
                            .build(voice))
                .header("xi-api-key", settings.getApiKey())
                .contentType(MediaType.APPLICATION_JSON)
                .accept(MediaType.parseMediaType("audio/mpeg"))
                .bodyValue(body)
                .retrieve()
                .bodyToMono(byte[].class)
                .timeout(timeout)
                .block());
  }
}
