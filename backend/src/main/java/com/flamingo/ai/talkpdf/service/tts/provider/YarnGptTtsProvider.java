package com.flamingo.ai.talkpdf.service.tts.provider;

import com.flamingo.ai.talkpdf.config.PipelineConfig;
import com.flamingo.ai.talkpdf.domain.enums.AudioContainer;
import com.flamingo.ai.talkpdf.service.tts.TtsProviderException;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import java.util.Map;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

/** YarnGPT speech for Nigerian languages. Returns MP3 per request; scripts are sent in chunks. */
@Component
public class YarnGptTtsProvider extends AbstractHttpTtsProvider {

  public static final String NAME = "yarngpt";

  public YarnGptTtsProvider(PipelineConfig pipelineConfig, WebClient.Builder webClientBuilder) {
    super(NAME, AudioContainer.MP3, true, pipelineConfig.getTts().getYarngpt(), webClientBuilder);
  }

  @Override
  @CircuitBreaker(name = NAME)
  public byte[] synthesize(String text, String language, String voice) {
    return execute(
        () -> {
          ResponseEntity<byte[]> response =
              webClient
                  .post()
                  .uri("/api/v1/tts")
                  .header(HttpHeaders.AUTHORIZATION, "Bearer " + settings.getApiKey())
                  .contentType(MediaType.APPLICATION_JSON)
                  .bodyValue(Map.of("text", text, "voice", voice, "response_format", "mp3"))
                  .retrieve()
                  .toEntity(byte[].class)
                  .timeout(timeout)
                  .block();

          if (response == null) {
            return null;
          }
          MediaType contentType = response.getHeaders().getContentType();
          if (!isAudio(contentType)) {
            throw new TtsProviderException(
                "unexpected content", "yarngpt returned content type " + contentType);
          }
          return response.getBody();
        });
  }

  private static boolean isAudio(MediaType contentType) {
    if (contentType == null) {
      return false;
    }
    String value = contentType.toString();
    return "audio".equals(contentType.getType())
        || value.contains("mpeg")
        || value.contains("mp3")
        || value.contains("octet-stream");
  }
}
