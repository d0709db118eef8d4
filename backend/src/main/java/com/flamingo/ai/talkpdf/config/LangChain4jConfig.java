package com.flamingo.ai.talkpdf.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.talkpdf.service.llm.OpenAiDocumentChatModel;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.openai.OpenAiChatModel;
import java.time.Duration;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;
import org.springframework.web.reactive.function.client.WebClient;

/** Configuration for LangChain4j models behind the OpenAI-compatible gateway. */
@Configuration
public class LangChain4jConfig {

  @Value("${langchain4j.openai.api-key:}")
  private String openAiApiKey;

  @Value("${langchain4j.openai.base-url:https://api.openai.com/v1}")
  private String baseUrl;

  @Value("${langchain4j.openai.chat-model.model-name:gpt-4o-mini}")
  private String chatModelName;

  @Value("${langchain4j.openai.chat-model.max-completion-tokens:4000}")
  private int maxCompletionTokens;

  @Value("${langchain4j.openai.chat-model.timeout-seconds:120}")
  private int timeoutSeconds;

  /** JSON-mode model for analysis calls. Output budgets are set per request from the plan. */
  @Bean
  @Primary
  public ChatModel chatModel() {
    validateApiKey();

    return OpenAiChatModel.builder()
        .baseUrl(baseUrl)
        .apiKey(openAiApiKey)
        .modelName(chatModelName)
        .timeout(Duration.ofSeconds(timeoutSeconds))
        .responseFormat("json_object")
        .logRequests(false)
        .logResponses(false)
        .build();
  }

  /** Free-text model for translation. */
  @Bean
  public ChatModel textChatModel() {
    validateApiKey();

    return OpenAiChatModel.builder()
        .baseUrl(baseUrl)
        .apiKey(openAiApiKey)
        .modelName(chatModelName)
        .maxCompletionTokens(maxCompletionTokens)
        .timeout(Duration.ofSeconds(timeoutSeconds))
        .logRequests(false)
        .logResponses(false)
        .build();
  }

  /**
   * Model that receives the uploaded file itself. The OpenAI module only maps text, image and audio
   * content, so document files go through {@link OpenAiDocumentChatModel}.
   */
  @Bean
  public ChatModel documentChatModel(
      WebClient.Builder webClientBuilder, ObjectMapper objectMapper) {
    validateApiKey();

    return new OpenAiDocumentChatModel(
        webClientBuilder,
        objectMapper,
        baseUrl,
        openAiApiKey,
        chatModelName,
        Duration.ofSeconds(timeoutSeconds));
  }

  private void validateApiKey() {
    if (openAiApiKey == null || openAiApiKey.isBlank()) {
      throw new IllegalStateException(
          "OpenAI API key is required. Set OPENAI_API_KEY environment variable.");
    }
  }
}
