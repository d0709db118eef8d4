package com.flamingo.ai.talkpdf.service.llm;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.google.common.annotations.VisibleForTesting;
import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.Content;
import dev.langchain4j.data.message.PdfFileContent;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.TextContent;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.data.pdf.PdfFile;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.request.ResponseFormat;
import dev.langchain4j.model.chat.request.ResponseFormatType;
import dev.langchain4j.model.chat.response.ChatResponse;
import dev.langchain4j.model.output.TokenUsage;
import java.time.Duration;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;

/**
 * {@link ChatModel} for an OpenAI-compatible chat completions endpoint that accepts document files.
 *
 * <p>User messages are sent as content parts. {@link TextContent} becomes a {@code text} part and
 * {@link PdfFileContent} a {@code file} part carrying a base64 data URL. Any other content is
 * rejected before a request is made.
 */
@Slf4j
public class OpenAiDocumentChatModel implements ChatModel {

  private final WebClient webClient;
  private final ObjectMapper objectMapper;
  private final String apiKey;
  private final String modelName;
  private final Duration timeout;

  public OpenAiDocumentChatModel(
      WebClient.Builder webClientBuilder,
      ObjectMapper objectMapper,
      String baseUrl,
      String apiKey,
      String modelName,
      Duration timeout) {
    this.webClient =
        webClientBuilder
            .clone()
            .baseUrl(baseUrl)
            .codecs(configurer -> configurer.defaultCodecs().maxInMemorySize(64 * 1024 * 1024))
            .build();
    this.objectMapper = objectMapper;
    this.apiKey = apiKey;
    this.modelName = modelName;
    this.timeout = timeout;
  }

  @Override
  public ChatResponse doChat(ChatRequest chatRequest) {
    ObjectNode body = toRequestBody(chatRequest);

    JsonNode response;
    try {
      response =
          webClient
              .post()
              .uri("/chat/completions")
              .header(HttpHeaders.AUTHORIZATION, "Bearer " + apiKey)
              .contentType(MediaType.APPLICATION_JSON)
              .bodyValue(body)
              .retrieve()
              .bodyToMono(JsonNode.class)
              .timeout(timeout)
              .block();
    } catch (WebClientResponseException e) {
      log.warn(
          "Chat completion responded {}: {}",
          e.getStatusCode().value(),
          abbreviate(e.getResponseBodyAsString()));
      throw e;
    }
    return toChatResponse(response);
  }

  @VisibleForTesting
  ObjectNode toRequestBody(ChatRequest chatRequest) {
    ObjectNode body = objectMapper.createObjectNode();
    body.put("model", modelName);

    ArrayNode messages = body.putArray("messages");
    for (ChatMessage message : chatRequest.messages()) {
      messages.add(toMessage(message));
    }

    if (chatRequest.temperature() != null) {
      body.put("temperature", chatRequest.temperature());
    }
    if (chatRequest.maxOutputTokens() != null) {
      body.put("max_completion_tokens", chatRequest.maxOutputTokens());
    }
    ResponseFormat responseFormat = chatRequest.responseFormat();
    if (responseFormat != null && responseFormat.type() == ResponseFormatType.JSON) {
      body.putObject("response_format").put("type", "json_object");
    }
    return body;
  }

  private ObjectNode toMessage(ChatMessage message) {
    ObjectNode node = objectMapper.createObjectNode();
    if (message instanceof SystemMessage systemMessage) {
      node.put("role", "system").put("content", systemMessage.text());
    } else if (message instanceof AiMessage aiMessage) {
      node.put("role", "assistant").put("content", aiMessage.text());
    } else if (message instanceof UserMessage userMessage) {
      node.put("role", "user");
      ArrayNode parts = node.putArray("content");
      for (Content content : userMessage.contents()) {
        parts.add(toPart(content));
      }
    } else {
      throw new IllegalArgumentException("Unsupported message type: " + message.type());
    }
    return node;
  }

  private ObjectNode toPart(Content content) {
    ObjectNode part = objectMapper.createObjectNode();
    if (content instanceof TextContent textContent) {
      part.put("type", "text").put("text", textContent.text());
    } else if (content instanceof PdfFileContent fileContent) {
      PdfFile file = fileContent.pdfFile();
      part.put("type", "file")
          .putObject("file")
          .put("filename", fileNameFor(file.mimeType()))
          .put("file_data", "data:" + file.mimeType() + ";base64," + file.base64Data());
    } else {
      throw new IllegalArgumentException("Unsupported content type: " + content.type());
    }
    return part;
  }

  private static ChatResponse toChatResponse(JsonNode response) {
    if (response == null) {
      throw new IllegalStateException("Chat completion returned no body");
    }
    String text = response.path("choices").path(0).path("message").path("content").asText("");
    if (text.isBlank()) {
      throw new IllegalStateException("Chat completion returned no content");
    }

    ChatResponse.Builder builder = ChatResponse.builder().aiMessage(AiMessage.from(text));
    JsonNode usage = response.path("usage");
    if (usage.isObject()) {
      builder.tokenUsage(
          new TokenUsage(
              usage.path("prompt_tokens").asInt(), usage.path("completion_tokens").asInt()));
    }
    return builder.build();
  }

  static String fileNameFor(String mimeType) {
    if ("application/msword".equals(mimeType)) {
      return "document.doc";
    }
    if (mimeType != null && mimeType.contains("wordprocessingml")) {
      return "document.docx";
    }
    return "document.pdf";
  }

  private static String abbreviate(String body) {
    if (body == null) {
      return "";
    }
    return body.length() > 200 ? body.substring(0, 200) : body;
  }
}
