package com.flamingo.ai.talkpdf.service.extraction;

import com.fasterxml.jackson.databind.JsonNode;
import com.flamingo.ai.talkpdf.config.PipelineConfig;
import com.flamingo.ai.talkpdf.config.PipelineConfig.PlanLimits;
import com.flamingo.ai.talkpdf.domain.model.PageContent;
import com.flamingo.ai.talkpdf.exception.DocumentProcessingException;
import com.flamingo.ai.talkpdf.service.llm.LlmJsonParser;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.PdfFileContent;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.TextContent;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.request.ResponseFormat;
import dev.langchain4j.model.chat.response.ChatResponse;
import io.micrometer.core.annotation.Timed;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.UUID;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Extracts verbatim text from a document by sending the file to a multimodal model.
 *
 * <p>Tiers with a page budget first ask for page-structured JSON. When that is unavailable or too
 * short, a plain full-text request is made. Either way fewer than the configured minimum characters
 * is a fatal outcome for the run.
 */
@Service
@Slf4j
public class DocumentTextExtractor {

  static final String PAGE_INSTRUCTIONS =
      """
        You are a precise document transcription engine. Extract the text of every page of the
        attached document exactly as written. Only transcribe text physically present on the page.
        Never invent, complete or correct text, and do not summarize, paraphrase, translate or add
        commentary. Preserve paragraph breaks. For a page without text output [BLANK PAGE]. For a
        page whose text cannot be read output [UNREADABLE].
        When a page starts or continues a chapter or section, record its heading as "chapter".

        Return ONLY valid JSON matching this structure:
        {"pages": [{"page": 1, "text": "...", "chapter": "..."}], "full_text": "..."}
        """;

  static final String TEXT_INSTRUCTIONS =
      """
        You are a precise document transcription engine. Extract all text from the attached
        document exactly as written, in reading order. Only output text physically present in the
        document. Do not invent text, summarize, paraphrase or add commentary. If the document
        cannot be read, output [UNREADABLE].
        """;

  private final ChatModel documentChatModel;
  private final LlmJsonParser jsonParser;
  private final PipelineConfig pipelineConfig;

  public DocumentTextExtractor(
      @Qualifier("documentChatModel") ChatModel documentChatModel,
      LlmJsonParser jsonParser,
      PipelineConfig pipelineConfig) {
    this.documentChatModel = documentChatModel;
    this.jsonParser = jsonParser;
    this.pipelineConfig = pipelineConfig;
  }

  /**
   * Extracts text from the given file.
   *
   * @param documentId document being processed, for logging and errors
   * @param fileName original file name, used to pick the content type
   * @param content raw file bytes
   * @param limits the owner's plan limits
   * @return extracted text with page structure when available
   * @throws DocumentProcessingException when no path yields enough text
   */
  @Timed(value = "pipeline.extraction", description = "Time to extract document text")
  public ExtractionResult extract(
      UUID documentId, String fileName, byte[] content, PlanLimits limits) {
    String base64 = Base64.getEncoder().encodeToString(content);
    String mimeType = mimeTypeOf(fileName);
    int minChars = pipelineConfig.getExtraction().getMinTextChars();

    if (limits.getMaxPages() > 0) {
      Optional<ExtractionResult> paged = extractPages(documentId, base64, mimeType, limits);
      if (paged.isPresent() && isSufficient(paged.get().text(), minChars)) {
        log.info(
            "Extracted {} pages ({} chars) from document {}",
            paged.get().pageCount(),
            paged.get().text().length(),
            documentId);
        return paged.get();
      }
      log.info("Page extraction insufficient for document {}, using plain extraction", documentId);
    }

    String text = extractPlainText(documentId, base64, mimeType);
    if (!isSufficient(text, minChars)) {
      throw new DocumentProcessingException(
          documentId,
          "Insufficient text extracted: " + (text == null ? 0 : text.trim().length()) + " chars",
          "Could not extract readable text from this document");
    }
    log.info("Extracted {} chars from document {}", text.length(), documentId);
    return new ExtractionResult(text.trim(), List.of(), null);
  }

  private Optional<ExtractionResult> extractPages(
      UUID documentId, String base64, String mimeType, PlanLimits limits) {
    String raw;
    try {
      raw =
          call(
              PAGE_INSTRUCTIONS,
              "Extract the text of each page of this document.",
              base64,
              mimeType,
              ResponseFormat.JSON);
    } catch (Exception e) {
      log.warn("Page extraction failed for document {}: {}", documentId, e.getMessage());
      return Optional.empty();
    }

    return jsonParser.parseObject(raw).flatMap(node -> toPagedResult(node, limits.getMaxPages()));
  }

  private Optional<ExtractionResult> toPagedResult(JsonNode node, int maxPages) {
    JsonNode pagesNode = node.get("pages");
    if (pagesNode == null || !pagesNode.isArray()) {
      return Optional.empty();
    }

    List<PageContent> pages = new ArrayList<>();
    for (JsonNode pageNode : pagesNode) {
      if (pages.size() >= maxPages) {
        break;
      }
      Optional<String> text = LlmJsonParser.text(pageNode, "text");
      if (text.isEmpty()) {
        continue;
      }
      int number = pageNode.path("page").asInt(pages.size() + 1);
      String chapter = LlmJsonParser.text(pageNode, "chapter").filter(c -> !c.isBlank()).orElse(null);
      pages.add(new PageContent(number, text.get(), chapter));
    }

    String fullText =
        LlmJsonParser.text(node, "full_text")
            .filter(t -> !t.isBlank())
            .orElseGet(
                () -> pages.stream().map(PageContent::text).collect(Collectors.joining("\n\n")));

    if (pages.isEmpty() && fullText.isBlank()) {
      return Optional.empty();
    }
    return Optional.of(new ExtractionResult(fullText.trim(), pages, pages.size()));
  }

  private String extractPlainText(UUID documentId, String base64, String mimeType) {
    try {
      return call(
          TEXT_INSTRUCTIONS, "Extract all text from this document.", base64, mimeType, null);
    } catch (Exception e) {
      throw new DocumentProcessingException(
          documentId, "Text extraction call failed: " + e.getMessage(), e);
    }
  }

  private String call(
      String instructions,
      String userText,
      String base64,
      String mimeType,
      ResponseFormat responseFormat) {
    List<ChatMessage> messages =
        List.of(
            SystemMessage.from(instructions),
            UserMessage.from(TextContent.from(userText), PdfFileContent.from(base64, mimeType)));

    ChatRequest request =
        ChatRequest.builder()
            .messages(messages)
            .temperature(pipelineConfig.getExtraction().getTemperature())
            .maxOutputTokens(pipelineConfig.getExtraction().getMaxOutputTokens())
            .responseFormat(responseFormat)
            .build();

    ChatResponse response = documentChatModel.chat(request);
    return response.aiMessage().text();
  }

  private static boolean isSufficient(String text, int minChars) {
    return text != null && text.trim().length() >= minChars;
  }

  static String mimeTypeOf(String fileName) {
    String name = fileName == null ? "" : fileName.toLowerCase(Locale.ROOT);
    if (name.endsWith(".docx")) {
      return "application/vnd.openxmlformats-officedocument.wordprocessingml.document";
    }
    if (name.endsWith(".doc")) {
      return "application/msword";
    }
    return "application/pdf";
  }
}
