package com.flamingo.ai.talkpdf.service.summary;

import com.fasterxml.jackson.databind.JsonNode;
import com.flamingo.ai.talkpdf.config.PipelineConfig;
import com.flamingo.ai.talkpdf.config.PipelineConfig.PlanLimits;
import com.flamingo.ai.talkpdf.domain.model.StudyPrompt;
import com.flamingo.ai.talkpdf.service.llm.LlmJsonParser;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.input.PromptTemplate;
import io.micrometer.core.annotation.Timed;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Produces the study summary and prompts in a single model call, degrading to a text excerpt when
 * the model fails. Word counts, prompt counts and the output token budget follow the owner's plan.
 */
@Service
@Slf4j
public class DocumentAnalysisService {

  static final PromptTemplate SYSTEM_TEMPLATE =
      PromptTemplate.from(
          """
          You are an expert study assistant. Analyze the provided document text and return a JSON
          object with two fields:

          1. "summary": A {{minWords}}-{{maxWords}} word summary written for listening. Cover the
             whole document from beginning to end, not only the opening pages. Use only facts
             stated in the text. Do not invent names, numbers or claims. Write in flowing prose
             without markdown, headers or bullet points.

          2. "study_prompts": An array of {{minPrompts}}-{{maxPrompts}} objects, each with a
             "topic" (a short phrase) and a "prompt" (a question that tests understanding of that
             topic, answerable from the text).

          Return ONLY valid JSON matching this structure:
          {"summary": "...", "study_prompts": [{"topic": "...", "prompt": "..."}]}
          """);

  static final PromptTemplate USER_TEMPLATE =
      PromptTemplate.from(
          """
          Document: {{fileName}}

          Content:
          {{content}}
          """);

  private final ChatModel chatModel;
  private final LlmJsonParser jsonParser;
  private final PipelineConfig pipelineConfig;

  public DocumentAnalysisService(
      @Qualifier("chatModel") ChatModel chatModel,
      LlmJsonParser jsonParser,
      PipelineConfig pipelineConfig) {
    this.chatModel = chatModel;
    this.jsonParser = jsonParser;
    this.pipelineConfig = pipelineConfig;
  }

  /**
   * Analyzes extracted text within the plan's budget.
   *
   * @param fileName document name shown to the model
   * @param extractedText full extracted text, at least the extraction minimum long
   * @param limits the owner's plan limits
   */
  @Timed(value = "pipeline.analysis", description = "Time to summarize document")
  public DocumentAnalysis analyze(String fileName, String extractedText, PlanLimits limits) {
    String truncated = truncate(extractedText, limits.getAnalysisChars());

    try {
      log.debug(
          "Analyzing '{}' (input {} chars, truncated to {})",
          fileName,
          extractedText.length(),
          truncated.length());
      String raw = chatModel.chat(buildRequest(fileName, truncated, limits)).aiMessage().text();

      Optional<DocumentAnalysis> parsed =
          jsonParser.parseObject(raw).flatMap(node -> toAnalysis(node, limits));
      if (parsed.isPresent()) {
        log.debug(
            "Analysis complete for '{}': {} char summary, {} prompts",
            fileName,
            parsed.get().summary().length(),
            parsed.get().studyPrompts().size());
        return parsed.get();
      }
      log.warn("Unusable analysis output for '{}', falling back to text excerpt", fileName);
    } catch (Exception e) {
      log.warn("Analysis call failed for '{}': {}", fileName, e.getMessage());
    }
    return fallback(extractedText);
  }

  private static ChatRequest buildRequest(String fileName, String content, PlanLimits limits) {
    String instructions =
        SYSTEM_TEMPLATE
            .apply(
                Map.of(
                    "minWords", limits.getSummaryMinWords(),
                    "maxWords", limits.getSummaryMaxWords(),
                    "minPrompts", limits.getMinStudyPrompts(),
                    "maxPrompts", limits.getMaxStudyPrompts()))
            .text();
    String userText =
        USER_TEMPLATE.apply(Map.of("fileName", fileName, "content", content)).text();

    return ChatRequest.builder()
        .messages(SystemMessage.from(instructions), UserMessage.from(userText))
        .maxOutputTokens(limits.getMaxTokens())
        .build();
  }

  private Optional<DocumentAnalysis> toAnalysis(JsonNode node, PlanLimits limits) {
    Optional<String> summary =
        LlmJsonParser.text(node, "summary")
            .map(String::trim)
            .filter(s -> s.length() >= pipelineConfig.getAnalysis().getMinSummaryChars());
    if (summary.isEmpty()) {
      return Optional.empty();
    }

    List<StudyPrompt> prompts = new ArrayList<>();
    JsonNode promptsNode = node.get("study_prompts");
    if (promptsNode != null && promptsNode.isArray()) {
      for (JsonNode item : promptsNode) {
        if (prompts.size() >= limits.getMaxStudyPrompts()) {
          break;
        }
        Optional<String> topic = LlmJsonParser.text(item, "topic").filter(t -> !t.isBlank());
        Optional<String> prompt = LlmJsonParser.text(item, "prompt").filter(p -> !p.isBlank());
        if (topic.isPresent() && prompt.isPresent()) {
          prompts.add(new StudyPrompt(topic.get().trim(), prompt.get().trim()));
        }
      }
    }
    return Optional.of(new DocumentAnalysis(summary.get(), prompts, false));
  }

  private DocumentAnalysis fallback(String extractedText) {
    String excerpt = truncate(extractedText.trim(), pipelineConfig.getAnalysis().getFallbackChars());
    return new DocumentAnalysis(excerpt, List.of(), true);
  }

  private static String truncate(String text, int maxChars) {
    return text.length() > maxChars ? text.substring(0, maxChars) : text;
  }
}
