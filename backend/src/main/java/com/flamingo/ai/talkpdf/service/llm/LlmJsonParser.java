package com.flamingo.ai.talkpdf.service.llm;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.Optional;
import java.util.regex.Pattern;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Lenient reader for JSON objects embedded in model output.
 *
 * <p>Strips markdown code fences, locates the first balanced {@code {...}} block and parses it.
 * Anything that does not yield a JSON object returns empty.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class LlmJsonParser {

  private static final Pattern CODE_FENCE = Pattern.compile("```(?:json|JSON)?");

  private final ObjectMapper objectMapper;

  /** Parses the first JSON object found in {@code raw}. */
  public Optional<JsonNode> parseObject(String raw) {
    if (raw == null || raw.isBlank()) {
      return Optional.empty();
    }
    String cleaned = CODE_FENCE.matcher(raw).replaceAll("").trim();
    String candidate = firstObject(cleaned);
    if (candidate == null) {
      log.debug("No JSON object found in model output ({} chars)", raw.length());
      return Optional.empty();
    }
    try {
      JsonNode node = objectMapper.readTree(candidate);
      return node != null && node.isObject() ? Optional.of(node) : Optional.empty();
    } catch (JsonProcessingException e) {
      log.debug("Model output is not valid JSON: {}", e.getOriginalMessage());
      return Optional.empty();
    }
  }

  /** Text value of a field, or empty when missing, null or not textual. */
  public static Optional<String> text(JsonNode node, String field) {
    JsonNode value = node.get(field);
    if (value == null || !value.isTextual()) {
      return Optional.empty();
    }
    return Optional.of(value.asText());
  }

  private static String firstObject(String text) {
    int start = text.indexOf('{');
    if (start < 0) {
      return null;
    }
    int depth = 0;
    boolean inString = false;
    boolean escaped = false;
    for (int i = start; i < text.length(); i++) {
      char c = text.charAt(i);
      if (inString) {
        if (escaped) {
          escaped = false;
        } else if (c == '\\') {
          escaped = true;
        } else if (c == '"') {
          inString = false;
        }
        continue;
      }
      if (c == '"') {
        inString = true;
      } else if (c == '{') {
        depth++;
      } else if (c == '}') {
        depth--;
        if (depth == 0) {
          return text.substring(start, i + 1);
        }
      }
    }
    // Unbalanced: fall back to the widest brace span
    int end = text.lastIndexOf('}');
    return end > start ? text.substring(start, end + 1) : null;
  }
}
