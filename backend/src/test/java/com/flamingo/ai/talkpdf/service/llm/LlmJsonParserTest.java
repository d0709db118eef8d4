package com.flamingo.ai.talkpdf.service.llm;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class LlmJsonParserTest {

  private final LlmJsonParser parser = new LlmJsonParser(new ObjectMapper());

  @Test
  void shouldParsePlainObject() {
    Optional<JsonNode> node = parser.parseObject("{\"summary\": \"text\"}");

    assertThat(node).isPresent();
    assertThat(node.get().get("summary").asText()).isEqualTo("text");
  }

  @Test
  void shouldStripCodeFences() {
    String raw = "```json\n{\"summary\": \"fenced\"}\n```";

    assertThat(parser.parseObject(raw))
        .get()
        .extracting(n -> n.get("summary").asText())
        .isEqualTo("fenced");
  }

  @Test
  void shouldFindObjectInsideProse() {
    String raw = "Here is the result: {\"a\": {\"b\": \"}\"}} and some trailing words {ignored}";

    Optional<JsonNode> node = parser.parseObject(raw);

    assertThat(node).isPresent();
    assertThat(node.get().path("a").path("b").asText()).isEqualTo("}");
  }

  @Test
  void shouldReturnEmptyForInvalidOrMissingJson() {
    assertThat(parser.parseObject("no json here")).isEmpty();
    assertThat(parser.parseObject("{not: valid")).isEmpty();
    assertThat(parser.parseObject("")).isEmpty();
    assertThat(parser.parseObject(null)).isEmpty();
  }

  @Test
  void shouldReadTextFieldsOnly() throws Exception {
    JsonNode node = new ObjectMapper().readTree("{\"s\": \"v\", \"n\": 3, \"z\": null}");

    assertThat(LlmJsonParser.text(node, "s")).contains("v");
    assertThat(LlmJsonParser.text(node, "n")).isEmpty();
    assertThat(LlmJsonParser.text(node, "z")).isEmpty();
    assertThat(LlmJsonParser.text(node, "missing")).isEmpty();
  }
}
