package com.flamingo.ai.talkpdf.domain.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/** Billable actions recorded as usage events. */
public enum UsageActionType {
  PDF_UPLOAD("pdf_upload"),
  AUDIO_CONVERSION("audio_conversion"),
  EXPLAIN_BACK("explain_back"),
  AI_QUESTION("ai_question");

  private final String value;

  UsageActionType(String value) {
    this.value = value;
  }

  @JsonValue
  public String getValue() {
    return value;
  }
}
