package com.flamingo.ai.talkpdf.domain.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/** Defines the processing status of a submitted document. */
public enum DocumentStatus {
  /** Document has been uploaded but never processed. */
  UPLOADED("uploaded"),

  /** A pipeline run is in flight (extraction, summarization, speech). */
  PROCESSING("processing"),

  /** Summary and study prompts are available; audio may be absent. */
  READY("ready"),

  /** The last pipeline run failed. */
  ERROR("error");

  private final String value;

  DocumentStatus(String value) {
    this.value = value;
  }

  @JsonValue
  public String getValue() {
    return value;
  }
}
