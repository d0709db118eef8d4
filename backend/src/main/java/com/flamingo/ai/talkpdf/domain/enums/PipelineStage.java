package com.flamingo.ai.talkpdf.domain.enums;

/** Stages a background pipeline run passes through, in order. */
public enum PipelineStage {
  ADMITTED,
  EXTRACTING,
  SUMMARIZING,
  TRANSLATING,
  SYNTHESIZING,
  PERSISTING,
  READY,
  ERROR
}
