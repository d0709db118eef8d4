package com.flamingo.ai.talkpdf.domain.model;

/** A question generated from the document for self-testing. */
public record StudyPrompt(String topic, String prompt) {}
