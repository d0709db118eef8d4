package com.flamingo.ai.talkpdf.domain.converter;

import com.fasterxml.jackson.core.type.TypeReference;
import com.flamingo.ai.talkpdf.domain.model.StudyPrompt;
import jakarta.persistence.Converter;
import java.util.Collections;
import java.util.List;

/** Stores {@code List<StudyPrompt>} as a JSON array. */
@Converter
public class StudyPromptListConverter extends JsonAttributeConverter<List<StudyPrompt>> {

  public StudyPromptListConverter() {
    super(new TypeReference<>() {});
  }

  @Override
  protected List<StudyPrompt> emptyValue() {
    return Collections.emptyList();
  }

  @Override
  protected boolean isEmpty(List<StudyPrompt> attribute) {
    return attribute == null || attribute.isEmpty();
  }
}
