package com.flamingo.ai.talkpdf.domain.converter;

import com.fasterxml.jackson.core.type.TypeReference;
import com.flamingo.ai.talkpdf.domain.model.TtsMetadata;
import jakarta.persistence.Converter;

/** Stores {@link TtsMetadata} as a snake_case JSON object. */
@Converter
public class TtsMetadataConverter extends JsonAttributeConverter<TtsMetadata> {

  public TtsMetadataConverter() {
    super(new TypeReference<>() {});
  }

  @Override
  protected TtsMetadata emptyValue() {
    return null;
  }
}
