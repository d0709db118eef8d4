package com.flamingo.ai.talkpdf.domain.converter;

import com.fasterxml.jackson.core.type.TypeReference;
import jakarta.persistence.Converter;
import java.util.Collections;
import java.util.Map;

/** Stores free-form usage metadata as a JSON object. */
@Converter
public class MetadataMapConverter extends JsonAttributeConverter<Map<String, Object>> {

  public MetadataMapConverter() {
    super(new TypeReference<>() {});
  }

  @Override
  protected Map<String, Object> emptyValue() {
    return Collections.emptyMap();
  }

  @Override
  protected boolean isEmpty(Map<String, Object> attribute) {
    return attribute == null || attribute.isEmpty();
  }
}
