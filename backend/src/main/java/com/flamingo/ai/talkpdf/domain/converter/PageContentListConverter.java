package com.flamingo.ai.talkpdf.domain.converter;

import com.fasterxml.jackson.core.type.TypeReference;
import com.flamingo.ai.talkpdf.domain.model.PageContent;
import jakarta.persistence.Converter;
import java.util.Collections;
import java.util.List;

/** Stores {@code List<PageContent>} as a JSON array. */
@Converter
public class PageContentListConverter extends JsonAttributeConverter<List<PageContent>> {

  public PageContentListConverter() {
    super(new TypeReference<>() {});
  }

  @Override
  protected List<PageContent> emptyValue() {
    return Collections.emptyList();
  }

  @Override
  protected boolean isEmpty(List<PageContent> attribute) {
    return attribute == null || attribute.isEmpty();
  }
}
