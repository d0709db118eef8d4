package com.flamingo.ai.talkpdf.domain.converter;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import jakarta.persistence.AttributeConverter;
import lombok.extern.slf4j.Slf4j;

/**
 * Base JPA converter for persisting a structured value as JSON in a TEXT column.
 *
 * @param <T> the attribute type
 */
@Slf4j
public abstract class JsonAttributeConverter<T> implements AttributeConverter<T, String> {

  protected static final ObjectMapper MAPPER =
      new ObjectMapper()
          .registerModule(new JavaTimeModule())
          .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

  private final TypeReference<T> type;

  protected JsonAttributeConverter(TypeReference<T> type) {
    this.type = type;
  }

  /** Value used when the column is empty or unreadable. */
  protected abstract T emptyValue();

  /** Whether the attribute should be stored as SQL NULL. */
  protected boolean isEmpty(T attribute) {
    return attribute == null;
  }

  @Override
  public String convertToDatabaseColumn(T attribute) {
    if (isEmpty(attribute)) {
      return null;
    }
    try {
      return MAPPER.writeValueAsString(attribute);
    } catch (JsonProcessingException e) {
      log.error("Failed to serialize {}: {}", type.getType(), e.getMessage());
      return null;
    }
  }

  @Override
  public T convertToEntityAttribute(String dbData) {
    if (dbData == null || dbData.isBlank()) {
      return emptyValue();
    }
    try {
      return MAPPER.readValue(dbData, type);
    } catch (JsonProcessingException e) {
      log.error("Failed to deserialize {}: {}", type.getType(), e.getMessage());
      return emptyValue();
    }
  }
}
