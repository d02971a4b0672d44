package com.flamingo.ai.embellisher.domain.converter;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.persistence.AttributeConverter;

/**
 * Base JPA converter that stores a value as a JSON string column.
 *
 * @param <T> attribute type
 */
public abstract class JsonAttributeConverter<T> implements AttributeConverter<T, String> {

  private static final ObjectMapper MAPPER = new ObjectMapper();

  private final TypeReference<T> typeReference;

  protected JsonAttributeConverter(TypeReference<T> typeReference) {
    this.typeReference = typeReference;
  }

  /** Value used when the column is null or empty. */
  protected abstract T emptyValue();

  @Override
  public String convertToDatabaseColumn(T attribute) {
    if (attribute == null) {
      return null;
    }
    try {
      return MAPPER.writeValueAsString(attribute);
    } catch (JsonProcessingException e) {
      throw new IllegalArgumentException("Failed to serialize attribute to JSON", e);
    }
  }

  @Override
  public T convertToEntityAttribute(String dbData) {
    if (dbData == null || dbData.isBlank()) {
      return emptyValue();
    }
    try {
      return MAPPER.readValue(dbData, typeReference);
    } catch (JsonProcessingException e) {
      throw new IllegalArgumentException("Failed to deserialize JSON column", e);
    }
  }
}
