package com.contenthub.tasks.utility;

import com.contenthub.tasks.exception.ValidationException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

/** Shared, pre-configured Jackson mapper. {@link ObjectMapper} is thread-safe once configured. */
public final class JacksonUtility {
  private static final ObjectMapper JSON_MAPPER =
      new ObjectMapper()
          .registerModule(new JavaTimeModule())
          .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
          .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

  private JacksonUtility() {}

  public static ObjectMapper getJsonMapper() {
    return JSON_MAPPER;
  }

  /**
   * Convert {@code value} into {@code type} through Jackson's tree model, as if it had been written
   * to JSON and read back.
   */
  public static <T> T convert(Object value, Class<T> type) {
    try {
      return JSON_MAPPER.convertValue(value, type);
    } catch (IllegalArgumentException e) {
      throw new ValidationException(
          "Cannot convert value of type "
              + (value == null ? "null" : value.getClass().getName())
              + " to "
              + type.getName(),
          e);
    }
  }

  public static <T> T convert(Object value, TypeReference<T> type) {
    try {
      return JSON_MAPPER.convertValue(value, type);
    } catch (IllegalArgumentException e) {
      throw new ValidationException("Value cannot be represented as JSON: " + e.getMessage(), e);
    }
  }
}
