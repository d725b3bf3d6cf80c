package com.gentoro.reportengine.utility;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.gentoro.reportengine.exception.ConfigurationException;

/** Shared Jackson mapper and small conversion helpers used across the engine. */
public final class JacksonUtility {

  private static final ObjectMapper JSON_MAPPER =
      JsonMapper.builder()
          .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
          .disable(SerializationFeature.FAIL_ON_EMPTY_BEANS)
          .build();

  private JacksonUtility() {}

  public static ObjectMapper getJsonMapper() {
    return JSON_MAPPER;
  }

  /** Parse a JSON document; malformed input is reported as a configuration error. */
  public static JsonNode readTree(String json) {
    try {
      return JSON_MAPPER.readTree(json);
    } catch (JsonProcessingException e) {
      throw new ConfigurationException("Invalid JSON: " + e.getOriginalMessage(), e);
    }
  }

  /** Convert any value (including {@code null}) into a JSON tree. */
  public static JsonNode toTree(Object value) {
    if (value instanceof JsonNode node) {
      return node;
    }
    return JSON_MAPPER.valueToTree(value);
  }

  /** Serialize to an indented JSON string; falls back to {@code toString()} on failure. */
  public static String toJson(Object value) {
    try {
      return JSON_MAPPER.writerWithDefaultPrettyPrinter().writeValueAsString(value);
    } catch (JsonProcessingException e) {
      return String.valueOf(value);
    }
  }
}
