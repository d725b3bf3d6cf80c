package com.gentoro.reportengine.table;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.MissingNode;
import com.gentoro.reportengine.utility.Values;

/**
 * Report data a transformation can draw from.
 *
 * @param metadata {@code {"fields": [{"name": ..., "value": ...}]}}, used by {@code metadata:}
 *     column sources
 * @param targets {@code {"targets": [{"name": ..., "value": ...}]}}, used by {@code targets:}
 *     column sources
 * @param extractedData the report's {@code extracted_data} section, used by custom transformers
 */
public record TransformContext(JsonNode metadata, JsonNode targets, JsonNode extractedData) {

  public TransformContext {
    metadata = metadata == null ? MissingNode.getInstance() : metadata;
    targets = targets == null ? MissingNode.getInstance() : targets;
    extractedData = extractedData == null ? MissingNode.getInstance() : extractedData;
  }

  public static TransformContext empty() {
    return new TransformContext(null, null, null);
  }

  /** Value of the metadata field called {@code name}, or an empty string. */
  public Object metadataValue(String name) {
    return lookup(metadata.path("fields"), name);
  }

  /** Value of the target called {@code name}, or an empty string. */
  public Object targetValue(String name) {
    return lookup(targets.path("targets"), name);
  }

  private static Object lookup(JsonNode entries, String name) {
    if (!entries.isArray()) {
      return "";
    }
    for (JsonNode entry : entries) {
      if (name.equals(entry.path("name").asText(null))) {
        Object value = Values.fromJson(entry.get("value"));
        if (value == null || value instanceof JsonNode) {
          return value == null ? "" : Values.str(value);
        }
        return value instanceof Boolean ? Values.str(value) : value;
      }
    }
    return "";
  }
}
