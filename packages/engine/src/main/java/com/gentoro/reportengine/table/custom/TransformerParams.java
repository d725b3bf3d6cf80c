package com.gentoro.reportengine.table.custom;

import com.fasterxml.jackson.databind.JsonNode;
import com.gentoro.reportengine.table.TransformConfigException;
import java.util.ArrayList;
import java.util.List;

/** Readers for custom transformer parameters. */
final class TransformerParams {

  private TransformerParams() {}

  /** Non-negative integers of an array parameter; absent yields an empty list. */
  static List<Integer> columns(JsonNode params, String field) {
    List<Integer> columns = new ArrayList<>();
    JsonNode node = params.path(field);
    if (node.isMissingNode() || node.isNull()) {
      return columns;
    }
    if (!node.isArray()) {
      throw new TransformConfigException("'" + field + "' must be an array of column indices");
    }
    for (JsonNode item : node) {
      if (!item.canConvertToInt()) {
        throw new TransformConfigException("'" + field + "' must contain integers: " + item);
      }
      if (item.asInt() >= 0) {
        columns.add(item.asInt());
      }
    }
    return columns;
  }

  /** Column index encoded as an object key ({@code "4"}). */
  static int columnKey(String key, String field) {
    int column;
    try {
      column = Integer.parseInt(key.strip());
    } catch (NumberFormatException e) {
      throw new TransformConfigException(
          "'" + field + "' keys must be column indices, got '" + key + "'", e);
    }
    if (column < 0) {
      throw new TransformConfigException(
          "'" + field + "' keys must not be negative, got '" + key + "'");
    }
    return column;
  }

  static String text(JsonNode params, String field, String fallback) {
    JsonNode node = params.path(field);
    return node.isMissingNode() || node.isNull() ? fallback : node.asText();
  }
}
