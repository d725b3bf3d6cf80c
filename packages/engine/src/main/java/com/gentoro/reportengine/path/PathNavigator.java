package com.gentoro.reportengine.path;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.MissingNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Dot-path access over hierarchical report data.
 *
 * <p>A path such as {@code extracted_data.rated_wattage} is split on dots and each segment is
 * looked up as an object key. Resolution is purely structural, with no array indexing or
 * escaping. A path that cannot be followed resolves to {@link MissingNode}; reads never
 * throw.
 */
public final class PathNavigator {

  private PathNavigator() {}

  /**
   * Resolve {@code path} against {@code data}.
   *
   * @return the node at {@code path}, or {@link MissingNode} when {@code path} is null/empty, a
   *     segment is absent, or an intermediate value is not an object
   */
  public static JsonNode get(JsonNode data, String path) {
    if (data == null || path == null || path.isEmpty()) {
      return MissingNode.getInstance();
    }
    JsonNode current = data;
    for (String part : path.split("\\.", -1)) {
      if (current == null || !current.isObject() || !current.has(part)) {
        return MissingNode.getInstance();
      }
      current = current.get(part);
    }
    return current;
  }

  /** Whether {@code path} resolves to a node (JSON {@code null} counts as present). */
  public static boolean exists(JsonNode data, String path) {
    return !get(data, path).isMissingNode();
  }

  /**
   * Assign {@code value} at {@code path}, creating empty objects for missing intermediate segments.
   * An intermediate segment holding a non-object value is replaced by an empty object.
   *
   * @throws IllegalArgumentException if {@code path} is null or empty
   */
  public static void set(ObjectNode data, String path, JsonNode value) {
    if (path == null || path.isEmpty()) {
      throw new IllegalArgumentException("Path must not be null or empty");
    }
    String[] parts = path.split("\\.", -1);
    ObjectNode current = data;
    for (int i = 0; i < parts.length - 1; i++) {
      JsonNode next = current.get(parts[i]);
      if (next instanceof ObjectNode nextObject) {
        current = nextObject;
      } else {
        current = current.putObject(parts[i]);
      }
    }
    current.set(
        parts[parts.length - 1], value == null ? JsonNodeFactory.instance.nullNode() : value);
  }
}
