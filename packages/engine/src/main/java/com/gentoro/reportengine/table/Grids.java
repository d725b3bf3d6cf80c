package com.gentoro.reportengine.table;

import com.fasterxml.jackson.databind.JsonNode;
import com.gentoro.reportengine.utility.Values;
import java.util.ArrayList;
import java.util.List;

/** Helpers for the row-major grids handled by the table pipeline. */
public final class Grids {

  private Grids() {}

  /** Copy of the grid with fresh row lists; cells are shared (they are immutable values). */
  public static List<List<Object>> copy(List<? extends List<?>> grid) {
    List<List<Object>> copy = new ArrayList<>(grid == null ? 0 : grid.size());
    if (grid != null) {
      for (List<?> row : grid) {
        copy.add(row == null ? new ArrayList<>() : new ArrayList<>(row));
      }
    }
    return copy;
  }

  /** Length of the longest row, 0 for an empty grid. */
  public static int width(List<? extends List<?>> grid) {
    int width = 0;
    for (List<?> row : grid) {
      width = Math.max(width, row.size());
    }
    return width;
  }

  /** Set {@code row[column]}, padding the row with empty strings when it is too short. */
  public static void put(List<Object> row, int column, Object value) {
    while (row.size() <= column) {
      row.add("");
    }
    row.set(column, value);
  }

  /** Insert like a list insert: negative positions count from the end, large ones append. */
  public static void insert(List<Object> row, int position, Object value) {
    int index = position < 0 ? Math.max(0, row.size() + position) : Math.min(position, row.size());
    row.add(index, value);
  }

  /**
   * Read a grid from JSON: an array of arrays of scalars. Numbers become {@link Long} or {@link
   * Double}, text stays text, {@code null} becomes an empty string. A non-array yields an empty
   * grid; a scalar row becomes a one-cell row.
   */
  public static List<List<Object>> fromJson(JsonNode node) {
    List<List<Object>> grid = new ArrayList<>();
    if (node == null || !node.isArray()) {
      return grid;
    }
    for (JsonNode rowNode : node) {
      List<Object> row = new ArrayList<>();
      if (rowNode.isArray()) {
        for (JsonNode cell : rowNode) {
          row.add(cellFromJson(cell));
        }
      } else {
        row.add(cellFromJson(rowNode));
      }
      grid.add(row);
    }
    return grid;
  }

  private static Object cellFromJson(JsonNode cell) {
    Object value = Values.fromJson(cell);
    if (value == null) {
      return "";
    }
    if (value instanceof Boolean || value instanceof JsonNode) {
      return Values.str(value);
    }
    return value;
  }
}
