package com.gentoro.reportengine.table;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonDeserializer;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * One step of a table transformation.
 *
 * <p>Steps are configured as JSON objects discriminated by {@code type}:
 *
 * <pre>{@code
 * {"type": "skip_columns", "columns": [0, 1]}
 * {"type": "add_column", "position": 0, "source": "row_index"}
 * {"type": "calculate", "column": 4, "operation": "formula=B{row}/A{row}*1000", "decimal": 1}
 * {"type": "calculate", "column": 5, "operation": "average", "decimal": 2, "label": "Average"}
 * {"type": "format_column", "column": 4, "function": "lambda x: f'{x:.2f}'"}
 * {"type": "reorder", "order": [2, 0, 1]}
 * {"type": "filter_rows", "condition": "remove_empty"}
 * {"type": "custom_transform", "transformer": "photometric_data_transformer", ...}
 * }</pre>
 *
 * Unknown types and unknown {@code calculate} operations are rejected with {@link
 * TransformConfigException} when the configuration is read.
 */
@JsonDeserialize(using = TransformStep.Deserializer.class)
public sealed interface TransformStep {

  String type();

  /** Parse a single step. */
  static TransformStep fromJson(JsonNode node) {
    if (node == null || !node.isObject()) {
      throw new TransformConfigException("Transform step must be a JSON object");
    }
    String type = node.path("type").asText("");
    return switch (type) {
      case SkipColumns.TYPE -> new SkipColumns(intList(node, "columns"));
      case AddColumn.TYPE ->
          new AddColumn(node.path("position").asInt(0), node.path("source").asText(""));
      case "calculate" -> calculate(node);
      case FormatColumn.TYPE ->
          new FormatColumn(
              column(node, type),
              textOrNull(node, "function"),
              decimal(node));
      case Reorder.TYPE -> new Reorder(intList(node, "order"));
      case FilterRows.TYPE -> new FilterRows(node.path("condition").asText(""));
      case CustomTransform.TYPE -> {
        String transformer = textOrNull(node, "transformer");
        if (transformer == null) {
          throw new TransformConfigException("custom_transform step requires 'transformer'");
        }
        yield new CustomTransform(transformer, node);
      }
      default -> throw new TransformConfigException("Unknown transform step type: '" + type + "'");
    };
  }

  /** Parse an array of steps; {@code null} or a missing node yields no steps. */
  static List<TransformStep> parseAll(JsonNode steps) {
    List<TransformStep> parsed = new ArrayList<>();
    if (steps == null || steps.isNull() || steps.isMissingNode()) {
      return parsed;
    }
    if (!steps.isArray()) {
      throw new TransformConfigException("Transformations must be a JSON array");
    }
    for (JsonNode step : steps) {
      parsed.add(fromJson(step));
    }
    return parsed;
  }

  private static TransformStep calculate(JsonNode node) {
    int column = column(node, "calculate");
    String operation = node.path("operation").asText("");
    Integer decimal = decimal(node);
    if (operation.startsWith(CalculateFormula.PREFIX)) {
      String formula = operation.substring(CalculateFormula.PREFIX.length());
      if (formula.isBlank()) {
        throw new TransformConfigException("calculate step has an empty formula");
      }
      return new CalculateFormula(column, formula, decimal);
    }
    Aggregation aggregation =
        Aggregation.fromOperation(operation)
            .orElseThrow(
                () ->
                    new TransformConfigException(
                        "Unknown calculate operation: '" + operation + "'"));
    int labelColumn = node.path("label_column").asInt(0);
    if (labelColumn < 0) {
      throw new TransformConfigException("label_column must not be negative");
    }
    return new CalculateAggregate(
        column,
        aggregation,
        decimal,
        textOrNull(node, "function"),
        textOrNull(node, "label"),
        labelColumn);
  }

  private static int column(JsonNode node, String type) {
    JsonNode column = node.get("column");
    if (column == null || !column.canConvertToInt() || !column.isIntegralNumber()) {
      throw new TransformConfigException(type + " step requires an integer 'column'");
    }
    if (column.intValue() < 0) {
      throw new TransformConfigException(type + " step has a negative column: " + column);
    }
    return column.intValue();
  }

  private static Integer decimal(JsonNode node) {
    JsonNode decimal = node.get("decimal");
    if (decimal == null || decimal.isNull()) {
      return null;
    }
    if (!decimal.isIntegralNumber() || decimal.intValue() < 0) {
      throw new TransformConfigException("'decimal' must be a non-negative integer: " + decimal);
    }
    return decimal.intValue();
  }

  private static String textOrNull(JsonNode node, String field) {
    JsonNode value = node.get(field);
    return value == null || value.isNull() ? null : value.asText();
  }

  private static List<Integer> intList(JsonNode node, String field) {
    List<Integer> values = new ArrayList<>();
    JsonNode array = node.get(field);
    if (array == null || array.isNull()) {
      return values;
    }
    if (!array.isArray()) {
      throw new TransformConfigException("'" + field + "' must be an array of column indices");
    }
    for (JsonNode item : array) {
      if (!item.isIntegralNumber()) {
        throw new TransformConfigException("'" + field + "' must contain integers: " + item);
      }
      values.add(item.intValue());
    }
    return values;
  }

  /** Jackson entry point, delegating to {@link #fromJson(JsonNode)}. */
  class Deserializer extends JsonDeserializer<TransformStep> {
    @Override
    public TransformStep deserialize(JsonParser p, DeserializationContext ctxt)
        throws IOException {
      JsonNode node = p.getCodec().readTree(p);
      return fromJson(node);
    }
  }

  private static void requireColumn(String type, String field, int column) {
    if (column < 0) {
      throw new TransformConfigException(
          type + " step has a negative '" + field + "': " + column);
    }
  }

  /** Drop the listed column indices from every row. */
  record SkipColumns(List<Integer> columns) implements TransformStep {
    static final String TYPE = "skip_columns";

    public SkipColumns {
      columns = List.copyOf(columns);
    }

    @Override
    public String type() {
      return TYPE;
    }
  }

  /**
   * Insert a column. {@code source} is {@code row_index}, {@code metadata:<key>}, {@code
   * targets:<key>} or {@code value:<literal>}.
   */
  record AddColumn(int position, String source) implements TransformStep {
    static final String TYPE = "add_column";

    @Override
    public String type() {
      return TYPE;
    }
  }

  /** Per-row formula written into {@code column}, optionally fixed to {@code decimal} places. */
  record CalculateFormula(int column, String formula, Integer decimal) implements TransformStep {
    static final String PREFIX = "formula=";

    public CalculateFormula {
      requireColumn("calculate", "column", column);
    }

    @Override
    public String type() {
      return "calculate";
    }
  }

  /**
   * Column aggregation written into the shared aggregate row. The value is rendered with {@code
   * decimal} places, or with the {@code function} format lambda, or plainly.
   */
  record CalculateAggregate(
      int column,
      Aggregation aggregation,
      Integer decimal,
      String function,
      String label,
      int labelColumn)
      implements TransformStep {

    public CalculateAggregate {
      requireColumn("calculate", "column", column);
      requireColumn("calculate", "label_column", labelColumn);
    }

    @Override
    public String type() {
      return "calculate";
    }
  }

  /** Format the numeric cells of a column with a format lambda or fixed decimals. */
  record FormatColumn(int column, String function, Integer decimal) implements TransformStep {
    static final String TYPE = "format_column";

    public FormatColumn {
      requireColumn(TYPE, "column", column);
    }

    @Override
    public String type() {
      return TYPE;
    }
  }

  /** Keep the listed columns, in the listed order. */
  record Reorder(List<Integer> order) implements TransformStep {
    static final String TYPE = "reorder";

    public Reorder {
      order = List.copyOf(order);
    }

    @Override
    public String type() {
      return TYPE;
    }
  }

  /** Drop rows: {@code remove_empty} or {@code remove_all_empty}. */
  record FilterRows(String condition) implements TransformStep {
    static final String TYPE = "filter_rows";

    @Override
    public String type() {
      return TYPE;
    }
  }

  /** Delegate to a named custom transformer; {@code params} is the whole step object. */
  record CustomTransform(String transformer, JsonNode params) implements TransformStep {
    static final String TYPE = "custom_transform";

    @Override
    public String type() {
      return TYPE;
    }
  }
}
