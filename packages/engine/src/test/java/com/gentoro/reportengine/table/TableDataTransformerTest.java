package com.gentoro.reportengine.table;

import static org.junit.jupiter.api.Assertions.*;

import com.fasterxml.jackson.databind.JsonNode;
import com.gentoro.reportengine.utility.JacksonUtility;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/** Unit tests for {@link TableDataTransformer}. */
class TableDataTransformerTest {

  private final TableDataTransformer transformer = new TableDataTransformer();

  private static JsonNode steps(String json) {
    return JacksonUtility.readTree(json);
  }

  private static List<List<Object>> grid(List<?>... rows) {
    List<List<Object>> grid = new ArrayList<>();
    for (List<?> row : rows) {
      grid.add(new ArrayList<>(row));
    }
    return grid;
  }

  @Test
  @DisplayName("the input grid is never modified and repeated runs agree")
  void inputIsImmutable() {
    List<List<Object>> input = grid(List.of("a", "2", "8"), List.of("b", "3", "9"));
    List<List<Object>> snapshot = grid(List.of("a", "2", "8"), List.of("b", "3", "9"));
    JsonNode config =
        steps(
            """
            [{"type": "skip_columns", "columns": [0]},
             {"type": "calculate", "column": 2, "operation": "formula=B{row}/A{row}*1000"},
             {"type": "calculate", "column": 0, "operation": "sum"}]
            """);

    List<List<Object>> first = transformer.transform(input, config, null);
    List<List<Object>> second = transformer.transform(input, config, null);

    assertEquals(snapshot, input);
    assertEquals(first, second);
    assertEquals(
        List.of(List.of("2", "8", "4000.0"), List.of("3", "9", "3000.0"), List.of("5.0", "", "")),
        first);
  }

  @Test
  @DisplayName("skip_columns drops the listed indices")
  void skipColumns() {
    List<List<Object>> result =
        transformer.transform(
            grid(List.of(1, 2, 3, 4)),
            steps("[{\"type\": \"skip_columns\", \"columns\": [0, 2, 9]}]"),
            null);
    assertEquals(List.of(List.of(2, 4)), result);
  }

  @Test
  @DisplayName("add_column fills the first row only")
  void addColumnFirstRowOnly() {
    TransformContext context =
        new TransformContext(
            JacksonUtility.readTree(
                "{\"fields\": [{\"name\": \"model_name\", \"value\": \"L-100\"}]}"),
            JacksonUtility.readTree("{\"targets\": [{\"name\": \"flux\", \"value\": 1500}]}"),
            null);
    List<List<Object>> input = grid(List.of("x", "y"), List.of("z", "w"), List.of("u", "v"));

    assertEquals(
        List.of(List.of("L-100", "x", "y"), List.of("", "z", "w"), List.of("", "u", "v")),
        transformer.transform(
            input,
            steps(
                "[{\"type\": \"add_column\", \"position\": 0,"
                    + " \"source\": \"metadata:model_name\"}]"),
            context));

    // past the end of the first row the value is appended
    assertEquals(
        List.of(List.of("x", "y", 1500L), List.of("z", "w", ""), List.of("u", "v", "")),
        transformer.transform(
            input,
            steps("[{\"type\": \"add_column\", \"position\": 5, \"source\": \"targets:flux\"}]"),
            context));

    // row_index is "1" on the only row that receives a value
    assertEquals(
        List.of(List.of("x", "1", "y"), List.of("z", "", "w"), List.of("u", "", "v")),
        transformer.transform(
            input,
            steps("[{\"type\": \"add_column\", \"position\": 1, \"source\": \"row_index\"}]"),
            context));

    // an empty value is inserted as an empty cell
    assertEquals(
        List.of(List.of("", "x", "y"), List.of("", "z", "w"), List.of("", "u", "v")),
        transformer.transform(
            input,
            steps("[{\"type\": \"add_column\", \"position\": 0, \"source\": \"metadata:none\"}]"),
            context));
  }

  @Test
  @DisplayName("add_column value: sources use the literal text")
  void addColumnLiteral() {
    assertEquals(
        List.of(List.of("Lamp", 1)),
        transformer.transform(
            grid(List.of(1)),
            steps("[{\"type\": \"add_column\", \"position\": 0, \"source\": \"value:Lamp\"}]"),
            null));
  }

  @Test
  @DisplayName("formulas honour decimals, pad short rows and skip failing rows")
  void formulas() {
    List<List<Object>> result =
        transformer.transform(
            grid(List.of("2", "8"), List.of("3", "10", "old"), List.of("n/a", "n/a")),
            steps(
                """
                [{"type": "calculate", "column": 3, "operation": "formula=B{row}/A{row}",
                  "decimal": 2}]
                """),
            null);
    assertEquals(List.of("2", "8", "", "4.00"), result.get(0));
    assertEquals(List.of("3", "10", "old", "3.33"), result.get(1));
    // 0/0 evaluates to zero
    assertEquals(List.of("n/a", "n/a", "", "0.00"), result.get(2));
  }

  @Test
  @DisplayName("aggregations share a single trailing row")
  void singleAggregateRow() {
    List<List<Object>> result =
        transformer.transform(
            grid(List.of("A", "10", "1.5"), List.of("B", "20", "2.5"), List.of("C", "x", "")),
            steps(
                """
                [{"type": "calculate", "column": 1, "operation": "average", "decimal": 1,
                  "label": "Average"},
                 {"type": "calculate", "column": 2, "operation": "max"},
                 {"type": "calculate", "column": 1, "operation": "min", "decimal": 0},
                 {"type": "format_column", "column": 2, "decimal": 2}]
                """),
            null);
    assertEquals(4, result.size());
    // min ran after average on the same cell
    assertEquals(List.of("Average", "10", "2.5"), result.get(3));
    // format_column ran before the aggregates
    assertEquals(List.of("A", "10", "1.50"), result.get(0));
  }

  @Test
  @DisplayName("aggregate values can be rendered by a format function")
  void aggregateWithFunction() {
    List<List<Object>> result =
        transformer.transform(
            grid(List.of("a", 100), List.of("b", 300)),
            steps(
                """
                [{"type": "calculate", "column": 1, "operation": "sum",
                  "function": "lambda x: f'{x:.0f} lm'"}]
                """),
            null);
    assertEquals(List.of("", "400 lm"), result.get(2));
  }

  @Test
  @DisplayName("an aggregate over a column without numbers leaves the cell empty")
  void aggregateWithoutNumbers() {
    List<List<Object>> result =
        transformer.transform(
            grid(List.of("a", "b")),
            steps("[{\"type\": \"calculate\", \"column\": 1, \"operation\": \"average\"}]"),
            null);
    assertEquals(List.of(List.of("a", "b"), List.of("", "")), result);
  }

  @Test
  @DisplayName("format_column applies a lambda to numeric cells only")
  void formatColumnFunction() {
    List<List<Object>> result =
        transformer.transform(
            grid(List.of("Flux", "lm"), List.of("a", 0.5), List.of("b", "12.3456")),
            steps(
                """
                [{"type": "format_column", "column": 1,
                  "function": "lambda x: f'{x:.4f}' if x < 1 else f'{x:.2f}'"}]
                """),
            null);
    assertEquals(
        List.of(List.of("Flux", "lm"), List.of("a", "0.5000"), List.of("b", "12.35")), result);
  }

  @Test
  @DisplayName("a failing cell keeps its plain number, a rejected lambda changes nothing")
  void formatColumnFailures() {
    List<List<Object>> input = grid(List.of(0), List.of(2));
    assertEquals(
        List.of(List.of("0.0"), List.of("0.5")),
        transformer.transform(
            input,
            steps(
                "[{\"type\": \"format_column\", \"column\": 0,"
                    + " \"function\": \"lambda x: 1 / x\"}]"),
            null));
    assertEquals(
        input,
        transformer.transform(
            input,
            steps(
                "[{\"type\": \"format_column\", \"column\": 0,"
                    + " \"function\": \"lambda x: __import__('os')\"}]"),
            null));
  }

  @Test
  @DisplayName("reorder keeps listed columns in listed order")
  void reorder() {
    assertEquals(
        List.of(List.of("c", "a"), List.of("a")),
        transformer.transform(
            grid(List.of("a", "b", "c"), List.of("a")),
            steps("[{\"type\": \"reorder\", \"order\": [2, 0]}]"),
            null));
  }

  @Test
  @DisplayName("filter_rows removes blank rows")
  void filterRows() {
    List<List<Object>> input = grid(Arrays.asList("", " "), Arrays.asList(null, ""), List.of("x"));
    assertEquals(
        List.of(List.of("x")),
        transformer.transform(
            input, steps("[{\"type\": \"filter_rows\", \"condition\": \"remove_empty\"}]"), null));
    assertEquals(
        input,
        transformer.transform(
            input, steps("[{\"type\": \"filter_rows\", \"condition\": \"keep_all\"}]"), null));
  }

  @Test
  @DisplayName("custom_transform dispatches to the named transformer")
  void customTransform() {
    TransformContext context =
        new TransformContext(
            null,
            null,
            JacksonUtility.readTree("{\"beam_angle\": 24.04, \"peak_intensity\": 1999.6}"));
    List<List<Object>> result =
        transformer.transform(
            grid(),
            steps(
                "[{\"type\": \"custom_transform\","
                    + " \"transformer\": \"beam_table_transformer\"}]"),
            context);
    assertEquals(List.of(List.of("", ""), List.of("", "24.0"), List.of("", "2000")), result);
  }

  @Test
  @DisplayName("unknown step types and operations are rejected")
  void invalidSteps() {
    assertThrows(
        TransformConfigException.class,
        () -> transformer.transform(grid(), steps("[{\"type\": \"pivot\"}]"), null));
    assertThrows(
        TransformConfigException.class,
        () ->
            transformer.transform(
                grid(),
                steps("[{\"type\": \"calculate\", \"column\": 1, \"operation\": \"median\"}]"),
                null));
    assertThrows(
        TransformConfigException.class,
        () ->
            transformer.transform(
                grid(),
                steps("[{\"type\": \"custom_transform\", \"transformer\": \"unknown\"}]"),
                null));
  }

  @Test
  @DisplayName("an overly long formula leaves its cells unchanged")
  void overlyLongFormula() {
    String formula = "formula=A{row}" + "+1".repeat(200_000);
    String config = "[{\"type\": \"calculate\", \"column\": 1, \"operation\": \"%s\"}]";
    List<List<Object>> result =
        transformer.transform(grid(List.of("1", "keep")), steps(config.formatted(formula)), null);
    assertEquals(List.of(List.of("1", "keep")), result);
  }
}
