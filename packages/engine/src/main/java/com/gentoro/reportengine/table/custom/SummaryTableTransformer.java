package com.gentoro.reportengine.table.custom;

import com.fasterxml.jackson.databind.JsonNode;
import com.gentoro.reportengine.expression.EvalResult;
import com.gentoro.reportengine.expression.SafeExpressionEvaluator;
import com.gentoro.reportengine.logging.LoggingService;
import com.gentoro.reportengine.table.FormatRules;
import com.gentoro.reportengine.table.Grids;
import com.gentoro.reportengine.table.TransformContext;
import com.gentoro.reportengine.utility.NumberFormats;
import com.gentoro.reportengine.utility.Values;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Measurement tables with computed columns and an averages row (photometric data, life test).
 *
 * <pre>{@code
 * {
 *   "type": "custom_transform",
 *   "transformer": "photometric_data_transformer",
 *   "calculate_columns": [5],
 *   "formulas": {"5": "D{row}/C{row}*100"},
 *   "average_columns": [2, 3, 4, 5],
 *   "format_rules": {"4": [{"condition": "x >= 100", "format": "{:.1f}"}]},
 *   "average_format_rules": {"5": [{"condition": "x < 100", "format": "{:.2f}"}]}
 * }
 * }</pre>
 *
 * <ol>
 *   <li>Each calculated column is filled per row. {@code {row}} is the one-based row number and
 *       column letters refer to the current row. A failing formula leaves the cell unchanged.
 *   <li>When {@code average_columns} is set, a row labelled {@code average_label} (default {@code
 *       Average}) is appended with the mean of each listed column, rendered with the column's
 *       {@code average_format_rules}, else its {@code format_rules}, else two decimals.
 *   <li>{@code format_rules} are applied to every data row, not to the averages row.
 * </ol>
 */
public class SummaryTableTransformer implements CustomTransformer {

  private static final org.slf4j.Logger log =
      LoggingService.getLogger(SummaryTableTransformer.class);

  private final SafeExpressionEvaluator evaluator;

  public SummaryTableTransformer() {
    this(new SafeExpressionEvaluator());
  }

  public SummaryTableTransformer(SafeExpressionEvaluator evaluator) {
    this.evaluator = evaluator;
  }

  @Override
  public List<List<Object>> transform(
      List<List<Object>> grid, JsonNode params, TransformContext context) {
    if (grid.isEmpty()) {
      return new ArrayList<>();
    }
    List<List<Object>> result = Grids.copy(grid);
    applyFormulas(result, params);

    List<Integer> averageColumns = TransformerParams.columns(params, "average_columns");
    JsonNode formatRules = params.path("format_rules");
    JsonNode averageRules = params.path("average_format_rules");
    int dataRows = result.size();
    if (!averageColumns.isEmpty()) {
      result.add(averageRow(result, averageColumns, formatRules, averageRules, params));
    }

    if (formatRules.isObject()) {
      Iterator<Map.Entry<String, JsonNode>> fields = formatRules.fields();
      while (fields.hasNext()) {
        Map.Entry<String, JsonNode> entry = fields.next();
        int column = TransformerParams.columnKey(entry.getKey(), "format_rules");
        FormatRules rules = FormatRules.parse(entry.getValue());
        for (int r = 0; r < dataRows; r++) {
          List<Object> row = result.get(r);
          if (column < row.size()) {
            row.set(column, rules.apply(row.get(column)));
          }
        }
      }
    }
    return result;
  }

  private void applyFormulas(List<List<Object>> result, JsonNode params) {
    JsonNode formulas = params.path("formulas");
    for (int column : TransformerParams.columns(params, "calculate_columns")) {
      JsonNode formulaNode = formulas.get(String.valueOf(column));
      if (formulaNode == null || formulaNode.isNull()) {
        continue;
      }
      String formula = formulaNode.asText();
      for (int r = 0; r < result.size(); r++) {
        List<Object> row = result.get(r);
        // Spreadsheet numbering: {row} is 1-based here.
        EvalResult<Number> value = evaluator.tryEvaluateRowFormula(formula, r + 1, row);
        if (value.isSuccess()) {
          Grids.put(row, column, value.value());
        } else {
          log.warn(
              "Formula calculation error in column {} row {}: {} ({})",
              column,
              r,
              formula,
              value.error().getMessage());
        }
      }
    }
  }

  private static List<Object> averageRow(
      List<List<Object>> result,
      List<Integer> columns,
      JsonNode formatRules,
      JsonNode averageRules,
      JsonNode params) {
    int width = Math.max(1, result.get(0).size());
    for (int column : columns) {
      width = Math.max(width, column + 1);
    }
    List<Object> row = new ArrayList<>(Collections.nCopies(width, ""));
    row.set(0, TransformerParams.text(params, "average_label", "Average"));

    for (int column : columns) {
      List<Double> values = new ArrayList<>();
      for (List<Object> dataRow : result) {
        if (column < dataRow.size()) {
          Double value = Values.toDouble(dataRow.get(column));
          if (value != null) {
            values.add(value);
          }
        }
      }
      if (values.isEmpty()) {
        continue;
      }
      double sum = 0;
      for (double v : values) {
        sum += v;
      }
      double average = sum / values.size();
      String key = String.valueOf(column);
      if (averageRules.has(key)) {
        row.set(column, FormatRules.parse(averageRules.get(key)).apply(average));
      } else if (formatRules.has(key)) {
        row.set(column, FormatRules.parse(formatRules.get(key)).apply(average));
      } else {
        row.set(column, NumberFormats.fixed(average, 2));
      }
    }
    return row;
  }
}
