package com.gentoro.reportengine.table;

import com.fasterxml.jackson.databind.JsonNode;
import com.gentoro.reportengine.expression.CompiledFormat;
import com.gentoro.reportengine.expression.EvalResult;
import com.gentoro.reportengine.expression.SafeEvalException;
import com.gentoro.reportengine.expression.SafeExpressionEvaluator;
import com.gentoro.reportengine.logging.LoggingService;
import com.gentoro.reportengine.table.TransformStep.AddColumn;
import com.gentoro.reportengine.table.TransformStep.CalculateAggregate;
import com.gentoro.reportengine.table.TransformStep.CalculateFormula;
import com.gentoro.reportengine.table.TransformStep.CustomTransform;
import com.gentoro.reportengine.table.TransformStep.FilterRows;
import com.gentoro.reportengine.table.TransformStep.FormatColumn;
import com.gentoro.reportengine.table.TransformStep.Reorder;
import com.gentoro.reportengine.table.TransformStep.SkipColumns;
import com.gentoro.reportengine.table.custom.CustomTransformerRegistry;
import com.gentoro.reportengine.utility.NumberFormats;
import com.gentoro.reportengine.utility.Values;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.function.DoubleFunction;

/**
 * Applies a list of {@link TransformStep}s to a grid.
 *
 * <p>Steps other than column aggregations run first, in configured order, each producing a new
 * grid. Aggregations ({@code calculate} with {@code average}, {@code sum}, {@code max} or {@code
 * min}) then run against that result and share a single trailing row, appended once however many
 * aggregations are configured. The input grid is never modified.
 */
public class TableDataTransformer {

  private static final org.slf4j.Logger log = LoggingService.getLogger(TableDataTransformer.class);

  private static final String ROW_INDEX = "row_index";
  private static final String METADATA_PREFIX = "metadata:";
  private static final String TARGETS_PREFIX = "targets:";
  private static final String VALUE_PREFIX = "value:";

  private final SafeExpressionEvaluator evaluator;
  private final CustomTransformerRegistry customTransformers;

  public TableDataTransformer() {
    this(new SafeExpressionEvaluator(), CustomTransformerRegistry.withBuiltins());
  }

  public TableDataTransformer(
      SafeExpressionEvaluator evaluator, CustomTransformerRegistry customTransformers) {
    this.evaluator = Objects.requireNonNull(evaluator, "evaluator");
    this.customTransformers = Objects.requireNonNull(customTransformers, "customTransformers");
  }

  /**
   * Parse {@code steps} and transform {@code grid}.
   *
   * @throws TransformConfigException when a step is malformed or of an unknown type
   */
  public List<List<Object>> transform(
      List<? extends List<?>> grid, JsonNode steps, TransformContext context) {
    return transform(grid, TransformStep.parseAll(steps), context);
  }

  public List<List<Object>> transform(
      List<? extends List<?>> grid, List<TransformStep> steps, TransformContext context) {
    TransformContext ctx = context == null ? TransformContext.empty() : context;
    List<List<Object>> result = Grids.copy(grid);
    List<CalculateAggregate> aggregates = new ArrayList<>();
    for (TransformStep step : steps) {
      if (step instanceof CalculateAggregate aggregate) {
        aggregates.add(aggregate);
      } else {
        result = apply(result, step, ctx);
      }
    }
    if (!aggregates.isEmpty() && !result.isEmpty()) {
      result = applyAggregates(result, aggregates);
    }
    log.debug(
        "Transformed grid with {} steps: {} rows in, {} rows out",
        steps.size(),
        grid == null ? 0 : grid.size(),
        result.size());
    return result;
  }

  private List<List<Object>> apply(
      List<List<Object>> grid, TransformStep step, TransformContext ctx) {
    if (step instanceof SkipColumns skip) {
      return skipColumns(grid, skip);
    } else if (step instanceof AddColumn add) {
      return addColumn(grid, add, ctx);
    } else if (step instanceof CalculateFormula formula) {
      return calculateFormula(grid, formula);
    } else if (step instanceof FormatColumn format) {
      return formatColumn(grid, format);
    } else if (step instanceof Reorder reorder) {
      return reorder(grid, reorder);
    } else if (step instanceof FilterRows filter) {
      return filterRows(grid, filter);
    } else if (step instanceof CustomTransform custom) {
      return customTransformers.transform(custom.transformer(), grid, custom.params(), ctx);
    }
    throw new TransformConfigException("Unsupported transform step: " + step.type());
  }

  private static List<List<Object>> skipColumns(List<List<Object>> grid, SkipColumns step) {
    if (step.columns().isEmpty()) {
      return grid;
    }
    Set<Integer> skipped = new HashSet<>(step.columns());
    List<List<Object>> result = new ArrayList<>(grid.size());
    for (List<Object> row : grid) {
      List<Object> kept = new ArrayList<>();
      for (int i = 0; i < row.size(); i++) {
        if (!skipped.contains(i)) {
          kept.add(row.get(i));
        }
      }
      result.add(kept);
    }
    return result;
  }

  /**
   * Only the first row carries the source value; the remaining rows get an empty cell at {@code
   * position}. Templates use this to label a merged first column.
   */
  private static List<List<Object>> addColumn(
      List<List<Object>> grid, AddColumn step, TransformContext ctx) {
    List<List<Object>> result = new ArrayList<>(grid.size());
    for (int rowIndex = 0; rowIndex < grid.size(); rowIndex++) {
      List<Object> row = new ArrayList<>(grid.get(rowIndex));
      Object value = sourceValue(step.source(), rowIndex, ctx);
      if (rowIndex == 0 && step.position() >= row.size()) {
        row.add(value);
      } else if (rowIndex == 0 && !"".equals(value)) {
        Grids.insert(row, step.position(), value);
      } else {
        Grids.insert(row, step.position(), "");
      }
      result.add(row);
    }
    return result;
  }

  private static Object sourceValue(String source, int rowIndex, TransformContext ctx) {
    if (ROW_INDEX.equals(source)) {
      return Integer.toString(rowIndex + 1);
    } else if (source.startsWith(METADATA_PREFIX)) {
      return ctx.metadataValue(source.substring(METADATA_PREFIX.length()));
    } else if (source.startsWith(TARGETS_PREFIX)) {
      return ctx.targetValue(source.substring(TARGETS_PREFIX.length()));
    } else if (source.startsWith(VALUE_PREFIX)) {
      return source.substring(VALUE_PREFIX.length());
    }
    return "";
  }

  private List<List<Object>> calculateFormula(List<List<Object>> grid, CalculateFormula step) {
    List<List<Object>> result = Grids.copy(grid);
    for (int rowIndex = 0; rowIndex < result.size(); rowIndex++) {
      List<Object> row = result.get(rowIndex);
      EvalResult<Number> value = evaluator.tryEvaluateRowFormula(step.formula(), rowIndex, row);
      if (value.isSuccess()) {
        Grids.put(row, step.column(), render(value.value(), step.decimal()));
      } else {
        log.debug(
            "Formula '{}' failed on row {}: {}",
            step.formula(),
            rowIndex,
            value.error().getMessage());
      }
    }
    return result;
  }

  private List<List<Object>> formatColumn(List<List<Object>> grid, FormatColumn step) {
    if (step.function() != null) {
      CompiledFormat format;
      try {
        format = evaluator.compileFormat(step.function());
      } catch (SafeEvalException e) {
        log.warn(
            "Format function for column {} rejected, column left unchanged: {}",
            step.column(),
            e.getMessage());
        return grid;
      }
      return mapNumericCells(grid, step.column(), value -> formatCell(format, value));
    }
    if (step.decimal() != null) {
      int decimal = step.decimal();
      return mapNumericCells(grid, step.column(), value -> NumberFormats.fixed(value, decimal));
    }
    return grid;
  }

  private static String formatCell(CompiledFormat format, double value) {
    EvalResult<String> formatted = format.tryApply(value);
    if (formatted.isSuccess()) {
      return formatted.value();
    }
    log.debug("Failed to format value {}: {}", value, formatted.error().getMessage());
    return NumberFormats.repr(value);
  }

  private static List<List<Object>> mapNumericCells(
      List<List<Object>> grid, int column, DoubleFunction<Object> mapper) {
    List<List<Object>> result = Grids.copy(grid);
    for (List<Object> row : result) {
      if (column < row.size()) {
        Double value = Values.toDouble(row.get(column));
        if (value != null) {
          row.set(column, mapper.apply(value));
        }
      }
    }
    return result;
  }

  private static List<List<Object>> reorder(List<List<Object>> grid, Reorder step) {
    List<List<Object>> result = new ArrayList<>(grid.size());
    for (List<Object> row : grid) {
      List<Object> reordered = new ArrayList<>(step.order().size());
      for (int index : step.order()) {
        if (index < row.size() && index >= -row.size()) {
          reordered.add(row.get(index < 0 ? row.size() + index : index));
        }
      }
      result.add(reordered);
    }
    return result;
  }

  private static List<List<Object>> filterRows(List<List<Object>> grid, FilterRows step) {
    String condition = step.condition();
    if (!"remove_empty".equals(condition) && !"remove_all_empty".equals(condition)) {
      if (!condition.isEmpty()) {
        log.warn("Unknown filter condition '{}', rows left unchanged", condition);
      }
      return grid;
    }
    List<List<Object>> result = new ArrayList<>();
    for (List<Object> row : grid) {
      if (row.stream().anyMatch(cell -> !Values.isBlank(cell))) {
        result.add(new ArrayList<>(row));
      }
    }
    return result;
  }

  private List<List<Object>> applyAggregates(
      List<List<Object>> grid, List<CalculateAggregate> aggregates) {
    int width = Grids.width(grid);
    for (CalculateAggregate aggregate : aggregates) {
      width = Math.max(width, aggregate.column() + 1);
      if (aggregate.label() != null) {
        width = Math.max(width, aggregate.labelColumn() + 1);
      }
    }
    List<Object> aggregateRow = new ArrayList<>(width);
    for (int i = 0; i < width; i++) {
      aggregateRow.add("");
    }
    for (CalculateAggregate aggregate : aggregates) {
      if (aggregate.label() != null) {
        aggregateRow.set(aggregate.labelColumn(), aggregate.label());
      }
      List<Double> values = new ArrayList<>();
      for (List<Object> row : grid) {
        if (aggregate.column() < row.size()) {
          Double value = Values.toDouble(row.get(aggregate.column()));
          if (value != null) {
            values.add(value);
          }
        }
      }
      if (values.isEmpty()) {
        log.debug(
            "No numeric values in column {} for {}",
            aggregate.column(),
            aggregate.aggregation().operation());
        continue;
      }
      double value = aggregate.aggregation().apply(values);
      aggregateRow.set(aggregate.column(), renderAggregate(aggregate, value));
    }
    List<List<Object>> result = Grids.copy(grid);
    result.add(aggregateRow);
    return result;
  }

  private String renderAggregate(CalculateAggregate aggregate, double value) {
    if (aggregate.decimal() != null) {
      return NumberFormats.fixed(value, aggregate.decimal());
    }
    if (aggregate.function() != null) {
      EvalResult<String> formatted = evaluator.tryEvaluateFormat(aggregate.function(), value);
      if (formatted.isSuccess()) {
        return formatted.value();
      }
      log.warn(
          "Format function for {} of column {} failed: {}",
          aggregate.aggregation().operation(),
          aggregate.column(),
          formatted.error().getMessage());
    }
    return NumberFormats.repr(value);
  }

  private static String render(Number value, Integer decimal) {
    if (decimal != null) {
      return NumberFormats.fixed(value.doubleValue(), decimal);
    }
    return Values.str(value);
  }
}
