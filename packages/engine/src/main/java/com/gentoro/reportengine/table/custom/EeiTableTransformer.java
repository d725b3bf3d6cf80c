package com.gentoro.reportengine.table.custom;

import com.fasterxml.jackson.databind.JsonNode;
import com.gentoro.reportengine.table.FormatRules;
import com.gentoro.reportengine.table.Grids;
import com.gentoro.reportengine.table.TransformConfigException;
import com.gentoro.reportengine.table.TransformContext;
import com.gentoro.reportengine.utility.NumberFormats;
import com.gentoro.reportengine.utility.Values;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Energy efficiency table: one row per model with the average efficacy taken from the photometric
 * data and the resulting efficiency class.
 *
 * <p>Rows are {@code [model, efficacy, class]} followed by {@value #MERGE_MARKER} in each of the
 * {@code merge_columns} (default 3 and 4), which the document layer merges vertically. Models come
 * from the {@code extracted_data} fields listed in {@code model_fields}; models without a name are
 * skipped and a single unnamed row is produced when none remain. The class is the one with the
 * highest {@code eei_thresholds} value not above the efficacy, {@code E} otherwise.
 */
public class EeiTableTransformer implements CustomTransformer {

  public static final String MERGE_MARKER = "__MERGE__";

  private static final Map<String, Double> DEFAULT_THRESHOLDS = defaultThresholds();

  @Override
  public List<List<Object>> transform(
      List<List<Object>> grid, JsonNode params, TransformContext context) {
    JsonNode data = context.extractedData();
    if (!data.isObject() || data.isEmpty()) {
      return new ArrayList<>();
    }
    String photometricRef =
        TransformerParams.text(params, "photometric_data_ref", "photometric_data");
    int efficacyColumn = params.path("efficacy_column").asInt(5);
    List<Integer> mergeColumns =
        params.has("merge_columns")
            ? TransformerParams.columns(params, "merge_columns")
            : List.of(3, 4);

    double efficacy = averageEfficacy(Grids.fromJson(data.get(photometricRef)), efficacyColumn);
    String efficiencyClass = efficiencyClass(efficacy, thresholds(params.get("eei_thresholds")));

    JsonNode rules = params.path("format_rules").path("1");
    String efficacyText =
        rules.isArray()
            ? FormatRules.parse(rules).apply(efficacy)
            : NumberFormats.fixed(efficacy, 1);

    List<List<Object>> result = new ArrayList<>();
    JsonNode modelFields = params.path("model_fields");
    if (modelFields.isArray()) {
      for (JsonNode field : modelFields) {
        Object model = Values.fromJson(data.get(field.asText()));
        if (Values.isTruthy(model)) {
          result.add(row(Values.str(model), efficacyText, efficiencyClass, mergeColumns));
        }
      }
    }
    if (result.isEmpty()) {
      result.add(row("", efficacyText, efficiencyClass, mergeColumns));
    }
    return result;
  }

  /** Class for an efficacy: highest threshold not above it wins. */
  static String efficiencyClass(double efficacy, Map<String, Double> thresholds) {
    return thresholds.entrySet().stream()
        .sorted(Map.Entry.<String, Double>comparingByValue(Comparator.reverseOrder()))
        .filter(e -> efficacy >= e.getValue())
        .map(Map.Entry::getKey)
        .findFirst()
        .orElse("E");
  }

  private static double averageEfficacy(List<List<Object>> photometric, int column) {
    double sum = 0;
    int count = 0;
    for (List<Object> row : photometric) {
      if (column >= 0 && column < row.size()) {
        Double value = Values.toDouble(row.get(column));
        if (value != null) {
          sum += value;
          count++;
        }
      }
    }
    return count == 0 ? 0 : sum / count;
  }

  private static List<Object> row(
      String model, String efficacy, String efficiencyClass, List<Integer> mergeColumns) {
    List<Object> row = new ArrayList<>(List.of(model, efficacy, efficiencyClass));
    for (int column : mergeColumns) {
      Grids.put(row, column, MERGE_MARKER);
    }
    return row;
  }

  private static Map<String, Double> thresholds(JsonNode config) {
    if (config == null || config.isNull()) {
      return DEFAULT_THRESHOLDS;
    }
    if (!config.isObject()) {
      throw new TransformConfigException("'eei_thresholds' must be an object of class to value");
    }
    Map<String, Double> thresholds = new LinkedHashMap<>();
    Iterator<Map.Entry<String, JsonNode>> fields = config.fields();
    while (fields.hasNext()) {
      Map.Entry<String, JsonNode> entry = fields.next();
      Double value = Values.toDouble(entry.getValue());
      if (value == null) {
        throw new TransformConfigException(
            "Threshold for class '" + entry.getKey() + "' is not numeric");
      }
      thresholds.put(entry.getKey(), value);
    }
    return thresholds;
  }

  private static Map<String, Double> defaultThresholds() {
    Map<String, Double> thresholds = new LinkedHashMap<>();
    thresholds.put("A++", 130.0);
    thresholds.put("A+", 110.0);
    thresholds.put("A", 90.0);
    thresholds.put("B", 70.0);
    thresholds.put("C", 50.0);
    thresholds.put("D", 30.0);
    return thresholds;
  }
}
