package com.gentoro.reportengine.table.custom;

import com.fasterxml.jackson.databind.JsonNode;
import com.gentoro.reportengine.table.FormatRules;
import com.gentoro.reportengine.table.TransformConfigException;
import com.gentoro.reportengine.table.TransformContext;
import com.gentoro.reportengine.utility.Values;
import java.util.ArrayList;
import java.util.List;

/**
 * Zonal intensity table: one {@code [0-<angle>°, value]} row per zone field present in {@code
 * extracted_data}.
 *
 * <p>Candidate angles come from {@code zone_angles} (default 30 to 180 in steps of 30) and are kept
 * between {@code min_angle} (30) and the maximum angle. The maximum is {@code max_angle_override}
 * when set, otherwise the larger of 180 and 1.2 times the beam angle read from {@code
 * beam_angle_field}. Field names follow {@code zone_fields_pattern} ({@code zone_{angle}}); values
 * are rendered with {@code format} ({@code {:.1f}}).
 */
public class ZoneTableTransformer implements CustomTransformer {

  private static final List<Double> DEFAULT_ANGLES = List.of(30.0, 60.0, 90.0, 120.0, 150.0, 180.0);

  @Override
  public List<List<Object>> transform(
      List<List<Object>> grid, JsonNode params, TransformContext context) {
    JsonNode data = context.extractedData();
    if (!data.isObject() || data.isEmpty()) {
      return new ArrayList<>();
    }
    String pattern = TransformerParams.text(params, "zone_fields_pattern", "zone_{angle}");
    String format = TransformerParams.text(params, "format", "{:.1f}");
    String beamField = TransformerParams.text(params, "beam_angle_field", "beam_angle");
    double minAngle = number(params.get("min_angle"), 30.0, "min_angle");

    Double beamAngle = Values.toDouble(Values.fromJson(data.get(beamField)));
    double maxAngle;
    JsonNode override = params.get("max_angle_override");
    if (override != null && Values.isTruthy(override)) {
      maxAngle = number(override, 180.0, "max_angle_override");
    } else {
      maxAngle = Math.max((beamAngle == null ? 0 : beamAngle) * 1.2, 180);
    }

    List<List<Object>> result = new ArrayList<>();
    for (double angle : angles(params.get("zone_angles"))) {
      if (angle < minAngle || angle > maxAngle) {
        continue;
      }
      String label = angleLabel(angle);
      Object value = Values.fromJson(data.get(pattern.replace("{angle}", label)));
      if (value == null || "".equals(value)) {
        continue;
      }
      String rendered = FormatRules.renderValue(format, value);
      result.add(new ArrayList<>(List.of("0-" + label + "°", rendered)));
    }
    return result;
  }

  private static List<Double> angles(JsonNode config) {
    if (config == null || config.isNull()) {
      return DEFAULT_ANGLES;
    }
    if (!config.isArray()) {
      throw new TransformConfigException("'zone_angles' must be an array of numbers");
    }
    List<Double> angles = new ArrayList<>();
    for (JsonNode item : config) {
      angles.add(number(item, 0, "zone_angles"));
    }
    return angles;
  }

  /** {@code 30} for whole angles, {@code 22.5} otherwise. */
  private static String angleLabel(double angle) {
    return angle == Math.rint(angle) && Math.abs(angle) < 1e15
        ? Long.toString((long) angle)
        : Values.str(angle);
  }

  private static double number(JsonNode node, double fallback, String field) {
    if (node == null || node.isNull()) {
      return fallback;
    }
    Double value = Values.toDouble(node);
    if (value == null) {
      throw new TransformConfigException("'" + field + "' must be numeric: " + node);
    }
    return value;
  }
}
