package com.gentoro.reportengine.table.custom;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.reportengine.table.TransformContext;
import com.gentoro.reportengine.utility.JacksonUtility;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/** Tests for the beam, energy efficiency and zone table transformers. */
class ReportTableTransformersTest {

  private static TransformContext extracted(String json) {
    return new TransformContext(null, null, JacksonUtility.readTree(json));
  }

  @Test
  @DisplayName("beam table puts the formatted values in the second column")
  void beamTable() {
    List<List<Object>> result =
        new BeamTableTransformer()
            .transform(
                new ArrayList<>(),
                JacksonUtility.readTree(
                    "{\"beam_angle_field\": \"beam\", \"peak_intensity_format\": \"{:.1f} cd\"}"),
                extracted("{\"beam\": \"36.25\", \"peak_intensity\": 812}"));
    assertEquals(
        List.of(List.of("", ""), List.of("", "36.2"), List.of("", "812.0 cd")), result);
  }

  @Test
  @DisplayName("beam table is empty without extracted data")
  void beamTableWithoutData() {
    assertTrue(
        new BeamTableTransformer()
            .transform(new ArrayList<>(), JacksonUtility.readTree("{}"), TransformContext.empty())
            .isEmpty());
  }

  @Test
  @DisplayName("energy efficiency table has one row per named model")
  void eeiTable() {
    TransformContext context =
        extracted(
            """
            {"model_a": "L-100", "model_b": "", "model_c": "L-300",
             "photometric_data": [["S1", 0, 0, 0, 0, 95.5], ["S2", 0, 0, 0, 0, 100.5],
                                  ["Header", 0, 0, 0, 0, "lm/W"]]}
            """);
    List<List<Object>> result =
        new EeiTableTransformer()
            .transform(
                new ArrayList<>(),
                JacksonUtility.readTree(
                    "{\"model_fields\": [\"model_a\", \"model_b\", \"model_c\"]}"),
                context);
    assertEquals(
        List.of(
            List.of("L-100", "98.0", "A", "__MERGE__", "__MERGE__"),
            List.of("L-300", "98.0", "A", "__MERGE__", "__MERGE__")),
        result);
  }

  @Test
  @DisplayName("energy efficiency table falls back to a single unnamed row")
  void eeiTableWithoutModels() {
    List<List<Object>> result =
        new EeiTableTransformer()
            .transform(
                new ArrayList<>(),
                JacksonUtility.readTree(
                    """
                    {"efficacy_column": 1, "merge_columns": [],
                     "eei_thresholds": {"Good": 50, "Fair": 20},
                     "format_rules": {"1": [{"condition": "x >= 0", "format": "{:.2f}"}]}}
                    """),
                extracted("{\"photometric_data\": [[\"S1\", 30], [\"S2\", 40]]}"));
    assertEquals(List.of(List.of("", "35.00", "Fair")), result);
  }

  @Test
  @DisplayName("efficiency classes use the highest threshold reached")
  void efficiencyClass() {
    Map<String, Double> thresholds = Map.of("A", 90.0, "B", 70.0);
    assertEquals("A", EeiTableTransformer.efficiencyClass(90, thresholds));
    assertEquals("B", EeiTableTransformer.efficiencyClass(89.9, thresholds));
    assertEquals("E", EeiTableTransformer.efficiencyClass(10, thresholds));
  }

  @Test
  @DisplayName("zone table lists present zones up to the computed maximum angle")
  void zoneTable() {
    TransformContext context =
        extracted(
            """
            {"beam_angle": 160, "zone_30": 120.45, "zone_60": "", "zone_90": 250,
             "zone_180": 400, "zone_150": null}
            """);
    List<List<Object>> result =
        new ZoneTableTransformer()
            .transform(
                new ArrayList<>(),
                JacksonUtility.readTree("{\"zone_angles\": [30, 60, 90, 150, 180, 210]}"),
                context);
    // max angle is max(160 * 1.2, 180) = 192, so 210 is out of range
    assertEquals(
        List.of(
            List.of("0-30°", "120.5"), List.of("0-90°", "250.0"), List.of("0-180°", "400.0")),
        result);
  }

  @Test
  @DisplayName("zone table honours min_angle, the override and a custom pattern")
  void zoneTableOptions() {
    List<List<Object>> result =
        new ZoneTableTransformer()
            .transform(
                new ArrayList<>(),
                JacksonUtility.readTree(
                    """
                    {"min_angle": 60, "max_angle_override": 90,
                     "zone_fields_pattern": "flux_{angle}", "format": "{:.0f} lm"}
                    """),
                extracted("{\"flux_30\": 1, \"flux_60\": 2.4, \"flux_90\": 3, \"flux_120\": 4}"));
    assertEquals(List.of(List.of("0-60°", "2 lm"), List.of("0-90°", "3 lm")), result);
  }
}
