package com.gentoro.reportengine.table.custom;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.reportengine.table.TransformConfigException;
import com.gentoro.reportengine.table.TransformContext;
import com.gentoro.reportengine.utility.JacksonUtility;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/** Unit tests for {@link SummaryTableTransformer}. */
class SummaryTableTransformerTest {

  private final SummaryTableTransformer transformer = new SummaryTableTransformer();

  private static List<List<Object>> photometric() {
    List<List<Object>> grid = new ArrayList<>();
    grid.add(new ArrayList<>(List.of("S1", "230", "10", "1200")));
    grid.add(new ArrayList<>(List.of("S2", "230", "12", "1320")));
    return grid;
  }

  @Test
  @DisplayName("formulas, averages and format rules produce the summary table")
  void summaryTable() {
    List<List<Object>> result =
        transformer.transform(
            photometric(),
            JacksonUtility.readTree(
                """
                {"calculate_columns": [4],
                 "formulas": {"4": "D{row}/C{row}"},
                 "average_columns": [2, 3, 4],
                 "format_rules": {
                   "4": [{"condition": "x >= 100", "format": "{:.1f}"}]
                 },
                 "average_format_rules": {
                   "3": [{"condition": "x >= 0", "format": "{:.0f}"}]
                 }}
                """),
            TransformContext.empty());

    assertEquals(3, result.size());
    assertEquals(List.of("S1", "230", "10", "1200", "120.0"), result.get(0));
    assertEquals(List.of("S2", "230", "12", "1320", "110.0"), result.get(1));
    assertEquals(List.of("Average", "", "11.00", "1260", "115.0"), result.get(2));
  }

  @Test
  @DisplayName("the average label is configurable")
  void averageLabel() {
    List<List<Object>> result =
        transformer.transform(
            photometric(),
            JacksonUtility.readTree("{\"average_columns\": [2], \"average_label\": \"Mean\"}"),
            TransformContext.empty());
    assertEquals(List.of("Mean", "", "11.00", ""), result.get(2));
  }

  @Test
  @DisplayName("an empty grid stays empty")
  void emptyGrid() {
    assertTrue(
        transformer
            .transform(new ArrayList<>(), JacksonUtility.readTree("{}"), TransformContext.empty())
            .isEmpty());
  }

  @Test
  @DisplayName("negative format rule keys are rejected")
  void negativeFormatRuleKey() {
    assertThrows(
        TransformConfigException.class,
        () ->
            transformer.transform(
                photometric(),
                JacksonUtility.readTree("{\"format_rules\": {\"-1\": \".1f\"}}"),
                TransformContext.empty()));
  }
}
