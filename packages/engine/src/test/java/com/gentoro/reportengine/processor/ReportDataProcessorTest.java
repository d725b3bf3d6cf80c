package com.gentoro.reportengine.processor;

import static org.junit.jupiter.api.Assertions.*;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.gentoro.reportengine.calculation.CalculatorException;
import com.gentoro.reportengine.calculation.CalculatorOptions;
import com.gentoro.reportengine.calculation.FieldNotFoundException;
import com.gentoro.reportengine.calculation.FunctionRegistry;
import com.gentoro.reportengine.config.EngineConfiguration;
import com.gentoro.reportengine.exception.ConfigurationException;
import com.gentoro.reportengine.table.TableDataTransformer;
import com.gentoro.reportengine.utility.JacksonUtility;
import java.util.List;
import java.util.Map;
import org.apache.commons.configuration2.MapConfiguration;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/** Unit tests for {@link ReportDataProcessor}. */
class ReportDataProcessorTest {

  private static ObjectNode report() {
    return (ObjectNode)
        JacksonUtility.readTree(
            """
            {
              "metadata": {"model_name": "L-100",
                           "fields": [{"name": "lab", "value": "North"}]},
              "extracted_data": {
                "rated_wattage": "10",
                "luminous_flux": 1500,
                "targets": [{"name": "flux", "value": 1450}],
                "photometric_data": [["S1", "10", "1200"], ["S2", "12", "1320"]]
              },
              "calculated_data": {}
            }
            """);
  }

  private static final String CONFIG =
      """
      {
        "field_mappings": [
          {"template_field": "model", "source_field": "metadata.model_name", "type": "text"},
          {"template_field": "efficacy", "source_field": "calculated_data.efficacy",
           "type": "text", "function": "energy_efficacy",
           "args": ["extracted_data.rated_wattage", "extracted_data.luminous_flux"]},
          {"template_field": "cri", "source_field": "extracted_data.cri", "type": "text"},
          {"template_field": "photometric", "source_field": "extracted_data.photometric_data",
           "type": "table"}
        ],
        "table_mappings": [
          {"template_field": "photometric", "source_field": "extracted_data.photometric_data",
           "transformations": [
             {"type": "calculate", "column": 3, "operation": "formula=C{row}/B{row}",
              "decimal": 1},
             {"type": "add_column", "position": 0, "source": "metadata:lab"},
             {"type": "add_column", "position": 5, "source": "targets:flux"},
             {"type": "calculate", "column": 4, "operation": "average", "decimal": 1,
              "label": "Average"}
           ]}
        ]
      }
      """;

  @Test
  @DisplayName("calculates fields, collects text values and transforms tables")
  void processesReport() {
    ObjectNode input = report();
    ProcessedReport processed = new ReportDataProcessor().process(input, CONFIG);

    assertEquals(Map.of("model", "L-100", "efficacy", "150.00"), processed.values());
    assertEquals(
        List.of(
            List.of("North", "S1", "10", "1200", "120.0", 1450L),
            List.of("", "S2", "12", "1320", "110.0", ""),
            List.of("Average", "", "", "", "115.0", "")),
        processed.table("photometric"));
    assertEquals("150.00", processed.report().at("/calculated_data/efficacy").asText());
    // the caller's report is left untouched
    assertTrue(input.at("/calculated_data/efficacy").isMissingNode());
  }

  @Test
  @DisplayName("settings drive the calculator flags")
  void fromConfiguration() {
    String config =
        """
        {"field_mappings": [{"template_field": "x", "source_field": "calculated_data.x",
                             "function": "energy_efficacy", "args": ["extracted_data.none"]}]}
        """;
    ReportDataProcessor strict =
        ReportDataProcessor.fromConfiguration(
            EngineConfiguration.from(
                new MapConfiguration(
                    Map.of(
                        EngineConfiguration.STRICT_MODE, "true",
                        EngineConfiguration.RAISE_ON_ERROR, "true"))));

    assertThrows(FieldNotFoundException.class, () -> strict.process(report(), config));
    ProcessedReport lenient = new ReportDataProcessor().process(report(), config);
    assertEquals("N/A", lenient.report().at("/calculated_data/x").asText());
  }

  @Test
  @DisplayName("a failing function aborts processing only when raiseOnError is set")
  void raiseOnError() {
    String config =
        """
        {"field_mappings": [{"template_field": "x", "source_field": "calculated_data.x",
                             "function": "fails"}]}
        """;
    FunctionRegistry registry =
        FunctionRegistry.withBuiltins()
            .register(
                "fails",
                args -> {
                  throw new IllegalStateException("no");
                });

    assertDoesNotThrow(
        () ->
            new ReportDataProcessor(
                    registry, CalculatorOptions.defaults(), new TableDataTransformer())
                .process(report(), config));
    assertThrows(
        CalculatorException.class,
        () ->
            new ReportDataProcessor(
                    registry, new CalculatorOptions(false, true), new TableDataTransformer())
                .process(report(), config));
  }

  @Test
  @DisplayName("malformed table mappings are configuration errors")
  void invalidTableMappings() {
    ReportDataProcessor processor = new ReportDataProcessor();
    assertThrows(
        ConfigurationException.class,
        () -> processor.process(report(), "{\"table_mappings\": {}}"));
    assertThrows(
        ConfigurationException.class,
        () -> processor.process(report(), "{\"table_mappings\": [{\"template_field\": \"t\"}]}"));
  }

  @Test
  @DisplayName("an empty configuration yields empty output")
  void emptyConfiguration() {
    ProcessedReport processed = new ReportDataProcessor().process(report(), "{}");
    assertTrue(processed.values().isEmpty());
    assertTrue(processed.tables().isEmpty());
  }
}
