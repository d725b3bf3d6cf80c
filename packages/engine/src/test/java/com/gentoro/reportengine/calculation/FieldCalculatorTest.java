package com.gentoro.reportengine.calculation;

import static org.junit.jupiter.api.Assertions.*;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.gentoro.reportengine.exception.ConfigurationException;
import com.gentoro.reportengine.path.PathNavigator;
import com.gentoro.reportengine.utility.JacksonUtility;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/** Unit tests for {@link FieldCalculator}. */
class FieldCalculatorTest {

  private static ObjectNode report() {
    return (ObjectNode)
        JacksonUtility.readTree(
            """
            {
              "metadata": {"model_name": "L-100"},
              "extracted_data": {"rated_wattage": "10", "luminous_flux": 1500, "cct": "4100"},
              "calculated_data": {}
            }
            """);
  }

  private static FieldMapping mapping(String target, String function, String... args) {
    return new FieldMapping(target, "calculated_data." + target, "text", function, List.of(args));
  }

  @Test
  @DisplayName("numeric strings are coerced when read")
  void coercesNumericStrings() {
    FieldCalculator calculator = new FieldCalculator(report());
    assertEquals(10L, calculator.getValue("extracted_data.rated_wattage").value());
    assertEquals("L-100", calculator.getValue("metadata.model_name").value());
  }

  @Test
  @DisplayName("a calculated field is written into the report and recorded")
  void calculatesAndStores() {
    ObjectNode data = report();
    FieldCalculator calculator = new FieldCalculator(data);

    FieldValue value =
        calculator.calculateField(
            mapping(
                "energy_class",
                "energy_class_rating",
                "extracted_data.rated_wattage",
                "extracted_data.luminous_flux"));

    assertEquals("B", value.value());
    assertEquals("B", PathNavigator.get(data, "calculated_data.energy_class").asText());
    assertEquals(value, calculator.getCalculatedValues().get("calculated_data.energy_class"));
    assertSame(data, calculator.getCalculatedReport());
  }

  @Test
  @DisplayName("missing arguments become null unless in strict mode")
  void missingArgumentLenient() {
    FieldCalculator calculator = new FieldCalculator(report());
    FieldValue value =
        calculator.calculateField(
            mapping("eff", "energy_efficacy", "extracted_data.missing", "extracted_data.cct"));
    assertEquals("N/A", value.value());
  }

  @Test
  @DisplayName("strict mode reports the missing field and the available ones")
  void missingArgumentStrict() {
    FieldCalculator calculator =
        new FieldCalculator(
            report(), FunctionRegistry.withBuiltins(), new CalculatorOptions(true, false));
    FieldNotFoundException e =
        assertThrows(
            FieldNotFoundException.class,
            () ->
                calculator.calculateField(
                    mapping("eff", "energy_efficacy", "extracted_data.missing")));
    assertEquals("extracted_data.missing", e.getFieldPath());
    assertTrue(e.getMessage().startsWith("Field not found: extracted_data.missing"));
    assertEquals(
        List.of("rated_wattage", "luminous_flux", "cct"),
        e.getAvailableFields().get("extracted_data"));
  }

  @Test
  @DisplayName("a mapping without a function passes its first argument through")
  void passThrough() {
    FieldCalculator calculator = new FieldCalculator(report());
    FieldValue value =
        calculator.calculateField(mapping("copy", null, "extracted_data.luminous_flux"));
    assertEquals(1500L, value.value());
  }

  @Test
  @DisplayName("batch mode skips failing mappings and keeps going")
  void batchSkipsFailures() {
    FunctionRegistry registry =
        FunctionRegistry.withBuiltins()
            .register(
                "explode",
                args -> {
                  throw new IllegalStateException("bad input");
                });
    FieldCalculator calculator =
        new FieldCalculator(report(), registry, CalculatorOptions.defaults());

    Map<String, FieldValue> results =
        calculator.processMappings(
            Arrays.asList(
                mapping("broken", "explode", "extracted_data.cct"),
                mapping("pct", "percentage", "extracted_data.rated_wattage", "extracted_data.cct"),
                new FieldMapping("plain", "metadata.model_name", "text", null, null)));

    assertEquals(List.of("pct"), List.copyOf(results.keySet()));
    assertEquals("0.24%", results.get("pct").value());
  }

  @Test
  @DisplayName("raiseOnError aborts the batch on the first failure")
  void raiseOnErrorAborts() {
    FunctionRegistry registry =
        FunctionRegistry.withBuiltins()
            .register(
                "explode",
                args -> {
                  throw new IllegalStateException("bad input");
                });
    FieldCalculator calculator =
        new FieldCalculator(report(), registry, new CalculatorOptions(false, true));
    assertThrows(
        CalculatorException.class,
        () -> calculator.processMappings(List.of(mapping("broken", "explode"))));
  }

  @Test
  @DisplayName("an unknown function propagates regardless of flags")
  void functionNotFoundAlwaysPropagates() {
    FieldCalculator calculator = new FieldCalculator(report());
    assertThrows(
        FunctionNotFoundException.class,
        () -> calculator.processMappings(List.of(mapping("x", "no_such_function"))));
  }

  @Test
  @DisplayName("processConfig reads field_mappings with Jackson")
  void processConfig() {
    JsonNode config =
        JacksonUtility.readTree(
            """
            {"field_mappings": [
              {"template_field": "eff", "source_field": "calculated_data.eff", "type": "text",
               "function": "calculate_energy_efficacy",
               "args": ["extracted_data.rated_wattage", "extracted_data.luminous_flux"],
               "comment": "ignored"}
            ]}
            """);
    ObjectNode data = report();
    Map<String, FieldValue> results = new FieldCalculator(data).processConfig(config);
    assertEquals("150.00", results.get("eff").value());
    assertEquals("150.00", data.at("/calculated_data/eff").asText());
  }

  @Test
  @DisplayName("a non-array field_mappings is a configuration error")
  void invalidConfig() {
    assertThrows(
        ConfigurationException.class,
        () -> FieldCalculator.readMappings(JacksonUtility.readTree("{\"field_mappings\": 3}")));
    assertTrue(FieldCalculator.readMappings(JacksonUtility.readTree("{}")).isEmpty());
  }
}
