package com.gentoro.reportengine.calculation;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.gentoro.reportengine.exception.ConfigurationException;
import com.gentoro.reportengine.exception.ErrorDetails;
import com.gentoro.reportengine.exception.ExceptionUtil;
import com.gentoro.reportengine.logging.LoggingService;
import com.gentoro.reportengine.path.PathNavigator;
import com.gentoro.reportengine.utility.JacksonUtility;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Computes calculated fields of a report from configured field mappings.
 *
 * <p>For each mapping the calculator resolves the argument paths, invokes the named function from
 * the {@link FunctionRegistry}, writes the result back into the report at {@code source_field} and
 * records it. The report passed in is mutated in place.
 *
 * <p>Error policy:
 *
 * <ul>
 *   <li>A missing argument is passed as {@code null}, or fails the mapping in strict mode.
 *   <li>An unknown function always propagates as {@link FunctionNotFoundException}.
 *   <li>In batch mode other failures are logged and skipped unless {@code raiseOnError} is set.
 * </ul>
 */
public class FieldCalculator {

  private static final org.slf4j.Logger log = LoggingService.getLogger(FieldCalculator.class);

  /** Report sections listed when a field cannot be found. */
  public static final List<String> SECTIONS =
      List.of("metadata", "extracted_data", "calculated_data");

  private final ObjectNode report;
  private final FunctionRegistry registry;
  private final CalculatorOptions options;
  private final Map<String, FieldValue> calculatedValues = new LinkedHashMap<>();

  public FieldCalculator(ObjectNode report) {
    this(report, FunctionRegistry.withBuiltins(), CalculatorOptions.defaults());
  }

  public FieldCalculator(ObjectNode report, FunctionRegistry registry, CalculatorOptions options) {
    if (report == null) {
      throw new IllegalArgumentException("Report must not be null");
    }
    this.report = report;
    this.registry = registry;
    this.options = options == null ? CalculatorOptions.defaults() : options;
  }

  /**
   * Read a field by dot path.
   *
   * @throws FieldNotFoundException when the path is absent or holds JSON {@code null}
   */
  public FieldValue getValue(String fieldPath) {
    JsonNode node = PathNavigator.get(report, fieldPath);
    if (node.isMissingNode() || node.isNull()) {
      throw new FieldNotFoundException(fieldPath, availableFields());
    }
    return FieldValue.fromJson(node, "report", fieldPath);
  }

  /**
   * Compute a single mapping and store its result. A mapping without a function passes its first
   * argument through.
   *
   * @throws FieldNotFoundException in strict mode when an argument is missing
   * @throws FunctionNotFoundException when the function is not registered
   * @throws CalculatorException when the function fails or the mapping has no target field
   */
  public FieldValue calculateField(FieldMapping mapping) {
    List<Object> args = new ArrayList<>(mapping.args().size());
    for (String path : mapping.args()) {
      try {
        args.add(getValue(path).value());
      } catch (FieldNotFoundException e) {
        if (options.strictMode()) {
          throw e;
        }
        log.debug("Argument '{}' of '{}' not found, using null", path, mapping.templateField());
        args.add(null);
      }
    }

    Object result;
    if (mapping.hasFunction()) {
      result = registry.invoke(mapping.function(), args);
    } else {
      result = args.isEmpty() ? null : args.get(0);
    }

    String target = mapping.sourceField();
    if (target == null || target.isEmpty()) {
      throw new CalculatorException(
          "Mapping '%s' has no source_field to store the result"
              .formatted(mapping.templateField()));
    }
    PathNavigator.set(report, target, JacksonUtility.toTree(result));
    FieldValue value = new FieldValue(result, "calculated_data", target);
    calculatedValues.put(target, value);
    log.debug("Calculated field '{}' = {}", target, result);
    return value;
  }

  /** Run every mapping of a configuration's {@code field_mappings} array that has a function. */
  public Map<String, FieldValue> processConfig(JsonNode config) {
    return processMappings(readMappings(config));
  }

  /**
   * Compute every mapping that has a function.
   *
   * @return results keyed by {@code template_field}, in mapping order
   */
  public Map<String, FieldValue> processMappings(List<FieldMapping> mappings) {
    Map<String, FieldValue> results = new LinkedHashMap<>();
    int attempted = 0;
    for (FieldMapping mapping : mappings) {
      if (!mapping.hasFunction()) {
        continue;
      }
      attempted++;
      try {
        results.put(mapping.templateField(), calculateField(mapping));
      } catch (FunctionNotFoundException e) {
        throw e;
      } catch (CalculatorException e) {
        if (options.raiseOnError()) {
          throw e;
        }
        String name = mapping.templateField() == null ? "unknown" : mapping.templateField();
        ErrorDetails details = ExceptionUtil.toErrorDetails(e);
        log.warn(
            "Failed to calculate field '{}' [{}]: {}", name, details.code(), details.message());
        log.debug("Failure trace: {}", ExceptionUtil.formatCompactStackTrace(e));
      }
    }
    log.info("Calculated {} of {} field mappings", results.size(), attempted);
    return results;
  }

  /** Fields computed so far, keyed by their path. */
  public Map<String, FieldValue> getCalculatedValues() {
    return Collections.unmodifiableMap(calculatedValues);
  }

  /** The report, including every computed field. */
  public ObjectNode getCalculatedReport() {
    return report;
  }

  /** Parse the {@code field_mappings} array of a report configuration. */
  public static List<FieldMapping> readMappings(JsonNode config) {
    JsonNode node = config == null ? null : config.get("field_mappings");
    if (node == null || node.isNull() || node.isMissingNode()) {
      return List.of();
    }
    if (!node.isArray()) {
      throw new ConfigurationException("'field_mappings' must be an array");
    }
    try {
      return JacksonUtility.getJsonMapper()
          .convertValue(node, new TypeReference<List<FieldMapping>>() {});
    } catch (IllegalArgumentException e) {
      throw new ConfigurationException("Invalid field mapping: " + e.getMessage(), e);
    }
  }

  private Map<String, List<String>> availableFields() {
    Map<String, List<String>> available = new LinkedHashMap<>();
    for (String section : SECTIONS) {
      JsonNode data = report.get(section);
      if (data != null && data.isObject()) {
        List<String> names = new ArrayList<>();
        data.fieldNames().forEachRemaining(names::add);
        available.put(section, names);
      }
    }
    return available;
  }
}
