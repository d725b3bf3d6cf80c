package com.gentoro.reportengine.processor;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.MissingNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.gentoro.reportengine.calculation.CalculatorOptions;
import com.gentoro.reportengine.calculation.FieldCalculator;
import com.gentoro.reportengine.calculation.FieldMapping;
import com.gentoro.reportengine.calculation.FunctionRegistry;
import com.gentoro.reportengine.config.EngineConfiguration;
import com.gentoro.reportengine.exception.ConfigurationException;
import com.gentoro.reportengine.expression.SafeExpressionEvaluator;
import com.gentoro.reportengine.logging.LoggingService;
import com.gentoro.reportengine.path.PathNavigator;
import com.gentoro.reportengine.table.Grids;
import com.gentoro.reportengine.table.TableDataTransformer;
import com.gentoro.reportengine.table.TransformContext;
import com.gentoro.reportengine.table.custom.CustomTransformerRegistry;
import com.gentoro.reportengine.utility.JacksonUtility;
import com.gentoro.reportengine.utility.Values;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Turns a report and its template configuration into the values and tables a document is filled
 * with.
 *
 * <p>The configuration has the shape:
 *
 * <pre>{@code
 * {
 *   "field_mappings": [
 *     {"template_field": "model", "source_field": "metadata.model_name", "type": "text"},
 *     {"template_field": "eff", "source_field": "calculated_data.efficacy", "type": "text",
 *      "function": "energy_efficacy", "args": ["extracted_data.wattage", "extracted_data.flux"]}
 *   ],
 *   "table_mappings": [
 *     {"template_field": "photometric", "source_field": "extracted_data.photometric_data",
 *      "transformations": [{"type": "skip_columns", "columns": [0]}]}
 *   ]
 * }
 * }</pre>
 *
 * Calculated fields are computed first, so text mappings may read them. The caller's report is
 * not modified; the calculated copy is returned in {@link ProcessedReport#report()}.
 */
public class ReportDataProcessor {

  private static final org.slf4j.Logger log = LoggingService.getLogger(ReportDataProcessor.class);

  private final FunctionRegistry functions;
  private final CalculatorOptions options;
  private final TableDataTransformer transformer;

  public ReportDataProcessor() {
    this(
        FunctionRegistry.withBuiltins(), CalculatorOptions.defaults(), new TableDataTransformer());
  }

  public ReportDataProcessor(
      FunctionRegistry functions, CalculatorOptions options, TableDataTransformer transformer) {
    this.functions = Objects.requireNonNull(functions, "functions");
    this.options = options == null ? CalculatorOptions.defaults() : options;
    this.transformer = Objects.requireNonNull(transformer, "transformer");
  }

  /** Processor wired from engine settings: calculator flags and expression depth. */
  public static ReportDataProcessor fromConfiguration(EngineConfiguration configuration) {
    return new ReportDataProcessor(
        FunctionRegistry.withBuiltins(),
        CalculatorOptions.fromConfiguration(configuration),
        new TableDataTransformer(
            SafeExpressionEvaluator.fromConfiguration(configuration),
            CustomTransformerRegistry.withBuiltins()));
  }

  /** Same as {@link #process(ObjectNode, JsonNode)} with the configuration given as JSON text. */
  public ProcessedReport process(ObjectNode report, String configJson) {
    return process(report, JacksonUtility.readTree(configJson));
  }

  /**
   * Calculate fields, collect text values and transform tables.
   *
   * @throws ConfigurationException when the configuration is malformed
   */
  public ProcessedReport process(ObjectNode report, JsonNode config) {
    if (report == null) {
      throw new IllegalArgumentException("Report must not be null");
    }
    JsonNode configuration = config == null ? MissingNode.getInstance() : config;
    ObjectNode working = report.deepCopy();

    FieldCalculator calculator = new FieldCalculator(working, functions, options);
    List<FieldMapping> mappings = FieldCalculator.readMappings(configuration);
    calculator.processMappings(mappings);

    Map<String, String> values = new LinkedHashMap<>();
    for (FieldMapping mapping : mappings) {
      if (!mapping.isType("text") || mapping.templateField() == null) {
        continue;
      }
      JsonNode node = PathNavigator.get(working, mapping.sourceField());
      if (node.isMissingNode() || node.isNull()) {
        log.debug(
            "No value for text field '{}' at '{}'",
            mapping.templateField(),
            mapping.sourceField());
        continue;
      }
      values.put(mapping.templateField(), Values.str(Values.fromJson(node)));
    }

    Map<String, List<List<Object>>> tables = new LinkedHashMap<>();
    JsonNode tableMappings = configuration.path("table_mappings");
    if (!tableMappings.isMissingNode() && !tableMappings.isNull() && !tableMappings.isArray()) {
      throw new ConfigurationException("'table_mappings' must be an array");
    }
    TransformContext context = contextOf(working);
    for (JsonNode mapping : tableMappings) {
      String templateField = mapping.path("template_field").asText(null);
      String sourceField = mapping.path("source_field").asText(null);
      if (templateField == null || sourceField == null) {
        throw new ConfigurationException(
            "Table mapping requires 'template_field' and 'source_field': " + mapping);
      }
      List<List<Object>> grid = Grids.fromJson(PathNavigator.get(working, sourceField));
      tables.put(
          templateField, transformer.transform(grid, mapping.get("transformations"), context));
    }

    log.info("Processed report: {} values, {} tables", values.size(), tables.size());
    if (log.isDebugEnabled()) {
      log.debug("Processed values: {}", JacksonUtility.toJson(values));
    }
    return new ProcessedReport(values, tables, working);
  }

  private static TransformContext contextOf(ObjectNode report) {
    JsonNode extracted = report.path("extracted_data");
    JsonNode targets = extracted.has("targets") ? extracted : null;
    return new TransformContext(report.path("metadata"), targets, extracted);
  }
}
